package com.moviecsv.source;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import com.moviecsv.exception.MalformedDatasetException;

/**
 * Liest ein gzip-komprimiertes IMDb-TSV-Archiv und konvertiert die Zeilen in {@link DataRecord}s.
 * Das Format kennt kein Quoting, {@code \N} steht für null.
 */
public class TsvArchiveReader implements Closeable {

	static final String NULL_TOKEN = "\\N";

	static final CSVFormat IMDB_TSV = CSVFormat.TDF.builder()
			.setQuote(null)
			.setEscape(null)
			.setIgnoreSurroundingSpaces(false)
			.setNullString(NULL_TOKEN)
			.setHeader()
			.setSkipHeaderRecord(true)
			.build();

	private final String datasetName;
	private final List<String> columns;
	private final ColumnType[] types;
	private final CSVParser parser;
	private final Iterator<CSVRecord> rows;

	/**
	 * Öffnet das Archiv und prüft, dass alle gewünschten Spalten im Header vorkommen.
	 *
	 * @param columns gewünschte Spalten, {@code null} für alle Spalten des Headers
	 */
	public TsvArchiveReader(String datasetName, Path archive, List<String> columns, Map<String, ColumnType> types) {
		this.datasetName = datasetName;
		this.parser = open(datasetName, archive);

		List<String> header = parser.getHeaderNames();
		this.columns = columns == null ? List.copyOf(header) : List.copyOf(columns);
		for (String column : this.columns) {
			if (!header.contains(column)) {
				MalformedDatasetException error = new MalformedDatasetException(datasetName, 1,
						"missing column '" + column + "'");
				try {
					parser.close();
				} catch (IOException e) {
					error.addSuppressed(e);
				}
				throw error;
			}
		}

		this.types = new ColumnType[this.columns.size()];
		for (int i = 0; i < this.columns.size(); i++) {
			ColumnType type = types == null ? null : types.get(this.columns.get(i));
			this.types[i] = type == null ? ColumnType.STRING : type;
		}
		this.rows = parser.iterator();
	}

	/**
	 * Liest alle verbleibenden Zeilen.
	 */
	public List<DataRecord> readAll() {
		List<DataRecord> out = new ArrayList<>();
		while (hasNext()) {
			out.add(next());
		}
		return out;
	}

	/**
	 * Liest bis zu {@code size} aufeinanderfolgende Zeilen; eine leere Liste bedeutet Dateiende.
	 */
	public List<DataRecord> nextBatch(int size) {
		List<DataRecord> batch = new ArrayList<>(Math.min(size, 16_384));
		while (batch.size() < size && hasNext()) {
			batch.add(next());
		}
		return batch;
	}

	private boolean hasNext() {
		try {
			return rows.hasNext();
		} catch (UncheckedIOException | IllegalStateException e) {
			throw new MalformedDatasetException(datasetName, parser.getCurrentLineNumber(),
					"unreadable content: " + rootMessage(e), e);
		}
	}

	private DataRecord next() {
		CSVRecord row;
		try {
			row = rows.next();
		} catch (UncheckedIOException | IllegalStateException e) {
			throw new MalformedDatasetException(datasetName, parser.getCurrentLineNumber(),
					"unreadable content: " + rootMessage(e), e);
		}

		LinkedHashMap<String, Object> values = new LinkedHashMap<>(columns.size() * 2);
		for (int i = 0; i < columns.size(); i++) {
			String column = columns.get(i);
			if (!row.isSet(column)) {
				throw new MalformedDatasetException(datasetName, parser.getCurrentLineNumber(),
						"expected " + parser.getHeaderNames().size() + " fields but found " + row.size());
			}
			String raw = row.get(column);
			try {
				values.put(column, types[i].parse(raw));
			} catch (IllegalArgumentException e) {
				throw new MalformedDatasetException(datasetName, parser.getCurrentLineNumber(),
						"column '" + column + "' is not " + types[i] + ": '" + raw + "'", e);
			}
		}
		return DataRecord.wrap(values);
	}

	private static String rootMessage(Throwable e) {
		Throwable root = e;
		while (root.getCause() != null) {
			root = root.getCause();
		}
		return root.getMessage();
	}

	private static CSVParser open(String datasetName, Path archive) {
		InputStream in = null;
		try {
			in = Files.newInputStream(archive);
			BufferedReader reader = new BufferedReader(new InputStreamReader(
					new GZIPInputStream(in, 1 << 16), StandardCharsets.UTF_8));
			return IMDB_TSV.parse(reader);
		} catch (IOException e) {
			MalformedDatasetException error = new MalformedDatasetException(datasetName, 0,
					"cannot open archive: " + e.getMessage(), e);
			if (in != null) {
				try {
					in.close();
				} catch (IOException closeFailure) {
					error.addSuppressed(closeFailure);
				}
			}
			throw error;
		}
	}

	@Override
	public void close() throws IOException {
		parser.close();
	}
}
