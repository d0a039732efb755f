package com.moviecsv.sink;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import com.moviecsv.entity.Movie;
import com.moviecsv.source.ColumnType;

/**
 * Schreibt die Filmtabelle als CSV mit Kopfzeile. Null wird als leeres Feld geschrieben und beim
 * Einlesen wieder zu null.
 */
@ApplicationScoped
public class CsvRecordSink implements RecordSink {

	private static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
			.setHeader(Movie.COLUMNS.toArray(new String[0]))
			.build();

	private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
			.setHeader()
			.setSkipHeaderRecord(true)
			.build();

	@Override
	public void writeTable(Path path, List<Movie> movies) throws IOException {
		try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
				CSVPrinter printer = new CSVPrinter(writer, WRITE_FORMAT)) {
			for (Movie movie : movies) {
				printer.printRecord(
						movie.getPrimaryTitle(),
						movie.getOriginalTitle(),
						movie.getStartYear(),
						movie.getRuntimeMinutes(),
						movie.getGenres(),
						movie.getAverageRating(),
						movie.getNumVotes(),
						movie.getDirectors(),
						movie.getWriters());
			}
		}
	}

	@Override
	public List<Movie> readTable(Path path) throws IOException {
		List<Movie> movies = new ArrayList<>();
		try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
				CSVParser parser = READ_FORMAT.parse(reader)) {
			for (String column : Movie.COLUMNS) {
				if (!parser.getHeaderMap().containsKey(column))
					throw new IOException(path + " is missing column '" + column + "'");
			}
			for (CSVRecord row : parser) {
				try {
					movies.add(Movie.builder()
							.primaryTitle(text(row, "primaryTitle"))
							.originalTitle(text(row, "originalTitle"))
							.startYear((Short) typed(row, "startYear", ColumnType.INT16))
							.runtimeMinutes((Integer) typed(row, "runtimeMinutes", ColumnType.INT32))
							.genres(text(row, "genres"))
							.averageRating((Float) typed(row, "averageRating", ColumnType.FLOAT32))
							.numVotes((Integer) typed(row, "numVotes", ColumnType.INT32))
							.directors(text(row, "directors"))
							.writers(text(row, "writers"))
							.build());
				} catch (IllegalArgumentException e) {
					throw new IOException(path + " line " + parser.getCurrentLineNumber() + ": " + e.getMessage(), e);
				}
			}
		}
		return movies;
	}

	private static String text(CSVRecord row, String column) {
		String value = row.get(column);
		return value == null || value.isEmpty() ? null : value;
	}

	private static Object typed(CSVRecord row, String column, ColumnType type) {
		return type.parse(text(row, column));
	}
}
