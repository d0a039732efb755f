package com.moviecsv.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import com.moviecsv.exception.DatasetBuildException;

/**
 * {@link RecordSource} über die öffentlichen IMDb-Archive: lädt das Archiv herunter und parst es
 * anschließend aus einer temporären Datei.
 */
@ApplicationScoped
public class ImdbRecordSource implements RecordSource {

	private static final Logger LOG = Logger.getLogger(ImdbRecordSource.class);

	@Inject
	ImdbDatasetClient client;

	@Override
	public List<DataRecord> fetch(Dataset dataset, List<String> columns, Map<String, ColumnType> types) {
		Path archive = client.download(dataset.archiveName());
		LOG.debugf("Parsing %s from %s", dataset.archiveName(), archive);
		try (TsvArchiveReader reader = new TsvArchiveReader(dataset.archiveName(), archive, columns, types)) {
			return reader.readAll();
		} catch (IOException e) {
			throw new DatasetBuildException("Failed to close " + dataset.archiveName() + " archive", e);
		} finally {
			delete(archive);
		}
	}

	@Override
	public RecordBatches fetchChunked(Dataset dataset, List<String> columns, Map<String, ColumnType> types,
			int chunkSize) {
		if (chunkSize <= 0)
			throw new IllegalArgumentException("chunkSize must be positive");

		Path archive = client.download(dataset.archiveName());
		TsvArchiveReader reader;
		try {
			reader = new TsvArchiveReader(dataset.archiveName(), archive, columns, types);
		} catch (RuntimeException e) {
			delete(archive);
			throw e;
		}
		return new ArchiveBatches(dataset, archive, reader, chunkSize);
	}

	private static void delete(Path archive) {
		try {
			Files.deleteIfExists(archive);
		} catch (IOException e) {
			LOG.warnf("Could not delete temporary archive %s: %s", archive, e.getMessage());
		}
	}

	/**
	 * Blockweiser Zugriff auf ein heruntergeladenes Archiv. Am Dateiende wird die temporäre Datei
	 * sofort freigegeben.
	 */
	private static final class ArchiveBatches implements RecordBatches {

		private final Dataset dataset;
		private final Path archive;
		private final TsvArchiveReader reader;
		private final int chunkSize;
		private List<DataRecord> pending;
		private boolean closed;

		ArchiveBatches(Dataset dataset, Path archive, TsvArchiveReader reader, int chunkSize) {
			this.dataset = dataset;
			this.archive = archive;
			this.reader = reader;
			this.chunkSize = chunkSize;
		}

		@Override
		public boolean hasNext() {
			if (closed)
				return false;
			if (pending == null) {
				pending = reader.nextBatch(chunkSize);
			}
			if (pending.isEmpty()) {
				close();
				return false;
			}
			return true;
		}

		@Override
		public List<DataRecord> next() {
			if (!hasNext())
				throw new NoSuchElementException();
			List<DataRecord> batch = pending;
			pending = null;
			return batch;
		}

		@Override
		public void close() {
			if (closed)
				return;
			closed = true;
			pending = null;
			try {
				reader.close();
			} catch (IOException e) {
				throw new DatasetBuildException("Failed to close " + dataset.archiveName() + " archive", e);
			} finally {
				delete(archive);
			}
		}
	}
}
