package com.moviecsv.source;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImdbRecordSourceTest {

	@TempDir
	Path dir;

	private final List<Path> downloads = new ArrayList<>();

	private ImdbRecordSource sourceServing(String... lines) {
		ImdbRecordSource source = new ImdbRecordSource();
		source.client = new ImdbDatasetClient() {
			@Override
			public Path download(String archiveName) {
				try {
					Path file = TsvFixtures.gzip(Files.createTempFile(dir, archiveName + "-", ".tsv.gz"), lines);
					downloads.add(file);
					return file;
				} catch (Exception e) {
					throw new IllegalStateException(e);
				}
			}
		};
		return source;
	}

	@Test
	void fetchReadsAllRowsAndDeletesDownload() {
		ImdbRecordSource source = sourceServing(
				"tconst\taverageRating\tnumVotes",
				"tt1\t7.5\t1500",
				"tt2\t\\N\t\\N");

		List<DataRecord> rows = source.fetch(Dataset.TITLE_RATINGS, null, Dataset.TITLE_RATINGS.types());

		assertThat(rows).hasSize(2);
		assertThat(rows.get(0).getFloat("averageRating")).isEqualTo(7.5f);
		assertThat(rows.get(1).getInteger("numVotes")).isNull();
		assertThat(downloads).hasSize(1).allSatisfy(p -> assertThat(p).doesNotExist());
	}

	@Test
	void fetchChunkedYieldsBoundedBatchesInOrder() {
		ImdbRecordSource source = sourceServing(
				"nconst\tprimaryName",
				"nm1\tA",
				"nm2\tB",
				"nm3\tC",
				"nm4\tD",
				"nm5\tE");

		List<Integer> sizes = new ArrayList<>();
		List<String> ids = new ArrayList<>();
		try (RecordBatches batches = source.fetchChunked(Dataset.NAME_BASICS, Dataset.NAME_BASICS.columns(),
				Dataset.NAME_BASICS.types(), 2)) {
			while (batches.hasNext()) {
				List<DataRecord> batch = batches.next();
				sizes.add(batch.size());
				batch.forEach(r -> ids.add(r.getString("nconst")));
			}
		}

		assertThat(sizes).containsExactly(2, 2, 1);
		assertThat(ids).containsExactly("nm1", "nm2", "nm3", "nm4", "nm5");
		assertThat(downloads.get(0)).doesNotExist();
	}

	@Test
	void closingEarlyReleasesDownload() {
		ImdbRecordSource source = sourceServing(
				"nconst\tprimaryName",
				"nm1\tA",
				"nm2\tB",
				"nm3\tC");

		try (RecordBatches batches = source.fetchChunked(Dataset.NAME_BASICS, null, null, 1)) {
			assertThat(batches.next()).hasSize(1);
			assertThat(downloads.get(0)).exists();
		}

		assertThat(downloads.get(0)).doesNotExist();
	}
}
