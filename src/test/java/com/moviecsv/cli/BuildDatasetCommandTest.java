package com.moviecsv.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.moviecsv.entity.Movie;
import com.moviecsv.exception.TransportException;
import com.moviecsv.service.PipelineWiring;
import com.moviecsv.source.ColumnType;
import com.moviecsv.source.DataRecord;
import com.moviecsv.source.Dataset;
import com.moviecsv.source.InMemoryRecordSource;
import com.moviecsv.source.RecordSource;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import picocli.CommandLine;

class BuildDatasetCommandTest {

	@TempDir
	Path dir;

	private Path artifact() {
		return dir.resolve("imdb_movies.csv");
	}

	private InMemoryRecordSource goodSource() {
		return new InMemoryRecordSource()
				.with(Dataset.TITLE_BASICS, DataRecord.of(
						"tconst", "tt1",
						"titleType", "movie",
						"primaryTitle", "Heat",
						"originalTitle", "Heat",
						"isAdult", (short) 0,
						"startYear", (short) 1995,
						"endYear", null,
						"runtimeMinutes", 170,
						"genres", "Crime,Drama"))
				.with(Dataset.TITLE_RATINGS, DataRecord.of("tconst", "tt1", "averageRating", 8.3f, "numVotes", 700_000))
				.with(Dataset.TITLE_CREW, DataRecord.of("tconst", "tt1", "directors", "nm1", "writers", "nm1"))
				.with(Dataset.NAME_BASICS, DataRecord.of("nconst", "nm1", "primaryName", "Michael Mann"));
	}

	private BuildDatasetCommand command(RecordSource source) {
		BuildDatasetCommand command = new BuildDatasetCommand();
		command.cache = PipelineWiring.cache(source, new SimpleMeterRegistry(), 10, artifact());
		return command;
	}

	@Test
	void successfulBuildExitsWithZero() throws Exception {
		int exitCode = command(goodSource()).call();

		assertThat(exitCode).isEqualTo(CommandLine.ExitCode.OK);
		assertThat(Files.readAllLines(artifact(), StandardCharsets.UTF_8))
				.hasSize(2)
				.first().isEqualTo(String.join(",", Movie.COLUMNS));
	}

	@Test
	void transportFailureExitsWithOne() {
		RecordSource failing = new InMemoryRecordSource() {
			@Override
			public List<DataRecord> fetch(Dataset dataset, List<String> columns, Map<String, ColumnType> types) {
				throw new TransportException("HTTP 503 for URL " + dataset.archiveName());
			}
		};

		int exitCode = command(failing).call();

		assertThat(exitCode).isEqualTo(1);
		assertThat(artifact()).doesNotExist();
	}

	@Test
	void forceFlagRebuildsCachedArtifact() throws Exception {
		Files.writeString(artifact(), "stale\n", StandardCharsets.UTF_8);
		InMemoryRecordSource source = goodSource();

		int exitCode = new CommandLine(command(source)).execute("--force", "--verbose");

		assertThat(exitCode).isEqualTo(CommandLine.ExitCode.OK);
		assertThat(source.totalFetches()).isEqualTo(4);
		assertThat(Files.readString(artifact(), StandardCharsets.UTF_8)).contains("Michael Mann");
	}

	@Test
	void cachedArtifactIsReusedWithoutForce() throws Exception {
		command(goodSource()).call();
		InMemoryRecordSource second = goodSource();

		int exitCode = new CommandLine(command(second)).execute();

		assertThat(exitCode).isEqualTo(CommandLine.ExitCode.OK);
		assertThat(second.totalFetches()).isZero();
	}
}
