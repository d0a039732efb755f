package com.moviecsv.sink;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.moviecsv.entity.Movie;

class CsvRecordSinkTest {

	@TempDir
	Path dir;

	private final CsvRecordSink sink = new CsvRecordSink();

	@Test
	void writesHeaderAndQuotesNameLists() throws Exception {
		Path file = dir.resolve("movies.csv");
		sink.writeTable(file, List.of(Movie.builder()
				.primaryTitle("Heat")
				.originalTitle("Heat")
				.startYear((short) 1995)
				.runtimeMinutes(170)
				.genres("Action,Crime,Drama")
				.averageRating(8.3f)
				.numVotes(700_000)
				.directors("Michael Mann")
				.writers("Michael Mann")
				.build()));

		List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);

		assertThat(lines).containsExactly(
				"primaryTitle,originalTitle,startYear,runtimeMinutes,genres,averageRating,numVotes,directors,writers",
				"Heat,Heat,1995,170,\"Action,Crime,Drama\",8.3,700000,Michael Mann,Michael Mann");
	}

	@Test
	void nullsSurviveTheRoundTripAsNull() throws Exception {
		Path file = dir.resolve("movies.csv");
		Movie sparse = Movie.builder()
				.primaryTitle("Say \"Hi\", World")
				.originalTitle("Say \"Hi\", World")
				.genres("Comedy")
				.build();

		sink.writeTable(file, List.of(sparse));

		assertThat(sink.readTable(file)).containsExactly(sparse);
	}

	@Test
	void rejectsTableWithoutExpectedColumns() throws Exception {
		Path file = Files.writeString(dir.resolve("other.csv"), "a,b\n1,2\n", StandardCharsets.UTF_8);

		assertThatThrownBy(() -> sink.readTable(file))
				.isInstanceOf(IOException.class)
				.hasMessageContaining("primaryTitle");
	}
}
