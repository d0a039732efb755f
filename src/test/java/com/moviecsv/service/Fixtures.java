package com.moviecsv.service;

import com.moviecsv.config.BuildOptions;
import com.moviecsv.config.ProgressLog;
import com.moviecsv.source.DataRecord;

/**
 * Rohzeilen für die Service-Tests.
 */
final class Fixtures {

	static final ProgressLog LOG = ProgressLog.of(Fixtures.class, new BuildOptions(false, true));

	private Fixtures() {
	}

	static DataRecord basics(String tconst, String type, boolean adult, Integer startYear, Integer runtime) {
		return DataRecord.of(
				"tconst", tconst,
				"titleType", type,
				"primaryTitle", "Title " + tconst,
				"originalTitle", "Original " + tconst,
				"isAdult", (short) (adult ? 1 : 0),
				"startYear", startYear == null ? null : startYear.shortValue(),
				"endYear", null,
				"runtimeMinutes", runtime,
				"genres", "Drama");
	}

	static DataRecord movie(String tconst) {
		return basics(tconst, "movie", false, 1999, 120);
	}

	static DataRecord rating(String tconst, float average, Integer votes) {
		return DataRecord.of("tconst", tconst, "averageRating", average, "numVotes", votes);
	}

	static DataRecord crew(String tconst, String directors, String writers) {
		return DataRecord.of("tconst", tconst, "directors", directors, "writers", writers);
	}

	static DataRecord name(String nconst, String primaryName) {
		return DataRecord.of("nconst", nconst, "primaryName", primaryName);
	}
}
