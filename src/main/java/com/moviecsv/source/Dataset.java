package com.moviecsv.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Die vier IMDb-Rohdatensätze mitsamt ihrem Standard-Schema.
 */
public enum Dataset {

	TITLE_BASICS("title.basics", schema(
			"tconst", ColumnType.STRING,
			"titleType", ColumnType.STRING,
			"primaryTitle", ColumnType.STRING,
			"originalTitle", ColumnType.STRING,
			"isAdult", ColumnType.INT16,
			"startYear", ColumnType.INT16,
			"endYear", ColumnType.INT16,
			"runtimeMinutes", ColumnType.INT32,
			"genres", ColumnType.STRING)),

	TITLE_RATINGS("title.ratings", schema(
			"tconst", ColumnType.STRING,
			"averageRating", ColumnType.FLOAT32,
			"numVotes", ColumnType.INT32)),

	TITLE_CREW("title.crew", schema(
			"tconst", ColumnType.STRING,
			"directors", ColumnType.STRING,
			"writers", ColumnType.STRING)),

	NAME_BASICS("name.basics", schema(
			"nconst", ColumnType.STRING,
			"primaryName", ColumnType.STRING));

	private final String archiveName;
	private final Map<String, ColumnType> types;

	Dataset(String archiveName, Map<String, ColumnType> types) {
		this.archiveName = archiveName;
		this.types = types;
	}

	/** Name des Archivs ohne Endung, wie er in der Download-URL steht. */
	public String archiveName() {
		return archiveName;
	}

	public List<String> columns() {
		return List.copyOf(types.keySet());
	}

	public Map<String, ColumnType> types() {
		return types;
	}

	private static Map<String, ColumnType> schema(Object... pairs) {
		LinkedHashMap<String, ColumnType> map = new LinkedHashMap<>();
		for (int i = 0; i < pairs.length; i += 2) {
			map.put((String) pairs[i], (ColumnType) pairs[i + 1]);
		}
		return Collections.unmodifiableMap(map);
	}
}
