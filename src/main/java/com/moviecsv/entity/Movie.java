package com.moviecsv.entity;

import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Eine Zeile der fertigen Filmtabelle. Directors und Writers enthalten aufgelöste Namen.
 */
@Getter
@Builder
@EqualsAndHashCode
@ToString
public class Movie {

	/** Spaltenreihenfolge der Ausgabedatei */
	public static final List<String> COLUMNS = List.of(
			"primaryTitle",
			"originalTitle",
			"startYear",
			"runtimeMinutes",
			"genres",
			"averageRating",
			"numVotes",
			"directors",
			"writers");

	private final String primaryTitle;
	private final String originalTitle;
	private final Short startYear;
	private final Integer runtimeMinutes;
	private final String genres;
	private final Float averageRating;
	private final Integer numVotes;
	private final String directors;
	private final String writers;
}
