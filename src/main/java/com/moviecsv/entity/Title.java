package com.moviecsv.entity;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Ein Titel nach dem Join von title.basics, title.ratings und title.crew mit allen Spalten.
 * Director- und Writer-Spalten enthalten kommaseparierte nconst-IDs.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public class Title {
	private final String tconst;
	private final String titleType;
	private final String primaryTitle;
	private final String originalTitle;
	/** isAdult aus title.basics; nur 0 gilt als nicht-adult, jeder andere Wert fällt beim Filter heraus. */
	private final Short adult;
	private final Short startYear;
	private final Short endYear;
	private final Integer runtimeMinutes;
	private final String genres;
	private final Float averageRating;
	private final Integer numVotes;
	private final String directors;
	private final String writers;
}
