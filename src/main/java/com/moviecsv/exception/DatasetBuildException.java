package com.moviecsv.exception;

/**
 * Basisklasse aller fatalen Fehler beim Aufbau des Film-Datensatzes. Bricht den gesamten Build ab.
 */
public class DatasetBuildException extends RuntimeException {

	public DatasetBuildException(String message) {
		super(message);
	}

	public DatasetBuildException(String message, Throwable cause) {
		super(message, cause);
	}
}
