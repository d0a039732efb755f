package com.moviecsv.exception;

import lombok.Getter;

/**
 * Fehlerhafter tabellarischer Inhalt (defektes gzip, fehlende Spalte, nicht konvertierbarer Wert).
 */
@Getter
public class MalformedDatasetException extends DatasetBuildException {

	/** Name des betroffenen Datensatzes, z.B. title.basics */
	private final String dataset;

	/** Zeilennummer in der Quelldatei, 0 wenn unbekannt */
	private final long line;

	public MalformedDatasetException(String dataset, long line, String message) {
		super(describe(dataset, line, message));
		this.dataset = dataset;
		this.line = line;
	}

	public MalformedDatasetException(String dataset, long line, String message, Throwable cause) {
		super(describe(dataset, line, message), cause);
		this.dataset = dataset;
		this.line = line;
	}

	private static String describe(String dataset, long line, String message) {
		return line > 0
				? dataset + " line " + line + ": " + message
				: dataset + ": " + message;
	}
}
