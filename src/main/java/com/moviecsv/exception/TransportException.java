package com.moviecsv.exception;

/**
 * Netzwerk- oder HTTP-Fehler beim Herunterladen eines IMDb-Archivs.
 */
public class TransportException extends DatasetBuildException {

	public TransportException(String message) {
		super(message);
	}

	public TransportException(String message, Throwable cause) {
		super(message, cause);
	}
}
