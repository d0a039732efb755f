package com.moviecsv.config;

/**
 * Optionen eines Build-Laufs.
 *
 * @param force   vorhandenes Artefakt ignorieren und neu bauen
 * @param verbose Detailmeldungen ausgeben
 */
public record BuildOptions(boolean force, boolean verbose) {

	public static BuildOptions defaults() {
		return new BuildOptions(false, false);
	}
}
