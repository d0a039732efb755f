package com.moviecsv.config;

import java.util.Locale;

import org.jboss.logging.Logger;

/**
 * Fortschritts-Logger eines Build-Laufs. Wird explizit an jede Komponente übergeben, statt die
 * Ausführlichkeit über einen globalen Schalter zu steuern.
 * <p>
 * {@link #info} wird immer ausgegeben, {@link #detail} nur im Verbose-Modus auf INFO (sonst DEBUG).
 */
public final class ProgressLog {

	private final Logger logger;
	private final boolean verbose;

	public ProgressLog(Logger logger, boolean verbose) {
		this.logger = logger;
		this.verbose = verbose;
	}

	public static ProgressLog of(Class<?> category, BuildOptions options) {
		return new ProgressLog(Logger.getLogger(category), options.verbose());
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void info(String format, Object... params) {
		logger.infof(format, params);
	}

	public void detail(String format, Object... params) {
		if (verbose) {
			logger.infof(format, params);
		} else {
			logger.debugf(format, params);
		}
	}

	public void warn(String format, Object... params) {
		logger.warnf(format, params);
	}

	public void error(Throwable cause, String format, Object... params) {
		logger.errorf(cause, format, params);
	}

	/**
	 * Formatiert Zähler mit Tausendertrennzeichen, z.B. {@code 250,000}.
	 */
	public static String count(long value) {
		return String.format(Locale.ROOT, "%,d", value);
	}
}
