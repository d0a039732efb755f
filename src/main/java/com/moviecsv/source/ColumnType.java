package com.moviecsv.source;

/**
 * Skalare Spaltentypen, in die Rohwerte genau einmal beim Parsen konvertiert werden.
 */
public enum ColumnType {
	STRING {
		@Override
		Object convert(String raw) {
			return raw;
		}
	},
	INT16 {
		@Override
		Object convert(String raw) {
			return Short.valueOf(raw.trim());
		}
	},
	INT32 {
		@Override
		Object convert(String raw) {
			return Integer.valueOf(raw.trim());
		}
	},
	FLOAT32 {
		@Override
		Object convert(String raw) {
			return Float.valueOf(raw.trim());
		}
	};

	/**
	 * Konvertiert einen Rohwert. {@code null} bleibt {@code null}, leere Felder nicht-textueller Spalten
	 * werden ebenfalls zu {@code null}.
	 *
	 * @throws IllegalArgumentException wenn der Wert nicht zum Typ passt
	 */
	public Object parse(String raw) {
		if (raw == null || (this != STRING && raw.isBlank()))
			return null;
		return convert(raw);
	}

	abstract Object convert(String raw);
}
