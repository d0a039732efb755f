package com.moviecsv.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Eine typisierte, unveränderliche Zeile eines Rohdatensatzes. Werte sind bereits konvertiert
 * (siehe {@link ColumnType}), {@code null} steht für das Null-Token der Quelle.
 */
public final class DataRecord {

	private final Map<String, Object> values;

	private DataRecord(Map<String, Object> values) {
		this.values = Collections.unmodifiableMap(values);
	}

	static DataRecord wrap(LinkedHashMap<String, Object> values) {
		return new DataRecord(values);
	}

	/**
	 * Baut einen Datensatz aus abwechselnden Spaltennamen und Werten. Null-Werte sind erlaubt.
	 */
	public static DataRecord of(Object... columnsAndValues) {
		if (columnsAndValues.length % 2 != 0)
			throw new IllegalArgumentException("Expected column/value pairs");
		LinkedHashMap<String, Object> values = new LinkedHashMap<>();
		for (int i = 0; i < columnsAndValues.length; i += 2) {
			values.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
		}
		return new DataRecord(values);
	}

	public Set<String> columns() {
		return values.keySet();
	}

	public Object get(String column) {
		return values.get(column);
	}

	public String getString(String column) {
		return (String) values.get(column);
	}

	public Short getShort(String column) {
		return (Short) values.get(column);
	}

	public Integer getInteger(String column) {
		return (Integer) values.get(column);
	}

	public Float getFloat(String column) {
		return (Float) values.get(column);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof DataRecord))
			return false;
		return values.equals(((DataRecord) o).values);
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public String toString() {
		return "DataRecord" + values;
	}
}
