package com.moviecsv.source;

import java.util.List;
import java.util.Map;

/**
 * Liefert typisierte Datensätze eines IMDb-Rohdatensatzes in Originalreihenfolge.
 */
public interface RecordSource {

	/**
	 * Lädt den kompletten Datensatz.
	 *
	 * @param dataset Rohdatensatz
	 * @param columns gewünschte Spalten, {@code null} für alle Spalten des Headers
	 * @param types   Typ je Spalte, fehlende Einträge werden als {@link ColumnType#STRING} gelesen
	 */
	List<DataRecord> fetch(Dataset dataset, List<String> columns, Map<String, ColumnType> types);

	/**
	 * Lädt den Datensatz lazy in Blöcken von höchstens {@code chunkSize} aufeinanderfolgenden Zeilen.
	 */
	RecordBatches fetchChunked(Dataset dataset, List<String> columns, Map<String, ColumnType> types, int chunkSize);
}
