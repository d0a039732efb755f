package com.moviecsv.source;

import java.util.Iterator;
import java.util.List;

/**
 * Endliche, einmal durchlaufbare Folge von Datensatz-Blöcken. Wer früher aufhört, muss
 * {@link #close()} aufrufen, damit der zugrunde liegende Download freigegeben wird.
 */
public interface RecordBatches extends Iterator<List<DataRecord>>, AutoCloseable {

	@Override
	void close();
}
