package com.moviecsv.sink;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.moviecsv.entity.Movie;

/**
 * Persistiert die fertige Filmtabelle und liest sie wieder ein.
 */
public interface RecordSink {

	void writeTable(Path path, List<Movie> movies) throws IOException;

	List<Movie> readTable(Path path) throws IOException;
}
