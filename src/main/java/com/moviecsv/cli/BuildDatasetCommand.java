package com.moviecsv.cli;

import java.util.List;
import java.util.concurrent.Callable;

import jakarta.inject.Inject;

import com.moviecsv.config.BuildOptions;
import com.moviecsv.config.ProgressLog;
import com.moviecsv.entity.Movie;
import com.moviecsv.exception.DatasetBuildException;
import com.moviecsv.service.DatasetCache;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine;

/**
 * Kommandozeilen-Einstieg: lädt, verarbeitet und cached den IMDb-Filmdatensatz.
 */
@TopCommand
@CommandLine.Command(
		name = "build-imdb",
		mixinStandardHelpOptions = true,
		version = "build-imdb 1.0",
		description = "Download, preprocess, and cache an IMDb movies dataset.")
public class BuildDatasetCommand implements Callable<Integer> {

	static final int EXIT_FAILURE = 1;

	@CommandLine.Option(
			names = {"--force"},
			description = "Rebuild the processed CSV even if a cached copy exists.")
	boolean force;

	@CommandLine.Option(
			names = {"--verbose"},
			description = "Print detailed progress information.")
	boolean verbose;

	@Inject
	DatasetCache cache;

	@Override
	public Integer call() {
		BuildOptions options = new BuildOptions(force, verbose);
		ProgressLog log = ProgressLog.of(BuildDatasetCommand.class, options);
		try {
			List<Movie> movies = cache.load(options);
			log.info("Finished. Rows: %s; columns: %d", ProgressLog.count(movies.size()), Movie.COLUMNS.size());
			return CommandLine.ExitCode.OK;
		} catch (DatasetBuildException e) {
			log.error(e, "Build failed: %s", e.getMessage());
			return EXIT_FAILURE;
		}
	}
}
