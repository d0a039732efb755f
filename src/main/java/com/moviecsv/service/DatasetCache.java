package com.moviecsv.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import com.moviecsv.config.BuildOptions;
import com.moviecsv.config.ProgressLog;
import com.moviecsv.entity.Movie;
import com.moviecsv.exception.DatasetBuildException;
import com.moviecsv.sink.RecordSink;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Entscheidet, ob das vorhandene CSV-Artefakt wiederverwendet oder die Pipeline komplett neu
 * ausgeführt wird. Der einzige persistente Zustand ist die Existenz der Artefaktdatei.
 */
@ApplicationScoped
public class DatasetCache {

	public enum State {
		MISSING, PRESENT
	}

	@Inject
	MovieDatasetBuilder builder;

	@Inject
	RecordSink sink;

	@Inject
	MeterRegistry meterRegistry;

	@ConfigProperty(name = "moviecsv.output.path", defaultValue = "imdb_movies.csv")
	String outputPath = "imdb_movies.csv";

	public Path artifactPath() {
		return Paths.get(outputPath);
	}

	public State state() {
		return Files.isRegularFile(artifactPath()) ? State.PRESENT : State.MISSING;
	}

	/**
	 * Liefert den Pfad des Artefakts und baut es nur, wenn es fehlt oder {@code force} gesetzt ist.
	 * Geschrieben wird in eine Nachbardatei, die erst nach Erfolg über das Artefakt verschoben wird.
	 */
	public Path build(BuildOptions options) {
		ProgressLog log = ProgressLog.of(DatasetCache.class, options);
		Path artifact = artifactPath();

		if (state() == State.PRESENT && !options.force()) {
			log.info("Using cached CSV at %s", artifact);
			return artifact;
		}

		log.info("Building IMDb dataset, this will take a couple of minutes :)");
		List<Movie> movies = builder.build(log);

		log.info("Writing processed CSV to %s", artifact);
		Timer.builder(MovieDatasetBuilder.STAGE_TIMER)
				.tag("stage", "write")
				.register(meterRegistry)
				.record(() -> replaceArtifact(artifact, movies));

		if (log.isVerbose()) {
			for (Timer timer : meterRegistry.find(MovieDatasetBuilder.STAGE_TIMER).timers()) {
				log.detail("Stage %s took %d ms", timer.getId().getTag("stage"),
						(long) timer.totalTime(TimeUnit.MILLISECONDS));
			}
		}
		return artifact;
	}

	/**
	 * Öffentlicher Einstieg: baut bei Bedarf und liest die Tabelle anschließend typisiert ein.
	 */
	public List<Movie> load(BuildOptions options) {
		Path artifact = build(options);
		try {
			return sink.readTable(artifact);
		} catch (IOException e) {
			throw new DatasetBuildException("Failed to read " + artifact, e);
		}
	}

	private void replaceArtifact(Path artifact, List<Movie> movies) {
		Path partial = artifact.resolveSibling(artifact.getFileName() + ".partial");
		try {
			Path parent = artifact.toAbsolutePath().getParent();
			if (parent != null)
				Files.createDirectories(parent);
			sink.writeTable(partial, movies);
			Files.move(partial, artifact, StandardCopyOption.REPLACE_EXISTING);
		} catch (IOException e) {
			DatasetBuildException error = new DatasetBuildException("Failed to write " + artifact, e);
			try {
				Files.deleteIfExists(partial);
			} catch (IOException cleanupFailure) {
				error.addSuppressed(cleanupFailure);
			}
			throw error;
		}
	}
}
