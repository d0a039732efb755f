package com.moviecsv.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import com.moviecsv.config.ProgressLog;
import com.moviecsv.entity.Movie;
import com.moviecsv.entity.Person;
import com.moviecsv.entity.Title;
import com.moviecsv.source.DataRecord;
import com.moviecsv.source.Dataset;
import com.moviecsv.source.RecordBatches;
import com.moviecsv.source.RecordSource;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Führt die komplette Pipeline aus: Titel laden und verknüpfen, filtern, Crew-IDs sammeln, Namen
 * auflösen und eindeutig machen, ID-Listen durch Namen ersetzen.
 */
@ApplicationScoped
public class MovieDatasetBuilder {

	public static final String STAGE_TIMER = "moviecsv.build.stage";
	public static final String UNRESOLVED_COUNTER = "moviecsv.build.unresolved-people";

	@Inject
	RecordSource source;

	@Inject
	TitleMergeService mergeService;

	@Inject
	CrewIdCollector crewIdCollector;

	@Inject
	PersonResolver personResolver;

	@Inject
	NameDisambiguator disambiguator;

	@Inject
	IdListRewriter idListRewriter;

	@Inject
	MeterRegistry meterRegistry;

	@ConfigProperty(name = "moviecsv.titles.chunk-size", defaultValue = "500000")
	int titleChunkSize = 500_000;

	/**
	 * Baut die Filmtabelle aus den Rohdaten. Fatale Fehler der Quelle werden unverändert weitergereicht.
	 */
	public List<Movie> build(ProgressLog log) {
		List<Title> titles = stage("merge", () -> loadFilteredTitles(log));
		log.detail("Kept %s titles after filtering", ProgressLog.count(titles.size()));

		log.detail("Collecting director and writer IDs");
		Set<String> relevantIds = stage("collect", () -> crewIdCollector.collect(titles));
		log.detail("Unique people IDs collected: %s", ProgressLog.count(relevantIds.size()));

		PersonResolution resolution = stage("resolve", () -> personResolver.resolve(relevantIds, log));
		meterRegistry.counter(UNRESOLVED_COUNTER).increment(resolution.unresolvedIds().size());

		List<Person> people;
		if (resolution.isEmpty()) {
			log.detail("No relevant people found; skipping name disambiguation");
			people = resolution.people();
		} else {
			log.detail("Disambiguating duplicate names");
			people = stage("disambiguate", () -> disambiguator.disambiguate(resolution.people()));
		}

		log.detail("Building ID → name lookup");
		Map<String, String> names = disambiguator.toNameMap(people);

		return stage("rewrite", () -> toMovies(titles, names));
	}

	/**
	 * Lädt ratings vollständig als Index, verknüpft title.basics blockweise damit und filtert jeden Block
	 * sofort. Der Filter liest keine Crew-Spalten, deshalb genügt es, title.crew danach nur für die
	 * verbliebenen Titel zu indexieren.
	 */
	List<Title> loadFilteredTitles(ProgressLog log) {
		log.detail("Loading %s", Dataset.TITLE_RATINGS.archiveName());
		List<DataRecord> ratings = source.fetch(Dataset.TITLE_RATINGS, Dataset.TITLE_RATINGS.columns(),
				Dataset.TITLE_RATINGS.types());
		log.detail("Loaded %s rows from %s", ProgressLog.count(ratings.size()), Dataset.TITLE_RATINGS.archiveName());
		Map<String, DataRecord> ratingIndex = mergeService.indexByTconst(ratings);

		log.detail("Merging %s with ratings and applying title filters", Dataset.TITLE_BASICS.archiveName());
		List<Title> titles = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		long basicsRows = 0;
		try (RecordBatches batches = source.fetchChunked(Dataset.TITLE_BASICS, Dataset.TITLE_BASICS.columns(),
				Dataset.TITLE_BASICS.types(), titleChunkSize)) {
			while (batches.hasNext()) {
				List<DataRecord> chunk = batches.next();
				basicsRows += chunk.size();
				titles.addAll(mergeService.filter(mergeService.joinRatings(chunk, ratingIndex, seen)));
			}
		}
		log.detail("Loaded %s rows from %s", ProgressLog.count(basicsRows), Dataset.TITLE_BASICS.archiveName());

		Set<String> kept = new HashSet<>();
		for (Title title : titles) {
			kept.add(title.getTconst());
		}

		log.detail("Merging %s", Dataset.TITLE_CREW.archiveName());
		Map<String, DataRecord> crewIndex = new HashMap<>();
		long crewRows = 0;
		try (RecordBatches batches = source.fetchChunked(Dataset.TITLE_CREW, Dataset.TITLE_CREW.columns(),
				Dataset.TITLE_CREW.types(), titleChunkSize)) {
			while (batches.hasNext()) {
				List<DataRecord> chunk = batches.next();
				crewRows += chunk.size();
				mergeService.indexByTconst(chunk, kept).forEach(crewIndex::putIfAbsent);
			}
		}
		log.detail("Loaded %s rows from %s", ProgressLog.count(crewRows), Dataset.TITLE_CREW.archiveName());

		return mergeService.joinCrew(titles, crewIndex);
	}

	List<Movie> toMovies(List<Title> titles, Map<String, String> names) {
		List<Movie> movies = new ArrayList<>(titles.size());
		for (Title title : titles) {
			movies.add(Movie.builder()
					.primaryTitle(title.getPrimaryTitle())
					.originalTitle(title.getOriginalTitle())
					.startYear(title.getStartYear())
					.runtimeMinutes(title.getRuntimeMinutes())
					.genres(title.getGenres())
					.averageRating(title.getAverageRating())
					.numVotes(title.getNumVotes())
					.directors(idListRewriter.rewrite(title.getDirectors(), names))
					.writers(idListRewriter.rewrite(title.getWriters(), names))
					.build());
		}
		return movies;
	}

	private <T> T stage(String name, Supplier<T> work) {
		return Timer.builder(STAGE_TIMER)
				.tag("stage", name)
				.register(meterRegistry)
				.record(work);
	}
}
