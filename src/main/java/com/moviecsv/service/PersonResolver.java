package com.moviecsv.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import com.moviecsv.config.ProgressLog;
import com.moviecsv.entity.Person;
import com.moviecsv.source.DataRecord;
import com.moviecsv.source.Dataset;
import com.moviecsv.source.RecordBatches;
import com.moviecsv.source.RecordSource;

/**
 * Löst nconst-IDs gegen name.basics auf. Die Referenztabelle wird blockweise gelesen und der Scan
 * endet, sobald alle gesuchten IDs gefunden sind.
 */
@ApplicationScoped
public class PersonResolver {

	static final int PROGRESS_EVERY_CHUNKS = 10;
	static final int UNRESOLVED_SAMPLE = 20;

	@Inject
	RecordSource source;

	@ConfigProperty(name = "moviecsv.names.chunk-size", defaultValue = "250000")
	int chunkSize = 250_000;

	/**
	 * Sucht die Personen zu {@code wantedIds}. Bei leerer Menge wird name.basics gar nicht geladen.
	 */
	public PersonResolution resolve(Set<String> wantedIds, ProgressLog log) {
		if (wantedIds.isEmpty()) {
			log.info("No relevant IDs found; skipping name loading");
			return PersonResolution.empty();
		}

		Set<String> remaining = new LinkedHashSet<>(wantedIds);
		List<Person> people = new ArrayList<>();
		long rowsProcessed = 0;
		int chunkIndex = 0;

		log.detail("Scanning %s in chunks of %s rows", Dataset.NAME_BASICS.archiveName(), ProgressLog.count(chunkSize));
		try (RecordBatches batches = source.fetchChunked(Dataset.NAME_BASICS, Dataset.NAME_BASICS.columns(),
				Dataset.NAME_BASICS.types(), chunkSize)) {
			while (!remaining.isEmpty() && batches.hasNext()) {
				List<DataRecord> chunk = batches.next();
				chunkIndex++;
				rowsProcessed += chunk.size();

				for (DataRecord row : chunk) {
					String nconst = row.getString("nconst");
					String name = row.getString("primaryName");
					if (nconst == null || name == null)
						continue;
					if (remaining.remove(nconst))
						people.add(new Person(nconst, name));
				}

				if (chunkIndex % PROGRESS_EVERY_CHUNKS == 0) {
					log.detail("Processed %s rows; %s IDs still missing",
							ProgressLog.count(rowsProcessed), ProgressLog.count(remaining.size()));
				}
			}
		}

		if (remaining.isEmpty()) {
			log.detail("Found all relevant names after %s rows; stopping early", ProgressLog.count(rowsProcessed));
		} else {
			log.warn("Warning: %s IDs not found in %s", ProgressLog.count(remaining.size()),
					Dataset.NAME_BASICS.archiveName());
			log.detail("Unresolved IDs (sample): %s", remaining.stream()
					.limit(UNRESOLVED_SAMPLE)
					.collect(Collectors.joining(", ")));
		}

		log.detail("Matched %s people rows", ProgressLog.count(people.size()));
		return new PersonResolution(Collections.unmodifiableList(people), Collections.unmodifiableSet(remaining));
	}
}
