package com.moviecsv.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import com.moviecsv.entity.Title;
import com.moviecsv.source.DataRecord;

/**
 * Verknüpft title.basics, title.ratings und title.crew über die tconst und filtert auf die Filme,
 * die in die Ausgabetabelle gehören.
 */
@ApplicationScoped
public class TitleMergeService {

	static final String MOVIE_TYPE = "movie";

	@ConfigProperty(name = "moviecsv.filter.min-start-year", defaultValue = "1930")
	int minStartYear = 1930;

	@ConfigProperty(name = "moviecsv.filter.min-votes", defaultValue = "1000")
	int minVotes = 1000;

	/**
	 * Kompletter Join samt Filter: basics ⋈ ratings (inner), danach ⋈ crew (left), danach Filter.
	 */
	public List<Title> merge(List<DataRecord> basics, List<DataRecord> ratings, List<DataRecord> crew) {
		Map<String, DataRecord> ratingIndex = indexByTconst(ratings);
		List<Title> joined = joinCrew(joinRatings(basics, ratingIndex), indexByTconst(crew));
		return filter(joined);
	}

	/**
	 * Baut einen Index tconst → Zeile. Bei doppelter tconst gewinnt die erste Zeile.
	 */
	public Map<String, DataRecord> indexByTconst(Collection<DataRecord> records) {
		Map<String, DataRecord> index = new HashMap<>(Math.max(16, records.size() * 4 / 3));
		for (DataRecord record : records) {
			String tconst = record.getString("tconst");
			if (tconst != null)
				index.putIfAbsent(tconst, record);
		}
		return index;
	}

	/**
	 * Wie {@link #indexByTconst(Collection)}, übernimmt aber nur Zeilen, deren tconst in {@code wanted} liegt.
	 */
	public Map<String, DataRecord> indexByTconst(Collection<DataRecord> records, Set<String> wanted) {
		Map<String, DataRecord> index = new HashMap<>();
		for (DataRecord record : records) {
			String tconst = record.getString("tconst");
			if (tconst != null && wanted.contains(tconst))
				index.putIfAbsent(tconst, record);
		}
		return index;
	}

	/**
	 * Inner Join von basics mit ratings. Titel ohne Rating fallen heraus, je tconst entsteht höchstens eine Zeile.
	 */
	public List<Title> joinRatings(List<DataRecord> basics, Map<String, DataRecord> ratingIndex) {
		return joinRatings(basics, ratingIndex, new HashSet<>());
	}

	/**
	 * Blockweise Variante: {@code seen} sammelt die bereits verarbeiteten tconst über mehrere Aufrufe hinweg.
	 */
	public List<Title> joinRatings(List<DataRecord> basics, Map<String, DataRecord> ratingIndex, Set<String> seen) {
		List<Title> out = new ArrayList<>();
		for (DataRecord basic : basics) {
			String tconst = basic.getString("tconst");
			if (tconst == null || !seen.add(tconst))
				continue;
			DataRecord rating = ratingIndex.get(tconst);
			if (rating == null)
				continue;

			out.add(Title.builder()
					.tconst(tconst)
					.titleType(basic.getString("titleType"))
					.primaryTitle(basic.getString("primaryTitle"))
					.originalTitle(basic.getString("originalTitle"))
					.adult(basic.getShort("isAdult"))
					.startYear(basic.getShort("startYear"))
					.endYear(basic.getShort("endYear"))
					.runtimeMinutes(basic.getInteger("runtimeMinutes"))
					.genres(basic.getString("genres"))
					.averageRating(rating.getFloat("averageRating"))
					.numVotes(rating.getInteger("numVotes"))
					.build());
		}
		return out;
	}

	/**
	 * Left Join mit title.crew: Titel ohne Crew-Zeile behalten null in directors/writers.
	 */
	public List<Title> joinCrew(List<Title> titles, Map<String, DataRecord> crewIndex) {
		List<Title> out = new ArrayList<>(titles.size());
		for (Title title : titles) {
			DataRecord crew = crewIndex.get(title.getTconst());
			if (crew == null) {
				out.add(title.toBuilder().directors(null).writers(null).build());
			} else {
				out.add(title.toBuilder()
						.directors(crew.getString("directors"))
						.writers(crew.getString("writers"))
						.build());
			}
		}
		return out;
	}

	/**
	 * Behält nur Zeilen, die {@link #accepts(Title)} erfüllen.
	 */
	public List<Title> filter(List<Title> titles) {
		List<Title> out = new ArrayList<>();
		for (Title title : titles) {
			if (accepts(title))
				out.add(title);
		}
		return out;
	}

	/**
	 * Kein Adult-Titel, Typ "movie", Laufzeit vorhanden, Startjahr und Stimmenzahl über den Schwellwerten.
	 */
	public boolean accepts(Title title) {
		return title.getAdult() != null
				&& title.getAdult() == 0
				&& MOVIE_TYPE.equals(title.getTitleType())
				&& title.getRuntimeMinutes() != null
				&& title.getStartYear() != null
				&& title.getStartYear() >= minStartYear
				&& title.getNumVotes() != null
				&& title.getNumVotes() >= minVotes;
	}
}
