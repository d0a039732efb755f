package com.moviecsv.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import com.moviecsv.entity.Person;

/**
 * Macht doppelte Anzeigenamen eindeutig, indem jedes Vorkommen einen Zähler-Suffix erhält.
 */
@ApplicationScoped
public class NameDisambiguator {

	/**
	 * Das n-te Vorkommen eines mehrfach vorkommenden Namens wird zu {@code "Name (n)"}. Eindeutige Namen
	 * und null bleiben unverändert; die Reihenfolge der Eingabe bestimmt die Nummerierung.
	 */
	public List<Person> disambiguate(List<Person> people) {
		Map<String, Integer> occurrences = new HashMap<>();
		for (Person person : people) {
			if (person.primaryName() != null)
				occurrences.merge(person.primaryName(), 1, Integer::sum);
		}

		Map<String, Integer> counter = new HashMap<>();
		List<Person> out = new ArrayList<>(people.size());
		for (Person person : people) {
			String name = person.primaryName();
			if (name == null || occurrences.get(name) < 2) {
				out.add(person);
				continue;
			}
			int n = counter.merge(name, 1, Integer::sum);
			out.add(person.withName(name + " (" + n + ")"));
		}
		return out;
	}

	/**
	 * Baut die unveränderliche Zuordnung nconst → Anzeigename. Personen ohne Namen werden ausgelassen.
	 */
	public Map<String, String> toNameMap(List<Person> people) {
		Map<String, String> map = new LinkedHashMap<>();
		for (Person person : people) {
			if (person.nconst() != null && person.primaryName() != null)
				map.putIfAbsent(person.nconst(), person.primaryName());
		}
		return Collections.unmodifiableMap(map);
	}
}
