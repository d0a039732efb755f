package com.moviecsv.service;

import java.util.List;
import java.util.Set;

import com.moviecsv.entity.Person;

/**
 * Ergebnis der Namensauflösung.
 *
 * @param people        gefundene Personen in Fundreihenfolge, höchstens ein Eintrag pro nconst
 * @param unresolvedIds gesuchte IDs, die in name.basics nicht vorkamen
 */
public record PersonResolution(List<Person> people, Set<String> unresolvedIds) {

	public static PersonResolution empty() {
		return new PersonResolution(List.of(), Set.of());
	}

	public boolean isEmpty() {
		return people.isEmpty();
	}
}
