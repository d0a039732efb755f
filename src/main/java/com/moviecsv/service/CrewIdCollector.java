package com.moviecsv.service;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import com.moviecsv.entity.Title;

/**
 * Sammelt alle nconst-IDs, die in den Director- oder Writer-Spalten der gefilterten Titel vorkommen.
 */
@ApplicationScoped
public class CrewIdCollector {

	/**
	 * Liefert die Vereinigung aller IDs in Reihenfolge des ersten Auftretens.
	 */
	public Set<String> collect(List<Title> titles) {
		Set<String> ids = new LinkedHashSet<>();
		for (Title title : titles) {
			addIds(title.getDirectors(), ids);
		}
		for (Title title : titles) {
			addIds(title.getWriters(), ids);
		}
		return Collections.unmodifiableSet(ids);
	}

	static void addIds(String cell, Set<String> target) {
		if (cell == null)
			return;
		for (String token : cell.split(",")) {
			String id = token.trim();
			if (!id.isEmpty())
				target.add(id);
		}
	}
}
