package com.moviecsv.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Ersetzt kommaseparierte nconst-Listen durch kommaseparierte Namen.
 */
@ApplicationScoped
public class IdListRewriter {

	/**
	 * Ersetzt jede ID durch ihren Namen; nicht auflösbare IDs entfallen. Bleibt nichts übrig, ist das Ergebnis null.
	 */
	public String rewrite(String cell, Map<String, String> names) {
		if (cell == null)
			return null;

		StringJoiner joined = new StringJoiner(",");
		int resolved = 0;
		for (String token : cell.split(",")) {
			String name = names.get(token.trim());
			if (name != null) {
				joined.add(name);
				resolved++;
			}
		}
		return resolved == 0 ? null : joined.toString();
	}

	public List<String> rewriteColumn(List<String> cells, Map<String, String> names) {
		List<String> out = new ArrayList<>(cells.size());
		for (String cell : cells) {
			out.add(rewrite(cell, names));
		}
		return out;
	}
}
