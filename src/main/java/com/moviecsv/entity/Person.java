package com.moviecsv.entity;

/**
 * Eine Person aus name.basics (Regie oder Drehbuch). {@code primaryName} kann null sein.
 */
public record Person(String nconst, String primaryName) {

	public Person withName(String name) {
		return new Person(nconst, name);
	}
}
