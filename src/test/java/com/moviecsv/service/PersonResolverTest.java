package com.moviecsv.service;

import static com.moviecsv.service.Fixtures.LOG;
import static com.moviecsv.service.Fixtures.name;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.moviecsv.entity.Person;
import com.moviecsv.source.Dataset;
import com.moviecsv.source.InMemoryRecordSource;

class PersonResolverTest {

	private final InMemoryRecordSource source = new InMemoryRecordSource();

	private PersonResolver resolver(int chunkSize) {
		PersonResolver resolver = new PersonResolver();
		resolver.source = source;
		resolver.chunkSize = chunkSize;
		return resolver;
	}

	@Test
	void emptyWantedSetNeverTouchesSource() {
		PersonResolution resolution = resolver(2).resolve(Set.of(), LOG);

		assertThat(resolution.people()).isEmpty();
		assertThat(resolution.unresolvedIds()).isEmpty();
		assertThat(source.totalFetches()).isZero();
	}

	@Test
	void stopsAfterChunkWithLastMatch() {
		source.with(Dataset.NAME_BASICS,
				name("nm1", "A"), name("nm2", "B"),
				name("nm3", "C"), name("nm4", "D"),
				name("nm5", "E"), name("nm6", "F"));

		PersonResolution resolution = resolver(2).resolve(Set.of("nm1", "nm2"), LOG);

		assertThat(resolution.people()).extracting(Person::nconst).containsExactlyInAnyOrder("nm1", "nm2");
		assertThat(source.chunksPulled(Dataset.NAME_BASICS)).isEqualTo(1);
		assertThat(source.wasClosed(Dataset.NAME_BASICS)).isTrue();
	}

	@Test
	void pullsUpToChunkContainingLastMatch() {
		source.with(Dataset.NAME_BASICS,
				name("nm1", "A"), name("nm2", "B"),
				name("nm3", "C"), name("nm4", "D"),
				name("nm5", "E"), name("nm6", "F"));

		resolver(2).resolve(Set.of("nm1", "nm4"), LOG);

		assertThat(source.chunksPulled(Dataset.NAME_BASICS)).isEqualTo(2);
	}

	@Test
	void reportsIdsMissingFromReferenceData() {
		source.with(Dataset.NAME_BASICS, name("A", "Ann"), name("C", "Cid"), name("D", "Dora"));

		PersonResolution resolution = resolver(2).resolve(Set.of("A", "B", "C"), LOG);

		assertThat(resolution.people()).extracting(Person::nconst).containsExactlyInAnyOrder("A", "C");
		assertThat(resolution.unresolvedIds()).containsExactly("B");
		assertThat(source.chunksPulled(Dataset.NAME_BASICS)).isEqualTo(2);
	}

	@Test
	void dropsRowsWithoutIdOrName() {
		source.with(Dataset.NAME_BASICS, name("nm1", null), name(null, "Ghost"), name("nm2", "Bea"));

		PersonResolution resolution = resolver(10).resolve(Set.of("nm1", "nm2"), LOG);

		assertThat(resolution.people()).containsExactly(new Person("nm2", "Bea"));
		assertThat(resolution.unresolvedIds()).containsExactly("nm1");
	}

	@Test
	void takesDuplicatedIdOnce() {
		source.with(Dataset.NAME_BASICS, name("nm1", "Ann"), name("nm1", "Ann Again"), name("nm2", "Bea"));

		List<Person> people = resolver(10).resolve(Set.of("nm1", "nm2"), LOG).people();

		assertThat(people).containsExactly(new Person("nm1", "Ann"), new Person("nm2", "Bea"));
	}

	@Test
	void keepsDiscoveryOrder() {
		source.with(Dataset.NAME_BASICS, name("nm9", "Zed"), name("nm1", "Ann"), name("nm5", "Max"));

		List<Person> people = resolver(1).resolve(Set.of("nm1", "nm5", "nm9"), LOG).people();

		assertThat(people).extracting(Person::nconst).containsExactly("nm9", "nm1", "nm5");
	}
}
