package org.translationsanalyzer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ContentIndex Tests")
class ContentIndexTest {

	private final ProjectClassifier classifier = ProjectClassifier.withDefaultMarkers();

	@Test
	@DisplayName("Should group entries by exact value regardless of key")
	void shouldGroupByValue() {
		TranslationEntry a = classifier.entry("apps/a/Messages.json", "title", "Hello");
		TranslationEntry b = classifier.entry("apps/b/Messages.json", "heading", "Hello");
		TranslationEntry c = classifier.entry("apps/b/Messages.json", "title", "Bye");

		ContentIndex index = ContentIndex.build(List.of(a, b, c));

		assertThat(index.group("Hello")).containsExactly(a, b);
		assertThat(index.group("Bye")).containsExactly(c);
		assertThat(index.distinctValues()).containsExactlyInAnyOrder("Hello", "Bye");
		assertThat(index.entryCount()).isEqualTo(3);
	}

	@Test
	@DisplayName("Should not group entries sharing a key but not a value")
	void shouldNotGroupBySameKey() {
		ContentIndex index = ContentIndex.build(List.of(classifier.entry("apps/a/Messages.json", "title", "Hello"),
				classifier.entry("apps/b/Messages.json", "title", "hello")));

		assertThat(index.occurrences("Hello")).isEqualTo(1);
		assertThat(index.occurrences("hello")).isEqualTo(1);
		assertThat(index.duplicatedValues()).isEmpty();
	}

	@Test
	@DisplayName("Should treat empty and whitespace values as ordinary keys")
	void shouldIndexEmptyAndWhitespaceValues() {
		ContentIndex index = ContentIndex.build(List.of(classifier.entry("apps/a/Messages.json", "empty", ""),
				classifier.entry("apps/b/Messages.json", "blank", ""),
				classifier.entry("apps/c/Messages.json", "space", " ")));

		assertThat(index.occurrences("")).isEqualTo(2);
		assertThat(index.occurrences(" ")).isEqualTo(1);
		assertThat(index.duplicatedValues()).containsExactly("");
	}

	@Test
	@DisplayName("Should not group a loaded number with the string of the same spelling")
	void shouldNotGroupNumberWithString(@TempDir Path tempDir) throws Exception {
		Path file = Files.writeString(tempDir.resolve("Messages_fr_FR.json"), """
				{"count": 1, "label": "1", "n": null, "s": "null"}
				""");
		Map<String, String> translations = new JsonTranslationLoader(ObjectMapperFactory.create()).load(file);
		List<TranslationEntry> entries = new ArrayList<>();
		for (Map.Entry<String, String> translation : translations.entrySet()) {
			entries.add(classifier.entry("apps/a/Messages_fr_FR.json", translation.getKey(), translation.getValue()));
		}

		ContentIndex index = ContentIndex.build(entries);

		assertThat(index.occurrences("1")).isEqualTo(1);
		assertThat(index.occurrences("null")).isEqualTo(1);
		assertThat(index.duplicatedValues()).isEmpty();
	}

	@Test
	@DisplayName("Should return an empty group for unknown values")
	void shouldReturnEmptyGroupForUnknownValue() {
		ContentIndex index = ContentIndex.build(List.of());

		assertThat(index.group("missing")).isEmpty();
		assertThat(index.entryCount()).isZero();
	}

	@Test
	@DisplayName("Should sort groups by file path then key whatever the input order")
	void shouldSortGroupsDeterministically() {
		List<TranslationEntry> entries = new ArrayList<>();
		for (int i = 0; i < 20; i++) {
			entries.add(classifier.entry("apps/p" + (i % 5) + "/Messages.json", "key" + i, "Same"));
		}
		List<TranslationEntry> shuffled = new ArrayList<>(entries);
		Collections.shuffle(shuffled, new Random(42));

		ContentIndex ordered = ContentIndex.build(entries);
		ContentIndex fromShuffled = ContentIndex.build(shuffled);

		assertThat(fromShuffled.group("Same")).isEqualTo(ordered.group("Same"));
		assertThat(ordered.group("Same")).isSortedAccordingTo(TranslationEntry.BY_LOCATION);
	}

	@Test
	@DisplayName("Should expose immutable groups")
	void shouldExposeImmutableGroups() {
		ContentIndex index = ContentIndex.build(List.of(classifier.entry("apps/a/Messages.json", "k", "v")));

		assertThatThrownBy(() -> index.group("v").clear()).isInstanceOf(UnsupportedOperationException.class);
	}

}
