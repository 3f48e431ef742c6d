package org.translationsanalyzer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JsonTranslationLoader Tests")
class JsonTranslationLoaderTest {

	@TempDir
	Path tempDir;

	private final JsonTranslationLoader loader = new JsonTranslationLoader(ObjectMapperFactory.create());

	private Path write(String fileName, String content) throws IOException {
		return Files.writeString(tempDir.resolve(fileName), content);
	}

	@Test
	@DisplayName("Should load keys in file order")
	void shouldLoadFlatObject() throws Exception {
		Path file = write("Messages_fr_FR.json", """
				{"zimbra_title": "Zimbra", "cancel": "Annuler", "empty": ""}
				""");

		Map<String, String> translations = loader.load(file);

		assertThat(translations).containsExactly(entry("zimbra_title", "Zimbra"), entry("cancel", "Annuler"),
				entry("empty", ""));
	}

	@Test
	@DisplayName("Should skip non-string values")
	void shouldSkipNonStringValues() throws Exception {
		Path file = write("Messages_fr_FR.json", """
				{"count": 1, "label": "1", "n": null, "s": "null", "enabled": true, "nested": {"a": "b"}}
				""");

		Map<String, String> translations = loader.load(file);

		assertThat(translations).containsExactly(entry("label", "1"), entry("s", "null"));
	}

	@Test
	@DisplayName("Should read UTF-8 content")
	void shouldReadUtf8() throws Exception {
		Path file = write("Messages_fr_FR.json", "{\"title\": \"Créer une règle\"}");

		assertThat(loader.load(file)).containsEntry("title", "Créer une règle");
	}

	@Test
	@DisplayName("Should reject files without a json extension")
	void shouldRejectNonJsonExtension() throws Exception {
		Path file = write("Messages_fr_FR.properties", "title=Titre");

		assertThatThrownBy(() -> loader.load(file)).isInstanceOf(TranslationLoadException.class)
			.hasMessageContaining("not a JSON file");
	}

	@ParameterizedTest
	@ValueSource(strings = { "[\"a\", \"b\"]", "\"text\"", "42" })
	@DisplayName("Should reject a root that is not an object")
	void shouldRejectNonObjectRoot(String content) throws Exception {
		Path file = write("Messages_fr_FR.json", content);

		assertThatThrownBy(() -> loader.load(file)).isInstanceOf(TranslationLoadException.class)
			.hasMessageContaining("Root element is not a JSON object");
	}

	@Test
	@DisplayName("Should report malformed JSON with the file path")
	void shouldRejectMalformedJson() throws Exception {
		Path file = write("Messages_fr_FR.json", "{\"title\": ");

		assertThatThrownBy(() -> loader.load(file)).isInstanceOf(TranslationLoadException.class)
			.hasMessageContaining("Invalid JSON format")
			.satisfies(e -> assertThat(((TranslationLoadException) e).getPath()).isEqualTo(file));
	}

	@Test
	@DisplayName("Should report unreadable files")
	void shouldRejectMissingFile() {
		Path file = tempDir.resolve("missing.json");

		assertThatThrownBy(() -> loader.load(file)).isInstanceOf(TranslationLoadException.class)
			.hasMessageContaining("Cannot read file");
	}

}
