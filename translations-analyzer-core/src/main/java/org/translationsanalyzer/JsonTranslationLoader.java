package org.translationsanalyzer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads flat JSON translation files ({@code {"key": "text", ...}}).
 *
 * <p>
 * Operates on raw JSON ({@code readTree}). Only string values are translations; any other
 * value (number, boolean, null, nested object) is skipped with a warning so that it can never
 * be grouped with a string of the same spelling.
 */
public class JsonTranslationLoader implements TranslationLoader {

	private static final Logger logger = LoggerFactory.getLogger(JsonTranslationLoader.class);

	private final ObjectMapper objectMapper;

	public JsonTranslationLoader(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	public Map<String, String> load(Path path) throws TranslationLoadException {
		if (!path.getFileName().toString().endsWith(".json")) {
			throw new TranslationLoadException(path, "File is not a JSON file: " + path);
		}

		String content;
		try {
			content = Files.readString(path, StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new TranslationLoadException(path, "Cannot read file: " + path, e);
		}

		JsonNode root;
		try {
			root = objectMapper.readTree(content);
		}
		catch (JsonProcessingException e) {
			throw new TranslationLoadException(path, "Invalid JSON format in " + path, e);
		}

		if (root == null || !root.isObject()) {
			throw new TranslationLoadException(path, "Root element is not a JSON object: " + path);
		}

		Map<String, String> translations = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			JsonNode value = field.getValue();
			if (!value.isTextual()) {
				logger.warn("Ignoring non-string value of key '{}' in {}: {}", field.getKey(), path,
						value.getNodeType());
				continue;
			}
			translations.put(field.getKey(), value.asText());
		}
		return translations;
	}

}
