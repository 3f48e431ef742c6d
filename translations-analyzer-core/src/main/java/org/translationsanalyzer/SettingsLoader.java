package org.translationsanalyzer;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link AnalyzerSettings} from a JSON file.
 *
 * <p>
 * Property names are snake_case ({@code translation_file_regex},
 * {@code common_translations_modules_path}, ...). Properties absent from the file keep their
 * default value.
 */
public class SettingsLoader {

	private static final Logger logger = LoggerFactory.getLogger(SettingsLoader.class);

	public static final String DEFAULT_SETTINGS_FILE = "settings.json";

	private final ObjectMapper objectMapper;

	public SettingsLoader(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Load settings, falling back to defaults when the file does not exist.
	 * @param settingsFile path of the settings file
	 * @return validated settings
	 * @throws IOException if the file exists but cannot be read or parsed
	 * @throws IllegalArgumentException if the settings are invalid
	 */
	public AnalyzerSettings load(Path settingsFile) throws IOException {
		AnalyzerSettings settings;
		if (Files.exists(settingsFile)) {
			settings = objectMapper.readValue(settingsFile.toFile(), AnalyzerSettings.class);
			logger.info("Loaded settings from {}", settingsFile);
		}
		else {
			settings = new AnalyzerSettings();
			logger.info("Settings file {} not found, using defaults", settingsFile);
		}
		settings.validate();
		return settings;
	}

}
