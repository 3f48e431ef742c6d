package org.translationsanalyzer;

import java.nio.file.Path;

/**
 * A translation file could not be read or is not a flat JSON object.
 */
public class TranslationLoadException extends Exception {

	private final Path path;

	public TranslationLoadException(Path path, String message) {
		super(message);
		this.path = path;
	}

	public TranslationLoadException(Path path, String message, Throwable cause) {
		super(message, cause);
		this.path = path;
	}

	public Path getPath() {
		return path;
	}

}
