package org.translationsanalyzer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * File system implementation of {@link TranslationFileSearch}.
 *
 * <p>
 * A file matches when the configured regular expression finds a match in its file name.
 * Directories whose name is in the skip list are pruned wherever they appear in the tree.
 */
public class FileSystemTranslationFileSearch implements TranslationFileSearch {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemTranslationFileSearch.class);

	private final Pattern fileNamePattern;

	private final Set<String> skipDirectories;

	public FileSystemTranslationFileSearch(String fileNameRegex, Collection<String> skipDirectories) {
		if (fileNameRegex.isEmpty()) {
			throw new IllegalArgumentException("Translation file regex cannot be empty");
		}
		try {
			this.fileNamePattern = Pattern.compile(fileNameRegex);
		}
		catch (PatternSyntaxException e) {
			throw new IllegalArgumentException(
					"Invalid regex pattern: " + fileNameRegex + " - " + e.getDescription(), e);
		}
		this.skipDirectories = Set.copyOf(skipDirectories);
	}

	@Override
	public List<Path> search(Path root) throws IOException {
		if (!Files.isDirectory(root)) {
			throw new IOException("Unable to read path: " + root);
		}

		List<Path> matches = new ArrayList<>();
		Files.walkFileTree(root, new SimpleFileVisitor<>() {

			@Override
			public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
				if (!dir.equals(root) && shouldSkip(dir)) {
					logger.debug("Skipping directory {}", dir);
					return FileVisitResult.SKIP_SUBTREE;
				}
				return FileVisitResult.CONTINUE;
			}

			@Override
			public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
				if (attrs.isRegularFile() && fileNamePattern.matcher(file.getFileName().toString()).find()) {
					matches.add(file);
				}
				return FileVisitResult.CONTINUE;
			}

			@Override
			public FileVisitResult visitFileFailed(Path file, IOException e) throws IOException {
				if (file.equals(root)) {
					throw e;
				}
				logger.warn("Unable to read {}: {}", file, e.getMessage());
				return FileVisitResult.CONTINUE;
			}

		});

		matches.sort(null);
		logger.debug("Found {} translation files below {}", matches.size(), root);
		return matches;
	}

	private boolean shouldSkip(Path dir) {
		Path name = dir.getFileName();
		return name != null && skipDirectories.contains(name.toString());
	}

}
