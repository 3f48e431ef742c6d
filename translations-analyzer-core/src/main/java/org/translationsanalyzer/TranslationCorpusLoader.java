package org.translationsanalyzer;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Loads many translation files in parallel and merges them into one
 * {@link TranslationCorpus}.
 *
 * <p>
 * Each file is parsed by a worker into its own entry list. Lists are merged after every
 * worker has finished, in file order, so callers never observe partially loaded state.
 */
public class TranslationCorpusLoader {

	private static final Logger logger = LoggerFactory.getLogger(TranslationCorpusLoader.class);

	private final TranslationLoader loader;

	private final ProjectClassifier classifier;

	private final int threads;

	private final LoadFailurePolicy failurePolicy;

	public TranslationCorpusLoader(TranslationLoader loader, ProjectClassifier classifier, int threads,
			LoadFailurePolicy failurePolicy) {
		if (threads < 1) {
			throw new IllegalArgumentException("Loader threads must be positive: " + threads);
		}
		this.loader = loader;
		this.classifier = classifier;
		this.threads = threads;
		this.failurePolicy = failurePolicy;
	}

	/**
	 * Load every file.
	 * @param root monorepo root; entry file paths are made relative to it
	 * @param files translation files to load
	 * @return the merged corpus
	 * @throws TranslationLoadException if a file fails and the policy is
	 * {@link LoadFailurePolicy#FAIL}
	 */
	public TranslationCorpus load(Path root, List<Path> files) throws TranslationLoadException {
		if (files.isEmpty()) {
			return new TranslationCorpus(root, 0, List.of(), List.of());
		}

		ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, files.size()));
		try {
			List<Future<FileResult>> futures = new ArrayList<>(files.size());
			for (Path file : files) {
				futures.add(executor.submit(() -> loadFile(root, file)));
			}

			List<TranslationEntry> entries = new ArrayList<>();
			List<LoadFailure> failures = new ArrayList<>();
			for (Future<FileResult> future : futures) {
				FileResult result = await(future);
				if (result.error() != null) {
					if (failurePolicy == LoadFailurePolicy.FAIL) {
						throw result.error();
					}
					logger.warn("Skipping {}: {}", result.filePath(), result.error().getMessage());
					failures.add(new LoadFailure(result.filePath(), result.error().getMessage()));
				}
				else {
					entries.addAll(result.entries());
				}
			}

			logger.debug("Loaded {} translations from {} files ({} skipped)", entries.size(), files.size(),
					failures.size());
			return new TranslationCorpus(root, files.size(), entries, failures);
		}
		finally {
			executor.shutdownNow();
		}
	}

	private FileResult loadFile(Path root, Path file) {
		String relativePath = relativize(root, file);
		try {
			Map<String, String> translations = loader.load(file);
			List<TranslationEntry> entries = new ArrayList<>(translations.size());
			for (Map.Entry<String, String> translation : translations.entrySet()) {
				entries.add(classifier.entry(relativePath, translation.getKey(), translation.getValue()));
			}
			return new FileResult(relativePath, entries, null);
		}
		catch (TranslationLoadException e) {
			return new FileResult(relativePath, List.of(), e);
		}
	}

	private FileResult await(Future<FileResult> future) {
		try {
			return future.get();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while loading translations", e);
		}
		catch (ExecutionException e) {
			throw new IllegalStateException("Failed to load translations", e.getCause());
		}
	}

	static String relativize(Path root, Path file) {
		Path relative = file.startsWith(root) ? root.relativize(file) : file;
		return relative.toString().replace('\\', '/');
	}

	private record FileResult(String filePath, List<TranslationEntry> entries,
			@Nullable TranslationLoadException error) {
	}

}
