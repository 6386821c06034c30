package org.javai.extparams.batch;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.extparams.ParamResolver;
import org.javai.extparams.SecretMasker;
import org.javai.extparams.placeholder.PlaceholderGrammar;
import org.javai.extparams.placeholder.PlaceholderMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the resolver to spec documents on disk.
 * <p>
 * {@link #processDirectory} mirrors a spec tree into an output tree: {@code .spec} and {@code .md}
 * documents are written with their placeholders resolved, every other file is copied unchanged.
 * A document that fails to resolve is copied through as is and recorded in the report; the run
 * carries on. The batch methods initialize the resolver on entry and clean it up on exit.
 */
public class Preprocessor {

	private static final Logger logger = LoggerFactory.getLogger(Preprocessor.class);

	private final ParamResolver resolver;

	public Preprocessor(ParamResolver resolver) {
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
	}

	/**
	 * @throws PreprocessingException when the tree cannot be walked or a file cannot be copied
	 */
	public BatchReport processDirectory(Path specDir, Path outDir) {
		resolver.initialize();
		try {
			Files.createDirectories(outDir);
			TreeProcessor processor = new TreeProcessor(specDir, outDir);
			Files.walkFileTree(specDir, processor);
			BatchReport report = new BatchReport(specDir, outDir, processor.resolved, processor.copied,
					processor.failures, processor.interrupted);
			if (report.interrupted()) {
				logger.warn("Preprocessing of {} interrupted; outputs written so far are left in place", specDir);
			}
			else {
				logger.info("Processed specs from {} to {}: {} resolved, {} copied, {} failed", specDir, outDir,
						report.resolvedFiles(), report.copiedFiles(), report.failures().size());
			}
			return report;
		}
		catch (IOException e) {
			throw new PreprocessingException("Preprocessing failed: " + e.getMessage(), e);
		}
		finally {
			resolver.cleanup();
		}
	}

	/**
	 * Resolves a single document.
	 *
	 * @param output target file; {@code null} writes {@code <name>_resolved<ext>} beside the input
	 */
	public BatchReport processFile(Path file, Path output) {
		Path target = output != null ? output : SpecFiles.defaultOutputPath(file);
		resolver.initialize();
		try {
			List<SpecValidationException> failures = new ArrayList<>();
			boolean resolved = processSpecFile(file, target, failures);
			logger.info("Processed file: {} -> {}", file, target);
			return new BatchReport(file, target, resolved ? 1 : 0, 0, failures, false);
		}
		finally {
			resolver.cleanup();
		}
	}

	public BatchReport processFile(Path file) {
		return processFile(file, null);
	}

	/**
	 * Resolves every spec document under {@code specDir} without writing anything.
	 */
	public ValidationReport validateSpecs(Path specDir) {
		resolver.initialize();
		try {
			List<SpecValidationException> errors = new ArrayList<>();
			int total = 0;
			int processed = 0;
			for (Path file : specDocuments(specDir, errors)) {
				total++;
				logger.info("Validating spec file: {}", file);
				try {
					resolver.resolveText(Files.readString(file));
					processed++;
				}
				catch (IOException | RuntimeException e) {
					SpecValidationException failure = new SpecValidationException(file, describe(e), e);
					errors.add(failure);
					logger.error("Validation failed: {} - {}", file, failure.getMessage());
				}
			}
			return new ValidationReport(total, processed, errors);
		}
		finally {
			resolver.cleanup();
		}
	}

	/**
	 * Placeholders in {@code file} with their positions. Does not need an initialized resolver.
	 */
	public List<PlaceholderMatch> findPlaceholders(Path file) {
		try {
			return PlaceholderGrammar.findAll(Files.readString(file));
		}
		catch (IOException e) {
			throw new PreprocessingException("Failed to analyze file " + file + ": " + e.getMessage(), e);
		}
	}

	public PlaceholderStatistics placeholderStatistics(Path specDir) {
		int totalFiles = 0;
		int filesWithPlaceholders = 0;
		Map<String, Integer> counts = new LinkedHashMap<>();
		List<PlaceholderStatistics.Occurrence> details = new ArrayList<>();

		for (Path file : specDocuments(specDir, new ArrayList<>())) {
			totalFiles++;
			List<PlaceholderMatch> matches;
			try {
				matches = findPlaceholders(file);
			}
			catch (PreprocessingException e) {
				logger.warn("Failed to analyze placeholders in {}: {}", file, e.getMessage());
				continue;
			}
			if (matches.isEmpty()) {
				continue;
			}
			filesWithPlaceholders++;
			for (PlaceholderMatch match : matches) {
				counts.merge(match.placeholder().source(), 1, Integer::sum);
				details.add(new PlaceholderStatistics.Occurrence(file, match));
			}
		}

		List<PlaceholderStatistics.SourceCount> mostUsed = counts.entrySet().stream()
				.sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
				.map(e -> new PlaceholderStatistics.SourceCount(e.getKey(), e.getValue()))
				.toList();
		return new PlaceholderStatistics(totalFiles, filesWithPlaceholders, details.size(), counts, mostUsed,
				details);
	}

	private boolean processSpecFile(Path source, Path target, List<SpecValidationException> failures) {
		logger.info("Processing spec file: {}", source);
		try {
			String resolved = resolver.resolveText(Files.readString(source));
			createParent(target);
			Files.writeString(target, resolved);
			logger.info("Resolved placeholders in: {} -> {}", source, target);
			return true;
		}
		catch (IOException | RuntimeException e) {
			SpecValidationException failure = new SpecValidationException(source, describe(e), e);
			failures.add(failure);
			logger.error("Failed to process spec file {}: {}", source, failure.getMessage());
			try {
				copy(source, target);
			}
			catch (IOException copyError) {
				throw new PreprocessingException(
						"Failed to process or copy spec file " + source + ": " + failure.getMessage(), copyError);
			}
			logger.warn("Copied original file due to processing error: {}", source);
			return false;
		}
	}

	private static void copy(Path source, Path target) throws IOException {
		createParent(target);
		Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
	}

	private static void createParent(Path target) throws IOException {
		Path parent = target.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
	}

	private static String describe(Exception e) {
		return SecretMasker.mask(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
	}

	/**
	 * Spec documents under {@code specDir} in path order. Unreadable directories are recorded in
	 * {@code errors} and skipped.
	 */
	private static List<Path> specDocuments(Path specDir, List<SpecValidationException> errors) {
		List<Path> documents = new ArrayList<>();
		try {
			Files.walkFileTree(specDir, new SimpleFileVisitor<>() {
				@Override
				public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
					if (attrs.isRegularFile() && SpecFiles.isSpecFile(file)) {
						documents.add(file);
					}
					return FileVisitResult.CONTINUE;
				}

				@Override
				public FileVisitResult visitFileFailed(Path file, IOException e) {
					errors.add(new SpecValidationException(file, "Failed to read directory: " + e.getMessage(), e));
					logger.warn("Failed to read {}: {}", file, e.getMessage());
					return FileVisitResult.CONTINUE;
				}
			});
		}
		catch (IOException e) {
			errors.add(new SpecValidationException(specDir, "Failed to read directory: " + e.getMessage(), e));
		}
		documents.sort(Comparator.naturalOrder());
		return documents;
	}

	private final class TreeProcessor extends SimpleFileVisitor<Path> {

		private final Path specDir;
		private final Path outDir;
		private final List<SpecValidationException> failures = new ArrayList<>();
		private int resolved;
		private int copied;
		private boolean interrupted;

		TreeProcessor(Path specDir, Path outDir) {
			this.specDir = specDir;
			this.outDir = outDir;
		}

		@Override
		public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
			if (dir.toAbsolutePath().normalize().equals(outDir.toAbsolutePath().normalize())) {
				return FileVisitResult.SKIP_SUBTREE;
			}
			Files.createDirectories(outDir.resolve(specDir.relativize(dir).toString()));
			return FileVisitResult.CONTINUE;
		}

		@Override
		public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
			if (Thread.currentThread().isInterrupted()) {
				interrupted = true;
				return FileVisitResult.TERMINATE;
			}
			Path target = outDir.resolve(specDir.relativize(file).toString());
			if (attrs.isRegularFile() && SpecFiles.isSpecFile(file)) {
				if (processSpecFile(file, target, failures)) {
					resolved++;
				}
			}
			else {
				try {
					copy(file, target);
				}
				catch (IOException e) {
					throw new PreprocessingException(
							"Failed to copy file from " + file + " to " + target + ": " + e.getMessage(), e);
				}
				copied++;
			}
			return FileVisitResult.CONTINUE;
		}

		@Override
		public FileVisitResult visitFileFailed(Path file, IOException e) throws IOException {
			throw new IOException("Failed to process directory " + file + ": " + e.getMessage(), e);
		}
	}
}
