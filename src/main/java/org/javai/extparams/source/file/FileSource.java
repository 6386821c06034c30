package org.javai.extparams.source.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.lang3.StringUtils;
import org.javai.extparams.config.SourceConfig;
import org.javai.extparams.source.JsonValues;
import org.javai.extparams.source.ParamSource;
import org.javai.extparams.source.SourceResolutionException;
import org.javai.extparams.source.SourceType;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Resolves keys from JSON and YAML files under a base directory.
 * <p>
 * Key format: {@code filename} or {@code filename#path.to.value}. Parsed documents are cached per
 * absolute path for as long as the file's modification time is unchanged.
 */
public class FileSource implements ParamSource {

	private static final String NAME = "FileSource";

	private final Options options;
	private final Path basePath;
	private final Map<Path, CachedDocument> documents = new ConcurrentHashMap<>();

	public FileSource(Options options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.basePath = options.basePath().toAbsolutePath().normalize();
	}

	public FileSource(SourceConfig config, Path workingDirectory) {
		this(Options.from(config, workingDirectory));
	}

	@Override
	public SourceType type() {
		return SourceType.FILE;
	}

	@Override
	public void initialize() {
	}

	@Override
	public String resolve(String key) {
		String filename = StringUtils.substringBefore(key, "#");
		String path = key.contains("#") ? StringUtils.substringAfter(key, "#") : null;
		try {
			JsonNode document = loadFile(filename);
			JsonNode value = JsonValues.at(document, path)
					.orElseThrow(() -> new FileAccessException(
							"Path '" + StringUtils.defaultIfEmpty(path, "root") + "' not found in file '" + filename + "'"));
			return JsonValues.render(value);
		}
		catch (FileAccessException e) {
			throw SourceResolutionException.failed(SourceType.FILE, NAME, key, e.getMessage(), e.getCause());
		}
	}

	JsonNode loadFile(String filename) {
		Path filePath = checkedPath(filename);
		String extension = extensionOf(filename);

		if (options.cacheFiles()) {
			JsonNode cached = cachedDocument(filePath);
			if (cached != null) {
				return cached;
			}
		}

		try {
			long size = Files.size(filePath);
			if (size > options.maxFileSize()) {
				throw new FileAccessException("File '" + filename + "' is too large (" + size + " bytes, max: "
						+ options.maxFileSize() + ")");
			}
			FileTime modified = Files.getLastModifiedTime(filePath);
			JsonNode document = parse(Files.readString(filePath), extension, filename);
			if (options.cacheFiles()) {
				documents.put(filePath, new CachedDocument(document, modified));
			}
			return document;
		}
		catch (NoSuchFileException e) {
			throw new FileAccessException("File '" + filename + "' not found", e);
		}
		catch (AccessDeniedException e) {
			throw new FileAccessException("Permission denied reading file '" + filename + "'", e);
		}
		catch (IOException e) {
			throw new FileAccessException("Failed to read file '" + filename + "': " + e.getMessage(), e);
		}
	}

	/**
	 * Checks containment, extension and size without parsing.
	 *
	 * @throws SourceResolutionException describing the first check that fails
	 */
	public void validateFile(String filename) {
		try {
			Path filePath = checkedPath(filename);
			long size = Files.size(filePath);
			if (size > options.maxFileSize()) {
				throw new FileAccessException("File '" + filename + "' is too large");
			}
		}
		catch (FileAccessException e) {
			throw new SourceResolutionException(SourceType.FILE, filename, "File validation failed: " + e.getMessage(), e);
		}
		catch (IOException e) {
			throw new SourceResolutionException(SourceType.FILE, filename,
					"File validation failed: File '" + filename + "' not found", e);
		}
	}

	/**
	 * Files directly under the base path with an allowed extension and an acceptable size.
	 */
	public List<AvailableFile> listAvailableFiles() {
		List<AvailableFile> available = new ArrayList<>();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(basePath)) {
			for (Path file : stream) {
				String name = file.getFileName().toString();
				if (!Files.isRegularFile(file) || !options.allowedExtensions().contains(extensionOf(name))) {
					continue;
				}
				long size = Files.size(file);
				if (size <= options.maxFileSize()) {
					available.add(new AvailableFile(name, size, Files.getLastModifiedTime(file).toInstant()));
				}
			}
		}
		catch (IOException e) {
			throw new SourceResolutionException(SourceType.FILE, basePath.toString(),
					"Failed to list available files: " + e.getMessage(), e);
		}
		available.sort((a, b) -> a.filename().compareTo(b.filename()));
		return available;
	}

	@Override
	public void refreshCache() {
		documents.clear();
	}

	@Override
	public void cleanup() {
		documents.clear();
	}

	private Path checkedPath(String filename) {
		Path filePath = basePath.resolve(filename).toAbsolutePath().normalize();
		if (!filePath.startsWith(basePath)) {
			throw new FileAccessException("File '" + filename + "' is outside allowed base path");
		}
		String extension = extensionOf(filename);
		if (!options.allowedExtensions().contains(extension)) {
			throw new FileAccessException("File extension '" + extension + "' is not allowed. Allowed: "
					+ String.join(", ", options.allowedExtensions()));
		}
		return filePath;
	}

	private JsonNode cachedDocument(Path filePath) {
		CachedDocument cached = documents.get(filePath);
		if (cached == null) {
			return null;
		}
		try {
			if (Files.getLastModifiedTime(filePath).equals(cached.modified())) {
				return cached.document();
			}
		}
		catch (IOException e) {
			documents.remove(filePath, cached);
			return null;
		}
		documents.remove(filePath, cached);
		return null;
	}

	private static JsonNode parse(String content, String extension, String filename) {
		try {
			return switch (extension) {
				case ".json" -> JsonValues.MAPPER.readTree(content);
				case ".yaml", ".yml" -> JsonValues.MAPPER.valueToTree(new Yaml().load(content));
				default -> throw new FileAccessException("Unsupported file extension: " + extension);
			};
		}
		catch (JsonProcessingException | YAMLException | IllegalArgumentException e) {
			throw new FileAccessException("Invalid JSON/YAML syntax in file '" + filename + "': " + e.getMessage(), e);
		}
	}

	static String extensionOf(String filename) {
		String name = Path.of(filename).getFileName().toString();
		int dot = name.lastIndexOf('.');
		return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
	}

	private record CachedDocument(JsonNode document, FileTime modified) {
	}

	public record AvailableFile(String filename, long size, Instant modified) {
	}

	private static final class FileAccessException extends RuntimeException {

		FileAccessException(String message) {
			super(message);
		}

		FileAccessException(String message, Throwable cause) {
			super(message, cause);
		}
	}

	public record Options(Path basePath, List<String> allowedExtensions, boolean cacheFiles, long maxFileSize) {

		public static final List<String> DEFAULT_EXTENSIONS = List.of(".json", ".yaml", ".yml");
		public static final long DEFAULT_MAX_FILE_SIZE = 1024 * 1024;

		public Options {
			Objects.requireNonNull(basePath, "basePath must not be null");
			allowedExtensions = allowedExtensions != null
					? allowedExtensions.stream().map(e -> e.toLowerCase(Locale.ROOT)).toList()
					: DEFAULT_EXTENSIONS;
		}

		public static Options from(SourceConfig config, Path workingDirectory) {
			return new Options(
					Path.of(config.string("basePath", workingDirectory.toString())),
					config.strings("allowedExtensions", DEFAULT_EXTENSIONS),
					config.bool("cacheFiles", true),
					config.longValue("maxFileSize", DEFAULT_MAX_FILE_SIZE));
		}
	}
}
