package org.javai.extparams.source.env;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.extparams.config.SourceConfig;
import org.javai.extparams.source.ParamSource;
import org.javai.extparams.source.SourceResolutionException;
import org.javai.extparams.source.SourceType;

/**
 * Resolves keys against an environment table.
 * <p>
 * Key format: the variable name. The configured {@code prefix} is prepended, then
 * {@code transformCase} ({@code upper}, {@code lower} or {@code none}) is applied.
 */
public class EnvSource implements ParamSource {

	private static final String NAME = "EnvSource";

	private final Options options;
	private final Map<String, String> environment;

	public EnvSource(Options options, Map<String, String> environment) {
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment must not be null"));
	}

	public EnvSource(SourceConfig config, Map<String, String> environment) {
		this(Options.from(config), environment);
	}

	@Override
	public SourceType type() {
		return SourceType.ENV;
	}

	@Override
	public void initialize() {
	}

	@Override
	public String resolve(String key) {
		String envKey = toEnvironmentKey(key);
		String value = environment.get(envKey);
		if (value == null) {
			throw SourceResolutionException.failed(SourceType.ENV, NAME, key,
					"Environment variable '" + envKey + "' not found");
		}
		return value;
	}

	public boolean exists(String key) {
		return environment.containsKey(toEnvironmentKey(key));
	}

	/**
	 * Variables visible through the configured prefix, with the prefix stripped from {@link
	 * AvailableVariable#key()}.
	 */
	public List<AvailableVariable> listAvailable() {
		String prefix = options.prefix();
		List<AvailableVariable> available = new ArrayList<>();
		environment.forEach((name, value) -> {
			if (prefix.isEmpty() || name.startsWith(prefix)) {
				available.add(new AvailableVariable(
						name.substring(prefix.length()), name, value != null && !value.isEmpty()));
			}
		});
		available.sort((a, b) -> a.originalKey().compareTo(b.originalKey()));
		return available;
	}

	String toEnvironmentKey(String key) {
		String envKey = options.prefix() + key;
		return switch (options.transformCase()) {
			case UPPER -> envKey.toUpperCase(Locale.ROOT);
			case LOWER -> envKey.toLowerCase(Locale.ROOT);
			case NONE -> envKey;
		};
	}

	public record AvailableVariable(String key, String originalKey, boolean hasValue) {
	}

	public enum TransformCase {
		UPPER, LOWER, NONE;

		static TransformCase parse(String value) {
			if (value == null) {
				return NONE;
			}
			return switch (value.toLowerCase(Locale.ROOT)) {
				case "upper" -> UPPER;
				case "lower" -> LOWER;
				default -> NONE;
			};
		}
	}

	public record Options(String prefix, TransformCase transformCase) {

		public Options {
			prefix = prefix != null ? prefix : "";
			transformCase = transformCase != null ? transformCase : TransformCase.NONE;
		}

		public static Options from(SourceConfig config) {
			return new Options(
					config.string("prefix", ""),
					TransformCase.parse(config.string("transformCase", "none")));
		}
	}
}
