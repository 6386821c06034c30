package org.javai.extparams.placeholder;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Parses and serializes the {@code <name:source#key>} / {@code <name:source#key|default>} syntax.
 * <p>
 * Segment rules: {@code name} excludes {@code :}, {@code source} excludes {@code #}, {@code key}
 * excludes {@code |} and {@code >}, {@code default} excludes {@code >}. There is no escaping; a
 * delimiter inside a segment ends that segment, and the leftmost match wins.
 */
public final class PlaceholderGrammar {

	static final Pattern PLACEHOLDER = Pattern.compile("<([^:]+):([^#]+)#([^|>]+)(?:\\|([^>]+))?>");

	private PlaceholderGrammar() {
	}

	/**
	 * Lazily scans {@code text} left to right for non-overlapping placeholders.
	 * The scan is stateless, so the same text can be scanned any number of times.
	 */
	public static Stream<PlaceholderMatch> scan(String text) {
		if (text == null || text.isEmpty()) {
			return Stream.empty();
		}
		return PLACEHOLDER.matcher(text)
				.results()
				.map(PlaceholderGrammar::toMatch);
	}

	/**
	 * Eagerly collects every placeholder in {@code text}.
	 */
	public static List<PlaceholderMatch> findAll(String text) {
		return scan(text).toList();
	}

	/**
	 * Parses the first well-formed placeholder in {@code placeholderText}. Surrounding text and any
	 * later placeholders are ignored.
	 *
	 * @throws InvalidPlaceholderSyntaxException if the text contains no well-formed placeholder
	 */
	public static Placeholder parse(String placeholderText) {
		if (placeholderText == null) {
			throw new InvalidPlaceholderSyntaxException("null");
		}
		Matcher matcher = PLACEHOLDER.matcher(placeholderText);
		if (!matcher.find()) {
			throw new InvalidPlaceholderSyntaxException(placeholderText);
		}
		return toPlaceholder(matcher);
	}

	public static String serialize(String name, String source, String key) {
		return serialize(name, source, key, null);
	}

	/**
	 * Renders a placeholder so that {@link #parse(String)} yields the same four components.
	 *
	 * @throws IllegalArgumentException if a component contains its segment's terminating delimiter
	 * or is empty, since such a placeholder could not be read back
	 */
	public static String serialize(String name, String source, String key, String defaultValue) {
		requireSegment("name", name, ":");
		requireSegment("source", source, "#");
		requireSegment("key", key, "|>");
		StringBuilder sb = new StringBuilder()
				.append('<').append(name)
				.append(':').append(source)
				.append('#').append(key);
		if (defaultValue != null) {
			requireSegment("defaultValue", defaultValue, ">");
			sb.append('|').append(defaultValue);
		}
		return sb.append('>').toString();
	}

	private static void requireSegment(String label, String value, String forbidden) {
		Objects.requireNonNull(value, label + " must not be null");
		if (value.isEmpty()) {
			throw new IllegalArgumentException(label + " must not be empty");
		}
		for (char c : forbidden.toCharArray()) {
			if (value.indexOf(c) >= 0) {
				throw new IllegalArgumentException(label + " must not contain '" + c + "': " + value);
			}
		}
	}

	private static PlaceholderMatch toMatch(MatchResult result) {
		return new PlaceholderMatch(toPlaceholder(result), result.group(), result.start(), result.end());
	}

	private static Placeholder toPlaceholder(MatchResult result) {
		return new Placeholder(result.group(1), result.group(2), result.group(3), result.group(4));
	}
}
