package org.javai.extparams.resolve;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.extparams.placeholder.PlaceholderGrammar;
import org.javai.extparams.placeholder.PlaceholderMatch;

/**
 * Substitutes every placeholder in a document.
 * <p>
 * Each distinct placeholder text is resolved once and substituted at every span where it occurs.
 * Resolution is all-or-nothing: if any placeholder cannot be resolved the call fails and no
 * partially substituted text is produced.
 */
public class TextResolver {

	private final PrecedenceResolver resolver;

	public TextResolver(PrecedenceResolver resolver) {
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
	}

	/**
	 * @return the document with all placeholders replaced; {@code null} and empty input are
	 * returned unchanged
	 * @throws UnresolvedPlaceholderException for the first placeholder that cannot be resolved
	 */
	public String resolveText(String text) {
		if (text == null || text.isEmpty()) {
			return text;
		}
		List<PlaceholderMatch> matches = PlaceholderGrammar.findAll(text);
		if (matches.isEmpty()) {
			return text;
		}

		Map<String, String> values = new LinkedHashMap<>();
		for (PlaceholderMatch match : matches) {
			if (!values.containsKey(match.text())) {
				values.put(match.text(), resolver.resolve(match.placeholder()));
			}
		}

		StringBuilder resolved = new StringBuilder(text.length());
		int position = 0;
		for (PlaceholderMatch match : matches) {
			resolved.append(text, position, match.start()).append(values.get(match.text()));
			position = match.end();
		}
		resolved.append(text, position, text.length());
		return resolved.toString();
	}
}
