package org.javai.extparams.resolve;

import java.util.List;
import org.javai.extparams.SecretMasker;

/**
 * Every source in a placeholder's fallback chain failed and the placeholder has no default.
 * The message names the key, the declared source and the last underlying error, masked.
 */
public class UnresolvedPlaceholderException extends RuntimeException {

	private final String key;
	private final String declaredSource;
	private final List<SourceFailure> attempts;

	public UnresolvedPlaceholderException(String key, String declaredSource, List<SourceFailure> attempts) {
		super(SecretMasker.mask("Could not resolve placeholder for key '" + key + "' from source '" + declaredSource
				+ "'. Last error: " + lastError(attempts)));
		this.key = key;
		this.declaredSource = declaredSource;
		this.attempts = List.copyOf(attempts);
	}

	private static String lastError(List<SourceFailure> attempts) {
		return attempts.isEmpty() ? "No sources available" : attempts.get(attempts.size() - 1).message();
	}

	public String key() {
		return key;
	}

	public String declaredSource() {
		return declaredSource;
	}

	/**
	 * Every failed attempt, in chain order.
	 */
	public List<SourceFailure> attempts() {
		return attempts;
	}
}
