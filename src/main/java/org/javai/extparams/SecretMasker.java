package org.javai.extparams;

import java.util.regex.Pattern;

/**
 * Masks anything that looks like secret material before text leaves the engine.
 * <p>
 * Every contiguous run of 20 or more characters from {@code [a-zA-Z0-9+/]} is replaced with
 * {@value #MASK}. Applied to every error message that is logged or surfaced to a caller.
 */
public final class SecretMasker {

	public static final String MASK = "****";

	private static final Pattern SECRET_LIKE = Pattern.compile("[a-zA-Z0-9+/]{20,}");

	private SecretMasker() {
	}

	public static String mask(String text) {
		if (text == null || text.length() < 20) {
			return text;
		}
		return SECRET_LIKE.matcher(text).replaceAll(MASK);
	}
}
