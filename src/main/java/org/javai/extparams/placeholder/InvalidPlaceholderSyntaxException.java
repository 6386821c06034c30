package org.javai.extparams.placeholder;

/**
 * Thrown by the strict single-placeholder parser when the text is not exactly one placeholder.
 * Document scanning never throws this; malformed spans are simply left as literal text.
 */
public class InvalidPlaceholderSyntaxException extends RuntimeException {

	private final String text;

	public InvalidPlaceholderSyntaxException(String text) {
		super("Invalid placeholder syntax: " + text);
		this.text = text;
	}

	public String text() {
		return text;
	}
}
