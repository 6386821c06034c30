package org.javai.extparams.placeholder;

/**
 * A placeholder located in a document, with the exact matched text and its span.
 *
 * @param placeholder the parsed placeholder
 * @param text the matched text, e.g. {@code <user:env#USER>}
 * @param start index of the opening {@code <}
 * @param end index just past the closing {@code >}
 */
public record PlaceholderMatch(Placeholder placeholder, String text, int start, int end) {
}
