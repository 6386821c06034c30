package org.javai.extparams.resolve;

import org.javai.extparams.source.SourceType;

/**
 * One failed attempt in a fallback chain.
 *
 * @param source the source that was tried
 * @param message masked error message
 */
public record SourceFailure(SourceType source, String message) {
}
