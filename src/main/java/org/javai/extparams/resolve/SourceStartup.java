package org.javai.extparams.resolve;

import org.javai.extparams.source.SourceType;

/**
 * Outcome of starting one enabled adapter. A failed start drops the source from the registry
 * without failing engine initialization.
 */
public sealed interface SourceStartup {

	SourceType type();

	record Started(SourceType type) implements SourceStartup {
	}

	/**
	 * @param reason masked failure message
	 */
	record Failed(SourceType type, String reason) implements SourceStartup {
	}
}
