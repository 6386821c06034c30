package org.javai.extparams.source;

/**
 * An adapter could not start. The engine drops the source and carries on without it.
 */
public class SourceInitializationException extends RuntimeException {

	private final SourceType source;

	public SourceInitializationException(SourceType source, String message) {
		super(message);
		this.source = source;
	}

	public SourceInitializationException(SourceType source, String message, Throwable cause) {
		super(message, cause);
		this.source = source;
	}

	public SourceType source() {
		return source;
	}
}
