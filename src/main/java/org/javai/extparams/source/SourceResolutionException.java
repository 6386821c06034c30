package org.javai.extparams.source;

/**
 * An adapter could not produce a value for a key. The resolver treats this as a signal to try the
 * next source in the chain.
 */
public class SourceResolutionException extends RuntimeException {

	private final SourceType source;
	private final String key;

	public SourceResolutionException(SourceType source, String key, String message) {
		super(message);
		this.source = source;
		this.key = key;
	}

	public SourceResolutionException(SourceType source, String key, String message, Throwable cause) {
		super(message, cause);
		this.source = source;
		this.key = key;
	}

	/**
	 * Builds the conventional {@code <Adapter> failed to resolve key '<key>': <reason>} message.
	 */
	public static SourceResolutionException failed(SourceType source, String adapter, String key, String reason) {
		return new SourceResolutionException(source, key,
				adapter + " failed to resolve key '" + key + "': " + reason);
	}

	public static SourceResolutionException failed(SourceType source, String adapter, String key, String reason,
			Throwable cause) {
		return new SourceResolutionException(source, key,
				adapter + " failed to resolve key '" + key + "': " + reason, cause);
	}

	public SourceType source() {
		return source;
	}

	public String key() {
		return key;
	}
}
