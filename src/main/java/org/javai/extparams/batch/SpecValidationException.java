package org.javai.extparams.batch;

import java.nio.file.Path;
import org.javai.extparams.SecretMasker;

/**
 * A spec document could not be resolved. Recorded per file in batch reports; the batch carries on.
 */
public class SpecValidationException extends RuntimeException {

	private final Path file;

	public SpecValidationException(Path file, String message) {
		super(SecretMasker.mask(message));
		this.file = file;
	}

	public SpecValidationException(Path file, String message, Throwable cause) {
		super(SecretMasker.mask(message), cause);
		this.file = file;
	}

	public Path file() {
		return file;
	}
}
