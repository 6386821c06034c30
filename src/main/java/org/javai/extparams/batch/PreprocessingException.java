package org.javai.extparams.batch;

/**
 * A batch run could not continue: a directory could not be read or created, or a file could not
 * be copied to the output tree.
 */
public class PreprocessingException extends RuntimeException {

	public PreprocessingException(String message) {
		super(message);
	}

	public PreprocessingException(String message, Throwable cause) {
		super(message, cause);
	}
}
