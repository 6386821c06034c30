package org.javai.extparams.host;

import org.javai.extparams.SecretMasker;

/**
 * Reply to a host runtime event.
 *
 * @param errorMessage masked failure description; {@code null} when not failed
 */
public record ExecutionResult(boolean failed, String errorMessage) {

	private static final ExecutionResult OK = new ExecutionResult(false, null);

	public static ExecutionResult ok() {
		return OK;
	}

	public static ExecutionResult failure(String errorMessage) {
		return new ExecutionResult(true, SecretMasker.mask(errorMessage));
	}
}
