package org.javai.extparams.host;

import java.util.List;

/**
 * A step as the host runtime reports it before execution.
 *
 * @param actualText the step text as written in the spec
 * @param parsedText the step text after the host's own parsing
 * @param fragments text fragments of the step; may be empty
 */
public record ExecutionStep(String actualText, String parsedText, List<String> fragments) {

	public ExecutionStep {
		fragments = fragments != null ? List.copyOf(fragments) : List.of();
	}

	public ExecutionStep(String actualText) {
		this(actualText, actualText, List.of());
	}
}
