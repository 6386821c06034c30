package org.javai.extparams.host;

/**
 * Reply to a step-starting event: the result plus the step with its placeholders resolved.
 * On failure {@code step} is the original, unchanged step.
 */
public record StepOutcome(ExecutionResult result, ExecutionStep step) {
}
