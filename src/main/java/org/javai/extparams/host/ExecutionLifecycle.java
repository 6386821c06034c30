package org.javai.extparams.host;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.extparams.ParamResolver;
import org.javai.extparams.SecretMasker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps host runtime events onto the resolver.
 * <ul>
 *   <li>execution starting: initialize the resolver</li>
 *   <li>spec starting: refresh all caches, so each spec sees current values</li>
 *   <li>step starting: resolve the step text and its fragments</li>
 *   <li>execution ending: clean up; never reported as a failure</li>
 * </ul>
 * All other events are acknowledged without doing anything. No hook throws: failures are
 * reported through {@link ExecutionResult} with masked messages.
 */
public class ExecutionLifecycle {

	private static final Logger logger = LoggerFactory.getLogger(ExecutionLifecycle.class);

	private final ParamResolver resolver;

	public ExecutionLifecycle(ParamResolver resolver) {
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
	}

	public ExecutionResult executionStarting() {
		try {
			resolver.initialize();
			return ExecutionResult.ok();
		}
		catch (RuntimeException e) {
			logger.error("Failed to initialize param resolver: {}", SecretMasker.mask(e.getMessage()));
			return ExecutionResult.failure("Failed to initialize param resolver: " + e.getMessage());
		}
	}

	public ExecutionResult specStarting() {
		try {
			resolver.refreshCaches();
			return ExecutionResult.ok();
		}
		catch (RuntimeException e) {
			return ExecutionResult.failure("Failed to refresh caches: " + e.getMessage());
		}
	}

	public StepOutcome stepStarting(ExecutionStep step) {
		if (step == null || step.actualText() == null || step.actualText().isEmpty()) {
			return new StepOutcome(ExecutionResult.ok(), step);
		}
		try {
			String resolvedText = resolver.resolveText(step.actualText());
			List<String> fragments = new ArrayList<>(step.fragments().size());
			for (String fragment : step.fragments()) {
				fragments.add(resolver.resolveText(fragment));
			}
			return new StepOutcome(ExecutionResult.ok(), new ExecutionStep(resolvedText, resolvedText, fragments));
		}
		catch (RuntimeException e) {
			String message = SecretMasker.mask(e.getMessage());
			logger.error("Error resolving step parameters: {}", message);
			return new StepOutcome(ExecutionResult.failure("Parameter resolution failed: " + message), step);
		}
	}

	public ExecutionResult stepEnding() {
		return ExecutionResult.ok();
	}

	public ExecutionResult scenarioStarting() {
		return ExecutionResult.ok();
	}

	public ExecutionResult scenarioEnding() {
		return ExecutionResult.ok();
	}

	public ExecutionResult specEnding() {
		return ExecutionResult.ok();
	}

	public ExecutionResult suiteResult() {
		return ExecutionResult.ok();
	}

	public ExecutionResult executionEnding() {
		try {
			resolver.cleanup();
		}
		catch (RuntimeException e) {
			logger.warn("Cleanup failed at end of execution: {}", SecretMasker.mask(e.getMessage()));
		}
		return ExecutionResult.ok();
	}
}
