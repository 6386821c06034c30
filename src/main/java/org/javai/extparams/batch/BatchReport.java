package org.javai.extparams.batch;

import java.nio.file.Path;
import java.util.List;

/**
 * Summary of a batch run.
 *
 * @param resolvedFiles spec documents written with placeholders resolved
 * @param copiedFiles non-spec files copied unchanged
 * @param failures spec documents that could not be resolved and were copied through as is
 * @param interrupted whether the run stopped early because the thread was interrupted
 */
public record BatchReport(Path input, Path output, int resolvedFiles, int copiedFiles,
		List<SpecValidationException> failures, boolean interrupted) {

	public BatchReport {
		failures = List.copyOf(failures);
	}

	/**
	 * True only when every spec document resolved and the run was not interrupted.
	 */
	public boolean succeeded() {
		return failures.isEmpty() && !interrupted;
	}
}
