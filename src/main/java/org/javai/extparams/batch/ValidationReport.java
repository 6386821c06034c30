package org.javai.extparams.batch;

import java.util.List;

/**
 * Result of a dry run over a spec directory.
 *
 * @param totalFiles spec documents found
 * @param processedFiles spec documents that resolved completely
 * @param errors one entry per document that did not resolve, or per unreadable directory
 */
public record ValidationReport(int totalFiles, int processedFiles, List<SpecValidationException> errors) {

	public ValidationReport {
		errors = List.copyOf(errors);
	}

	public boolean isValid() {
		return errors.isEmpty();
	}
}
