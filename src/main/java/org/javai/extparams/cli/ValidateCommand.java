package org.javai.extparams.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.javai.extparams.batch.SpecValidationException;
import org.javai.extparams.batch.ValidationReport;
import org.javai.extparams.config.ConfigurationException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Checks that every placeholder in a spec tree resolves, without writing anything.
 */
@Command(name = "validate", description = "Check that all placeholders in spec files resolve")
class ValidateCommand implements Callable<Integer> {

	@ParentCommand
	ExternalParamsCli parent;

	@Spec
	CommandSpec spec;

	@Option(names = "--spec-dir", defaultValue = "specs", description = "Directory containing spec files")
	Path specDir;

	@Override
	public Integer call() {
		PrintWriter out = spec.commandLine().getOut();
		ValidationReport report;
		try {
			report = parent.preprocessor().validateSpecs(specDir);
		}
		catch (ConfigurationException e) {
			spec.commandLine().getErr().println("Validation failed: " + e.getMessage());
			return 1;
		}

		out.printf("Validated %d of %d spec file(s)%n", report.processedFiles(), report.totalFiles());
		for (SpecValidationException error : report.errors()) {
			out.println("  FAILED " + error.file() + ": " + error.getMessage());
		}
		return report.isValid() ? 0 : 1;
	}
}
