package org.javai.extparams.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.javai.extparams.batch.BatchReport;
import org.javai.extparams.batch.PreprocessingException;
import org.javai.extparams.batch.SpecValidationException;
import org.javai.extparams.config.ConfigurationException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Resolves a spec tree into an output tree.
 */
@Command(name = "preprocess", description = "Preprocess spec files to resolve placeholders")
class PreprocessCommand implements Callable<Integer> {

	@ParentCommand
	ExternalParamsCli parent;

	@Spec
	CommandSpec spec;

	@Option(names = "--spec-dir", defaultValue = "specs", description = "Directory containing spec files")
	Path specDir;

	@Option(names = "--out-dir", defaultValue = "specs_resolved", description = "Output directory for processed specs")
	Path outDir;

	@Override
	public Integer call() {
		PrintWriter out = spec.commandLine().getOut();
		PrintWriter err = spec.commandLine().getErr();
		BatchReport report;
		try {
			report = parent.preprocessor().processDirectory(specDir, outDir);
		}
		catch (PreprocessingException | ConfigurationException e) {
			err.println("Preprocessing failed: " + e.getMessage());
			return 1;
		}

		for (SpecValidationException failure : report.failures()) {
			err.println("Unresolved: " + failure.file() + " - " + failure.getMessage());
		}
		if (report.interrupted()) {
			err.println("Preprocessing interrupted");
		}
		out.printf("Preprocessing completed. Output written to %s (%d resolved, %d copied, %d failed)%n", outDir,
				report.resolvedFiles(), report.copiedFiles(), report.failures().size());
		return report.succeeded() ? 0 : 1;
	}
}
