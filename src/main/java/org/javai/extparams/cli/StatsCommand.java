package org.javai.extparams.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.javai.extparams.batch.PlaceholderStatistics;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Reports placeholder usage in a spec tree.
 */
@Command(name = "stats", description = "Show placeholder usage statistics")
class StatsCommand implements Callable<Integer> {

	@ParentCommand
	ExternalParamsCli parent;

	@Spec
	CommandSpec spec;

	@Option(names = "--spec-dir", defaultValue = "specs", description = "Directory containing spec files")
	Path specDir;

	@Override
	public Integer call() {
		PrintWriter out = spec.commandLine().getOut();
		PlaceholderStatistics stats = parent.preprocessor().placeholderStatistics(specDir);
		out.printf("Spec files: %d (%d with placeholders)%n", stats.totalFiles(), stats.filesWithPlaceholders());
		out.printf("Placeholders: %d%n", stats.totalPlaceholders());
		stats.mostUsedSources().forEach(count -> out.printf("  %-8s %d%n", count.source(), count.count()));
		return 0;
	}
}
