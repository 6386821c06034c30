package org.javai.extparams.cli;

import java.nio.file.Path;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.javai.extparams.ParamResolver;
import org.javai.extparams.batch.Preprocessor;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Command line entry point.
 *
 * <pre>
 * gauge-external-params preprocess --spec-dir specs --out-dir specs_resolved
 * gauge-external-params validate --spec-dir specs
 * gauge-external-params --config params.json --verbose stats
 * </pre>
 *
 * Exit code 0 means every document resolved; 1 means at least one did not or the run failed.
 */
@Command(
		name = "gauge-external-params",
		mixinStandardHelpOptions = true,
		version = "gauge-external-params 0.1.0",
		description = "Resolves <name:source#key|default> placeholders in spec files from external sources",
		subcommands = {PreprocessCommand.class, ValidateCommand.class, StatsCommand.class}
)
public class ExternalParamsCli implements Runnable {

	static final String LOGGER_ROOT = ParamResolver.class.getPackageName();

	@Option(names = {"--config", "-c"}, description = "Configuration file (default: ./gauge-external-params.json)")
	Path configPath;

	@Option(names = {"--verbose", "-v"}, description = "Enable debug logging")
	boolean verbose;

	@Spec
	CommandSpec spec;

	public static void main(String[] args) {
		System.exit(commandLine().execute(args));
	}

	public static CommandLine commandLine() {
		return new CommandLine(new ExternalParamsCli());
	}

	@Override
	public void run() {
		spec.commandLine().usage(spec.commandLine().getOut());
	}

	Preprocessor preprocessor() {
		if (verbose) {
			enableDebugLogging();
		}
		ParamResolver.Builder builder = ParamResolver.builder();
		if (configPath != null) {
			builder.configPath(configPath);
		}
		return new Preprocessor(builder.build());
	}

	static void enableDebugLogging() {
		Configurator.setRootLevel(Level.DEBUG);
		Configurator.setAllLevels(LOGGER_ROOT, Level.DEBUG);
	}
}
