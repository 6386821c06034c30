package org.javai.extparams.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.extparams.ParamResolver;
import org.javai.extparams.config.ResolverConfig;
import org.javai.extparams.config.SourceConfig;
import org.javai.extparams.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for {@link Preprocessor} batch runs over a temporary spec tree.
 */
@DisplayName("Preprocessor")
class PreprocessorTest {

	private static final ResolverConfig ENV_ONLY = new ResolverConfig(Duration.ofSeconds(60), Map.of(
			"env", SourceConfig.enabled(Map.of()),
			"file", SourceConfig.disabled(),
			"http", SourceConfig.disabled()));

	private static final String VALID_SPEC = """
			# Login
			## Successful login
			* Log in as "<user:env#TEST_USER>" with password "<pw:env#TEST_PASSWORD|changeme>"
			""";
	private static final String BROKEN_SPEC = """
			# Orders
			* Open "<url:env#ORDERS_URL>"
			""";

	@TempDir
	Path root;

	private Path specDir;
	private ParamResolver resolver;
	private Preprocessor preprocessor;

	@BeforeEach
	void setUp() throws IOException {
		specDir = Files.createDirectories(root.resolve("specs"));
		resolver = ParamResolver.builder()
				.config(ENV_ONLY)
				.environment(Map.of("TEST_USER", "alice"))
				.workingDirectory(root)
				.build();
		preprocessor = new Preprocessor(resolver);
	}

	@Nested
	@DisplayName("Process directory")
	class ProcessDirectory {

		@Test
		@DisplayName("resolves valid documents and copies broken ones through")
		void resolvesValidDocumentsAndCopiesBrokenOnesThrough() throws IOException {
			Files.writeString(specDir.resolve("login.spec"), VALID_SPEC);
			Files.writeString(specDir.resolve("orders.spec"), BROKEN_SPEC);
			Path outDir = root.resolve("specs_resolved");

			BatchReport report = preprocessor.processDirectory(specDir, outDir);

			assertThat(report.resolvedFiles()).isEqualTo(1);
			assertThat(report.failures()).singleElement().satisfies(failure -> {
				assertThat(failure.file()).isEqualTo(specDir.resolve("orders.spec"));
				assertThat(failure.getMessage()).contains("ORDERS_URL");
			});
			assertThat(report.succeeded()).isFalse();
			assertThat(Files.readString(outDir.resolve("login.spec")))
					.contains("Log in as \"alice\" with password \"changeme\"");
			assertThat(Files.readString(outDir.resolve("orders.spec"))).isEqualTo(BROKEN_SPEC);
		}

		@Test
		@DisplayName("mirrors tree and copies other files unchanged")
		void mirrorsTreeAndCopiesOtherFilesUnchanged() throws IOException {
			Path nested = Files.createDirectories(specDir.resolve("checkout/payments"));
			Files.writeString(nested.resolve("README.md"), "User <u:env#TEST_USER>");
			Files.writeString(nested.resolve("data.csv"), "id,<u:env#TEST_USER>");
			Files.writeString(specDir.resolve("concepts.cpt"), "* concept");
			Path outDir = root.resolve("out");

			BatchReport report = preprocessor.processDirectory(specDir, outDir);

			assertThat(report.succeeded()).isTrue();
			assertThat(report.resolvedFiles()).isEqualTo(1);
			assertThat(report.copiedFiles()).isEqualTo(2);
			assertThat(Files.readString(outDir.resolve("checkout/payments/README.md"))).isEqualTo("User alice");
			assertThat(Files.readString(outDir.resolve("checkout/payments/data.csv"))).isEqualTo("id,<u:env#TEST_USER>");
			assertThat(outDir.resolve("concepts.cpt")).exists();
		}

		@Test
		@DisplayName("output inside spec directory is not reprocessed")
		void outputInsideSpecDirectoryIsNotReprocessed() throws IOException {
			Files.writeString(specDir.resolve("login.spec"), VALID_SPEC);
			Path outDir = specDir.resolve("resolved");

			preprocessor.processDirectory(specDir, outDir);
			BatchReport second = preprocessor.processDirectory(specDir, outDir);

			assertThat(second.resolvedFiles()).isEqualTo(1);
			assertThat(outDir.resolve("resolved")).doesNotExist();
		}

		@Test
		@DisplayName("logs progress and cleans up resolver")
		void logsProgressAndCleansUpResolver() throws IOException {
			Files.writeString(specDir.resolve("orders.spec"), BROKEN_SPEC);

			try (LogCaptorAppender logs = LogCaptorAppender.create(Preprocessor.class, Level.INFO)) {
				preprocessor.processDirectory(specDir, root.resolve("out"));

				assertThat(logs.messages(Level.INFO)).anyMatch(m -> m.startsWith("Processing spec file"));
				assertThat(logs.messages(Level.ERROR)).singleElement()
						.satisfies(m -> assertThat(m).startsWith("Failed to process spec file"));
				assertThat(logs.messages(Level.WARN)).anyMatch(
						m -> m.startsWith("Copied original file due to processing error"));
			}
			assertThat(resolver.isInitialized()).isFalse();
		}

		@Test
		@DisplayName("missing spec directory fails the run")
		void missingSpecDirectoryFailsTheRun() {
			assertThatThrownBy(() -> preprocessor.processDirectory(root.resolve("absent"), root.resolve("out")))
					.isInstanceOf(PreprocessingException.class)
					.hasMessageStartingWith("Preprocessing failed:");
		}

		@Test
		@DisplayName("interrupted run stops between files")
		void interruptedRunStopsBetweenFiles() throws IOException {
			Files.writeString(specDir.resolve("a.spec"), VALID_SPEC);
			Files.writeString(specDir.resolve("b.spec"), VALID_SPEC);

			Thread.currentThread().interrupt();
			BatchReport report;
			try {
				report = preprocessor.processDirectory(specDir, root.resolve("out"));
			}
			finally {
				Thread.interrupted();
			}

			assertThat(report.interrupted()).isTrue();
			assertThat(report.succeeded()).isFalse();
			assertThat(report.resolvedFiles()).isZero();
		}
	}

	@Test
	@DisplayName("process file writes beside input by default")
	void processFileWritesBesideInputByDefault() throws IOException {
		Path spec = specDir.resolve("login.spec");
		Files.writeString(spec, VALID_SPEC);

		BatchReport report = preprocessor.processFile(spec);

		assertThat(report.output()).isEqualTo(specDir.resolve("login_resolved.spec"));
		assertThat(Files.readString(report.output())).contains("alice");
		assertThat(report.succeeded()).isTrue();
	}

	@Test
	@DisplayName("validate specs reports without writing")
	void validateSpecsReportsWithoutWriting() throws IOException {
		Files.writeString(specDir.resolve("login.spec"), VALID_SPEC);
		Files.writeString(specDir.resolve("orders.spec"), BROKEN_SPEC);
		Files.writeString(specDir.resolve("notes.txt"), "<x:env#NOPE>");

		ValidationReport report = preprocessor.validateSpecs(specDir);

		assertThat(report.totalFiles()).isEqualTo(2);
		assertThat(report.processedFiles()).isEqualTo(1);
		assertThat(report.isValid()).isFalse();
		assertThat(report.errors()).extracting(SpecValidationException::file)
				.containsExactly(specDir.resolve("orders.spec"));
		assertThat(root.resolve("specs_resolved")).doesNotExist();
	}

	@Test
	@DisplayName("statistics count placeholders per source")
	void statisticsCountPlaceholdersPerSource() throws IOException {
		Files.writeString(specDir.resolve("a.spec"), "<a:env#A> <b:vault#app/db:pw> <c:env#C>");
		Files.writeString(specDir.resolve("b.md"), "<d:file#cfg.json#x>");
		Files.writeString(specDir.resolve("c.spec"), "no placeholders");

		PlaceholderStatistics stats = preprocessor.placeholderStatistics(specDir);

		assertThat(stats.totalFiles()).isEqualTo(3);
		assertThat(stats.filesWithPlaceholders()).isEqualTo(2);
		assertThat(stats.totalPlaceholders()).isEqualTo(4);
		assertThat(stats.sourceCounts()).containsExactly(Map.entry("env", 2), Map.entry("vault", 1),
				Map.entry("file", 1));
		assertThat(stats.mostUsedSources().get(0)).isEqualTo(new PlaceholderStatistics.SourceCount("env", 2));
	}

	@Test
	@DisplayName("find placeholders on missing file fails")
	void findPlaceholdersOnMissingFileFails() {
		assertThatThrownBy(() -> preprocessor.findPlaceholders(specDir.resolve("none.spec")))
				.isInstanceOf(PreprocessingException.class)
				.hasMessageStartingWith("Failed to analyze file");
	}

	@Test
	@DisplayName("spec file naming")
	void specFileNaming() {
		assertThat(SpecFiles.isSpecFile(Path.of("a/B.SPEC"))).isTrue();
		assertThat(SpecFiles.isSpecFile(Path.of("a/readme.md"))).isTrue();
		assertThat(SpecFiles.isSpecFile(Path.of("a/data.csv"))).isFalse();
		assertThat(SpecFiles.defaultOutputPath(Path.of("specs/login.spec")))
				.isEqualTo(Path.of("specs/login_resolved.spec"));
	}
}
