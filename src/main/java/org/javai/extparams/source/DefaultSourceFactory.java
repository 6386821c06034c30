package org.javai.extparams.source;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.javai.extparams.config.SourceConfig;
import org.javai.extparams.source.aws.AwsSecretsSource;
import org.javai.extparams.source.env.EnvSource;
import org.javai.extparams.source.file.FileSource;
import org.javai.extparams.source.http.HttpSource;
import org.javai.extparams.source.k8s.K8sSource;
import org.javai.extparams.source.vault.VaultSource;

/**
 * Maps each {@link SourceType} to its production adapter.
 * <p>
 * The environment table and working directory are handed in explicitly; adapters never read
 * process-wide state themselves.
 */
public class DefaultSourceFactory implements SourceFactory {

	private final Map<String, String> environment;
	private final Path workingDirectory;

	public DefaultSourceFactory(Map<String, String> environment, Path workingDirectory) {
		this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment must not be null"));
		this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
	}

	@Override
	public ParamSource create(SourceType type, SourceConfig config) {
		return switch (type) {
			case ENV -> new EnvSource(config, environment);
			case FILE -> new FileSource(config, workingDirectory);
			case VAULT -> new VaultSource(VaultSource.Options.from(config, environment));
			case AWS -> new AwsSecretsSource(AwsSecretsSource.Options.from(config, environment));
			case K8S -> new K8sSource(K8sSource.Options.from(config));
			case HTTP -> new HttpSource(HttpSource.Options.from(config));
		};
	}
}
