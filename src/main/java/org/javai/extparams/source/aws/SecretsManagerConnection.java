package org.javai.extparams.source.aws;

import java.util.List;
import java.util.Objects;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.utils.SdkAutoCloseable;

/**
 * A Secrets Manager client together with the SDK resources its credentials were built from, such
 * as the STS client behind an assumed role. Closing the connection closes all of them.
 *
 * @param client the Secrets Manager client
 * @param resources credential resources, closed after the client in list order
 */
public record SecretsManagerConnection(SecretsManagerClient client, List<SdkAutoCloseable> resources)
		implements SdkAutoCloseable {

	public SecretsManagerConnection {
		Objects.requireNonNull(client, "client must not be null");
		resources = resources != null ? List.copyOf(resources) : List.of();
	}

	public static SecretsManagerConnection of(SecretsManagerClient client) {
		return new SecretsManagerConnection(client, List.of());
	}

	@Override
	public void close() {
		client.close();
		resources.forEach(SdkAutoCloseable::close);
	}
}
