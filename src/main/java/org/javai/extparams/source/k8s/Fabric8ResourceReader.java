package org.javai.extparams.source.k8s;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.javai.extparams.source.SourceInitializationException;
import org.javai.extparams.source.SourceType;

/**
 * {@link KubernetesResourceReader} backed by the fabric8 client.
 * <p>
 * Uses the configured kubeconfig file when one is given, otherwise fabric8's auto-configuration
 * (default kubeconfig, then in-cluster service account).
 */
public class Fabric8ResourceReader implements KubernetesResourceReader {

	private final KubernetesClient client;

	Fabric8ResourceReader(KubernetesClient client) {
		this.client = client;
	}

	public static Fabric8ResourceReader connect(K8sSource.Options options) {
		Config config = loadConfig(options);
		int timeoutMillis = (int) options.timeout().toMillis();
		config.setRequestTimeout(timeoutMillis);
		config.setConnectionTimeout(timeoutMillis);
		return new Fabric8ResourceReader(new KubernetesClientBuilder().withConfig(config).build());
	}

	private static Config loadConfig(K8sSource.Options options) {
		String context = StringUtils.defaultIfBlank(options.context(), null);
		if (StringUtils.isBlank(options.kubeconfig())) {
			return Config.autoConfigure(context);
		}
		try {
			String contents = Files.readString(Path.of(options.kubeconfig()));
			return Config.fromKubeconfig(context, contents, options.kubeconfig());
		}
		catch (IOException e) {
			throw new SourceInitializationException(SourceType.K8S,
					"Failed to read kubeconfig '" + options.kubeconfig() + "': " + e.getMessage(), e);
		}
	}

	@Override
	public void verifyConnection() {
		client.namespaces().list();
	}

	@Override
	public Secret readSecret(String namespace, String name) {
		return client.secrets().inNamespace(namespace).withName(name).get();
	}

	@Override
	public ConfigMap readConfigMap(String namespace, String name) {
		return client.configMaps().inNamespace(namespace).withName(name).get();
	}

	@Override
	public List<Secret> listSecrets(String namespace) {
		return client.secrets().inNamespace(namespace).list().getItems();
	}

	@Override
	public List<ConfigMap> listConfigMaps(String namespace) {
		return client.configMaps().inNamespace(namespace).list().getItems();
	}

	@Override
	public List<Namespace> listNamespaces() {
		return client.namespaces().list().getItems();
	}

	@Override
	public void close() {
		client.close();
	}
}
