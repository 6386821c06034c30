package org.javai.extparams.source.k8s;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.Secret;
import java.util.List;

/**
 * The slice of the Kubernetes API the k8s source needs. Read methods return {@code null} for a
 * resource that does not exist and throw
 * {@link io.fabric8.kubernetes.client.KubernetesClientException} for any other API failure.
 */
public interface KubernetesResourceReader extends AutoCloseable {

	/**
	 * Makes an authenticated call; bad credentials fail here.
	 */
	void verifyConnection();

	Secret readSecret(String namespace, String name);

	ConfigMap readConfigMap(String namespace, String name);

	List<Secret> listSecrets(String namespace);

	List<ConfigMap> listConfigMaps(String namespace);

	List<Namespace> listNamespaces();

	@Override
	void close();
}
