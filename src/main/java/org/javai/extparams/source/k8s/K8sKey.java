package org.javai.extparams.source.k8s;

/**
 * Parsed k8s source key: {@code type:[namespace/]name[:field]} where type is {@code secret} or
 * {@code configmap}. Everything after the second colon is the field.
 */
record K8sKey(String type, String namespace, String name, String field) {

	static K8sKey parse(String key) {
		String[] parts = key.split(":", 3);
		if (parts.length < 2 || parts[1].isEmpty()) {
			throw new IllegalArgumentException(
					"Invalid key format. Expected 'type:name' or 'type:name:field', got: " + key);
		}
		String name = parts[1];
		String namespace = null;
		int slash = name.indexOf('/');
		if (slash >= 0) {
			namespace = name.substring(0, slash);
			name = name.substring(slash + 1);
		}
		String field = parts.length > 2 && !parts[2].isEmpty() ? parts[2] : null;
		return new K8sKey(parts[0], namespace, name, field);
	}
}
