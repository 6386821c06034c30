package org.javai.extparams.source.aws;

import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Parsed AWS Secrets Manager key.
 * <p>
 * Formats: {@code name}, {@code name:field}, {@code name@<versionId>:field} where the version id
 * is a UUID, and {@code name@<STAGE>:field} for a version stage such as {@code AWSPENDING}.
 */
record AwsSecretKey(String secretName, String versionId, String versionStage, String field) {

	private static final Pattern VERSION_ID = Pattern.compile("^[a-fA-F0-9-]{36}$");

	static AwsSecretKey parse(String key) {
		if (key.contains("@")) {
			String name = StringUtils.substringBefore(key, "@");
			String versionPart = StringUtils.substringAfter(key, "@");
			String version = StringUtils.substringBefore(versionPart, ":");
			String field = versionPart.contains(":") ? StringUtils.substringAfter(versionPart, ":") : null;
			if (VERSION_ID.matcher(version).matches()) {
				return new AwsSecretKey(name, version, null, emptyToNull(field));
			}
			return new AwsSecretKey(name, null, emptyToNull(version), emptyToNull(field));
		}
		String name = StringUtils.substringBefore(key, ":");
		String field = key.contains(":") ? StringUtils.substringAfter(key, ":") : null;
		return new AwsSecretKey(name, null, null, emptyToNull(field));
	}

	/**
	 * Backend cache identity: {@code name:versionId}, {@code name:stage} or {@code name:AWSCURRENT}.
	 */
	String cacheKey() {
		String version = versionId != null ? versionId : versionStage != null ? versionStage : "AWSCURRENT";
		return secretName + ":" + version;
	}

	private static String emptyToNull(String value) {
		return StringUtils.isEmpty(value) ? null : value;
	}
}
