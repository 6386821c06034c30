package org.javai.extparams.source.aws;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.auth.StsAssumeRoleCredentialsProvider;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.utils.SdkAutoCloseable;

/**
 * Builds the Secrets Manager client for {@link AwsSecretsSource.Options}.
 * <p>
 * Credentials are chosen in this order: explicit access key (with optional session token), named
 * profile, then the SDK default chain. A configured {@code roleArn} is assumed through STS on top
 * of whichever base credentials were chosen.
 */
final class SecretsManagerClients {

	private SecretsManagerClients() {
	}

	static SecretsManagerConnection create(AwsSecretsSource.Options options) {
		Region region = Region.of(options.region());
		ClientOverrideConfiguration overrides = ClientOverrideConfiguration.builder()
				.apiCallTimeout(options.timeout())
				.retryPolicy(RetryPolicy.builder().numRetries(options.retries()).build())
				.build();

		List<SdkAutoCloseable> resources = new ArrayList<>();
		AwsCredentialsProvider credentials = baseCredentials(options);
		if (StringUtils.isNotBlank(options.roleArn())) {
			StsClient sts = StsClient.builder()
					.region(region)
					.credentialsProvider(credentials)
					.overrideConfiguration(overrides)
					.build();
			StsAssumeRoleCredentialsProvider assumed = assumeRole(options.roleArn(), sts);
			resources.add(assumed);
			resources.add(sts);
			credentials = assumed;
		}

		try {
			SecretsManagerClient client = SecretsManagerClient.builder()
					.region(region)
					.credentialsProvider(credentials)
					.overrideConfiguration(overrides)
					.build();
			return new SecretsManagerConnection(client, resources);
		}
		catch (RuntimeException e) {
			resources.forEach(SdkAutoCloseable::close);
			throw e;
		}
	}

	static AwsCredentialsProvider baseCredentials(AwsSecretsSource.Options options) {
		if (StringUtils.isNotBlank(options.accessKeyId()) && StringUtils.isNotBlank(options.secretAccessKey())) {
			if (StringUtils.isNotBlank(options.sessionToken())) {
				return StaticCredentialsProvider.create(AwsSessionCredentials.create(
						options.accessKeyId(), options.secretAccessKey(), options.sessionToken()));
			}
			return StaticCredentialsProvider.create(
					AwsBasicCredentials.create(options.accessKeyId(), options.secretAccessKey()));
		}
		if (StringUtils.isNotBlank(options.profile())) {
			return ProfileCredentialsProvider.create(options.profile());
		}
		return DefaultCredentialsProvider.create();
	}

	private static StsAssumeRoleCredentialsProvider assumeRole(String roleArn, StsClient sts) {
		AssumeRoleRequest request = AssumeRoleRequest.builder()
				.roleArn(roleArn)
				.roleSessionName("gauge-external-params-" + Instant.now().toEpochMilli())
				.build();
		return StsAssumeRoleCredentialsProvider.builder()
				.stsClient(sts)
				.refreshRequest(request)
				.build();
	}
}
