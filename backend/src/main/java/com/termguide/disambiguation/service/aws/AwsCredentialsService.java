package com.termguide.disambiguation.service.aws;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;

/**
 * Resolves the credentials used by the Bedrock embedder and the S3 vector store. Static keys from
 * configuration win; otherwise the SDK default chain (environment, profile, instance role) is used.
 */
@Slf4j
@Service
public class AwsCredentialsService {

  private final AwsCredentialsProvider credentialsProvider;
  private final boolean staticCredentials;

  public AwsCredentialsService(
      @Value("${aws.access-key-id:}") String accessKeyId,
      @Value("${aws.secret-access-key:}") String secretAccessKey) {
    if (isSet(accessKeyId) && isSet(secretAccessKey)) {
      this.credentialsProvider =
          StaticCredentialsProvider.create(
              AwsBasicCredentials.create(accessKeyId, secretAccessKey));
      this.staticCredentials = true;
      log.info("Using configured static AWS credentials");
    } else {
      this.credentialsProvider = DefaultCredentialsProvider.create();
      this.staticCredentials = false;
      log.debug("No static AWS credentials configured, using the default provider chain");
    }
  }

  public AwsCredentialsProvider getCredentialsProvider() {
    return credentialsProvider;
  }

  public boolean isUsingStaticCredentials() {
    return staticCredentials;
  }

  private static boolean isSet(String value) {
    return value != null && !value.trim().isEmpty();
  }
}
