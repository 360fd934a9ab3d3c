package com.termguide.disambiguation.service.vector;

import java.time.Duration;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.termguide.disambiguation.config.GuidanceProperties;
import com.termguide.disambiguation.exception.CapabilityUnavailableException;
import com.termguide.disambiguation.service.aws.AwsCredentialsService;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.BucketAlreadyOwnedByYouException;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Collections persisted in S3. The name of the live collection is kept in an {@code ACTIVE} object
 * under the prefix so a restarted process can reopen it instead of re-embedding the corpus.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "guidance.vector-store.type", havingValue = "s3")
public class S3VectorIndexFactory implements VectorIndexFactory {

  private static final String ACTIVE_POINTER = "ACTIVE";

  private final S3Client s3Client;
  private final ObjectMapper objectMapper;
  private final String bucket;
  private final String prefix;
  private final String region;

  @Autowired
  public S3VectorIndexFactory(
      GuidanceProperties properties,
      AwsCredentialsService awsCredentialsService,
      ObjectMapper objectMapper) {
    this(
        S3Client.builder()
            .region(Region.of(properties.getVectorStore().getRegion()))
            .credentialsProvider(awsCredentialsService.getCredentialsProvider())
            .overrideConfiguration(
                c ->
                    c.apiCallTimeout(
                        Duration.ofMillis(properties.getVectorStore().getCallTimeoutMs())))
            .build(),
        objectMapper,
        properties);
  }

  S3VectorIndexFactory(
      S3Client s3Client, ObjectMapper objectMapper, GuidanceProperties properties) {
    String configuredBucket = properties.getVectorStore().getBucket();
    if (configuredBucket == null || configuredBucket.isBlank()) {
      throw new CapabilityUnavailableException(
          "guidance.vector-store.bucket must be set when guidance.vector-store.type=s3");
    }
    this.s3Client = s3Client;
    this.objectMapper = objectMapper;
    this.bucket = configuredBucket;
    this.prefix = properties.getVectorStore().getPrefix();
    this.region = properties.getVectorStore().getRegion();
    ensureBucketExists();
  }

  @Override
  public VectorIndex create(String collectionName) {
    S3VectorIndex index = new S3VectorIndex(collectionName, s3Client, objectMapper, bucket, prefix);
    index.clear();
    return index;
  }

  @Override
  public Optional<VectorIndex> openActive() {
    String activeName;
    try {
      activeName =
          s3Client
              .getObjectAsBytes(
                  GetObjectRequest.builder().bucket(bucket).key(activePointerKey()).build())
              .asUtf8String()
              .trim();
    } catch (NoSuchKeyException e) {
      log.info("No active guidance collection recorded in s3://{}/{}", bucket, prefix);
      return Optional.empty();
    }
    if (activeName.isEmpty()) {
      return Optional.empty();
    }
    S3VectorIndex index = new S3VectorIndex(activeName, s3Client, objectMapper, bucket, prefix);
    return index.reload() ? Optional.of(index) : Optional.empty();
  }

  @Override
  public void markActive(VectorIndex index) {
    s3Client.putObject(
        PutObjectRequest.builder()
            .bucket(bucket)
            .key(activePointerKey())
            .contentType("text/plain")
            .build(),
        RequestBody.fromString(index.getName()));
    log.info("Marked collection {} active in s3://{}/{}", index.getName(), bucket, prefix);
  }

  @Override
  public void drop(VectorIndex index) {
    if (index instanceof S3VectorIndex) {
      ((S3VectorIndex) index).deletePersisted();
    } else {
      index.clear();
    }
  }

  @PreDestroy
  public void close() {
    s3Client.close();
  }

  private String activePointerKey() {
    return prefix + "/" + ACTIVE_POINTER;
  }

  private void ensureBucketExists() {
    try {
      s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
      log.debug("S3 bucket {} exists", bucket);
    } catch (NoSuchBucketException e) {
      createBucket();
    } catch (S3Exception e) {
      if (e.statusCode() == 301) {
        throw new CapabilityUnavailableException(
            String.format(
                "Bucket '%s' exists in a region other than '%s'; configure guidance.vector-store.region",
                bucket, region),
            e);
      }
      log.warn("Could not check bucket {}: {}. Attempting to create it", bucket, e.getMessage());
      createBucket();
    }
  }

  private void createBucket() {
    try {
      CreateBucketRequest.Builder request = CreateBucketRequest.builder().bucket(bucket);
      if (!"us-east-1".equals(region)) {
        request.createBucketConfiguration(
            CreateBucketConfiguration.builder().locationConstraint(region).build());
      }
      s3Client.createBucket(request.build());
      log.info("Created S3 bucket '{}' in region '{}'", bucket, region);
    } catch (BucketAlreadyOwnedByYouException e) {
      log.info("Bucket '{}' already exists and is owned by this account", bucket);
    } catch (S3Exception e) {
      throw new CapabilityUnavailableException("Failed to create S3 bucket " + bucket, e);
    }
  }
}
