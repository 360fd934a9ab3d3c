package com.termguide.disambiguation.service.vector;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.termguide.disambiguation.config.GuidanceProperties;
import com.termguide.disambiguation.exception.EmbeddingException;
import com.termguide.disambiguation.service.aws.AwsCredentialsService;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

/**
 * Embeddings from an Amazon Titan text embedding model on Bedrock. Each call is retried with
 * exponential backoff before an {@link EmbeddingException} is raised; callers on the query path
 * turn that into an empty result.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "guidance.embedding.provider", havingValue = "bedrock")
public class BedrockEmbeddingService implements Embedder {

  private static final Set<Integer> TITAN_V2_DIMENSIONS = Set.of(256, 512, 1024);

  private final BedrockRuntimeClient bedrockClient;
  private final ObjectMapper objectMapper;
  private final String embeddingModelId;
  private final Integer requestedDimensions;
  private final int maxRetries;
  private final long retryBaseDelayMs;

  @Autowired
  public BedrockEmbeddingService(
      GuidanceProperties properties,
      AwsCredentialsService awsCredentialsService,
      ObjectMapper objectMapper) {
    this(
        BedrockRuntimeClient.builder()
            .region(Region.of(properties.getEmbedding().getRegion()))
            .credentialsProvider(awsCredentialsService.getCredentialsProvider())
            .overrideConfiguration(
                c ->
                    c.apiCallTimeout(
                        Duration.ofMillis(properties.getEmbedding().getCallTimeoutMs())))
            .build(),
        objectMapper,
        properties);
  }

  BedrockEmbeddingService(
      BedrockRuntimeClient bedrockClient,
      ObjectMapper objectMapper,
      GuidanceProperties properties) {
    this.bedrockClient = bedrockClient;
    this.objectMapper = objectMapper;
    this.embeddingModelId = properties.getEmbedding().getModelId();
    int dimension = properties.getEmbedding().getDimension();
    this.requestedDimensions = TITAN_V2_DIMENSIONS.contains(dimension) ? dimension : null;
    this.maxRetries = Math.max(1, properties.getEmbedding().getMaxRetries());
    this.retryBaseDelayMs = Math.max(0L, properties.getEmbedding().getRetryBaseDelayMs());
    log.info("Bedrock embeddings enabled with model {}", getModelId());
  }

  @Override
  public List<Float> embed(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Cannot embed blank text");
    }
    log.debug(
        "Generating embedding for text: {}", text.substring(0, Math.min(text.length(), 100)));

    RuntimeException lastFailure = null;
    for (int attempt = 0; attempt < maxRetries; attempt++) {
      try {
        return invoke(text);
      } catch (EmbeddingException e) {
        throw e;
      } catch (RuntimeException e) {
        lastFailure = e;
        log.warn(
            "Embedding attempt {}/{} failed: {}", attempt + 1, maxRetries, e.getMessage());
        if (attempt + 1 < maxRetries) {
          backoff(attempt);
        }
      }
    }
    throw new EmbeddingException(
        "Embedding failed after " + maxRetries + " attempts", lastFailure);
  }

  /** Titan embeds one text per request, so a batch is a sequence of single calls. */
  @Override
  public List<List<Float>> embedBatch(List<String> texts) {
    log.debug("Generating embeddings for {} texts", texts.size());
    List<List<Float>> vectors = new ArrayList<>(texts.size());
    for (String text : texts) {
      vectors.add(embed(text));
    }
    return vectors;
  }

  @Override
  public String getModelId() {
    return requestedDimensions == null
        ? embeddingModelId
        : embeddingModelId + "@" + requestedDimensions;
  }

  @PreDestroy
  public void close() {
    bedrockClient.close();
  }

  private List<Float> invoke(String text) {
    String payload;
    try {
      Map<String, Object> requestBody = new LinkedHashMap<>();
      requestBody.put("inputText", text);
      if (requestedDimensions != null) {
        requestBody.put("dimensions", requestedDimensions);
        requestBody.put("normalize", true);
      }
      payload = objectMapper.writeValueAsString(requestBody);
    } catch (IOException e) {
      throw new EmbeddingException("Could not build embedding request", e);
    }

    InvokeModelRequest invokeRequest =
        InvokeModelRequest.builder()
            .modelId(embeddingModelId)
            .contentType("application/json")
            .accept("application/json")
            .body(SdkBytes.fromString(payload, StandardCharsets.UTF_8))
            .build();

    InvokeModelResponse response = bedrockClient.invokeModel(invokeRequest);

    JsonNode embedding;
    try {
      embedding = objectMapper.readTree(response.body().asUtf8String()).path("embedding");
    } catch (IOException e) {
      throw new EmbeddingException("Unreadable embedding response", e);
    }
    if (!embedding.isArray() || embedding.isEmpty()) {
      throw new EmbeddingException("Embedding response has no 'embedding' array");
    }
    List<Float> vector = new ArrayList<>(embedding.size());
    embedding.forEach(value -> vector.add(value.floatValue()));
    return vector;
  }

  private void backoff(int attempt) {
    long delay = retryBaseDelayMs * (1L << attempt);
    if (delay <= 0) {
      return;
    }
    try {
      Thread.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EmbeddingException("Interrupted while backing off", e);
    }
  }
}
