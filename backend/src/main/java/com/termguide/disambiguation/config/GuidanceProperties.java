package com.termguide.disambiguation.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tunables for the guidance engine, bound from the {@code guidance.*} namespace. Every value has a
 * working default so the engine can run from an empty configuration; {@link #validate()} rejects
 * combinations that would make the confidence gate or the penalty meaningless.
 */
@Data
@Component
@ConfigurationProperties(prefix = "guidance")
public class GuidanceProperties {

  public static final int NEUTRAL_PRIORITY = 5;

  private Thresholds thresholds = new Thresholds();
  private NegativeAnchor negativeAnchor = new NegativeAnchor();
  private Index index = new Index();
  private VectorStore vectorStore = new VectorStore();
  private Embedding embedding = new Embedding();
  private Query query = new Query();
  private Bulk bulk = new Bulk();
  private Session session = new Session();
  private Aggregation aggregation = new Aggregation();

  /** Genre tag to routing entry. Routing only biases ranking, it never filters. */
  private Map<String, GenreRoute> routing = new LinkedHashMap<>();

  private double routingBoost = 0.03;

  /** Fallback priorities for categories whose corpus section does not declare one. */
  private Map<String, Integer> categoryPriorities = new LinkedHashMap<>();

  private List<String> warnCategories = new ArrayList<>(List.of("false_cognates"));

  private Validation validation = new Validation();

  @PostConstruct
  public void validate() {
    requireUnit("guidance.thresholds.inject", thresholds.getInject());
    requireUnit("guidance.thresholds.log", thresholds.getLog());
    if (thresholds.getLog() > thresholds.getInject()) {
      throw new IllegalStateException(
          String.format(
              "guidance.thresholds.log (%.3f) must not exceed guidance.thresholds.inject (%.3f)",
              thresholds.getLog(), thresholds.getInject()));
    }
    requireUnit("guidance.negative-anchor.threshold", negativeAnchor.getThreshold());
    requireUnit("guidance.negative-anchor.penalty", negativeAnchor.getPenalty());
    requireUnit("guidance.aggregation.score", aggregation.getScore());
    if (aggregation.getScore() >= thresholds.getInject()) {
      throw new IllegalStateException(
          "guidance.aggregation.score must stay below guidance.thresholds.inject");
    }
    requireUnit("guidance.bulk.default-min-confidence", bulk.getDefaultMinConfidence());
    requireUnit("guidance.query.context-indicator-boost", query.getContextIndicatorBoost());
    requireUnit("guidance.routing-boost", routingBoost);
    requirePositive("guidance.index.batch-size", index.getBatchSize());
    requirePositive("guidance.query.top-k", query.getTopK());
    requirePositive("guidance.bulk.concurrency", bulk.getConcurrency());
    requirePositive("guidance.embedding.dimension", embedding.getDimension());
    requirePositive("guidance.session.max-sessions", session.getMaxSessions());
    requirePositive("guidance.session.max-entries", session.getMaxEntries());
    if (bulk.getDefaultMaxApiCalls() < 0) {
      throw new IllegalStateException("guidance.bulk.default-max-api-calls must be >= 0");
    }
    if (bulk.getEmbeddingCallsPerSecond() < 0) {
      throw new IllegalStateException("guidance.bulk.embedding-calls-per-second must be >= 0");
    }
  }

  /** Priority used for ranking when the corpus does not declare one for the category. */
  public int priorityFor(String category) {
    return categoryPriorities.getOrDefault(category, NEUTRAL_PRIORITY);
  }

  private static void requireUnit(String name, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
      throw new IllegalStateException(name + " must be within [0, 1] but was " + value);
    }
  }

  private static void requirePositive(String name, long value) {
    if (value <= 0) {
      throw new IllegalStateException(name + " must be positive but was " + value);
    }
  }

  @Data
  public static class Thresholds {
    private double inject = 0.80;
    private double log = 0.65;
  }

  @Data
  public static class NegativeAnchor {
    private double threshold = 0.82;
    private double penalty = 0.25;
  }

  @Data
  public static class Index {
    private int batchSize = 50;
    private boolean buildOnStartup = true;
    private String corpusLocation = "classpath:corpus/guidance-corpus.json";
    private String collectionPrefix = "guidance";
  }

  @Data
  public static class VectorStore {
    /** {@code memory} or {@code s3}. */
    private String type = "memory";

    private String bucket = "";
    private String prefix = "guidance-index";
    private String region = "us-east-1";
    private long callTimeoutMs = 10000;
  }

  @Data
  public static class Embedding {
    /** {@code hashing} or {@code bedrock}. */
    private String provider = "hashing";

    private String modelId = "amazon.titan-embed-text-v2:0";
    private int dimension = 384;
    private int maxRetries = 3;
    private long retryBaseDelayMs = 1000;
    private long callTimeoutMs = 15000;
    private String region = "us-east-1";
  }

  @Data
  public static class Query {
    private int topK = 5;
    private double contextIndicatorBoost = 0.05;
  }

  @Data
  public static class Bulk {
    private int defaultMaxApiCalls = 20;
    private double defaultMinConfidence = 0.65;
    private int concurrency = 6;
    private double embeddingCallsPerSecond = 0;
  }

  @Data
  public static class Session {
    private long maxSessions = 256;
    private long maxEntries = 5000;
    private long ttlMinutes = 60;
  }

  @Data
  public static class Aggregation {
    private boolean enabled = true;
    private double score = 0.70;
    private int maxUnitLength = 8;
  }

  @Data
  public static class GenreRoute {
    private List<String> preferredCategories = new ArrayList<>();
    private String domainHint = "";
  }

  @Data
  public static class Validation {
    private List<Case> cases = new ArrayList<>();
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Case {
    private String query;
    private String expected;
    private String genre;
  }
}
