package com.termguide.disambiguation.service.guidance;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.RateLimiter;
import com.termguide.disambiguation.config.GuidanceProperties;
import com.termguide.disambiguation.dto.guidance.BulkGuidanceReport;
import com.termguide.disambiguation.dto.guidance.FormatPromptResponse;
import com.termguide.disambiguation.dto.guidance.GuidanceQuery;
import com.termguide.disambiguation.dto.guidance.GuidanceResult;
import com.termguide.disambiguation.dto.guidance.QueryContext;
import com.termguide.disambiguation.dto.guidance.UncertainMatch;
import com.termguide.disambiguation.dto.index.EngineStats;
import com.termguide.disambiguation.dto.index.IndexStats;
import com.termguide.disambiguation.exception.ResourceNotFoundException;
import com.termguide.disambiguation.service.CloudWatchLoggingService;
import com.termguide.disambiguation.service.index.GuidanceIndexService;

import lombok.extern.slf4j.Slf4j;

/**
 * Caller-facing entry point: single and bulk lookups, prompt formatting and index administration.
 * Bulk calls with a session id reuse that session's orchestrator, and with it its result cache;
 * sessions are bounded in number and expire after a period without use.
 */
@Slf4j
@Service
public class GuidanceService {

  private final DisambiguationEngine engine;
  private final GuidanceIndexService indexService;
  private final PromptInjectionFormatter formatter;
  private final UncertainMatchLog uncertainMatchLog;
  private final CloudWatchLoggingService cloudWatchLoggingService;
  private final GuidanceProperties properties;
  private final Executor executor;
  private final RateLimiter embeddingRateLimiter;
  private final Cache<String, BulkGuidanceOrchestrator> sessions;

  public GuidanceService(
      DisambiguationEngine engine,
      GuidanceIndexService indexService,
      PromptInjectionFormatter formatter,
      UncertainMatchLog uncertainMatchLog,
      CloudWatchLoggingService cloudWatchLoggingService,
      GuidanceProperties properties,
      @Qualifier("guidanceExecutor") Executor executor) {
    this.engine = engine;
    this.indexService = indexService;
    this.formatter = formatter;
    this.uncertainMatchLog = uncertainMatchLog;
    this.cloudWatchLoggingService = cloudWatchLoggingService;
    this.properties = properties;
    this.executor = executor;
    double callsPerSecond = properties.getBulk().getEmbeddingCallsPerSecond();
    this.embeddingRateLimiter = callsPerSecond > 0 ? RateLimiter.create(callsPerSecond) : null;
    this.sessions =
        CacheBuilder.newBuilder()
            .maximumSize(properties.getSession().getMaxSessions())
            .expireAfterAccess(properties.getSession().getTtlMinutes(), TimeUnit.MINUTES)
            .build();
  }

  public GuidanceResult queryOne(GuidanceQuery query) {
    return engine.disambiguate(query);
  }

  /**
   * Bulk lookup. Null {@code maxApiCalls} and {@code minConfidence} fall back to the configured
   * defaults; a null {@code sessionId} scopes the result cache to this call.
   */
  public BulkGuidanceReport queryBulk(
      List<String> terms,
      String genre,
      Integer maxApiCalls,
      Double minConfidence,
      String sessionId) {
    return queryBulk(terms, genre, null, maxApiCalls, minConfidence, sessionId);
  }

  /** Bulk lookup where every term is disambiguated against the same surrounding text. */
  public BulkGuidanceReport queryBulk(
      List<String> terms,
      String genre,
      QueryContext context,
      Integer maxApiCalls,
      Double minConfidence,
      String sessionId) {
    int cap = maxApiCalls != null ? maxApiCalls : properties.getBulk().getDefaultMaxApiCalls();
    double floor =
        minConfidence != null ? minConfidence : properties.getBulk().getDefaultMinConfidence();
    indexService.requireActive();

    BulkGuidanceReport report =
        orchestratorFor(sessionId).bulkGuidance(terms, genre, context, cap, floor);
    report.setSessionId(sessionId);

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("sessionId", sessionId);
    data.put("genre", genre);
    data.put("termsRequested", report.getTermsRequested());
    data.put("directHits", report.getDirectHits());
    data.put("vectorHits", report.getVectorHits());
    data.put("aggregatedHits", report.getAggregatedHits());
    data.put(
        "mediumConfidence",
        report.getMediumConfidence() == null ? 0 : report.getMediumConfidence().size());
    data.put("notFound", report.getNotFound());
    data.put("rateLimited", report.getRateLimited());
    data.put("cacheHits", report.getCacheHits());
    data.put("apiCallsMade", report.getApiCallsMade());
    cloudWatchLoggingService.logEvent(
        CloudWatchLoggingService.EVENT_BULK_GUIDANCE_RESULT, "Bulk guidance completed", data);
    return report;
  }

  /** Looks the terms up and renders the usable results as a prompt block. */
  public FormatPromptResponse formatForPrompt(
      List<String> terms,
      String genre,
      boolean includeSuggestions,
      Integer maxApiCalls,
      String sessionId) {
    BulkGuidanceReport report = queryBulk(terms, genre, maxApiCalls, 0.0, sessionId);
    return formatter.render(report.getResults(), includeSuggestions);
  }

  public String formatForPrompt(List<GuidanceResult> results, boolean includeSuggestions) {
    return formatter.format(results, includeSuggestions);
  }

  public void dropSession(String sessionId) {
    if (sessions.getIfPresent(sessionId) == null) {
      throw new ResourceNotFoundException("No guidance session " + sessionId);
    }
    sessions.invalidate(sessionId);
    log.info("Dropped guidance session {}", sessionId);
  }

  public long activeSessions() {
    sessions.cleanUp();
    return sessions.size();
  }

  public IndexStats buildIndex(boolean forceRebuild) {
    IndexStats stats = indexService.buildIndex(forceRebuild);
    // cached results may point at patterns from the previous corpus
    if (forceRebuild) {
      sessions.invalidateAll();
    }

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("collection", stats.getCollectionName());
    data.put("corpusVersion", stats.getCorpusVersion());
    data.put("embeddingModelId", stats.getEmbeddingModelId());
    data.put("totalIndexed", stats.getTotalIndexed());
    data.put("skippedEntries", stats.getSkippedEntries());
    data.put("reusedExisting", stats.isReusedExisting());
    data.put("buildMillis", stats.getBuildMillis());
    cloudWatchLoggingService.logEvent(
        CloudWatchLoggingService.EVENT_INDEX_BUILD, "Guidance index built", data);
    return stats;
  }

  public void clearIndex() {
    indexService.clear();
    sessions.invalidateAll();
  }

  public List<UncertainMatch> uncertainMatches(int limit) {
    return uncertainMatchLog.recent(limit);
  }

  public EngineStats getStats() {
    Map<String, Double> thresholds = new LinkedHashMap<>();
    thresholds.put("inject", properties.getThresholds().getInject());
    thresholds.put("log", properties.getThresholds().getLog());
    thresholds.put("negative_anchor_threshold", properties.getNegativeAnchor().getThreshold());
    thresholds.put("negative_anchor_penalty", properties.getNegativeAnchor().getPenalty());
    thresholds.put("aggregation_score", properties.getAggregation().getScore());

    EngineStats.EngineStatsBuilder stats =
        EngineStats.builder()
            .ready(indexService.getActive().isPresent())
            .indexingInProgress(indexService.isIndexingInProgress())
            .thresholds(thresholds)
            .activeSessions(activeSessions())
            .uncertainMatchesLogged(uncertainMatchLog.size());

    indexService
        .getActive()
        .ifPresent(
            index -> {
              IndexStats built = index.getStats();
              stats
                  .collectionName(index.getCollection().getName())
                  .collectionCount(index.getCollection().count())
                  .directLookupEntries(index.getDirectLookup().size())
                  .corpusVersion(index.getCorpusVersion())
                  .embeddingModelId(index.getEmbeddingModelId())
                  .categories(built.getPatternsPerCategory())
                  .negativeAnchors(index.getNegativeAnchors().countsByCategory())
                  .builtAt(index.getBuiltAt());
            });
    return stats.build();
  }

  private BulkGuidanceOrchestrator orchestratorFor(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      return newOrchestrator();
    }
    return sessions.asMap().computeIfAbsent(sessionId, id -> newOrchestrator());
  }

  private BulkGuidanceOrchestrator newOrchestrator() {
    return new BulkGuidanceOrchestrator(engine, executor, properties, embeddingRateLimiter);
  }
}
