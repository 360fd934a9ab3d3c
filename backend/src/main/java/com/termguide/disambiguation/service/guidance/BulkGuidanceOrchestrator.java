package com.termguide.disambiguation.service.guidance;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import org.slf4j.MDC;

import com.google.common.base.Strings;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.RateLimiter;
import com.termguide.disambiguation.config.GuidanceProperties;
import com.termguide.disambiguation.dto.guidance.BulkGuidanceReport;
import com.termguide.disambiguation.dto.guidance.ConfidenceTier;
import com.termguide.disambiguation.dto.guidance.GuidanceQuery;
import com.termguide.disambiguation.dto.guidance.GuidanceResult;
import com.termguide.disambiguation.dto.guidance.LookupPath;
import com.termguide.disambiguation.dto.guidance.QueryContext;
import com.termguide.disambiguation.service.index.DirectLookupCache;

import lombok.extern.slf4j.Slf4j;

/**
 * Resolves batches of terms for one translation unit. Each instance owns a bounded, TTL-expired
 * cache of results so a term seen earlier in the batch (or in an earlier batch of the same
 * session) costs no embedding call. Instances are not shared between sessions.
 */
@Slf4j
public class BulkGuidanceOrchestrator {

  private final DisambiguationEngine engine;
  private final Executor executor;
  private final GuidanceProperties properties;
  private final RateLimiter rateLimiter;
  private final Cache<String, GuidanceResult> sessionCache;

  public BulkGuidanceOrchestrator(
      DisambiguationEngine engine,
      Executor executor,
      GuidanceProperties properties,
      RateLimiter rateLimiter) {
    this.engine = engine;
    this.executor = executor;
    this.properties = properties;
    this.rateLimiter = rateLimiter;
    this.sessionCache =
        CacheBuilder.newBuilder()
            .maximumSize(properties.getSession().getMaxEntries())
            .expireAfterWrite(properties.getSession().getTtlMinutes(), TimeUnit.MINUTES)
            .build();
  }

  public BulkGuidanceReport bulkGuidance(
      List<String> terms, String genre, int maxApiCalls, double minConfidence) {
    return bulkGuidance(terms, genre, null, maxApiCalls, minConfidence);
  }

  /**
   * Looks up every term. At most {@code maxApiCalls} embedding lookups are made; terms past the
   * cap come back rate limited and count as not found. Results keep the order of {@code terms}.
   * The optional {@code context} is shared by every term of the batch and is part of the cache
   * key.
   */
  public BulkGuidanceReport bulkGuidance(
      List<String> terms,
      String genre,
      QueryContext context,
      int maxApiCalls,
      double minConfidence) {
    if (terms == null) {
      throw new IllegalArgumentException("terms must not be null");
    }
    if (maxApiCalls < 0) {
      throw new IllegalArgumentException("maxApiCalls must be >= 0");
    }
    CallBudget budget = CallBudget.capped(maxApiCalls, rateLimiter);

    // cached results are pinned here; resolving fresh terms may evict them from the cache
    Map<String, GuidanceResult> cached = new LinkedHashMap<>();
    Map<String, String> termsByKey = new LinkedHashMap<>();
    int cacheHits = 0;
    for (String term : terms) {
      if (term == null || term.isBlank()) {
        continue;
      }
      String key = cacheKey(term, genre, context);
      if (cached.containsKey(key) || termsByKey.containsKey(key)) {
        cacheHits++;
        continue;
      }
      GuidanceResult hit = sessionCache.getIfPresent(key);
      if (hit != null) {
        cached.put(key, hit);
        cacheHits++;
      } else {
        termsByKey.put(key, term.trim());
      }
    }

    Map<String, GuidanceResult> byKey = new HashMap<>(cached);
    byKey.putAll(resolve(termsByKey, genre, context, budget));

    List<GuidanceResult> results = new ArrayList<>(terms.size());
    Map<String, GuidanceResult> distinct = new LinkedHashMap<>();
    int blanks = 0;
    for (String term : terms) {
      if (term == null || term.isBlank()) {
        results.add(GuidanceResult.none(term == null ? "" : term));
        blanks++;
        continue;
      }
      String key = cacheKey(term, genre, context);
      GuidanceResult result = byKey.get(key);
      results.add(result);
      distinct.putIfAbsent(key, result);
    }

    BulkGuidanceReport report =
        summarize(results, distinct.values(), blanks, cacheHits, budget.used(), minConfidence);
    log.info(
        "Bulk guidance for {} terms: {} direct, {} vector, {} aggregated, {} not found, "
            + "{} rate limited, {} cache hits, {} api calls",
        report.getTermsRequested(),
        report.getDirectHits(),
        report.getVectorHits(),
        report.getAggregatedHits(),
        report.getNotFound(),
        report.getRateLimited(),
        report.getCacheHits(),
        report.getApiCallsMade());
    if (report.getRateLimited() > 0) {
      log.warn(
          "Call budget of {} exhausted, {} terms not looked up",
          maxApiCalls,
          report.getRateLimited());
    }
    return report;
  }

  public long cachedEntries() {
    return sessionCache.size();
  }

  private Map<String, GuidanceResult> resolve(
      Map<String, String> termsByKey, String genre, QueryContext context, CallBudget budget) {
    Map<String, String> callerMdc = MDC.getCopyOfContextMap();
    Map<String, CompletableFuture<GuidanceResult>> futures = new LinkedHashMap<>();
    termsByKey.forEach(
        (key, term) ->
            futures.put(
                key,
                CompletableFuture.supplyAsync(
                    () -> {
                      Map<String, String> workerMdc = MDC.getCopyOfContextMap();
                      if (callerMdc != null) {
                        MDC.setContextMap(callerMdc);
                      }
                      try {
                        GuidanceQuery query =
                            GuidanceQuery.builder()
                                .term(term)
                                .genre(genre)
                                .context(context)
                                .build();
                        return engine.disambiguate(query, budget);
                      } finally {
                        if (workerMdc != null) {
                          MDC.setContextMap(workerMdc);
                        } else {
                          MDC.clear();
                        }
                      }
                    },
                    executor)));

    Map<String, GuidanceResult> resolved = new LinkedHashMap<>();
    for (Map.Entry<String, CompletableFuture<GuidanceResult>> entry : futures.entrySet()) {
      GuidanceResult result;
      try {
        result = entry.getValue().join();
      } catch (CompletionException e) {
        futures.values().forEach(future -> future.cancel(false));
        if (e.getCause() instanceof RuntimeException) {
          throw (RuntimeException) e.getCause();
        }
        throw e;
      }
      resolved.put(entry.getKey(), result);
      if (!result.isRateLimited()) {
        sessionCache.put(entry.getKey(), result);
      }
    }
    return resolved;
  }

  private BulkGuidanceReport summarize(
      List<GuidanceResult> results,
      Collection<GuidanceResult> distinct,
      int blanks,
      int cacheHits,
      int apiCalls,
      double minConfidence) {
    int direct = 0;
    int vector = 0;
    int aggregated = 0;
    int penalized = 0;
    int notFound = blanks;
    int rateLimited = 0;
    Set<String> warnCategories = Set.copyOf(properties.getWarnCategories());
    List<GuidanceResult> highConfidence = new ArrayList<>();
    List<GuidanceResult> mediumConfidence = new ArrayList<>();
    List<GuidanceResult> warnings = new ArrayList<>();
    for (GuidanceResult result : distinct) {
      if (result.isRateLimited()) {
        rateLimited++;
        notFound++;
        continue;
      }
      if (result.getNegativePenalty() > 0) {
        penalized++;
      }
      if (!result.isUsable()) {
        notFound++;
        continue;
      }
      if (result.getLookupPath() == LookupPath.DIRECT) {
        direct++;
      } else if (result.getLookupPath() == LookupPath.VECTOR) {
        vector++;
      } else if (result.getLookupPath() == LookupPath.AGGREGATED) {
        aggregated++;
      }

      if (result.getFinalScore() >= minConfidence) {
        highConfidence.add(result);
      } else if (result.getConfidenceTier() == ConfidenceTier.LOG) {
        mediumConfidence.add(result);
      }
      if (result.category() != null && warnCategories.contains(result.category())) {
        warnings.add(result);
      }
    }

    return BulkGuidanceReport.builder()
        .results(results)
        .highConfidence(highConfidence)
        .mediumConfidence(mediumConfidence)
        .warnings(warnings)
        .termsRequested(results.size())
        .directHits(direct)
        .vectorHits(vector)
        .aggregatedHits(aggregated)
        .negPenaltiesApplied(penalized)
        .notFound(notFound)
        .rateLimited(rateLimited)
        .cacheHits(cacheHits)
        .apiCallsMade(apiCalls)
        .build();
  }

  static String cacheKey(String term, String genre, QueryContext context) {
    String normalizedGenre = genre == null ? "" : genre.trim().toLowerCase(Locale.ROOT);
    String key = DirectLookupCache.normalize(term) + "|" + normalizedGenre;
    if (context == null || context.isEmpty()) {
      return key;
    }
    return key
        + "|"
        + Strings.nullToEmpty(context.getPrevious()).trim()
        + "\n"
        + Strings.nullToEmpty(context.getNext()).trim();
  }
}
