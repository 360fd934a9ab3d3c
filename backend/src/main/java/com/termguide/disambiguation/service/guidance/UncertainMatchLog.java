package com.termguide.disambiguation.service.guidance;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.termguide.disambiguation.dto.guidance.GuidanceQuery;
import com.termguide.disambiguation.dto.guidance.GuidanceResult;
import com.termguide.disambiguation.dto.guidance.QueryContext;
import com.termguide.disambiguation.dto.guidance.UncertainMatch;
import com.termguide.disambiguation.service.CloudWatchLoggingService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Recent LOG-tier matches kept for human review. Bounded: once it grows past {@value #MAX_ENTRIES}
 * entries it is trimmed back to the newest {@value #RETAINED_ENTRIES}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UncertainMatchLog {

  static final int MAX_ENTRIES = 1000;
  static final int RETAINED_ENTRIES = 500;

  private final CloudWatchLoggingService cloudWatchLoggingService;
  private final List<UncertainMatch> entries = new ArrayList<>();

  public void record(GuidanceQuery query, GuidanceResult result) {
    UncertainMatch match =
        UncertainMatch.builder()
            .timestamp(Instant.now())
            .term(result.getQueryTerm())
            .genre(query.getGenre())
            .context(describe(query.getContext()))
            .rendering(result.getRendering())
            .category(result.category())
            .lookupPath(result.getLookupPath())
            .rawSimilarity(result.getRawSimilarity())
            .negativePenalty(result.getNegativePenalty())
            .finalScore(result.getFinalScore())
            .build();

    synchronized (entries) {
      entries.add(match);
      if (entries.size() > MAX_ENTRIES) {
        entries.subList(0, entries.size() - RETAINED_ENTRIES).clear();
      }
    }

    log.info(
        "Uncertain match: '{}' -> '{}' ({}, score {})",
        match.getTerm(),
        match.getRendering(),
        match.getCategory(),
        String.format("%.3f", match.getFinalScore()));

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("term", match.getTerm());
    data.put("rendering", match.getRendering());
    data.put("category", match.getCategory());
    data.put("genre", match.getGenre());
    data.put("lookupPath", String.valueOf(match.getLookupPath()));
    data.put("rawSimilarity", match.getRawSimilarity());
    data.put("negativePenalty", match.getNegativePenalty());
    data.put("finalScore", match.getFinalScore());
    cloudWatchLoggingService.logEvent(
        CloudWatchLoggingService.EVENT_UNCERTAIN_MATCH, "Uncertain guidance match", data);
  }

  /** Newest last, at most {@code limit} entries. */
  public List<UncertainMatch> recent(int limit) {
    synchronized (entries) {
      int from = Math.max(0, entries.size() - Math.max(0, limit));
      return List.copyOf(entries.subList(from, entries.size()));
    }
  }

  public int size() {
    synchronized (entries) {
      return entries.size();
    }
  }

  private static String describe(QueryContext context) {
    if (context == null || context.isEmpty()) {
      return null;
    }
    return String.format(
        "[PREV] %s [NEXT] %s",
        context.getPrevious() == null ? "" : context.getPrevious(),
        context.getNext() == null ? "" : context.getNext());
  }
}
