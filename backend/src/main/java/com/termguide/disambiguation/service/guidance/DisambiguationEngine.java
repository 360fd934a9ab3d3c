package com.termguide.disambiguation.service.guidance;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.termguide.disambiguation.config.GuidanceProperties;
import com.termguide.disambiguation.dto.corpus.Pattern;
import com.termguide.disambiguation.dto.guidance.ConfidenceTier;
import com.termguide.disambiguation.dto.guidance.GuidanceQuery;
import com.termguide.disambiguation.dto.guidance.GuidanceResult;
import com.termguide.disambiguation.dto.guidance.LookupPath;
import com.termguide.disambiguation.dto.guidance.QueryContext;
import com.termguide.disambiguation.service.index.GuidanceIndex;
import com.termguide.disambiguation.service.index.GuidanceIndexService;
import com.termguide.disambiguation.service.vector.PatternCandidate;
import com.termguide.disambiguation.service.vector.VectorMath;
import com.termguide.disambiguation.service.vector.VectorSimilaritySearchService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves one term against the active index, cheapest path first:
 *
 * <ol>
 *   <li>exact match in the direct lookup cache, returned unscored;
 *   <li>one embedding of the term (with genre hint and context) searched against the collection,
 *       penalized by the candidate category's negative anchors and tiered;
 *   <li>when that yields nothing usable, greedy decomposition into sub-units that each hit the
 *       direct lookup cache, capped at LOG tier.
 * </ol>
 *
 * "No match" is a normal IGNORE result, never an exception.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DisambiguationEngine {

  private final GuidanceIndexService indexService;
  private final VectorSimilaritySearchService vectorSearch;
  private final ConfidenceClassifier classifier;
  private final GenreRoutingTable routing;
  private final UncertainMatchLog uncertainMatchLog;
  private final GuidanceProperties properties;

  public GuidanceResult disambiguate(GuidanceQuery query) {
    return disambiguate(query, CallBudget.unlimited());
  }

  /**
   * Resolves {@code query}, claiming one unit of {@code budget} before any embedding call. A
   * refused claim yields a rate-limited NONE result.
   */
  public GuidanceResult disambiguate(GuidanceQuery query, CallBudget budget) {
    String term = query.getTerm() == null ? "" : query.getTerm().trim();
    if (term.isEmpty()) {
      throw new IllegalArgumentException("term must not be blank");
    }
    GuidanceIndex index = indexService.requireActive();
    List<String> preferred = routing.preferredCategories(query.getGenre());

    Optional<Pattern> direct = index.getDirectLookup().get(term, preferred);
    if (direct.isPresent()) {
      log.debug("Direct hit for '{}' in {}", term, direct.get().getCategory());
      return GuidanceResult.direct(term, direct.get());
    }

    if (!budget.tryAcquire()) {
      log.debug("Call budget exhausted, not looking up '{}'", term);
      return GuidanceResult.rateLimited(term);
    }

    GuidanceResult result = vectorLookup(index, query, term);
    if (!result.isUsable()) {
      Optional<GuidanceResult> aggregated = aggregate(index, term, preferred);
      if (aggregated.isPresent()) {
        result = aggregated.get();
      }
    }

    if (result.getConfidenceTier() == ConfidenceTier.LOG) {
      uncertainMatchLog.record(query, result);
    }
    return result;
  }

  private GuidanceResult vectorLookup(GuidanceIndex index, GuidanceQuery query, String term) {
    String text = queryText(term, query.getContext(), routing.domainHint(query.getGenre()));
    Optional<List<Float>> embedding = vectorSearch.embedQuery(index, text);
    if (embedding.isEmpty()) {
      return GuidanceResult.none(term);
    }

    List<PatternCandidate> candidates =
        vectorSearch.search(
            index, embedding.get(), properties.getQuery().getTopK(), query.getCategoryFilter());
    if (candidates.isEmpty()) {
      log.debug("No vector candidates for '{}'", term);
      return GuidanceResult.none(term);
    }

    PatternCandidate best = candidates.get(0);
    double bestRank = rankScore(best, index, query);
    for (PatternCandidate candidate : candidates.subList(1, candidates.size())) {
      double rank = rankScore(candidate, index, query);
      if (rank > bestRank) {
        best = candidate;
        bestRank = rank;
      }
    }

    Pattern pattern = best.getPattern();
    double raw = VectorMath.clampUnit(best.getSimilarity());
    double penalty = index.getNegativeAnchors().penalty(embedding.get(), pattern.getCategoryId());
    double finalScore = Math.max(0.0, raw - penalty);
    ConfidenceTier tier = classifier.classify(finalScore);
    log.debug(
        "Vector match '{}' -> '{}' ({}): raw={}, penalty={}, final={}, tier={}",
        term,
        pattern.getPrimaryRendering(),
        pattern.getCategory(),
        raw,
        penalty,
        finalScore,
        tier);

    boolean usable = tier != ConfidenceTier.IGNORE;
    return GuidanceResult.builder()
        .queryTerm(term)
        .rawSimilarity(raw)
        .negativePenalty(penalty)
        .finalScore(finalScore)
        .confidenceTier(tier)
        .matchedPattern(usable ? pattern : null)
        .rendering(usable ? pattern.getPrimaryRendering() : null)
        .lookupPath(LookupPath.VECTOR)
        .build();
  }

  /** Ranking only; the reported similarity stays the plain cosine. */
  private double rankScore(PatternCandidate candidate, GuidanceIndex index, GuidanceQuery query) {
    Pattern pattern = candidate.getPattern();
    int priority = index.priorityOf(pattern);
    double score =
        candidate.getSimilarity()
            * (1.0 + (priority - GuidanceProperties.NEUTRAL_PRIORITY) * 0.02);
    score += routing.boost(query.getGenre(), pattern.getCategory());
    QueryContext context = query.getContext();
    if (context != null
        && !context.isEmpty()
        && pattern.getContextIndicators().stream().anyMatch(context::mentions)) {
      score += properties.getQuery().getContextIndicatorBoost();
    }
    return score;
  }

  /**
   * Covers the whole term with the longest direct-lookup hits, left to right. Multi-word terms are
   * split on whitespace, anything else into characters.
   */
  Optional<GuidanceResult> aggregate(GuidanceIndex index, String term, List<String> preferred) {
    GuidanceProperties.Aggregation config = properties.getAggregation();
    if (!config.isEnabled()) {
      return Optional.empty();
    }

    boolean words = term.chars().anyMatch(Character::isWhitespace);
    List<String> units =
        words
            ? List.of(term.split("\\s+"))
            : term.codePoints().mapToObj(Character::toString).collect(Collectors.toList());
    String separator = words ? " " : "";
    if (units.size() < 2) {
      return Optional.empty();
    }

    List<Pattern> components = new ArrayList<>();
    int position = 0;
    while (position < units.size()) {
      int longest = Math.min(config.getMaxUnitLength(), units.size() - position);
      Pattern found = null;
      int length = longest;
      for (; length >= 1; length--) {
        if (position == 0 && length == units.size()) {
          continue;
        }
        String piece = String.join(separator, units.subList(position, position + length));
        Optional<Pattern> hit = index.getDirectLookup().get(piece, preferred);
        if (hit.isPresent()) {
          found = hit.get();
          break;
        }
      }
      if (found == null) {
        return Optional.empty();
      }
      components.add(found);
      position += length;
    }

    ConfidenceTier tier = classifier.classify(config.getScore());
    if (tier == ConfidenceTier.INJECT) {
      tier = ConfidenceTier.LOG;
    }
    if (tier == ConfidenceTier.IGNORE) {
      return Optional.empty();
    }

    String rendering =
        components.stream().map(Pattern::getPrimaryRendering).collect(Collectors.joining(" "));
    log.debug("Aggregated '{}' from {} sub-units into '{}'", term, components.size(), rendering);
    return Optional.of(
        GuidanceResult.builder()
            .queryTerm(term)
            .rawSimilarity(config.getScore())
            .negativePenalty(0.0)
            .finalScore(config.getScore())
            .confidenceTier(tier)
            .rendering(rendering)
            .components(List.copyOf(components))
            .lookupPath(LookupPath.AGGREGATED)
            .build());
  }

  /** The text embedded for a query; the term is repeated after the context for emphasis. */
  static String queryText(String term, QueryContext context, String domainHint) {
    StringBuilder text = new StringBuilder();
    if (domainHint != null && !domainHint.isBlank()) {
      text.append(domainHint).append('\n');
    }
    text.append(term);
    if (context != null && !context.isEmpty()) {
      if (context.getPrevious() != null && !context.getPrevious().isBlank()) {
        text.append("\n[PREV] ").append(context.getPrevious().trim());
      }
      if (context.getNext() != null && !context.getNext().isBlank()) {
        text.append("\n[NEXT] ").append(context.getNext().trim());
      }
      text.append('\n').append(term);
    }
    return text.toString();
  }
}
