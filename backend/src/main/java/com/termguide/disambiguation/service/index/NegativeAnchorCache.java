package com.termguide.disambiguation.service.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import com.termguide.disambiguation.dto.corpus.NegativeAnchor;
import com.termguide.disambiguation.service.vector.VectorMath;

/**
 * Embedded false-positive examples grouped by category handle. The penalty is a step: a query whose
 * closest anchor in the candidate's category reaches the threshold loses a fixed amount, anything
 * below the threshold loses nothing. Immutable once built.
 */
public final class NegativeAnchorCache {

  private final Map<Integer, List<List<Float>>> vectorsByCategory;
  private final Map<String, Integer> countsByCategoryName;
  private final double threshold;
  private final double penalty;

  private NegativeAnchorCache(
      Map<Integer, List<List<Float>>> vectorsByCategory,
      Map<String, Integer> countsByCategoryName,
      double threshold,
      double penalty) {
    this.vectorsByCategory = vectorsByCategory;
    this.countsByCategoryName = countsByCategoryName;
    this.threshold = threshold;
    this.penalty = penalty;
  }

  /** Builds from anchors whose embeddings are already filled in; others are ignored. */
  public static NegativeAnchorCache build(
      Collection<NegativeAnchor> anchors, double threshold, double penalty) {
    Map<Integer, List<List<Float>>> byCategory = new HashMap<>();
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (NegativeAnchor anchor : anchors) {
      if (!anchor.isEmbedded()) {
        continue;
      }
      byCategory
          .computeIfAbsent(anchor.getCategoryId(), id -> new ArrayList<>())
          .add(anchor.getEmbedding());
      counts.merge(anchor.getCategory(), 1, Integer::sum);
    }
    Map<Integer, List<List<Float>>> frozen = new HashMap<>();
    byCategory.forEach((id, vectors) -> frozen.put(id, List.copyOf(vectors)));
    return new NegativeAnchorCache(
        Collections.unmodifiableMap(frozen),
        Collections.unmodifiableMap(counts),
        threshold,
        penalty);
  }

  public static NegativeAnchorCache empty(double threshold, double penalty) {
    return new NegativeAnchorCache(Map.of(), Map.of(), threshold, penalty);
  }

  /** Highest cosine similarity between the query and any anchor of the category, if it has any. */
  public OptionalDouble maxSimilarity(List<Float> queryEmbedding, int categoryId) {
    List<List<Float>> anchors = vectorsByCategory.get(categoryId);
    if (anchors == null || anchors.isEmpty() || queryEmbedding == null) {
      return OptionalDouble.empty();
    }
    double best = Double.NEGATIVE_INFINITY;
    for (List<Float> anchor : anchors) {
      best = Math.max(best, VectorMath.cosine(queryEmbedding, anchor));
    }
    return OptionalDouble.of(best);
  }

  /** Fixed penalty when the closest anchor is at or above the threshold, otherwise 0. */
  public double penalty(List<Float> queryEmbedding, int categoryId) {
    OptionalDouble closest = maxSimilarity(queryEmbedding, categoryId);
    return closest.isPresent() && closest.getAsDouble() >= threshold ? penalty : 0.0;
  }

  public int anchorCount(int categoryId) {
    List<List<Float>> anchors = vectorsByCategory.get(categoryId);
    return anchors == null ? 0 : anchors.size();
  }

  public Map<String, Integer> countsByCategory() {
    return countsByCategoryName;
  }

  public int totalAnchors() {
    return countsByCategoryName.values().stream().mapToInt(Integer::intValue).sum();
  }
}
