package com.termguide.disambiguation.dto.guidance;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.termguide.disambiguation.dto.corpus.Pattern;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one term lookup. Owned by the caller; holds no reference back into the index beyond
 * the immutable patterns it matched.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Guidance for one source term")
public class GuidanceResult {

  private String queryTerm;

  @Schema(description = "Cosine similarity of the best match, 1.0 for a direct hit")
  private double rawSimilarity;

  private double negativePenalty;

  @Schema(description = "max(0, rawSimilarity - negativePenalty)")
  private double finalScore;

  private ConfidenceTier confidenceTier;

  @Schema(description = "Matched pattern; absent when nothing cleared the ignore floor")
  private Pattern matchedPattern;

  private LookupPath lookupPath;

  @Schema(description = "Rendering to use; for aggregated results the merged sub-unit renderings")
  private String rendering;

  @Schema(description = "Sub-unit patterns an aggregated result was composed from")
  private List<Pattern> components;

  @Schema(description = "True when the term was not looked up because the call budget ran out")
  private boolean rateLimited;

  public static GuidanceResult direct(String term, Pattern pattern) {
    return GuidanceResult.builder()
        .queryTerm(term)
        .rawSimilarity(1.0)
        .negativePenalty(0.0)
        .finalScore(1.0)
        .confidenceTier(ConfidenceTier.INJECT)
        .matchedPattern(pattern)
        .rendering(pattern.getPrimaryRendering())
        .lookupPath(LookupPath.DIRECT)
        .build();
  }

  public static GuidanceResult none(String term) {
    return GuidanceResult.builder()
        .queryTerm(term)
        .confidenceTier(ConfidenceTier.IGNORE)
        .lookupPath(LookupPath.NONE)
        .build();
  }

  public static GuidanceResult rateLimited(String term) {
    return none(term).toBuilder().rateLimited(true).build();
  }

  @JsonIgnore
  public boolean isUsable() {
    return confidenceTier != null && confidenceTier != ConfidenceTier.IGNORE;
  }

  /** Category of the matched pattern, or of the first component for aggregated results. */
  public String category() {
    if (matchedPattern != null) {
      return matchedPattern.getCategory();
    }
    return components == null || components.isEmpty() ? null : components.get(0).getCategory();
  }
}
