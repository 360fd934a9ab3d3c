package com.termguide.disambiguation.dto.guidance;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(
    description =
        "Guidance for a batch of terms with lookup statistics. terms_requested counts every entry"
            + " of the request. cache_hits counts entries answered without a new lookup. The other"
            + " counters are taken over the distinct terms of the batch, whether freshly looked up"
            + " or served from the session cache; blank entries count as not found")
public class BulkGuidanceReport {

  @Schema(description = "One result per requested term, in request order")
  private List<GuidanceResult> results;

  @JsonProperty("high_confidence")
  @Schema(description = "Distinct results scoring at least minConfidence")
  private List<GuidanceResult> highConfidence;

  @JsonProperty("medium_confidence")
  @Schema(description = "Distinct LOG-tier results scoring below minConfidence")
  private List<GuidanceResult> mediumConfidence;

  @Schema(description = "Usable results from categories flagged as false cognates")
  private List<GuidanceResult> warnings;

  @JsonProperty("terms_requested")
  private int termsRequested;

  @JsonProperty("direct_hits")
  private int directHits;

  @JsonProperty("vector_hits")
  private int vectorHits;

  @JsonProperty("aggregated_hits")
  private int aggregatedHits;

  @JsonProperty("neg_penalties_applied")
  private int negPenaltiesApplied;

  @JsonProperty("not_found")
  private int notFound;

  @JsonProperty("rate_limited")
  private int rateLimited;

  @JsonProperty("cache_hits")
  private int cacheHits;

  @JsonProperty("api_calls_made")
  private int apiCallsMade;

  @JsonProperty("session_id")
  private String sessionId;
}
