package com.termguide.disambiguation.dto.index;

import java.time.Instant;
import java.util.Map;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Current state of the guidance engine")
public class EngineStats {

  private boolean ready;
  private boolean indexingInProgress;
  private String collectionName;
  private int collectionCount;
  private int directLookupEntries;
  private String corpusVersion;
  private String embeddingModelId;

  @Schema(description = "Indexed patterns per category")
  private Map<String, Integer> categories;

  private Map<String, Integer> negativeAnchors;

  @Schema(description = "Confidence and penalty thresholds in effect")
  private Map<String, Double> thresholds;

  private long activeSessions;
  private int uncertainMatchesLogged;
  private Instant builtAt;
}
