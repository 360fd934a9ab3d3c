package com.termguide.disambiguation.dto.guidance;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A LOG-tier lookup kept for review. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UncertainMatch {

  private Instant timestamp;
  private String term;
  private String genre;
  private String context;
  private String rendering;
  private String category;
  private LookupPath lookupPath;
  private double rawSimilarity;
  private double negativePenalty;
  private double finalScore;
}
