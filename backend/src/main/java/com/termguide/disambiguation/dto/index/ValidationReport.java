package com.termguide.disambiguation.dto.index;

import java.util.List;

import com.termguide.disambiguation.dto.guidance.ConfidenceTier;
import com.termguide.disambiguation.dto.guidance.LookupPath;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Result of replaying the configured validation queries against the live index. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReport {

  private int total;
  private int passed;
  private double successRate;
  private List<CaseResult> cases;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class CaseResult {
    private String query;
    private String expected;
    private String actual;
    private double finalScore;
    private ConfidenceTier tier;
    private LookupPath lookupPath;
    private boolean passed;
  }
}
