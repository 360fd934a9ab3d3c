package com.termguide.disambiguation.service.guidance;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Service;

import com.termguide.disambiguation.config.GuidanceProperties;
import com.termguide.disambiguation.dto.guidance.GuidanceQuery;
import com.termguide.disambiguation.dto.guidance.GuidanceResult;
import com.termguide.disambiguation.dto.index.ValidationReport;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Replays the configured query/expected-rendering cases against the live index. A case passes when
 * the lookup is usable and its rendering contains the expected text, ignoring case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndexValidationService {

  private final DisambiguationEngine engine;
  private final GuidanceProperties properties;

  public ValidationReport validateIndex() {
    return validate(properties.getValidation().getCases());
  }

  public ValidationReport validate(List<GuidanceProperties.Case> cases) {
    List<ValidationReport.CaseResult> results = new ArrayList<>(cases.size());
    int passed = 0;
    for (GuidanceProperties.Case validationCase : cases) {
      GuidanceQuery query = GuidanceQuery.of(validationCase.getQuery(), validationCase.getGenre());
      GuidanceResult result = engine.disambiguate(query);
      boolean ok =
          result.isUsable() && contains(result.getRendering(), validationCase.getExpected());
      if (ok) {
        passed++;
      } else {
        log.warn(
            "Validation case '{}' expected '{}' but got '{}' ({})",
            validationCase.getQuery(),
            validationCase.getExpected(),
            result.getRendering(),
            result.getConfidenceTier());
      }
      results.add(
          ValidationReport.CaseResult.builder()
              .query(validationCase.getQuery())
              .expected(validationCase.getExpected())
              .actual(result.getRendering())
              .finalScore(result.getFinalScore())
              .tier(result.getConfidenceTier())
              .lookupPath(result.getLookupPath())
              .passed(ok)
              .build());
    }

    double successRate = cases.isEmpty() ? 0.0 : (double) passed / cases.size();
    log.info("Index validation: {}/{} cases passed", passed, cases.size());
    return ValidationReport.builder()
        .total(cases.size())
        .passed(passed)
        .successRate(successRate)
        .cases(results)
        .build();
  }

  private static boolean contains(String rendering, String expected) {
    if (rendering == null || expected == null) {
      return false;
    }
    return rendering.toLowerCase(Locale.ROOT).contains(expected.toLowerCase(Locale.ROOT));
  }
}
