package com.termguide.disambiguation.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.termguide.disambiguation.dto.guidance.ConfidenceTier;
import com.termguide.disambiguation.dto.guidance.LookupPath;
import com.termguide.disambiguation.dto.guidance.UncertainMatch;
import com.termguide.disambiguation.dto.index.EngineStats;
import com.termguide.disambiguation.dto.index.IndexStats;
import com.termguide.disambiguation.dto.index.ValidationReport;
import com.termguide.disambiguation.exception.CapabilityUnavailableException;
import com.termguide.disambiguation.exception.CorpusFormatException;
import com.termguide.disambiguation.exception.GlobalExceptionHandler;
import com.termguide.disambiguation.service.guidance.GuidanceService;
import com.termguide.disambiguation.service.guidance.IndexValidationService;

@ExtendWith(MockitoExtension.class)
@DisplayName("IndexAdminController Tests")
class IndexAdminControllerTest {

  private MockMvc mockMvc;

  @Mock private GuidanceService guidanceService;

  @Mock private IndexValidationService validationService;

  @BeforeEach
  void setUp() {
    IndexAdminController controller = new IndexAdminController(guidanceService, validationService);
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  private static IndexStats builtStats() {
    return IndexStats.builder()
        .collectionName("guidance-1")
        .corpusVersion("2.1")
        .embeddingModelId("hashing-v1@384")
        .patternsPerCategory(Map.of("cultivation_realms", 12))
        .totalIndexed(12)
        .collectionCount(15)
        .skippedEntries(1)
        .buildMillis(42)
        .build();
  }

  @Nested
  @DisplayName("POST /api/index/build")
  class Build {

    @Test
    @DisplayName("Should keep a populated index unless a rebuild is forced")
    void shouldBuildWithoutForce() throws Exception {
      when(guidanceService.buildIndex(false)).thenReturn(builtStats());

      mockMvc
          .perform(post("/api/index/build"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.collectionName").value("guidance-1"))
          .andExpect(jsonPath("$.totalIndexed").value(12))
          .andExpect(jsonPath("$.skippedEntries").value(1))
          .andExpect(jsonPath("$.patternsPerCategory.cultivation_realms").value(12));

      verify(guidanceService).buildIndex(false);
    }

    @Test
    @DisplayName("Should forward forceRebuild")
    void shouldForceRebuild() throws Exception {
      when(guidanceService.buildIndex(true)).thenReturn(builtStats());

      mockMvc
          .perform(post("/api/index/build").param("forceRebuild", "true"))
          .andExpect(status().isOk());

      verify(guidanceService).buildIndex(true);
    }

    @Test
    @DisplayName("Should answer 422 for a malformed corpus")
    void shouldReportMalformedCorpus() throws Exception {
      when(guidanceService.buildIndex(true))
          .thenThrow(new CorpusFormatException("corpus.json", "missing pattern_categories"));

      mockMvc
          .perform(post("/api/index/build").param("forceRebuild", "true"))
          .andExpect(status().isUnprocessableEntity())
          .andExpect(
              jsonPath("$.message")
                  .value("Malformed corpus 'corpus.json': missing pattern_categories"));
    }

    @Test
    @DisplayName("Should answer 503 when the vector store is unreachable")
    void shouldReportStoreUnavailable() throws Exception {
      when(guidanceService.buildIndex(false))
          .thenThrow(new CapabilityUnavailableException("Bucket 'guidance' does not exist"));

      mockMvc.perform(post("/api/index/build")).andExpect(status().isServiceUnavailable());
    }
  }

  @Nested
  @DisplayName("Inspection")
  class Inspection {

    @Test
    @DisplayName("Should report engine statistics")
    void shouldReportStats() throws Exception {
      EngineStats stats =
          EngineStats.builder()
              .ready(true)
              .collectionName("guidance-1")
              .collectionCount(15)
              .directLookupEntries(12)
              .thresholds(Map.of("inject", 0.80, "log", 0.65))
              .builtAt(Instant.parse("2026-01-01T00:00:00Z"))
              .build();
      when(guidanceService.getStats()).thenReturn(stats);

      mockMvc
          .perform(get("/api/index/stats"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.ready").value(true))
          .andExpect(jsonPath("$.directLookupEntries").value(12))
          .andExpect(jsonPath("$.thresholds.inject").value(0.80));
    }

    @Test
    @DisplayName("Should replay the validation cases")
    void shouldValidate() throws Exception {
      ValidationReport report =
          ValidationReport.builder()
              .total(2)
              .passed(1)
              .successRate(0.5)
              .cases(
                  List.of(
                      ValidationReport.CaseResult.builder()
                          .query("金丹期")
                          .expected("Kim Đan kỳ")
                          .actual("Kim Đan kỳ")
                          .finalScore(1.0)
                          .tier(ConfidenceTier.INJECT)
                          .lookupPath(LookupPath.DIRECT)
                          .passed(true)
                          .build(),
                      ValidationReport.CaseResult.builder()
                          .query("天外")
                          .expected("thiên ngoại")
                          .tier(ConfidenceTier.IGNORE)
                          .lookupPath(LookupPath.NONE)
                          .passed(false)
                          .build()))
              .build();
      when(validationService.validateIndex()).thenReturn(report);

      mockMvc
          .perform(post("/api/index/validate"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.successRate").value(0.5))
          .andExpect(jsonPath("$.cases", hasSize(2)))
          .andExpect(jsonPath("$.cases[1].passed").value(false));
    }

    @Test
    @DisplayName("Should list uncertain matches up to the requested limit")
    void shouldListUncertainMatches() throws Exception {
      UncertainMatch match =
          UncertainMatch.builder()
              .term("筑基后期")
              .rendering("Trúc Cơ hậu kỳ")
              .lookupPath(LookupPath.AGGREGATED)
              .finalScore(0.70)
              .build();
      when(guidanceService.uncertainMatches(10)).thenReturn(List.of(match));

      mockMvc
          .perform(get("/api/index/uncertain-matches").param("limit", "10"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$", hasSize(1)))
          .andExpect(jsonPath("$[0].rendering").value("Trúc Cơ hậu kỳ"))
          .andExpect(jsonPath("$[0].lookupPath").value("AGGREGATED"));
    }

    @Test
    @DisplayName("Should default the uncertain match limit to 100")
    void shouldDefaultUncertainMatchLimit() throws Exception {
      when(guidanceService.uncertainMatches(100)).thenReturn(List.of());

      mockMvc.perform(get("/api/index/uncertain-matches")).andExpect(status().isOk());

      verify(guidanceService).uncertainMatches(100);
    }
  }

  @Test
  @DisplayName("DELETE /api/index should clear the index")
  void shouldClearIndex() throws Exception {
    mockMvc.perform(delete("/api/index")).andExpect(status().isNoContent());

    verify(guidanceService).clearIndex();
  }
}
