package com.termguide.disambiguation.service.guidance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.termguide.disambiguation.config.GuidanceProperties;
import com.termguide.disambiguation.dto.corpus.Pattern;
import com.termguide.disambiguation.dto.guidance.BulkGuidanceReport;
import com.termguide.disambiguation.dto.guidance.ConfidenceTier;
import com.termguide.disambiguation.dto.guidance.GuidanceQuery;
import com.termguide.disambiguation.dto.guidance.GuidanceResult;
import com.termguide.disambiguation.dto.guidance.LookupPath;
import com.termguide.disambiguation.dto.guidance.QueryContext;
import com.termguide.disambiguation.exception.IndexNotReadyException;
import com.termguide.disambiguation.fixtures.TestFixtures;

@ExtendWith(MockitoExtension.class)
@DisplayName("BulkGuidanceOrchestrator Tests")
class BulkGuidanceOrchestratorTest {

  @Mock private DisambiguationEngine engine;

  private final Map<String, GuidanceResult> canned = new HashMap<>();
  private BulkGuidanceOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    GuidanceProperties properties = TestFixtures.properties();
    orchestrator = new BulkGuidanceOrchestrator(engine, Runnable::run, properties, null);

    canned.put("金丹期", GuidanceResult.direct("金丹期", pattern("cultivation_realms", "Kim Đan")));
    canned.put("迷惑", vector("迷惑", "false_cognates", "phiền phức", 0.9, ConfidenceTier.INJECT));
    canned.put("灵根", vector("灵根", "sino_disambiguation", "linh căn", 0.7, ConfidenceTier.LOG));
    canned.put(
        "筑基后期",
        GuidanceResult.builder()
            .queryTerm("筑基后期")
            .finalScore(0.70)
            .confidenceTier(ConfidenceTier.LOG)
            .rendering("Trúc Cơ hậu kỳ")
            .components(List.of(pattern("cultivation_realms", "Trúc Cơ")))
            .lookupPath(LookupPath.AGGREGATED)
            .build());
  }

  private void answerFromCannedResults() {
    when(engine.disambiguate(any(GuidanceQuery.class), any(CallBudget.class)))
        .thenAnswer(
            invocation -> {
              GuidanceQuery query = invocation.getArgument(0);
              GuidanceResult known = canned.get(query.getTerm());
              if (known != null && known.getLookupPath() == LookupPath.DIRECT) {
                return known;
              }
              CallBudget budget = invocation.getArgument(1);
              if (!budget.tryAcquire()) {
                return GuidanceResult.rateLimited(query.getTerm());
              }
              return known != null ? known : GuidanceResult.none(query.getTerm());
            });
  }

  @Nested
  @DisplayName("Call budget")
  class Budget {

    @Test
    @DisplayName("Should stop embedding at the cap and report the rest as not found")
    void capLeavesRemainderRateLimited() {
      answerFromCannedResults();
      List<String> terms = List.of("a1", "a2", "a3", "a4", "a5", "a6", "a7", "a8");

      BulkGuidanceReport report = orchestrator.bulkGuidance(terms, null, 3, 0.65);

      assertThat(report.getApiCallsMade()).isEqualTo(3);
      assertThat(report.getRateLimited()).isEqualTo(5);
      assertThat(report.getNotFound()).isEqualTo(8);
      assertThat(report.getResults()).hasSize(8);
      assertThat(report.getResults()).filteredOn(GuidanceResult::isRateLimited).hasSize(5);
    }

    @Test
    @DisplayName("Should not cache rate limited results")
    void rateLimitedResultsAreRetried() {
      answerFromCannedResults();

      BulkGuidanceReport starved = orchestrator.bulkGuidance(List.of("迷惑"), null, 0, 0.65);
      BulkGuidanceReport funded = orchestrator.bulkGuidance(List.of("迷惑"), null, 5, 0.65);

      assertThat(starved.getRateLimited()).isEqualTo(1);
      assertThat(funded.getCacheHits()).isZero();
      assertThat(funded.getVectorHits()).isEqualTo(1);
      assertThat(funded.getResults().get(0).getRendering()).isEqualTo("phiền phức");
    }

    @Test
    @DisplayName("Should reject a negative cap")
    void negativeCap() {
      assertThatThrownBy(() -> orchestrator.bulkGuidance(List.of("x"), null, -1, 0.5))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("Session cache")
  class SessionCache {

    @Test
    @DisplayName("Should look a repeated term up once and count the repeat as a cache hit")
    void repeatedTermLookedUpOnce() {
      answerFromCannedResults();

      BulkGuidanceReport report =
          orchestrator.bulkGuidance(List.of("迷惑", "灵根", "迷惑"), null, 10, 0.65);

      verify(engine, times(1))
          .disambiguate(argThat(query -> query.getTerm().equals("迷惑")), any(CallBudget.class));
      assertThat(report.getCacheHits()).isEqualTo(1);
      assertThat(report.getApiCallsMade()).isEqualTo(2);
      assertThat(report.getResults())
          .extracting(GuidanceResult::getQueryTerm)
          .containsExactly("迷惑", "灵根", "迷惑");
      assertThat(report.getHighConfidence()).extracting(GuidanceResult::getQueryTerm)
          .containsExactly("迷惑", "灵根");
    }

    @Test
    @DisplayName("Should serve later batches of the same session from the cache")
    void laterBatchesHitCache() {
      answerFromCannedResults();
      orchestrator.bulkGuidance(List.of("迷惑", "灵根"), "modern", 10, 0.65);

      BulkGuidanceReport second =
          orchestrator.bulkGuidance(List.of("灵根", "迷惑"), "Modern", 10, 0.65);

      verify(engine, times(2)).disambiguate(any(GuidanceQuery.class), any(CallBudget.class));
      assertThat(second.getCacheHits()).isEqualTo(2);
      assertThat(second.getApiCallsMade()).isZero();
      assertThat(second.getResults().get(0).getRendering()).isEqualTo("linh căn");
      assertThat(second.getVectorHits()).isEqualTo(2);
      assertThat(second.getHighConfidence()).hasSize(2);
      assertThat(orchestrator.cachedEntries()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep a cached result even when fresh lookups evict it from the cache")
    void cachedResultSurvivesEviction() {
      answerFromCannedResults();
      GuidanceProperties properties = TestFixtures.properties();
      properties.getSession().setMaxEntries(1);
      BulkGuidanceOrchestrator tiny =
          new BulkGuidanceOrchestrator(engine, Runnable::run, properties, null);
      tiny.bulkGuidance(List.of("金丹期"), "xianxia", 10, 0.65);

      BulkGuidanceReport second = tiny.bulkGuidance(List.of("金丹期", "迷惑"), "xianxia", 10, 0.65);

      assertThat(second.getCacheHits()).isEqualTo(1);
      assertThat(second.getResults().get(0).getRendering()).isEqualTo("Kim Đan");
      assertThat(second.getResults().get(0).getConfidenceTier()).isEqualTo(ConfidenceTier.INJECT);
      assertThat(second.getResults().get(0).getLookupPath()).isEqualTo(LookupPath.DIRECT);
      assertThat(second.getDirectHits()).isEqualTo(1);
      assertThat(second.getVectorHits()).isEqualTo(1);
      assertThat(tiny.cachedEntries()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep separate entries per genre")
    void genreIsPartOfKey() {
      answerFromCannedResults();
      orchestrator.bulkGuidance(List.of("迷惑"), "modern", 10, 0.65);

      BulkGuidanceReport other = orchestrator.bulkGuidance(List.of("迷惑"), "xianxia", 10, 0.65);

      assertThat(other.getCacheHits()).isZero();
      assertThat(orchestrator.cachedEntries()).isEqualTo(2);
    }
  }

  @Nested
  @DisplayName("Shared context")
  class SharedContext {

    @Test
    @DisplayName("Should pass the batch context into every lookup")
    void contextReachesEngine() {
      answerFromCannedResults();
      QueryContext chapter = new QueryContext("他终于突破到", "寿元大增");

      orchestrator.bulkGuidance(List.of("迷惑", "灵根"), "xianxia", chapter, 10, 0.65);

      verify(engine, times(2))
          .disambiguate(argThat(query -> query.getContext() == chapter), any(CallBudget.class));
    }

    @Test
    @DisplayName("Should not reuse results computed under a different context")
    void contextIsPartOfKey() {
      answerFromCannedResults();
      QueryContext first = new QueryContext("他终于突破到", null);
      orchestrator.bulkGuidance(List.of("迷惑"), "xianxia", first, 10, 0.65);

      BulkGuidanceReport same =
          orchestrator.bulkGuidance(
              List.of("迷惑"), "xianxia", new QueryContext(" 他终于突破到 ", ""), 10, 0.65);
      BulkGuidanceReport other =
          orchestrator.bulkGuidance(
              List.of("迷惑"), "xianxia", new QueryContext("她很迷惑", null), 10, 0.65);
      BulkGuidanceReport none = orchestrator.bulkGuidance(List.of("迷惑"), "xianxia", 10, 0.65);

      assertThat(same.getCacheHits()).isEqualTo(1);
      assertThat(other.getCacheHits()).isZero();
      assertThat(none.getCacheHits()).isZero();
      assertThat(orchestrator.cachedEntries()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should treat an empty context like no context")
    void emptyContextSharesKey() {
      assertThat(BulkGuidanceOrchestrator.cacheKey("迷惑", "Modern", new QueryContext(" ", null)))
          .isEqualTo(BulkGuidanceOrchestrator.cacheKey("迷惑", "modern", null));
    }
  }

  @Nested
  @DisplayName("Report")
  class Report {

    @Test
    @DisplayName("Should count hits per lookup path and collect warnings")
    void countsPerPath() {
      answerFromCannedResults();

      BulkGuidanceReport report =
          orchestrator.bulkGuidance(
              List.of("金丹期", "迷惑", "灵根", "筑基后期", "无名"), "xianxia", 10, 0.8);

      assertThat(report.getTermsRequested()).isEqualTo(5);
      assertThat(report.getDirectHits()).isEqualTo(1);
      assertThat(report.getVectorHits()).isEqualTo(2);
      assertThat(report.getAggregatedHits()).isEqualTo(1);
      assertThat(report.getNotFound()).isEqualTo(1);
      assertThat(report.getApiCallsMade()).isEqualTo(4);
      assertThat(report.getHighConfidence())
          .extracting(GuidanceResult::getQueryTerm)
          .containsExactly("金丹期", "迷惑");
      assertThat(report.getMediumConfidence())
          .extracting(GuidanceResult::getQueryTerm)
          .containsExactly("灵根", "筑基后期");
      assertThat(report.getWarnings())
          .extracting(GuidanceResult::getQueryTerm)
          .containsExactly("迷惑");
    }

    @Test
    @DisplayName("Should count results carrying a negative anchor penalty")
    void countsPenalties() {
      canned.put(
          "一掌",
          vector("一掌", "action_emphasis", "một chưởng", 0.6, ConfidenceTier.IGNORE)
              .toBuilder()
              .negativePenalty(0.25)
              .matchedPattern(null)
              .rendering(null)
              .build());
      answerFromCannedResults();

      BulkGuidanceReport report = orchestrator.bulkGuidance(List.of("一掌"), null, 10, 0.65);

      assertThat(report.getNegPenaltiesApplied()).isEqualTo(1);
      assertThat(report.getNotFound()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep blank terms in place without looking them up")
    void blankTermsKeepPosition() {
      answerFromCannedResults();

      BulkGuidanceReport report =
          orchestrator.bulkGuidance(Arrays.asList("金丹期", " ", null), null, 10, 0.65);

      assertThat(report.getResults()).hasSize(3);
      assertThat(report.getTermsRequested()).isEqualTo(3);
      assertThat(report.getNotFound()).isEqualTo(2);
      assertThat(report.getResults().get(1).getConfidenceTier()).isEqualTo(ConfidenceTier.IGNORE);
      assertThat(report.getResults().get(2).getQueryTerm()).isEmpty();
      verify(engine, never())
          .disambiguate(argThat(query -> query.getTerm().isBlank()), any(CallBudget.class));
    }

    @Test
    @DisplayName("Should propagate index failures")
    void propagatesEngineFailure() {
      when(engine.disambiguate(any(GuidanceQuery.class), any(CallBudget.class)))
          .thenThrow(new IndexNotReadyException("Guidance index has not been built"));

      assertThatThrownBy(() -> orchestrator.bulkGuidance(List.of("迷惑"), null, 10, 0.65))
          .isInstanceOf(IndexNotReadyException.class);
    }
  }

  private static Pattern pattern(String category, String rendering) {
    return Pattern.builder().term(rendering).category(category).primaryRendering(rendering).build();
  }

  private static GuidanceResult vector(
      String term, String category, String rendering, double score, ConfidenceTier tier) {
    return GuidanceResult.builder()
        .queryTerm(term)
        .rawSimilarity(score)
        .finalScore(score)
        .confidenceTier(tier)
        .matchedPattern(pattern(category, rendering))
        .rendering(rendering)
        .lookupPath(LookupPath.VECTOR)
        .build();
  }
}
