package com.termguide.disambiguation.service.guidance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

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
import com.termguide.disambiguation.dto.guidance.FormatPromptResponse;
import com.termguide.disambiguation.dto.guidance.GuidanceQuery;
import com.termguide.disambiguation.dto.guidance.GuidanceResult;
import com.termguide.disambiguation.dto.index.EngineStats;
import com.termguide.disambiguation.dto.index.IndexStats;
import com.termguide.disambiguation.exception.IndexNotReadyException;
import com.termguide.disambiguation.exception.ResourceNotFoundException;
import com.termguide.disambiguation.fixtures.TestFixtures;
import com.termguide.disambiguation.service.CloudWatchLoggingService;
import com.termguide.disambiguation.service.index.GuidanceIndexService;

@ExtendWith(MockitoExtension.class)
@DisplayName("GuidanceService Tests")
class GuidanceServiceTest {

  private static final Pattern JINDAN =
      Pattern.builder()
          .term("金丹期")
          .category("cultivation_realms")
          .primaryRendering("Kim Đan")
          .build();

  @Mock private DisambiguationEngine engine;
  @Mock private GuidanceIndexService indexService;
  @Mock private UncertainMatchLog uncertainMatchLog;
  @Mock private CloudWatchLoggingService cloudWatchLoggingService;

  private GuidanceProperties properties;
  private GuidanceService service;

  @BeforeEach
  void setUp() {
    properties = TestFixtures.properties();
    service =
        new GuidanceService(
            engine,
            indexService,
            new PromptInjectionFormatter(properties),
            uncertainMatchLog,
            cloudWatchLoggingService,
            properties,
            Runnable::run);
  }

  private void directHits() {
    lenient()
        .when(engine.disambiguate(any(GuidanceQuery.class), any(CallBudget.class)))
        .thenAnswer(
            invocation ->
                GuidanceResult.direct(
                    invocation.<GuidanceQuery>getArgument(0).getTerm(), JINDAN));
  }

  @Nested
  @DisplayName("Bulk lookups")
  class Bulk {

    @Test
    @DisplayName("Should tag the report with the session and emit a result event")
    void reportsSessionAndLogsEvent() {
      directHits();

      BulkGuidanceReport report = service.queryBulk(List.of("金丹期"), "xianxia", null, null, "s1");

      assertThat(report.getSessionId()).isEqualTo("s1");
      assertThat(report.getDirectHits()).isEqualTo(1);
      verify(indexService).requireActive();
      verify(cloudWatchLoggingService)
          .logEvent(
              eq(CloudWatchLoggingService.EVENT_BULK_GUIDANCE_RESULT), anyString(), anyMap());
    }

    @Test
    @DisplayName("Should reuse a session's cache across calls")
    void sessionCacheIsShared() {
      directHits();
      service.queryBulk(List.of("金丹期"), null, 5, 0.5, "chapter-7");

      BulkGuidanceReport second = service.queryBulk(List.of("金丹期"), null, 5, 0.5, "chapter-7");
      BulkGuidanceReport unscoped = service.queryBulk(List.of("金丹期"), null, 5, 0.5, null);

      assertThat(second.getCacheHits()).isEqualTo(1);
      assertThat(unscoped.getCacheHits()).isZero();
      assertThat(service.activeSessions()).isEqualTo(1);
      verify(engine, times(2)).disambiguate(any(GuidanceQuery.class), any(CallBudget.class));
    }

    @Test
    @DisplayName("Should fail fast when no index is active")
    void requiresIndex() {
      when(indexService.requireActive())
          .thenThrow(new IndexNotReadyException("Guidance index has not been built"));

      assertThatThrownBy(() -> service.queryBulk(List.of("金丹期"), null, null, null, null))
          .isInstanceOf(IndexNotReadyException.class);
      verify(engine, never()).disambiguate(any(GuidanceQuery.class), any(CallBudget.class));
    }

    @Test
    @DisplayName("Should render the looked up terms as a prompt block")
    void formatsPrompt() {
      directHits();

      FormatPromptResponse response =
          service.formatForPrompt(List.of("金丹期"), "xianxia", false, null, null);

      assertThat(response.getInjected()).isEqualTo(1);
      assertThat(response.getPrompt()).contains("- **金丹期** → `Kim Đan`");
    }
  }

  @Nested
  @DisplayName("Sessions and index administration")
  class Administration {

    @Test
    @DisplayName("Should drop a known session and reject an unknown one")
    void dropSession() {
      directHits();
      service.queryBulk(List.of("金丹期"), null, 5, 0.5, "s1");

      service.dropSession("s1");

      assertThat(service.activeSessions()).isZero();
      assertThatThrownBy(() -> service.dropSession("s1"))
          .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Should forget sessions on a forced rebuild only")
    void forcedRebuildInvalidatesSessions() {
      directHits();
      when(indexService.buildIndex(false)).thenReturn(IndexStats.builder().build());
      when(indexService.buildIndex(true)).thenReturn(IndexStats.builder().build());
      service.queryBulk(List.of("金丹期"), null, 5, 0.5, "s1");

      service.buildIndex(false);
      assertThat(service.activeSessions()).isEqualTo(1);

      service.buildIndex(true);
      assertThat(service.activeSessions()).isZero();
      verify(cloudWatchLoggingService, times(2))
          .logEvent(eq(CloudWatchLoggingService.EVENT_INDEX_BUILD), anyString(), anyMap());
    }

    @Test
    @DisplayName("Should clear the index and every session")
    void clearIndex() {
      directHits();
      service.queryBulk(List.of("金丹期"), null, 5, 0.5, "s1");

      service.clearIndex();

      verify(indexService).clear();
      assertThat(service.activeSessions()).isZero();
    }

    @Test
    @DisplayName("Should report thresholds even before an index exists")
    void statsWithoutIndex() {
      when(indexService.getActive()).thenReturn(Optional.empty());

      EngineStats stats = service.getStats();

      assertThat(stats.isReady()).isFalse();
      assertThat(stats.getCollectionName()).isNull();
      assertThat(stats.getThresholds())
          .containsEntry("inject", 0.80)
          .containsEntry("log", 0.65)
          .containsEntry("negative_anchor_penalty", 0.25)
          .containsKeys("negative_anchor_threshold", "aggregation_score");
    }
  }
}
