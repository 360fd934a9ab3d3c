package com.termguide.disambiguation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.test.util.ReflectionTestUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.termguide.disambiguation.UserMdcFilter;
import com.termguide.disambiguation.service.aws.AwsCredentialsService;

import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.InputLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsResponse;

@ExtendWith(MockitoExtension.class)
@DisplayName("CloudWatchLoggingService Tests")
class CloudWatchLoggingServiceTest {

  @Mock private AwsCredentialsService awsCredentialsService;

  @Mock private CloudWatchLogsClient cloudWatchLogsClient;

  private CloudWatchLoggingService cloudWatchLoggingService;

  @BeforeEach
  void setUp() {
    cloudWatchLoggingService =
        new CloudWatchLoggingService(awsCredentialsService, new ObjectMapper());
    ReflectionTestUtils.setField(cloudWatchLoggingService, "logGroupName", "/term-guidance");
    ReflectionTestUtils.setField(cloudWatchLoggingService, "logStreamName", "guidance-engine");
    ReflectionTestUtils.setField(cloudWatchLoggingService, "awsRegion", "us-east-1");
    ReflectionTestUtils.setField(cloudWatchLoggingService, "minLevel", "INFO");
    ReflectionTestUtils.setField(
        cloudWatchLoggingService, "allowedLoggersCsv", "com.termguide.disambiguation.service");
    ReflectionTestUtils.setField(
        cloudWatchLoggingService,
        "allowedEventTypesCsv",
        "UNCERTAIN_MATCH,INDEX_BUILD,BULK_GUIDANCE_RESULT");
  }

  @AfterEach
  void tearDown() {
    MDC.clear();
  }

  private void enable() {
    ReflectionTestUtils.setField(cloudWatchLoggingService, "cloudWatchEnabled", true);
    ReflectionTestUtils.setField(
        cloudWatchLoggingService, "cloudWatchLogsClient", cloudWatchLogsClient);
  }

  @SuppressWarnings("unchecked")
  private ConcurrentLinkedQueue<InputLogEvent> queue() {
    return (ConcurrentLinkedQueue<InputLogEvent>)
        ReflectionTestUtils.getField(cloudWatchLoggingService, "logEventQueue");
  }

  @Nested
  @DisplayName("Disabled")
  class Disabled {

    @Test
    @DisplayName("Should neither create a client nor queue events")
    void staysIdle() {
      cloudWatchLoggingService.init();
      cloudWatchLoggingService.logEvent(
          CloudWatchLoggingService.EVENT_INDEX_BUILD, "built", Map.of("totalIndexed", 3));

      assertThat(cloudWatchLoggingService.isEnabled()).isFalse();
      assertThat(cloudWatchLoggingService.queuedEvents()).isZero();
      verifyNoInteractions(awsCredentialsService);
    }
  }

  @Nested
  @DisplayName("Filtering")
  class Filtering {

    @Test
    @DisplayName("Should queue allowed event types with caller identity from the MDC")
    void queuesAllowedEvent() {
      enable();
      MDC.put(UserMdcFilter.USERNAME_MDC_KEY, "translator-1");
      MDC.put(UserMdcFilter.CORRELATION_ID_MDC_KEY, "corr-42");

      cloudWatchLoggingService.logEvent(
          CloudWatchLoggingService.EVENT_UNCERTAIN_MATCH, "Uncertain", Map.of("term", "灵根"));

      assertThat(cloudWatchLoggingService.queuedEvents()).isEqualTo(1);
      String message = queue().peek().message();
      assertThat(message).startsWith("[INFO] [translator-1] Uncertain");
      assertThat(message)
          .contains("\"correlationId\":\"corr-42\"")
          .contains("\"eventType\":\"UNCERTAIN_MATCH\"")
          .contains("灵根");
    }

    @Test
    @DisplayName("Should drop event types outside the allow-list")
    void dropsUnknownEventType() {
      enable();

      cloudWatchLoggingService.logEvent("CACHE_STATS", "stats", Map.of());

      assertThat(cloudWatchLoggingService.queuedEvents()).isZero();
    }

    @Test
    @DisplayName("Should respect the minimum level and the logger allow-list")
    void levelAndLoggerFilters() {
      assertThat(cloudWatchLoggingService.shouldSend("DEBUG", Map.of())).isFalse();
      assertThat(cloudWatchLoggingService.shouldSend("WARN", Map.of())).isTrue();
      String engineLogger = "com.termguide.disambiguation.service.guidance.GuidanceService";
      assertThat(cloudWatchLoggingService.shouldSend("ERROR", Map.of("logger", engineLogger)))
          .isTrue();
      assertThat(
              cloudWatchLoggingService.shouldSend("ERROR", Map.of("logger", "org.apache.catalina")))
          .isFalse();
    }

    @Test
    @DisplayName("Should split oversized messages into chunks")
    void chunksLargeMessages() {
      enable();

      cloudWatchLoggingService.log("WARN", "huge", Map.of("payload", "x".repeat(300_000)));

      assertThat(cloudWatchLoggingService.queuedEvents()).isEqualTo(2);
      assertThat(queue().peek().message()).contains("[CHUNK 1/2");
    }
  }

  @Nested
  @DisplayName("Upload")
  class Upload {

    @Test
    @DisplayName("Should upload queued events and keep the sequence token")
    void uploadsBatch() {
      enable();
      when(cloudWatchLogsClient.putLogEvents(any(PutLogEventsRequest.class)))
          .thenReturn(PutLogEventsResponse.builder().nextSequenceToken("token-2").build());
      cloudWatchLoggingService.log("INFO", "first", null);
      cloudWatchLoggingService.log("INFO", "second", null);

      ReflectionTestUtils.invokeMethod(cloudWatchLoggingService, "uploadLogs");

      ArgumentCaptor<PutLogEventsRequest> captor =
          ArgumentCaptor.forClass(PutLogEventsRequest.class);
      verify(cloudWatchLogsClient).putLogEvents(captor.capture());
      assertThat(captor.getValue().logEvents()).hasSize(2);
      assertThat(captor.getValue().logGroupName()).isEqualTo("/term-guidance");
      assertThat(cloudWatchLoggingService.queuedEvents()).isZero();
      assertThat(ReflectionTestUtils.getField(cloudWatchLoggingService, "sequenceToken"))
          .isEqualTo("token-2");
    }

    @Test
    @DisplayName("Should requeue events when the upload fails")
    void requeuesOnFailure() {
      enable();
      when(cloudWatchLogsClient.putLogEvents(any(PutLogEventsRequest.class)))
          .thenThrow(new IllegalStateException("network down"));
      cloudWatchLoggingService.log("INFO", "kept", null);

      ReflectionTestUtils.invokeMethod(cloudWatchLoggingService, "uploadLogs");

      assertThat(cloudWatchLoggingService.queuedEvents()).isEqualTo(1);
    }
  }
}
