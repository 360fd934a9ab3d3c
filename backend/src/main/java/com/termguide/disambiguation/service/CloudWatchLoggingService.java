package com.termguide.disambiguation.service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.termguide.disambiguation.UserMdcFilter;
import com.termguide.disambiguation.service.aws.AwsCredentialsService;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogGroupRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogStreamRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.InputLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.InvalidSequenceTokenException;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceAlreadyExistsException;

/**
 * Ships structured engine events (uncertain matches, index builds, bulk summaries) and selected
 * application logs to CloudWatch Logs. Events are queued and uploaded in batches every few
 * seconds; nothing is queued while shipping is disabled.
 */
@Service
public class CloudWatchLoggingService {
  private static final Logger LOGGER = LoggerFactory.getLogger(CloudWatchLoggingService.class);
  private static final int MAX_BATCH_SIZE = 10000;
  private static final int MAX_BATCH_BYTES = 1048576;
  private static final int MAX_MESSAGE_SIZE = 256000;
  private static final List<String> LEVEL_ORDER =
      Arrays.asList("TRACE", "DEBUG", "INFO", "WARN", "ERROR");

  public static final String EVENT_UNCERTAIN_MATCH = "UNCERTAIN_MATCH";
  public static final String EVENT_INDEX_BUILD = "INDEX_BUILD";
  public static final String EVENT_BULK_GUIDANCE_RESULT = "BULK_GUIDANCE_RESULT";

  private final AwsCredentialsService awsCredentialsService;
  private final ObjectMapper objectMapper;

  @Value("${aws.cloudwatch.enabled:false}")
  private boolean cloudWatchEnabled;

  @Value("${aws.cloudwatch.log-group:/term-guidance}")
  private String logGroupName;

  @Value("${aws.cloudwatch.log-stream:guidance-engine}")
  private String logStreamName;

  @Value("${aws.region:us-east-1}")
  private String awsRegion;

  @Value("${aws.cloudwatch.upload-interval-seconds:5}")
  private long uploadIntervalSeconds;

  @Value("${aws.cloudwatch.filter.min-level:INFO}")
  private String minLevel;

  @Value("${aws.cloudwatch.filter.allowed-loggers:com.termguide.disambiguation.service}")
  private String allowedLoggersCsv;

  @Value(
      "${aws.cloudwatch.filter.allow-event-types:"
          + EVENT_UNCERTAIN_MATCH
          + ","
          + EVENT_INDEX_BUILD
          + ","
          + EVENT_BULK_GUIDANCE_RESULT
          + "}")
  private String allowedEventTypesCsv;

  private CloudWatchLogsClient cloudWatchLogsClient;
  private ScheduledExecutorService scheduler;
  private final ConcurrentLinkedQueue<InputLogEvent> logEventQueue = new ConcurrentLinkedQueue<>();
  private String sequenceToken;

  public CloudWatchLoggingService(
      AwsCredentialsService awsCredentialsService, ObjectMapper objectMapper) {
    this.awsCredentialsService = awsCredentialsService;
    this.objectMapper = objectMapper;
  }

  @PostConstruct
  public void init() {
    if (!cloudWatchEnabled) {
      LOGGER.info("CloudWatch logging is disabled");
      return;
    }

    try {
      cloudWatchLogsClient =
          CloudWatchLogsClient.builder()
              .region(Region.of(awsRegion))
              .credentialsProvider(awsCredentialsService.getCredentialsProvider())
              .build();
      ensureLogGroupAndStreamExist();

      scheduler = Executors.newSingleThreadScheduledExecutor();
      scheduler.scheduleAtFixedRate(
          this::uploadLogs, uploadIntervalSeconds, uploadIntervalSeconds, TimeUnit.SECONDS);
      LOGGER.info(
          "CloudWatch logging initialized for log group {} and stream {}",
          logGroupName,
          logStreamName);
    } catch (RuntimeException e) {
      LOGGER.error("Failed to initialize CloudWatch logging, shipping disabled", e);
      cloudWatchEnabled = false;
    }
  }

  public boolean isEnabled() {
    return cloudWatchEnabled;
  }

  /** Queues a structured event; {@code eventType} is matched against the allow-list. */
  public void logEvent(String eventType, String message, Map<String, Object> data) {
    Map<String, Object> withType = new LinkedHashMap<>();
    if (data != null) {
      withType.putAll(data);
    }
    withType.put("eventType", eventType);
    log("INFO", message, withType);
  }

  public void log(String level, String message, Map<String, Object> data) {
    if (!cloudWatchEnabled) {
      return;
    }
    String normalizedLevel = level != null ? level.toUpperCase() : "INFO";
    if (!shouldSend(normalizedLevel, data)) {
      return;
    }

    String username = resolve(data, UserMdcFilter.USERNAME_MDC_KEY, "anonymous");
    String correlationId = resolve(data, UserMdcFilter.CORRELATION_ID_MDC_KEY, null);

    Map<String, Object> fullData = new LinkedHashMap<>();
    fullData.put("level", normalizedLevel);
    fullData.put("username", username);
    fullData.put("message", message);
    fullData.put("timestamp", Instant.now().toString());
    if (correlationId != null) {
      fullData.put("correlationId", correlationId);
    }
    if (data != null) {
      Map<String, Object> details = new LinkedHashMap<>(data);
      details.remove(UserMdcFilter.USERNAME_MDC_KEY);
      details.remove(UserMdcFilter.CORRELATION_ID_MDC_KEY);
      if (!details.isEmpty()) {
        fullData.put("data", details);
      }
    }

    String json;
    try {
      json = objectMapper.writeValueAsString(fullData);
    } catch (JsonProcessingException e) {
      LOGGER.warn("Could not serialize CloudWatch event '{}': {}", message, e.getMessage());
      return;
    }

    String formatted = String.format("[%s] [%s] %s%n%s", normalizedLevel, username, message, json);
    if (formatted.getBytes(StandardCharsets.UTF_8).length > MAX_MESSAGE_SIZE) {
      queueChunked(formatted, normalizedLevel, username, message);
    } else {
      logEventQueue.offer(
          InputLogEvent.builder()
              .timestamp(Instant.now().toEpochMilli())
              .message(formatted)
              .build());
    }
  }

  int queuedEvents() {
    return logEventQueue.size();
  }

  boolean shouldSend(String level, Map<String, Object> data) {
    int lvl = LEVEL_ORDER.indexOf(level);
    int min = LEVEL_ORDER.indexOf(minLevel != null ? minLevel.toUpperCase() : "INFO");
    if (lvl >= 0 && min >= 0 && lvl < min) {
      return false;
    }
    if (data != null && data.containsKey("eventType")) {
      return csv(allowedEventTypesCsv).contains(String.valueOf(data.get("eventType")));
    }
    if (data != null && data.containsKey("logger")) {
      String logger = String.valueOf(data.get("logger"));
      return csv(allowedLoggersCsv).stream().anyMatch(logger::startsWith);
    }
    return true;
  }

  private static Set<String> csv(String value) {
    return Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .collect(Collectors.toSet());
  }

  private static String resolve(Map<String, Object> data, String key, String fallback) {
    if (data != null && data.get(key) != null) {
      return String.valueOf(data.get(key));
    }
    String fromMdc = MDC.get(key);
    return fromMdc != null && !fromMdc.isEmpty() ? fromMdc : fallback;
  }

  private void queueChunked(String formatted, String level, String username, String summary) {
    byte[] bytes = formatted.getBytes(StandardCharsets.UTF_8);
    int totalChunks = (int) Math.ceil((double) bytes.length / MAX_MESSAGE_SIZE);
    String chunkId = UUID.randomUUID().toString().substring(0, 8);
    long timestamp = Instant.now().toEpochMilli();
    LOGGER.debug("Chunking large log message into {} parts (ID: {})", totalChunks, chunkId);

    for (int i = 0; i < totalChunks; i++) {
      int start = i * MAX_MESSAGE_SIZE;
      int end = Math.min(start + MAX_MESSAGE_SIZE, bytes.length);
      String chunk = new String(bytes, start, end - start, StandardCharsets.UTF_8);
      String header =
          i == 0
              ? String.format(
                  "[%s] [%s] [CHUNK %d/%d ID:%s] %s",
                  level, username, i + 1, totalChunks, chunkId, summary)
              : String.format("[CHUNK %d/%d ID:%s]", i + 1, totalChunks, chunkId);
      logEventQueue.offer(
          InputLogEvent.builder().timestamp(timestamp + i).message(header + "\n" + chunk).build());
    }
  }

  private void ensureLogGroupAndStreamExist() {
    try {
      cloudWatchLogsClient.createLogGroup(
          CreateLogGroupRequest.builder().logGroupName(logGroupName).build());
      LOGGER.info("Created CloudWatch log group: {}", logGroupName);
    } catch (ResourceAlreadyExistsException e) {
      LOGGER.debug("CloudWatch log group {} already exists", logGroupName);
    }

    try {
      cloudWatchLogsClient.createLogStream(
          CreateLogStreamRequest.builder()
              .logGroupName(logGroupName)
              .logStreamName(logStreamName)
              .build());
      LOGGER.info("Created CloudWatch log stream: {}", logStreamName);
    } catch (ResourceAlreadyExistsException e) {
      LOGGER.debug("CloudWatch log stream {} already exists", logStreamName);
    }
  }

  private synchronized void uploadLogs() {
    List<InputLogEvent> batch = new ArrayList<>();
    int batchBytes = 0;
    while (batch.size() < MAX_BATCH_SIZE) {
      InputLogEvent event = logEventQueue.peek();
      if (event == null) {
        break;
      }
      int eventSize = event.message().getBytes(StandardCharsets.UTF_8).length + 26;
      if (batchBytes + eventSize > MAX_BATCH_BYTES && !batch.isEmpty()) {
        break;
      }
      logEventQueue.poll();
      batch.add(event);
      batchBytes += eventSize;
    }
    if (batch.isEmpty()) {
      return;
    }

    batch.sort(Comparator.comparingLong(InputLogEvent::timestamp));
    try {
      PutLogEventsRequest.Builder request =
          PutLogEventsRequest.builder()
              .logGroupName(logGroupName)
              .logStreamName(logStreamName)
              .logEvents(batch);
      if (sequenceToken != null) {
        request.sequenceToken(sequenceToken);
      }
      PutLogEventsResponse response = cloudWatchLogsClient.putLogEvents(request.build());
      sequenceToken = response.nextSequenceToken();
    } catch (InvalidSequenceTokenException e) {
      sequenceToken = e.expectedSequenceToken();
      batch.forEach(logEventQueue::offer);
    } catch (RuntimeException e) {
      LOGGER.error("Failed to upload logs to CloudWatch, requeueing {} events", batch.size(), e);
      batch.forEach(logEventQueue::offer);
    }
  }

  @PreDestroy
  public void shutdown() {
    if (scheduler == null) {
      return;
    }
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
        scheduler.shutdownNow();
      }
      uploadLogs();
    } catch (InterruptedException e) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      cloudWatchLogsClient.close();
    }
  }
}
