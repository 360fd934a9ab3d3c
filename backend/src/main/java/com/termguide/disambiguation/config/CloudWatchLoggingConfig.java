package com.termguide.disambiguation.config;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.boot.logging.logback.LogbackLoggingSystem;
import org.springframework.context.annotation.Configuration;

import com.termguide.disambiguation.UserMdcFilter;
import com.termguide.disambiguation.service.CloudWatchLoggingService;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;

/** Attaches a logback appender that forwards application logs to CloudWatch when it is enabled. */
@Configuration
@RequiredArgsConstructor
public class CloudWatchLoggingConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(CloudWatchLoggingConfig.class);

  private final CloudWatchLoggingService cloudWatchLoggingService;
  private final LoggingSystem loggingSystem;

  @PostConstruct
  public void configureCloudWatchLogging() {
    if (!cloudWatchLoggingService.isEnabled()) {
      LOGGER.debug("CloudWatch shipping disabled; skipping appender configuration");
      return;
    }
    if (!(loggingSystem instanceof LogbackLoggingSystem)) {
      LOGGER.warn("CloudWatch appender needs logback, found {}", loggingSystem.getClass());
      return;
    }

    LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
    CloudWatchAppender appender = new CloudWatchAppender(cloudWatchLoggingService);
    appender.setContext(loggerContext);
    appender.start();
    loggerContext.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(appender);
    LOGGER.debug("CloudWatch logging appender configured");
  }

  private static final class CloudWatchAppender extends AppenderBase<ILoggingEvent> {
    private final CloudWatchLoggingService cloudWatchLoggingService;

    private CloudWatchAppender(CloudWatchLoggingService cloudWatchLoggingService) {
      this.cloudWatchLoggingService = cloudWatchLoggingService;
    }

    @Override
    protected void append(ILoggingEvent event) {
      // recursion guard
      if (event.getLoggerName().contains("CloudWatchLoggingService")
          || event.getLoggerName().contains("CloudWatchLogsClient")) {
        return;
      }

      Map<String, Object> data = new HashMap<>();
      data.put("logger", event.getLoggerName());
      data.put("thread", event.getThreadName());
      if (event.getThrowableProxy() != null) {
        data.put("exception", event.getThrowableProxy().getClassName());
        data.put("exceptionMessage", event.getThrowableProxy().getMessage());
      }
      Map<String, String> mdc = event.getMDCPropertyMap();
      String username = mdc.get(UserMdcFilter.USERNAME_MDC_KEY);
      if (username != null && !username.isEmpty()) {
        data.put(UserMdcFilter.USERNAME_MDC_KEY, username);
      }
      String correlationId = mdc.get(UserMdcFilter.CORRELATION_ID_MDC_KEY);
      if (correlationId != null && !correlationId.isEmpty()) {
        data.put(UserMdcFilter.CORRELATION_ID_MDC_KEY, correlationId);
      }

      try {
        cloudWatchLoggingService.log(
            event.getLevel().toString(), event.getFormattedMessage(), data);
      } catch (RuntimeException e) {
        addError("Failed to send log to CloudWatch", e);
      }
    }
  }
}
