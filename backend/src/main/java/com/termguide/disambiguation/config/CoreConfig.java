package com.termguide.disambiguation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

@Configuration
public class CoreConfig {

  @Bean
  public ObjectMapper objectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return mapper;
  }

  /** Bounded pool used to fan bulk guidance lookups out; its size caps concurrent API calls. */
  @Bean(name = "guidanceExecutor")
  public ThreadPoolTaskExecutor guidanceExecutor(GuidanceProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getBulk().getConcurrency());
    executor.setMaxPoolSize(properties.getBulk().getConcurrency());
    executor.setQueueCapacity(10000);
    executor.setThreadNamePrefix("guidance-");
    executor.initialize();
    return executor;
  }
}
