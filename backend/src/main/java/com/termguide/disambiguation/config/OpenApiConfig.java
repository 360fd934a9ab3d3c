package com.termguide.disambiguation.config;

import java.util.List;
import java.util.Locale;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import lombok.RequiredArgsConstructor;

/** API document for the guidance endpoints. The description quotes the live confidence gate. */
@Configuration
@RequiredArgsConstructor
public class OpenApiConfig {

  static final String SUMMARY =
      "Resolves source-language terms to target-language renderings and renders the confident "
          + "ones as a prompt guidance block.";

  private final GuidanceProperties properties;

  @Value("${springdoc.info.title:Term Guidance Engine API}")
  private String title;

  @Value("${springdoc.info.version:1.0.0}")
  private String version;

  @Value("${server.port:8081}")
  private String serverPort;

  @Bean
  public OpenAPI guidanceOpenAPI() {
    return new OpenAPI()
        .info(new Info().title(title).version(version).description(describe()))
        .tags(
            List.of(
                new Tag()
                    .name("Guidance")
                    .description("Term disambiguation lookups and prompt formatting"),
                new Tag()
                    .name("Index Administration")
                    .description("Build, inspect and validate the guidance index")))
        .servers(
            List.of(
                new Server()
                    .url("http://localhost:" + serverPort)
                    .description("Local development server")));
  }

  String describe() {
    GuidanceProperties.Thresholds thresholds = properties.getThresholds();
    return SUMMARY
        + String.format(
            Locale.ROOT,
            " Results scoring at least %.2f are INJECT, at least %.2f LOG, anything lower IGNORE.",
            thresholds.getInject(),
            thresholds.getLog());
  }
}
