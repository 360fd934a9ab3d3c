package com.termguide.disambiguation.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("GuidanceProperties Tests")
class GuidancePropertiesTest {

  private GuidanceProperties properties;

  @BeforeEach
  void setUp() {
    properties = new GuidanceProperties();
  }

  @Nested
  @DisplayName("Defaults")
  class Defaults {

    @Test
    @DisplayName("Should accept the built-in defaults")
    void shouldAcceptDefaults() {
      assertThatCode(properties::validate).doesNotThrowAnyException();
      assertThat(properties.getThresholds().getInject()).isEqualTo(0.80);
      assertThat(properties.getThresholds().getLog()).isEqualTo(0.65);
      assertThat(properties.getNegativeAnchor().getThreshold()).isEqualTo(0.82);
      assertThat(properties.getNegativeAnchor().getPenalty()).isEqualTo(0.25);
      assertThat(properties.getIndex().getBatchSize()).isEqualTo(50);
      assertThat(properties.getBulk().getDefaultMaxApiCalls()).isEqualTo(20);
      assertThat(properties.getWarnCategories()).containsExactly("false_cognates");
    }

    @Test
    @DisplayName("Should fall back to the neutral priority for unknown categories")
    void shouldUseNeutralPriority() {
      properties.setCategoryPriorities(Map.of("cultivation_realms", 9));

      assertThat(properties.priorityFor("cultivation_realms")).isEqualTo(9);
      assertThat(properties.priorityFor("unknown")).isEqualTo(GuidanceProperties.NEUTRAL_PRIORITY);
    }
  }

  @Nested
  @DisplayName("Validation")
  class Validation {

    @Test
    @DisplayName("Should reject a log threshold above the inject threshold")
    void shouldRejectInvertedThresholds() {
      properties.getThresholds().setInject(0.60);
      properties.getThresholds().setLog(0.70);
      properties.getAggregation().setScore(0.50);

      assertThatThrownBy(properties::validate)
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("guidance.thresholds.log");
    }

    @Test
    @DisplayName("Should accept equal log and inject thresholds")
    void shouldAcceptEqualThresholds() {
      properties.getThresholds().setInject(0.75);
      properties.getThresholds().setLog(0.75);
      properties.getAggregation().setScore(0.70);

      assertThatCode(properties::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject an aggregation score that would reach the inject tier")
    void shouldRejectAggregationAtInject() {
      properties.getAggregation().setScore(0.80);

      assertThatThrownBy(properties::validate)
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("guidance.aggregation.score");
    }

    @Test
    @DisplayName("Should reject values outside the unit interval")
    void shouldRejectNonUnitValues() {
      properties.getNegativeAnchor().setPenalty(1.5);

      assertThatThrownBy(properties::validate)
          .isInstanceOf(IllegalStateException.class)
          .hasMessage("guidance.negative-anchor.penalty must be within [0, 1] but was 1.5");
    }

    @Test
    @DisplayName("Should reject NaN thresholds")
    void shouldRejectNaN() {
      properties.getThresholds().setInject(Double.NaN);

      assertThatThrownBy(properties::validate)
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("guidance.thresholds.inject");
    }

    @Test
    @DisplayName("Should reject a non-positive batch size")
    void shouldRejectZeroBatchSize() {
      properties.getIndex().setBatchSize(0);

      assertThatThrownBy(properties::validate)
          .isInstanceOf(IllegalStateException.class)
          .hasMessage("guidance.index.batch-size must be positive but was 0");
    }

    @Test
    @DisplayName("Should reject a negative default call budget")
    void shouldRejectNegativeDefaultBudget() {
      properties.getBulk().setDefaultMaxApiCalls(-1);

      assertThatThrownBy(properties::validate)
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("guidance.bulk.default-max-api-calls");
    }

    @Test
    @DisplayName("Should accept a zero default call budget")
    void shouldAcceptZeroDefaultBudget() {
      properties.getBulk().setDefaultMaxApiCalls(0);

      assertThatCode(properties::validate).doesNotThrowAnyException();
    }
  }
}
