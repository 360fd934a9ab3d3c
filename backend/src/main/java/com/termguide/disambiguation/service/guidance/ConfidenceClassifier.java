package com.termguide.disambiguation.service.guidance;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.termguide.disambiguation.config.GuidanceProperties;
import com.termguide.disambiguation.dto.guidance.ConfidenceTier;

/**
 * Maps a final score onto a tier. Each tier's lower bound is inclusive, so a score equal to the
 * inject threshold is INJECT and a score equal to the log threshold is LOG.
 */
@Component
public class ConfidenceClassifier {

  private final double injectThreshold;
  private final double logThreshold;

  @Autowired
  public ConfidenceClassifier(GuidanceProperties properties) {
    this(properties.getThresholds().getInject(), properties.getThresholds().getLog());
  }

  private ConfidenceClassifier(double injectThreshold, double logThreshold) {
    if (logThreshold > injectThreshold) {
      throw new IllegalArgumentException(
          "log threshold " + logThreshold + " exceeds inject threshold " + injectThreshold);
    }
    this.injectThreshold = injectThreshold;
    this.logThreshold = logThreshold;
  }

  public static ConfidenceClassifier of(double injectThreshold, double logThreshold) {
    return new ConfidenceClassifier(injectThreshold, logThreshold);
  }

  public ConfidenceTier classify(double finalScore) {
    if (finalScore >= injectThreshold) {
      return ConfidenceTier.INJECT;
    }
    if (finalScore >= logThreshold) {
      return ConfidenceTier.LOG;
    }
    return ConfidenceTier.IGNORE;
  }

  public double getInjectThreshold() {
    return injectThreshold;
  }

  public double getLogThreshold() {
    return logThreshold;
  }
}
