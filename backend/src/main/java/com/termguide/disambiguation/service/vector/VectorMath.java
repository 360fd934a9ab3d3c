package com.termguide.disambiguation.service.vector;

import java.util.ArrayList;
import java.util.List;

public final class VectorMath {

  private VectorMath() {}

  /**
   * Cosine similarity of two vectors of equal length. Returns 0 when either vector has no
   * magnitude.
   */
  public static double cosine(List<Float> a, List<Float> b) {
    if (a.size() != b.size()) {
      throw new IllegalArgumentException(
          "Vectors must have the same dimension (" + a.size() + " vs " + b.size() + ")");
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.size(); i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  /** Unit-length copy of {@code vector}, or the vector itself when it has no magnitude. */
  public static List<Float> normalize(float[] vector) {
    double normSquared = 0.0;
    for (float v : vector) {
      normSquared += v * v;
    }
    double norm = Math.sqrt(normSquared);
    List<Float> result = new ArrayList<>(vector.length);
    for (float v : vector) {
      result.add(norm > 0.0 ? (float) (v / norm) : v);
    }
    return result;
  }

  public static double clampUnit(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}
