package com.termguide.disambiguation.service.vector;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.termguide.disambiguation.config.GuidanceProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Offline feature-hashing embedder. Words, character trigrams and, for scripts written without
 * spaces, character bigrams are hashed into a fixed number of buckets and the result is scaled to
 * unit length. Deterministic for a given dimension, which is part of the model id.
 */
@Slf4j
@Component
@ConditionalOnProperty(
    name = "guidance.embedding.provider",
    havingValue = "hashing",
    matchIfMissing = true)
public class HashingEmbedder implements Embedder {

  private static final String VERSION = "local-hashing-v1";
  private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

  private final int dimension;

  @Autowired
  public HashingEmbedder(GuidanceProperties properties) {
    this(properties.getEmbedding().getDimension());
  }

  public HashingEmbedder(int dimension) {
    if (dimension <= 0) {
      throw new IllegalArgumentException("dimension must be positive");
    }
    this.dimension = dimension;
    log.info("Using offline hashing embedder {}", getModelId());
  }

  @Override
  public List<Float> embed(String text) {
    float[] vector = new float[dimension];
    if (text == null || text.isBlank()) {
      return VectorMath.normalize(vector);
    }

    String normalized = text.toLowerCase(Locale.ROOT);
    for (String token : TOKEN_SPLIT.split(normalized)) {
      if (token.isEmpty()) {
        continue;
      }
      addHashed(vector, "tok:" + token, 1.0f);
      int[] codePoints = token.codePoints().toArray();
      if (isUnspaced(codePoints)) {
        for (int i = 0; i < codePoints.length; i++) {
          addHashed(vector, "chr:" + new String(codePoints, i, 1), 0.5f);
          if (i + 1 < codePoints.length) {
            addHashed(vector, "bi:" + new String(codePoints, i, 2), 0.75f);
          }
        }
      } else if (codePoints.length >= 3) {
        for (int i = 0; i <= codePoints.length - 3; i++) {
          addHashed(vector, "tri:" + new String(codePoints, i, 3), 0.35f);
        }
      }
    }
    return VectorMath.normalize(vector);
  }

  @Override
  public List<List<Float>> embedBatch(List<String> texts) {
    return texts.stream().map(this::embed).collect(Collectors.toList());
  }

  @Override
  public String getModelId() {
    return VERSION + ":" + dimension;
  }

  private void addHashed(float[] vector, String key, float weight) {
    vector[Math.floorMod(key.hashCode(), vector.length)] += weight;
  }

  /** Han, kana and hangul runs carry no word boundaries, so they are hashed per character. */
  private static boolean isUnspaced(int[] codePoints) {
    for (int codePoint : codePoints) {
      Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
      if (script == Character.UnicodeScript.HAN
          || script == Character.UnicodeScript.HIRAGANA
          || script == Character.UnicodeScript.KATAKANA
          || script == Character.UnicodeScript.HANGUL) {
        return true;
      }
    }
    return false;
  }
}
