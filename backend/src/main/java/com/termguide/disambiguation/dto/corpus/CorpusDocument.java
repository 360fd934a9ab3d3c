package com.termguide.disambiguation.dto.corpus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire shape of a corpus file. Field names follow the snake_case corpus format; the aliases accept
 * the older per-store spellings ({@code hanzi}, {@code vn_term}, {@code avoid}, ...) so existing
 * corpora load unchanged.
 */
@Data
@NoArgsConstructor
public class CorpusDocument {

  private String version;

  @JsonProperty("pattern_categories")
  @JsonAlias({"categories"})
  private Map<String, CategorySection> patternCategories;

  /** Anchors declared outside their category; each must name a known category. */
  @JsonProperty("negative_anchors")
  private List<AnchorEntry> negativeAnchors = new ArrayList<>();

  @Data
  @NoArgsConstructor
  public static class CategorySection {
    private String description;
    private Integer priority;
    private List<PatternEntry> patterns = new ArrayList<>();

    @JsonProperty("negative_anchors")
    private List<String> negativeAnchors = new ArrayList<>();

    @JsonProperty("negative_vectors")
    private NegativeVectors negativeVectors;
  }

  @Data
  @NoArgsConstructor
  public static class NegativeVectors {
    private String description;
    private List<String> texts = new ArrayList<>();
  }

  @Data
  @NoArgsConstructor
  public static class PatternEntry {
    @JsonAlias({"hanzi", "source_term", "source"})
    private String term;

    @JsonProperty("primary_rendering")
    @JsonAlias({"vn_term", "primary_reading", "rendering", "correct"})
    private String primaryRendering;

    @JsonProperty("alternate_renderings")
    @JsonAlias({"alternatives", "alternate_readings"})
    private List<String> alternateRenderings = new ArrayList<>();

    @JsonProperty("discouraged_renderings")
    @JsonAlias({"avoid", "wrong_renderings"})
    private List<String> discouragedRenderings = new ArrayList<>();

    @JsonProperty("context_tags")
    @JsonAlias({"tags", "domains"})
    private List<String> contextTags = new ArrayList<>();

    @JsonProperty("corpus_frequency")
    @JsonAlias({"frequency"})
    private Long corpusFrequency;

    @JsonProperty("context_indicators")
    @JsonAlias({"zh_indicators", "indicators"})
    private List<String> contextIndicators = new ArrayList<>();

    @JsonAlias({"meaning", "notes"})
    private String explanation;
  }

  @Data
  @NoArgsConstructor
  public static class AnchorEntry {
    private String category;

    @JsonAlias({"source_text", "example"})
    private String text;
  }
}
