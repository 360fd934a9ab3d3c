package com.termguide.disambiguation.dto.corpus;

import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * One source-term to rendering disambiguation entry. Instances are created once while a corpus is
 * loaded and stay immutable for as long as the index built from them is active.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@Schema(description = "Source term and its preferred target-language rendering")
public class Pattern {

  @Schema(description = "Source-language surface form", example = "金丹期")
  private final String term;

  @Schema(description = "Logical category", example = "cultivation_realms")
  private final String category;

  /** Handle resolved from the category registry at load time. */
  @JsonIgnore private final int categoryId;

  @Schema(description = "Preferred rendering", example = "Kim Đan")
  private final String primaryRendering;

  @Singular private final List<String> alternateRenderings;

  @Singular private final Set<String> discouragedRenderings;

  @Singular private final Set<String> contextTags;

  /** Informational only; breaks ranking ties, never decides correctness. */
  private final long corpusFrequency;

  /** Words whose presence in the surrounding context makes this reading more likely. */
  @Singular private final List<String> contextIndicators;

  private final String explanation;
}
