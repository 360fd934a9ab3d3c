package com.termguide.disambiguation.dto.guidance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One lookup as seen by the engine. Genre and context are optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuidanceQuery {

  private String term;
  private QueryContext context;
  private String genre;

  /** Restricts vector candidates to one category; null means every category. */
  private String categoryFilter;

  public static GuidanceQuery of(String term) {
    return GuidanceQuery.builder().term(term).build();
  }

  public static GuidanceQuery of(String term, String genre) {
    return GuidanceQuery.builder().term(term).genre(genre).build();
  }
}
