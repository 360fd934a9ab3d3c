package com.termguide.disambiguation.dto.guidance;

import com.fasterxml.jackson.annotation.JsonIgnore;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Text surrounding the term in the source document")
public class QueryContext {

  @Schema(description = "Sentence or clause before the term")
  private String previous;

  @Schema(description = "Sentence or clause after the term")
  private String next;

  @JsonIgnore
  public boolean isEmpty() {
    return (previous == null || previous.isBlank()) && (next == null || next.isBlank());
  }

  public boolean mentions(String word) {
    return (previous != null && previous.contains(word)) || (next != null && next.contains(word));
  }
}
