package com.termguide.disambiguation.dto.guidance;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Single term lookup")
public class GuidanceQueryRequest {

  @NotBlank(message = "term is required")
  @Size(max = 200, message = "term must be at most 200 characters")
  @Schema(
      description = "Source-language term",
      example = "金丹期",
      requiredMode = Schema.RequiredMode.REQUIRED)
  private String term;

  @Valid private QueryContext context;

  @Schema(description = "Genre tag used to bias ranking", example = "cultivation_novel")
  private String genre;

  @Schema(description = "Restrict vector candidates to this category")
  private String category;

  public GuidanceQuery toQuery() {
    return GuidanceQuery.builder()
        .term(term)
        .context(context)
        .genre(genre)
        .categoryFilter(category)
        .build();
  }
}
