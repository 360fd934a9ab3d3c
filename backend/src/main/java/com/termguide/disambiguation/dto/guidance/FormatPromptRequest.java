package com.termguide.disambiguation.dto.guidance;

import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Look up terms and render the guidance block for a prompt")
public class FormatPromptRequest {

  @NotEmpty(message = "terms must not be empty")
  @Size(max = 5000, message = "at most 5000 terms per batch")
  private List<String> terms;

  private String genre;

  @Schema(description = "Also render LOG-tier results as suggestions")
  private boolean includeSuggestions;

  @Min(value = 0, message = "maxApiCalls must be >= 0")
  private Integer maxApiCalls;

  @Size(max = 128)
  private String sessionId;
}
