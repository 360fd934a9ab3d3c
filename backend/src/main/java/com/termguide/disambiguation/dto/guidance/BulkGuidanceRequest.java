package com.termguide.disambiguation.dto.guidance;

import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
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
@Schema(description = "Batch lookup, typically every pattern detected in one chapter")
public class BulkGuidanceRequest {

  @NotEmpty(message = "terms must not be empty")
  @Size(max = 5000, message = "at most 5000 terms per batch")
  private List<String> terms;

  private String genre;

  @Valid
  @Schema(description = "Surrounding text shared by every term of the batch, e.g. the chapter")
  private QueryContext context;

  @Min(value = 0, message = "maxApiCalls must be >= 0")
  @Schema(description = "Ceiling on embedding lookups for this batch; defaults from configuration")
  private Integer maxApiCalls;

  @DecimalMin(value = "0.0", message = "minConfidence must be >= 0")
  @DecimalMax(value = "1.0", message = "minConfidence must be <= 1")
  @Schema(description = "Floor for the high_confidence view; defaults from configuration")
  private Double minConfidence;

  @Size(max = 128)
  @Schema(description = "Translation unit id; results are cached per session across calls")
  private String sessionId;
}
