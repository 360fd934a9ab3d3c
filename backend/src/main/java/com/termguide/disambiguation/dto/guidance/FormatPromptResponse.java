package com.termguide.disambiguation.dto.guidance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FormatPromptResponse {

  private String prompt;
  private int injected;
  private int suggested;
  private int warnings;
}
