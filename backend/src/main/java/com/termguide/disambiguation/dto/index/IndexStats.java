package com.termguide.disambiguation.dto.index;

import java.time.Instant;
import java.util.Map;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of an index build")
public class IndexStats {

  private String collectionName;
  private String corpusVersion;
  private String embeddingModelId;

  @Schema(description = "Indexed patterns per category")
  private Map<String, Integer> patternsPerCategory;

  private int totalIndexed;

  @Schema(description = "Embedded negative anchors per category")
  private Map<String, Integer> anchorsPerCategory;

  private int skippedEntries;

  @Schema(description = "Vectors stored in the collection, patterns and anchors together")
  private int collectionCount;

  @Schema(description = "True when a persisted collection was reopened instead of re-embedded")
  private boolean reusedExisting;

  private Instant builtAt;
  private long buildMillis;
}
