package com.termguide.disambiguation.service.index;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import com.termguide.disambiguation.dto.corpus.Category;
import com.termguide.disambiguation.dto.corpus.CategoryRegistry;
import com.termguide.disambiguation.dto.corpus.Pattern;
import com.termguide.disambiguation.dto.index.IndexStats;
import com.termguide.disambiguation.service.vector.VectorIndex;

import lombok.Builder;
import lombok.Getter;

/**
 * Everything one query needs, captured together so a rebuild can replace it in a single reference
 * swap. Readers holding an old snapshot keep a consistent view until they finish.
 */
@Getter
@Builder
public class GuidanceIndex {

  private final VectorIndex collection;
  private final DirectLookupCache directLookup;
  private final NegativeAnchorCache negativeAnchors;
  private final CategoryRegistry categories;
  private final Map<String, Pattern> patternsById;
  private final String corpusVersion;
  private final String embeddingModelId;
  private final Instant builtAt;
  private final IndexStats stats;

  public Optional<Pattern> pattern(String id) {
    return Optional.ofNullable(patternsById.get(id));
  }

  public int priorityOf(Pattern pattern) {
    Category category = categories.get(pattern.getCategoryId());
    return category.getPriority();
  }
}
