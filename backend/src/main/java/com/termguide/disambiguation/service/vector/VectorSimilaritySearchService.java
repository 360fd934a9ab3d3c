package com.termguide.disambiguation.service.vector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.termguide.disambiguation.dto.corpus.Pattern;
import com.termguide.disambiguation.exception.EmbeddingSpaceMismatchException;
import com.termguide.disambiguation.service.index.GuidanceIndex;
import com.termguide.disambiguation.service.index.GuidanceIndexService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Query-time half of the vector path. Embedding and index failures degrade to empty results; only
 * an embedding-space mismatch between the index and the embedder is raised.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VectorSimilaritySearchService {

  private static final Comparator<PatternCandidate> BY_SIMILARITY_THEN_FREQUENCY =
      Comparator.comparingDouble(PatternCandidate::getSimilarity)
          .reversed()
          .thenComparing(
              Comparator.comparingLong(
                      (PatternCandidate candidate) -> candidate.getPattern().getCorpusFrequency())
                  .reversed());

  private final Embedder embedder;

  /** Embeds query text. Empty when the embedder fails or times out. */
  public Optional<List<Float>> embedQuery(GuidanceIndex index, String text) {
    requireSameEmbeddingSpace(index);
    try {
      List<Float> vector = embedder.embed(text);
      return vector == null || vector.isEmpty() ? Optional.empty() : Optional.of(vector);
    } catch (EmbeddingSpaceMismatchException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn("Query embedding failed, degrading to no vector match: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Nearest patterns to an already computed query vector, most similar first. Ties go to the
   * pattern seen more often in the corpus.
   */
  public List<PatternCandidate> search(
      GuidanceIndex index, List<Float> queryVector, int k, String categoryFilter) {
    Map<String, String> filter = new LinkedHashMap<>();
    filter.put(GuidanceIndexService.META_KIND, GuidanceIndexService.KIND_PATTERN);
    if (categoryFilter != null && !categoryFilter.isBlank()) {
      filter.put(GuidanceIndexService.META_CATEGORY, categoryFilter);
    }

    List<VectorMatch> matches;
    try {
      matches = index.getCollection().query(queryVector, k, filter);
    } catch (EmbeddingSpaceMismatchException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn(
          "Vector query against {} failed, degrading to no match: {}",
          index.getCollection().getName(),
          e.getMessage());
      return List.of();
    }

    List<PatternCandidate> candidates = new ArrayList<>(matches.size());
    for (VectorMatch match : matches) {
      Optional<Pattern> pattern = index.pattern(match.getId());
      if (pattern.isEmpty()) {
        log.debug("Vector {} has no pattern in the active index, skipping", match.getId());
        continue;
      }
      candidates.add(new PatternCandidate(pattern.get(), match.similarity()));
    }
    candidates.sort(BY_SIMILARITY_THEN_FREQUENCY);
    return candidates;
  }

  /** Embeds {@code text} and searches; empty when embedding fails. */
  public List<PatternCandidate> query(
      GuidanceIndex index, String text, int k, String categoryFilter) {
    return embedQuery(index, text)
        .map(vector -> search(index, vector, k, categoryFilter))
        .orElse(List.of());
  }

  private void requireSameEmbeddingSpace(GuidanceIndex index) {
    String indexModel = index.getEmbeddingModelId();
    if (indexModel != null && !Objects.equals(indexModel, embedder.getModelId())) {
      throw new EmbeddingSpaceMismatchException(indexModel, embedder.getModelId());
    }
  }
}
