package com.termguide.disambiguation.service.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToIntFunction;

import com.termguide.disambiguation.dto.corpus.Pattern;

import lombok.extern.slf4j.Slf4j;

/**
 * Exact-match table from normalized term to the patterns carrying it, at most one per category.
 * Normalization only folds case and collapses whitespace; there is no fuzzy matching here.
 * Immutable once built.
 */
@Slf4j
public final class DirectLookupCache {

  private static final java.util.regex.Pattern WHITESPACE =
      java.util.regex.Pattern.compile("\\s+");

  private final Map<String, List<Pattern>> entries;
  private final int size;

  private DirectLookupCache(Map<String, List<Pattern>> entries) {
    this.entries = Collections.unmodifiableMap(entries);
    this.size = entries.values().stream().mapToInt(List::size).sum();
  }

  public static String normalize(String term) {
    if (term == null) {
      return "";
    }
    return WHITESPACE.matcher(term.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
  }

  /**
   * Builds the cache in load order. A later pattern with the same normalized term and category
   * replaces the earlier one. {@code priority} orders patterns that share a term across categories.
   */
  public static DirectLookupCache build(
      Collection<Pattern> patterns, ToIntFunction<Pattern> priority) {
    Map<String, Map<Integer, Pattern>> byTerm = new LinkedHashMap<>();
    int collisions = 0;
    for (Pattern pattern : patterns) {
      String key = normalize(pattern.getTerm());
      if (key.isEmpty()) {
        continue;
      }
      Pattern previous =
          byTerm
              .computeIfAbsent(key, k -> new LinkedHashMap<>())
              .put(pattern.getCategoryId(), pattern);
      if (previous != null) {
        collisions++;
        log.warn(
            "Duplicate term '{}' in category '{}': '{}' replaces '{}'",
            pattern.getTerm(),
            pattern.getCategory(),
            pattern.getPrimaryRendering(),
            previous.getPrimaryRendering());
      }
    }

    Map<String, List<Pattern>> entries = new LinkedHashMap<>();
    Comparator<Pattern> byPriority = Comparator.comparingInt(priority).reversed();
    byTerm.forEach(
        (key, perCategory) -> {
          List<Pattern> sorted = new ArrayList<>(perCategory.values());
          sorted.sort(byPriority);
          entries.put(key, List.copyOf(sorted));
        });
    if (collisions > 0) {
      log.info("Direct lookup cache built with {} same-category collisions", collisions);
    }
    return new DirectLookupCache(entries);
  }

  /** Highest-priority pattern for {@code term}. */
  public Optional<Pattern> get(String term) {
    List<Pattern> candidates = entries.get(normalize(term));
    return candidates == null ? Optional.empty() : Optional.of(candidates.get(0));
  }

  /**
   * Pattern for {@code term} from the first of {@code preferredCategories} that has one, falling
   * back to {@link #get(String)}.
   */
  public Optional<Pattern> get(String term, Collection<String> preferredCategories) {
    List<Pattern> candidates = entries.get(normalize(term));
    if (candidates == null) {
      return Optional.empty();
    }
    if (preferredCategories != null) {
      for (String category : preferredCategories) {
        for (Pattern candidate : candidates) {
          if (candidate.getCategory().equals(category)) {
            return Optional.of(candidate);
          }
        }
      }
    }
    return Optional.of(candidates.get(0));
  }

  public boolean contains(String term) {
    return entries.containsKey(normalize(term));
  }

  /** Number of (term, category) entries. */
  public int size() {
    return size;
  }

  public Map<String, List<Pattern>> asMap() {
    return entries;
  }
}
