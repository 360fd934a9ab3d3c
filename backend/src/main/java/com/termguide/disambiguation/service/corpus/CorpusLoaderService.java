package com.termguide.disambiguation.service.corpus;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.termguide.disambiguation.config.GuidanceProperties;
import com.termguide.disambiguation.dto.corpus.Category;
import com.termguide.disambiguation.dto.corpus.CategoryRegistry;
import com.termguide.disambiguation.dto.corpus.CorpusDocument;
import com.termguide.disambiguation.dto.corpus.LoadedCorpus;
import com.termguide.disambiguation.dto.corpus.NegativeAnchor;
import com.termguide.disambiguation.dto.corpus.Pattern;
import com.termguide.disambiguation.exception.CorpusFormatException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a corpus document into typed {@link Pattern} and {@link NegativeAnchor} records.
 *
 * <p>Structural problems (unparseable JSON, no category map, a category that is not an object)
 * abort the load with {@link CorpusFormatException}. Individual entries that cannot be used are
 * skipped and logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorpusLoaderService {

  private static final int MIN_PRIORITY = 1;
  private static final int MAX_PRIORITY = 10;

  private final ObjectMapper objectMapper;
  private final ResourceLoader resourceLoader;
  private final GuidanceProperties properties;

  /** Loads the corpus at {@code guidance.index.corpus-location}. */
  public LoadedCorpus loadConfigured() {
    return load(properties.getIndex().getCorpusLocation());
  }

  public LoadedCorpus load(String location) {
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      throw new CorpusFormatException(location, "resource does not exist");
    }
    try (InputStream in = resource.getInputStream()) {
      return load(in, location);
    } catch (IOException e) {
      throw new CorpusFormatException(location, "could not be read", e);
    }
  }

  public LoadedCorpus load(InputStream in, String source) {
    CorpusDocument document;
    try {
      document = objectMapper.readValue(in, CorpusDocument.class);
    } catch (JsonProcessingException e) {
      throw new CorpusFormatException(source, e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new CorpusFormatException(source, "could not be read", e);
    }
    if (document == null) {
      throw new CorpusFormatException(source, "document is empty");
    }
    return toCorpus(document, source);
  }

  LoadedCorpus toCorpus(CorpusDocument document, String source) {
    Map<String, CorpusDocument.CategorySection> sections = document.getPatternCategories();
    if (sections == null) {
      throw new CorpusFormatException(source, "missing 'pattern_categories' object");
    }

    CategoryRegistry.Builder registryBuilder = CategoryRegistry.builder();
    LoadedCorpus.LoadedCorpusBuilder corpus = LoadedCorpus.builder().source(source);
    int skipped = 0;

    for (Map.Entry<String, CorpusDocument.CategorySection> entry : sections.entrySet()) {
      String categoryName = entry.getKey();
      CorpusDocument.CategorySection section = entry.getValue();
      if (categoryName == null || categoryName.isBlank()) {
        throw new CorpusFormatException(source, "category with a blank name");
      }
      if (section == null) {
        throw new CorpusFormatException(source, "category '" + categoryName + "' has no body");
      }

      Category category =
          registryBuilder.register(
              categoryName, section.getDescription(), resolvePriority(categoryName, section));

      List<CorpusDocument.PatternEntry> entries =
          section.getPatterns() == null ? List.of() : section.getPatterns();
      for (int i = 0; i < entries.size(); i++) {
        Optional<Pattern> pattern = toPattern(entries.get(i), category);
        if (pattern.isPresent()) {
          corpus.pattern(pattern.get());
        } else {
          skipped++;
          log.warn(
              "Skipping entry #{} in category '{}' of {}: missing term or rendering ({})",
              i,
              categoryName,
              source,
              entries.get(i));
        }
      }

      for (String text : categoryAnchorTexts(section)) {
        corpus.anchor(anchor(category, text));
      }
    }

    CategoryRegistry registry = registryBuilder.build();
    List<CorpusDocument.AnchorEntry> looseAnchors =
        document.getNegativeAnchors() == null ? List.of() : document.getNegativeAnchors();
    for (CorpusDocument.AnchorEntry anchorEntry : looseAnchors) {
      if (anchorEntry == null || isBlank(anchorEntry.getText())) {
        skipped++;
        log.warn("Skipping negative anchor without text in {}", source);
        continue;
      }
      Optional<Category> category = registry.resolve(anchorEntry.getCategory());
      if (category.isEmpty()) {
        skipped++;
        log.warn(
            "Skipping negative anchor for unknown category '{}' in {}",
            anchorEntry.getCategory(),
            source);
        continue;
      }
      corpus.anchor(anchor(category.get(), anchorEntry.getText()));
    }

    LoadedCorpus loaded =
        corpus
            .version(document.getVersion() == null ? "unversioned" : document.getVersion())
            .categories(registry)
            .skippedEntries(skipped)
            .build();

    log.info(
        "Loaded corpus {} (version {}): {} categories, {} patterns, {} negative anchors, {} skipped",
        source,
        loaded.getVersion(),
        registry.size(),
        loaded.getPatterns().size(),
        loaded.getAnchors().size(),
        skipped);
    return loaded;
  }

  private Optional<Pattern> toPattern(CorpusDocument.PatternEntry entry, Category category) {
    if (entry == null || isBlank(entry.getTerm()) || isBlank(entry.getPrimaryRendering())) {
      return Optional.empty();
    }
    long frequency = entry.getCorpusFrequency() == null ? 0L : entry.getCorpusFrequency();
    return Optional.of(
        Pattern.builder()
            .term(entry.getTerm().trim())
            .category(category.getName())
            .categoryId(category.getId())
            .primaryRendering(entry.getPrimaryRendering().trim())
            .alternateRenderings(clean(entry.getAlternateRenderings()))
            .discouragedRenderings(clean(entry.getDiscouragedRenderings()))
            .contextTags(clean(entry.getContextTags()))
            .corpusFrequency(Math.max(0L, frequency))
            .contextIndicators(clean(entry.getContextIndicators()))
            .explanation(isBlank(entry.getExplanation()) ? null : entry.getExplanation().trim())
            .build());
  }

  private int resolvePriority(String categoryName, CorpusDocument.CategorySection section) {
    int priority =
        section.getPriority() != null
            ? section.getPriority()
            : properties.priorityFor(categoryName);
    if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
      log.warn(
          "Priority {} of category '{}' is outside [{}, {}], clamping",
          priority,
          categoryName,
          MIN_PRIORITY,
          MAX_PRIORITY);
      priority = Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, priority));
    }
    return priority;
  }

  private static Set<String> categoryAnchorTexts(CorpusDocument.CategorySection section) {
    Set<String> texts = new LinkedHashSet<>();
    if (section.getNegativeAnchors() != null) {
      texts.addAll(clean(section.getNegativeAnchors()));
    }
    if (section.getNegativeVectors() != null && section.getNegativeVectors().getTexts() != null) {
      texts.addAll(clean(section.getNegativeVectors().getTexts()));
    }
    return texts;
  }

  private static NegativeAnchor anchor(Category category, String text) {
    return NegativeAnchor.builder()
        .category(category.getName())
        .categoryId(category.getId())
        .sourceText(text.trim())
        .build();
  }

  private static List<String> clean(List<String> values) {
    if (values == null) {
      return List.of();
    }
    return values.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(value -> !value.isEmpty())
        .distinct()
        .collect(Collectors.toList());
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
