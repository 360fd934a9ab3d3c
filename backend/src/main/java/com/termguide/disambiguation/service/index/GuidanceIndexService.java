package com.termguide.disambiguation.service.index;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.MDC;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import com.termguide.disambiguation.config.GuidanceProperties;
import com.termguide.disambiguation.dto.corpus.Category;
import com.termguide.disambiguation.dto.corpus.CategoryRegistry;
import com.termguide.disambiguation.dto.corpus.LoadedCorpus;
import com.termguide.disambiguation.dto.corpus.NegativeAnchor;
import com.termguide.disambiguation.dto.corpus.Pattern;
import com.termguide.disambiguation.dto.index.IndexStats;
import com.termguide.disambiguation.exception.EmbeddingException;
import com.termguide.disambiguation.exception.IndexNotReadyException;
import com.termguide.disambiguation.service.corpus.CorpusLoaderService;
import com.termguide.disambiguation.service.vector.Embedder;
import com.termguide.disambiguation.service.vector.VectorData;
import com.termguide.disambiguation.service.vector.VectorIndex;
import com.termguide.disambiguation.service.vector.VectorIndexFactory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the active {@link GuidanceIndex}. A build is the only writer: it populates a fresh
 * collection and both caches off to the side, then publishes them with one reference swap, so
 * queries never see a half-built index.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GuidanceIndexService {

  public static final String META_KIND = "kind";
  public static final String META_CATEGORY = "category";
  public static final String META_TERM = "term";
  public static final String KIND_PATTERN = "pattern";
  public static final String KIND_ANCHOR = "anchor";

  private final CorpusLoaderService corpusLoader;
  private final Embedder embedder;
  private final VectorIndexFactory indexFactory;
  private final GuidanceProperties properties;

  private final AtomicReference<GuidanceIndex> active = new AtomicReference<>();
  private final AtomicBoolean indexingInProgress = new AtomicBoolean(false);
  private final AtomicLong collectionSequence = new AtomicLong();
  private final Object buildLock = new Object();

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (!properties.getIndex().isBuildOnStartup()) {
      log.info("Index build on startup is disabled; waiting for an explicit build request");
      return;
    }

    String username = MDC.get("username");
    CompletableFuture.runAsync(
        () -> {
          try {
            if (username != null) {
              MDC.put("username", username);
            }
            buildIndex(false);
          } catch (RuntimeException e) {
            log.error("Startup index build failed; queries will be rejected until a rebuild", e);
          } finally {
            MDC.remove("username");
          }
        });
  }

  /** Loads the configured corpus and builds from it. */
  public IndexStats buildIndex(boolean forceRebuild) {
    GuidanceIndex current = active.get();
    if (!forceRebuild && current != null && current.getCollection().count() > 0) {
      log.info(
          "Index {} already populated, skipping build", current.getCollection().getName());
      return current.getStats();
    }
    return buildIndex(corpusLoader.loadConfigured(), forceRebuild);
  }

  /**
   * Builds the index for {@code corpus}. Without {@code forceRebuild}, an already populated index
   * (live in this process or persisted by the vector store) is kept and its stats returned.
   */
  public IndexStats buildIndex(LoadedCorpus corpus, boolean forceRebuild) {
    synchronized (buildLock) {
      GuidanceIndex current = active.get();
      if (!forceRebuild && current != null && current.getCollection().count() > 0) {
        log.info(
            "Index {} already populated, skipping build", current.getCollection().getName());
        return current.getStats();
      }

      indexingInProgress.set(true);
      try {
        Optional<VectorIndex> persisted = Optional.empty();
        if (!forceRebuild && current == null) {
          persisted = openPersisted();
          if (persisted.isPresent()) {
            Optional<GuidanceIndex> reopened = reopen(corpus, persisted.get());
            if (reopened.isPresent()) {
              publish(reopened.get());
              return reopened.get().getStats();
            }
          }
        }

        GuidanceIndex built = populate(corpus);
        publish(built);
        persisted.ifPresent(indexFactory::drop);
        return built.getStats();
      } finally {
        indexingInProgress.set(false);
      }
    }
  }

  /** Drops the active index. Queries fail with {@link IndexNotReadyException} until a rebuild. */
  public void clear() {
    synchronized (buildLock) {
      GuidanceIndex previous = active.getAndSet(null);
      if (previous != null) {
        previous.getCollection().clear();
        log.info("Cleared guidance index {}", previous.getCollection().getName());
      }
    }
  }

  public Optional<GuidanceIndex> getActive() {
    return Optional.ofNullable(active.get());
  }

  public GuidanceIndex requireActive() {
    GuidanceIndex index = active.get();
    if (index == null) {
      throw new IndexNotReadyException(
          indexingInProgress.get()
              ? "Guidance index is being built, retry shortly"
              : "Guidance index has not been built");
    }
    return index;
  }

  public boolean isIndexingInProgress() {
    return indexingInProgress.get();
  }

  public static String patternId(Pattern pattern) {
    return pattern.getCategory() + "/" + DirectLookupCache.normalize(pattern.getTerm());
  }

  /** Deterministic text embedded for a pattern. */
  public static String embeddingText(Pattern pattern) {
    return String.join(
        " ", pattern.getTerm(), pattern.getPrimaryRendering(), pattern.getCategory());
  }

  private GuidanceIndex populate(LoadedCorpus corpus) {
    long started = System.currentTimeMillis();
    String name =
        properties.getIndex().getCollectionPrefix()
            + "-"
            + started
            + "-"
            + collectionSequence.incrementAndGet();
    VectorIndex collection = indexFactory.create(name);
    log.info(
        "Building index {} from {} patterns and {} anchors",
        name,
        corpus.getPatterns().size(),
        corpus.getAnchors().size());

    try {
      collection.putTag(VectorIndex.TAG_EMBEDDING_MODEL_ID, embedder.getModelId());
      collection.putTag(VectorIndex.TAG_CORPUS_VERSION, corpus.getVersion());

      Map<String, Pattern> patternsById = new LinkedHashMap<>();
      for (Pattern pattern : corpus.getPatterns()) {
        patternsById.put(patternId(pattern), pattern);
      }
      upsertPatterns(collection, new ArrayList<>(patternsById.values()));
      List<NegativeAnchor> embeddedAnchors = embedAnchors(collection, corpus.getAnchors());

      return assemble(
          collection,
          corpus,
          patternsById,
          embeddedAnchors,
          false,
          System.currentTimeMillis() - started);
    } catch (RuntimeException e) {
      log.error("Index build {} failed, keeping the previous index", name, e);
      try {
        indexFactory.drop(collection);
      } catch (RuntimeException dropFailure) {
        e.addSuppressed(dropFailure);
      }
      throw e;
    }
  }

  private void upsertPatterns(VectorIndex collection, List<Pattern> patterns) {
    int batchSize = properties.getIndex().getBatchSize();
    for (int from = 0; from < patterns.size(); from += batchSize) {
      List<Pattern> batch = patterns.subList(from, Math.min(from + batchSize, patterns.size()));
      List<String> texts = new ArrayList<>(batch.size());
      batch.forEach(pattern -> texts.add(embeddingText(pattern)));
      List<List<Float>> vectors = embedChecked(texts);
      for (int i = 0; i < batch.size(); i++) {
        Pattern pattern = batch.get(i);
        collection.upsert(
            patternId(pattern),
            vectors.get(i),
            Map.of(
                META_KIND, KIND_PATTERN,
                META_CATEGORY, pattern.getCategory(),
                META_TERM, pattern.getTerm()),
            texts.get(i));
      }
      log.debug("Indexed patterns {}-{} of {}", from + 1, from + batch.size(), patterns.size());
    }
  }

  private List<NegativeAnchor> embedAnchors(VectorIndex collection, List<NegativeAnchor> anchors) {
    int batchSize = properties.getIndex().getBatchSize();
    List<NegativeAnchor> embedded = new ArrayList<>(anchors.size());
    for (int from = 0; from < anchors.size(); from += batchSize) {
      List<NegativeAnchor> batch =
          anchors.subList(from, Math.min(from + batchSize, anchors.size()));
      List<String> texts = new ArrayList<>(batch.size());
      batch.forEach(anchor -> texts.add(anchor.getSourceText()));
      List<List<Float>> vectors = embedChecked(texts);
      for (int i = 0; i < batch.size(); i++) {
        NegativeAnchor anchor = batch.get(i).withEmbedding(vectors.get(i));
        embedded.add(anchor);
        collection.upsert(
            "anchor/" + anchor.getCategory() + "/" + (from + i),
            anchor.getEmbedding(),
            Map.of(META_KIND, KIND_ANCHOR, META_CATEGORY, anchor.getCategory()),
            anchor.getSourceText());
      }
    }
    return embedded;
  }

  private List<List<Float>> embedChecked(List<String> texts) {
    List<List<Float>> vectors = embedder.embedBatch(texts);
    if (vectors == null || vectors.size() != texts.size()) {
      throw new EmbeddingException(
          String.format(
              "Embedder returned %d vectors for %d texts",
              vectors == null ? 0 : vectors.size(), texts.size()));
    }
    return vectors;
  }

  private Optional<VectorIndex> openPersisted() {
    try {
      return indexFactory.openActive();
    } catch (RuntimeException e) {
      log.warn("Could not open the persisted collection, rebuilding: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /** Adopts a persisted collection when it matches the corpus and the current embedding model. */
  private Optional<GuidanceIndex> reopen(LoadedCorpus corpus, VectorIndex collection) {
    long started = System.currentTimeMillis();
    String storedModel = collection.getEmbeddingModelId();
    if (!embedder.getModelId().equals(storedModel)) {
      log.warn(
          "Persisted collection {} was embedded with '{}' but the embedder is '{}', rebuilding",
          collection.getName(),
          storedModel,
          embedder.getModelId());
      return Optional.empty();
    }
    if (!corpus.getVersion().equals(collection.getTags().get(VectorIndex.TAG_CORPUS_VERSION))) {
      log.info(
          "Persisted collection {} is for corpus version {}, rebuilding for {}",
          collection.getName(),
          collection.getTags().get(VectorIndex.TAG_CORPUS_VERSION),
          corpus.getVersion());
      return Optional.empty();
    }

    Map<String, Pattern> patternsById = new LinkedHashMap<>();
    corpus.getPatterns().forEach(pattern -> patternsById.put(patternId(pattern), pattern));
    int storedPatterns = collection.scan(Map.of(META_KIND, KIND_PATTERN)).size();
    if (storedPatterns != patternsById.size()) {
      log.info(
          "Persisted collection {} holds {} patterns, corpus has {}, rebuilding",
          collection.getName(),
          storedPatterns,
          patternsById.size());
      return Optional.empty();
    }

    CategoryRegistry categories = corpus.getCategories();
    List<NegativeAnchor> anchors = new ArrayList<>();
    for (VectorData stored : collection.scan(Map.of(META_KIND, KIND_ANCHOR))) {
      Optional<Category> category = categories.resolve(stored.getMetadata().get(META_CATEGORY));
      if (category.isEmpty()) {
        log.warn("Ignoring persisted anchor {} with unknown category", stored.getId());
        continue;
      }
      anchors.add(
          NegativeAnchor.builder()
              .category(category.get().getName())
              .categoryId(category.get().getId())
              .sourceText(stored.getDocument())
              .embedding(stored.getEmbedding())
              .build());
    }

    log.info("Reusing persisted collection {}", collection.getName());
    return Optional.of(
        assemble(
            collection,
            corpus,
            patternsById,
            anchors,
            true,
            System.currentTimeMillis() - started));
  }

  private GuidanceIndex assemble(
      VectorIndex collection,
      LoadedCorpus corpus,
      Map<String, Pattern> patternsById,
      List<NegativeAnchor> anchors,
      boolean reused,
      long buildMillis) {
    CategoryRegistry categories = corpus.getCategories();
    DirectLookupCache directLookup =
        DirectLookupCache.build(
            corpus.getPatterns(),
            pattern -> categories.get(pattern.getCategoryId()).getPriority());
    NegativeAnchorCache anchorCache =
        NegativeAnchorCache.build(
            anchors,
            properties.getNegativeAnchor().getThreshold(),
            properties.getNegativeAnchor().getPenalty());

    Map<String, Integer> perCategory = new LinkedHashMap<>();
    categories.all().forEach(category -> perCategory.put(category.getName(), 0));
    patternsById
        .values()
        .forEach(pattern -> perCategory.merge(pattern.getCategory(), 1, Integer::sum));

    Instant builtAt = Instant.now();
    IndexStats stats =
        IndexStats.builder()
            .collectionName(collection.getName())
            .corpusVersion(corpus.getVersion())
            .embeddingModelId(collection.getEmbeddingModelId())
            .patternsPerCategory(perCategory)
            .totalIndexed(patternsById.size())
            .anchorsPerCategory(anchorCache.countsByCategory())
            .skippedEntries(corpus.getSkippedEntries())
            .collectionCount(collection.count())
            .reusedExisting(reused)
            .builtAt(builtAt)
            .buildMillis(buildMillis)
            .build();

    return GuidanceIndex.builder()
        .collection(collection)
        .directLookup(directLookup)
        .negativeAnchors(anchorCache)
        .categories(categories)
        .patternsById(Map.copyOf(patternsById))
        .corpusVersion(corpus.getVersion())
        .embeddingModelId(collection.getEmbeddingModelId())
        .builtAt(builtAt)
        .stats(stats)
        .build();
  }

  private void publish(GuidanceIndex index) {
    GuidanceIndex previous = active.getAndSet(index);
    indexFactory.markActive(index.getCollection());
    if (previous != null && previous.getCollection() != index.getCollection()) {
      indexFactory.drop(previous.getCollection());
    }
    IndexStats stats = index.getStats();
    log.info(
        "Index {} active: {} patterns, {} anchors, {} direct entries, {} vectors in {} ms",
        stats.getCollectionName(),
        stats.getTotalIndexed(),
        index.getNegativeAnchors().totalAnchors(),
        index.getDirectLookup().size(),
        stats.getCollectionCount(),
        stats.getBuildMillis());
  }
}
