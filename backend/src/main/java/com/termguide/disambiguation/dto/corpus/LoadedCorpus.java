package com.termguide.disambiguation.dto.corpus;

import java.util.List;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/** Typed result of one corpus load: patterns in load order plus the anchors that survived it. */
@Getter
@Builder
public class LoadedCorpus {

  private final String source;
  private final String version;
  private final CategoryRegistry categories;
  @Singular private final List<Pattern> patterns;
  @Singular private final List<NegativeAnchor> anchors;

  /** Entries dropped because they lacked a rendering or referenced an unknown category. */
  private final int skippedEntries;
}
