package com.termguide.disambiguation.dto.corpus;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
@EqualsAndHashCode
public class Category {

  private final int id;
  private final String name;
  private final String description;

  /** 1 to 10, 5 is neutral. Only influences candidate ranking. */
  private final int priority;
}
