package com.termguide.disambiguation.dto.corpus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of categories known to one loaded corpus. Names are resolved to integer handles once,
 * at load time; the query path compares handles only.
 */
public final class CategoryRegistry {

  private final List<Category> byId;
  private final Map<String, Category> byName;

  private CategoryRegistry(List<Category> byId) {
    this.byId = Collections.unmodifiableList(byId);
    Map<String, Category> names = new LinkedHashMap<>();
    byId.forEach(category -> names.put(category.getName(), category));
    this.byName = Collections.unmodifiableMap(names);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<Category> resolve(String name) {
    return Optional.ofNullable(name == null ? null : byName.get(name));
  }

  public Category get(int id) {
    if (id < 0 || id >= byId.size()) {
      throw new IllegalArgumentException("Unknown category id " + id);
    }
    return byId.get(id);
  }

  public List<Category> all() {
    return byId;
  }

  public int size() {
    return byId.size();
  }

  public static final class Builder {
    private final List<Category> categories = new ArrayList<>();
    private final Map<String, Integer> ids = new LinkedHashMap<>();

    /** Registers {@code name} if it is new and returns its handle either way. */
    public Category register(String name, String description, int priority) {
      Integer existing = ids.get(name);
      if (existing != null) {
        return categories.get(existing);
      }
      Category category =
          Category.builder()
              .id(categories.size())
              .name(name)
              .description(description)
              .priority(priority)
              .build();
      ids.put(name, category.getId());
      categories.add(category);
      return category;
    }

    public CategoryRegistry build() {
      return new CategoryRegistry(new ArrayList<>(categories));
    }
  }
}
