package com.termguide.disambiguation.service.guidance;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.termguide.disambiguation.config.GuidanceProperties;
import com.termguide.disambiguation.config.GuidanceProperties.GenreRoute;

import lombok.extern.slf4j.Slf4j;

/**
 * Static genre to preferred-category table. Routing only biases: preferred categories win ties in
 * direct lookup and get a small ranking boost in vector search, but nothing is ever excluded.
 */
@Slf4j
@Component
public class GenreRoutingTable {

  private final Map<String, GenreRoute> routes;
  private final double boost;

  public GenreRoutingTable(GuidanceProperties properties) {
    Map<String, GenreRoute> normalized = new LinkedHashMap<>();
    properties.getRouting().forEach((genre, route) -> normalized.put(normalize(genre), route));
    this.routes = Map.copyOf(normalized);
    this.boost = properties.getRoutingBoost();
    log.debug("Loaded {} genre routes", routes.size());
  }

  public List<String> preferredCategories(String genre) {
    GenreRoute route = route(genre);
    return route == null ? List.of() : List.copyOf(route.getPreferredCategories());
  }

  /** Short phrase prepended to the query text so the embedding leans toward the genre. */
  public String domainHint(String genre) {
    GenreRoute route = route(genre);
    return route == null || route.getDomainHint() == null ? "" : route.getDomainHint().trim();
  }

  public double boost(String genre, String category) {
    return category != null && preferredCategories(genre).contains(category) ? boost : 0.0;
  }

  private GenreRoute route(String genre) {
    return genre == null || genre.isBlank() ? null : routes.get(normalize(genre));
  }

  private static String normalize(String genre) {
    return genre.trim().toLowerCase(Locale.ROOT);
  }
}
