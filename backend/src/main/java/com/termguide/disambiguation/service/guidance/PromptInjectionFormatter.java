package com.termguide.disambiguation.service.guidance;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.termguide.disambiguation.config.GuidanceProperties;
import com.termguide.disambiguation.dto.corpus.Pattern;
import com.termguide.disambiguation.dto.guidance.ConfidenceTier;
import com.termguide.disambiguation.dto.guidance.FormatPromptResponse;
import com.termguide.disambiguation.dto.guidance.GuidanceResult;
import com.termguide.disambiguation.dto.guidance.LookupPath;

/**
 * Renders results as a markdown block for a translation prompt. Output is deterministic: results
 * are ordered by descending final score, then term, and each term appears once.
 */
@Component
public class PromptInjectionFormatter {

  static final String HEADING = "## Terminology Guidance";
  static final String REQUIRED_HEADING = "### Required Terminology (use exactly as shown):";
  static final String SUGGESTED_HEADING = "### Suggested Terminology (verify context):";
  static final String WARNINGS_HEADING = "### False Cognate Warnings:";
  private static final String DEFAULT_WARNING = "Context-dependent meaning";

  private static final Comparator<GuidanceResult> ORDER =
      Comparator.comparingDouble(GuidanceResult::getFinalScore)
          .reversed()
          .thenComparing(GuidanceResult::getQueryTerm, Comparator.nullsLast(String::compareTo));

  private final Set<String> warnCategories;

  public PromptInjectionFormatter(GuidanceProperties properties) {
    this.warnCategories = Set.copyOf(properties.getWarnCategories());
  }

  public String format(List<GuidanceResult> results, boolean includeSuggestions) {
    return render(results, includeSuggestions).getPrompt();
  }

  /** Empty prompt when nothing is injectable (or suggestible, when suggestions are requested). */
  public FormatPromptResponse render(List<GuidanceResult> results, boolean includeSuggestions) {
    Map<String, GuidanceResult> byTerm = new LinkedHashMap<>();
    results.stream()
        .filter(result -> result != null && result.isUsable() && result.getRendering() != null)
        .sorted(ORDER)
        .forEach(result -> byTerm.putIfAbsent(result.getQueryTerm(), result));

    List<GuidanceResult> required = new ArrayList<>();
    List<GuidanceResult> suggested = new ArrayList<>();
    List<GuidanceResult> warnings = new ArrayList<>();
    for (GuidanceResult result : byTerm.values()) {
      if (result.getConfidenceTier() == ConfidenceTier.INJECT) {
        required.add(result);
      } else if (includeSuggestions) {
        suggested.add(result);
      } else {
        continue;
      }
      if (result.category() != null && warnCategories.contains(result.category())) {
        warnings.add(result);
      }
    }

    if (required.isEmpty() && suggested.isEmpty()) {
      return FormatPromptResponse.builder().prompt("").build();
    }

    List<String> lines = new ArrayList<>();
    lines.add(HEADING);
    lines.add("");
    if (!required.isEmpty()) {
      lines.add(REQUIRED_HEADING);
      required.forEach(result -> lines.add(requiredLine(result)));
      lines.add("");
    }
    if (!suggested.isEmpty()) {
      lines.add(SUGGESTED_HEADING);
      suggested.forEach(result -> lines.add(suggestedLine(result)));
      lines.add("");
    }
    if (!warnings.isEmpty()) {
      lines.add(WARNINGS_HEADING);
      warnings.forEach(result -> lines.add(warningLine(result)));
      lines.add("");
    }

    return FormatPromptResponse.builder()
        .prompt(String.join("\n", lines))
        .injected(required.size())
        .suggested(suggested.size())
        .warnings(warnings.size())
        .build();
  }

  private static String requiredLine(GuidanceResult result) {
    StringBuilder line =
        new StringBuilder("- **")
            .append(result.getQueryTerm())
            .append("** → `")
            .append(result.getRendering())
            .append('`');
    Pattern pattern = result.getMatchedPattern();
    if (pattern != null && !pattern.getDiscouragedRenderings().isEmpty()) {
      String avoid =
          pattern.getDiscouragedRenderings().stream().sorted().collect(Collectors.joining(", "));
      line.append(" (NOT: ").append(avoid).append(')');
    }
    return line.toString();
  }

  private static String suggestedLine(GuidanceResult result) {
    StringBuilder line =
        new StringBuilder("- ")
            .append(result.getQueryTerm())
            .append(" → ")
            .append(result.getRendering());
    String note = explanation(result);
    if (note != null) {
      line.append(" (").append(note).append(')');
    }
    return line.toString();
  }

  private static String warningLine(GuidanceResult result) {
    String note = explanation(result);
    return "- **" + result.getQueryTerm() + "**: " + (note == null ? DEFAULT_WARNING : note);
  }

  private static String explanation(GuidanceResult result) {
    if (result.getLookupPath() == LookupPath.AGGREGATED && result.getComponents() != null) {
      return "composed from: "
          + result.getComponents().stream()
              .map(Pattern::getTerm)
              .collect(Collectors.joining(" + "));
    }
    Pattern pattern = result.getMatchedPattern();
    if (pattern == null || pattern.getExplanation() == null || pattern.getExplanation().isBlank()) {
      return null;
    }
    return pattern.getExplanation();
  }
}
