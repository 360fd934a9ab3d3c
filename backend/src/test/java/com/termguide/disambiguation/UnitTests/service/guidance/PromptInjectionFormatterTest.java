package com.termguide.disambiguation.service.guidance;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.termguide.disambiguation.dto.corpus.Pattern;
import com.termguide.disambiguation.dto.guidance.ConfidenceTier;
import com.termguide.disambiguation.dto.guidance.FormatPromptResponse;
import com.termguide.disambiguation.dto.guidance.GuidanceResult;
import com.termguide.disambiguation.dto.guidance.LookupPath;
import com.termguide.disambiguation.fixtures.TestFixtures;

@DisplayName("PromptInjectionFormatter Tests")
class PromptInjectionFormatterTest {

  private PromptInjectionFormatter formatter;

  private final Pattern jindan =
      Pattern.builder()
          .term("金丹期")
          .category("cultivation_realms")
          .primaryRendering("Kim Đan")
          .discouragedRendering("Golden Core")
          .discouragedRendering("Kim Đan kỳ")
          .build();
  private final Pattern mihuo =
      Pattern.builder()
          .term("迷惑")
          .category("false_cognates")
          .primaryRendering("phiền phức")
          .explanation("Japanese 迷惑 means trouble, not confusion")
          .build();
  private final Pattern lingqi =
      Pattern.builder()
          .term("灵气")
          .category("sino_disambiguation")
          .primaryRendering("linh khí")
          .explanation("Spiritual energy")
          .build();

  @BeforeEach
  void setUp() {
    formatter = new PromptInjectionFormatter(TestFixtures.properties());
  }

  @Test
  @DisplayName("Should list injected terms with their discouraged renderings")
  void requiredSection() {
    String prompt = formatter.format(List.of(GuidanceResult.direct("金丹期", jindan)), false);

    assertThat(prompt)
        .isEqualTo(
            PromptInjectionFormatter.HEADING
                + "\n\n"
                + PromptInjectionFormatter.REQUIRED_HEADING
                + "\n- **金丹期** → `Kim Đan` (NOT: Golden Core, Kim Đan kỳ)\n");
  }

  @Test
  @DisplayName("Should add suggestions only when asked for")
  void suggestionsOnRequest() {
    List<GuidanceResult> results =
        List.of(GuidanceResult.direct("金丹期", jindan), scored("灵气", lingqi, 0.7));

    String without = formatter.format(results, false);
    String with = formatter.format(results, true);

    assertThat(without).doesNotContain(PromptInjectionFormatter.SUGGESTED_HEADING);
    assertThat(with)
        .contains(
            PromptInjectionFormatter.SUGGESTED_HEADING + "\n- 灵气 → linh khí (Spiritual energy)");
  }

  @Test
  @DisplayName("Should warn about false cognates that were included")
  void falseCognateWarnings() {
    FormatPromptResponse response =
        formatter.render(List.of(scored("迷惑", mihuo, 0.85)), false);

    assertThat(response.getInjected()).isEqualTo(1);
    assertThat(response.getWarnings()).isEqualTo(1);
    assertThat(response.getPrompt())
        .contains(
            PromptInjectionFormatter.WARNINGS_HEADING
                + "\n- **迷惑**: Japanese 迷惑 means trouble, not confusion");
  }

  @Test
  @DisplayName("Should describe aggregated suggestions by their components")
  void aggregatedExplanation() {
    Pattern zhuji =
        Pattern.builder().term("筑基").category("cultivation_realms").primaryRendering("Trúc Cơ")
            .build();
    Pattern houqi =
        Pattern.builder().term("后期").category("cultivation_realms").primaryRendering("hậu kỳ")
            .build();
    GuidanceResult aggregated =
        GuidanceResult.builder()
            .queryTerm("筑基后期")
            .finalScore(0.7)
            .confidenceTier(ConfidenceTier.LOG)
            .rendering("Trúc Cơ hậu kỳ")
            .components(List.of(zhuji, houqi))
            .lookupPath(LookupPath.AGGREGATED)
            .build();

    assertThat(formatter.format(List.of(aggregated), true))
        .contains("- 筑基后期 → Trúc Cơ hậu kỳ (composed from: 筑基 + 后期)");
  }

  @Test
  @DisplayName("Should order by score then term and list each term once")
  void deterministicOrder() {
    List<GuidanceResult> results =
        List.of(
            scored("灵气", lingqi.toBuilder().explanation(null).build(), 0.82),
            GuidanceResult.direct("金丹期", jindan),
            scored("迷惑", mihuo, 0.82),
            GuidanceResult.direct("金丹期", jindan));

    FormatPromptResponse first = formatter.render(results, false);
    FormatPromptResponse again = formatter.render(List.copyOf(results), false);

    assertThat(first.getPrompt()).isEqualTo(again.getPrompt());
    assertThat(first.getInjected()).isEqualTo(3);
    String prompt = first.getPrompt();
    assertThat(prompt.indexOf("金丹期")).isLessThan(prompt.indexOf("灵气"));
    assertThat(prompt.indexOf("灵气")).isLessThan(prompt.indexOf("迷惑"));
    assertThat(prompt.split("\\*\\*金丹期\\*\\*", -1)).hasSize(2);
  }

  @Test
  @DisplayName("Should return an empty prompt when nothing is usable")
  void emptyWhenNothingUsable() {
    FormatPromptResponse response =
        formatter.render(
            List.of(GuidanceResult.none("无名"), scored("灵气", lingqi, 0.7)), false);

    assertThat(response.getPrompt()).isEmpty();
    assertThat(response.getInjected()).isZero();
  }

  private static GuidanceResult scored(String term, Pattern pattern, double score) {
    return GuidanceResult.builder()
        .queryTerm(term)
        .rawSimilarity(score)
        .finalScore(score)
        .confidenceTier(score >= 0.80 ? ConfidenceTier.INJECT : ConfidenceTier.LOG)
        .matchedPattern(pattern)
        .rendering(pattern.getPrimaryRendering())
        .lookupPath(LookupPath.VECTOR)
        .build();
  }
}
