package dev.turbot.mcp;

import dev.turbot.search.CandidateAttributes;
import dev.turbot.search.ScoredResult;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Formats ranked travel results as text blocks within a configurable token budget.
 *
 * <p>Uses character-based token estimation (chars / 4). Each block carries the source document,
 * the main offer attributes and the score so the response layer can cite and explain it. Blocks
 * are accumulated until the budget is reached; the first block is always included, truncated at
 * character level if it alone exceeds the budget.
 */
@Component
public class ResultFormatter {

  private static final double CHARS_PER_TOKEN = 4.0;

  /** Attributes shown in the block header, in display order. */
  static final List<String> HEADER_ATTRIBUTES =
      List.of(
          "destination",
          "category",
          "price_range",
          "travel_month",
          "duration_days",
          "transport_type",
          "family_friendly");

  private final int tokenBudget;

  public ResultFormatter(@Value("${turbot.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats results until the token budget is spent.
   *
   * @param results ranked results, best first
   * @return formatted text, empty when there are no results
   */
  public String format(@Nullable List<ScoredResult> results) {
    if (results == null || results.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;

    for (int i = 0; i < results.size(); i++) {
      String formatted = formatResult(i + 1, results.get(i));
      int resultTokens = estimateTokens(formatted);

      if (i == 0 && resultTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        break;
      }

      if (estimatedTokens + resultTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      estimatedTokens += resultTokens;
    }

    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String formatResult(int index, ScoredResult result) {
    String source = result.attributes().sourceFile();
    return String.format(
        Locale.ROOT,
        "## [%d] Source: %s\n%s\nScore: %.3f (similarity %.3f)\n\n%s\n\n---\n",
        index,
        source.isEmpty() ? result.id() : source,
        formatAttributes(result.attributes()),
        result.score(),
        result.baseSimilarity(),
        result.body());
  }

  private static String formatAttributes(CandidateAttributes attributes) {
    StringJoiner joiner = new StringJoiner(", ", "Attributes: ", "");
    joiner.setEmptyValue("Attributes: none");
    for (String name : HEADER_ATTRIBUTES) {
      Object value = attributes.get(name);
      if (value != null) {
        joiner.add(name + "=" + value);
      }
    }
    return joiner.toString();
  }
}
