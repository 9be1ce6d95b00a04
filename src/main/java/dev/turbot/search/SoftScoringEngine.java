package dev.turbot.search;

import dev.turbot.search.constraint.Constraint;
import dev.turbot.search.constraint.ConstraintSet;
import dev.turbot.search.penalty.PenaltyRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Weighted soft scoring of retrieved candidates against the constraints not used as hard filter.
 *
 * <p>For each remaining constraint the {@link PenaltyRegistry} yields a mismatch fraction, which is
 * scaled by the constraint's weight from {@link SearchProperties}. The final score is {@code
 * baseSimilarity * PRODUCT(1 - weight * fraction)}. Since every factor lies in [0, 1] penalties only
 * ever lower the score: a satisfied constraint leaves it unchanged, a mismatched one never raises
 * it.
 *
 * <p>Stateless and safe for concurrent use.
 */
@Component
public class SoftScoringEngine {

  private final PenaltyRegistry registry;
  private final SearchProperties properties;

  public SoftScoringEngine(PenaltyRegistry registry, SearchProperties properties) {
    this.registry = registry;
    this.properties = properties;
  }

  /**
   * Scores one candidate.
   *
   * @param baseSimilarity similarity from the candidate store, clamped to [0, 1]
   * @param attributes the candidate's stored attributes
   * @param constraints all constraints of the query
   * @param hardFilter the filter already applied by the store (skipped here), or null
   * @return the final score with the per-constraint penalties that produced it
   */
  public CandidateScore score(
      double baseSimilarity,
      CandidateAttributes attributes,
      ConstraintSet constraints,
      @Nullable HardFilter hardFilter) {
    double base = clamp(baseSimilarity);
    double factor = 1.0;
    Map<String, Double> penalties = new LinkedHashMap<>();

    for (Constraint constraint : constraints.all()) {
      if (hardFilter != null && constraint.key() == hardFilter.key()) {
        continue;
      }
      String name = constraint.key().value();
      Object candidateValue = attributes.firstPresent(constraint.key().attributeNames());
      double penalty =
          clamp(properties.weightFor(name)) * registry.fraction(constraint, candidateValue);
      penalties.put(name, penalty);
      factor *= 1.0 - penalty;
    }

    double score = Math.max(0.0, base * factor);
    return new CandidateScore(Math.min(score, base), penalties);
  }

  private static double clamp(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}
