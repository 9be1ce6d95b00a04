package dev.turbot.search;

import dev.turbot.search.constraint.ConstraintKey;
import dev.turbot.search.constraint.ConstraintSet;
import java.util.List;
import java.util.Optional;

/**
 * Picks the one constraint pushed down to the candidate store as an equality pre-filter.
 *
 * <p>The store filters efficiently on a single predicate only, so exactly one constraint is chosen
 * by fixed precedence: destination, travel month, season, category, price range, subcategory. All
 * remaining constraints are left to {@link SoftScoringEngine}. Destination and time window come
 * first because a wrong destination or season is never an acceptable answer, while price or
 * category mismatches can still be useful.
 */
public final class HardFilterSelector {

  static final List<ConstraintKey> PRECEDENCE =
      List.of(
          ConstraintKey.DESTINATION,
          ConstraintKey.TRAVEL_MONTH,
          ConstraintKey.SEASON,
          ConstraintKey.CATEGORY,
          ConstraintKey.PRICE_RANGE,
          ConstraintKey.SUBCATEGORY);

  private HardFilterSelector() {}

  /**
   * Selects the hard filter for the given constraints.
   *
   * @param constraints the constraints of the query
   * @return the first present constraint in precedence order, normalised; empty when none applies
   */
  public static Optional<HardFilter> select(ConstraintSet constraints) {
    for (ConstraintKey key : PRECEDENCE) {
      Optional<HardFilter> filter =
          constraints
              .get(key)
              .map(c -> new HardFilter(key, c.asText()))
              .filter(f -> !f.value().isBlank());
      if (filter.isPresent()) {
        return filter;
      }
    }
    return Optional.empty();
  }
}
