package dev.turbot.search.penalty;

import dev.turbot.search.constraint.Constraint;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Maps every {@link Constraint} variant to its {@link PenaltyFunction}.
 *
 * <p>Every permitted subtype of {@link Constraint} must be registered here. Looking up a kind
 * without a function fails with {@link IllegalStateException} instead of scoring as a match.
 */
@Component
public class PenaltyRegistry {

  private final Map<Class<? extends Constraint>, PenaltyFunction<Constraint>> functions =
      new HashMap<>();

  public PenaltyRegistry() {
    register(Constraint.Destination.class, (c, v) -> PenaltyFunctions.exactText(c.value(), v));
    register(Constraint.Category.class, (c, v) -> PenaltyFunctions.exactText(c.value(), v));
    register(Constraint.TransportType.class, (c, v) -> PenaltyFunctions.exactText(c.value(), v));
    register(Constraint.Subcategory.class, (c, v) -> PenaltyFunctions.exactText(c.value(), v));
    register(Constraint.SeasonOf.class, (c, v) -> PenaltyFunctions.exactText(c.asText(), v));
    register(
        Constraint.FamilyFriendly.class, (c, v) -> PenaltyFunctions.exactBoolean(c.value(), v));
    register(
        Constraint.PriceRange.class,
        (c, v) -> PenaltyFunctions.price(c.band().representativePrice(), v));
    register(Constraint.PriceMax.class, (c, v) -> PenaltyFunctions.price(c.eur(), v));
    register(Constraint.TravelMonth.class, (c, v) -> PenaltyFunctions.month(c.month(), v));
    register(Constraint.DurationDays.class, PenaltyFunctions::duration);
    register(Constraint.Amenities.class, (c, v) -> PenaltyFunctions.amenities(c.values(), v));
  }

  private <C extends Constraint> void register(Class<C> kind, PenaltyFunction<C> function) {
    functions.put(kind, (c, v) -> function.fraction(kind.cast(c), v));
  }

  /**
   * Computes the mismatch fraction of {@code constraint} against a candidate value.
   *
   * @param constraint the query constraint
   * @param candidateValue the candidate's stored value, null when absent
   * @return fraction in [0, 1] of the field weight to deduct
   * @throws IllegalStateException if no function is registered for the constraint's kind
   */
  public double fraction(Constraint constraint, @Nullable Object candidateValue) {
    PenaltyFunction<Constraint> function = functions.get(constraint.getClass());
    if (function == null) {
      throw new IllegalStateException(
          "No penalty function registered for " + constraint.getClass().getSimpleName());
    }
    double fraction = function.fraction(constraint, candidateValue);
    return Math.max(0.0, Math.min(1.0, fraction));
  }
}
