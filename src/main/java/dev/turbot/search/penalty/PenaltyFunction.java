package dev.turbot.search.penalty;

import dev.turbot.search.constraint.Constraint;
import org.jspecify.annotations.Nullable;

/**
 * Pure mismatch function for one constraint kind.
 *
 * <p>Returns the fraction of the field's weight to deduct: 0 for a match, 1 for a full mismatch,
 * and values in between for near misses. A missing or unparsable candidate value is a full
 * mismatch; implementations never throw on candidate data.
 *
 * @param <C> the constraint variant the function scores
 */
@FunctionalInterface
public interface PenaltyFunction<C extends Constraint> {

  double fraction(C constraint, @Nullable Object candidateValue);
}
