package dev.turbot.search.penalty;

import dev.turbot.search.constraint.Constraint;
import java.time.Month;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import org.jspecify.annotations.Nullable;

/**
 * The mismatch functions behind {@link PenaltyRegistry}. All functions are pure and return a
 * fraction in [0, 1] of the field weight.
 */
final class PenaltyFunctions {

  static final double FULL = 1.0;
  static final double NONE = 0.0;

  private PenaltyFunctions() {}

  /** Case-insensitive text equality after trimming; no partial credit. */
  static double exactText(String expected, @Nullable Object candidateValue) {
    Optional<String> actual = AttributeValues.text(candidateValue);
    String wanted = expected.trim().toLowerCase(Locale.ROOT);
    return actual.isPresent() && actual.get().equals(wanted) ? NONE : FULL;
  }

  static double exactBoolean(boolean expected, @Nullable Object candidateValue) {
    Optional<Boolean> actual = AttributeValues.bool(candidateValue);
    return actual.isPresent() && actual.get() == expected ? NONE : FULL;
  }

  /**
   * Duration in days: equal is free, off by one day costs 0.2, off by two 0.5, anything further the
   * full weight.
   */
  static double duration(Constraint.DurationDays constraint, @Nullable Object candidateValue) {
    OptionalDouble actual = AttributeValues.number(candidateValue);
    if (actual.isEmpty()) {
      return FULL;
    }
    double diff = Math.abs(constraint.days() - actual.getAsDouble());
    if (diff == 0) {
      return NONE;
    }
    if (diff <= 1) {
      return 0.2;
    }
    if (diff <= 2) {
      return 0.5;
    }
    return FULL;
  }

  /**
   * Relative price distance {@code |query - candidate| / query}: within 10% costs 0.2, within 25%
   * costs 0.5, anything further the full weight.
   */
  static double price(double queryPrice, @Nullable Object candidateValue) {
    OptionalDouble actual = AttributeValues.price(candidateValue);
    if (actual.isEmpty()) {
      return FULL;
    }
    double diff = Math.abs(queryPrice - actual.getAsDouble());
    if (diff == 0) {
      return NONE;
    }
    if (queryPrice <= 0) {
      return FULL;
    }
    double relative = diff / queryPrice;
    if (relative <= 0.10) {
      return 0.2;
    }
    if (relative <= 0.25) {
      return 0.5;
    }
    return FULL;
  }

  /**
   * Calendar distance on the linear scale January=1 to December=12. One month apart costs 0.3, two
   * months 0.6, anything further the full weight. December and January are eleven months apart.
   */
  static double month(Month expected, @Nullable Object candidateValue) {
    Optional<Month> actual = AttributeValues.month(candidateValue);
    if (actual.isEmpty()) {
      return FULL;
    }
    int distance = Math.abs(expected.getValue() - actual.get().getValue());
    switch (distance) {
      case 0:
        return NONE;
      case 1:
        return 0.3;
      case 2:
        return 0.6;
      default:
        return FULL;
    }
  }

  /** Share of requested amenities the candidate does not list. */
  static double amenities(List<String> requested, @Nullable Object candidateValue) {
    List<String> offered = AttributeValues.list(candidateValue);
    long missing = requested.stream().filter(a -> !offered.contains(a)).count();
    return (double) missing / requested.size();
  }
}
