package dev.turbot.search.constraint;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable set of typed constraints for one search request, at most one per {@link ConstraintKey}.
 *
 * <p>Iteration follows insertion order, which is the order the query parser supplied the values in.
 */
public final class ConstraintSet {

  private static final ConstraintSet EMPTY = new ConstraintSet(Map.of());

  private final Map<ConstraintKey, Constraint> constraints;

  private ConstraintSet(Map<ConstraintKey, Constraint> constraints) {
    this.constraints = Collections.unmodifiableMap(new LinkedHashMap<>(constraints));
  }

  public static ConstraintSet empty() {
    return EMPTY;
  }

  /**
   * Builds a set from typed constraints; a later constraint of the same kind replaces an earlier
   * one.
   */
  public static ConstraintSet of(Constraint... constraints) {
    return of(List.of(constraints));
  }

  public static ConstraintSet of(Collection<? extends Constraint> constraints) {
    Map<ConstraintKey, Constraint> byKey = new LinkedHashMap<>();
    for (Constraint constraint : constraints) {
      byKey.put(constraint.key(), constraint);
    }
    return new ConstraintSet(byKey);
  }

  /**
   * Parses the plain name-to-value mapping produced by the query parser.
   *
   * <p>Null values, blank strings, empty collections and the literal {@code "null"} are treated as
   * absent and skipped. {@code location} is accepted as an alias of {@code destination}; when both
   * are given, {@code destination} wins.
   *
   * @param raw constraint name to raw value (strings, numbers, booleans or lists)
   * @return the typed constraint set
   * @throws IllegalArgumentException on an unknown constraint name or an unparsable value
   */
  public static ConstraintSet fromRaw(Map<String, ?> raw) {
    if (raw == null || raw.isEmpty()) {
      return EMPTY;
    }
    Map<ConstraintKey, Constraint> byKey = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : raw.entrySet()) {
      ConstraintKey key = ConstraintKey.fromValue(entry.getKey());
      Object value = entry.getValue();
      if (isAbsent(key, value)) {
        continue;
      }
      boolean isAlias = !key.value().equalsIgnoreCase(entry.getKey().trim());
      if (isAlias && byKey.containsKey(key)) {
        continue;
      }
      byKey.put(key, key.parse(value));
    }
    return new ConstraintSet(byKey);
  }

  /** True when the value carries nothing, including list values made only of blank items. */
  static boolean isAbsent(ConstraintKey key, Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof String s) {
      String trimmed = s.trim();
      if (trimmed.isEmpty() || "null".equalsIgnoreCase(trimmed)) {
        return true;
      }
      return key == ConstraintKey.AMENITIES && trimmed.replace(",", "").isBlank();
    }
    if (value instanceof Collection<?> c) {
      return c.stream().allMatch(item -> item == null || item.toString().isBlank());
    }
    return false;
  }

  public Optional<Constraint> get(ConstraintKey key) {
    return Optional.ofNullable(constraints.get(key));
  }

  public boolean contains(ConstraintKey key) {
    return constraints.containsKey(key);
  }

  public Collection<Constraint> all() {
    return constraints.values();
  }

  public boolean isEmpty() {
    return constraints.isEmpty();
  }

  public int size() {
    return constraints.size();
  }

  /** Returns a copy with the given constraint added or replaced. */
  public ConstraintSet with(Constraint constraint) {
    Map<ConstraintKey, Constraint> copy = new LinkedHashMap<>(constraints);
    copy.put(constraint.key(), constraint);
    return new ConstraintSet(copy);
  }

  /** Human-readable summary of the active constraints, e.g. {@code destination=Rome, price_range=moderate}. */
  public String describe() {
    if (constraints.isEmpty()) {
      return "no constraints";
    }
    return constraints.values().stream()
        .map(c -> c.key().value() + "=" + c.asText())
        .collect(Collectors.joining(", "));
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ConstraintSet other && constraints.equals(other.constraints);
  }

  @Override
  public int hashCode() {
    return constraints.hashCode();
  }

  @Override
  public String toString() {
    return "ConstraintSet[" + describe() + "]";
  }
}
