package dev.turbot.search.constraint;

import java.time.Month;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * The constraint vocabulary: every attribute name the ranking engine understands.
 *
 * <p>Each key names the metadata attributes a candidate may carry the value under, in lookup order.
 * The first attribute name is the canonical one and is used for hard filters. Secondary names cover
 * documents written with older metadata ({@code location}, {@code seasonal}) and the fallback between
 * the two price fields.
 */
public enum ConstraintKey {
  DESTINATION(
      "destination", raw -> new Constraint.Destination(text(raw)), "destination", "location"),
  CATEGORY("category", raw -> new Constraint.Category(text(raw)), "category"),
  PRICE_RANGE(
      "price_range",
      raw -> new Constraint.PriceRange(PriceBand.fromValue(text(raw))),
      "price_range",
      "price_max"),
  PRICE_MAX(
      "price_max",
      raw -> new Constraint.PriceMax(positiveInt(raw, "price_max")),
      "price_max",
      "price_range"),
  TRAVEL_MONTH("travel_month", raw -> new Constraint.TravelMonth(month(raw)), "travel_month"),
  SEASON(
      "season", raw -> new Constraint.SeasonOf(Season.fromValue(text(raw))), "season", "seasonal"),
  DURATION_DAYS(
      "duration_days",
      raw -> new Constraint.DurationDays(positiveInt(raw, "duration_days")),
      "duration_days"),
  FAMILY_FRIENDLY(
      "family_friendly", raw -> new Constraint.FamilyFriendly(bool(raw)), "family_friendly"),
  TRANSPORT_TYPE(
      "transport_type", raw -> new Constraint.TransportType(text(raw)), "transport_type"),
  AMENITIES("amenities", raw -> new Constraint.Amenities(list(raw)), "amenities"),
  SUBCATEGORY("subcategory", raw -> new Constraint.Subcategory(text(raw)), "subcategory");

  /** Names the query parser may use instead of the canonical key. */
  private static final List<String> DESTINATION_ALIASES = List.of("location");

  private final String value;
  private final Function<Object, Constraint> parser;
  private final List<String> attributeNames;

  ConstraintKey(String value, Function<Object, Constraint> parser, String... attributeNames) {
    this.value = value;
    this.parser = parser;
    this.attributeNames = List.of(attributeNames);
  }

  /** Canonical vocabulary name, e.g. {@code price_range}. */
  public String value() {
    return value;
  }

  /** Metadata attribute names a candidate value is looked up under, canonical name first. */
  public List<String> attributeNames() {
    return attributeNames;
  }

  /**
   * Parses a raw value from the query parser into a typed constraint.
   *
   * @throws IllegalArgumentException if the value cannot be interpreted for this key
   */
  public Constraint parse(Object raw) {
    return parser.apply(raw);
  }

  /** Resolves a vocabulary name (or alias), case-insensitively. */
  public static Optional<ConstraintKey> find(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    if (DESTINATION_ALIASES.contains(normalized)) {
      return Optional.of(DESTINATION);
    }
    return Arrays.stream(values()).filter(k -> k.value.equals(normalized)).findFirst();
  }

  public static ConstraintKey fromValue(String name) {
    return find(name)
        .orElseThrow(() -> new IllegalArgumentException("Unknown constraint: " + name));
  }

  private static String text(Object raw) {
    if (raw instanceof String s) {
      return s;
    }
    throw new IllegalArgumentException("Expected a text value, got: " + raw);
  }

  private static int positiveInt(Object raw, String name) {
    double number;
    if (raw instanceof Number n) {
      number = n.doubleValue();
    } else if (raw instanceof String s) {
      try {
        number = Double.parseDouble(s.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(name + " must be a number, got: " + raw, e);
      }
    } else {
      throw new IllegalArgumentException(name + " must be a number, got: " + raw);
    }
    if (Double.isNaN(number) || number != Math.rint(number)) {
      throw new IllegalArgumentException(name + " must be a whole number, got: " + raw);
    }
    if (number < 1 || number > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(
          name + " must be between 1 and " + Integer.MAX_VALUE + ", got: " + raw);
    }
    return (int) number;
  }

  private static Month month(Object raw) {
    if (raw instanceof Number n) {
      return monthOf(n.doubleValue(), raw);
    }
    String s = text(raw).trim();
    if (!s.isEmpty() && s.chars().allMatch(Character::isDigit)) {
      return monthOf(s.length() <= 2 ? Integer.parseInt(s) : 0, raw);
    }
    try {
      return Month.valueOf(s.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid travel month: " + raw, e);
    }
  }

  private static Month monthOf(double number, Object raw) {
    if (number != Math.rint(number) || number < 1 || number > 12) {
      throw new IllegalArgumentException("Invalid travel month: " + raw);
    }
    return Month.of((int) number);
  }

  private static boolean bool(Object raw) {
    if (raw instanceof Boolean b) {
      return b;
    }
    if (raw instanceof String s) {
      String normalized = s.trim().toLowerCase(Locale.ROOT);
      if ("true".equals(normalized)) {
        return true;
      }
      if ("false".equals(normalized)) {
        return false;
      }
    }
    throw new IllegalArgumentException("family_friendly must be true or false, got: " + raw);
  }

  private static List<String> list(Object raw) {
    if (raw instanceof List<?> items) {
      return items.stream().filter(i -> i != null).map(Object::toString).toList();
    }
    return Arrays.asList(text(raw).split(","));
  }
}
