package dev.turbot.search.constraint;

import java.time.Month;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * A single user-implied travel constraint, one record per kind of the constraint vocabulary.
 *
 * <p>Each variant knows its {@link ConstraintKey} and its canonical text form. The text form is what
 * gets pushed to the candidate store when the constraint is selected as the hard filter:
 * destinations are title-cased, every other kind is lower-cased.
 *
 * <p>Instances are created through {@link ConstraintKey#parse(Object)}, which validates raw values
 * coming from the query parser; the record constructors validate the same invariants.
 */
public sealed interface Constraint
    permits Constraint.Destination,
        Constraint.Category,
        Constraint.PriceRange,
        Constraint.PriceMax,
        Constraint.TravelMonth,
        Constraint.SeasonOf,
        Constraint.DurationDays,
        Constraint.FamilyFriendly,
        Constraint.TransportType,
        Constraint.Amenities,
        Constraint.Subcategory {

  ConstraintKey key();

  /** Canonical text form, used for hard filters and filter summaries. */
  String asText();

  record Destination(String value) implements Constraint {
    public Destination {
      value = requireText(value, "destination");
    }

    @Override
    public ConstraintKey key() {
      return ConstraintKey.DESTINATION;
    }

    @Override
    public String asText() {
      return titleCase(value);
    }
  }

  record Category(String value) implements Constraint {
    public Category {
      value = requireText(value, "category");
    }

    @Override
    public ConstraintKey key() {
      return ConstraintKey.CATEGORY;
    }

    @Override
    public String asText() {
      return value.toLowerCase(Locale.ROOT);
    }
  }

  record PriceRange(PriceBand band) implements Constraint {
    @Override
    public ConstraintKey key() {
      return ConstraintKey.PRICE_RANGE;
    }

    @Override
    public String asText() {
      return band.value();
    }
  }

  /** Maximum price in EUR. */
  record PriceMax(int eur) implements Constraint {
    public PriceMax {
      if (eur <= 0) {
        throw new IllegalArgumentException("price_max must be positive, got: " + eur);
      }
    }

    @Override
    public ConstraintKey key() {
      return ConstraintKey.PRICE_MAX;
    }

    @Override
    public String asText() {
      return String.valueOf(eur);
    }
  }

  record TravelMonth(Month month) implements Constraint {
    @Override
    public ConstraintKey key() {
      return ConstraintKey.TRAVEL_MONTH;
    }

    @Override
    public String asText() {
      return month.name().toLowerCase(Locale.ROOT);
    }
  }

  record SeasonOf(Season season) implements Constraint {
    @Override
    public ConstraintKey key() {
      return ConstraintKey.SEASON;
    }

    @Override
    public String asText() {
      return season.value();
    }
  }

  record DurationDays(int days) implements Constraint {
    public DurationDays {
      if (days <= 0) {
        throw new IllegalArgumentException("duration_days must be positive, got: " + days);
      }
    }

    @Override
    public ConstraintKey key() {
      return ConstraintKey.DURATION_DAYS;
    }

    @Override
    public String asText() {
      return String.valueOf(days);
    }
  }

  record FamilyFriendly(boolean value) implements Constraint {
    @Override
    public ConstraintKey key() {
      return ConstraintKey.FAMILY_FRIENDLY;
    }

    @Override
    public String asText() {
      return String.valueOf(value);
    }
  }

  record TransportType(String value) implements Constraint {
    public TransportType {
      value = requireText(value, "transport_type");
    }

    @Override
    public ConstraintKey key() {
      return ConstraintKey.TRANSPORT_TYPE;
    }

    @Override
    public String asText() {
      return value.toLowerCase(Locale.ROOT);
    }
  }

  /** Requested amenities, normalised to trimmed lower-case names without duplicates. */
  record Amenities(List<String> values) implements Constraint {
    public Amenities {
      values = normalizeAll(values);
      if (values.isEmpty()) {
        throw new IllegalArgumentException("amenities must not be empty");
      }
    }

    @Override
    public ConstraintKey key() {
      return ConstraintKey.AMENITIES;
    }

    @Override
    public String asText() {
      return String.join(",", values);
    }
  }

  record Subcategory(String value) implements Constraint {
    public Subcategory {
      value = requireText(value, "subcategory");
    }

    @Override
    public ConstraintKey key() {
      return ConstraintKey.SUBCATEGORY;
    }

    @Override
    public String asText() {
      return value.toLowerCase(Locale.ROOT);
    }
  }

  private static String requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return value.trim();
  }

  private static List<String> normalizeAll(Collection<String> raw) {
    List<String> normalized = new ArrayList<>();
    if (raw == null) {
      return List.copyOf(normalized);
    }
    for (String item : raw) {
      if (item == null || item.isBlank()) {
        continue;
      }
      String value = item.trim().toLowerCase(Locale.ROOT);
      if (!normalized.contains(value)) {
        normalized.add(value);
      }
    }
    return List.copyOf(normalized);
  }

  /**
   * Title-cases text: the first letter of every word is upper-cased, the remaining letters
   * lower-cased. A word starts after any non-letter character ({@code "new york"} becomes {@code
   * "New York"}, {@code "costa del-sol"} becomes {@code "Costa Del-Sol"}).
   */
  static String titleCase(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    boolean startOfWord = true;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isLetter(c)) {
        sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
        startOfWord = false;
      } else {
        sb.append(c);
        startOfWord = true;
      }
    }
    return sb.toString();
  }
}
