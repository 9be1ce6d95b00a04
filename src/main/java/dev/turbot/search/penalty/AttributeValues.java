package dev.turbot.search.penalty;

import dev.turbot.search.constraint.PriceBand;
import java.time.Month;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import org.jspecify.annotations.Nullable;

/**
 * Lenient readers for candidate attribute values as stored in fragment metadata.
 *
 * <p>Stored values may be strings, numbers or lists depending on how a fragment was written. Every
 * reader returns an empty result instead of throwing when the value cannot be interpreted.
 */
final class AttributeValues {

  private AttributeValues() {}

  /** Trimmed lower-case text, empty for null or blank values. */
  static Optional<String> text(@Nullable Object value) {
    if (value == null) {
      return Optional.empty();
    }
    String text = value.toString().trim();
    return text.isEmpty() ? Optional.empty() : Optional.of(text.toLowerCase(Locale.ROOT));
  }

  static OptionalDouble number(@Nullable Object value) {
    if (value instanceof Number n) {
      double d = n.doubleValue();
      return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
    }
    Optional<String> text = text(value);
    if (text.isEmpty()) {
      return OptionalDouble.empty();
    }
    try {
      double d = Double.parseDouble(text.get());
      return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
    } catch (NumberFormatException e) {
      return OptionalDouble.empty();
    }
  }

  static Optional<Boolean> bool(@Nullable Object value) {
    if (value instanceof Boolean b) {
      return Optional.of(b);
    }
    if (value instanceof Number n) {
      int i = n.intValue();
      return i == 0 || i == 1 ? Optional.of(i == 1) : Optional.empty();
    }
    String text = text(value).orElse("");
    if ("true".equals(text) || "yes".equals(text)) {
      return Optional.of(Boolean.TRUE);
    }
    if ("false".equals(text) || "no".equals(text)) {
      return Optional.of(Boolean.FALSE);
    }
    return Optional.empty();
  }

  /** Month by English name ({@code "august"}) or number ({@code 8}). */
  static Optional<Month> month(@Nullable Object value) {
    OptionalDouble number = number(value);
    if (number.isPresent()) {
      double d = number.getAsDouble();
      return d >= 1 && d <= 12 && d == Math.rint(d)
          ? Optional.of(Month.of((int) d))
          : Optional.empty();
    }
    return text(value)
        .flatMap(
            t -> Arrays.stream(Month.values()).filter(m -> m.name().equalsIgnoreCase(t)).findFirst());
  }

  /** Price in EUR from a numeric value or a price band name. */
  static OptionalDouble price(@Nullable Object value) {
    OptionalDouble number = number(value);
    if (number.isPresent()) {
      return number;
    }
    Optional<PriceBand> band = text(value).flatMap(PriceBand::find);
    return band.isPresent()
        ? OptionalDouble.of(band.get().representativePrice())
        : OptionalDouble.empty();
  }

  /** List items from a collection or a comma-separated string, trimmed and lower-cased. */
  static List<String> list(@Nullable Object value) {
    if (value == null) {
      return List.of();
    }
    if (value instanceof Collection<?> items) {
      return items.stream()
          .filter(Objects::nonNull)
          .map(i -> i.toString().trim().toLowerCase(Locale.ROOT))
          .filter(s -> !s.isEmpty())
          .toList();
    }
    return Arrays.stream(value.toString().split(","))
        .map(s -> s.trim().toLowerCase(Locale.ROOT))
        .filter(s -> !s.isEmpty())
        .toList();
  }
}
