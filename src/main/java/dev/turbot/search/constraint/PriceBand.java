package dev.turbot.search.constraint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/**
 * Price band of a travel offer, each mapped to a representative per-person price in EUR.
 *
 * <p>Bands are compared point-to-point through {@link #representativePrice()}, not as ranges.
 */
public enum PriceBand {
  BUDGET("budget", 150),
  MODERATE("moderate", 350),
  EXPENSIVE("expensive", 600),
  LUXURY("luxury", 1000);

  private final String value;
  private final int representativePrice;

  PriceBand(String value, int representativePrice) {
    this.value = value;
    this.representativePrice = representativePrice;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public int representativePrice() {
    return representativePrice;
  }

  @JsonCreator
  public static PriceBand fromValue(String value) {
    return find(value).orElseThrow(() -> new IllegalArgumentException("Invalid price band: " + value));
  }

  /** Case-insensitive lookup that tolerates surrounding whitespace. */
  public static Optional<PriceBand> find(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    for (PriceBand band : values()) {
      if (band.value.equalsIgnoreCase(trimmed)) {
        return Optional.of(band);
      }
    }
    return Optional.empty();
  }
}
