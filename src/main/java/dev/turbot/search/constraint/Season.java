package dev.turbot.search.constraint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Travel season as stored on offers ({@code year_round} marks offers valid all year). */
public enum Season {
  SPRING("spring"),
  SUMMER("summer"),
  AUTUMN("autumn"),
  WINTER("winter"),
  YEAR_ROUND("year_round");

  private final String value;

  Season(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static Season fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
      if ("fall".equals(normalized)) {
        return AUTUMN;
      }
      for (Season season : values()) {
        if (season.value.equals(normalized)) {
          return season;
        }
      }
    }
    throw new IllegalArgumentException("Invalid season: " + value);
  }
}
