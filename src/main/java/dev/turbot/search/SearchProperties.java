package dev.turbot.search;

import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for travel search ranking.
 *
 * <p>Properties are bound from {@code turbot.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code over-fetch-factor} - how many raw candidates to request from the store per result
 *       slot (default 3, bounded [1, 10])
 *   <li>{@code penalty-weights} - maximum fractional score loss per fully mismatched constraint,
 *       keyed by constraint name (each in [0, 1])
 *   <li>{@code default-penalty-weight} - weight for constraints missing from the table (default
 *       0.1)
 *   <li>{@code default-limit} / {@code default-threshold} - request defaults (10 and 0.1)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "turbot.search")
public class SearchProperties {

  private int overFetchFactor = 3;
  private double defaultPenaltyWeight = 0.1;
  private Map<String, Double> penaltyWeights = defaultWeights();
  private int defaultLimit = 10;
  private double defaultThreshold = 0.1;

  static Map<String, Double> defaultWeights() {
    Map<String, Double> weights = new LinkedHashMap<>();
    weights.put("price_range", 0.9);
    weights.put("travel_month", 0.8);
    weights.put("duration_days", 0.6);
    weights.put("category", 0.5);
    weights.put("family_friendly", 0.3);
    weights.put("transport_type", 0.2);
    return weights;
  }

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (overFetchFactor < 1 || overFetchFactor > 10) {
      throw new IllegalStateException(
          "turbot.search.over-fetch-factor must be in [1, 10], got: " + overFetchFactor);
    }
    requireUnitInterval("turbot.search.default-penalty-weight", defaultPenaltyWeight);
    penaltyWeights.forEach(
        (name, weight) -> requireUnitInterval("turbot.search.penalty-weights." + name, weight));
    if (defaultLimit < 1) {
      throw new IllegalStateException(
          "turbot.search.default-limit must be at least 1, got: " + defaultLimit);
    }
    requireUnitInterval("turbot.search.default-threshold", defaultThreshold);
  }

  private static void requireUnitInterval(String name, Double value) {
    if (value == null || value < 0.0 || value > 1.0) {
      throw new IllegalStateException(name + " must be in [0.0, 1.0], got: " + value);
    }
  }

  /** Weight of the named constraint, falling back to {@code default-penalty-weight}. */
  public double weightFor(String constraintName) {
    Double weight = penaltyWeights.get(constraintName);
    return weight != null ? weight : defaultPenaltyWeight;
  }

  public int getOverFetchFactor() {
    return overFetchFactor;
  }

  public void setOverFetchFactor(int overFetchFactor) {
    this.overFetchFactor = overFetchFactor;
  }

  public double getDefaultPenaltyWeight() {
    return defaultPenaltyWeight;
  }

  public void setDefaultPenaltyWeight(double defaultPenaltyWeight) {
    this.defaultPenaltyWeight = defaultPenaltyWeight;
  }

  public Map<String, Double> getPenaltyWeights() {
    return penaltyWeights;
  }

  public void setPenaltyWeights(Map<String, Double> penaltyWeights) {
    this.penaltyWeights = new LinkedHashMap<>(penaltyWeights);
  }

  public int getDefaultLimit() {
    return defaultLimit;
  }

  public void setDefaultLimit(int defaultLimit) {
    this.defaultLimit = defaultLimit;
  }

  public double getDefaultThreshold() {
    return defaultThreshold;
  }

  public void setDefaultThreshold(double defaultThreshold) {
    this.defaultThreshold = defaultThreshold;
  }
}
