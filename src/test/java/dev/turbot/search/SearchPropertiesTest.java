package dev.turbot.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class SearchPropertiesTest {

  @Test
  void defaultsAreValid() {
    SearchProperties properties = new SearchProperties();

    assertThatCode(properties::validate).doesNotThrowAnyException();
    assertThat(properties.getOverFetchFactor()).isEqualTo(3);
    assertThat(properties.getDefaultLimit()).isEqualTo(10);
    assertThat(properties.getDefaultThreshold()).isEqualTo(0.1);
  }

  @Test
  void defaultWeightTableMatchesConstraintImportance() {
    SearchProperties properties = new SearchProperties();

    assertThat(properties.weightFor("price_range")).isEqualTo(0.9);
    assertThat(properties.weightFor("travel_month")).isEqualTo(0.8);
    assertThat(properties.weightFor("duration_days")).isEqualTo(0.6);
    assertThat(properties.weightFor("category")).isEqualTo(0.5);
    assertThat(properties.weightFor("family_friendly")).isEqualTo(0.3);
    assertThat(properties.weightFor("transport_type")).isEqualTo(0.2);
  }

  @Test
  void unlistedConstraintFallsBackToDefaultWeight() {
    SearchProperties properties = new SearchProperties();
    properties.setDefaultPenaltyWeight(0.25);

    assertThat(properties.weightFor("amenities")).isEqualTo(0.25);
  }

  @Test
  void overFetchFactorOutOfRangeFailsValidation() {
    SearchProperties properties = new SearchProperties();
    properties.setOverFetchFactor(11);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("over-fetch-factor");
  }

  @Test
  void weightAboveOneFailsValidation() {
    SearchProperties properties = new SearchProperties();
    properties.setPenaltyWeights(Map.of("category", 1.5));

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("penalty-weights.category");
  }

  @Test
  void thresholdOutOfRangeFailsValidation() {
    SearchProperties properties = new SearchProperties();
    properties.setDefaultThreshold(-0.1);

    assertThatThrownBy(properties::validate).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void limitBelowOneFailsValidation() {
    SearchProperties properties = new SearchProperties();
    properties.setDefaultLimit(0);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("default-limit");
  }
}
