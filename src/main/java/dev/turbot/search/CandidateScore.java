package dev.turbot.search;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of soft scoring one candidate.
 *
 * @param score final rank score, {@code baseSimilarity * PRODUCT(1 - penalty)}
 * @param penalties applied penalty per constraint name, in constraint order, zero entries included
 */
public record CandidateScore(double score, Map<String, Double> penalties) {

  public CandidateScore {
    penalties = Collections.unmodifiableMap(new LinkedHashMap<>(penalties));
  }
}
