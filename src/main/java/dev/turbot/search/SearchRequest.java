package dev.turbot.search;

import dev.turbot.search.constraint.ConstraintSet;
import java.util.Objects;

/**
 * Domain request for a travel search: query text, typed constraints, result limit and similarity
 * threshold.
 *
 * @param query the free-text query (must not be null or blank)
 * @param constraints constraints implied by the query, possibly empty
 * @param limit maximum number of results (must be >= 1)
 * @param threshold minimum final score for a result, in [0, 1]
 */
public record SearchRequest(String query, ConstraintSet constraints, int limit, double threshold) {

  /** Default number of results when not specified. */
  static final int DEFAULT_LIMIT = 10;

  /** Default minimum score when not specified. */
  static final double DEFAULT_THRESHOLD = 0.1;

  /** Compact constructor validating input. */
  public SearchRequest {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
    if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
      throw new IllegalArgumentException("threshold must be in [0.0, 1.0], got: " + threshold);
    }
    constraints = Objects.requireNonNullElse(constraints, ConstraintSet.empty());
  }

  /** Convenience constructor with no constraints and default limit and threshold. */
  public SearchRequest(String query) {
    this(query, ConstraintSet.empty(), DEFAULT_LIMIT, DEFAULT_THRESHOLD);
  }

  /** Convenience constructor with default limit and threshold. */
  public SearchRequest(String query, ConstraintSet constraints) {
    this(query, constraints, DEFAULT_LIMIT, DEFAULT_THRESHOLD);
  }
}
