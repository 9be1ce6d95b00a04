package dev.turbot.search;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of a travel search.
 *
 * @param query the query text searched for
 * @param results ranked results, best first
 * @param totalResults number of results returned
 * @param processingTime wall-clock time of the search in seconds
 * @param hardFilter the filter pushed down to the store, null for an unfiltered search
 */
public record SearchResponse(
    String query,
    List<ScoredResult> results,
    int totalResults,
    double processingTime,
    @Nullable HardFilter hardFilter) {

  public SearchResponse {
    results = List.copyOf(results);
  }

  static SearchResponse of(
      String query, List<ScoredResult> results, double processingTime, @Nullable HardFilter filter) {
    return new SearchResponse(query, results, results.size(), processingTime, filter);
  }
}
