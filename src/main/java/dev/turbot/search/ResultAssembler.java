package dev.turbot.search;

import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Pure static utility turning scored candidates into the final result list.
 *
 * <p>Pairs each candidate with its score, drops scores below the threshold, sorts by score
 * descending and truncates to the limit. The sort is stable, so equal scores keep the store's ANN
 * order.
 */
public final class ResultAssembler {

  private ResultAssembler() {}

  /**
   * Assembles the ordered result list.
   *
   * @param candidates candidates in store order
   * @param scores one score per candidate, same order
   * @param threshold minimum score to keep a result
   * @param limit maximum number of results
   * @return results sorted by score descending; empty when nothing passes the threshold
   * @throws IllegalArgumentException when candidates and scores differ in size or limit is below 1
   */
  public static List<ScoredResult> assemble(
      List<RetrievedCandidate> candidates,
      List<CandidateScore> scores,
      double threshold,
      int limit) {
    if (candidates.size() != scores.size()) {
      throw new IllegalArgumentException(
          "Got %d candidates but %d scores".formatted(candidates.size(), scores.size()));
    }
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
    return IntStream.range(0, candidates.size())
        .mapToObj(i -> ScoredResult.of(candidates.get(i), scores.get(i)))
        .filter(r -> r.score() >= threshold)
        .sorted(Comparator.comparingDouble(ScoredResult::score).reversed())
        .limit(limit)
        .toList();
  }
}
