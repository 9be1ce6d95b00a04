package dev.turbot.search;

import java.util.Map;

/**
 * A ranked search result.
 *
 * @param id store identifier of the fragment
 * @param body the fragment text
 * @param attributes structured attributes of the fragment
 * @param baseSimilarity similarity returned by the candidate store
 * @param score final rank score in [0, 1], never above {@code baseSimilarity}
 * @param penalties penalty applied per soft-scored constraint
 */
public record ScoredResult(
    String id,
    String body,
    CandidateAttributes attributes,
    double baseSimilarity,
    double score,
    Map<String, Double> penalties) {

  static ScoredResult of(RetrievedCandidate candidate, CandidateScore candidateScore) {
    return new ScoredResult(
        candidate.id(),
        candidate.body(),
        candidate.attributes(),
        candidate.similarity(),
        candidateScore.score(),
        candidateScore.penalties());
  }
}
