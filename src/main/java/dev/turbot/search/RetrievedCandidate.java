package dev.turbot.search;

/**
 * A raw candidate returned by the {@link CandidateStore}, before soft scoring.
 *
 * @param id store identifier of the fragment
 * @param body the fragment text
 * @param attributes structured attributes of the fragment
 * @param similarity base similarity to the query vector, in [0, 1]
 */
public record RetrievedCandidate(
    String id, String body, CandidateAttributes attributes, double similarity) {}
