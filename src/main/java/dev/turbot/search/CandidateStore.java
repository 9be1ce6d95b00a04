package dev.turbot.search;

import dev.langchain4j.data.embedding.Embedding;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Approximate nearest-neighbour index of travel document fragments.
 *
 * <p>Supports at most one equality pre-filter per query. Implementations may throw any runtime
 * exception on failure; {@link TravelSearchService} degrades such failures to an empty result.
 */
public interface CandidateStore {

  /**
   * Returns up to {@code maxResults} fragments nearest to the query vector, most similar first.
   *
   * @param queryEmbedding the query vector
   * @param maxResults number of raw candidates to fetch
   * @param filter equality pre-filter, or null for an unfiltered search
   * @return candidates in ANN order
   */
  List<RetrievedCandidate> query(
      Embedding queryEmbedding, int maxResults, @Nullable HardFilter filter);
}
