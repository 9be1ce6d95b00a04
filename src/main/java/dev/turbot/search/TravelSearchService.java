package dev.turbot.search;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Search orchestration combining vector retrieval with constraint-aware soft ranking.
 *
 * <p>Pipeline: embed query -> select one hard filter from the constraints -> over-fetch {@code
 * limit * overFetchFactor} candidates from the {@link CandidateStore} with that filter -> soft-score
 * every candidate against the remaining constraints -> threshold, sort and truncate.
 *
 * <p>Embedding failures propagate as {@link EmbeddingException}. Store failures are logged and
 * treated as zero candidates, so the caller always gets a well-formed response.
 */
@Service
public class TravelSearchService {

  private static final Logger log = LoggerFactory.getLogger(TravelSearchService.class);

  /**
   * BGE query prefix recommended by the bge-small-en-v1.5 model documentation. Prepended to search
   * queries only, never to stored fragments.
   */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  private final EmbeddingModel embeddingModel;
  private final CandidateStore candidateStore;
  private final SoftScoringEngine scoringEngine;
  private final SearchProperties properties;
  private final Clock clock;
  private final Executor searchExecutor;

  public TravelSearchService(
      EmbeddingModel embeddingModel,
      CandidateStore candidateStore,
      SoftScoringEngine scoringEngine,
      SearchProperties properties,
      Clock clock,
      @Qualifier("searchExecutor") Executor searchExecutor) {
    this.embeddingModel = embeddingModel;
    this.candidateStore = candidateStore;
    this.scoringEngine = scoringEngine;
    this.properties = properties;
    this.clock = clock;
    this.searchExecutor = searchExecutor;
  }

  /**
   * Runs a ranked travel search.
   *
   * @param request query text, constraints, limit and threshold
   * @return results ordered by final score descending, with timing
   * @throws EmbeddingException if the query cannot be embedded
   */
  public SearchResponse search(SearchRequest request) {
    long start = clock.millis();

    Embedding queryEmbedding = embed(request.query());
    HardFilter applied = HardFilterSelector.select(request.constraints()).orElse(null);
    // saturate instead of overflowing for very large limits
    int fetchSize =
        (int) Math.min(Integer.MAX_VALUE, (long) request.limit() * properties.getOverFetchFactor());

    List<RetrievedCandidate> candidates = fetchCandidates(queryEmbedding, fetchSize, applied);

    List<CandidateScore> scores =
        candidates.stream()
            .map(
                c ->
                    scoringEngine.score(
                        c.similarity(), c.attributes(), request.constraints(), applied))
            .toList();

    List<ScoredResult> results =
        ResultAssembler.assemble(candidates, scores, request.threshold(), request.limit());

    double elapsedSeconds = (clock.millis() - start) / 1000.0;
    log.debug(
        "Search '{}' [{}] filter={} fetched={} returned={} in {}s",
        request.query(),
        request.constraints().describe(),
        applied,
        candidates.size(),
        results.size(),
        elapsedSeconds);
    return SearchResponse.of(request.query(), results, elapsedSeconds, applied);
  }

  /**
   * Runs {@link #search(SearchRequest)} on the search worker pool, keeping the blocking embedding
   * and store calls off the caller's thread.
   */
  public CompletableFuture<SearchResponse> searchAsync(SearchRequest request) {
    return CompletableFuture.supplyAsync(() -> search(request), searchExecutor);
  }

  private Embedding embed(String query) {
    try {
      return embeddingModel.embed(BGE_QUERY_PREFIX + query).content();
    } catch (RuntimeException e) {
      log.error("Embedding failed for query '{}': {}", query, e.getMessage());
      throw new EmbeddingException("Failed to embed query: " + e.getMessage(), e);
    }
  }

  private List<RetrievedCandidate> fetchCandidates(
      Embedding queryEmbedding, int fetchSize, @Nullable HardFilter filter) {
    try {
      return candidateStore.query(queryEmbedding, fetchSize, filter);
    } catch (RuntimeException e) {
      log.warn("Candidate store query failed, returning no results: {}", e.getMessage(), e);
      return List.of();
    }
  }
}
