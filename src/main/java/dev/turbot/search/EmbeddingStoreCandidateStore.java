package dev.turbot.search;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link CandidateStore} backed by a LangChain4j {@link EmbeddingStore}.
 *
 * <p>The hard filter becomes a metadata {@code IsEqualTo} filter on the store request. The store's
 * relevance score is used as base similarity, clamped to [0, 1].
 */
@Component
public class EmbeddingStoreCandidateStore implements CandidateStore {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingStoreCandidateStore.class);

  private final EmbeddingStore<TextSegment> embeddingStore;

  public EmbeddingStoreCandidateStore(EmbeddingStore<TextSegment> embeddingStore) {
    this.embeddingStore = embeddingStore;
  }

  @Override
  public List<RetrievedCandidate> query(
      Embedding queryEmbedding, int maxResults, @Nullable HardFilter filter) {
    EmbeddingSearchRequest.EmbeddingSearchRequestBuilder builder =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .maxResults(maxResults)
            .minScore(0.0);

    if (filter != null) {
      builder.filter(filter.toStoreFilter());
    }

    List<EmbeddingMatch<TextSegment>> matches = embeddingStore.search(builder.build()).matches();
    log.debug("Store returned {} matches (k={}, filter={})", matches.size(), maxResults, filter);
    return matches.stream().map(EmbeddingStoreCandidateStore::toCandidate).toList();
  }

  private static RetrievedCandidate toCandidate(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    double score = match.score() != null ? match.score() : 0.0;
    return new RetrievedCandidate(
        match.embeddingId(),
        segment != null ? segment.text() : "",
        segment != null ? CandidateAttributes.from(segment.metadata()) : CandidateAttributes.empty(),
        Math.max(0.0, Math.min(1.0, score)));
  }
}
