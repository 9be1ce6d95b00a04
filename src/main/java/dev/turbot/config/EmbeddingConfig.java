package dev.turbot.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Configures the embedding model and the vector store holding travel document fragments.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running
 * in-process. The {@link PgVectorEmbeddingStore} shares the application's HikariCP
 * {@link DataSource}; fragment attributes live in its JSON metadata column, which is what
 * the single equality pre-filter of a search runs against.
 *
 * @see dev.turbot.search.EmbeddingStoreCandidateStore
 */
@Configuration
public class EmbeddingConfig {

    /**
     * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
     *
     * @return a ready-to-use embedding model requiring no external API
     */
    @Bean
    public EmbeddingModel embeddingModel() {
        return new BgeSmallEnV15QuantizedEmbeddingModel();
    }

    /**
     * Configures the pgvector embedding store holding the fragments.
     *
     * @param dataSource  the shared HikariCP data source (no duplicate pool)
     * @param table       table holding fragments, embeddings and metadata
     * @param dimension   embedding dimension, must match the embedding model
     * @param createTable whether the store creates its table and index on startup
     * @return an embedding store backed by pgvector
     */
    @Bean
    public EmbeddingStore<TextSegment> embeddingStore(
            DataSource dataSource,
            @Value("${turbot.store.table:travel_fragments}") String table,
            @Value("${turbot.store.dimension:384}") int dimension,
            @Value("${turbot.store.create-table:true}") boolean createTable) {
        return PgVectorEmbeddingStore.datasourceBuilder()
                .datasource(dataSource)
                .table(table)
                .dimension(dimension)
                .createTable(createTable)
                .useIndex(true)   // IVFFlat index for approximate search
                .indexListSize(100)
                .build();
    }
}
