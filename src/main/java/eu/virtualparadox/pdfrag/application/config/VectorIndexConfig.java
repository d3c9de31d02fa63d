package eu.virtualparadox.pdfrag.application.config;

import eu.virtualparadox.pdfrag.rag.index.InMemoryVectorIndex;
import eu.virtualparadox.pdfrag.rag.index.LuceneVectorIndex;
import eu.virtualparadox.pdfrag.rag.index.VectorIndex;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.search.SearcherManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the {@link VectorIndex} backend from {@code pdfrag.index.backend}.
 */
@Configuration
@Slf4j
public class VectorIndexConfig {

    @Bean
    @ConditionalOnProperty(prefix = "pdfrag.index", name = "backend", havingValue = "lucene", matchIfMissing = true)
    public VectorIndex luceneVectorIndex(final IndexWriter indexWriter,
                                         final SearcherManager searcherManager,
                                         final EmbeddingProperties embedding) {
        log.info("Vector backend: LUCENE ({} dimensions, model {})", embedding.getDimension(), embedding.getModelName());
        return new LuceneVectorIndex(indexWriter, searcherManager, embedding.getDimension(), embedding.getModelName());
    }

    @Bean
    @ConditionalOnProperty(prefix = "pdfrag.index", name = "backend", havingValue = "in_memory")
    public VectorIndex inMemoryVectorIndex(final EmbeddingProperties embedding) {
        log.info("Vector backend: IN_MEMORY ({} dimensions, model {})", embedding.getDimension(), embedding.getModelName());
        return new InMemoryVectorIndex(embedding.getDimension(), embedding.getModelName());
    }
}
