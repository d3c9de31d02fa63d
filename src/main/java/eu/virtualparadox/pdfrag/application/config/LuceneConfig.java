package eu.virtualparadox.pdfrag.application.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens the on-disk vector collection used by the Lucene backend.
 * <p>
 * The collection lives under {@code pdfrag.index} and survives restarts: the writer appends to
 * whatever a previous run committed. The analyzer only tokenizes the stored chunk text; chunk ids
 * and metadata are indexed as exact terms. Only active when {@code pdfrag.index.backend=lucene}.
 */
@Configuration
@ConditionalOnProperty(prefix = "pdfrag.index", name = "backend", havingValue = "lucene", matchIfMissing = true)
@Slf4j
public class LuceneConfig {

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private Analyzer analyzer;

    @Bean
    public Directory luceneDirectory(final ApplicationConfig props) throws IOException {
        final Path collectionPath = props.getIndex();
        Files.createDirectories(collectionPath);
        this.directory = FSDirectory.open(collectionPath);
        return this.directory;
    }

    @Bean
    public Analyzer chunkTextAnalyzer() {
        this.analyzer = new StandardAnalyzer();
        return this.analyzer;
    }

    /**
     * Single writer of the collection. Every mutation of the vector index goes through it.
     */
    @Bean
    public IndexWriter indexWriter(final Directory dir, final Analyzer analyzer) throws IOException {
        this.indexWriter = new IndexWriter(dir, new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND));
        log.info("Opened vector collection at {} with {} records", dir, indexWriter.getDocStats().numDocs);
        return this.indexWriter;
    }

    /**
     * Searchers refreshed from the writer after each commit.
     */
    @Bean
    public SearcherManager searcherManager(final IndexWriter writer) throws IOException {
        this.searcherManager = new SearcherManager(writer, null);
        return this.searcherManager;
    }

    /**
     * Closes searchers before the writer and the writer before the directory.
     */
    @PreDestroy
    public void close() {
        closeResource("searcher manager", searcherManager);
        closeResource("index writer", indexWriter);
        closeResource("analyzer", analyzer);
        closeResource("directory", directory);
        log.info("Vector collection closed");
    }

    private static void closeResource(final String name, final Closeable resource) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (IOException | RuntimeException e) {
            log.error("Unable to close Lucene {}", name, e);
        }
    }
}
