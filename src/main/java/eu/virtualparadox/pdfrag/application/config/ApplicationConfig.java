package eu.virtualparadox.pdfrag.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Filesystem layout of the application.
 * <p>{@code documents} holds the source PDFs (the filesystem of record), {@code processed} and
 * {@code summaries} hold derived artifacts, {@code index} holds the persistent vector collection.</p>
 */
@Configuration
@ConfigurationProperties(prefix = "pdfrag")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path documents;
    private Path processed;
    private Path summaries;
    private Path index;
    private Path models;

    /** Upper bound for a single PDF accepted by ingestion and upload. */
    private DataSize maxFileSize = DataSize.ofMegabytes(100);

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root != null) Files.createDirectories(root);
        if (documents != null) Files.createDirectories(documents);
        if (processed != null) Files.createDirectories(processed);
        if (summaries != null) Files.createDirectories(summaries);
        if (index != null) Files.createDirectories(index);
        if (models != null) Files.createDirectories(models);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
