package eu.virtualparadox.helpindex.application.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the shared Lucene analyzer.
 * <p>Directories, writers and searchers are generation-scoped and owned by
 * {@link eu.virtualparadox.helpindex.index.HelpIndexManager}.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private Analyzer analyzer;

    /**
     * Provides a shared, general-purpose analyzer used for both indexing and querying.
     *
     * @return {@link StandardAnalyzer} instance
     */
    @Bean
    public Analyzer analyzer() {
        this.analyzer = new StandardAnalyzer();
        return this.analyzer;
    }

    @PreDestroy
    public void close() {
        try { if (analyzer != null) analyzer.close(); } catch (Exception e) {
            log.error("Unable to close Analyzer", e);
        }
    }
}
