package eu.virtualparadox.helpindex.application.config;

import eu.virtualparadox.helpindex.util.Fingerprints;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Externalized settings of the help index, bound from {@code helpindex.*}.
 * <p>The index location defaults to a folder under {@code dataDir} keyed by the corpus root,
 * so two corpora never share one index.</p>
 */
@Configuration
@ConfigurationProperties(prefix = "helpindex")
@Getter @Setter
public class ApplicationConfig {

    private static final int ROOT_KEY_LENGTH = 16;

    private Path root;
    private String sourceFile = "brhelpcontent.xml";
    private Path index;
    private Path dataDir = Path.of(System.getProperty("user.home"), ".help-index");
    private boolean forceRebuild;
    private int extractionWorkers = 8;
    private int batchSize = 1000;
    private int progressInterval = 5000;
    private int maxPageSize = 100;
    private int defaultPageSize = 10;
    private String onlineHelpBaseUrl;

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root == null) {
            throw new IllegalStateException("helpindex.root must be configured");
        }
        Files.createDirectories(resolveIndexPath());
    }

    /**
     * @return the structure document inside the corpus root
     */
    public Path getSourcePath() {
        return root.resolve(sourceFile);
    }

    /**
     * Resolves the index directory: the explicit override when present,
     * otherwise {@code dataDir/<root key>}.
     *
     * @return absolute index directory
     */
    public Path resolveIndexPath() {
        if (index != null) {
            return index.toAbsolutePath();
        }
        final String rootKey = Fingerprints.sha256(root.toAbsolutePath().normalize().toString())
                .substring(0, ROOT_KEY_LENGTH);
        return dataDir.resolve(rootKey).toAbsolutePath();
    }
}
