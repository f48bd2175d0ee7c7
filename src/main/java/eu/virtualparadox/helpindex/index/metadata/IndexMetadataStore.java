package eu.virtualparadox.helpindex.index.metadata;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Reads and writes {@link IndexMetadata} as a small JSON file.
 * <p>Writes go to a temporary file in the same directory which then atomically replaces the
 * target, so readers see either the previous record or the new one, never a partial file.</p>
 */
@Slf4j
public class IndexMetadataStore {

    public static final String FILE_NAME = "index-metadata.json";

    private static final String TEMP_FILE_PREFIX = "meta-";
    private static final String TEMP_FILE_SUFFIX = ".tmp";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    @Getter
    private final Path file;

    public IndexMetadataStore(final Path file) {
        this.file = file;
    }

    public static IndexMetadataStore forIndex(final Path indexPath) {
        return new IndexMetadataStore(indexPath.resolve(FILE_NAME));
    }

    /**
     * @return the stored record; empty when the file is absent or cannot be decoded
     */
    public Optional<IndexMetadata> read() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(MAPPER.readValue(file.toFile(), IndexMetadata.class));
        } catch (IOException e) {
            log.warn("Unreadable index metadata at {}, treating it as missing", file, e);
            return Optional.empty();
        }
    }

    /**
     * Atomically replaces the stored record.
     *
     * @param metadata record to persist
     * @throws IOException if the record cannot be written or moved into place
     */
    public void write(final IndexMetadata metadata) throws IOException {
        final Path dir = file.toAbsolutePath().getParent();
        Files.createDirectories(dir);

        final Path temp = Files.createTempFile(dir, TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);
        try {
            MAPPER.writeValue(temp.toFile(), metadata);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported in {}, replacing metadata non-atomically", dir);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
