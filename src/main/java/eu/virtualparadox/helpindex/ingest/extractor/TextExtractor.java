package eu.virtualparadox.helpindex.ingest.extractor;

import java.io.IOException;
import java.nio.file.Path;

public interface TextExtractor {

    String extractText(final Path path) throws IOException;

}
