package eu.virtualparadox.helpindex.ingest.extractor;

import eu.virtualparadox.helpindex.ingest.cleaner.TextCleaner;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * HTML-specific extractor that uses jsoup to turn a help page into one line of plain text.
 * <p>Script, style and other non-content elements are dropped before text is collected;
 * whitespace is collapsed by {@link TextCleaner}.</p>
 */
@Service
@RequiredArgsConstructor
public final class HtmlTextExtractor implements TextExtractor {

    private static final String NON_CONTENT = "script, style, noscript, template";

    private final TextCleaner textCleaner;

    @Override
    public String extractText(final Path path) throws IOException {
        final Document html = Jsoup.parse(path.toFile(), StandardCharsets.UTF_8.name());
        html.select(NON_CONTENT).remove();

        final Element body = html.body();
        final String raw = body != null ? body.text() : html.text();
        return textCleaner.cleanText(raw);
    }
}
