package eu.virtualparadox.helpindex.application.config;

import eu.virtualparadox.helpindex.tree.HelpTree;
import eu.virtualparadox.helpindex.tree.ancestry.AncestryResolver;
import eu.virtualparadox.helpindex.tree.parser.StructureParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Parses the structure document once at startup. A syntax error aborts startup.
 */
@Configuration
@Slf4j
public class TreeConfig {

    @Bean
    public StructureParser structureParser() {
        return new StructureParser();
    }

    @Bean
    public HelpTree helpTree(final StructureParser parser, final ApplicationConfig props) {
        final HelpTree tree = parser.parse(props.getSourcePath());
        log.info("Loaded help structure from {}: {} nodes ({} pages, {} sections)",
                props.getSourcePath(), tree.size(), tree.pageCount(), tree.sectionCount());
        return tree;
    }

    @Bean
    public AncestryResolver ancestryResolver(final HelpTree tree) {
        return new AncestryResolver(tree);
    }
}
