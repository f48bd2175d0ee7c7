package eu.virtualparadox.helpindex;

import eu.virtualparadox.helpindex.catalog.model.IndexStatistics;
import eu.virtualparadox.helpindex.catalog.service.HelpCatalogService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@Slf4j
public class HelpIndexApplication {

    public static void main(final String[] args) {
        SpringApplication.run(HelpIndexApplication.class, args);
    }

    @Bean
    public ApplicationRunner startupReport(final HelpCatalogService catalogService) {
        return args -> {
            final IndexStatistics stats = catalogService.getStatistics();
            log.info("Help index ready: {} documents built {} ({} pages, {} sections) at {}",
                    stats.documentCount(), stats.builtAt(), stats.pageCount(), stats.sectionCount(), stats.indexPath());
        };
    }
}
