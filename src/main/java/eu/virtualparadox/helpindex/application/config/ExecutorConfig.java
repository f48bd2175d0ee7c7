package eu.virtualparadox.helpindex.application.config;

import eu.virtualparadox.helpindex.application.executor.ExtractionExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public ExtractionExecutor extractionExecutor(final ApplicationConfig props) {
        return ExtractionExecutor.create(props.getExtractionWorkers());
    }
}
