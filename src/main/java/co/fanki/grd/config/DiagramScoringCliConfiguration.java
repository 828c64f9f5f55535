package co.fanki.grd.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the command-line diagram scorer.
 *
 * <p>Active only when {@code grd.cli.enabled} is {@code true}, so the
 * engine can be embedded without scoring its own arguments.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "grd.cli.enabled", havingValue = "true")
public class DiagramScoringCliConfiguration {

    /**
     * Creates the runner that scores the files given as arguments.
     *
     * @param objectMapper the application object mapper
     * @return the runner
     */
    @Bean
    public DiagramScoringRunner diagramScoringRunner(
            final ObjectMapper objectMapper) {
        return new DiagramScoringRunner(objectMapper, System.out);
    }

}
