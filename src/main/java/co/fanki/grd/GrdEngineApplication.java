package co.fanki.grd;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * GRD Engine Application.
 *
 * <p>Parses Guided Reasoning Diagrams (Mermaid flowcharts describing a
 * sequence of reasoning steps), analyzes their execution order and
 * scores their quality. Run with {@code --grd.cli.enabled=true} followed
 * by file paths to print a JSON report per file.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class GrdEngineApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(GrdEngineApplication.class, args);
    }

}
