package co.fanki.grd.config;

import co.fanki.grd.diagram.domain.GraphAnalysis;
import co.fanki.grd.diagram.domain.GraphAnalyzer;
import co.fanki.grd.diagram.domain.GraphStructure;
import co.fanki.grd.diagram.domain.MalformedDiagramException;
import co.fanki.grd.diagram.domain.MermaidExtractor;
import co.fanki.grd.diagram.domain.MermaidParser;
import co.fanki.grd.diagram.domain.ValidationResult;
import co.fanki.grd.metrics.domain.GrdMetrics;
import co.fanki.grd.metrics.domain.QualityScore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Scores diagram files given on the command line.
 *
 * <p>Every non-option argument is read as a file holding a model answer
 * or raw diagram code. One JSON report per file is written to the output
 * stream. A file that cannot be read is reported with an {@code error}
 * field and the run goes on.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DiagramScoringRunner implements CommandLineRunner {

    private static final Logger LOG = LoggerFactory.getLogger(
            DiagramScoringRunner.class);

    private final ObjectMapper objectMapper;

    private final PrintStream out;

    /**
     * Creates a new DiagramScoringRunner.
     *
     * @param theObjectMapper the mapper used to render reports
     * @param theOut the stream reports are written to
     */
    public DiagramScoringRunner(final ObjectMapper theObjectMapper,
            final PrintStream theOut) {
        this.objectMapper = theObjectMapper;
        this.out = theOut;
    }

    @Override
    public void run(final String... args) throws JsonProcessingException {
        for (final String arg : args) {
            if (arg.startsWith("--")) {
                continue;
            }
            final ObjectNode report = report(Path.of(arg));
            out.println(objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(report));
        }
    }

    /**
     * Builds the report for a single diagram file.
     *
     * @param file the file to score
     * @return the JSON report
     */
    ObjectNode report(final Path file) {
        final ObjectNode report = objectMapper.createObjectNode();
        report.put("file", file.toString());

        final String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            LOG.warn("Failed to read diagram file {}: {}",
                    file, e.getMessage());
            report.put("error", "Unreadable file: " + e.getMessage());
            return report;
        }

        final String diagram = MermaidExtractor.extract(content)
                .orElse(content);

        final ValidationResult validation = MermaidParser.validate(diagram);
        report.put("valid", validation.valid());
        report.put("reason", validation.reason());

        GraphStructure graph = null;
        try {
            graph = MermaidParser.parse(diagram);
        } catch (final MalformedDiagramException e) {
            LOG.debug("Diagram in {} is malformed: {}", file, e.getMessage());
            report.put("error", e.getMessage());
        }

        final QualityScore score = graph == null
                ? QualityScore.zero()
                : GrdMetrics.evaluate(diagram, graph);

        final ObjectNode scores = report.putObject("scores");
        scores.put("validity", score.validity());
        scores.put("completeness", score.completeness());
        scores.put("traceability", score.traceability());
        scores.put("overall", score.overall());

        if (graph != null) {
            final GraphAnalysis analysis = GraphAnalyzer.analyze(graph);
            final ArrayNode order = report.putArray("executionOrder");
            analysis.executionOrder().forEach(order::add);
            report.put("hasCycle", analysis.hasCycle());
            final ArrayNode unreachable = report.putArray("unreachableNodes");
            analysis.unreachableNodes().forEach(unreachable::add);
            final ArrayNode dangling = report.putArray("danglingEdges");
            analysis.danglingEdges().forEach(
                    edge -> dangling.add(edge.toString()));
            report.set("graph", graph.toJsonTree());
        }

        return report;
    }

}
