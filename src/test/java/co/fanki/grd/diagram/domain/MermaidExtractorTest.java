package co.fanki.grd.diagram.domain;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link MermaidExtractor}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class MermaidExtractorTest {

    @Test
    void whenExtracting_givenMermaidFence_shouldReturnBlockBody() {
        final String answer = """
                Here is my plan:
                ```mermaid
                flowchart TD
                    A[Read] --> B[Solve]
                ```
                Then I follow it.
                """;

        assertEquals(Optional.of("flowchart TD\n    A[Read] --> B[Solve]"),
                MermaidExtractor.extract(answer));
    }

    @Test
    void whenExtracting_givenUntaggedFence_shouldReturnBlockBody() {
        assertEquals(Optional.of("graph LR\nA --> B"),
                MermaidExtractor.extract("```\ngraph LR\nA --> B\n```"));
    }

    @Test
    void whenExtracting_givenTwoFences_shouldReturnFirst() {
        assertEquals(Optional.of("graph TD\nA[x]"),
                MermaidExtractor.extract(
                        "```mermaid\ngraph TD\nA[x]\n```\n"
                                + "```mermaid\ngraph TD\nB[y]\n```"));
    }

    @Test
    void whenExtracting_givenRawDiagram_shouldReturnTrimmedText() {
        assertEquals(Optional.of("flowchart TD\n A[x]"),
                MermaidExtractor.extract("  flowchart TD\n A[x]  \n"));
    }

    @Test
    void whenExtracting_givenSequenceDiagram_shouldReturnText() {
        assertEquals(Optional.of("sequenceDiagram\n A->>B: hi"),
                MermaidExtractor.extract("sequenceDiagram\n A->>B: hi"));
    }

    @Test
    void whenExtracting_givenProse_shouldReturnEmpty() {
        assertTrue(MermaidExtractor.extract("I think the answer is 42")
                .isEmpty());
    }

    @Test
    void whenExtracting_givenNull_shouldReturnEmpty() {
        assertTrue(MermaidExtractor.extract(null).isEmpty());
    }

}
