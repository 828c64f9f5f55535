package co.fanki.grd.diagram.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the EdgeKind enum.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class EdgeKindTest {

    @Test
    void whenResolvingConnector_givenArrow_shouldReturnDirected() {
        assertEquals(EdgeKind.DIRECTED, EdgeKind.fromConnector("-->"));
    }

    @Test
    void whenResolvingConnector_givenDash_shouldReturnUndirected() {
        assertEquals(EdgeKind.UNDIRECTED, EdgeKind.fromConnector("--"));
    }

    @Test
    void whenResolvingConnector_givenUnknown_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> EdgeKind.fromConnector("==>"));
    }

    @Test
    void whenRequestingLabel_shouldReturnLowerCaseName() {
        assertEquals("directed", EdgeKind.DIRECTED.label());
        assertEquals("undirected", EdgeKind.UNDIRECTED.label());
    }

}
