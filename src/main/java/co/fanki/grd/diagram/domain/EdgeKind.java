package co.fanki.grd.diagram.domain;

/**
 * Kind of connection between two diagram nodes.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum EdgeKind {

    /** Arrow connector {@code -->}; the source precedes the target. */
    DIRECTED("-->"),

    /** Plain connector {@code --}; adjacency only. */
    UNDIRECTED("--");

    private final String connector;

    EdgeKind(final String theConnector) {
        this.connector = theConnector;
    }

    /** Returns the connector text used in diagram source. */
    public String connector() {
        return connector;
    }

    /**
     * Resolves the kind for a connector token.
     *
     * @param connector the connector text, {@code -->} or {@code --}
     * @return the matching edge kind
     * @throws IllegalArgumentException if the connector is unknown
     */
    public static EdgeKind fromConnector(final String connector) {
        if (DIRECTED.connector.equals(connector)) {
            return DIRECTED;
        }
        if (UNDIRECTED.connector.equals(connector)) {
            return UNDIRECTED;
        }
        throw new IllegalArgumentException(
                "Unknown edge connector: " + connector);
    }

    /** Returns the lower-case name used in JSON reports. */
    public String label() {
        return name().toLowerCase();
    }

}
