package co.fanki.grd.diagram.domain;

import co.fanki.grd.shared.DomainException;

/**
 * Thrown when no node or edge syntax can be recognized in a diagram.
 *
 * <p>Distinguishes unparseable input from a diagram that parses but
 * scores poorly.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MalformedDiagramException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code carried by every instance. */
    public static final String ERROR_CODE = "MALFORMED_DIAGRAM";

    /**
     * Creates a new exception.
     *
     * @param message the error message
     */
    public MalformedDiagramException(final String message) {
        super(message, ERROR_CODE);
    }

}
