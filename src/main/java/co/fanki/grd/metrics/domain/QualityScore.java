package co.fanki.grd.metrics.domain;

/**
 * Quality scores of a single diagram, each in [0, 1].
 *
 * @param validity 1.0 if the diagram passes structural validation
 * @param completeness presence of start, end, steps and edges
 * @param traceability how much of the diagram is executable
 * @param overall the weighted combination of the three
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record QualityScore(
        double validity,
        double completeness,
        double traceability,
        double overall) {

    private static final QualityScore ZERO = new QualityScore(0, 0, 0, 0);

    /** Returns the score of a diagram that could not be evaluated. */
    public static QualityScore zero() {
        return ZERO;
    }

}
