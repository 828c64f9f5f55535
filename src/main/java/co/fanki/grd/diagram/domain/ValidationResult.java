package co.fanki.grd.diagram.domain;

/**
 * Outcome of the structural validation of a diagram.
 *
 * @param valid whether every acceptance rule holds
 * @param reason the failed rule, or null when valid
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ValidationResult(boolean valid, String reason) {

    private static final ValidationResult ACCEPTED =
            new ValidationResult(true, null);

    /** Returns the result for an accepted diagram. */
    public static ValidationResult accepted() {
        return ACCEPTED;
    }

    /**
     * Creates the result for a rejected diagram.
     *
     * @param reason the rule that failed
     * @return the rejected result
     */
    public static ValidationResult rejected(final String reason) {
        return new ValidationResult(false, reason);
    }

}
