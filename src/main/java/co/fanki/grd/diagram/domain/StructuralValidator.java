package co.fanki.grd.diagram.domain;

import java.util.regex.Pattern;

/**
 * Cheap syntax-level acceptance check over raw diagram text.
 *
 * <p>Works on the text alone and never builds a graph, so callers can
 * reject garbage before paying for a full parse. Connectivity and node
 * existence are not checked here.</p>
 *
 * <p>Rules are evaluated in order and the first failure is reported:</p>
 * <ol>
 *   <li>some line opens with {@code graph} or {@code flowchart}</li>
 *   <li>there is at least one node declaration or edge connector</li>
 * </ol>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class StructuralValidator {

    /** Reason reported when no line declares the diagram kind. */
    public static final String MISSING_DECLARATION =
            "Missing diagram declaration: expected 'graph' or 'flowchart'";

    /** Reason reported when nothing looks like a node or an edge. */
    public static final String NO_DEFINITIONS =
            "No node or edge definitions found";

    /** Keyword prefix only, so {@code graphTD} is accepted too. */
    private static final Pattern DECLARATION = Pattern.compile(
            "^\\s*(graph|flowchart)",
            Pattern.MULTILINE | Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern DEFINITION = Pattern.compile(
            "\\w+\\s*\\[.*?\\]|\\w+\\s*\\(.*?\\)|\\w+\\s*\\{.*?\\}"
                    + "|\\w+\\s*-->|\\w+\\s*--",
            Pattern.UNICODE_CHARACTER_CLASS);

    private StructuralValidator() {
    }

    /**
     * Validates the diagram text. Never throws.
     *
     * @param text the diagram text, may be null
     * @return the validation outcome
     */
    public static ValidationResult validate(final String text) {
        if (text == null || !DECLARATION.matcher(text).find()) {
            return ValidationResult.rejected(MISSING_DECLARATION);
        }
        if (!DEFINITION.matcher(text).find()) {
            return ValidationResult.rejected(NO_DEFINITIONS);
        }
        return ValidationResult.accepted();
    }

}
