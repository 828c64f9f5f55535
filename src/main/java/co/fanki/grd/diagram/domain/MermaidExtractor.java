package co.fanki.grd.diagram.domain;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls Mermaid diagram code out of a free-text answer.
 *
 * <p>Answers usually wrap the diagram in a markdown code fence, tagged
 * {@code mermaid} or not. When there is no fence, the answer is taken as
 * diagram code only if it already opens with a diagram keyword.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class MermaidExtractor {

    private static final Pattern CODE_FENCE = Pattern.compile(
            "```(?:mermaid)?\\s*\\n(.*?)```", Pattern.DOTALL);

    private static final String[] DIAGRAM_KEYWORDS = {
        "graph", "flowchart", "sequenceDiagram"
    };

    private MermaidExtractor() {
    }

    /**
     * Extracts the diagram code from the given text.
     *
     * @param text the answer text, may be null
     * @return the trimmed diagram code, or empty if none was found
     */
    public static Optional<String> extract(final String text) {
        if (text == null) {
            return Optional.empty();
        }

        final Matcher fence = CODE_FENCE.matcher(text);
        if (fence.find()) {
            return Optional.of(fence.group(1).strip());
        }

        final String stripped = text.strip();
        for (final String keyword : DIAGRAM_KEYWORDS) {
            if (stripped.startsWith(keyword)) {
                return Optional.of(stripped);
            }
        }
        return Optional.empty();
    }

}
