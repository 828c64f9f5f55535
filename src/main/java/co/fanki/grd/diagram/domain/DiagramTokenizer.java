package co.fanki.grd.diagram.domain;

import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Pattern-based scanner for node and edge declarations in diagram text.
 *
 * <p>This is not a full Mermaid grammar. It recognizes two shapes:</p>
 * <ul>
 *   <li>Node declarations: {@code id[label]}, {@code id(label)} and
 *       {@code id{label}}</li>
 *   <li>Edge declarations: {@code id --> id} and {@code id -- id}, where
 *       the source may carry an inline node declaration and the connector
 *       may carry a pipe label ({@code -->|yes|})</li>
 * </ul>
 *
 * <p>Edges are scanned independently of node declarations. The target of
 * an edge is matched with a look-ahead so that a chain such as
 * {@code A --> B --> C} produces both {@code A --> B} and
 * {@code B --> C}.</p>
 *
 * <p>Identifiers are Unicode word characters, so {@code Lösung} or
 * {@code 步骤1} are single ids.</p>
 *
 * <p>Both scans return lazy streams in source order.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DiagramTokenizer {

    /** Groups: 1 id, 2 bracketed label including its brackets. */
    static final Pattern NODE_PATTERN = Pattern.compile(
            "(\\w+)\\s*(\\[.*?\\]|\\(.*?\\)|\\{.*?\\})",
            Pattern.UNICODE_CHARACTER_CLASS);

    /** Groups: 1 source, 2 connector, 3 target (look-ahead). */
    static final Pattern EDGE_PATTERN = Pattern.compile(
            "(\\w+)\\s*"
                    + "(?:\\[[^\\]\\n]*\\]|\\([^)\\n]*\\)|\\{[^}\\n]*\\})?"
                    + "\\s*(-->|--)"
                    + "(?:\\|[^|\\n]*\\|)?"
                    + "\\s*(?=(\\w+))",
            Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * A node declaration found in the text.
     *
     * @param id the node identifier
     * @param label the trimmed label text
     * @param shape the shape given by the bracket style
     */
    public record NodeDeclaration(String id, String label, ShapeKind shape) {

        /** Converts this declaration into a graph node. */
        public DiagramNode toNode() {
            return new DiagramNode(id, label, shape);
        }
    }

    /**
     * An edge declaration found in the text.
     *
     * @param from the source identifier
     * @param to the target identifier
     * @param kind directed for {@code -->}, undirected for {@code --}
     */
    public record EdgeDeclaration(String from, String to, EdgeKind kind) {

        /** Converts this declaration into a graph edge. */
        public DiagramEdge toEdge() {
            return new DiagramEdge(from, to, kind);
        }
    }

    private DiagramTokenizer() {
    }

    /**
     * Scans the text for node declarations.
     *
     * @param text the diagram text, may be null
     * @return the declarations in source order, empty if text is null
     */
    public static Stream<NodeDeclaration> nodes(final String text) {
        if (text == null) {
            return Stream.empty();
        }
        return NODE_PATTERN.matcher(text).results()
                .map(DiagramTokenizer::toNodeDeclaration);
    }

    /**
     * Scans the text for edge declarations.
     *
     * @param text the diagram text, may be null
     * @return the declarations in source order, empty if text is null
     */
    public static Stream<EdgeDeclaration> edges(final String text) {
        if (text == null) {
            return Stream.empty();
        }
        return EDGE_PATTERN.matcher(text).results()
                .map(match -> new EdgeDeclaration(
                        match.group(1),
                        match.group(3),
                        EdgeKind.fromConnector(match.group(2))));
    }

    private static NodeDeclaration toNodeDeclaration(final MatchResult match) {
        final String bracketed = match.group(2);
        final ShapeKind shape = ShapeKind.fromOpeningBracket(
                bracketed.charAt(0));
        final String label = bracketed.substring(1, bracketed.length() - 1);
        return new NodeDeclaration(match.group(1), label.trim(), shape);
    }

}
