package json.jsonc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Guesses the formatting conventions of a parsed document so that synthesized nodes blend in.
///
/// The guess is global: every whitespace trivia token holding a newline votes with the text after
/// its last newline, and the most frequent non-empty vote wins (first seen on a tie). Synthesized
/// nodes repeat the winning unit once per nesting level.
public final class JsoncIndent {

    /// Indent unit used when no whitespace trivia contains a newline.
    public static final String DEFAULT_UNIT = "    ";

    /// Line break used when the document has none.
    public static final String DEFAULT_NEWLINE = "\n";

    private JsoncIndent() {
        // Static utility class
    }

    /// Formatting used to synthesize new nodes.
    /// @param unit the indent string for one nesting level
    /// @param newline the line break sequence
    public record Style(String unit, String newline) {

        /// The style of a document with no line breaks.
        public static final Style DEFAULT = new Style(DEFAULT_UNIT, DEFAULT_NEWLINE);

        public Style {
            Objects.requireNonNull(unit, "unit must not be null");
            Objects.requireNonNull(newline, "newline must not be null");
        }

        /// Returns a line break followed by `depth` indent units.
        public String lineAt(int depth) {
            return newline + unit.repeat(Math.max(0, depth));
        }
    }

    /// Infers the indent unit of a tree.
    /// @param root the tree to scan
    /// @return the most frequent indentation, or [#DEFAULT_UNIT]
    public static String infer(JsoncNode root) {
        return style(root).unit();
    }

    /// Infers indent unit and newline sequence of a tree.
    /// @param root the tree to scan
    /// @return the inferred style
    public static Style style(JsoncNode root) {
        Objects.requireNonNull(root, "root must not be null");
        final var tally = new Tally();
        walk(root, tally);

        var unit = DEFAULT_UNIT;
        int best = 0;
        for (final var entry : tally.indents.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                unit = entry.getKey();
            }
        }
        final var newline = tally.crlf > tally.lf ? "\r\n" : DEFAULT_NEWLINE;
        return new Style(unit, newline);
    }

    private static void walk(JsoncNode node, Tally tally) {
        tally.scan(node.leadingTrivia());
        switch (node.kind()) {
            case SCALAR, KEY -> {
            }
            case OBJECT -> {
                final var object = (JsoncNode.ObjectNode) node;
                for (final var member : object.members()) {
                    walk(member.key(), tally);
                    walk(member.value(), tally);
                }
                tally.scan(object.danglingTrivia());
            }
            case ARRAY -> {
                final var array = (JsoncNode.ArrayNode) node;
                for (final var element : array.elements()) {
                    walk(element.value(), tally);
                }
                tally.scan(array.danglingTrivia());
            }
        }
        tally.scan(node.trailingTrivia());
    }

    private static final class Tally {
        private final Map<String, Integer> indents = new LinkedHashMap<>();
        private int crlf;
        private int lf;

        void scan(List<JsoncToken> trivia) {
            for (final var token : trivia) {
                if (token.kind() != JsoncToken.Kind.WHITESPACE) {
                    continue;
                }
                final var text = token.text();
                final int lastNewline = text.lastIndexOf('\n');
                if (lastNewline < 0) {
                    continue;
                }
                if (text.contains("\r\n")) {
                    crlf++;
                } else {
                    lf++;
                }
                final var indent = text.substring(lastNewline + 1);
                if (!indent.isEmpty()) {
                    indents.merge(indent, 1, Integer::sum);
                }
            }
        }
    }
}
