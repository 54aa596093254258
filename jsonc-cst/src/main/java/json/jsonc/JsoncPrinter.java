package json.jsonc;

import java.util.List;
import java.util.Objects;

/// Serializes a JSONC tree back to text.
///
/// Emits, node by node, leading trivia, content, trailing trivia. Nothing is normalized or
/// re-indented, so an unmodified tree prints exactly the text it was parsed from.
final class JsoncPrinter {

    private final StringBuilder out = new StringBuilder();

    private JsoncPrinter() {
    }

    /// Prints a tree.
    /// @param root the node to print
    /// @return the JSONC text
    /// @throws IllegalStateException if a container entry lacks raw text or a separator is not a comma
    static String print(JsoncNode root) {
        Objects.requireNonNull(root, "root must not be null");
        final var printer = new JsoncPrinter();
        printer.node(root);
        return printer.out.toString();
    }

    private void node(JsoncNode node) {
        if (node == null) {
            throw new IllegalStateException("Container entry without a node");
        }
        trivia(node.leadingTrivia());
        switch (node.kind()) {
            case SCALAR -> out.append(((JsoncNode.Scalar) node).raw());
            case KEY -> out.append(((JsoncNode.Key) node).raw());
            case OBJECT -> {
                final var object = (JsoncNode.ObjectNode) node;
                out.append('{');
                for (final var member : object.members()) {
                    node(member.key());
                    out.append(':');
                    node(member.value());
                    separator(member.separator());
                }
                trivia(object.danglingTrivia());
                out.append('}');
            }
            case ARRAY -> {
                final var array = (JsoncNode.ArrayNode) node;
                out.append('[');
                for (final var element : array.elements()) {
                    node(element.value());
                    separator(element.separator());
                }
                trivia(array.danglingTrivia());
                out.append(']');
            }
        }
        trivia(node.trailingTrivia());
    }

    private void separator(JsoncToken separator) {
        if (separator == null) {
            return;
        }
        if (separator.kind() != JsoncToken.Kind.COMMA) {
            throw new IllegalStateException("Separator must be a comma: " + separator);
        }
        out.append(separator.text());
    }

    private void trivia(List<JsoncToken> trivia) {
        for (final var token : trivia) {
            out.append(token.text());
        }
    }
}
