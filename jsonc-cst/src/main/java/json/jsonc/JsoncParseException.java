package json.jsonc;

import java.util.Objects;

/// Thrown when the token sequence does not form a well-formed JSONC document.
/// Carries what the parser expected and the token it found instead.
public final class JsoncParseException extends JsoncException {

    private static final long serialVersionUID = 1L;

    private final String expected;
    private final JsoncToken.Kind found;
    private final int line;
    private final int column;
    private final int offset;

    /// Creates a new parse exception positioned at the offending token.
    public JsoncParseException(String expected, JsoncToken token) {
        super(formatMessage(expected, Objects.requireNonNull(token, "token must not be null")));
        this.expected = expected;
        this.found = token.kind();
        this.line = token.line();
        this.column = token.column();
        this.offset = token.offset();
    }

    /// Returns a description of what the parser expected, e.g. `':'` or `value`.
    public String expected() {
        return expected;
    }

    /// Returns the kind of token actually found.
    public JsoncToken.Kind found() {
        return found;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public int offset() {
        return offset;
    }

    private static String formatMessage(String expected, JsoncToken token) {
        final var sb = new StringBuilder();
        sb.append("Expected ").append(expected);
        if (token.kind() == JsoncToken.Kind.EOF) {
            sb.append(" but reached end of input");
        } else {
            sb.append(" but found '").append(token.text()).append('\'');
        }
        sb.append(" at line ").append(token.line());
        sb.append(", column ").append(token.column());
        sb.append(" (offset ").append(token.offset()).append(')');
        return sb.toString();
    }
}
