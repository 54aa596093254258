package json.jsonc;

/// Thrown when the tokenizer meets a character that cannot start any token, or a string or
/// block comment that never terminates.
public final class JsoncLexException extends JsoncException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;
    private final int offset;

    /// Creates a new lex exception with position information.
    public JsoncLexException(String message, int line, int column, int offset) {
        super(formatMessage(message, line, column, offset));
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    /// Returns the 1-based line of the offending character.
    public int line() {
        return line;
    }

    /// Returns the 1-based column of the offending character.
    public int column() {
        return column;
    }

    /// Returns the 0-based char offset of the offending character.
    public int offset() {
        return offset;
    }

    private static String formatMessage(String message, int line, int column, int offset) {
        return message + " at line " + line + ", column " + column + " (offset " + offset + ")";
    }
}
