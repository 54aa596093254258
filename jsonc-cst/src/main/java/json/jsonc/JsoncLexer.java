package json.jsonc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Tokenizer for the JSONC dialect.
///
/// Produces a total, ordered token list: every char of the input lands in exactly one token,
/// and the list always ends with an [JsoncToken.Kind#EOF] token of empty text.
/// Concatenating the text of all tokens gives back the input.
///
/// Recognized input:
/// - whitespace: runs of space, tab, CR and LF
/// - `// ...` up to (not including) the end of the line
/// - `/* ... */`
/// - strings, raw escapes kept; a backslash escapes the next char
/// - numbers: `-?(0|[1-9][0-9]*)(.[0-9]+)?([eE][+-]?[0-9]+)?`
/// - `true`, `false`, `null`, `{`, `}`, `[`, `]`, `:`, `,`
///
/// Anything else fails with [JsoncLexException]; there is no skip-and-continue.
final class JsoncLexer {

    private static final Logger LOG = Logger.getLogger(JsoncLexer.class.getName());

    private final String text;
    private int pos;
    private int line;
    private int column;

    private JsoncLexer(String text) {
        this.text = text;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    /// Splits source text into tokens.
    /// @param text the JSONC source
    /// @return the token list, terminated by an EOF token
    /// @throws NullPointerException if text is null
    /// @throws JsoncLexException on an unrecognized character or unterminated literal
    static List<JsoncToken> tokenize(String text) {
        Objects.requireNonNull(text, "text must not be null");
        LOG.fine(() -> "Tokenizing " + text.length() + " chars");
        return new JsoncLexer(text).run();
    }

    private List<JsoncToken> run() {
        final var tokens = new ArrayList<JsoncToken>();
        while (pos < text.length()) {
            final var token = next();
            LOG.finer(() -> "Token: " + token);
            tokens.add(token);
        }
        tokens.add(new JsoncToken(JsoncToken.Kind.EOF, "", line, column, pos));
        return tokens;
    }

    private JsoncToken next() {
        final char c = text.charAt(pos);
        return switch (c) {
            case ' ', '\t', '\r', '\n' -> scanWhitespace();
            case '/' -> scanComment();
            case '"' -> scanString();
            case '{' -> single(JsoncToken.Kind.LBRACE);
            case '}' -> single(JsoncToken.Kind.RBRACE);
            case '[' -> single(JsoncToken.Kind.LBRACKET);
            case ']' -> single(JsoncToken.Kind.RBRACKET);
            case ':' -> single(JsoncToken.Kind.COLON);
            case ',' -> single(JsoncToken.Kind.COMMA);
            case 't' -> scanKeyword("true", JsoncToken.Kind.TRUE);
            case 'f' -> scanKeyword("false", JsoncToken.Kind.FALSE);
            case 'n' -> scanKeyword("null", JsoncToken.Kind.NULL);
            default -> {
                if (c == '-' || isDigit(c)) {
                    yield scanNumber();
                }
                throw illegal(pos);
            }
        };
    }

    private JsoncToken single(JsoncToken.Kind kind) {
        return emit(kind, pos + 1);
    }

    private JsoncToken scanWhitespace() {
        int end = pos;
        while (end < text.length() && isWhitespace(text.charAt(end))) {
            end++;
        }
        return emit(JsoncToken.Kind.WHITESPACE, end);
    }

    private JsoncToken scanComment() {
        if (pos + 1 >= text.length()) {
            throw illegal(pos);
        }
        final char second = text.charAt(pos + 1);
        if (second == '/') {
            int end = pos + 2;
            while (end < text.length() && text.charAt(end) != '\n' && text.charAt(end) != '\r') {
                end++;
            }
            return emit(JsoncToken.Kind.LINE_COMMENT, end);
        }
        if (second == '*') {
            final int close = text.indexOf("*/", pos + 2);
            if (close < 0) {
                throw new JsoncLexException("Unterminated block comment", line, column, pos);
            }
            return emit(JsoncToken.Kind.BLOCK_COMMENT, close + 2);
        }
        throw illegal(pos);
    }

    private JsoncToken scanString() {
        int end = pos + 1;
        while (end < text.length()) {
            final char c = text.charAt(end);
            if (c == '\\') {
                end += 2;
            } else if (c == '"') {
                return emit(JsoncToken.Kind.STRING, end + 1);
            } else {
                end++;
            }
        }
        throw new JsoncLexException("Unterminated string", line, column, pos);
    }

    private JsoncToken scanNumber() {
        int end = pos;
        if (text.charAt(end) == '-') {
            end++;
        }
        if (end >= text.length() || !isDigit(text.charAt(end))) {
            throw illegal(pos);
        }
        if (text.charAt(end) == '0') {
            end++;
        } else {
            end = skipDigits(end);
        }
        if (end + 1 < text.length() && text.charAt(end) == '.' && isDigit(text.charAt(end + 1))) {
            end = skipDigits(end + 1);
        }
        if (end < text.length() && (text.charAt(end) == 'e' || text.charAt(end) == 'E')) {
            int exp = end + 1;
            if (exp < text.length() && (text.charAt(exp) == '+' || text.charAt(exp) == '-')) {
                exp++;
            }
            if (exp < text.length() && isDigit(text.charAt(exp))) {
                end = skipDigits(exp);
            }
        }
        return emit(JsoncToken.Kind.NUMBER, end);
    }

    private JsoncToken scanKeyword(String keyword, JsoncToken.Kind kind) {
        if (!text.startsWith(keyword, pos)) {
            throw illegal(pos);
        }
        return emit(kind, pos + keyword.length());
    }

    private int skipDigits(int from) {
        int end = from;
        while (end < text.length() && isDigit(text.charAt(end))) {
            end++;
        }
        return end;
    }

    /// Cuts `text[pos, end)` into a token and advances line/column past it.
    private JsoncToken emit(JsoncToken.Kind kind, int end) {
        final var raw = text.substring(pos, end);
        final var token = new JsoncToken(kind, raw, line, column, pos);
        for (int i = 0; i < raw.length(); i++) {
            if (raw.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        pos = end;
        return token;
    }

    private JsoncLexException illegal(int at) {
        return new JsoncLexException("Illegal character '" + text.charAt(at) + "'", line, column, at);
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
