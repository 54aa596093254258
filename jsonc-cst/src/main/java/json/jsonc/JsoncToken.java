package json.jsonc;

import java.util.Objects;

/// A classified slice of JSONC source text.
///
/// Tokens are either significant (structural punctuation and literals) or trivia
/// (whitespace and comments). The raw text is kept verbatim so that printing a token
/// reproduces the exact source characters it was cut from.
///
/// Positions are 1-based `line`/`column` and a 0-based char `offset` into the source.
/// Tokens built during synthesis have no source position and report line 0, column 0, offset -1.
public record JsoncToken(Kind kind, String text, int line, int column, int offset) {

    /// Token kinds of the JSONC dialect.
    public enum Kind {
        WHITESPACE,
        LINE_COMMENT,
        BLOCK_COMMENT,
        STRING,
        NUMBER,
        TRUE,
        FALSE,
        NULL,
        LBRACE,
        RBRACE,
        LBRACKET,
        RBRACKET,
        COLON,
        COMMA,
        EOF;

        /// Returns true for whitespace and comments.
        public boolean isTrivia() {
            return this == WHITESPACE || this == LINE_COMMENT || this == BLOCK_COMMENT;
        }
    }

    public JsoncToken {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /// Creates a token that was not cut from source text.
    public static JsoncToken synthetic(Kind kind, String text) {
        return new JsoncToken(kind, text, 0, 0, -1);
    }

    /// Creates a synthetic whitespace token.
    public static JsoncToken whitespace(String text) {
        return synthetic(Kind.WHITESPACE, text);
    }

    /// Creates a synthetic `,` separator.
    public static JsoncToken comma() {
        return synthetic(Kind.COMMA, ",");
    }

    public boolean isTrivia() {
        return kind.isTrivia();
    }

    public boolean isSynthetic() {
        return offset < 0;
    }
}
