package json.jsonc;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for JsoncLexer - token kinds, positions and lexical errors
class JsoncLexerTest extends JsoncTestBase {

    @Test
    void testTokenKindsOfSmallObject() {
        final var tokens = JsoncLexer.tokenize("{\"a\": [1, true, null]} // end");
        assertThat(tokens).extracting(JsoncToken::kind).containsExactly(
                JsoncToken.Kind.LBRACE,
                JsoncToken.Kind.STRING,
                JsoncToken.Kind.COLON,
                JsoncToken.Kind.WHITESPACE,
                JsoncToken.Kind.LBRACKET,
                JsoncToken.Kind.NUMBER,
                JsoncToken.Kind.COMMA,
                JsoncToken.Kind.WHITESPACE,
                JsoncToken.Kind.TRUE,
                JsoncToken.Kind.COMMA,
                JsoncToken.Kind.WHITESPACE,
                JsoncToken.Kind.NULL,
                JsoncToken.Kind.RBRACKET,
                JsoncToken.Kind.RBRACE,
                JsoncToken.Kind.WHITESPACE,
                JsoncToken.Kind.LINE_COMMENT,
                JsoncToken.Kind.EOF);
    }

    @Test
    void testTokensCoverEveryCharExactlyOnce() {
        final var text = "/* head */\n{\r\n  \"k\\\"ey\": -1.5e+3, // tail\r\n  \"b\": false\n}\n";
        final var tokens = JsoncLexer.tokenize(text);
        final var joined = tokens.stream().map(JsoncToken::text).collect(Collectors.joining());
        assertThat(joined).isEqualTo(text);
        assertThat(tokens.get(tokens.size() - 1).kind()).isEqualTo(JsoncToken.Kind.EOF);
        assertThat(tokens.get(tokens.size() - 1).offset()).isEqualTo(text.length());
    }

    @Test
    void testEmptyInputIsJustEof() {
        final var tokens = JsoncLexer.tokenize("");
        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).kind()).isEqualTo(JsoncToken.Kind.EOF);
        assertThat(tokens.get(0).line()).isEqualTo(1);
        assertThat(tokens.get(0).column()).isEqualTo(1);
    }

    @Test
    void testPositionsTrackLinesAndColumns() {
        final var tokens = JsoncLexer.tokenize("{\n  \"a\": 1\n}");
        final var key = tokens.get(2);
        assertThat(key.kind()).isEqualTo(JsoncToken.Kind.STRING);
        assertThat(key.line()).isEqualTo(2);
        assertThat(key.column()).isEqualTo(3);
        assertThat(key.offset()).isEqualTo(4);

        final var close = tokens.get(tokens.size() - 2);
        assertThat(close.kind()).isEqualTo(JsoncToken.Kind.RBRACE);
        assertThat(close.line()).isEqualTo(3);
        assertThat(close.column()).isEqualTo(1);
    }

    @Test
    void testLineCommentStopsBeforeLineBreak() {
        final var tokens = JsoncLexer.tokenize("// note\r\n1");
        assertThat(tokens.get(0).text()).isEqualTo("// note");
        assertThat(tokens.get(1).text()).isEqualTo("\r\n");
        assertThat(tokens.get(2).text()).isEqualTo("1");
    }

    @Test
    void testBlockCommentMaySpanLines() {
        final var tokens = JsoncLexer.tokenize("/* a\n * b\n */ 2");
        assertThat(tokens.get(0).kind()).isEqualTo(JsoncToken.Kind.BLOCK_COMMENT);
        assertThat(tokens.get(0).text()).isEqualTo("/* a\n * b\n */");
        assertThat(tokens.get(2).line()).isEqualTo(3);
        assertThat(tokens.get(2).column()).isEqualTo(5);
    }

    @Test
    void testStringKeepsRawEscapes() {
        final var tokens = JsoncLexer.tokenize("\"a\\u0041\\n\\\"\"");
        assertThat(tokens.get(0).kind()).isEqualTo(JsoncToken.Kind.STRING);
        assertThat(tokens.get(0).text()).isEqualTo("\"a\\u0041\\n\\\"\"");
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-0", "12", "-3.25", "1e10", "6.02E-23", "4E+2"})
    void testNumbersKeepRawText(String number) {
        final var tokens = JsoncLexer.tokenize(number);
        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(0).kind()).isEqualTo(JsoncToken.Kind.NUMBER);
        assertThat(tokens.get(0).text()).isEqualTo(number);
    }

    @Test
    void testIllegalCharacterReportsPosition() {
        assertThatThrownBy(() -> JsoncLexer.tokenize("{\n  \"a\": @\n}"))
                .isInstanceOf(JsoncLexException.class)
                .satisfies(e -> {
                    final var ex = (JsoncLexException) e;
                    assertThat(ex.line()).isEqualTo(2);
                    assertThat(ex.column()).isEqualTo(8);
                    assertThat(ex.offset()).isEqualTo(9);
                    assertThat(ex.getMessage()).contains("'@'").contains("line 2, column 8");
                });
    }

    @Test
    void testUnterminatedStringFailsAtOpeningQuote() {
        assertThatThrownBy(() -> JsoncLexer.tokenize("[\"abc"))
                .isInstanceOf(JsoncLexException.class)
                .satisfies(e -> assertThat(((JsoncLexException) e).offset()).isEqualTo(1));
    }

    @Test
    void testUnterminatedBlockCommentFails() {
        assertThatThrownBy(() -> JsoncLexer.tokenize("1 /* open"))
                .isInstanceOf(JsoncLexException.class)
                .hasMessageContaining("Unterminated block comment");
    }

    @ParameterizedTest
    @ValueSource(strings = {"tru", "nul", "-", "'a'", "/ 1", "#"})
    void testMalformedLiteralsFail(String text) {
        assertThatThrownBy(() -> JsoncLexer.tokenize(text)).isInstanceOf(JsoncLexException.class);
    }

    @Test
    void testSyntheticTokensHaveNoPosition() {
        final var token = JsoncToken.whitespace("\n  ");
        assertThat(token.isSynthetic()).isTrue();
        assertThat(token.isTrivia()).isTrue();
        assertThat(token.offset()).isEqualTo(-1);
        assertThat(JsoncToken.comma().isTrivia()).isFalse();
    }
}
