package json.jsonc;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Recursive descent builder of the JSONC concrete syntax tree.
///
/// Trivia ownership rules:
/// - trivia before a significant token becomes leading trivia of the node that token opens
/// - trivia between a key and `:` is the key's trailing trivia
/// - trivia after a value, up to the next `,` or closing bracket, is the value's trailing trivia
/// - trivia after a `,` is leading trivia of the next key or element
/// - trivia before a closing bracket that no child owns (empty container, trailing comma)
///   is the container's dangling trivia
/// - trivia around the root value is the root's leading and trailing trivia
///
/// Parsing is all-or-nothing: the first structural violation throws [JsoncParseException].
/// Containers nested deeper than [#MAX_DEPTH] are rejected the same way.
final class JsoncParser {

    private static final Logger LOG = Logger.getLogger(JsoncParser.class.getName());

    /// Deepest container nesting accepted before parsing fails.
    static final int MAX_DEPTH = 1000;

    private final List<JsoncToken> tokens;
    private int pos;
    private int depth;

    private JsoncParser(List<JsoncToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /// Tokenizes and parses JSONC source text.
    /// @param text the JSONC source
    /// @return the root node
    /// @throws NullPointerException if text is null
    /// @throws JsoncLexException if the text cannot be tokenized
    /// @throws JsoncParseException if the tokens do not form one JSONC value
    static JsoncNode parse(String text) {
        return parse(JsoncLexer.tokenize(text));
    }

    /// Parses an EOF-terminated token list into a tree.
    /// @param tokens tokens as produced by the lexer
    /// @return the root node
    /// @throws JsoncParseException if the tokens do not form one JSONC value
    static JsoncNode parse(List<JsoncToken> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).kind() != JsoncToken.Kind.EOF) {
            throw new IllegalArgumentException("tokens must end with an EOF token");
        }
        LOG.fine(() -> "Parsing " + tokens.size() + " tokens");
        return new JsoncParser(tokens).parseRoot();
    }

    private JsoncNode parseRoot() {
        final var leading = collectTrivia();
        final var root = parseValue(leading);
        root.trailingTrivia().addAll(collectTrivia());
        if (peek().kind() != JsoncToken.Kind.EOF) {
            throw new JsoncParseException("end of input", peek());
        }
        return root;
    }

    private JsoncNode parseValue(List<JsoncToken> leading) {
        final var token = peek();
        final JsoncNode node = switch (token.kind()) {
            case LBRACE -> {
                enter(token);
                final var object = parseObject();
                depth--;
                yield object;
            }
            case LBRACKET -> {
                enter(token);
                final var array = parseArray();
                depth--;
                yield array;
            }
            case STRING -> new JsoncNode.Scalar(decodeString(consume()), token.text());
            case NUMBER -> new JsoncNode.Scalar(decodeNumber(consume().text()), token.text());
            case TRUE -> new JsoncNode.Scalar(scalarConsumed(Boolean.TRUE), token.text());
            case FALSE -> new JsoncNode.Scalar(scalarConsumed(Boolean.FALSE), token.text());
            case NULL -> new JsoncNode.Scalar(scalarConsumed(null), token.text());
            default -> throw new JsoncParseException("value", token);
        };
        node.leadingTrivia().addAll(leading);
        LOG.finer(() -> "Parsed " + node.kind() + " at line " + token.line());
        return node;
    }

    private JsoncNode.ObjectNode parseObject() {
        final var object = new JsoncNode.ObjectNode();
        consume(); // skip {

        var trivia = collectTrivia();
        if (peek().kind() == JsoncToken.Kind.RBRACE) {
            consume();
            object.danglingTrivia().addAll(trivia);
            return object;
        }

        while (true) {
            final var keyToken = expect(JsoncToken.Kind.STRING, "string key");
            final var key = new JsoncNode.Key(decodeString(keyToken), keyToken.text());
            key.leadingTrivia().addAll(trivia);
            key.trailingTrivia().addAll(collectTrivia());
            expect(JsoncToken.Kind.COLON, "':'");

            final var value = parseValue(collectTrivia());
            value.trailingTrivia().addAll(collectTrivia());

            final var next = peek();
            if (next.kind() == JsoncToken.Kind.RBRACE) {
                consume();
                object.members().add(new JsoncNode.Member(key, value, null));
                return object;
            }
            if (next.kind() != JsoncToken.Kind.COMMA) {
                throw new JsoncParseException("',' or '}'", next);
            }
            object.members().add(new JsoncNode.Member(key, value, consume()));

            trivia = collectTrivia();
            if (peek().kind() == JsoncToken.Kind.RBRACE) {
                // trailing comma
                consume();
                object.danglingTrivia().addAll(trivia);
                return object;
            }
        }
    }

    private JsoncNode.ArrayNode parseArray() {
        final var array = new JsoncNode.ArrayNode();
        consume(); // skip [

        var trivia = collectTrivia();
        if (peek().kind() == JsoncToken.Kind.RBRACKET) {
            consume();
            array.danglingTrivia().addAll(trivia);
            return array;
        }

        while (true) {
            final var value = parseValue(trivia);
            value.trailingTrivia().addAll(collectTrivia());

            final var next = peek();
            if (next.kind() == JsoncToken.Kind.RBRACKET) {
                consume();
                array.elements().add(new JsoncNode.Element(value, null));
                return array;
            }
            if (next.kind() != JsoncToken.Kind.COMMA) {
                throw new JsoncParseException("',' or ']'", next);
            }
            array.elements().add(new JsoncNode.Element(value, consume()));

            trivia = collectTrivia();
            if (peek().kind() == JsoncToken.Kind.RBRACKET) {
                // trailing comma
                consume();
                array.danglingTrivia().addAll(trivia);
                return array;
            }
        }
    }

    private void enter(JsoncToken open) {
        if (++depth > MAX_DEPTH) {
            throw new JsoncParseException("at most " + MAX_DEPTH + " levels of nesting", open);
        }
    }

    private List<JsoncToken> collectTrivia() {
        final var trivia = new ArrayList<JsoncToken>();
        while (peek().isTrivia()) {
            trivia.add(consume());
        }
        return trivia;
    }

    private JsoncToken expect(JsoncToken.Kind kind, String description) {
        final var token = peek();
        if (token.kind() != kind) {
            throw new JsoncParseException(description, token);
        }
        return consume();
    }

    private Object scalarConsumed(Object value) {
        consume();
        return value;
    }

    private JsoncToken peek() {
        return pos < tokens.size() ? tokens.get(pos) : tokens.get(tokens.size() - 1);
    }

    private JsoncToken consume() {
        final var token = peek();
        if (pos < tokens.size()) {
            pos++;
        }
        return token;
    }

    private static String decodeString(JsoncToken token) {
        try {
            return JsoncNative.unquote(token.text());
        } catch (IllegalArgumentException e) {
            throw new JsoncParseException("valid string literal (" + e.getMessage() + ")", token);
        }
    }

    /// Decodes a number literal: `Long` when it fits, `BigInteger` for larger integers,
    /// `Double` when there is a fraction or exponent, and `BigDecimal` when such a literal
    /// overflows a double.
    static Number decodeNumber(String raw) {
        if (raw.indexOf('.') < 0 && raw.indexOf('e') < 0 && raw.indexOf('E') < 0) {
            final var big = new BigInteger(raw);
            if (big.bitLength() < 64) {
                return Long.valueOf(big.longValue());
            }
            return big;
        }
        final double d = Double.parseDouble(raw);
        if (Double.isInfinite(d)) {
            return new BigDecimal(raw);
        }
        return d;
    }
}
