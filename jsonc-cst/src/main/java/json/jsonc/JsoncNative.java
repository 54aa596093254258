package json.jsonc;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Converts between JSONC trees and plain Java values.
///
/// Plain values are `Map<String, ?>`, `List`/`Collection`/arrays, `String`, `Number`, `Boolean`
/// and `null`. Reading strips all trivia and raw text; building synthesizes formatting from an
/// [JsoncIndent.Style].
public final class JsoncNative {

    private JsoncNative() {
        // Static utility class
    }

    /// Strips formatting from a tree.
    ///
    /// Objects become insertion-ordered maps where a repeated key keeps its first position and
    /// its last value. Arrays become lists. Scalars become their decoded value.
    ///
    /// @param node the tree to convert
    /// @return the plain value (maybe null for a JSON null)
    public static Object toNative(JsoncNode node) {
        Objects.requireNonNull(node, "node must not be null");
        return switch (node.kind()) {
            case SCALAR -> ((JsoncNode.Scalar) node).value();
            case KEY -> ((JsoncNode.Key) node).name();
            case OBJECT -> {
                final var members = ((JsoncNode.ObjectNode) node).members();
                final var map = new LinkedHashMap<String, Object>(members.size() * 2);
                for (final var member : members) {
                    map.put(member.key().name(), toNative(member.value()));
                }
                yield map;
            }
            case ARRAY -> {
                final var elements = ((JsoncNode.ArrayNode) node).elements();
                final var list = new ArrayList<Object>(elements.size());
                for (final var element : elements) {
                    list.add(toNative(element.value()));
                }
                yield list;
            }
        };
    }

    /// Builds a tree from a plain value using the default style at nesting depth 0.
    /// @param value the plain value
    /// @return a new tree with synthesized formatting
    /// @throws IllegalArgumentException if the value holds an unsupported type
    public static JsoncNode fromNative(Object value) {
        return fromNative(value, JsoncIndent.Style.DEFAULT, 0);
    }

    /// Builds a tree from a plain value.
    ///
    /// Children of a non-empty container start on a new line indented `depth + 1` units, the last
    /// child is followed by a new line indented `depth` units so the closing bracket lines up with
    /// the line that opened it. The returned node itself has no leading or trailing trivia.
    ///
    /// @param value the plain value
    /// @param style the formatting to synthesize
    /// @param depth the nesting level the returned node will live at
    /// @return a new tree
    /// @throws IllegalArgumentException if the value holds an unsupported type
    public static JsoncNode fromNative(Object value, JsoncIndent.Style style, int depth) {
        Objects.requireNonNull(style, "style must not be null");
        if (value instanceof Map<?, ?> map) {
            return objectFrom(map, style, depth);
        }
        if (value instanceof Collection<?> collection) {
            return arrayFrom(collection, style, depth);
        }
        if (value != null && value.getClass().isArray()) {
            final int length = Array.getLength(value);
            final var list = new ArrayList<Object>(length);
            for (int i = 0; i < length; i++) {
                list.add(Array.get(value, i));
            }
            return arrayFrom(list, style, depth);
        }
        return scalarFrom(value);
    }

    private static JsoncNode.ObjectNode objectFrom(Map<?, ?> map, JsoncIndent.Style style, int depth) {
        final var object = new JsoncNode.ObjectNode();
        for (final var entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String name)) {
                throw new IllegalArgumentException("Object keys must be strings, got: " + entry.getKey());
            }
            final var key = JsoncNode.Key.of(name);
            key.leadingTrivia().add(JsoncToken.whitespace(style.lineAt(depth + 1)));
            final var child = fromNative(entry.getValue(), style, depth + 1);
            child.leadingTrivia().add(JsoncToken.whitespace(" "));
            object.members().add(new JsoncNode.Member(key, child, null));
        }
        closeEntries(object.members(), style, depth);
        return object;
    }

    private static JsoncNode.ArrayNode arrayFrom(Collection<?> values, JsoncIndent.Style style, int depth) {
        final var array = new JsoncNode.ArrayNode();
        for (final var value : values) {
            final var child = fromNative(value, style, depth + 1);
            child.leadingTrivia().add(JsoncToken.whitespace(style.lineAt(depth + 1)));
            array.elements().add(new JsoncNode.Element(child, null));
        }
        closeEntries(array.elements(), style, depth);
        return array;
    }

    /// Puts a comma after every entry but the last and aligns the closing bracket.
    private static <E extends JsoncNode.Entry> void closeEntries(List<E> entries, JsoncIndent.Style style, int depth) {
        for (int i = 0; i < entries.size() - 1; i++) {
            @SuppressWarnings("unchecked")
            final E separated = (E) entries.get(i).withSeparator(JsoncToken.comma());
            entries.set(i, separated);
        }
        if (!entries.isEmpty()) {
            entries.get(entries.size() - 1).value().trailingTrivia()
                    .add(JsoncToken.whitespace(style.lineAt(depth)));
        }
    }

    private static JsoncNode.Scalar scalarFrom(Object value) {
        if (value == null) {
            return new JsoncNode.Scalar(null, "null");
        }
        if (value instanceof Boolean bool) {
            return new JsoncNode.Scalar(bool, bool.toString());
        }
        if (value instanceof String string) {
            return new JsoncNode.Scalar(string, quote(string));
        }
        if (value instanceof Character character) {
            return scalarFrom(character.toString());
        }
        if (value instanceof Number number) {
            final var raw = encodeNumber(number);
            return new JsoncNode.Scalar(JsoncParser.decodeNumber(raw), raw);
        }
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }

    private static String encodeNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            final double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Non-finite number cannot be encoded: " + number);
            }
            return number instanceof Float ? Float.toString(number.floatValue()) : Double.toString(d);
        }
        if (number instanceof BigDecimal decimal) {
            return decimal.toString();
        }
        if (number instanceof BigInteger || number instanceof Long || number instanceof Integer
                || number instanceof Short || number instanceof Byte) {
            return number.toString();
        }
        throw new IllegalArgumentException("Unsupported number type: " + number.getClass().getName());
    }

    /// Encodes a string as a JSON string literal.
    ///
    /// Escapes `"`, `\` and control characters; non-ASCII text is written as is.
    public static String quote(String value) {
        Objects.requireNonNull(value, "value must not be null");
        final var sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /// Decodes a raw JSON string literal, quotes included.
    ///
    /// Raw control characters are accepted as they are.
    ///
    /// @throws IllegalArgumentException on a bad escape or a literal not wrapped in quotes
    public static String unquote(String raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        if (raw.length() < 2 || raw.charAt(0) != '"' || raw.charAt(raw.length() - 1) != '"') {
            throw new IllegalArgumentException("not a quoted string");
        }
        final int end = raw.length() - 1;
        final var sb = new StringBuilder(end);
        int i = 1;
        while (i < end) {
            final char c = raw.charAt(i);
            if (c != '\\') {
                sb.append(c);
                i++;
                continue;
            }
            if (i + 1 >= end) {
                throw new IllegalArgumentException("dangling backslash");
            }
            final char escaped = raw.charAt(i + 1);
            switch (escaped) {
                case '"' -> sb.append('"');
                case '\\' -> sb.append('\\');
                case '/' -> sb.append('/');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'u' -> {
                    if (i + 6 > end) {
                        throw new IllegalArgumentException("truncated unicode escape");
                    }
                    int code = 0;
                    for (int h = i + 2; h < i + 6; h++) {
                        final int digit = Character.digit(raw.charAt(h), 16);
                        if (digit < 0) {
                            throw new IllegalArgumentException("invalid unicode escape \\u" + raw.substring(i + 2, i + 6));
                        }
                        code = code * 16 + digit;
                    }
                    sb.append((char) code);
                    i += 4;
                }
                default -> throw new IllegalArgumentException("invalid escape \\" + escaped);
            }
            i += 2;
        }
        return sb.toString();
    }
}
