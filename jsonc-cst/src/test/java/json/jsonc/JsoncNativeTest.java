package json.jsonc;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for JsoncNative - plain value conversion in both directions
class JsoncNativeTest extends JsoncTestBase {

    @Test
    void testToNativeStripsFormatting() {
        final var root = Jsonc.parse("""
                // settings
                {
                  "name": "bar", /* inline */
                  "size": [1, 2.5, -3],
                  "on": true,
                  "none": null
                }
                """);
        final var value = (Map<String, Object>) JsoncNative.toNative(root);
        assertThat(value.keySet()).containsExactly("name", "size", "on", "none");
        assertThat(value.get("name")).isEqualTo("bar");
        assertThat(value.get("size")).isEqualTo(List.of(1L, 2.5d, -3L));
        assertThat(value.get("on")).isEqualTo(true);
        assertThat(value.containsKey("none")).isTrue();
        assertThat(value.get("none")).isNull();
    }

    @Test
    void testDuplicateKeyKeepsFirstPositionAndLastValue() {
        final var value = (Map<String, Object>) JsoncNative.toNative(Jsonc.parse("{\"a\": 1, \"b\": 2, \"a\": 3}"));
        assertThat(value.keySet()).containsExactly("a", "b");
        assertThat(value.get("a")).isEqualTo(3L);
    }

    @Test
    void testKeyNodeConvertsToName() {
        final var root = (JsoncNode.ObjectNode) Jsonc.parse("{\"k\\u0041\": 1}");
        assertThat(JsoncNative.toNative(root.members().get(0).key())).isEqualTo("kA");
    }

    @Test
    void testFromNativeSynthesizesIndentedLayout() {
        final var value = new LinkedHashMap<String, Object>();
        value.put("a", 1);
        value.put("b", Arrays.asList(true, null));
        assertThat(Jsonc.print(JsoncNative.fromNative(value))).isEqualTo("""
                {
                    "a": 1,
                    "b": [
                        true,
                        null
                    ]
                }""");
    }

    @Test
    void testFromNativeWithCustomStyleAndDepth() {
        final var style = new JsoncIndent.Style("\t", "\n");
        final var node = JsoncNative.fromNative(List.of("x"), style, 1);
        assertThat(Jsonc.print(node)).isEqualTo("[\n\t\t\"x\"\n\t]");
    }

    @Test
    void testEmptyContainersStayOnOneLine() {
        assertThat(Jsonc.print(JsoncNative.fromNative(Map.of()))).isEqualTo("{}");
        assertThat(Jsonc.print(JsoncNative.fromNative(List.of()))).isEqualTo("[]");
    }

    @Test
    void testScalarsAreEncodedCanonically() {
        assertThat(Jsonc.print(JsoncNative.fromNative(7))).isEqualTo("7");
        assertThat(Jsonc.print(JsoncNative.fromNative(2.5d))).isEqualTo("2.5");
        assertThat(Jsonc.print(JsoncNative.fromNative(new BigDecimal("1.50")))).isEqualTo("1.50");
        assertThat(Jsonc.print(JsoncNative.fromNative(new BigInteger("99999999999999999999"))))
                .isEqualTo("99999999999999999999");
        assertThat(Jsonc.print(JsoncNative.fromNative(false))).isEqualTo("false");
        assertThat(Jsonc.print(JsoncNative.fromNative(null))).isEqualTo("null");
        assertThat(Jsonc.print(JsoncNative.fromNative("line\nbreak \"q\" \u00e9"))).isEqualTo("\"line\\nbreak \\\"q\\\" \u00e9\"");
    }

    @Test
    void testSynthesizedScalarsDecodeLikeParsedOnes() {
        final var scalar = (JsoncNode.Scalar) JsoncNative.fromNative(7);
        assertThat(scalar.value()).isEqualTo(7L);
        assertThat(((JsoncNode.Scalar) JsoncNative.fromNative(1.5f)).value()).isEqualTo(1.5d);
    }

    @Test
    void testPrimitiveArraysBecomeArrays() {
        assertThat(JsoncNative.toNative(JsoncNative.fromNative(new int[]{1, 2}))).isEqualTo(List.of(1L, 2L));
    }

    @Test
    void testUnsupportedValuesFail() {
        assertThatThrownBy(() -> JsoncNative.fromNative(Map.of(1, "x")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("keys must be strings");
        assertThatThrownBy(() -> JsoncNative.fromNative(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsoncNative.fromNative(List.of(new Object())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported value type");
    }

    @Test
    void testQuoteEscapesControlCharacters() {
        assertThat(JsoncNative.quote("a\u0001\tb\\")).isEqualTo("\"a\\u0001\\tb\\\\\"");
    }

    @Test
    void testUnquoteRejectsBadLiterals() {
        assertThat(JsoncNative.unquote("\"\\ud83d\\ude00\"")).isEqualTo("\ud83d\ude00");
        assertThatThrownBy(() -> JsoncNative.unquote("\"\\u12\"")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsoncNative.unquote("\"\\uzzzz\"")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsoncNative.unquote("nope")).isInstanceOf(IllegalArgumentException.class);
    }
}
