package json.jsonc;

import net.jqwik.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/// Property-based testing for the parse/print/edit cycle
/// Generates nested JSONC documents with trivia in every slot the grammar allows
class JsoncRoundTripPropertyTest extends JsoncTestBase {

    private static final int MAX_DEPTH = 3;

    private static final String MARKER = "@edited@";

    private static final List<String> TRIVIA = List.of(
            "", "", " ", "\n", "\n  ", "\n    ", "\t", "\r\n  ", " // note\n", "/* block */", " /* a\n b */ ");

    private static final List<String> SCALARS = List.of(
            "0", "-1", "42", "3.25", "-0.5e-3", "1E10", "true", "false", "null",
            "\"\"", "\"text\"", "\"esc\\\"aped\\n\"", "\"\\u00e9t\\u00e9\"", "\"slash\\/\"");

    private static final List<String> KEYS = List.of("\"alpha\"", "\"beta\"", "\"gamma\"", "\"with space\"", "\"k\\u0041\"");

    @Provide
    Arbitrary<String> documents() {
        return Combinators.combine(trivia(), value(MAX_DEPTH), trivia()).as((a, v, b) -> a + v + b);
    }

    @Provide
    Arbitrary<String> objectDocuments() {
        return Combinators.combine(trivia(), object(MAX_DEPTH), trivia()).as((a, v, b) -> a + v + b);
    }

    @Property(tries = 200)
    void printOfParseIsIdentity(@ForAll("documents") String text) {
        assertThat(Jsonc.print(Jsonc.parse(text))).isEqualTo(text);
    }

    @Property(tries = 100)
    void reprintIsIdempotent(@ForAll("documents") String text) {
        final var once = Jsonc.print(Jsonc.parse(text));
        assertThat(Jsonc.print(Jsonc.parse(once))).isEqualTo(once);
    }

    @Property(tries = 100)
    void nativeValueSurvivesSynthesis(@ForAll("documents") String text) {
        final var data = Jsonc.toNative(Jsonc.parse(text));
        final var synthesized = Jsonc.print(Jsonc.fromNative(data));
        assertThat(Jsonc.toNative(Jsonc.parse(synthesized))).isEqualTo(data);
    }

    @Property(tries = 100)
    void updatingExistingKeyKeepsOrderAndOtherValues(@ForAll("objectDocuments") String text) {
        final var root = Jsonc.parse(text);
        final var before = (Map<String, Object>) Jsonc.toNative(root);
        Assume.that(!before.isEmpty());
        final var target = before.keySet().iterator().next();

        final var edited = Jsonc.parse(Jsonc.update(text, JsoncPath.of(target), List.of(7, "seven")));
        final var after = (Map<String, Object>) Jsonc.toNative(edited);

        assertThat(new ArrayList<>(after.keySet())).containsExactlyElementsOf(new ArrayList<>(before.keySet()));
        assertThat(after.get(target)).isEqualTo(List.of(7L, "seven"));
        for (final var key : before.keySet()) {
            if (!key.equals(target)) {
                assertThat(after.get(key)).isEqualTo(before.get(key));
            }
        }
    }

    @Property(tries = 200)
    void replacingScalarLeavesOtherBytesUnchanged(@ForAll("objectDocuments") String text) {
        final var root = (JsoncNode.ObjectNode) Jsonc.parse(text);
        String target = null;
        String original = null;
        for (int i = 0; i < root.members().size(); i++) {
            final var member = root.members().get(i);
            if (member.value() instanceof JsoncNode.Scalar scalar && root.lastIndexOf(member.key().name()) == i) {
                target = member.key().name();
                original = scalar.raw();
                break;
            }
        }
        Assume.that(target != null);

        final var edited = Jsonc.print(Jsonc.setValue(root, JsoncPath.of(target), MARKER));
        assertThat(edited).contains(JsoncNative.quote(MARKER));
        assertThat(edited.replace(JsoncNative.quote(MARKER), original)).isEqualTo(text);
    }

    @Property(tries = 100)
    void appendingNewKeyKeepsDocumentValid(@ForAll("objectDocuments") String text) {
        final var updated = Jsonc.update(text, JsoncPath.of("added", "nested"), "value");
        final var after = (Map<String, Object>) Jsonc.toNative(Jsonc.parse(updated));
        final var keys = new ArrayList<>(after.keySet());
        assertThat(keys.get(keys.size() - 1)).isEqualTo("added");
        assertThat(after.get("added")).isEqualTo(Map.of("nested", "value"));
    }

    private static Arbitrary<String> trivia() {
        return Arbitraries.of(TRIVIA);
    }

    private static Arbitrary<String> scalar() {
        return Arbitraries.of(SCALARS);
    }

    private static Arbitrary<String> value(int depth) {
        if (depth == 0) {
            return scalar();
        }
        return Arbitraries.oneOf(scalar(), array(depth), object(depth));
    }

    private static Arbitrary<String> array(int depth) {
        final var element = Combinators.combine(trivia(), value(depth - 1), trivia())
                .as((a, v, b) -> a + v + b);
        return Combinators.combine(element.list().ofMaxSize(3), trivia())
                .as((elements, inner) -> elements.isEmpty()
                        ? "[" + inner + "]"
                        : "[" + String.join(",", elements) + "]");
    }

    private static Arbitrary<String> object(int depth) {
        final var member = Combinators.combine(
                        trivia(), Arbitraries.of(KEYS), trivia(), trivia(), value(depth - 1), trivia())
                .as((a, k, b, c, v, d) -> a + k + b + ":" + c + v + d);
        return Combinators.combine(member.list().ofMaxSize(3), trivia())
                .as((members, inner) -> members.isEmpty()
                        ? "{" + inner + "}"
                        : "{" + String.join(",", members) + "}");
    }
}
