package json.jsonc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Concrete syntax tree for JSONC documents.
///
/// Every node owns exactly two ordered trivia lists:
/// - leading trivia: whitespace and comments between the previous significant token and this node
/// - trailing trivia: whitespace and comments after this node up to the next `,`, `:`
///   or closing bracket
///
/// A node never holds another node's trivia. Containers own their children outright, so an edit
/// is a plain swap of a list entry.
///
/// The variant set is closed and fixed by the grammar:
/// - [Scalar]: string, number, boolean or null, with its raw source text
/// - [ObjectNode]: ordered [Member] entries
/// - [ArrayNode]: ordered [Element] entries
/// - [Key]: an object member name, with its raw source text
///
/// Consumers dispatch with an exhaustive `switch` over [#kind()].
public abstract sealed class JsoncNode
        permits JsoncNode.Scalar, JsoncNode.ObjectNode, JsoncNode.ArrayNode, JsoncNode.Key {

    /// Node variants.
    public enum Kind {
        SCALAR,
        OBJECT,
        ARRAY,
        KEY
    }

    private final List<JsoncToken> leadingTrivia = new ArrayList<>();
    private final List<JsoncToken> trailingTrivia = new ArrayList<>();

    private JsoncNode() {
    }

    public abstract Kind kind();

    /// Mutable list of trivia printed before this node.
    public List<JsoncToken> leadingTrivia() {
        return leadingTrivia;
    }

    /// Mutable list of trivia printed after this node.
    public List<JsoncToken> trailingTrivia() {
        return trailingTrivia;
    }

    /// Replaces the trivia of this node with copies of the trivia lists of `other`.
    void copyTriviaFrom(JsoncNode other) {
        leadingTrivia.clear();
        leadingTrivia.addAll(other.leadingTrivia);
        trailingTrivia.clear();
        trailingTrivia.addAll(other.trailingTrivia);
    }

    /// A string, number, boolean or null literal.
    ///
    /// `value` is the decoded value (`String`, `Long`, `BigInteger`, `Double`, `BigDecimal`,
    /// `Boolean` or null), `raw` the exact literal that is printed.
    public static final class Scalar extends JsoncNode {
        private final Object value;
        private final String raw;

        public Scalar(Object value, String raw) {
            this.value = value;
            this.raw = Objects.requireNonNull(raw, "raw must not be null");
        }

        public Object value() {
            return value;
        }

        public String raw() {
            return raw;
        }

        @Override
        public Kind kind() {
            return Kind.SCALAR;
        }

        @Override
        public String toString() {
            return "Scalar[" + raw + "]";
        }
    }

    /// An object member name.
    public static final class Key extends JsoncNode {
        private final String name;
        private final String raw;

        public Key(String name, String raw) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.raw = Objects.requireNonNull(raw, "raw must not be null");
        }

        /// Creates a key whose raw literal is the canonical encoding of `name`.
        public static Key of(String name) {
            return new Key(name, JsoncNative.quote(name));
        }

        public String name() {
            return name;
        }

        public String raw() {
            return raw;
        }

        @Override
        public Kind kind() {
            return Kind.KEY;
        }

        @Override
        public String toString() {
            return "Key[" + raw + "]";
        }
    }

    /// An `{ ... }` container.
    public static final class ObjectNode extends JsoncNode {
        private final List<Member> members = new ArrayList<>();
        private final List<JsoncToken> danglingTrivia = new ArrayList<>();

        /// Mutable, source-ordered list of members.
        public List<Member> members() {
            return members;
        }

        /// Trivia before `}` that no member owns: the inside of an empty object, or what follows
        /// a trailing comma.
        public List<JsoncToken> danglingTrivia() {
            return danglingTrivia;
        }

        /// Returns the position of the last member named `name`, or -1.
        public int lastIndexOf(String name) {
            for (int i = members.size() - 1; i >= 0; i--) {
                if (members.get(i).key().name().equals(name)) {
                    return i;
                }
            }
            return -1;
        }

        @Override
        public Kind kind() {
            return Kind.OBJECT;
        }

        @Override
        public String toString() {
            return "ObjectNode" + members;
        }
    }

    /// A `[ ... ]` container.
    public static final class ArrayNode extends JsoncNode {
        private final List<Element> elements = new ArrayList<>();
        private final List<JsoncToken> danglingTrivia = new ArrayList<>();

        /// Mutable, source-ordered list of elements.
        public List<Element> elements() {
            return elements;
        }

        /// Trivia before `]` that no element owns.
        public List<JsoncToken> danglingTrivia() {
            return danglingTrivia;
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }

        @Override
        public String toString() {
            return "ArrayNode" + elements;
        }
    }

    /// A container entry: the node printed first, the value, and the `,` that follows, if any.
    sealed interface Entry permits Member, Element {
        /// The node that opens the entry and owns the trivia after the previous separator.
        JsoncNode head();

        JsoncNode value();

        JsoncToken separator();

        Entry withValue(JsoncNode value);

        Entry withSeparator(JsoncToken separator);
    }

    /// `key : value` with an optional following `,`.
    public record Member(Key key, JsoncNode value, JsoncToken separator) implements Entry {
        public Member {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
            // separator can be null for the last member
        }

        @Override
        public JsoncNode head() {
            return key;
        }

        @Override
        public Member withValue(JsoncNode value) {
            return new Member(key, value, separator);
        }

        @Override
        public Member withSeparator(JsoncToken separator) {
            return new Member(key, value, separator);
        }
    }

    /// An array value with an optional following `,`.
    public record Element(JsoncNode value, JsoncToken separator) implements Entry {
        public Element {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public JsoncNode head() {
            return value;
        }

        @Override
        public Element withValue(JsoncNode value) {
            return new Element(value, separator);
        }

        @Override
        public Element withSeparator(JsoncToken separator) {
            return new Element(value, separator);
        }
    }
}
