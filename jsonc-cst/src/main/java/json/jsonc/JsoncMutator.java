package json.jsonc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Path-addressed edits on a JSONC tree.
///
/// Edits touch only the entries they address. Replaced values inherit the trivia of the value
/// they replace. New members are appended after the last existing member with synthesized
/// indentation ([JsoncIndent]). A `,` is inserted after the former last member only when it
/// lacked one.
///
/// Every edit validates the whole path before changing anything, so a failing call leaves the
/// tree untouched.
final class JsoncMutator {

    private static final Logger LOG = Logger.getLogger(JsoncMutator.class.getName());

    private JsoncMutator() {
    }

    /// Sets the value at `path`, creating missing object members along the way.
    ///
    /// @param root the tree to edit in place
    /// @param path where to write; empty replaces the root
    /// @param value the plain value to write
    /// @return the root of the edited tree, a new node only when `path` is empty
    /// @throws JsoncPathTypeException if a step does not fit the node it meets
    /// @throws JsoncIndexException if an index step is out of bounds
    /// @throws IllegalArgumentException if the value holds an unsupported type
    static JsoncNode set(JsoncNode root, JsoncPath path, Object value) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(path, "path must not be null");
        LOG.fine(() -> "Setting value at " + path);

        final var style = JsoncIndent.style(root);
        final var replacement = JsoncNative.fromNative(value, style, path.size());
        if (path.isEmpty()) {
            replacement.copyTriviaFrom(root);
            return replacement;
        }

        validate(root, path);

        JsoncNode current = root;
        for (int i = 0; i < path.size(); i++) {
            final boolean last = i == path.size() - 1;
            final var next = child(current, path, i);
            if (next == null) {
                final var object = (JsoncNode.ObjectNode) current;
                final var name = ((JsoncPath.Step.Key) path.get(i)).name();
                final var created = last ? replacement : emptyContainerFor(path.get(i + 1));
                final int depth = i;
                LOG.finer(() -> "Appending member " + JsoncNative.quote(name) + " at depth " + depth);
                appendMember(object, JsoncNode.Key.of(name), created, style, depth);
                current = created;
            } else if (last) {
                replace(current, path.get(i), replacement);
            } else {
                current = next;
            }
        }
        return root;
    }

    /// Looks up the node at `path`. Never throws on navigation problems.
    /// @return the node, or empty when a key is missing, an index is out of bounds or a step
    ///         does not fit the node it meets
    static Optional<JsoncNode> find(JsoncNode root, JsoncPath path) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(path, "path must not be null");
        JsoncNode current = root;
        for (final var step : path.steps()) {
            current = lookup(current, step);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    /// Removes the object member or array element at `path`.
    ///
    /// @return true if something was removed, false if an object key along the path is missing
    /// @throws IllegalArgumentException if `path` is empty
    /// @throws JsoncPathTypeException if a step does not fit the node it meets
    /// @throws JsoncIndexException if an index step is out of bounds
    static boolean remove(JsoncNode root, JsoncPath path) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(path, "path must not be null");
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Cannot remove the root value");
        }
        LOG.fine(() -> "Removing value at " + path);

        JsoncNode current = root;
        for (int i = 0; i < path.size() - 1; i++) {
            current = child(current, path, i);
            if (current == null) {
                return false;
            }
        }

        final int lastStep = path.size() - 1;
        if (child(current, path, lastStep) == null) {
            return false;
        }
        if (current instanceof JsoncNode.ObjectNode object) {
            final var name = ((JsoncPath.Step.Key) path.get(lastStep)).name();
            removeEntry(object.members(), object.danglingTrivia(), object.lastIndexOf(name));
        } else {
            final var array = (JsoncNode.ArrayNode) current;
            final int index = ((JsoncPath.Step.Index) path.get(lastStep)).index();
            removeEntry(array.elements(), array.danglingTrivia(), index);
        }
        return true;
    }

    /// Walks the path without changing anything and throws what [#set] would throw.
    ///
    /// Once a key is missing, the rest of the path is created fresh: key steps create empty
    /// objects, and an index step would address an empty array, which is always out of bounds.
    private static void validate(JsoncNode root, JsoncPath path) {
        JsoncNode current = root;
        for (int i = 0; i < path.size(); i++) {
            final var next = child(current, path, i);
            if (next == null) {
                for (int j = i + 1; j < path.size(); j++) {
                    if (path.get(j) instanceof JsoncPath.Step.Index index) {
                        throw new JsoncIndexException(
                                "Index " + index.index() + " out of bounds for new empty array", path, j);
                    }
                }
                return;
            }
            current = next;
        }
    }

    /// Resolves one step strictly.
    /// @return the child value, or null when an object has no such key
    private static JsoncNode child(JsoncNode current, JsoncPath path, int i) {
        final var step = path.get(i);
        return switch (current.kind()) {
            case OBJECT -> {
                if (!(step instanceof JsoncPath.Step.Key key)) {
                    throw new JsoncPathTypeException("Index step " + step + " cannot address an object", path, i);
                }
                final var object = (JsoncNode.ObjectNode) current;
                final int found = object.lastIndexOf(key.name());
                yield found < 0 ? null : object.members().get(found).value();
            }
            case ARRAY -> {
                if (!(step instanceof JsoncPath.Step.Index index)) {
                    throw new JsoncPathTypeException("Key step " + step + " cannot address an array", path, i);
                }
                final var elements = ((JsoncNode.ArrayNode) current).elements();
                if (index.index() < 0 || index.index() >= elements.size()) {
                    throw new JsoncIndexException(
                            "Index " + index.index() + " out of bounds for length " + elements.size(), path, i);
                }
                yield elements.get(index.index()).value();
            }
            case SCALAR, KEY -> throw new JsoncPathTypeException("Cannot step into a scalar", path, i);
        };
    }

    private static JsoncNode lookup(JsoncNode current, JsoncPath.Step step) {
        if (current instanceof JsoncNode.ObjectNode object && step instanceof JsoncPath.Step.Key key) {
            final int found = object.lastIndexOf(key.name());
            return found < 0 ? null : object.members().get(found).value();
        }
        if (current instanceof JsoncNode.ArrayNode array && step instanceof JsoncPath.Step.Index index) {
            final var elements = array.elements();
            return index.index() < 0 || index.index() >= elements.size()
                    ? null
                    : elements.get(index.index()).value();
        }
        return null;
    }

    private static JsoncNode emptyContainerFor(JsoncPath.Step next) {
        if (next instanceof JsoncPath.Step.Key) {
            return new JsoncNode.ObjectNode();
        }
        return new JsoncNode.ArrayNode();
    }

    private static void replace(JsoncNode container, JsoncPath.Step step, JsoncNode replacement) {
        if (container instanceof JsoncNode.ObjectNode object) {
            final var name = ((JsoncPath.Step.Key) step).name();
            replaceEntry(object.members(), object.lastIndexOf(name), replacement);
        } else {
            final var array = (JsoncNode.ArrayNode) container;
            replaceEntry(array.elements(), ((JsoncPath.Step.Index) step).index(), replacement);
        }
    }

    /// Swaps the value of an entry, carrying the old value's trivia over to the new one.
    @SuppressWarnings("unchecked")
    private static <E extends JsoncNode.Entry> void replaceEntry(List<E> entries, int index, JsoncNode replacement) {
        final var entry = entries.get(index);
        replacement.copyTriviaFrom(entry.value());
        entries.set(index, (E) entry.withValue(replacement));
    }

    /// Appends `key: value` as the last member of `object`, which sits at nesting `depth`.
    private static void appendMember(JsoncNode.ObjectNode object, JsoncNode.Key key, JsoncNode value,
                                     JsoncIndent.Style style, int depth) {
        final var members = object.members();
        value.leadingTrivia().add(JsoncToken.whitespace(" "));

        if (members.isEmpty()) {
            // comments of an empty object move in front of the new key
            final var dangling = object.danglingTrivia();
            final int tail = whitespaceTailStart(dangling);
            final var comments = new ArrayList<>(dangling.subList(0, tail));
            final var closing = new ArrayList<>(dangling.subList(tail, dangling.size()));
            dangling.clear();

            key.leadingTrivia().addAll(comments);
            key.leadingTrivia().add(JsoncToken.whitespace(style.lineAt(depth + 1)));
            if (containsNewline(closing)) {
                value.trailingTrivia().addAll(closing);
            } else {
                value.trailingTrivia().add(JsoncToken.whitespace(style.lineAt(depth)));
            }
            members.add(new JsoncNode.Member(key, value, null));
            return;
        }

        final int lastIndex = members.size() - 1;
        final var previous = members.get(lastIndex);
        key.leadingTrivia().add(JsoncToken.whitespace(style.lineAt(depth + 1)));

        if (previous.separator() != null) {
            // trailing comma layout: keep it, dangling trivia stays before '}'
            members.add(new JsoncNode.Member(key, value, JsoncToken.comma()));
            return;
        }

        // The comma goes right after the previous value. Its trailing comments follow the comma,
        // its whitespace tail now aligns the closing brace after the new member.
        final var previousTrailing = previous.value().trailingTrivia();
        final int tail = whitespaceTailStart(previousTrailing);
        final var comments = new ArrayList<>(previousTrailing.subList(0, tail));
        final var closing = new ArrayList<>(previousTrailing.subList(tail, previousTrailing.size()));
        previousTrailing.clear();

        key.leadingTrivia().addAll(0, comments);
        value.trailingTrivia().addAll(closing);
        members.set(lastIndex, previous.withSeparator(JsoncToken.comma()));
        members.add(new JsoncNode.Member(key, value, null));
    }

    /// Removes an entry and repairs separators so that the remaining layout stays valid.
    @SuppressWarnings("unchecked")
    private static <E extends JsoncNode.Entry> void removeEntry(List<E> entries, List<JsoncToken> dangling, int index) {
        final var removed = entries.remove(index);
        final var removedTrailing = removed.value().trailingTrivia();
        final var closing = removedTrailing.subList(whitespaceTailStart(removedTrailing), removedTrailing.size());

        if (entries.isEmpty()) {
            if (removed.separator() == null) {
                dangling.clear();
                dangling.addAll(closing);
            }
            return;
        }

        if (index == entries.size()) {
            final var previous = entries.get(index - 1);
            if (removed.separator() == null) {
                replaceWhitespaceTail(previous.value().trailingTrivia(), closing);
                entries.set(index - 1, (E) previous.withSeparator(null));
            }
            return;
        }

        if (index == 0) {
            final var next = entries.get(0).head();
            final var removedLeading = removed.head().leadingTrivia();
            if (isWhitespaceOnly(next.leadingTrivia()) && isWhitespaceOnly(removedLeading)) {
                next.leadingTrivia().clear();
                next.leadingTrivia().addAll(removedLeading);
            }
        }
    }

    /// Swaps the whitespace ending `trivia` for `closing`.
    ///
    /// An empty `closing` keeps the old tail, and so does one without a line break when the old
    /// tail ends a line comment.
    private static void replaceWhitespaceTail(List<JsoncToken> trivia, List<JsoncToken> closing) {
        if (closing.isEmpty()) {
            return;
        }
        final int tail = whitespaceTailStart(trivia);
        if (tail > 0 && trivia.get(tail - 1).kind() == JsoncToken.Kind.LINE_COMMENT && !containsNewline(closing)) {
            return;
        }
        trivia.subList(tail, trivia.size()).clear();
        trivia.addAll(closing);
    }

    /// Returns the index where the run of whitespace tokens ending the list starts.
    private static int whitespaceTailStart(List<JsoncToken> trivia) {
        int start = trivia.size();
        while (start > 0 && trivia.get(start - 1).kind() == JsoncToken.Kind.WHITESPACE) {
            start--;
        }
        return start;
    }

    private static boolean containsNewline(List<JsoncToken> trivia) {
        for (final var token : trivia) {
            if (token.text().indexOf('\n') >= 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean isWhitespaceOnly(List<JsoncToken> trivia) {
        for (final var token : trivia) {
            if (token.kind() != JsoncToken.Kind.WHITESPACE) {
                return false;
            }
        }
        return true;
    }
}
