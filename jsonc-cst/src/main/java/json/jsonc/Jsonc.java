package json.jsonc;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Lossless JSON-with-comments (JSONC) documents.
///
/// Parsing keeps every comment, blank line and whitespace choice in the tree, so printing an
/// unmodified tree gives back the input byte for byte. Path edits change only the region they
/// address; new members get indentation inferred from the rest of the document.
///
/// Usage examples:
/// ```java
/// // Text in, text out
/// String updated = Jsonc.update(text, JsoncPath.of("bar", "height"), 30);
///
/// // Several edits on one tree
/// JsoncNode root = Jsonc.parse(text);
/// root = Jsonc.setValue(root, JsoncPath.of("modules-left", 0), "clock");
/// Jsonc.remove(root, JsoncPath.of("tray"));
/// String out = Jsonc.print(root);
///
/// // Data only
/// Map<?, ?> config = (Map<?, ?>) Jsonc.toNative(Jsonc.parse(text));
/// ```
///
/// Trees are not thread-safe; callers editing the same document concurrently must serialize
/// access themselves. No method performs I/O.
public final class Jsonc {

    private static final Logger LOG = Logger.getLogger(Jsonc.class.getName());

    private Jsonc() {
        // Static utility class
    }

    /// Parses JSONC text into a tree.
    /// @param text the JSONC source
    /// @return the root node
    /// @throws NullPointerException if text is null
    /// @throws JsoncLexException if the text contains a character no token can start with
    /// @throws JsoncParseException if the text is not exactly one JSONC value
    public static JsoncNode parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        LOG.fine(() -> "Parsing JSONC document of " + text.length() + " chars");
        return JsoncParser.parse(text);
    }

    /// Prints a tree back to text.
    /// @param root the tree
    /// @return the JSONC text; identical to the parsed input if the tree was not edited
    public static String print(JsoncNode root) {
        Objects.requireNonNull(root, "root must not be null");
        return JsoncPrinter.print(root);
    }

    /// Writes a plain value at a path, keeping the formatting around it.
    /// @param root the tree to edit in place
    /// @param path where to write; missing object members are created
    /// @param value a plain value (map, list, string, number, boolean or null)
    /// @return the root to keep using; differs from `root` only when `path` is empty
    /// @throws JsoncPathTypeException if a step does not fit the node it meets
    /// @throws JsoncIndexException if an index step is out of bounds
    /// @throws IllegalArgumentException if the value holds an unsupported type
    public static JsoncNode setValue(JsoncNode root, JsoncPath path, Object value) {
        return JsoncMutator.set(root, path, value);
    }

    /// Removes the object member or array element at a path.
    /// @return true if something was removed, false if an object key along the path is missing
    /// @throws IllegalArgumentException if `path` is empty
    /// @throws JsoncPathTypeException if a step does not fit the node it meets
    /// @throws JsoncIndexException if an index step is out of bounds
    public static boolean remove(JsoncNode root, JsoncPath path) {
        return JsoncMutator.remove(root, path);
    }

    /// Finds the node at a path.
    /// @return the node, or empty when the path does not lead anywhere
    public static Optional<JsoncNode> find(JsoncNode root, JsoncPath path) {
        return JsoncMutator.find(root, path);
    }

    /// Reads the plain value at a path.
    /// @param fallback returned when the path does not lead anywhere
    /// @return the plain value (null for a JSON null), or `fallback`
    public static Object get(JsoncNode root, JsoncPath path, Object fallback) {
        final var node = find(root, path);
        return node.isPresent() ? JsoncNative.toNative(node.get()) : fallback;
    }

    /// Strips all formatting and returns plain data.
    /// @see JsoncNative#toNative(JsoncNode)
    public static Object toNative(JsoncNode root) {
        return JsoncNative.toNative(root);
    }

    /// Builds a whole new document from plain data with default formatting.
    /// @see JsoncNative#fromNative(Object)
    public static JsoncNode fromNative(Object value) {
        return JsoncNative.fromNative(value);
    }

    /// Parses, edits and prints in one call.
    /// @param text the JSONC source
    /// @param path where to write
    /// @param value the plain value to write
    /// @return the edited text; unchanged outside the edited region
    public static String update(String text, JsoncPath path, Object value) {
        final var root = setValue(parse(text), path, value);
        return print(root);
    }
}
