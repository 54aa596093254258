package json.jsonc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// An address inside a JSONC document: a sequence of object-key and array-index steps.
///
/// ```java
/// JsoncPath path = JsoncPath.of("modules-left", 0);
/// ```
///
/// @param steps the steps, outermost first
public record JsoncPath(List<Step> steps) {

    private static final JsoncPath ROOT = new JsoncPath(List.of());

    /// A single navigation step.
    public sealed interface Step permits Step.Key, Step.Index {

        /// Object member step (by key).
        record Key(String name) implements Step {
            public Key {
                Objects.requireNonNull(name, "name must not be null");
            }

            @Override
            public String toString() {
                return JsoncNative.quote(name);
            }
        }

        /// Array element step (by index).
        record Index(int index) implements Step {
            @Override
            public String toString() {
                return Integer.toString(index);
            }
        }
    }

    public JsoncPath {
        Objects.requireNonNull(steps, "steps must not be null");
        steps = List.copyOf(steps); // defensive copy
    }

    /// The empty path, addressing the root value.
    public static JsoncPath root() {
        return ROOT;
    }

    /// Builds a path from `String` keys and `Integer` indices.
    /// @throws IllegalArgumentException if a step is neither a String nor an Integer
    public static JsoncPath of(Object... steps) {
        Objects.requireNonNull(steps, "steps must not be null");
        return of(List.of(steps));
    }

    /// Builds a path from `String` keys and `Integer` indices.
    /// @throws IllegalArgumentException if a step is neither a String nor an Integer
    public static JsoncPath of(List<?> steps) {
        Objects.requireNonNull(steps, "steps must not be null");
        final var out = new ArrayList<Step>(steps.size());
        for (final var step : steps) {
            if (step instanceof String name) {
                out.add(new Step.Key(name));
            } else if (step instanceof Integer index) {
                out.add(new Step.Index(index));
            } else if (step instanceof Step typed) {
                out.add(typed);
            } else {
                throw new IllegalArgumentException("Path step must be a String key or Integer index, got: " + step);
            }
        }
        return new JsoncPath(out);
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public Step get(int index) {
        return steps.get(index);
    }

    @Override
    public String toString() {
        return steps.toString();
    }
}
