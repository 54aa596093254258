package json.jsonc;

/// Thrown when a path step meets a node it cannot navigate: a key step on an array,
/// an index step on an object, or any step on a scalar.
public final class JsoncPathTypeException extends JsoncException {

    private static final long serialVersionUID = 1L;

    private final JsoncPath path;
    private final int step;

    public JsoncPathTypeException(String message, JsoncPath path, int step) {
        super(message + " at step " + step + " of path " + path);
        this.path = path;
        this.step = step;
    }

    /// Returns the full path being navigated.
    public JsoncPath path() {
        return path;
    }

    /// Returns the 0-based index of the failing step.
    public int step() {
        return step;
    }
}
