package json.jsonc;

/// Thrown when an index step falls outside an array. Arrays are never padded to reach an index.
public final class JsoncIndexException extends JsoncException {

    private static final long serialVersionUID = 1L;

    private final JsoncPath path;
    private final int step;

    public JsoncIndexException(String message, JsoncPath path, int step) {
        super(message + " at step " + step + " of path " + path);
        this.path = path;
        this.step = step;
    }

    public JsoncPath path() {
        return path;
    }

    /// Returns the 0-based index of the failing step.
    public int step() {
        return step;
    }
}
