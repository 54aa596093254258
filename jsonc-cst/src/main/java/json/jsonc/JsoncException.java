package json.jsonc;

/// Base class of every failure raised while lexing, parsing, or editing a JSONC document.
/// This is a runtime exception: a failed call leaves no partial tree behind and the caller
/// decides how to surface it.
public class JsoncException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public JsoncException(String message) {
        super(message);
    }

    public JsoncException(String message, Throwable cause) {
        super(message, cause);
    }
}
