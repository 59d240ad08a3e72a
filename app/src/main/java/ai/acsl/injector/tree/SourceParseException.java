package ai.acsl.injector.tree;

/**
 * Raised when a tree provider cannot produce a usable tree for the given text.
 */
public class SourceParseException extends RuntimeException {

    public SourceParseException(String message) {
        super(message);
    }

    public SourceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
