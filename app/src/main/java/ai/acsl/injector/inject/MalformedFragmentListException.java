package ai.acsl.injector.inject;

/**
 * Raised when a fragment sequence does not have the expected shape. The whole call is rejected.
 */
public class MalformedFragmentListException extends RuntimeException {

    public MalformedFragmentListException(String message) {
        super(message);
    }
}
