package ai.acsl.injector.inject;

/**
 * Raised when injection points cannot be applied to a source text.
 */
public class InjectionException extends RuntimeException {

    public InjectionException(String message) {
        super(message);
    }

    public InjectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
