package ai.acsl.injector.inject;

import java.util.Objects;

/**
 * A byte offset where the fragment at {@code fragmentIndex} is spliced in, with a human-readable label.
 */
public record InjectionPoint(InjectionPointKind kind, int bytePosition, int lineNumber, int fragmentIndex, String contextLabel) {

    public InjectionPoint {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(contextLabel, "contextLabel");
        if (bytePosition < 0) {
            throw new IllegalArgumentException("bytePosition must not be negative");
        }
        if (fragmentIndex < 1) {
            throw new IllegalArgumentException("fragmentIndex must be at least 1");
        }
    }
}
