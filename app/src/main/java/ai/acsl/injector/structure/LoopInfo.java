package ai.acsl.injector.structure;

import java.util.Objects;

/**
 * One loop inside a function. The header is the normalized text from the loop keyword to its body.
 */
public record LoopInfo(LoopKind kind, String header, int bytePosition, int lineNumber) {

    public LoopInfo {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(header, "header");
        if (bytePosition < 0 || lineNumber < 1) {
            throw new IllegalArgumentException("Invalid loop position");
        }
    }
}
