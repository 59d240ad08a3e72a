package ai.acsl.injector.structure;

import java.util.List;
import java.util.Objects;

/**
 * One function definition with its loops in source order, nested loops flattened.
 */
public record FunctionInfo(String name, String signature, int bytePosition, int lineNumber, List<LoopInfo> loops) {

    public FunctionInfo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(signature, "signature");
        if (bytePosition < 0 || lineNumber < 1) {
            throw new IllegalArgumentException("Invalid function position");
        }
        loops = List.copyOf(Objects.requireNonNull(loops, "loops"));
    }
}
