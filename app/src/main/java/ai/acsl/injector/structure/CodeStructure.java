package ai.acsl.injector.structure;

import java.util.List;
import java.util.Objects;

/**
 * Structural fingerprint of a source text: its functions in order of appearance.
 */
public record CodeStructure(List<FunctionInfo> functions) {

    public CodeStructure {
        functions = List.copyOf(Objects.requireNonNull(functions, "functions"));
    }

    /**
     * Number of fragment slots the structure offers: one per function plus one per loop.
     */
    public int slotCount() {
        int slots = 0;
        for (FunctionInfo function : functions) {
            slots += 1 + function.loops().size();
        }
        return slots;
    }
}
