package ai.acsl.injector.structure;

import java.util.Objects;

/**
 * First divergence found between a reference and a candidate structure.
 */
public record StructureMismatch(String field, String referenceValue, String candidateValue, String message) {

    public StructureMismatch {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(referenceValue, "referenceValue");
        Objects.requireNonNull(candidateValue, "candidateValue");
        Objects.requireNonNull(message, "message");
    }
}
