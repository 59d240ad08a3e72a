package ai.acsl.injector.structure;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of comparing two structures. A match certifies structural parity.
 */
public record ComparisonResult(Optional<StructureMismatch> mismatch) {

    private static final ComparisonResult MATCH = new ComparisonResult(Optional.empty());

    public ComparisonResult {
        mismatch = mismatch == null ? Optional.empty() : mismatch;
    }

    public static ComparisonResult match() {
        return MATCH;
    }

    public static ComparisonResult mismatch(StructureMismatch mismatch) {
        return new ComparisonResult(Optional.of(Objects.requireNonNull(mismatch, "mismatch")));
    }

    public boolean matches() {
        return mismatch.isEmpty();
    }

    public Optional<String> diagnostic() {
        return mismatch.map(StructureMismatch::message);
    }
}
