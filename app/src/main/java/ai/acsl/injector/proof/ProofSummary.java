package ai.acsl.injector.proof;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Goal counts and notable lines extracted from a verifier run.
 */
public record ProofSummary(OptionalInt provedGoals, OptionalInt totalGoals, List<String> failedGoals, List<String> warnings) {

    public ProofSummary {
        provedGoals = provedGoals == null ? OptionalInt.empty() : provedGoals;
        totalGoals = totalGoals == null ? OptionalInt.empty() : totalGoals;
        failedGoals = List.copyOf(Objects.requireNonNull(failedGoals, "failedGoals"));
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
    }

    public boolean hasGoalCounts() {
        return provedGoals.isPresent() && totalGoals.isPresent();
    }

    /**
     * Proved over total goals, or 0.0 when either count is missing or zero.
     */
    public double ratio() {
        if (!hasGoalCounts() || provedGoals.getAsInt() <= 0 || totalGoals.getAsInt() <= 0) {
            return 0.0;
        }
        return (double) provedGoals.getAsInt() / totalGoals.getAsInt();
    }

    public boolean fullyProved() {
        return hasGoalCounts() && provedGoals.getAsInt() > 0 && provedGoals.getAsInt() == totalGoals.getAsInt();
    }
}
