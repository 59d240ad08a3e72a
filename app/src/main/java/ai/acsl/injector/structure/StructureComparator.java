package ai.acsl.injector.structure;

import java.util.List;
import java.util.Objects;

/**
 * Compares two structures and reports the first divergence. Checks run in a fixed order: function count,
 * then per function name, signature and loop count, then per loop kind and header.
 */
public class StructureComparator {

    public ComparisonResult compare(CodeStructure reference, CodeStructure candidate) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(candidate, "candidate");

        List<FunctionInfo> referenceFunctions = reference.functions();
        List<FunctionInfo> candidateFunctions = candidate.functions();
        if (referenceFunctions.size() != candidateFunctions.size()) {
            return countMismatch("function count", "function count mismatch",
                    referenceFunctions.size(), candidateFunctions.size());
        }

        for (int i = 0; i < referenceFunctions.size(); i++) {
            FunctionInfo expected = referenceFunctions.get(i);
            FunctionInfo actual = candidateFunctions.get(i);

            if (!expected.name().equals(actual.name())) {
                return valueMismatch("function name", "function " + i + " name mismatch", expected.name(), actual.name());
            }
            String prefix = "function '" + expected.name() + "'";
            if (!expected.signature().equals(actual.signature())) {
                return valueMismatch("function signature", prefix + " signature mismatch",
                        expected.signature(), actual.signature());
            }
            if (expected.loops().size() != actual.loops().size()) {
                return countMismatch("loop count", prefix + " loop count mismatch",
                        expected.loops().size(), actual.loops().size());
            }

            for (int j = 0; j < expected.loops().size(); j++) {
                LoopInfo expectedLoop = expected.loops().get(j);
                LoopInfo actualLoop = actual.loops().get(j);
                if (expectedLoop.kind() != actualLoop.kind()) {
                    return valueMismatch("loop kind", prefix + " loop " + j + " kind mismatch",
                            expectedLoop.kind().label(), actualLoop.kind().label());
                }
                if (!expectedLoop.header().equals(actualLoop.header())) {
                    return valueMismatch("loop header", prefix + " loop " + j + " header mismatch",
                            expectedLoop.header(), actualLoop.header());
                }
            }
        }
        return ComparisonResult.match();
    }

    private static ComparisonResult countMismatch(String field, String summary, int expected, int actual) {
        String message = summary + ": reference has " + expected + ", candidate has " + actual;
        return ComparisonResult.mismatch(new StructureMismatch(field, String.valueOf(expected), String.valueOf(actual), message));
    }

    private static ComparisonResult valueMismatch(String field, String summary, String expected, String actual) {
        String message = summary + ": reference '" + expected + "', candidate '" + actual + "'";
        return ComparisonResult.mismatch(new StructureMismatch(field, expected, actual, message));
    }
}
