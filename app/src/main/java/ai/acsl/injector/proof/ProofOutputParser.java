package ai.acsl.injector.proof;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the textual report of a Frama-C WP run: the {@code Proved goals: p / t} summary, goals that were not
 * proved and warning or error lines.
 */
public class ProofOutputParser {

    private static final Pattern PROVED_GOALS = Pattern.compile("Proved goals:\\s+(\\d+)\\s*/\\s*(\\d+)");
    private static final Pattern FAILED_GOAL = Pattern.compile("^\\[wp\\].*Goal.*not proved.*$", Pattern.MULTILINE);
    private static final Pattern WARNING = Pattern.compile("^\\[.*?\\] .*(?:error|warning|Error|Warning).*$", Pattern.MULTILINE);

    public ProofSummary parse(String output) {
        if (output == null || output.isBlank()) {
            return new ProofSummary(OptionalInt.empty(), OptionalInt.empty(), List.of(), List.of());
        }
        String normalized = output.replace("\r\n", "\n");
        OptionalInt proved = OptionalInt.empty();
        OptionalInt total = OptionalInt.empty();
        Matcher summary = PROVED_GOALS.matcher(normalized);
        if (summary.find()) {
            proved = OptionalInt.of(Integer.parseInt(summary.group(1)));
            total = OptionalInt.of(Integer.parseInt(summary.group(2)));
        }
        return new ProofSummary(proved, total, collect(FAILED_GOAL, normalized), collect(WARNING, normalized));
    }

    private static List<String> collect(Pattern pattern, String output) {
        List<String> lines = new ArrayList<>();
        Matcher matcher = pattern.matcher(output);
        while (matcher.find()) {
            lines.add(matcher.group().strip());
        }
        return lines;
    }
}
