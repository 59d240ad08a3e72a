package ai.acsl.injector.structure;

/**
 * Renders structures as indented plain text for diagnostics and the inspect command.
 */
public class StructureReport {

    private static final String RULE = "=".repeat(70);

    public String render(CodeStructure structure) {
        StringBuilder builder = new StringBuilder();
        if (structure.functions().isEmpty()) {
            builder.append("(no functions)").append('\n');
        }
        for (int i = 0; i < structure.functions().size(); i++) {
            FunctionInfo function = structure.functions().get(i);
            builder.append("Function ").append(i).append(": ").append(function.name()).append('\n');
            builder.append("  Signature: ").append(function.signature()).append('\n');
            builder.append("  Line: ").append(function.lineNumber()).append('\n');
            builder.append("  Loops: ").append(function.loops().size()).append('\n');
            for (int j = 0; j < function.loops().size(); j++) {
                LoopInfo loop = function.loops().get(j);
                builder.append("    Loop ").append(j).append(": ").append(loop.kind().label()).append('\n');
                builder.append("      Header: ").append(loop.header()).append('\n');
                builder.append("      Line: ").append(loop.lineNumber()).append('\n');
            }
        }
        return builder.toString();
    }

    public String renderComparison(CodeStructure reference, CodeStructure candidate, ComparisonResult result) {
        StringBuilder builder = new StringBuilder();
        section(builder, "REFERENCE STRUCTURE");
        builder.append(render(reference));
        section(builder, "CANDIDATE STRUCTURE");
        builder.append(render(candidate));
        section(builder, "VALIDATION");
        builder.append(result.diagnostic().map(message -> "Structures differ: " + message).orElse("Structures match"))
                .append('\n');
        return builder.toString();
    }

    private static void section(StringBuilder builder, String title) {
        builder.append(RULE).append('\n').append(title).append('\n').append(RULE).append('\n');
    }
}
