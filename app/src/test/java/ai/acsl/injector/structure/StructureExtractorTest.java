package ai.acsl.injector.structure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import ai.acsl.injector.tree.NodeKinds;
import ai.acsl.injector.tree.SourceParseException;
import ai.acsl.injector.tree.SyntaxNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class StructureExtractorTest {

    private static final String CLAMP = "int clamp(int v,int min,int max){ int low = v>min?v:min; return low<max?low:max; }";

    private static final String SUM = """
            int sum(int *a, int n) {
                int s = 0;
                for (int i = 0; i < n; i++) {
                    int j = 0;
                    while (j < i) { j++; }
                    s += a[i];
                }
                do {
                    n--;
                } while (n > 0);
                return s;
            }
            """;

    private final StructureExtractor extractor = new StructureExtractor();

    @Test
    void extractsFunctionWithoutLoops() {
        CodeStructure structure = extractor.extract(CLAMP);

        assertThat(structure.functions()).hasSize(1);
        FunctionInfo clamp = structure.functions().get(0);
        assertThat(clamp.name()).isEqualTo("clamp");
        assertThat(clamp.signature()).isEqualTo("int clamp(int v,int min,int max)");
        assertThat(clamp.bytePosition()).isZero();
        assertThat(clamp.lineNumber()).isEqualTo(1);
        assertThat(clamp.loops()).isEmpty();
        assertThat(structure.slotCount()).isEqualTo(1);
    }

    @Test
    void flattensNestedLoopsInSourceOrder() {
        FunctionInfo sum = extractor.extract(SUM).functions().get(0);

        assertThat(sum.loops())
                .extracting(LoopInfo::kind, LoopInfo::header, LoopInfo::lineNumber)
                .containsExactly(
                        tuple(LoopKind.FOR, "for (int i = 0; i < n; i++)", 3),
                        tuple(LoopKind.WHILE, "while (j < i)", 5),
                        tuple(LoopKind.DO_WHILE, "do", 8));
        assertThat(sum.loops().get(0).bytePosition()).isEqualTo(SUM.indexOf("for"));
    }

    @Test
    void usesStatementStartAsHeaderEndForBracelessBodies() {
        FunctionInfo function = extractor.extract("void f(int n) {\n  while (n)\n    n--;\n}").functions().get(0);

        assertThat(function.loops()).extracting(LoopInfo::header).containsExactly("while (n)");
    }

    @Test
    void namesPointerReturningFunctions() {
        FunctionInfo dup = extractor.extract("static char *dup(const char *s)\n{\n    return 0;\n}\n").functions().get(0);

        assertThat(dup.name()).isEqualTo("dup");
        assertThat(dup.signature()).isEqualTo("static char *dup(const char *s)");
    }

    @Test
    void reportsPositionsInUtf8Bytes() {
        FunctionInfo function = extractor.extract("/* héllo */\nint f(void) { return 0; }").functions().get(0);

        assertThat(function.bytePosition()).isEqualTo(13);
        assertThat(function.lineNumber()).isEqualTo(2);
    }

    @Test
    void listsNestedFunctionsSeparately() {
        CodeStructure structure = extractor.extract("void outer(void) { int inner(int x) { while (x) x--; return x; } }");

        assertThat(structure.functions()).extracting(FunctionInfo::name).containsExactly("outer", "inner");
        assertThat(structure.functions().get(0).loops()).hasSize(1);
        assertThat(structure.functions().get(1).loops()).hasSize(1);
    }

    @Test
    void countsLoopsWhoseHeadersHoldBraceInitializers() {
        String walk = """
                int walk(int n) {
                    struct pt { int x; int y; };
                    for (struct pt p = {0, 0}; p.x < n; p.x++) {
                        n--;
                    }
                    int s = n;
                    while (s > 10) s--;
                    return s;
                }
                """;

        FunctionInfo function = extractor.extract(walk).functions().get(0);

        assertThat(function.loops())
                .extracting(LoopInfo::kind, LoopInfo::header)
                .containsExactly(
                        tuple(LoopKind.FOR, "for (struct pt p = {0, 0}; p.x < n; p.x++)"),
                        tuple(LoopKind.WHILE, "while (s > 10)"));
        assertThat(extractor.extract("int f(int n){ for (int a[2] = {0, 1}; a[0] < n; a[0]++) { n--; } return n; }")
                .functions().get(0).loops())
                .extracting(LoopInfo::kind)
                .containsExactly(LoopKind.FOR);
    }

    @Test
    void isDeterministic() {
        assertThat(extractor.extract(SUM)).isEqualTo(extractor.extract(SUM));
    }

    @Test
    void fallsBackToUnknownNameWithoutDeclarator() {
        String source = "weird {}";
        Node body = new Node(NodeKinds.COMPOUND_STATEMENT, 6, 8, List.of());
        Node function = new Node(NodeKinds.FUNCTION_DEFINITION, 0, 8, List.of(body));
        StructureExtractor custom = new StructureExtractor(text -> new Node(NodeKinds.TRANSLATION_UNIT, 0, 8, List.of(function)));

        FunctionInfo info = custom.extract(source).functions().get(0);

        assertThat(info.name()).isEqualTo("unknown");
        assertThat(info.signature()).isEqualTo("weird");
    }

    @Test
    void keepsWhatSurvivesAroundMalformedRegions() {
        CodeStructure structure = extractor.extract("int f(int n) { while (n) n--; return n; }\n}\nint g(void) { return 0; }\n");

        assertThat(structure.functions()).extracting(FunctionInfo::name).contains("f");
        assertThat(structure.functions().get(0).loops()).extracting(LoopInfo::kind).containsExactly(LoopKind.WHILE);
    }

    @Test
    void propagatesParseFailures() {
        StructureExtractor failing = new StructureExtractor(text -> {
            throw new SourceParseException("tree-sitter returned no tree");
        });

        assertThatThrownBy(() -> failing.extract("int f(void) { return 0; }"))
                .isInstanceOf(SourceParseException.class)
                .hasMessageContaining("no tree");
    }

    private record Node(String kind, int startByte, int endByte, List<SyntaxNode> children) implements SyntaxNode {
    }
}
