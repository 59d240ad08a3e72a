package ai.acsl.injector.structure;

import ai.acsl.injector.tree.NodeKinds;
import ai.acsl.injector.tree.SourceText;
import ai.acsl.injector.tree.SyntaxNode;
import ai.acsl.injector.tree.SyntaxTrees;
import ai.acsl.injector.tree.TreeProvider;
import ai.acsl.injector.tree.c.CTreeProvider;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link CodeStructure} from source text by walking the tree produced by a {@link TreeProvider}.
 */
public class StructureExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(StructureExtractor.class);
    private static final String UNKNOWN_NAME = "unknown";

    private final TreeProvider treeProvider;

    public StructureExtractor() {
        this(new CTreeProvider());
    }

    public StructureExtractor(TreeProvider treeProvider) {
        this.treeProvider = Objects.requireNonNull(treeProvider, "treeProvider");
    }

    public CodeStructure extract(String sourceText) {
        SourceText source = new SourceText(Objects.requireNonNull(sourceText, "sourceText"));
        SyntaxNode root = treeProvider.parse(sourceText);

        List<FunctionInfo> functions = new ArrayList<>();
        for (SyntaxNode node : SyntaxTrees.findAll(root, NodeKinds.FUNCTION_DEFINITION)) {
            functions.add(toFunction(node, source));
        }
        LOGGER.debug("Extracted {} functions", functions.size());
        return new CodeStructure(functions);
    }

    private FunctionInfo toFunction(SyntaxNode node, SourceText source) {
        Optional<SyntaxNode> body = SyntaxTrees.firstChild(node, NodeKinds.COMPOUND_STATEMENT);
        String signature = body
                .map(block -> source.slice(node.startByte(), block.startByte()))
                .orElseGet(() -> source.slice(node.startByte(), node.endByte()));
        List<LoopInfo> loops = body.map(block -> extractLoops(block, source)).orElse(List.of());
        return new FunctionInfo(functionName(node, source), SourceText.normalizeWhitespace(signature),
                node.startByte(), source.lineNumberAt(node.startByte()), loops);
    }

    private String functionName(SyntaxNode node, SourceText source) {
        for (SyntaxNode child : node.children()) {
            SyntaxNode declarator = child;
            // The declarator is the last child, after the star and any qualifiers.
            while (declarator.is(NodeKinds.POINTER_DECLARATOR) && !declarator.children().isEmpty()) {
                List<SyntaxNode> parts = declarator.children();
                declarator = parts.get(parts.size() - 1);
            }
            if (declarator.is(NodeKinds.FUNCTION_DECLARATOR)) {
                return SyntaxTrees.firstChild(declarator, NodeKinds.IDENTIFIER)
                        .map(identifier -> source.slice(identifier.startByte(), identifier.endByte()))
                        .orElse(UNKNOWN_NAME);
            }
        }
        return UNKNOWN_NAME;
    }

    private List<LoopInfo> extractLoops(SyntaxNode body, SourceText source) {
        List<LoopInfo> loops = new ArrayList<>();
        for (SyntaxNode loop : SyntaxTrees.findAll(body, NodeKinds.LOOPS)) {
            loops.add(new LoopInfo(LoopKind.fromNodeKind(loop.kind()), loopHeader(loop, source),
                    loop.startByte(), source.lineNumberAt(loop.startByte())));
        }
        loops.sort(Comparator.comparingInt(LoopInfo::bytePosition));
        return loops;
    }

    private String loopHeader(SyntaxNode loop, SourceText source) {
        Integer bodyStart = null;
        for (SyntaxNode child : loop.children()) {
            if (child.is(NodeKinds.COMPOUND_STATEMENT)) {
                bodyStart = child.startByte();
                break;
            }
            if (NodeKinds.STATEMENTS.contains(child.kind())) {
                bodyStart = child.startByte();
            }
        }
        String header = bodyStart == null
                ? source.slice(loop.startByte(), loop.endByte())
                : source.slice(loop.startByte(), bodyStart);
        return SourceText.normalizeWhitespace(header);
    }
}
