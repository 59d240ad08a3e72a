package ai.acsl.injector.tree.c;

import ai.acsl.injector.tree.SyntaxNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * {@link SyntaxNode} view of a tree-sitter node. Children include anonymous tokens, in source order.
 */
final class TreeSitterSyntaxNode implements SyntaxNode {

    // Held so the native tree outlives every node handed out from it.
    private final TSTree tree;
    private final TSNode node;
    private List<SyntaxNode> children;

    TreeSitterSyntaxNode(TSTree tree, TSNode node) {
        this.tree = tree;
        this.node = node;
    }

    @Override
    public String kind() {
        return node.getType();
    }

    @Override
    public int startByte() {
        return node.getStartByte();
    }

    @Override
    public int endByte() {
        return node.getEndByte();
    }

    @Override
    public List<SyntaxNode> children() {
        if (children == null) {
            int count = node.getChildCount();
            List<SyntaxNode> collected = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                collected.add(new TreeSitterSyntaxNode(tree, node.getChild(i)));
            }
            children = Collections.unmodifiableList(collected);
        }
        return children;
    }

    @Override
    public String toString() {
        return kind() + "[" + startByte() + ", " + endByte() + ")";
    }
}
