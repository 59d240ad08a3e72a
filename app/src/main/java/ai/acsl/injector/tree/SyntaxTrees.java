package ai.acsl.injector.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Kind-based lookups over any {@link SyntaxNode} tree.
 */
public final class SyntaxTrees {

    private SyntaxTrees() {
    }

    /**
     * Collects every node whose kind is in {@code kinds}, the root included, in pre-order.
     */
    public static List<SyntaxNode> findAll(SyntaxNode root, Set<String> kinds) {
        List<SyntaxNode> matches = new ArrayList<>();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (kinds.contains(node.kind())) {
                matches.add(node);
            }
            List<SyntaxNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return matches;
    }

    public static List<SyntaxNode> findAll(SyntaxNode root, String kind) {
        return findAll(root, Set.of(kind));
    }

    public static Optional<SyntaxNode> firstChild(SyntaxNode node, String kind) {
        for (SyntaxNode child : node.children()) {
            if (child.is(kind)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }
}
