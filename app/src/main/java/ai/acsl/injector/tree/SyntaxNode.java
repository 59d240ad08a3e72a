package ai.acsl.injector.tree;

import java.util.List;

/**
 * Minimal view of a concrete syntax tree node: a kind tag, a UTF-8 byte span and ordered children.
 */
public interface SyntaxNode {

    String kind();

    int startByte();

    int endByte();

    List<SyntaxNode> children();

    default boolean is(String kind) {
        return kind().equals(kind);
    }
}
