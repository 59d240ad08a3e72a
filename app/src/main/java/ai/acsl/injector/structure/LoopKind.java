package ai.acsl.injector.structure;

import ai.acsl.injector.tree.NodeKinds;

/**
 * Loop constructs tracked by the structural model.
 */
public enum LoopKind {
    FOR("for"),
    WHILE("while"),
    DO_WHILE("do-while");

    private final String label;

    LoopKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static LoopKind fromNodeKind(String nodeKind) {
        return switch (nodeKind) {
            case NodeKinds.FOR_STATEMENT -> FOR;
            case NodeKinds.WHILE_STATEMENT -> WHILE;
            case NodeKinds.DO_STATEMENT -> DO_WHILE;
            default -> throw new IllegalArgumentException("Not a loop node: " + nodeKind);
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
