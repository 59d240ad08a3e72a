package ai.acsl.injector.tree;

/**
 * Turns source text into a concrete syntax tree.
 */
@FunctionalInterface
public interface TreeProvider {

    /**
     * Parses the given text. Malformed regions are expected to surface as {@link NodeKinds#ERROR} nodes;
     * only input that cannot be turned into any tree raises {@link SourceParseException}.
     */
    SyntaxNode parse(String source);
}
