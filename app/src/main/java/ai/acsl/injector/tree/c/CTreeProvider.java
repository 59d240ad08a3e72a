package ai.acsl.injector.tree.c;

import ai.acsl.injector.tree.SourceParseException;
import ai.acsl.injector.tree.SyntaxNode;
import ai.acsl.injector.tree.TreeProvider;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterC;

/**
 * Tree provider for C sources backed by the tree-sitter C grammar.
 * <p>
 * Spans are UTF-8 byte offsets. Malformed regions come back as {@code ERROR} nodes; only a parse that yields
 * no tree at all raises {@link SourceParseException}. A fresh native parser is used per call, so one provider
 * can be shared across threads.
 */
public class CTreeProvider implements TreeProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(CTreeProvider.class);

    private final TSLanguage language;

    public CTreeProvider() {
        this(new TreeSitterC());
    }

    public CTreeProvider(TSLanguage language) {
        this.language = Objects.requireNonNull(language, "language");
    }

    @Override
    public SyntaxNode parse(String source) {
        if (source == null) {
            throw new IllegalArgumentException("source must be provided");
        }
        TSTree tree;
        try {
            TSParser parser = new TSParser();
            parser.setLanguage(language);
            tree = parser.parseString(null, source);
        } catch (RuntimeException ex) {
            throw new SourceParseException("tree-sitter failed to parse source: " + ex.getMessage(), ex);
        }
        if (tree == null) {
            throw new SourceParseException("tree-sitter returned no tree");
        }
        TSNode root = tree.getRootNode();
        if (root == null || root.isNull()) {
            throw new SourceParseException("tree-sitter returned an empty tree");
        }
        if (root.hasError()) {
            LOGGER.debug("Parsed tree contains error nodes");
        }
        LOGGER.trace("Parsed {} top-level nodes", root.getChildCount());
        return new TreeSitterSyntaxNode(tree, root);
    }
}
