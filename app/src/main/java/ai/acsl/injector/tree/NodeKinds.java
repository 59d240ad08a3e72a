package ai.acsl.injector.tree;

import java.util.Set;

/**
 * Node kind tags of the tree-sitter C grammar that the structural model reads.
 */
public final class NodeKinds {

    public static final String TRANSLATION_UNIT = "translation_unit";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String FUNCTION_DECLARATOR = "function_declarator";
    public static final String POINTER_DECLARATOR = "pointer_declarator";
    public static final String PARAMETER_LIST = "parameter_list";
    public static final String IDENTIFIER = "identifier";
    public static final String COMPOUND_STATEMENT = "compound_statement";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String DO_STATEMENT = "do_statement";
    public static final String IF_STATEMENT = "if_statement";
    public static final String SWITCH_STATEMENT = "switch_statement";
    public static final String CASE_STATEMENT = "case_statement";
    public static final String LABELED_STATEMENT = "labeled_statement";
    public static final String ATTRIBUTED_STATEMENT = "attributed_statement";
    public static final String RETURN_STATEMENT = "return_statement";
    public static final String BREAK_STATEMENT = "break_statement";
    public static final String CONTINUE_STATEMENT = "continue_statement";
    public static final String GOTO_STATEMENT = "goto_statement";
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String DECLARATION = "declaration";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String ERROR = "ERROR";

    /**
     * Kinds that can stand as the body of a loop.
     */
    public static final Set<String> STATEMENTS = Set.of(
            COMPOUND_STATEMENT, FOR_STATEMENT, WHILE_STATEMENT, DO_STATEMENT, IF_STATEMENT,
            SWITCH_STATEMENT, CASE_STATEMENT, LABELED_STATEMENT, ATTRIBUTED_STATEMENT, RETURN_STATEMENT,
            BREAK_STATEMENT, CONTINUE_STATEMENT, GOTO_STATEMENT, EXPRESSION_STATEMENT, DECLARATION);

    public static final Set<String> LOOPS = Set.of(FOR_STATEMENT, WHILE_STATEMENT, DO_STATEMENT);

    private NodeKinds() {
    }
}
