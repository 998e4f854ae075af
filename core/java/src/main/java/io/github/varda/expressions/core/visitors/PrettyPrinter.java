package io.github.varda.expressions.core.visitors;

import io.github.varda.expressions.core.ast.Clause;
import io.github.varda.expressions.core.ast.Conjunction;
import io.github.varda.expressions.core.ast.Disjunction;
import io.github.varda.expressions.core.ast.Expression;
import io.github.varda.expressions.core.ast.ExpressionNode;
import io.github.varda.expressions.core.ast.Grouping;
import io.github.varda.expressions.core.ast.Negation;
import io.github.varda.expressions.core.ast.Tautology;
import io.github.varda.expressions.core.dispatch.Visitor;
import io.github.varda.expressions.core.parsing.Grammar;

/**
 * Renders query expression trees in canonical form.
 * <p>
 * The canonical form is the minimal surface text: single spaces around keywords, no
 * spaces around {@code :}, and parentheses only where the tree has a {@link Grouping}.
 * Parsing the output and printing again yields the same text.
 * </p>
 * <pre>
 * "  *     or    sample    :   x  "  →  "* or sample:x"
 * "( sample : a )"                   →  "(sample:a)"
 * </pre>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public final class PrettyPrinter {

    public static final Visitor<String> VISITOR = Visitor.<String>builder()
            .onLeaf(Tautology.class, node -> String.valueOf(Grammar.TAUTOLOGY))
            .onLeaf(Clause.class, node -> node.field() + Grammar.CLAUSE_SEPARATOR + node.value())
            .onUnary(ExpressionNode.class, (node, expression) -> expression)
            .onUnary(Negation.class, (node, expression) -> Grammar.NOT + " " + expression)
            .onUnary(Grouping.class, (node, expression) -> Grammar.GROUP_OPEN + expression + Grammar.GROUP_CLOSE)
            .onBinary(Conjunction.class, (node, left, right) -> left + " " + Grammar.AND + " " + right)
            .onBinary(Disjunction.class, (node, left, right) -> left + " " + Grammar.OR + " " + right)
            .build();

    private PrettyPrinter() {
    }

    /**
     * @param expression tree to render
     * @return canonical text of the tree
     */
    public static String print(Expression expression) {
        return VISITOR.visit(expression);
    }
}
