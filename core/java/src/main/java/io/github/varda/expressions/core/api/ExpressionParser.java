package io.github.varda.expressions.core.api;

import io.github.varda.expressions.core.ast.Expression;
import io.github.varda.expressions.core.exception.ExpressionSyntaxException;

/**
 * Interface for parsing query expression text into an {@link Expression} tree.
 * <p>
 * The query language combines {@code field:value} clauses and the tautology {@code *}
 * with the keywords {@code and}, {@code or} and {@code not}, and parentheses for
 * explicit grouping:
 * </p>
 * <pre>{@code
 * ExpressionParser parser = new BasicExpressionParser();
 * Expression expression = parser.parse("sample:3 and (group:2 or sample:4) and not group:5");
 * }</pre>
 * <p>
 * Implementations are stateless and may be shared between threads.
 * </p>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public interface ExpressionParser {

    /**
     * Parses the given text into a complete expression tree.
     *
     * @param text the expression text
     * @return the parsed tree, never {@code null}
     * @throws ExpressionSyntaxException if {@code text} is {@code null}, blank, exceeds the
     *                                   configured limits, or does not match the grammar
     */
    Expression parse(String text) throws ExpressionSyntaxException;
}
