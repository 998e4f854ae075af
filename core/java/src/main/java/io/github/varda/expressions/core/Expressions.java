package io.github.varda.expressions.core;

import io.github.varda.expressions.core.api.ClauseBuilder;
import io.github.varda.expressions.core.api.ClausePredicate;
import io.github.varda.expressions.core.api.ClauseValueUpdate;
import io.github.varda.expressions.core.api.CriterionAlgebra;
import io.github.varda.expressions.core.api.ExpressionParser;
import io.github.varda.expressions.core.api.QueryScope;
import io.github.varda.expressions.core.ast.Clause;
import io.github.varda.expressions.core.ast.Conjunction;
import io.github.varda.expressions.core.ast.Expression;
import io.github.varda.expressions.core.ast.Grouping;
import io.github.varda.expressions.core.ast.Negation;
import io.github.varda.expressions.core.ast.Term;
import io.github.varda.expressions.core.exception.ExpressionSyntaxException;
import io.github.varda.expressions.core.impl.BasicExpressionParser;
import io.github.varda.expressions.core.parsing.Grammar;
import io.github.varda.expressions.core.visitors.ClauseTester;
import io.github.varda.expressions.core.visitors.ClauseValueUpdater;
import io.github.varda.expressions.core.visitors.Identity;
import io.github.varda.expressions.core.visitors.PrettyPrinter;
import io.github.varda.expressions.core.visitors.QueryCriterionBuilder;
import io.github.varda.expressions.core.visitors.SingletonTester;
import io.github.varda.expressions.core.visitors.TautologyTester;

import java.util.Objects;

/**
 * Entry points for working with query expressions.
 * <p>
 * Parsing uses a {@link BasicExpressionParser} with the default policy. Use
 * {@code new BasicExpressionParser(policy)} for other limits.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * Expression expression = Expressions.parse("sample:3 and (group:2 or sample:4) and not group:5");
 *
 * Expressions.compose(expression);      // "sample:3 and (group:2 or sample:4) and not group:5"
 * Expressions.isSingleton(expression);  // false
 * Expressions.classify(Expressions.parse("group:1 or group:2"));  // GROUP_CLAUSES
 * }</pre>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public final class Expressions {

    private static final ExpressionParser DEFAULT_PARSER = new BasicExpressionParser();

    private Expressions() {
    }

    /**
     * Parses query expression text with the default policy.
     *
     * @param text the query expression
     * @return the parsed tree
     * @throws ExpressionSyntaxException if the text is not a valid query expression
     */
    public static Expression parse(String text) {
        return DEFAULT_PARSER.parse(text);
    }

    /**
     * Renders an expression in canonical form.
     */
    public static String compose(Expression expression) {
        return PrettyPrinter.print(expression);
    }

    /**
     * Same as {@link #compose(Expression)}.
     */
    public static String prettyPrint(Expression expression) {
        return compose(expression);
    }

    public static Expression deepCopy(Expression expression) {
        return Identity.copy(expression);
    }

    /**
     * Compiles an expression into a predicate of the given algebra.
     *
     * @param expression    the tree to compile
     * @param algebra       boolean connectives of the backend
     * @param clauseBuilder translation of individual clauses
     * @param <P>           predicate type of the backend
     * @return the composed predicate
     */
    public static <P> P buildQueryCriterion(Expression expression,
                                            CriterionAlgebra<P> algebra,
                                            ClauseBuilder<P> clauseBuilder) {
        return new QueryCriterionBuilder<>(algebra, clauseBuilder).build(expression);
    }

    /**
     * Returns a copy of {@code expression} with every clause value replaced by
     * {@code update.update(field, value)}.
     *
     * @throws IllegalArgumentException if an updated value is not a valid clause value
     */
    public static Expression updateClauseValues(Expression expression, ClauseValueUpdate update) {
        return new ClauseValueUpdater(update).update(expression);
    }

    /**
     * @return {@code true} if every clause of {@code expression} satisfies {@code predicate},
     * whatever connectives join them
     */
    public static boolean testClauses(Expression expression, ClausePredicate predicate) {
        return new ClauseTester(predicate).test(expression);
    }

    /**
     * @return {@code true} if the expression is written as {@code *} alone
     */
    public static boolean isTautology(Expression expression) {
        return TautologyTester.test(expression);
    }

    /**
     * @return {@code true} if the expression is written as a single {@code sample:<value>} clause
     */
    public static boolean isSingleton(Expression expression) {
        return SingletonTester.test(expression);
    }

    /**
     * Conjunction of two expressions, grouping the left one so the leftmost-connective rule
     * cannot split it: {@code (left) and right}.
     * <p>
     * The result owns {@code left} and {@code right}; callers keeping a reference to either
     * should pass a {@link #deepCopy(Expression) copy}.
     * </p>
     */
    public static Expression makeConjunction(Expression left, Expression right) {
        Objects.requireNonNull(left, "left cannot be null");
        Objects.requireNonNull(right, "right cannot be null");
        return new Expression(new Conjunction(new Term(new Grouping(left)), right));
    }

    /**
     * Classifies an expression by shape. Checks are made in order: singleton sample query,
     * tautology, group clauses only, anything else.
     */
    public static QueryScope classify(Expression expression) {
        if (isSingleton(expression)) {
            return QueryScope.SINGLETON;
        }
        if (isTautology(expression)) {
            return QueryScope.TAUTOLOGY;
        }
        if (testClauses(expression, (field, value) -> Grammar.GROUP_FIELD.equals(field))) {
            return QueryScope.GROUP_CLAUSES;
        }
        return QueryScope.GENERAL;
    }

    /**
     * Restricts {@code expression} to the samples other than {@code sampleValue}:
     * {@code (not sample:<sampleValue>) and expression}.
     *
     * @throws IllegalArgumentException if {@code sampleValue} is not a valid clause value
     */
    public static Expression excludeSample(Expression expression, String sampleValue) {
        Expression excluded = new Expression(new Term(new Negation(
                new Term(new Clause(Grammar.SAMPLE_FIELD, sampleValue)))));
        return makeConjunction(excluded, expression);
    }
}
