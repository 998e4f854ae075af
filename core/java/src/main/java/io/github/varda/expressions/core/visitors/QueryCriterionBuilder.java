package io.github.varda.expressions.core.visitors;

import io.github.varda.expressions.core.api.ClauseBuilder;
import io.github.varda.expressions.core.api.CriterionAlgebra;
import io.github.varda.expressions.core.ast.Clause;
import io.github.varda.expressions.core.ast.Conjunction;
import io.github.varda.expressions.core.ast.Disjunction;
import io.github.varda.expressions.core.ast.Expression;
import io.github.varda.expressions.core.ast.ExpressionNode;
import io.github.varda.expressions.core.ast.Negation;
import io.github.varda.expressions.core.ast.Tautology;
import io.github.varda.expressions.core.dispatch.Visitor;

import java.util.Objects;

/**
 * Compiles a query expression tree into a predicate of a caller-supplied boolean algebra.
 *
 * <h2>Translation</h2>
 * <ul>
 *   <li>{@code *} → {@link CriterionAlgebra#tautology()}</li>
 *   <li>{@code field:value} → {@link ClauseBuilder#build(String, String)}</li>
 *   <li>{@code not t} → {@link CriterionAlgebra#not(Object)}</li>
 *   <li>{@code l and r} → {@link CriterionAlgebra#and(Object, Object)}</li>
 *   <li>{@code l or r} → {@link CriterionAlgebra#or(Object, Object)}</li>
 *   <li>groupings, terms and expressions pass their child's predicate through</li>
 * </ul>
 * <p>
 * The compiler only builds a predicate description; evaluating it is up to the backend.
 * Exceptions thrown by the clause builder or the algebra propagate unchanged.
 * </p>
 *
 * <pre>{@code
 * QueryCriterionBuilder<PredicateResolver<Sample>> builder =
 *     new QueryCriterionBuilder<>(new JpaCriterionAlgebra<>(), clauseContext);
 * PredicateResolver<Sample> resolver = builder.build(Expressions.parse("not sample:4"));
 * }</pre>
 *
 * @param <P> predicate type of the backend
 * @author Varda Contributors
 * @since 1.0.0
 */
public final class QueryCriterionBuilder<P> {

    private final Visitor<P> visitor;

    /**
     * @param algebra       the target boolean algebra
     * @param clauseBuilder translation of individual clauses
     */
    public QueryCriterionBuilder(CriterionAlgebra<P> algebra, ClauseBuilder<P> clauseBuilder) {
        Objects.requireNonNull(algebra, "algebra cannot be null");
        Objects.requireNonNull(clauseBuilder, "clauseBuilder cannot be null");

        this.visitor = Visitor.<P>builder()
                .onLeaf(Tautology.class, node -> algebra.tautology())
                .onLeaf(Clause.class, node -> clauseBuilder.build(node.field(), node.value()))
                .onUnary(ExpressionNode.class, (node, expression) -> expression)
                .onUnary(Negation.class, (node, expression) -> algebra.not(expression))
                .onBinary(Conjunction.class, (node, left, right) -> algebra.and(left, right))
                .onBinary(Disjunction.class, (node, left, right) -> algebra.or(left, right))
                .build();
    }

    /**
     * @param expression tree to compile
     * @return the composed predicate
     */
    public P build(Expression expression) {
        return visitor.visit(expression);
    }
}
