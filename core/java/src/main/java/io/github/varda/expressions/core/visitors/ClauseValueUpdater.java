package io.github.varda.expressions.core.visitors;

import io.github.varda.expressions.core.api.ClauseValueUpdate;
import io.github.varda.expressions.core.ast.Clause;
import io.github.varda.expressions.core.ast.Expression;
import io.github.varda.expressions.core.ast.Node;
import io.github.varda.expressions.core.dispatch.Visitor;

import java.util.Objects;

/**
 * Rewrites the value of every clause in a query expression tree.
 * <p>
 * Extends {@link Identity#VISITOR}, overriding clauses only: the result has the same
 * structure as the input, with each {@code field:value} replaced by
 * {@code field:update(field, value)}.
 * </p>
 *
 * <pre>{@code
 * Expression updated = new ClauseValueUpdater((field, value) -> idFromUri(value))
 *     .update(Expressions.parse("sample:https://localhost/samples/3"));
 * // sample:3
 * }</pre>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public final class ClauseValueUpdater {

    private final Visitor<Node> visitor;

    /**
     * @param update computes each clause's new value; the result must be a valid clause value
     */
    public ClauseValueUpdater(ClauseValueUpdate update) {
        Objects.requireNonNull(update, "update cannot be null");

        this.visitor = Visitor.extending(Identity.VISITOR)
                .onLeaf(Clause.class, node -> new Clause(node.field(), update.update(node.field(), node.value())))
                .build();
    }

    /**
     * @param expression tree to rewrite
     * @return a new tree with updated clause values
     * @throws IllegalArgumentException if an updated value is not a valid clause value
     */
    public Expression update(Expression expression) {
        return (Expression) visitor.visit(expression);
    }
}
