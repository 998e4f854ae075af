package io.github.varda.expressions.core.dispatch;

import io.github.varda.expressions.core.ast.Node;

import java.util.List;

/**
 * Visit method in its most general form: the node and the results already computed for
 * its children, in order (none for leaves, one for wrappers, left then right for
 * connectives).
 * <p>
 * Registered through {@link Visitor.Builder#onAny(Class, VisitMethod)}, typically at
 * {@link Node} to give a visitor a catch-all default.
 * </p>
 *
 * @param <R> result type of the visitor
 * @author Varda Contributors
 * @since 1.0.0
 */
@FunctionalInterface
public interface VisitMethod<R> {

    R visit(Node node, List<R> children);
}
