package io.github.varda.expressions.core.dispatch;

import io.github.varda.expressions.core.ast.BinaryNode;
import io.github.varda.expressions.core.ast.ExpressionNode;
import io.github.varda.expressions.core.ast.Leaf;
import io.github.varda.expressions.core.ast.Node;
import io.github.varda.expressions.core.exception.MissingVisitMethodException;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dispatch table mapping AST node kinds to visit methods, with optional fallback to a
 * base table.
 * <p>
 * A visitor is one read-only operation over the closed set of node kinds. It is written
 * purely in terms of "what to do with this node given the results of its children":
 * {@link #visit(Node)} walks the tree post-order and hands every method its children's
 * results, so no method ever recurses itself.
 * </p>
 *
 * <h2>Method Resolution</h2>
 * <p>
 * For a node of runtime kind {@code K}, the kinds in {@code K}'s lineage are tried from
 * most to least specific (e.g. {@code Clause}, {@code Leaf}, {@code TermContent},
 * {@code Node}), and the first registered method wins. If none is registered, the same
 * walk is repeated on the base visitor, transitively. If the whole chain comes up empty,
 * a {@link MissingVisitMethodException} is thrown.
 * </p>
 *
 * <h2>Extension by Override</h2>
 * <p>
 * A visitor built with {@link #extending(Visitor)} only registers the kinds it changes
 * and inherits everything else. For example, swapping conjunctions and disjunctions:
 * </p>
 * <pre>{@code
 * Visitor<Node> switcher = Visitor.extending(Identity.VISITOR)
 *     .onBinary(Conjunction.class, (node, left, right) ->
 *         new Disjunction((Term) left, (Expression) right))
 *     .onBinary(Disjunction.class, (node, left, right) ->
 *         new Conjunction((Term) left, (Expression) right))
 *     .build();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Visitors are immutable once built and may be shared, provided their methods are
 * themselves free of shared mutable state.
 * </p>
 *
 * @param <R> result type produced for every node
 * @author Varda Contributors
 * @since 1.0.0
 */
public final class Visitor<R> {

    private final Map<Class<? extends Node>, VisitMethod<R>> methods;
    private final Visitor<R> base;

    private Visitor(Map<Class<? extends Node>, VisitMethod<R>> methods, Visitor<R> base) {
        this.methods = Collections.unmodifiableMap(new HashMap<>(methods));
        this.base = base;
    }

    /**
     * Starts a standalone visitor.
     *
     * @param <R> result type
     * @return a new builder without base
     */
    public static <R> Builder<R> builder() {
        return new Builder<>(null);
    }

    /**
     * Starts a visitor falling back to {@code base} for every kind it does not register.
     *
     * @param base the visitor to inherit from
     * @param <R>  result type
     * @return a new builder
     * @throws NullPointerException if base is {@code null}
     */
    public static <R> Builder<R> extending(Visitor<R> base) {
        return new Builder<>(Objects.requireNonNull(base, "base visitor cannot be null"));
    }

    /**
     * @return the base visitor, or {@code null} for a standalone visitor
     */
    public Visitor<R> getBase() {
        return base;
    }

    /**
     * Walks {@code node} post-order and returns the result computed for it.
     *
     * @param node root of the (sub)tree to visit
     * @return the result of the method resolved for {@code node}
     * @throws MissingVisitMethodException if a node kind in the tree has no method
     */
    public R visit(Node node) {
        Objects.requireNonNull(node, "node cannot be null");

        List<R> children;
        if (node instanceof Leaf) {
            children = Collections.emptyList();
        } else if (node instanceof ExpressionNode unary) {
            children = Collections.singletonList(visit(unary.expression()));
        } else if (node instanceof BinaryNode binary) {
            R left = visit(binary.left());
            R right = visit(binary.right());
            children = Arrays.asList(left, right);
        } else {
            // Slot interfaces are implemented only by kinds of the three categories above
            throw new MissingVisitMethodException(node.getClass());
        }

        return resolve(node.getClass()).visit(node, children);
    }

    /**
     * Finds the visit method for {@code kind}, following the lineage and then the base chain.
     *
     * @param kind the runtime node kind
     * @return the resolved method
     * @throws MissingVisitMethodException if no method applies
     */
    public VisitMethod<R> resolve(Class<? extends Node> kind) {
        for (Visitor<R> visitor = this; visitor != null; visitor = visitor.base) {
            for (Class<? extends Node> candidate : NodeLineage.of(kind)) {
                VisitMethod<R> method = visitor.methods.get(candidate);
                if (method != null) {
                    return method;
                }
            }
        }
        throw new MissingVisitMethodException(kind);
    }

    /**
     * Visit method for leaf kinds.
     */
    @FunctionalInterface
    public interface LeafMethod<N extends Leaf, R> {
        R visit(N node);
    }

    /**
     * Visit method for wrapper kinds, receiving the result of the wrapped child.
     */
    @FunctionalInterface
    public interface UnaryMethod<N extends ExpressionNode, R> {
        R visit(N node, R expression);
    }

    /**
     * Visit method for connective kinds, receiving the results of both operands.
     */
    @FunctionalInterface
    public interface BinaryMethod<N extends BinaryNode, R> {
        R visit(N node, R left, R right);
    }

    /**
     * Registers visit methods. A later registration for the same kind replaces the earlier one.
     *
     * @param <R> result type
     */
    public static final class Builder<R> {
        private final Map<Class<? extends Node>, VisitMethod<R>> methods = new HashMap<>();
        private final Visitor<R> base;

        private Builder(Visitor<R> base) {
            this.base = base;
        }

        /**
         * Registers a method for a leaf kind or category.
         */
        public <N extends Leaf> Builder<R> onLeaf(Class<N> kind, LeafMethod<N, R> method) {
            Objects.requireNonNull(method, "method cannot be null");
            return register(kind, (node, children) -> method.visit(kind.cast(node)));
        }

        /**
         * Registers a method for a wrapper kind or for the whole {@link ExpressionNode} category.
         */
        public <N extends ExpressionNode> Builder<R> onUnary(Class<N> kind, UnaryMethod<N, R> method) {
            Objects.requireNonNull(method, "method cannot be null");
            return register(kind, (node, children) -> method.visit(kind.cast(node), children.get(0)));
        }

        /**
         * Registers a method for a connective kind or for the whole {@link BinaryNode} category.
         */
        public <N extends BinaryNode> Builder<R> onBinary(Class<N> kind, BinaryMethod<N, R> method) {
            Objects.requireNonNull(method, "method cannot be null");
            return register(kind, (node, children) -> method.visit(kind.cast(node), children.get(0), children.get(1)));
        }

        /**
         * Registers an arity-independent method, typically at {@link Node} as a catch-all.
         */
        public Builder<R> onAny(Class<? extends Node> kind, VisitMethod<R> method) {
            Objects.requireNonNull(method, "method cannot be null");
            return register(kind, method);
        }

        public Visitor<R> build() {
            return new Visitor<>(methods, base);
        }

        private Builder<R> register(Class<? extends Node> kind, VisitMethod<R> method) {
            methods.put(Objects.requireNonNull(kind, "kind cannot be null"), method);
            return this;
        }
    }
}
