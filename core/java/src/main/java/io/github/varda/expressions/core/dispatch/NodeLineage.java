package io.github.varda.expressions.core.dispatch;

import io.github.varda.expressions.core.ast.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes the lookup order of a node kind: the kind itself, then its supertypes that are
 * node kinds, breadth first, in declaration order.
 * <p>
 * For example {@code Clause} yields {@code [Clause, Leaf, TermContent, Node]} and
 * {@code Conjunction} yields {@code [Conjunction, BinaryNode, ExpressionContent, Node]}.
 * </p>
 */
final class NodeLineage {

    private static final ClassValue<List<Class<? extends Node>>> LINEAGES = new ClassValue<>() {
        @Override
        protected List<Class<? extends Node>> computeValue(Class<?> type) {
            return compute(type);
        }
    };

    private NodeLineage() {
        // Utility class - prevent instantiation
    }

    static List<Class<? extends Node>> of(Class<? extends Node> kind) {
        return LINEAGES.get(kind);
    }

    private static List<Class<? extends Node>> compute(Class<?> kind) {
        Set<Class<? extends Node>> lineage = new LinkedHashSet<>();
        Deque<Class<?>> pending = new ArrayDeque<>();
        pending.add(kind);

        while (!pending.isEmpty()) {
            Class<?> current = pending.poll();
            if (!Node.class.isAssignableFrom(current)) {
                continue;
            }
            if (lineage.add(current.asSubclass(Node.class))) {
                if (current.getSuperclass() != null) {
                    pending.add(current.getSuperclass());
                }
                Collections.addAll(pending, current.getInterfaces());
            }
        }
        return List.copyOf(new ArrayList<>(lineage));
    }
}
