package io.github.varda.expressions.core.exception;

import io.github.varda.expressions.core.ast.Node;

/**
 * Exception thrown when a {@link io.github.varda.expressions.core.dispatch.Visitor} has no
 * visit method for a node kind, neither directly nor through its base visitors.
 * <p>
 * This signals a missing case in a visitor definition, never a data problem. It should
 * surface in tests and is not meant to be caught.
 * </p>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public class MissingVisitMethodException extends IllegalStateException {

    private final Class<? extends Node> nodeKind;

    /**
     * @param nodeKind the node kind no visit method was found for
     */
    public MissingVisitMethodException(Class<? extends Node> nodeKind) {
        super("No visit method registered for node kind " + nodeKind.getSimpleName());
        this.nodeKind = nodeKind;
    }

    /**
     * @return the node kind that could not be dispatched
     */
    public Class<? extends Node> getNodeKind() {
        return nodeKind;
    }
}
