package io.github.varda.expressions.jpa.utils;

import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.ManagedType;
import jakarta.persistence.metamodel.SingularAttribute;
import jakarta.persistence.metamodel.Type;

/**
 * Resolves dot-notation attribute paths (e.g. {@code "submitter.name"}) against a query root.
 * <p>
 * Segments are looked up in the JPA metamodel. Entity associations along the way are
 * joined once per {@code From} (a {@code LEFT} join, reused when the path is resolved
 * again); embeddables are navigated without a join. Collections are rejected: comparing a
 * collection-valued path with a single value needs a membership subquery instead.
 * </p>
 * <p>
 * A resolved path is {@code null} for rows without the association, so comparisons on it
 * should be guarded with {@code isNotNull} when they may end up negated.
 * </p>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public final class PathResolver {

    private PathResolver() {
        throw new UnsupportedOperationException("PathResolver is a utility class and cannot be instantiated");
    }

    /**
     * @param root the root of the criteria query
     * @param path the attribute path in dot notation
     * @return the resolved path
     * @throws IllegalArgumentException if the path is blank, a segment does not exist, a
     *                                  basic attribute is navigated, or a segment is a collection
     */
    public static Path<?> resolve(Root<?> root, String path) {
        if (root == null) {
            throw new IllegalArgumentException("Root cannot be null");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path cannot be null or blank");
        }

        String[] segments = path.split("\\.");
        ManagedType<?> type = root.getModel();
        From<?, ?> from = root;
        Path<?> current = root;

        for (int i = 0; i < segments.length; i++) {
            String segment = segments[i];
            Attribute<?, ?> attribute = findAttribute(type, segment, path);

            if (attribute.isCollection()) {
                throw new IllegalArgumentException(String.format(
                        "Segment '%s' of path '%s' is a collection and cannot be compared with a single value",
                        segment, path));
            }
            if (i == segments.length - 1) {
                return current.get(segment);
            }

            Type<?> target = ((SingularAttribute<?, ?>) attribute).getType();
            if (!(target instanceof ManagedType<?> managed)) {
                throw new IllegalArgumentException(String.format(
                        "Segment '%s' of path '%s' is a basic attribute and cannot be navigated", segment, path));
            }

            if (attribute.isAssociation() && from != null) {
                from = joinOnce(from, segment);
                current = from;
            } else {
                current = current.get(segment);
                from = null;
            }
            type = managed;
        }
        return current;
    }

    private static Attribute<?, ?> findAttribute(ManagedType<?> type, String segment, String path) {
        try {
            return type.getAttribute(segment);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format("Field '%s' of path '%s' not found in %s",
                    segment, path, type.getJavaType().getSimpleName()), e);
        }
    }

    private static From<?, ?> joinOnce(From<?, ?> from, String attribute) {
        return from.getJoins().stream()
                .filter(j -> j.getAttribute().getName().equals(attribute))
                .findFirst()
                .map(j -> (From<?, ?>) j)
                .orElseGet(() -> from.join(attribute, JoinType.LEFT));
    }
}
