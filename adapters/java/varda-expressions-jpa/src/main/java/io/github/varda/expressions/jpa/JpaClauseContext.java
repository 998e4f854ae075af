package io.github.varda.expressions.jpa;

import io.github.varda.expressions.core.Expressions;
import io.github.varda.expressions.core.api.ClauseBuilder;
import io.github.varda.expressions.core.ast.Expression;
import io.github.varda.expressions.core.parsing.Grammar;
import io.github.varda.expressions.jpa.exception.ClauseValueConversionException;
import io.github.varda.expressions.jpa.exception.UnknownClauseFieldException;
import io.github.varda.expressions.jpa.utils.ClauseValueConverter;
import io.github.varda.expressions.jpa.utils.PathResolver;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Translates query expression clauses into JPA Criteria predicates over one entity type.
 * <p>
 * Every clause field the expressions may use is mapped once, when the context is built.
 * Three kinds of mapping are available:
 * </p>
 * <ul>
 *   <li><strong>attribute:</strong> {@code field:value} holds when the attribute at a dotted
 *       path equals the value, converted to the attribute type. A {@code null} attribute, or a
 *       missing association on the path, makes the clause false, so its negation holds</li>
 *   <li><strong>membership:</strong> {@code field:value} holds when some element of a collection
 *       association has an attribute equal to the value ({@code EXISTS} subquery)</li>
 *   <li><strong>mapping:</strong> a custom {@link ClauseMapping}</li>
 * </ul>
 * <p>
 * Values of attribute and membership clauses are converted while building, so an invalid
 * value fails before any query is created.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * JpaClauseContext<Sample> context = JpaClauseContext.builder(Sample.class)
 *     .attribute("sample", "id", Long.class)
 *     .membership("group", "groups", "id", Long.class)
 *     .build();
 *
 * PredicateResolver<Sample> resolver =
 *     context.toResolver(Expressions.parse("sample:1 and (group:2 or sample:3) and not group:4"));
 * }</pre>
 *
 * <p>Contexts are immutable and thread-safe once built.</p>
 *
 * @param <E> the entity type queried
 * @author Varda Contributors
 * @since 1.0.0
 */
public final class JpaClauseContext<E> implements ClauseBuilder<PredicateResolver<E>> {

    private static final Logger logger = Logger.getLogger(JpaClauseContext.class.getName());

    private final Class<E> entityClass;
    private final Map<String, Function<String, PredicateResolver<E>>> mappings;
    private final JpaCriterionAlgebra<E> algebra = new JpaCriterionAlgebra<>();

    private JpaClauseContext(Class<E> entityClass, Map<String, Function<String, PredicateResolver<E>>> mappings) {
        this.entityClass = entityClass;
        this.mappings = Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
    }

    /**
     * @param entityClass the entity type queried
     * @param <E>         the entity type
     * @return a new builder without mappings
     */
    public static <E> Builder<E> builder(Class<E> entityClass) {
        return new Builder<>(Objects.requireNonNull(entityClass, "entityClass cannot be null"));
    }

    public Class<E> getEntityClass() {
        return entityClass;
    }

    /**
     * @return the mapped clause fields, in registration order
     */
    public Set<String> getFields() {
        return mappings.keySet();
    }

    /**
     * {@inheritDoc}
     *
     * @throws UnknownClauseFieldException     if {@code field} is not mapped
     * @throws ClauseValueConversionException if {@code value} does not convert to the attribute type
     */
    @Override
    public PredicateResolver<E> build(String field, String value) {
        Function<String, PredicateResolver<E>> mapping = mappings.get(field);
        if (mapping == null) {
            throw new UnknownClauseFieldException(field, getFields());
        }
        logger.fine(() -> String.format("Mapping clause %s:%s on %s", field, value, entityClass.getSimpleName()));
        return mapping.apply(value);
    }

    /**
     * Compiles a query expression into a deferred predicate.
     *
     * @param expression the parsed query expression
     * @return the predicate resolver for the whole expression
     * @throws UnknownClauseFieldException     if the expression uses an unmapped field
     * @throws ClauseValueConversionException if a clause value does not convert
     */
    public PredicateResolver<E> toResolver(Expression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");
        return Expressions.buildQueryCriterion(expression, algebra, this);
    }

    /**
     * Collects field mappings for a {@link JpaClauseContext}.
     *
     * @param <E> the entity type queried
     */
    public static final class Builder<E> {
        private final Class<E> entityClass;
        private final Map<String, Function<String, PredicateResolver<E>>> mappings = new LinkedHashMap<>();

        private Builder(Class<E> entityClass) {
            this.entityClass = entityClass;
        }

        /**
         * Maps {@code field:value} to equality on an attribute path.
         * <p>
         * The equality is guarded by {@code IS NOT NULL}: SQL would otherwise evaluate both the
         * clause and its negation to unknown on a {@code null} attribute.
         * </p>
         *
         * @param field clause field
         * @param path  attribute path in dot notation, e.g. {@code "id"} or {@code "submitter.name"}
         * @param type  attribute type the value is converted to
         */
        public Builder<E> attribute(String field, String path, Class<?> type) {
            requireText(path, "path");
            Objects.requireNonNull(type, "type cannot be null");

            return register(field, value -> {
                Object converted = convert(field, value, type);
                return (root, query, cb) -> {
                    Path<?> attributePath = PathResolver.resolve(root, path);
                    return cb.and(cb.isNotNull(attributePath), cb.equal(attributePath, converted));
                };
            });
        }

        /**
         * Maps {@code field:value} to the existence of an element of a collection association
         * whose attribute equals the value.
         *
         * @param field      clause field
         * @param collection name of the collection association on the entity
         * @param attribute  attribute of the collection element compared with the value
         * @param type       attribute type the value is converted to
         */
        public Builder<E> membership(String field, String collection, String attribute, Class<?> type) {
            requireText(collection, "collection");
            requireText(attribute, "attribute");
            Objects.requireNonNull(type, "type cannot be null");

            return register(field, value -> {
                Object converted = convert(field, value, type);
                return (root, query, cb) -> {
                    Subquery<Integer> subquery = query.subquery(Integer.class);
                    Root<E> correlated = subquery.correlate(root);
                    Join<E, ?> member = correlated.join(collection);
                    subquery.select(cb.literal(1))
                            .where(cb.equal(member.get(attribute), converted));
                    return cb.exists(subquery);
                };
            });
        }

        /**
         * Maps {@code field:value} with custom predicate logic.
         *
         * @param field   clause field
         * @param mapping the predicate logic, receiving the raw value
         */
        public Builder<E> mapping(String field, ClauseMapping<E> mapping) {
            Objects.requireNonNull(mapping, "mapping cannot be null");

            return register(field, value -> (root, query, cb) -> mapping.resolve(root, query, cb, value));
        }

        /**
         * @throws IllegalStateException if no field is mapped
         */
        public JpaClauseContext<E> build() {
            if (mappings.isEmpty()) {
                throw new IllegalStateException("At least one clause field must be mapped");
            }
            return new JpaClauseContext<>(entityClass, mappings);
        }

        private Builder<E> register(String field, Function<String, PredicateResolver<E>> mapping) {
            if (!Grammar.isSymbol(field) || Grammar.isKeyword(field)) {
                throw new IllegalArgumentException("Invalid clause field: " + field);
            }
            if (mappings.containsKey(field)) {
                throw new IllegalArgumentException("Clause field already mapped: " + field);
            }
            mappings.put(field, mapping);
            return this;
        }

        private static Object convert(String field, String value, Class<?> type) {
            try {
                return ClauseValueConverter.convert(type, value);
            } catch (IllegalArgumentException e) {
                throw new ClauseValueConversionException(field, value, type, e);
            }
        }

        private static void requireText(String text, String name) {
            if (text == null || text.isBlank()) {
                throw new IllegalArgumentException(name + " cannot be null or blank");
            }
        }
    }
}
