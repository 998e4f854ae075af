package io.github.varda.expressions.jpa;

import io.github.varda.expressions.jpa.entities.Sample;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JpaCriterionAlgebraTest {

    private final JpaCriterionAlgebra<Sample> algebra = new JpaCriterionAlgebra<>();

    private Root<Sample> root;
    private CriteriaQuery<?> query;
    private CriteriaBuilder cb;
    private Predicate left;
    private Predicate right;
    private Predicate combined;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        root = mock(Root.class);
        query = mock(CriteriaQuery.class);
        cb = mock(CriteriaBuilder.class);
        left = mock(Predicate.class);
        right = mock(Predicate.class);
        combined = mock(Predicate.class);
    }

    @Test
    void testTautology() {
        when(cb.conjunction()).thenReturn(combined);

        assertSame(combined, algebra.tautology().resolve(root, query, cb));
    }

    @Test
    void testAndOperation() {
        when(cb.and(left, right)).thenReturn(combined);

        Predicate result = algebra.and((r, q, b) -> left, (r, q, b) -> right).resolve(root, query, cb);

        assertSame(combined, result);
        verify(cb).and(left, right);
    }

    @Test
    void testOrOperation() {
        when(cb.or(left, right)).thenReturn(combined);

        Predicate result = algebra.or((r, q, b) -> left, (r, q, b) -> right).resolve(root, query, cb);

        assertSame(combined, result);
        verify(cb).or(left, right);
    }

    @Test
    void testNotOperation() {
        when(cb.not(left)).thenReturn(combined);

        assertSame(combined, algebra.not((r, q, b) -> left).resolve(root, query, cb));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCompositionIsDeferred() {
        // Given
        PredicateResolver<Sample> operand = mock(PredicateResolver.class);

        // When
        PredicateResolver<Sample> negated = algebra.not(operand);

        // Then: nothing resolved until the composed resolver is
        verifyNoInteractions(operand);
        negated.resolve(root, query, cb);
        verify(operand).resolve(root, query, cb);
    }
}
