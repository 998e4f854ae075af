package io.github.varda.expressions.core.dispatch;

import io.github.varda.expressions.core.Expressions;
import io.github.varda.expressions.core.ast.BinaryNode;
import io.github.varda.expressions.core.ast.Clause;
import io.github.varda.expressions.core.ast.Conjunction;
import io.github.varda.expressions.core.ast.Disjunction;
import io.github.varda.expressions.core.ast.Expression;
import io.github.varda.expressions.core.ast.ExpressionNode;
import io.github.varda.expressions.core.ast.Leaf;
import io.github.varda.expressions.core.ast.Node;
import io.github.varda.expressions.core.ast.Tautology;
import io.github.varda.expressions.core.ast.Term;
import io.github.varda.expressions.core.exception.MissingVisitMethodException;
import io.github.varda.expressions.core.impl.ExpressionFixtures;
import io.github.varda.expressions.core.visitors.Identity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Visitor dispatch Tests")
class VisitorTest {

    static Stream<String> validExpressions() {
        return ExpressionFixtures.VALID_EXPRESSIONS.stream();
    }

    @Nested
    @DisplayName("Method resolution")
    class Resolution {

        @Test
        @DisplayName("Should prefer the most specific registered kind")
        void shouldPreferMostSpecificKind() {
            // Given
            Visitor<String> visitor = Visitor.<String>builder()
                    .onAny(Node.class, (node, children) -> "node")
                    .onAny(Leaf.class, (node, children) -> "leaf")
                    .onLeaf(Clause.class, node -> "clause")
                    .build();

            // Then
            assertEquals("clause", visitor.visit(new Clause("a", "1")));
            assertEquals("leaf", visitor.visit(new Tautology()));
            assertEquals("node", visitor.visit(new Term(new Tautology())));
        }

        @Test
        @DisplayName("Should resolve through the category interfaces of a kind")
        void shouldResolveCategories() {
            Visitor<String> visitor = Visitor.<String>builder()
                    .onLeaf(Leaf.class, node -> "leaf")
                    .onUnary(ExpressionNode.class, (node, expression) -> "unary(" + expression + ")")
                    .onBinary(BinaryNode.class, (node, left, right) -> left + "," + right)
                    .build();

            assertEquals("unary(unary(leaf),unary(unary(leaf)))", visitor.visit(Expressions.parse("a:1 and *")));
        }

        @Test
        @DisplayName("Should fall back to the base visitor")
        void shouldFallBackToBase() {
            // Given
            Visitor<String> base = Visitor.<String>builder()
                    .onLeaf(Tautology.class, node -> "base-tautology")
                    .onLeaf(Clause.class, node -> "base-clause")
                    .build();
            Visitor<String> derived = Visitor.extending(base)
                    .onLeaf(Clause.class, node -> "derived-clause")
                    .build();

            // Then
            assertSame(base, derived.getBase());
            assertNull(base.getBase());
            assertEquals("derived-clause", derived.visit(new Clause("a", "1")));
            assertEquals("base-tautology", derived.visit(new Tautology()));
        }

        @Test
        @DisplayName("Should try an exact kind in the base before a category in the derived visitor")
        void shouldWalkLineagePerVisitor() {
            Visitor<String> base = Visitor.<String>builder()
                    .onLeaf(Clause.class, node -> "base-clause")
                    .build();
            Visitor<String> derived = Visitor.extending(base)
                    .onAny(Node.class, (node, children) -> "derived-node")
                    .build();

            assertEquals("derived-node", derived.visit(new Clause("a", "1")));
        }

        @Test
        @DisplayName("Should throw when no method applies")
        void shouldThrowWhenNothingResolves() {
            // Given
            Visitor<String> visitor = Visitor.<String>builder()
                    .onLeaf(Clause.class, node -> "clause")
                    .build();

            // When
            MissingVisitMethodException exception = assertThrows(MissingVisitMethodException.class,
                    () -> visitor.visit(new Term(new Clause("a", "1"))));

            // Then
            assertEquals(Term.class, exception.getNodeKind());
            assertTrue(exception.getMessage().contains("Term"));
        }

        @Test
        @DisplayName("Should let a later registration replace an earlier one")
        void shouldReplaceRegistration() {
            Visitor<String> visitor = Visitor.<String>builder()
                    .onLeaf(Tautology.class, node -> "first")
                    .onLeaf(Tautology.class, node -> "second")
                    .build();

            assertEquals("second", visitor.visit(new Tautology()));
        }
    }

    @Nested
    @DisplayName("Traversal")
    class Traversal {

        @Test
        @DisplayName("Should visit children before their parent, left before right")
        void shouldVisitPostOrder() {
            // Given
            List<String> order = new ArrayList<>();
            Visitor<Void> visitor = Visitor.<Void>builder()
                    .onAny(Node.class, (node, children) -> {
                        order.add(node.getClass().getSimpleName());
                        return null;
                    })
                    .build();

            // When
            visitor.visit(Expressions.parse("a:1 or *"));

            // Then
            assertEquals(List.of("Clause", "Term", "Tautology", "Term", "Expression", "Disjunction", "Expression"),
                    order);
        }

        @Test
        @DisplayName("Should hand null child results to the parent")
        void shouldAcceptNullResults() {
            Visitor<String> visitor = Visitor.<String>builder()
                    .onLeaf(Leaf.class, node -> null)
                    .onUnary(ExpressionNode.class, (node, expression) -> expression)
                    .onBinary(BinaryNode.class, (node, left, right) -> left + "|" + right)
                    .build();

            assertEquals("null|null", visitor.visit(Expressions.parse("a:1 and b:2")));
        }

        @Test
        @DisplayName("Should reject a null node")
        void shouldRejectNull() {
            assertThrows(NullPointerException.class, () -> Identity.VISITOR.visit(null));
        }
    }

    @Nested
    @DisplayName("Extension by override")
    class Extension {

        private final Visitor<Node> switcher = Visitor.extending(Identity.VISITOR)
                .onBinary(Conjunction.class, (node, left, right) -> new Disjunction((Term) left, (Expression) right))
                .onBinary(Disjunction.class, (node, left, right) -> new Conjunction((Term) left, (Expression) right))
                .build();

        @ParameterizedTest
        @MethodSource("io.github.varda.expressions.core.dispatch.VisitorTest#validExpressions")
        @DisplayName("Should swap connectives and copy everything else")
        void shouldSwapConnectives(String text) {
            // Given
            String swapped = text.replace(" and ", " __tmp__ ").replace(" or ", " and ").replace(" __tmp__ ", " or ");

            // When
            Expression result = (Expression) switcher.visit(Expressions.parse(text));

            // Then
            assertEquals(swapped, Expressions.compose(result));
        }
    }
}
