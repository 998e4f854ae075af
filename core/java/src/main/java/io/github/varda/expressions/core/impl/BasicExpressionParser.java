package io.github.varda.expressions.core.impl;

import io.github.varda.expressions.core.api.ExpressionParser;
import io.github.varda.expressions.core.ast.Clause;
import io.github.varda.expressions.core.ast.Conjunction;
import io.github.varda.expressions.core.ast.Disjunction;
import io.github.varda.expressions.core.ast.Expression;
import io.github.varda.expressions.core.ast.Grouping;
import io.github.varda.expressions.core.ast.Negation;
import io.github.varda.expressions.core.ast.Tautology;
import io.github.varda.expressions.core.ast.Term;
import io.github.varda.expressions.core.config.ExpressionPolicy;
import io.github.varda.expressions.core.exception.ExpressionSyntaxException;
import io.github.varda.expressions.core.parsing.Grammar;
import io.github.varda.expressions.core.parsing.ParsingCursor;

import java.util.logging.Logger;

/**
 * Recursive descent parser for query expressions.
 * <p>
 * Terms are matched by ordered alternation, the first alternative that applies wins:
 * </p>
 * <ol>
 *   <li>{@code '(' expression ')'} → {@link Grouping}</li>
 *   <li>{@code 'not' term} → {@link Negation}</li>
 *   <li>{@code symbol ':' value} → {@link Clause}</li>
 *   <li>{@code '*'} → {@link Tautology}</li>
 * </ol>
 *
 * <h2>Grouping Rule</h2>
 * <p>
 * An expression is one term, optionally followed by a connective and the <em>entire</em>
 * recursively parsed remainder. The leftmost connective therefore becomes the outermost
 * node, whatever keywords follow:
 * </p>
 * <pre>
 * a and b or c   →  Conjunction(a, Disjunction(b, c))
 * a or b and c   →  Disjunction(a, Conjunction(b, c))
 * </pre>
 * <p>
 * {@code and} does not bind tighter than {@code or}. Any other grouping has to be written
 * with parentheses, and those are kept in the tree as {@link Grouping} nodes. Stored
 * expressions rely on this rule, so it must not be replaced by conventional precedence.
 * </p>
 *
 * <h2>Limits</h2>
 * <p>
 * The {@link ExpressionPolicy} bounds the input length and the recursion depth. Each
 * connective, grouping and negation opens one level.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * ExpressionParser parser = new BasicExpressionParser();
 * Expression expression = parser.parse("sample:1 and not group:4");
 *
 * // Strict configuration (for public APIs)
 * ExpressionParser strictParser = new BasicExpressionParser(ExpressionPolicy.strict());
 * }</pre>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public class BasicExpressionParser implements ExpressionParser {

    private static final Logger logger = Logger.getLogger(BasicExpressionParser.class.getName());

    private final ExpressionPolicy policy;

    /**
     * Default constructor using {@link ExpressionPolicy#defaults()}.
     */
    public BasicExpressionParser() {
        this(ExpressionPolicy.defaults());
    }

    /**
     * Constructor with custom limits.
     *
     * @param policy the parser limits
     * @throws IllegalArgumentException if policy is null
     */
    public BasicExpressionParser(ExpressionPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Expression policy is required");
        }
        this.policy = policy;
    }

    /**
     * @return the limits applied by this parser
     */
    public ExpressionPolicy getPolicy() {
        return policy;
    }

    @Override
    public Expression parse(String text) throws ExpressionSyntaxException {
        if (text == null || text.isBlank()) {
            throw new ExpressionSyntaxException("Query expression cannot be null or empty");
        }

        if (text.length() > policy.maxExpressionLength()) {
            throw new ExpressionSyntaxException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    text.length(), policy.maxExpressionLength(), policy.policyName()
            ));
        }

        ParsingCursor cursor = new ParsingCursor(text);
        try {
            Expression expression = parseExpression(cursor, 1);
            if (!cursor.atEnd()) {
                throw cursor.error("end of input");
            }
            logger.finer(() -> "Parsed query expression: " + text);
            return expression;
        } catch (ExpressionSyntaxException e) {
            logger.fine(() -> String.format("Rejected query expression '%s': %s", text, e.getMessage()));
            throw e;
        }
    }

    private Expression parseExpression(ParsingCursor cursor, int depth) {
        checkDepth(cursor, depth);

        Term term = parseTerm(cursor, depth);

        if (cursor.tryKeyword(Grammar.AND)) {
            return new Expression(new Conjunction(term, parseExpression(cursor, depth + 1)));
        }
        if (cursor.tryKeyword(Grammar.OR)) {
            return new Expression(new Disjunction(term, parseExpression(cursor, depth + 1)));
        }
        return new Expression(term);
    }

    private Term parseTerm(ParsingCursor cursor, int depth) {
        if (cursor.tryChar(Grammar.GROUP_OPEN)) {
            Expression grouped = parseExpression(cursor, depth + 1);
            if (!cursor.tryChar(Grammar.GROUP_CLOSE)) {
                throw cursor.error("'" + Grammar.GROUP_CLOSE + "'");
            }
            return new Term(new Grouping(grouped));
        }

        if (cursor.tryKeyword(Grammar.NOT)) {
            checkDepth(cursor, depth + 1);
            return new Term(new Negation(parseTerm(cursor, depth + 1)));
        }

        String field = cursor.trySymbol();
        if (field != null) {
            if (!cursor.tryChar(Grammar.CLAUSE_SEPARATOR)) {
                throw cursor.error("'" + Grammar.CLAUSE_SEPARATOR + "' after field '" + field + "'");
            }
            String value = cursor.tryValue();
            if (value == null) {
                throw cursor.error("value for field '" + field + "'");
            }
            return new Term(new Clause(field, value));
        }

        if (cursor.tryChar(Grammar.TAUTOLOGY)) {
            return new Term(new Tautology());
        }

        throw cursor.error("'(', 'not', a clause or '*'");
    }

    private void checkDepth(ParsingCursor cursor, int depth) {
        if (depth > policy.maxNestingDepth()) {
            throw new ExpressionSyntaxException(String.format(
                    "Expression nested too deeply at position %d (max depth: %d). Policy applied: %s",
                    cursor.position(), policy.maxNestingDepth(), policy.policyName()
            ), cursor.input(), cursor.position());
        }
    }
}
