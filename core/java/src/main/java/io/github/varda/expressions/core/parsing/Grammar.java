package io.github.varda.expressions.core.parsing;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical rules of the query expression language.
 * <p>
 * The surface syntax is:
 * </p>
 * <pre>
 * expression := term 'and' expression
 *             | term 'or' expression
 *             | term
 * term       := '(' expression ')'
 *             | 'not' term
 *             | symbol ':' value
 *             | '*'
 * symbol     := [A-Za-z][A-Za-z0-9._-]*     (not a keyword)
 * value      := [^()\s]+
 * </pre>
 * <p>
 * {@code \s} is whatever {@link #isWhitespace(char)} accepts, Unicode spaces included, both
 * between tokens and inside values. Whitespace between tokens is insignificant. There are no precedence
 * declarations: how connectives group follows from the parsing algorithm in
 * {@link io.github.varda.expressions.core.impl.BasicExpressionParser}.
 * </p>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public final class Grammar {

    public static final String AND = "and";
    public static final String OR = "or";
    public static final String NOT = "not";

    /**
     * Reserved words that can never be used as a clause field.
     */
    public static final Set<String> KEYWORDS = Set.of(AND, OR, NOT);

    public static final char TAUTOLOGY = '*';
    public static final char CLAUSE_SEPARATOR = ':';
    public static final char GROUP_OPEN = '(';
    public static final char GROUP_CLOSE = ')';

    /**
     * Field name a singleton query expression must use.
     */
    public static final String SAMPLE_FIELD = "sample";

    /**
     * Field name of group membership clauses.
     */
    public static final String GROUP_FIELD = "group";

    private static final char NEXT_LINE = (char) 0x85;

    static final Pattern SYMBOL_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9._-]*");

    private Grammar() {
        // Constants only
    }

    /**
     * @param text candidate field name
     * @return {@code true} if {@code text} has the shape of a symbol (keywords included)
     */
    public static boolean isSymbol(String text) {
        return text != null && SYMBOL_PATTERN.matcher(text).matches();
    }

    /**
     * @param text candidate word
     * @return {@code true} if {@code text} is one of {@link #KEYWORDS}
     */
    public static boolean isKeyword(String text) {
        return KEYWORDS.contains(text);
    }

    /**
     * @param text candidate clause value
     * @return {@code true} if {@code text} is a non-empty run without whitespace or parentheses
     */
    public static boolean isValue(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!isValueChar(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * The single whitespace definition of the language: Java whitespace, the no-break
     * spaces and {@code U+0085}.
     *
     * @param c candidate character
     * @return {@code true} if {@code c} separates tokens and can never occur in a value
     */
    public static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == NEXT_LINE;
    }

    static boolean isValueChar(char c) {
        return c != GROUP_OPEN && c != GROUP_CLOSE && !isWhitespace(c);
    }

    static boolean isSymbolChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                || c == '.' || c == '_' || c == '-';
    }
}
