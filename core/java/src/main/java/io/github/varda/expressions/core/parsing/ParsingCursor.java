package io.github.varda.expressions.core.parsing;

import io.github.varda.expressions.core.exception.ExpressionSyntaxException;

import java.util.regex.Matcher;

/**
 * Scannerless read position over an expression string.
 * <p>
 * Tokens are recognized in context: what counts as a clause value depends on having
 * just read a {@code ':'}, so the cursor offers one {@code try*} method per token
 * class instead of a separate token stream. Every {@code try*} method skips leading
 * whitespace, consumes the token and returns it on a match, and leaves the position
 * untouched otherwise.
 * </p>
 * <p>
 * Instances are single-use and not thread-safe.
 * </p>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public final class ParsingCursor {

    private final String input;
    private int position;

    public ParsingCursor(String input) {
        this.input = input;
        this.position = 0;
    }

    /**
     * @return current zero-based offset in the input
     */
    public int position() {
        return position;
    }

    /**
     * @return the full input this cursor reads
     */
    public String input() {
        return input;
    }

    /**
     * Skips whitespace and reports whether the whole input has been consumed.
     *
     * @return {@code true} at end of input
     */
    public boolean atEnd() {
        skipWhitespace();
        return position >= input.length();
    }

    /**
     * Consumes {@code expected} if it is the next non-blank character.
     *
     * @param expected punctuation character to match
     * @return {@code true} if consumed
     */
    public boolean tryChar(char expected) {
        skipWhitespace();
        if (position < input.length() && input.charAt(position) == expected) {
            position++;
            return true;
        }
        return false;
    }

    /**
     * Consumes {@code keyword} if the next maximal run of symbol characters equals it.
     * <p>
     * {@code "not(x:1)"} starts with the keyword {@code not}; {@code "nots:1"} does not.
     * </p>
     *
     * @param keyword one of {@link Grammar#KEYWORDS}
     * @return {@code true} if consumed
     */
    public boolean tryKeyword(String keyword) {
        skipWhitespace();
        int end = symbolRunEnd(position);
        if (end - position == keyword.length() && input.startsWith(keyword, position)) {
            position = end;
            return true;
        }
        return false;
    }

    /**
     * Consumes a symbol that is not a keyword.
     *
     * @return the symbol, or {@code null} if none is next
     */
    public String trySymbol() {
        skipWhitespace();
        Matcher matcher = Grammar.SYMBOL_PATTERN.matcher(input).region(position, input.length());
        if (!matcher.lookingAt()) {
            return null;
        }
        String symbol = matcher.group();
        if (Grammar.isKeyword(symbol)) {
            return null;
        }
        position = matcher.end();
        return symbol;
    }

    /**
     * Consumes a clause value.
     *
     * @return the value, or {@code null} if none is next
     */
    public String tryValue() {
        skipWhitespace();
        int end = position;
        while (end < input.length() && Grammar.isValueChar(input.charAt(end))) {
            end++;
        }
        if (end == position) {
            return null;
        }
        String value = input.substring(position, end);
        position = end;
        return value;
    }

    /**
     * Builds a syntax error located at the next non-blank character.
     *
     * @param expected description of what the grammar required here
     * @return the exception, for the caller to throw
     */
    public ExpressionSyntaxException error(String expected) {
        skipWhitespace();
        String found = position >= input.length()
                ? "end of input"
                : "'" + input.charAt(position) + "'";
        return new ExpressionSyntaxException(
                String.format("Expected %s at position %d but found %s", expected, position, found),
                input, position);
    }

    private void skipWhitespace() {
        while (position < input.length() && Grammar.isWhitespace(input.charAt(position))) {
            position++;
        }
    }

    private int symbolRunEnd(int from) {
        int end = from;
        while (end < input.length() && Grammar.isSymbolChar(input.charAt(end))) {
            end++;
        }
        return end;
    }
}
