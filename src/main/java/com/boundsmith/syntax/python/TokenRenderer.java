package com.boundsmith.syntax.python;

import org.antlr.v4.runtime.Token;

import java.util.List;
import java.util.Set;

/**
 * Renders a token range with normalized spacing, e.g. {@code len(items)},
 * {@code self.data['key']}, {@code x + 1}, {@code f(limit=3)}.
 */
final class TokenRenderer {

    private static final Set<Integer> PREFIX_OPERATORS = Set.of(
            Python3Lexer.ADD, Python3Lexer.MINUS, Python3Lexer.NOT_OP, Python3Lexer.STAR, Python3Lexer.POWER);

    private static final Set<Integer> OPERANDS = Set.of(
            Python3Lexer.NAME, Python3Lexer.NUMBER, Python3Lexer.STRING_LITERAL, Python3Lexer.FSTRING_LITERAL,
            Python3Lexer.NONE, Python3Lexer.TRUE, Python3Lexer.FALSE, Python3Lexer.ELLIPSIS,
            Python3Lexer.CLOSE_PAREN, Python3Lexer.CLOSE_BRACK, Python3Lexer.CLOSE_BRACE);

    private static final Set<Integer> OPENERS = Set.of(
            Python3Lexer.OPEN_PAREN, Python3Lexer.OPEN_BRACK, Python3Lexer.OPEN_BRACE);

    private static final Set<Integer> CLOSERS = Set.of(
            Python3Lexer.CLOSE_PAREN, Python3Lexer.CLOSE_BRACK, Python3Lexer.CLOSE_BRACE);

    private static final Set<Integer> TIGHT_AFTER = Set.of(
            Python3Lexer.OPEN_PAREN, Python3Lexer.OPEN_BRACK, Python3Lexer.OPEN_BRACE, Python3Lexer.DOT);

    private static final Set<Integer> TIGHT_BEFORE = Set.of(
            Python3Lexer.CLOSE_PAREN, Python3Lexer.CLOSE_BRACK, Python3Lexer.CLOSE_BRACE, Python3Lexer.COMMA,
            Python3Lexer.DOT, Python3Lexer.COLON, Python3Lexer.SEMI_COLON);

    private TokenRenderer() {
    }

    /**
     * @param tokens The whole token stream of the file
     * @param from Index of the first token, inclusive
     * @param to Index of the last token, inclusive
     */
    static String render(List<Token> tokens, int from, int to) {
        StringBuilder text = new StringBuilder();
        int depth = 0;
        boolean previousPrefix = false;
        Token previous = null;
        for (int i = from; i <= to; i++) {
            Token token = tokens.get(i);
            if (token.getChannel() != Token.DEFAULT_CHANNEL || token.getType() == Token.EOF) {
                continue;
            }
            if (previous != null && needsSpace(previous, previousPrefix, token, depth)) {
                text.append(' ');
            }
            text.append(token.getText());
            if (OPENERS.contains(token.getType())) {
                depth++;
            } else if (CLOSERS.contains(token.getType())) {
                depth--;
            }
            previousPrefix = PREFIX_OPERATORS.contains(token.getType())
                    && (previous == null || !OPERANDS.contains(previous.getType()));
            previous = token;
        }
        return text.toString();
    }

    private static boolean needsSpace(Token previous, boolean previousPrefix, Token token, int depth) {
        if (previousPrefix || TIGHT_AFTER.contains(previous.getType())) {
            return false;
        }
        if (TIGHT_BEFORE.contains(token.getType())) {
            return false;
        }
        if ((token.getType() == Python3Lexer.OPEN_PAREN || token.getType() == Python3Lexer.OPEN_BRACK)
                && OPERANDS.contains(previous.getType())) {
            return false;
        }
        return depth == 0 || !(token.getType() == Python3Lexer.ASSIGN || previous.getType() == Python3Lexer.ASSIGN);
    }
}
