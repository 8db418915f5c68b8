package com.quanta.playground.compiler;

import com.quanta.playground.exception.ParseException;

import java.util.List;

/**
 * Read-only position into an immutable token list. The parser advances it
 * instead of removing tokens, so any rule can be driven from any position.
 */
public final class TokenCursor {

    private final List<Token> tokens;
    private int p;

    public TokenCursor(List<Token> tokens) {
        this(tokens, 0);
    }

    public TokenCursor(List<Token> tokens, int position) {
        if (position < 0 || position > tokens.size()) {
            throw new IndexOutOfBoundsException("cursor position " + position + " outside 0.." + tokens.size());
        }
        this.tokens = List.copyOf(tokens);
        this.p = position;
    }

    public int position() {
        return p;
    }

    public boolean atEnd() {
        return p >= tokens.size();
    }

    /**
     * Current token, or {@code null} at end of input.
     */
    public Token peek() {
        return atEnd() ? null : tokens.get(p);
    }

    public boolean peekKeyword(String keyword) {
        return !atEnd() && tokens.get(p).isKeyword(keyword);
    }

    public boolean peekKind(TokenKind kind) {
        return !atEnd() && tokens.get(p).kind() == kind;
    }

    /**
     * Consumes the current token.
     *
     * @param expected what the caller needs here, used in the error message
     */
    public Token next(String expected) throws ParseException {
        if (atEnd()) {
            throw ParseException.unexpectedEndOfInput(expected);
        }
        return tokens.get(p++);
    }

    public Token expectKeyword(String keyword) throws ParseException {
        String expected = "'" + keyword + "'";
        Token t = next(expected);
        if (!t.isKeyword(keyword)) {
            p--;
            throw ParseException.expectedToken(expected, t.toString());
        }
        return t;
    }

    public Token expectKind(TokenKind kind) throws ParseException {
        String expected = kind.name().toLowerCase();
        Token t = next(expected);
        if (t.kind() != kind) {
            p--;
            throw ParseException.expectedToken(expected, t.toString());
        }
        return t;
    }
}
