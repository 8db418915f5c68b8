package com.quanta.playground.compiler;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A classified lexical unit. Tokens carry no source position.
 *
 * @param kind   token class
 * @param text   literal text; string contents without the quotes, the digit run for numbers
 * @param number parsed value of a {@link TokenKind#NUMBER} token, {@code null} for every other kind
 */
public record Token(TokenKind kind, String text, BigInteger number) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        if ((kind == TokenKind.NUMBER) != (number != null)) {
            throw new IllegalArgumentException("number value must be set exactly for NUMBER tokens");
        }
    }

    public static Token keyword(String text) {
        return new Token(TokenKind.KEYWORD, text, null);
    }

    public static Token identifier(String text) {
        return new Token(TokenKind.IDENTIFIER, text, null);
    }

    public static Token number(String digits) {
        return new Token(TokenKind.NUMBER, digits, new BigInteger(digits));
    }

    public static Token string(String contents) {
        return new Token(TokenKind.STRING, contents, null);
    }

    public static Token operator(char op) {
        return new Token(TokenKind.OPERATOR, String.valueOf(op), null);
    }

    public boolean is(TokenKind kind, String text) {
        return this.kind == kind && this.text.equals(text);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenKind.KEYWORD, keyword);
    }

    /**
     * Text of this token as it appears inside an expression.
     */
    public String render() {
        return switch (kind) {
            case STRING -> "\"" + escape(text) + "\"";
            case NUMBER -> number.toString();
            default -> text;
        };
    }

    /**
     * Quanta strings have no escapes, so a backslash or line break in the
     * contents must be escaped to stay one Python string literal.
     */
    private static String escape(String contents) {
        StringBuilder sb = new StringBuilder(contents.length());
        for (int i = 0; i < contents.length(); i++) {
            char c = contents.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return kind + " '" + text + "'";
    }
}
