package com.quanta.playground.dto;

import com.quanta.playground.compiler.Token;

/**
 * One Quanta token as shown to the editor: its kind, its literal text and the
 * text it contributes to a generated expression.
 */
public record SyntaxToken(
    String tokenType,
    String value,
    String rendered
) {

    public static SyntaxToken from(Token token) {
        return new SyntaxToken(token.kind().name(), token.text(), token.render());
    }
}
