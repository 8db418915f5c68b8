package com.quanta.playground.compiler;

public enum TokenKind {
    KEYWORD, IDENTIFIER, NUMBER, STRING, OPERATOR
}
