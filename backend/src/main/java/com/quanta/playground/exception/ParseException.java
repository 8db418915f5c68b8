package com.quanta.playground.exception;

public class ParseException extends CompilationException {

    public enum Kind {
        UNEXPECTED_END_OF_INPUT,
        EXPECTED_TOKEN
    }

    private final Kind kind;

    public ParseException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static ParseException unexpectedEndOfInput(String expected) {
        return new ParseException(Kind.UNEXPECTED_END_OF_INPUT,
                "Unexpected end of input, expected " + expected);
    }

    public static ParseException expectedToken(String expected, String found) {
        return new ParseException(Kind.EXPECTED_TOKEN,
                "Expected " + expected + " but got " + found);
    }

    public Kind getKind() {
        return kind;
    }
}
