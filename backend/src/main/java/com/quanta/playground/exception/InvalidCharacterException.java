package com.quanta.playground.exception;

public class InvalidCharacterException extends CompilationException {

    private final char character;
    private final int offset;

    public InvalidCharacterException(char character, int offset) {
        super("Invalid character '" + character + "' at position " + offset);
        this.character = character;
        this.offset = offset;
    }

    public char getCharacter() {
        return character;
    }

    public int getOffset() {
        return offset;
    }
}
