package com.quanta.playground.exception;

public class UnterminatedStringException extends CompilationException {

    private final int offset;

    public UnterminatedStringException(int offset) {
        super("Unterminated string literal starting at position " + offset);
        this.offset = offset;
    }

    /**
     * Offset of the opening quote.
     */
    public int getOffset() {
        return offset;
    }
}
