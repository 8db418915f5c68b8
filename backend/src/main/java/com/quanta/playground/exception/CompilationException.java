package com.quanta.playground.exception;

/**
 * Base failure of the Quanta to Python pipeline. Raised by the tokenizer and
 * the parser; the whole compile aborts on the first one.
 */
public class CompilationException extends Exception {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
