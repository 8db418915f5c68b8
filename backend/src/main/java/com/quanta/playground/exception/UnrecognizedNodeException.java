package com.quanta.playground.exception;

/**
 * The code generator met a node it has no rendering for. Only reachable when
 * the AST and the generator fall out of step.
 */
public class UnrecognizedNodeException extends IllegalStateException {

    public UnrecognizedNodeException(String message) {
        super(message);
    }
}
