package com.quanta.playground.compiler.ast;

import java.util.Objects;

public record Print(String expression) implements Statement {

    public Print {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PRINT;
    }
}
