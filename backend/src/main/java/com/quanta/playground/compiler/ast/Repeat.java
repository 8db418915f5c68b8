package com.quanta.playground.compiler.ast;

import java.util.List;
import java.util.Objects;

public record Repeat(String count, List<Statement> body) implements Statement {

    public Repeat {
        Objects.requireNonNull(count, "count");
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.REPEAT;
    }
}
