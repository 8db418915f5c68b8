package com.quanta.playground.compiler.ast;

import java.util.List;

public record Program(List<Statement> body) implements Node {

    public Program {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PROGRAM;
    }
}
