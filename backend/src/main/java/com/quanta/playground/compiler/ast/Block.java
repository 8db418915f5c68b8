package com.quanta.playground.compiler.ast;

import java.util.List;

public record Block(List<Statement> body) implements Alternate {

    public Block {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BLOCK;
    }
}
