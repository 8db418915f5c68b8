package com.quanta.playground.compiler.ast;

import java.util.List;
import java.util.Objects;

/**
 * Conditional. {@code alternate} is another {@code If} for {@code elif}, a {@link Block}
 * for {@code else}, or {@code null} when neither follows.
 */
public record If(String test, List<Statement> consequent, Alternate alternate) implements Alternate {

    public If {
        Objects.requireNonNull(test, "test");
        consequent = List.copyOf(consequent);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF;
    }
}
