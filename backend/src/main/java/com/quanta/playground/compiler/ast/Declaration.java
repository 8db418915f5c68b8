package com.quanta.playground.compiler.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code let name [= value]}. A {@code null} value means declared but uninitialized.
 */
public record Declaration(String name, String value) implements Statement {

    public Declaration {
        Objects.requireNonNull(name, "name");
    }

    public Optional<String> initializer() {
        return Optional.ofNullable(value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DECLARATION;
    }
}
