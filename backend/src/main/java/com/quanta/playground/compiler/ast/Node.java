package com.quanta.playground.compiler.ast;

/**
 * Closed set of Quanta AST nodes. Nodes are immutable once built.
 * Expressions are not nodes: they travel as the verbatim, space-joined token
 * text and are evaluated only by the Python runtime.
 */
public sealed interface Node permits Program, Statement {

    NodeKind kind();
}
