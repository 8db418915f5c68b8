package com.quanta.playground.compiler.ast;

public enum NodeKind {
    PROGRAM, DECLARATION, PRINT, IF, REPEAT, BLOCK
}
