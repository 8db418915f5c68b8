package com.quanta.playground.compiler.ast;

/**
 * What follows an {@link If} consequent: a chained {@code elif} or a terminal {@code else} block.
 */
public sealed interface Alternate extends Statement permits If, Block {}
