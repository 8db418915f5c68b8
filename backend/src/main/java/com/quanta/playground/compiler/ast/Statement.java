package com.quanta.playground.compiler.ast;

public sealed interface Statement extends Node permits Declaration, Print, Repeat, Alternate {}
