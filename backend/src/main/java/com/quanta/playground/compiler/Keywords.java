package com.quanta.playground.compiler;

import java.util.Set;

public final class Keywords {

    public static final String LET = "let";
    public static final String WRITE = "write";
    public static final String IF = "if";
    public static final String ELIF = "elif";
    public static final String ELSE = "else";
    public static final String END = "end";
    public static final String REPEAT = "repeat";

    public static final Set<String> ALL = Set.of(LET, WRITE, IF, ELIF, ELSE, END, REPEAT);

    private Keywords() {}

    public static boolean isKeyword(String word) {
        return ALL.contains(word);
    }
}
