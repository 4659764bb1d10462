package com.pyparser.ast;

import java.util.Set;

/**
 * A reserved word. {@code None}, {@code True} and {@code False} are keywords too.
 */
public final class Keyword extends Leaf {

    public static final Set<String> RESERVED = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break",
        "class", "continue", "def", "del", "elif", "else", "except", "finally", "for",
        "from", "global", "if", "import", "in", "is", "lambda", "nonlocal", "not", "or",
        "pass", "raise", "return", "try", "while", "with", "yield");

    public Keyword(String value, Position start, String prefix) {
        super(value, start, prefix);
    }

    @Override
    public String type() {
        return "keyword";
    }
}
