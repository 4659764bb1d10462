package com.pyparser.ast;

/**
 * A token the tokenizer could not classify: stray characters, unterminated strings.
 */
public final class ErrorLeaf extends Leaf {

    public ErrorLeaf(String value, Position start, String prefix) {
        super(value, start, prefix);
    }

    @Override
    public String type() {
        return "error_leaf";
    }
}
