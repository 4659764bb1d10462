package com.pyparser.ast;

public final class Operator extends Leaf {

    public Operator(String value, Position start, String prefix) {
        super(value, start, prefix);
    }

    @Override
    public String type() {
        return "operator";
    }
}
