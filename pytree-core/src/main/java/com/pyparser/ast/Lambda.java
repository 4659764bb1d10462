package com.pyparser.ast;

import java.util.List;

/**
 * {@code lambda params: body}. Has parameters but no name and no statements.
 */
public class Lambda extends Function {

    public Lambda(List<Element> children) {
        super(Symbol.LAMBDEF, children);
    }

    @Override
    protected String keyword() {
        return "lambda";
    }

    @Override
    public Name name() {
        return null;
    }

    @Override
    protected List<Element> body() {
        return List.of();
    }

    /**
     * The expression after the colon, or null.
     */
    public Element expression() {
        int colon = indexOfLeaf(":");
        return colon >= 0 && colon + 1 < childCount() ? child(colon + 1) : null;
    }
}
