package com.pyparser.ast;

import java.util.List;

/**
 * {@code @expression NEWLINE}.
 */
public class Decorator extends Node {

    public Decorator(List<Element> children) {
        super(Symbol.DECORATOR, children);
    }

    public Element expression() {
        return childCount() > 1 && !(child(1) instanceof Whitespace) ? child(1) : null;
    }
}
