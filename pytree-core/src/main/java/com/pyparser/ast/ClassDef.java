package com.pyparser.ast;

import java.util.List;

public class ClassDef extends ClassOrFunc {

    public ClassDef(List<Element> children) {
        super(Symbol.CLASSDEF, children);
    }

    @Override
    public ScopeKind kind() {
        return ScopeKind.CLASS;
    }

    @Override
    protected String keyword() {
        return "class";
    }

    /**
     * What is written between the parentheses after the class name, or null for no
     * bases and for {@code ()}.
     */
    public Element getSuperArglist() {
        int open = indexOfLeaf("(");
        if (open < 0 || open + 1 >= childCount()) {
            return null;
        }
        Element next = child(open + 1);
        return next.hasValue(")") || next.hasValue(":") ? null : next;
    }

    /**
     * The docstring, preceded by the {@code __init__} signature when the class has one.
     */
    public String doc() {
        String doc = rawDoc();
        Name name = name();
        for (Scope subscope : subscopes()) {
            if (subscope instanceof Function function && !(function instanceof Lambda)
                    && function.name() != null && "__init__".equals(function.name().value())) {
                String signature = function.getCallSignature(Function.DEFAULT_SIGNATURE_WIDTH,
                    name == null ? "" : name.value());
                return signature + "\n\n" + doc;
            }
        }
        return doc;
    }
}
