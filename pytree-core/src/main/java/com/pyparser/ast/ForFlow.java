package com.pyparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code for target in iterable:}.
 */
public class ForFlow extends Flow {

    public ForFlow(List<Element> children) {
        super(Symbol.FOR_FLOW, children);
    }

    protected ForFlow(Symbol symbol, List<Element> children) {
        super(symbol, children);
    }

    /**
     * The raw loop target, e.g. the exprlist in {@code for a, b in x}.
     */
    public Element setStmt() {
        int index = commandIndex() + 1;
        if (index >= childCount()) {
            return null;
        }
        Element target = child(index);
        return target.hasValue("in") || target.hasValue(":") ? null : target;
    }

    public Element iterable() {
        int in = indexOfLeaf("in");
        if (in < 0 || in + 1 >= childCount()) {
            return null;
        }
        Element next = child(in + 1);
        return next.hasValue(":") ? null : next;
    }

    @Override
    public List<Element> inputs() {
        Element iterable = iterable();
        return iterable == null ? List.of() : List.of(iterable);
    }

    @Override
    public List<Name> setVars() {
        Element target = setStmt();
        return target == null ? List.of() : AssignmentTargets.unpack(target);
    }

    @Override
    protected List<Element> additionalPositionChecks() {
        List<Element> checks = new ArrayList<>(inputs());
        Element target = setStmt();
        if (target != null) {
            checks.add(target);
        }
        return checks;
    }
}
