package com.pyparser.ast;

import java.util.List;

/**
 * One parameter: {@code [*|**] target [: annotation] [= default]}.
 */
public class Param extends Node implements NameDefiner {

    public Param(List<Element> children) {
        super(Symbol.PARAM, children);
    }

    /**
     * 0 for plain parameters, 1 for {@code *args}, 2 for {@code **kwargs}.
     */
    public int stars() {
        Element first = child(0);
        if (first.hasValue("*")) {
            return 1;
        }
        if (first.hasValue("**")) {
            return 2;
        }
        return 0;
    }

    public Element target() {
        int index = stars() > 0 ? 1 : 0;
        if (index >= childCount()) {
            return null;
        }
        Element target = child(index);
        return target.hasValue(":") || target.hasValue("=") ? null : target;
    }

    public Name getName() {
        return target() instanceof Name name ? name : null;
    }

    public Element annotation() {
        return after(":");
    }

    public Element getDefault() {
        return after("=");
    }

    private Element after(String operator) {
        int index = indexOfLeaf(operator);
        if (index < 0 || index + 1 >= childCount()) {
            return null;
        }
        Element next = child(index + 1);
        return next instanceof Operator && (next.hasValue("=") || next.hasValue(":")) ? null : next;
    }

    /**
     * The function or lambda this parameter belongs to, or null when detached.
     */
    public Function parentFunction() {
        Element owner = getParentUntil(Function.class);
        return owner instanceof Function function ? function : null;
    }

    /**
     * Index of this parameter among the params of its function.
     */
    public int positionNr() {
        Function function = parentFunction();
        if (function == null) {
            return 0;
        }
        List<Param> params = function.params();
        for (int i = 0; i < params.size(); i++) {
            if (params.get(i) == this) {
                return i;
            }
        }
        throw new StructuralInconsistencyException("Param is not listed by its function");
    }

    @Override
    public List<Name> getDefinedNames() {
        Element target = target();
        return target == null ? List.of() : AssignmentTargets.unpack(target);
    }
}
