package com.pyparser.ast;

import java.util.ArrayList;
import java.util.List;

final class AssignmentTargets {

    private AssignmentTargets() {
    }

    /**
     * Names bound when assigning to {@code target}: plain names, tuple and list
     * unpacking (nested and parenthesized) and star targets. Attribute and subscript
     * targets bind nothing.
     */
    static List<Name> unpack(Element target) {
        List<Name> names = new ArrayList<>();
        collect(target, names);
        return names;
    }

    private static void collect(Element current, List<Name> names) {
        if (current instanceof Name name) {
            names.add(name);
            return;
        }
        if (!(current instanceof Node node)) {
            return;
        }
        switch (node.symbol()) {
            case TESTLIST_STAR_EXPR, TESTLIST_COMP, EXPRLIST -> {
                for (int i = 0; i < node.childCount(); i += 2) {
                    collect(node.child(i), names);
                }
            }
            case ATOM -> {
                if (node.childCount() >= 3 && (node.child(0).hasValue("(") || node.child(0).hasValue("["))) {
                    collect(node.child(1), names);
                }
            }
            case STAR_EXPR -> {
                if (node.childCount() > 1) {
                    collect(node.child(1), names);
                }
            }
            default -> {
            }
        }
    }

    /**
     * Targets of {@code name := value} expressions inside {@code expression}, not
     * looking into nested comprehensions or lambdas.
     */
    static List<Name> walrusTargets(Element expression) {
        List<Name> names = new ArrayList<>();
        if (!(expression instanceof Node node) || expression.isScope()) {
            return names;
        }
        List<Element> candidates = new ArrayList<>();
        candidates.add(node);
        candidates.addAll(node.descendantsOutsideScopes());
        for (Element candidate : candidates) {
            if (candidate instanceof Node named && named.symbol() == Symbol.NAMEDEXPR_TEST
                    && named.child(0) instanceof Name name) {
                names.add(name);
            }
        }
        return names;
    }
}
