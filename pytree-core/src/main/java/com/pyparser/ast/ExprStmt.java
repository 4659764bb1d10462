package com.pyparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An expression statement, optionally an assignment:
 * {@code [target0, op0, target1, op1, ..., rhs]}. Annotated assignments are
 * {@code [target, annassign]}.
 */
public class ExprStmt extends Node implements NameDefiner {

    public ExprStmt(List<Element> children) {
        super(Symbol.EXPR_STMT, children);
    }

    public boolean isAnnotated() {
        return childCount() == 2 && child(1) instanceof Node node && node.symbol() == Symbol.ANNASSIGN;
    }

    @Override
    public List<Name> getDefinedNames() {
        if (isAnnotated()) {
            return child(0) instanceof Name name ? List.of(name) : List.of();
        }
        List<Name> names = new ArrayList<>();
        for (int i = 0; i < childCount() - 2; i += 2) {
            if (child(i + 1).hasValue("=")) {
                names.addAll(AssignmentTargets.unpack(child(i)));
            }
        }
        return names;
    }

    /**
     * The cleaned string statement that directly follows this assignment, e.g.
     * {@code "About x."} for {@code x = 1} followed by {@code """About x."""}. Empty for
     * other statements and when no string follows.
     */
    public String rawDoc() {
        if (!isAnnotated() && assignmentDetails().isEmpty()) {
            return "";
        }
        Element next = nextSibling();
        if (next != null && next.hasValue(";")) {
            next = next.nextSibling();
        } else if (next == null || next instanceof Whitespace) {
            Element line = parent();
            next = line == null ? null : line.nextSibling();
            if (next instanceof Node simple && simple.symbol() == Symbol.SIMPLE_STMT) {
                next = simple.child(0);
            }
        }
        if (!(next instanceof ExprStmt statement) || statement.childCount() != 1) {
            return "";
        }
        return Docstrings.cleandoc(Docstrings.evaluate(statement.child(0)));
    }

    /**
     * Every {@code (target, operator)} pair, left to right.
     */
    public List<AssignmentDetail> assignmentDetails() {
        List<AssignmentDetail> details = new ArrayList<>();
        for (int i = 0; i + 1 < childCount(); i += 2) {
            if (child(i + 1) instanceof Operator operator) {
                details.add(new AssignmentDetail(child(i), operator));
            }
        }
        return details;
    }

    /**
     * The right-hand side: the value of an annotated assignment (null for a bare
     * annotation), otherwise the last child.
     */
    public Element getRhs() {
        if (isAnnotated()) {
            Node annassign = (Node) child(1);
            int equals = annassign.indexOfLeaf("=");
            return equals >= 0 && equals + 1 < annassign.childCount() ? annassign.child(equals + 1) : null;
        }
        return child(childCount() - 1);
    }

    /**
     * Expression chains of the top-level comma-separated items of the right-hand side.
     */
    public List<StatementElement> expressionList() {
        Element rhs = getRhs();
        if (rhs == null) {
            return List.of();
        }
        List<Element> items = new ArrayList<>();
        if (rhs instanceof Node node && (node.symbol() == Symbol.TESTLIST_STAR_EXPR)) {
            for (Element child : node.children()) {
                if (!child.hasValue(",")) {
                    items.add(child);
                }
            }
        } else {
            items.add(rhs);
        }
        List<StatementElement> result = new ArrayList<>();
        for (Element item : items) {
            StatementElement chain = ExpressionChains.build(item);
            if (chain != null) {
                result.add(chain);
            }
        }
        return result;
    }
}
