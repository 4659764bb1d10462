package com.pyparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A comprehension or generator expression: the result expression followed by its
 * {@code for} and {@code if} clauses. It opens its own scope, so the clause targets are
 * visible to the result expression even though they come later in the source.
 */
public class ListComprehension extends ForFlow {

    public ListComprehension(List<Element> children) {
        super(Symbol.LIST_COMPREHENSION, children);
    }

    /**
     * The result expression.
     */
    public Element stmt() {
        return child(0);
    }

    /**
     * The {@code comp_for} and {@code comp_if} clauses in source order.
     */
    public List<Node> clauses() {
        List<Node> result = new ArrayList<>();
        for (int i = 1; i < childCount(); i++) {
            if (child(i) instanceof Node node
                    && (node.symbol() == Symbol.COMP_FOR || node.symbol() == Symbol.COMP_IF)) {
                result.add(node);
            }
        }
        return result;
    }

    private Node innermostFor() {
        Node innermost = null;
        for (Node clause : clauses()) {
            if (clause.symbol() == Symbol.COMP_FOR) {
                innermost = clause;
            }
        }
        return innermost;
    }

    private static Element clausePart(Node clause, int offset) {
        int index = clause.indexOfLeaf("for") + offset;
        if (index >= clause.childCount()) {
            return null;
        }
        Element part = clause.child(index);
        return part instanceof Keyword && (part.hasValue("in") || part.hasValue("for")) ? null : part;
    }

    /**
     * Target of the innermost {@code for} clause.
     */
    public Element middle() {
        Node clause = innermostFor();
        return clause == null ? null : clausePart(clause, 1);
    }

    /**
     * Iterable of the innermost {@code for} clause.
     */
    public Element input() {
        Node clause = innermostFor();
        if (clause == null) {
            return null;
        }
        int in = clause.indexOfLeaf("in");
        return in < 0 || in + 1 >= clause.childCount() ? null : clause.child(in + 1);
    }

    @Override
    public String command() {
        return "for";
    }

    @Override
    public Element setStmt() {
        return middle();
    }

    @Override
    public Element iterable() {
        return input();
    }

    @Override
    public List<Name> setVars() {
        List<Name> names = new ArrayList<>();
        for (Node clause : clauses()) {
            if (clause.symbol() == Symbol.COMP_FOR) {
                Element target = clausePart(clause, 1);
                if (target != null) {
                    names.addAll(AssignmentTargets.unpack(target));
                }
            }
        }
        return names;
    }

    @Override
    protected List<Element> body() {
        return List.of();
    }

    @Override
    public Flow next() {
        return null;
    }

    @Override
    public Flow previous() {
        return null;
    }

    @Override
    public List<Name> getDefinedNames() {
        return setVars();
    }

    @Override
    public List<Name> getDefinedNames(boolean internal) {
        return setVars();
    }

    /**
     * Clause targets are visible everywhere inside the comprehension, so the position
     * does not filter them.
     */
    @Override
    public ScopeNames namesAt(Position position) {
        return new ScopeNames(this, getDefinedNames());
    }
}
