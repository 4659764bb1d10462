package com.pyparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An identifier.
 */
public final class Name extends Leaf {

    public Name(String value, Position start, String prefix) {
        super(value, start, prefix);
    }

    @Override
    public String type() {
        return "name";
    }

    /**
     * Position of this name inside nested tuple targets, outermost first. For {@code y}
     * in {@code x, (y, z) = 2, ''} this is {@code [1, 0]}.
     *
     * @throws StructuralInconsistencyException if an ancestor does not list the child it
     *         was reached from
     */
    public List<Integer> assignmentIndexes() {
        List<Integer> indexes = new ArrayList<>();
        Element compare = this;
        Element node = parent();
        while (node != null) {
            if (node instanceof Node n && isTupleSymbol(n.symbol())) {
                int found = -1;
                List<Element> children = n.children();
                for (int i = 0; i < children.size(); i++) {
                    if (children.get(i) == compare) {
                        found = i;
                        break;
                    }
                }
                if (found < 0) {
                    throw new StructuralInconsistencyException(
                        "Couldn't find the assignment of " + value() + " in " + n.type());
                }
                indexes.add(0, found / 2);
            }
            compare = node;
            node = node.parent();
        }
        return indexes;
    }

    private static boolean isTupleSymbol(Symbol symbol) {
        return symbol == Symbol.TESTLIST_COMP
            || symbol == Symbol.TESTLIST_STAR_EXPR
            || symbol == Symbol.EXPRLIST;
    }

    /**
     * The closest enclosing element that binds names: a statement, param or scope.
     */
    public Element getDefinition() {
        Element current = parent();
        while (current != null && !(current instanceof NameDefiner)) {
            current = current.parent();
        }
        return current;
    }

    public boolean isDefinition() {
        Element definition = getDefinition();
        if (definition instanceof ClassOrFunc scope && scope.name() == this) {
            return true;
        }
        if (!(definition instanceof NameDefiner definer)) {
            return false;
        }
        for (Name name : definer.getDefinedNames()) {
            if (name == this) {
                return true;
            }
        }
        return false;
    }
}
