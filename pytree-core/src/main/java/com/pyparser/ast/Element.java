package com.pyparser.ast;

import java.util.List;

/**
 * Base of the syntax tree: either a {@link Leaf} (one token) or a {@link Node}
 * (an ordered, non-empty list of children).
 *
 * <p>Elements own their children. The upward direction is answered by the
 * {@link SyntaxTree} the element was indexed into; an element that was never indexed
 * has no parent.
 */
public abstract sealed class Element permits Leaf, Node {

    SyntaxTree tree;
    int index = -1;

    /**
     * @return the grammar name of this element, e.g. {@code "name"} or {@code "expr_stmt"}
     */
    public abstract String type();

    public abstract Position start();

    public abstract Position end();

    public abstract String getCode(boolean includePrefix);

    public String getCode() {
        return getCode(true);
    }

    /**
     * Shifts this element and everything below it.
     */
    public abstract void move(int lineOffset, int columnOffset);

    public abstract Leaf firstLeaf();

    public abstract Leaf lastLeaf();

    public abstract List<Leaf> leaves();

    /**
     * @return true if this is a leaf with exactly the given text
     */
    public boolean hasValue(String value) {
        return false;
    }

    public boolean isScope() {
        return false;
    }

    public SyntaxTree tree() {
        return tree;
    }

    public Element parent() {
        return tree == null ? null : tree.parent(this);
    }

    /**
     * @return true if {@code start <= position <= end}
     */
    public boolean contains(Position position) {
        return start().compareTo(position) <= 0 && position.compareTo(end()) <= 0;
    }

    /**
     * Nearest ancestor that opens a scope, or null for the root and detached elements.
     */
    public Scope getParentScope() {
        Element current = parent();
        while (current != null && !current.isScope()) {
            current = current.parent();
        }
        return (Scope) current;
    }

    /**
     * Walks up from this element (inclusive) until an element of one of the given types
     * is found. Returns the topmost ancestor when nothing matches.
     */
    public Element getParentUntil(Class<?>... types) {
        Element current = this;
        while (current.parent() != null) {
            for (Class<?> type : types) {
                if (type.isInstance(current)) {
                    return current;
                }
            }
            current = current.parent();
        }
        return current;
    }

    public Element nextSibling() {
        Element parent = parent();
        if (parent == null) {
            return null;
        }
        List<Element> siblings = ((Node) parent).children();
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == this) {
                return i + 1 < siblings.size() ? siblings.get(i + 1) : null;
            }
        }
        return null;
    }

    public Element prevSibling() {
        Element parent = parent();
        if (parent == null) {
            return null;
        }
        List<Element> siblings = ((Node) parent).children();
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == this) {
                return i > 0 ? siblings.get(i - 1) : null;
            }
        }
        return null;
    }

    protected String describe() {
        String code = getCode(false);
        int newline = code.indexOf('\n');
        if (newline >= 0) {
            code = code.substring(0, newline) + "...";
        }
        return "<" + getClass().getSimpleName() + ": " + code + "@" + start() + ">";
    }

    @Override
    public String toString() {
        return describe();
    }
}
