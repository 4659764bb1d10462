package com.pyparser.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * An inner element: a grammar symbol with at least one child. Start and end always come
 * from the first and last leaf.
 */
public non-sealed class Node extends Element {

    private final Symbol symbol;
    private final List<Element> children;

    public Node(Symbol symbol, List<Element> children) {
        if (children.isEmpty()) {
            throw new IllegalArgumentException(symbol.grammarName() + " must have at least one child");
        }
        this.symbol = symbol;
        this.children = new ArrayList<>(children);
    }

    public Symbol symbol() {
        return symbol;
    }

    @Override
    public String type() {
        return symbol.grammarName();
    }

    public List<Element> children() {
        return Collections.unmodifiableList(children);
    }

    public Element child(int i) {
        return children.get(i);
    }

    public int childCount() {
        return children.size();
    }

    void appendChild(Element child) {
        children.add(child);
    }

    /**
     * Index of the first child that is a leaf with the given text, or -1.
     */
    public int indexOfLeaf(String value) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).hasValue(value)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public Position start() {
        return firstLeaf().start();
    }

    @Override
    public Position end() {
        return lastLeaf().end();
    }

    @Override
    public Leaf firstLeaf() {
        Element current = this;
        while (current instanceof Node node) {
            current = node.children.get(0);
        }
        return (Leaf) current;
    }

    @Override
    public Leaf lastLeaf() {
        Element current = this;
        while (current instanceof Node node) {
            current = node.children.get(node.children.size() - 1);
        }
        return (Leaf) current;
    }

    @Override
    public List<Leaf> leaves() {
        List<Leaf> leaves = new ArrayList<>();
        Deque<Element> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Element current = stack.pop();
            if (current instanceof Node node) {
                for (int i = node.children.size() - 1; i >= 0; i--) {
                    stack.push(node.children.get(i));
                }
            } else {
                leaves.add((Leaf) current);
            }
        }
        return leaves;
    }

    @Override
    public String getCode(boolean includePrefix) {
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (Leaf leaf : leaves()) {
            sb.append(leaf.getCode(includePrefix || !first));
            first = false;
        }
        return sb.toString();
    }

    @Override
    public void move(int lineOffset, int columnOffset) {
        for (Leaf leaf : leaves()) {
            leaf.move(lineOffset, columnOffset);
        }
    }

    /**
     * Every descendant (excluding this node) in pre-order, without descending into
     * nested scopes. Nested scopes themselves are still returned.
     */
    protected List<Element> descendantsOutsideScopes() {
        List<Element> result = new ArrayList<>();
        Deque<Element> stack = new ArrayDeque<>();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
        while (!stack.isEmpty()) {
            Element current = stack.pop();
            result.add(current);
            if (current instanceof Node node && !current.isScope()) {
                for (int i = node.children.size() - 1; i >= 0; i--) {
                    stack.push(node.children.get(i));
                }
            }
        }
        return result;
    }
}
