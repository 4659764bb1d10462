package com.pyparser.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Arena holding every element of one parsed module. Each element gets an index; the
 * parent relation is stored here as an index array so that elements only point down.
 */
public final class SyntaxTree {

    private static final int NO_PARENT = -1;

    private record Pending(Element element, int parentIndex) {
    }

    private final List<Element> elements = new ArrayList<>();
    private int[] parents = new int[64];

    SyntaxTree(Element root) {
        adopt(root, NO_PARENT);
    }

    /**
     * Indexes {@code root} and its subtree under the element at {@code parentIndex}.
     */
    void adopt(Element root, int parentIndex) {
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(root, parentIndex));
        while (!stack.isEmpty()) {
            Pending pending = stack.pop();
            Element element = pending.element();
            int index = elements.size();
            element.tree = this;
            element.index = index;
            elements.add(element);
            if (index == parents.length) {
                parents = Arrays.copyOf(parents, parents.length * 2);
            }
            parents[index] = pending.parentIndex();
            if (element instanceof Node node) {
                List<Element> children = node.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(new Pending(children.get(i), index));
                }
            }
        }
    }

    public Element root() {
        return elements.get(0);
    }

    public int size() {
        return elements.size();
    }

    public Element get(int index) {
        return elements.get(index);
    }

    public List<Element> elements() {
        return Collections.unmodifiableList(elements);
    }

    public int indexOf(Element element) {
        return element.tree == this ? element.index : NO_PARENT;
    }

    public int parentIndex(int index) {
        return parents[index];
    }

    public Element parent(Element element) {
        if (element.tree != this) {
            return null;
        }
        int parent = parents[element.index];
        return parent == NO_PARENT ? null : elements.get(parent);
    }

    public int[] childIndexes(int index) {
        Element element = elements.get(index);
        if (!(element instanceof Node node)) {
            return new int[0];
        }
        List<Element> children = node.children();
        int[] result = new int[children.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = children.get(i).index;
        }
        return result;
    }
}
