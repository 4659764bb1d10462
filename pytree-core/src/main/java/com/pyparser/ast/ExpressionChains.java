package com.pyparser.ast;

import java.util.List;

/**
 * Turns an expression into a chain of {@link Call}s and {@link Array}s, e.g.
 * {@code a.b(c)[0]} into {@code Call(a) -> Call(b) -> Array(TUPLE) -> Array(LIST)}.
 */
public final class ExpressionChains {

    private ExpressionChains() {
    }

    /**
     * @return the first link, or null if the expression is not a chain (operators,
     *         lambdas, comparisons)
     */
    public static StatementElement build(Element expression) {
        if (expression instanceof Name || expression instanceof Literal || expression instanceof Keyword) {
            return new Call((Leaf) expression);
        }
        if (!(expression instanceof Node node)) {
            return null;
        }
        switch (node.symbol()) {
            case ATOM:
                return fromAtom(node);
            case STRINGS:
                return new Call((Leaf) node.child(0));
            case POWER:
                return fromPower(node);
            default:
                return null;
        }
    }

    private static StatementElement fromPower(Node power) {
        List<Element> children = power.children();
        int start = children.get(0).hasValue("await") ? 1 : 0;
        if (start >= children.size()) {
            return null;
        }
        StatementElement head = build(children.get(start));
        if (head == null) {
            return null;
        }
        for (int i = start + 1; i < children.size(); i++) {
            Element child = children.get(i);
            if (!(child instanceof Node trailer) || trailer.symbol() != Symbol.TRAILER) {
                break;
            }
            StatementElement link = fromTrailer(trailer);
            if (link == null) {
                break;
            }
            head.setNext(link);
        }
        return head;
    }

    private static StatementElement fromTrailer(Node trailer) {
        Element open = trailer.child(0);
        Element content = trailer.childCount() > 1 ? trailer.child(1) : null;
        if (open.hasValue(".")) {
            return content instanceof Name name ? new Call(name) : null;
        }
        if (open.hasValue("(")) {
            if (content == null || content.hasValue(")")) {
                return new Array(trailer, ArrayType.TUPLE);
            }
            if (content instanceof Node arglist && arglist.symbol() == Symbol.ARGLIST) {
                return fill(new Array(trailer, ArrayType.TUPLE), arglist.children());
            }
            return fill(new Array(trailer, ArrayType.NOARRAY), List.of(content));
        }
        Array subscript = new Array(trailer, ArrayType.LIST);
        if (content == null || content.hasValue("]")) {
            return subscript;
        }
        if (content instanceof Node list && list.symbol() == Symbol.SUBSCRIPTLIST) {
            return fill(subscript, list.children());
        }
        return fill(subscript, List.of(content));
    }

    private static StatementElement fromAtom(Node atom) {
        Element open = atom.child(0);
        Element content = atom.childCount() > 1 ? atom.child(1) : null;
        if (content != null && content.hasValue(closing(open))) {
            content = null;
        }
        if (open.hasValue("(")) {
            if (content == null) {
                return new Array(atom, ArrayType.TUPLE);
            }
            if (content instanceof Node tuple && tuple.symbol() == Symbol.TESTLIST_COMP) {
                return fill(new Array(atom, ArrayType.TUPLE), tuple.children());
            }
            return fill(new Array(atom, ArrayType.NOARRAY), List.of(content));
        }
        if (open.hasValue("[")) {
            Array list = new Array(atom, ArrayType.LIST);
            if (content instanceof Node items && items.symbol() == Symbol.TESTLIST_COMP) {
                return fill(list, items.children());
            }
            return content == null ? list : fill(list, List.of(content));
        }
        if (open.hasValue("{")) {
            return fromBraces(atom, content);
        }
        return null;
    }

    private static StatementElement fromBraces(Node atom, Element content) {
        if (content == null) {
            return new Array(atom, ArrayType.DICT);
        }
        if (content instanceof ListComprehension comprehension) {
            if (comprehension.stmt() instanceof Node entry && entry.symbol() == Symbol.DICT_ENTRY) {
                Array dict = new Array(atom, ArrayType.DICT);
                dict.addValue(entry.child(0), true);
                if (entry.childCount() > 2) {
                    dict.addValue(entry.child(2), false);
                }
                return dict;
            }
            return fill(new Array(atom, ArrayType.SET), List.of(comprehension));
        }
        if (!(content instanceof Node maker) || maker.symbol() != Symbol.DICTORSETMAKER) {
            return fill(new Array(atom, ArrayType.SET), List.of(content));
        }
        List<Element> children = maker.children();
        boolean isDict = false;
        for (Element child : children) {
            if (child.hasValue(":") || child.hasValue("**")) {
                isDict = true;
                break;
            }
        }
        Array array = new Array(atom, isDict ? ArrayType.DICT : ArrayType.SET);
        int i = 0;
        while (i < children.size()) {
            Element child = children.get(i);
            if (child.hasValue(",")) {
                i++;
            } else if (child.hasValue("**")) {
                i += 2;
            } else if (isDict && i + 2 < children.size() && children.get(i + 1).hasValue(":")) {
                array.addValue(child, true);
                array.addValue(children.get(i + 2), false);
                i += 3;
            } else {
                array.addValue(child, false);
                i++;
            }
        }
        return array;
    }

    private static Array fill(Array array, List<Element> items) {
        for (Element item : items) {
            if (!item.hasValue(",")) {
                array.addValue(item, false);
            }
        }
        return array;
    }

    private static String closing(Element open) {
        if (open.hasValue("(")) {
            return ")";
        }
        return open.hasValue("[") ? "]" : "}";
    }
}
