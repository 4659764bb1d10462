package com.pyparser.ast;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A bracketed value list in an expression chain: a literal tuple, list, dict or set, a
 * call's argument list or a subscript.
 *
 * <p>Dicts only support {@link #items()}; every other type only supports positional
 * access.
 */
public class Array extends StatementElement implements CallPathSegment, Iterable<Element> {

    private final Node node;
    private ArrayType type;
    private final List<Element> values = new ArrayList<>();
    private final List<Element> keys = new ArrayList<>();

    public Array(Node node, ArrayType type) {
        this.node = node;
        this.type = type;
    }

    public Node node() {
        return node;
    }

    public ArrayType type() {
        return type;
    }

    /**
     * Adds a value; adding a key turns the array into a dict.
     */
    public void addValue(Element value, boolean isKey) {
        if (isKey) {
            type = ArrayType.DICT;
            keys.add(value);
        } else {
            values.add(value);
        }
    }

    public List<Element> values() {
        return Collections.unmodifiableList(values);
    }

    public List<Element> keys() {
        return Collections.unmodifiableList(keys);
    }

    public int size() {
        return values.size();
    }

    /**
     * @throws UnsupportedOperationException for dicts
     */
    public Element get(int index) {
        if (type == ArrayType.DICT) {
            throw new UnsupportedOperationException("Dict arrays only support items()");
        }
        return values.get(index);
    }

    /**
     * @throws UnsupportedOperationException for dicts
     */
    @Override
    public Iterator<Element> iterator() {
        if (type == ArrayType.DICT) {
            throw new UnsupportedOperationException("Dict arrays only support items()");
        }
        return Collections.unmodifiableList(values).iterator();
    }

    /**
     * Key/value pairs of a dict.
     *
     * @throws UnsupportedOperationException if this is not a dict
     */
    public List<Map.Entry<Element, Element>> items() {
        if (type != ArrayType.DICT) {
            throw new UnsupportedOperationException("items() is only defined for dict arrays, not " + type);
        }
        List<Map.Entry<Element, Element>> items = new ArrayList<>();
        for (int i = 0; i < Math.min(keys.size(), values.size()); i++) {
            items.add(new AbstractMap.SimpleImmutableEntry<>(keys.get(i), values.get(i)));
        }
        return items;
    }

    /**
     * Discriminant check that is false for anything that is not an array.
     */
    public static boolean isType(StatementElement element, ArrayType... types) {
        if (!(element instanceof Array array)) {
            return false;
        }
        for (ArrayType type : types) {
            if (array.type == type) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String segmentText() {
        return node.getCode(false);
    }

    @Override
    protected CallPathSegment pathSegment() {
        return this;
    }

    @Override
    public String toString() {
        return "<Array " + type + ": " + segmentText() + ">";
    }
}
