package com.pyparser.json;

import com.pyparser.ast.Element;

/**
 * Writes syntax tree elements as JSON.
 */
public interface TreeJsonSerializer {

    /**
     * Serializes an element and its subtree.
     *
     * @param element a leaf, a node or a whole module
     * @return the compact JSON text
     * @throws TreeJsonException if serialization fails
     */
    String serialize(Element element) throws TreeJsonException;

    /**
     * Same as {@link #serialize(Element)}, indented.
     *
     * @throws TreeJsonException if serialization fails
     */
    String serializePretty(Element element) throws TreeJsonException;
}
