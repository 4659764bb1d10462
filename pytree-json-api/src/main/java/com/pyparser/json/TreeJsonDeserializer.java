package com.pyparser.json;

import com.pyparser.ast.Element;
import com.pyparser.ast.Module;

/**
 * Rebuilds syntax trees from JSON written by a {@link TreeJsonSerializer}.
 */
public interface TreeJsonDeserializer {

    /**
     * Reads a whole module. The returned module is fully indexed, so parents, scopes and
     * name lookups work as on a freshly parsed one.
     *
     * @param json the JSON text of a module
     * @return the module
     * @throws TreeJsonException if the text is not a serialized module
     */
    Module deserializeModule(String json) throws TreeJsonException;

    /**
     * Reads any element. Elements other than modules come back detached: they have no
     * parent until they are put into a module.
     *
     * @throws TreeJsonException if the text is not a serialized element
     */
    Element deserialize(String json) throws TreeJsonException;
}
