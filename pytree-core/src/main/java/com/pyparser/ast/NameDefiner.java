package com.pyparser.ast;

import java.util.List;

/**
 * Anything that introduces names into a namespace: scopes, assignments, imports, params.
 */
public interface NameDefiner {

    /**
     * @return the name leaves bound by this element, in source order; never null
     */
    List<Name> getDefinedNames();
}
