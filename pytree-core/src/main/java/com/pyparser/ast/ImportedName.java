package com.pyparser.ast;

import java.util.List;

/**
 * One imported item: the dotted path and the {@code as} alias, if any.
 */
public record ImportedName(List<Name> path, Name alias) {

    public Name boundName() {
        return alias != null ? alias : path.get(0);
    }
}
