package com.pyparser.ast;

import java.util.ArrayList;
import java.util.List;

public final class Scopes {

    private Scopes() {
    }

    /**
     * Drops every name that starts at or after {@code position}. A null position keeps
     * all names.
     */
    public static List<Name> filterAfterPosition(List<Name> names, Position position) {
        if (position == null) {
            return names;
        }
        List<Name> result = new ArrayList<>();
        for (Name name : names) {
            if (name.start().isBefore(position)) {
                result.add(name);
            }
        }
        return result;
    }
}
