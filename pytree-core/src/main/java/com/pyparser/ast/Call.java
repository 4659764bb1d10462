package com.pyparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A name (or literal) in an expression chain.
 */
public class Call extends StatementElement {

    private final Leaf name;

    public Call(Leaf name) {
        this.name = name;
    }

    public Leaf name() {
        return name;
    }

    /**
     * The texts of this call and the directly following calls: {@code [a, b]} for
     * {@code a.b(c)}.
     */
    public List<String> names() {
        List<String> names = new ArrayList<>();
        StatementElement current = this;
        while (current instanceof Call call) {
            names.add(call.name.value());
            current = call.next();
        }
        return names;
    }

    @Override
    protected CallPathSegment pathSegment() {
        return name;
    }

    @Override
    public String toString() {
        return "<Call: " + name.value() + ">";
    }
}
