package com.pyparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared shape of {@code class} and {@code def}: decorators, then an optional
 * {@code async}, the keyword and the declared name.
 */
public abstract class ClassOrFunc extends Scope {

    protected ClassOrFunc(Symbol symbol, List<Element> children) {
        super(symbol, children);
    }

    protected abstract String keyword();

    protected int keywordIndex() {
        return indexOfLeaf(keyword());
    }

    /**
     * The declared name, or null when the source omits it.
     */
    public Name name() {
        int index = keywordIndex();
        if (index >= 0 && index + 1 < childCount() && child(index + 1) instanceof Name name) {
            return name;
        }
        return null;
    }

    public List<Decorator> decorators() {
        List<Decorator> result = new ArrayList<>();
        for (Element child : children()) {
            if (!(child instanceof Decorator decorator)) {
                break;
            }
            result.add(decorator);
        }
        return result;
    }
}
