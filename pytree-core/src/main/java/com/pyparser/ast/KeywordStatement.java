package com.pyparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A small statement introduced by a keyword: {@code pass return raise del global
 * nonlocal assert break continue}. Binds no names.
 */
public class KeywordStatement extends Node implements NameDefiner {

    public KeywordStatement(List<Element> children) {
        super(Symbol.KEYWORD_STMT, children);
    }

    public String keyword() {
        return ((Leaf) child(0)).value();
    }

    /**
     * Names listed by {@code global} or {@code nonlocal}; empty for other keywords.
     */
    public List<Name> globalNames() {
        List<Name> names = new ArrayList<>();
        if (!"global".equals(keyword()) && !"nonlocal".equals(keyword())) {
            return names;
        }
        for (Element child : children()) {
            if (child instanceof Name name) {
                names.add(name);
            }
        }
        return names;
    }

    @Override
    public List<Name> getDefinedNames() {
        return List.of();
    }
}
