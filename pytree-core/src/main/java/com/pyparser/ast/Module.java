package com.pyparser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Root of a parsed file. Creating a module indexes the whole tree into a
 * {@link SyntaxTree}, which is what gives every element its parent.
 */
public final class Module extends Scope {

    private static final Pattern FILE_NAME = Pattern.compile("([^/\\\\]*?)([/\\\\]__init__)?(\\.py|\\.so)?$");
    private static final Pattern ABI_TAG = Pattern.compile("\\.[a-z]+-\\d{2}[mud]{0,3}$");

    private final String path;
    private final SyntaxTree syntaxTree;
    private volatile Name name;
    private volatile Map<String, List<Name>> usedNames;

    public Module(List<Element> children) {
        this(children, null);
    }

    public Module(List<Element> children, String path) {
        super(Symbol.MODULE, children);
        this.path = path;
        this.syntaxTree = new SyntaxTree(this);
    }

    @Override
    public ScopeKind kind() {
        return ScopeKind.MODULE;
    }

    public String path() {
        return path;
    }

    public SyntaxTree syntaxTree() {
        return syntaxTree;
    }

    @Override
    protected List<Element> body() {
        return children();
    }

    /**
     * The module name derived from the path: no directories, no {@code __init__}, no
     * {@code .py}/{@code .so} and no ABI tag. Located at {@code (1, 0)}; empty without a path.
     */
    public Name name() {
        Name result = name;
        if (result == null) {
            result = new Name(moduleName(path), Position.START, "");
            name = result;
        }
        return result;
    }

    static String moduleName(String path) {
        if (path == null) {
            return "";
        }
        Matcher matcher = FILE_NAME.matcher(path);
        if (!matcher.find()) {
            return "";
        }
        return ABI_TAG.matcher(matcher.group(1)).replaceFirst("");
    }

    /**
     * True if the module contains {@code from __future__ import absolute_import}.
     */
    public boolean hasExplicitAbsoluteImport() {
        for (Import imp : imports()) {
            List<Name> from = imp.getFromNames();
            if (from.size() != 1 || !"__future__".equals(from.get(0).value())) {
                continue;
            }
            for (ImportedName item : imp.importedNames()) {
                if ("absolute_import".equals(item.path().get(0).value())) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Names declared {@code global} inside functions of this module.
     */
    public List<Name> getGlobalNames() {
        List<Name> names = new ArrayList<>();
        for (Element element : syntaxTree.elements()) {
            if (element instanceof KeywordStatement statement && "global".equals(statement.keyword())
                    && statement.getParentUntil(Function.class) instanceof Function) {
                names.addAll(statement.globalNames());
            }
        }
        return names;
    }

    /**
     * Every name leaf of the module grouped by its text, in source order.
     */
    public Map<String, List<Name>> usedNames() {
        Map<String, List<Name>> result = usedNames;
        if (result == null) {
            Map<String, List<Name>> names = new LinkedHashMap<>();
            for (Leaf leaf : leaves()) {
                if (leaf instanceof Name n) {
                    names.computeIfAbsent(n.value(), k -> new ArrayList<>()).add(n);
                }
            }
            for (Map.Entry<String, List<Name>> entry : names.entrySet()) {
                entry.setValue(Collections.unmodifiableList(entry.getValue()));
            }
            result = Collections.unmodifiableMap(names);
            usedNames = result;
        }
        return result;
    }

    /**
     * The deepest scope whose extent contains {@code position}; this module if none.
     */
    public Scope getInnermostScope(Position position) {
        Scope innermost = this;
        Element current = this;
        while (current instanceof Node node) {
            Element next = null;
            for (Element child : node.children()) {
                if (child.start().compareTo(position) <= 0 && position.isBefore(child.end())) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                // the position sits exactly at an end, e.g. after the last token of the file
                for (Element child : node.children()) {
                    if (child.contains(position)) {
                        next = child;
                    }
                }
            }
            if (next == null) {
                break;
            }
            if (next instanceof Scope scope) {
                innermost = scope;
            }
            current = next;
        }
        return innermost;
    }

    /**
     * Visible names from the innermost scope at {@code position} outwards to this module.
     * Plain flow segments are skipped since their names belong to the enclosing scope;
     * comprehensions are included. A null position lists every scope's names unfiltered,
     * starting at the module.
     */
    public List<ScopeNames> scopeNamesGenerator(Position position) {
        List<ScopeNames> result = new ArrayList<>();
        Scope scope = position == null ? this : getInnermostScope(position);
        while (scope != null) {
            if (!(scope instanceof Flow) || scope instanceof ListComprehension) {
                result.add(scope.namesAt(position));
            }
            scope = scope.getParentScope();
        }
        return result;
    }
}
