package com.pyparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code import a.b as c, d} or {@code from ..x import y as z}.
 */
public class Import extends Node implements NameDefiner {

    public Import(Symbol symbol, List<Element> children) {
        super(symbol, children);
        if (symbol != Symbol.IMPORT_NAME && symbol != Symbol.IMPORT_FROM) {
            throw new IllegalArgumentException(symbol.grammarName() + " is not an import");
        }
    }

    public boolean isFrom() {
        return symbol() == Symbol.IMPORT_FROM;
    }

    private int importKeywordIndex() {
        return indexOfLeaf("import");
    }

    /**
     * Number of leading dots of a relative {@code from} import.
     */
    public int level() {
        if (!isFrom()) {
            return 0;
        }
        int level = 0;
        for (int i = 1; i < childCount(); i++) {
            Element child = child(i);
            if (child.hasValue(".")) {
                level++;
            } else if (child.hasValue("...")) {
                level += 3;
            } else {
                break;
            }
        }
        return level;
    }

    /**
     * The module path of a {@code from} import, empty for {@code from . import x}.
     */
    public List<Name> getFromNames() {
        List<Name> names = new ArrayList<>();
        if (!isFrom()) {
            return names;
        }
        int end = importKeywordIndex() < 0 ? childCount() : importKeywordIndex();
        for (int i = 1; i < end; i++) {
            Element child = child(i);
            if (child instanceof Name name) {
                names.add(name);
            } else if (child instanceof Node node && node.symbol() == Symbol.DOTTED_NAME) {
                names.addAll(dottedNames(node));
            }
        }
        return names;
    }

    public List<ImportedName> importedNames() {
        List<ImportedName> result = new ArrayList<>();
        int start = importKeywordIndex();
        if (start < 0) {
            return result;
        }
        for (int i = start + 1; i < childCount(); i++) {
            ImportedName item = toImportedName(child(i));
            if (item != null) {
                result.add(item);
            }
        }
        return result;
    }

    private static ImportedName toImportedName(Element element) {
        if (element instanceof Name name) {
            return new ImportedName(List.of(name), null);
        }
        if (!(element instanceof Node node)) {
            return null;
        }
        switch (node.symbol()) {
            case DOTTED_NAME:
                return new ImportedName(dottedNames(node), null);
            case DOTTED_AS_NAME:
            case IMPORT_AS_NAME:
                List<Name> path = node.child(0) instanceof Name first
                    ? List.of(first)
                    : node.child(0) instanceof Node dotted ? dottedNames(dotted) : List.of();
                if (path.isEmpty()) {
                    return null;
                }
                Element last = node.child(node.childCount() - 1);
                Name alias = node.childCount() == 3 && last instanceof Name name ? name : null;
                return new ImportedName(path, alias);
            default:
                return null;
        }
    }

    private static List<Name> dottedNames(Node dotted) {
        List<Name> names = new ArrayList<>();
        for (Element child : dotted.children()) {
            if (child instanceof Name name) {
                names.add(name);
            }
        }
        return names;
    }

    public boolean isStar() {
        int start = importKeywordIndex();
        if (!isFrom() || start < 0) {
            return false;
        }
        for (int i = start + 1; i < childCount(); i++) {
            if (child(i).hasValue("*")) {
                return true;
            }
        }
        return false;
    }

    /**
     * True for {@code import a.b} without an alias: binding {@code a} also makes
     * {@code a.b} reachable.
     */
    public boolean isNested() {
        if (isFrom()) {
            return false;
        }
        for (ImportedName item : importedNames()) {
            if (item.alias() == null && item.path().size() > 1) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when the statement has no resolvable path, e.g. {@code import} or
     * {@code from import x}.
     */
    public boolean isDefunct() {
        if (importKeywordIndex() < 0) {
            return true;
        }
        if (isFrom() && getFromNames().isEmpty() && level() == 0) {
            return true;
        }
        return importedNames().isEmpty() && !isStar();
    }

    @Override
    public List<Name> getDefinedNames() {
        if (isDefunct() || isStar()) {
            return List.of();
        }
        List<Name> names = new ArrayList<>();
        for (ImportedName item : importedNames()) {
            names.add(item.boundName());
        }
        return names;
    }

    /**
     * Full dotted paths, the {@code from} part prepended.
     */
    public List<List<Name>> paths() {
        List<List<Name>> result = new ArrayList<>();
        List<Name> from = getFromNames();
        if (isStar()) {
            result.add(from);
            return result;
        }
        for (ImportedName item : importedNames()) {
            List<Name> path = new ArrayList<>(from);
            path.addAll(item.path());
            result.add(path);
        }
        return result;
    }

    /**
     * The path a name belongs to, cut off after that name; null if unrelated.
     */
    public List<Name> pathForName(Name name) {
        for (List<Name> path : paths()) {
            for (int i = 0; i < path.size(); i++) {
                if (path.get(i) == name) {
                    return path.subList(0, i + 1);
                }
            }
        }
        for (ImportedName item : importedNames()) {
            if (item.alias() == name) {
                List<Name> path = new ArrayList<>(getFromNames());
                path.addAll(item.path());
                return path;
            }
        }
        return null;
    }

    public List<Name> getAllImportNames() {
        List<Name> names = new ArrayList<>(getFromNames());
        for (ImportedName item : importedNames()) {
            names.addAll(item.path());
            if (item.alias() != null) {
                names.add(item.alias());
            }
        }
        return names;
    }
}
