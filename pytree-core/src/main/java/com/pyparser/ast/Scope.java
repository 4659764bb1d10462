package com.pyparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A node that owns a namespace (module, class, function) or a block inside one
 * (flow segment, comprehension).
 */
public abstract class Scope extends Node implements NameDefiner {

    private volatile String rawDoc;

    protected Scope(Symbol symbol, List<Element> children) {
        super(symbol, children);
    }

    public abstract ScopeKind kind();

    @Override
    public boolean isScope() {
        return true;
    }

    /**
     * The statements of the body: the suite's children, or nothing if the scope has no
     * suite (e.g. a missing colon).
     */
    protected List<Element> body() {
        Element last = child(childCount() - 1);
        if (last instanceof Node node && node.symbol() == Symbol.SUITE) {
            return node.children();
        }
        return List.of();
    }

    /**
     * Assignments, imports, keyword statements and flow-chain heads directly in the body.
     */
    public List<Node> statements() {
        List<Node> result = new ArrayList<>();
        for (Element element : body()) {
            if (element instanceof Node node && node.symbol() == Symbol.SIMPLE_STMT) {
                for (Element small : node.children()) {
                    if (small instanceof ExprStmt || small instanceof Import || small instanceof KeywordStatement) {
                        result.add((Node) small);
                    }
                }
            } else if (element instanceof FlowChain chain) {
                result.add(chain.head());
            }
        }
        return result;
    }

    public List<Scope> subscopes() {
        List<Scope> result = new ArrayList<>();
        for (Element element : body()) {
            if (element instanceof ClassOrFunc scope) {
                result.add(scope);
            } else if (element instanceof FlowChain chain) {
                result.add(chain.head());
            }
        }
        return result;
    }

    public List<Import> imports() {
        List<Import> result = new ArrayList<>();
        for (Node statement : statements()) {
            if (statement instanceof Import imp) {
                result.add(imp);
            }
        }
        return result;
    }

    public List<KeywordStatement> asserts() {
        List<KeywordStatement> result = new ArrayList<>();
        for (Node statement : statements()) {
            if (statement instanceof KeywordStatement keyword && "assert".equals(keyword.keyword())) {
                result.add(keyword);
            }
        }
        return result;
    }

    /**
     * Imports of this scope including those nested in flows and their later segments.
     */
    public List<Import> getImports() {
        return ownImports();
    }

    /**
     * Imports of this body and of flows nested in it, without later segments of this
     * scope's own chain.
     */
    List<Import> ownImports() {
        List<Import> result = new ArrayList<>();
        for (Node statement : statements()) {
            if (statement instanceof Import imp) {
                result.add(imp);
            } else if (statement instanceof Flow flow) {
                result.addAll(flow.getImports());
            }
        }
        return result;
    }

    @Override
    public List<Name> getDefinedNames() {
        return bodyDefinedNames();
    }

    /**
     * Names bound directly in the body. Flows do not open a namespace, so the internal
     * names of nested flow chains are included; class and function bodies are not.
     */
    protected List<Name> bodyDefinedNames() {
        List<Name> names = new ArrayList<>();
        for (Element element : body()) {
            if (element instanceof Node node && node.symbol() == Symbol.SIMPLE_STMT) {
                for (Element small : node.children()) {
                    if (small instanceof NameDefiner definer) {
                        names.addAll(definer.getDefinedNames());
                    }
                }
            } else if (element instanceof ClassOrFunc scope) {
                Name name = scope.name();
                if (name != null) {
                    names.add(name);
                }
            } else if (element instanceof FlowChain chain) {
                names.addAll(chain.head().getDefinedNames(true));
            }
        }
        return names;
    }

    /**
     * Elements besides {@link #statements()} that the position lookup should consider.
     */
    protected List<Element> additionalPositionChecks() {
        return List.of();
    }

    /**
     * The innermost statement that contains {@code position}: direct statements first
     * (flows are searched segment by segment), then subscopes.
     */
    public Element getStatementForPosition(Position position, boolean includeImports) {
        List<Element> checks = new ArrayList<>();
        for (Node statement : statements()) {
            if (includeImports || !(statement instanceof Import)) {
                checks.add(statement);
            }
        }
        checks.addAll(additionalPositionChecks());
        for (Element check : checks) {
            if (check instanceof Flow flow) {
                for (Flow segment : flow.segmentsFromHere()) {
                    Element found = segment.getStatementForPosition(position, includeImports);
                    if (found != null) {
                        return found;
                    }
                }
            } else if (check.contains(position)) {
                return check;
            }
        }
        for (Scope subscope : subscopes()) {
            if (subscope instanceof Flow) {
                continue;
            }
            if (subscope.contains(position)) {
                Element found = subscope.getStatementForPosition(position, includeImports);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    public Element getStatementForPosition(Position position) {
        return getStatementForPosition(position, false);
    }

    public ScopeNames namesAt(Position position) {
        return new ScopeNames(this, Scopes.filterAfterPosition(getDefinedNames(), position));
    }

    /**
     * This scope followed by every nested scope, depth-first, all flow segments included.
     */
    public List<Scope> walk() {
        List<Scope> result = new ArrayList<>();
        result.add(this);
        for (Scope subscope : subscopes()) {
            if (subscope instanceof Flow flow) {
                for (Flow segment : flow.segmentsFromHere()) {
                    result.addAll(segment.walk());
                }
            } else {
                result.addAll(subscope.walk());
            }
        }
        return result;
    }

    /**
     * The cleaned docstring, or an empty string.
     */
    public String rawDoc() {
        String doc = rawDoc;
        if (doc == null) {
            doc = Docstrings.cleandoc(findDocstring());
            rawDoc = doc;
        }
        return doc;
    }

    private String findDocstring() {
        for (Element element : body()) {
            if (element instanceof Whitespace) {
                continue;
            }
            if (!(element instanceof Node node) || node.symbol() != Symbol.SIMPLE_STMT
                    || !(node.child(0) instanceof ExprStmt stmt) || stmt.childCount() != 1) {
                return "";
            }
            return Docstrings.evaluate(stmt.child(0));
        }
        return "";
    }
}
