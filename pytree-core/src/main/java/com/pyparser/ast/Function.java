package com.pyparser.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class Function extends ClassOrFunc {

    public static final int DEFAULT_SIGNATURE_WIDTH = 72;

    public Function(List<Element> children) {
        this(Symbol.FUNCDEF, children);
    }

    protected Function(Symbol symbol, List<Element> children) {
        super(symbol, children);
    }

    @Override
    public ScopeKind kind() {
        return ScopeKind.FUNCTION;
    }

    @Override
    protected String keyword() {
        return "def";
    }

    public boolean isAsync() {
        int index = keywordIndex();
        return index > 0 && child(index - 1).hasValue("async");
    }

    /**
     * The {@code parameters} node, or null when the source has none.
     */
    public Node parameters() {
        for (Element child : children()) {
            if (child instanceof Node node && node.symbol() == Symbol.PARAMETERS) {
                return node;
            }
        }
        return null;
    }

    public List<Param> params() {
        Node parameters = parameters();
        if (parameters == null) {
            return List.of();
        }
        List<Param> result = new ArrayList<>();
        for (Element child : parameters.children()) {
            if (child instanceof Param param) {
                result.add(param);
            }
        }
        return result;
    }

    /**
     * The return annotation after {@code ->}, or null.
     */
    public Element annotation() {
        int arrow = indexOfLeaf("->");
        if (arrow < 0 || arrow + 1 >= childCount()) {
            return null;
        }
        Element next = child(arrow + 1);
        return next.hasValue(":") ? null : next;
    }

    @Override
    public List<Name> getDefinedNames() {
        List<Name> names = new ArrayList<>(bodyDefinedNames());
        for (Param param : params()) {
            names.addAll(param.getDefinedNames());
        }
        return names;
    }

    /**
     * {@code return} statements of this function, including those nested in flows, but
     * not those of nested functions or classes.
     */
    public List<KeywordStatement> returns() {
        List<KeywordStatement> result = new ArrayList<>();
        for (Element element : bodyDescendants()) {
            if (element instanceof KeywordStatement statement && "return".equals(statement.keyword())) {
                result.add(statement);
            }
        }
        return result;
    }

    public boolean isGenerator() {
        for (Element element : bodyDescendants()) {
            if (element.hasValue("yield") && element instanceof Keyword) {
                return true;
            }
        }
        return false;
    }

    private List<Element> bodyDescendants() {
        List<Element> result = new ArrayList<>();
        Deque<Element> stack = new ArrayDeque<>();
        List<Element> body = body();
        for (int i = body.size() - 1; i >= 0; i--) {
            stack.push(body.get(i));
        }
        while (!stack.isEmpty()) {
            Element current = stack.pop();
            result.add(current);
            if (current instanceof ClassOrFunc || current instanceof Lambda) {
                continue;
            }
            if (current instanceof Node node) {
                List<Element> children = node.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }
        return result;
    }

    @Override
    protected List<Element> additionalPositionChecks() {
        List<Element> checks = new ArrayList<>(decorators());
        checks.addAll(returns());
        return checks;
    }

    /**
     * The call signature folded to lines of at most {@code width} characters.
     *
     * @param funcName the name to print instead of the declared one, or null
     */
    public String getCallSignature(int width, String funcName) {
        String name = funcName;
        if (name == null) {
            name = name() == null ? "" : name().value();
        }
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder(name).append('(');
        List<Param> params = params();
        for (int i = 0; i < params.size(); i++) {
            String code = params.get(i).getCode(false);
            if (i != params.size() - 1) {
                code += ", ";
            }
            if (line.length() + code.length() > width) {
                lines.add(line.toString().stripTrailing());
                line = new StringBuilder(code);
            } else {
                line.append(code);
            }
        }
        line.append(')');
        lines.add(line.toString());
        return String.join("\n", lines);
    }

    public String getCallSignature() {
        return getCallSignature(DEFAULT_SIGNATURE_WIDTH, null);
    }

    /**
     * The call signature followed by the docstring.
     */
    public String doc() {
        return getCallSignature() + "\n\n" + rawDoc();
    }
}
