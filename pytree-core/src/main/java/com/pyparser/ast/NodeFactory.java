package com.pyparser.ast;

import java.util.List;

/**
 * Creates the typed element for a grammar symbol or leaf type. Used by the parser and
 * when rebuilding a tree from an external representation.
 */
public final class NodeFactory {

    private NodeFactory() {
    }

    public static Node create(Symbol symbol, List<Element> children) {
        return create(symbol, children, null);
    }

    /**
     * @param path only used for {@link Symbol#MODULE}
     */
    public static Node create(Symbol symbol, List<Element> children, String path) {
        switch (symbol) {
            case MODULE:
                return new Module(children, path);
            case CLASSDEF:
                return new ClassDef(children);
            case FUNCDEF:
                return new Function(children);
            case LAMBDEF:
                return new Lambda(children);
            case FLOW:
                return new Flow(children);
            case FOR_FLOW:
                return new ForFlow(children);
            case LIST_COMPREHENSION:
                return new ListComprehension(children);
            case IF_STMT:
            case WHILE_STMT:
            case FOR_STMT:
            case TRY_STMT:
            case WITH_STMT:
                return new FlowChain(symbol, children);
            case EXPR_STMT:
                return new ExprStmt(children);
            case IMPORT_NAME:
            case IMPORT_FROM:
                return new Import(symbol, children);
            case KEYWORD_STMT:
                return new KeywordStatement(children);
            case PARAM:
                return new Param(children);
            case DECORATOR:
                return new Decorator(children);
            default:
                return new Node(symbol, children);
        }
    }

    /**
     * @param type one of the values returned by {@link Leaf#type()}
     */
    public static Leaf createLeaf(String type, String value, Position start, String prefix) {
        switch (type) {
            case "name":
                return new Name(value, start, prefix);
            case "number":
            case "string":
                return new Literal(value, start, prefix);
            case "operator":
                return new Operator(value, start, prefix);
            case "keyword":
                return new Keyword(value, start, prefix);
            case "newline":
            case "endmarker":
                return new Whitespace(value, start, prefix);
            case "error_leaf":
                return new ErrorLeaf(value, start, prefix);
            default:
                throw new IllegalArgumentException("Unknown leaf type: " + type);
        }
    }
}
