package com.pyparser.ast;

import java.util.Locale;

/**
 * Grammar symbols of inner nodes. Expression levels only get a node when they have more
 * than one child, so {@code a} alone is a bare {@link Name}, not an {@code ATOM}.
 */
public enum Symbol {
    MODULE,
    SIMPLE_STMT,
    EXPR_STMT,
    ANNASSIGN,
    KEYWORD_STMT,
    IMPORT_NAME,
    IMPORT_FROM,
    DOTTED_NAME,
    DOTTED_AS_NAME,
    IMPORT_AS_NAME,
    DECORATOR,
    CLASSDEF,
    FUNCDEF,
    LAMBDEF,
    PARAMETERS,
    PARAM,
    SUITE,
    IF_STMT,
    WHILE_STMT,
    FOR_STMT,
    TRY_STMT,
    WITH_STMT,
    FLOW,
    FOR_FLOW,
    WITH_ITEM,
    TESTLIST_STAR_EXPR,
    EXPRLIST,
    TESTLIST_COMP,
    STAR_EXPR,
    NAMEDEXPR_TEST,
    TEST,
    OR_TEST,
    AND_TEST,
    NOT_TEST,
    COMPARISON,
    EXPR,
    XOR_EXPR,
    AND_EXPR,
    SHIFT_EXPR,
    ARITH_EXPR,
    TERM,
    FACTOR,
    POWER,
    ATOM,
    STRINGS,
    TRAILER,
    ARGLIST,
    ARGUMENT,
    SUBSCRIPTLIST,
    SUBSCRIPT,
    DICTORSETMAKER,
    DICT_ENTRY,
    LIST_COMPREHENSION,
    COMP_FOR,
    COMP_IF,
    YIELD_EXPR,
    ERROR_NODE;

    public String grammarName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Symbol fromGrammarName(String name) {
        return valueOf(name.toUpperCase(Locale.ROOT));
    }

    public boolean isFlowChain() {
        return this == IF_STMT || this == WHILE_STMT || this == FOR_STMT
            || this == TRY_STMT || this == WITH_STMT;
    }
}
