package com.pyparser.ast;

public enum ScopeKind {
    MODULE,
    CLASS,
    FUNCTION,
    FLOW
}
