package com.pyparser.ast;

public enum ArrayType {
    /** A parenthesized single value or a call with one argument, no trailing comma. */
    NOARRAY,
    TUPLE,
    LIST,
    DICT,
    SET
}
