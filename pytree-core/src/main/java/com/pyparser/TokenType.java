package com.pyparser;

public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    ENDMARKER,
    ERRORTOKEN
}
