package com.pyparser;

import com.pyparser.ast.Position;

/**
 * A token with the whitespace, comments and line continuations before it.
 */
public record Token(TokenType type, String value, Position start, String prefix) {

    public boolean is(TokenType expected, String text) {
        return type == expected && value.equals(text);
    }
}
