package com.pyparser.ast;

/**
 * NEWLINE at the end of a logical line, or the empty ENDMARKER that closes a module
 * and carries its trailing whitespace as prefix.
 */
public final class Whitespace extends Leaf {

    public Whitespace(String value, Position start, String prefix) {
        super(value, start, prefix);
    }

    public boolean isEndMarker() {
        return value().isEmpty();
    }

    @Override
    protected boolean isLineTerminator() {
        return true;
    }

    @Override
    public String type() {
        return isEndMarker() ? "endmarker" : "newline";
    }
}
