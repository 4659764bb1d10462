package com.pyparser.ast;

import java.util.List;

/**
 * A single token together with the whitespace and comments ({@code prefix}) before it.
 */
public abstract sealed class Leaf extends Element implements CallPathSegment
        permits Name, Literal, Operator, Keyword, Whitespace, ErrorLeaf {

    private final String value;
    private final String prefix;
    private int line;
    private int column;

    protected Leaf(String value, Position start, String prefix) {
        this.value = value;
        this.prefix = prefix == null ? "" : prefix;
        this.line = start.line();
        this.column = start.column();
    }

    public String value() {
        return value;
    }

    public String prefix() {
        return prefix;
    }

    @Override
    public Position start() {
        return new Position(line, column);
    }

    @Override
    public Position end() {
        int lastBreak = Math.max(value.lastIndexOf('\n'), value.lastIndexOf('\r'));
        if (lastBreak < 0 || lastBreak == value.length() - 1 && isLineTerminator()) {
            return new Position(line, column + value.length());
        }
        int lines = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\n' || c == '\r' && (i + 1 == value.length() || value.charAt(i + 1) != '\n')) {
                lines++;
            }
        }
        return new Position(line + lines, value.length() - lastBreak - 1);
    }

    /**
     * NEWLINE leaves stay on their own line.
     */
    protected boolean isLineTerminator() {
        return false;
    }

    @Override
    public String getCode(boolean includePrefix) {
        return includePrefix ? prefix + value : value;
    }

    @Override
    public void move(int lineOffset, int columnOffset) {
        line += lineOffset;
        column += columnOffset;
    }

    @Override
    public Leaf firstLeaf() {
        return this;
    }

    @Override
    public Leaf lastLeaf() {
        return this;
    }

    @Override
    public List<Leaf> leaves() {
        return List.of(this);
    }

    @Override
    public boolean hasValue(String text) {
        return value.equals(text);
    }

    @Override
    public String segmentText() {
        return value;
    }
}
