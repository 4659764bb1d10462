package com.pyparser.ast;

/**
 * A point in the source: 1-based line, 0-based column.
 */
public record Position(int line, int column) implements Comparable<Position> {

    public static final Position START = new Position(1, 0);

    public Position shift(int lineOffset, int columnOffset) {
        return new Position(line + lineOffset, column + columnOffset);
    }

    public boolean isBefore(Position other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Position other) {
        if (line != other.line) {
            return Integer.compare(line, other.line);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
