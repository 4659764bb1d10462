package com.pyparser.ast;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * One link of an expression chain such as {@code a.b(c)[0]}: names become {@link Call}s,
 * calls and subscripts become {@link Array}s.
 */
public abstract class StatementElement {

    private StatementElement next;
    private StatementElement previous;

    public StatementElement next() {
        return next;
    }

    public StatementElement previous() {
        return previous;
    }

    /**
     * Appends {@code element} at the end of the chain. Appending an element that is
     * already in the chain changes nothing.
     */
    public void setNext(StatementElement element) {
        StatementElement tail = this;
        while (true) {
            if (tail == element) {
                return;
            }
            if (tail.next == null) {
                break;
            }
            tail = tail.next;
        }
        tail.next = element;
        element.previous = tail;
    }

    /**
     * True if the next link calls this one, i.e. it is a tuple or no-array.
     */
    public boolean nextIsExecution() {
        return Array.isType(next, ArrayType.TUPLE, ArrayType.NOARRAY);
    }

    /**
     * The segments from this element to the end of the chain. Every iteration starts
     * over.
     */
    public Iterable<CallPathSegment> generateCallPath() {
        StatementElement first = this;
        return () -> new Iterator<>() {
            private StatementElement current = first;

            @Override
            public boolean hasNext() {
                return current != null;
            }

            @Override
            public CallPathSegment next() {
                if (current == null) {
                    throw new NoSuchElementException();
                }
                CallPathSegment segment = current.pathSegment();
                current = current.next;
                return segment;
            }
        };
    }

    protected abstract CallPathSegment pathSegment();
}
