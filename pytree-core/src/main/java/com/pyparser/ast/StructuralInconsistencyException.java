package com.pyparser.ast;

/**
 * Thrown when the tree contradicts itself, e.g. a parent link that does not match the
 * parent's children. Never raised for malformed source.
 */
public class StructuralInconsistencyException extends RuntimeException {

    public StructuralInconsistencyException(String message) {
        super(message);
    }
}
