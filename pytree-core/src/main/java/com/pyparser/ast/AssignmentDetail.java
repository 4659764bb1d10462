package com.pyparser.ast;

/**
 * One {@code target op} pair of an assignment, e.g. {@code (x, =)} in {@code x = y = 1}.
 */
public record AssignmentDetail(Element target, Operator operator) {
}
