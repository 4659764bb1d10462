package com.pyparser.ast;

/**
 * One step of a call path such as {@code a.b(c)[0]}: a name leaf or an array.
 */
public interface CallPathSegment {

    String segmentText();
}
