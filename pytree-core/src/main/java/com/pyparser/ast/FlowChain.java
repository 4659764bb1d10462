package com.pyparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A compound statement as the ordered list of its segments, e.g.
 * {@code if / elif / else} or {@code try / except / finally}.
 */
public class FlowChain extends Node {

    public FlowChain(Symbol symbol, List<Element> children) {
        super(symbol, children);
        if (!symbol.isFlowChain()) {
            throw new IllegalArgumentException(symbol.grammarName() + " is not a compound statement");
        }
    }

    public Flow head() {
        return (Flow) child(0);
    }

    public List<Flow> segments() {
        List<Flow> result = new ArrayList<>();
        for (Element child : children()) {
            if (child instanceof Flow flow) {
                result.add(flow);
            }
        }
        return result;
    }

    Flow segmentAfter(Flow segment) {
        List<Flow> segments = segments();
        for (int i = 0; i < segments.size() - 1; i++) {
            if (segments.get(i) == segment) {
                return segments.get(i + 1);
            }
        }
        return null;
    }

    Flow segmentBefore(Flow segment) {
        List<Flow> segments = segments();
        for (int i = 1; i < segments.size(); i++) {
            if (segments.get(i) == segment) {
                return segments.get(i - 1);
            }
        }
        return null;
    }

    /**
     * Appends a detached segment at the end. Appending a segment that is already part of
     * this chain changes nothing.
     *
     * @throws IllegalArgumentException if the segment belongs to another tree
     */
    Flow append(Flow segment) {
        for (Element child : children()) {
            if (child == segment) {
                return segment;
            }
        }
        if (segment.tree() != null) {
            throw new IllegalArgumentException("Flow segment '" + segment.command()
                + "' at " + segment.start() + " already belongs to a tree");
        }
        appendChild(segment);
        SyntaxTree tree = tree();
        if (tree != null) {
            tree.adopt(segment, tree.indexOf(this));
        }
        return segment;
    }
}
