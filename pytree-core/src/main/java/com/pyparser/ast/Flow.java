package com.pyparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * One segment of a compound statement: the keyword, its inputs, a colon and a suite.
 */
public class Flow extends Scope {

    public Flow(List<Element> children) {
        this(Symbol.FLOW, children);
    }

    protected Flow(Symbol symbol, List<Element> children) {
        super(symbol, children);
    }

    @Override
    public ScopeKind kind() {
        return ScopeKind.FLOW;
    }

    protected int commandIndex() {
        for (int i = 0; i < childCount(); i++) {
            Element child = child(i);
            if (child instanceof Keyword && !child.hasValue("async")) {
                return i;
            }
        }
        return 0;
    }

    /**
     * One of {@code if elif else while for try except finally with}.
     */
    public String command() {
        Element keyword = child(commandIndex());
        return keyword instanceof Leaf leaf ? leaf.value() : "";
    }

    public boolean isAsync() {
        return child(0).hasValue("async");
    }

    public FlowChain chain() {
        return parent() instanceof FlowChain chain ? chain : null;
    }

    public Flow next() {
        FlowChain chain = chain();
        return chain == null ? null : chain.segmentAfter(this);
    }

    public Flow previous() {
        FlowChain chain = chain();
        return chain == null ? null : chain.segmentBefore(this);
    }

    /**
     * Appends {@code next} at the end of this segment's chain and returns it.
     *
     * @throws IllegalStateException if this segment is not part of a chain
     * @throws IllegalArgumentException if {@code next} already belongs to another tree
     */
    public Flow setNext(Flow next) {
        FlowChain chain = chain();
        if (chain == null) {
            throw new IllegalStateException("Flow segment '" + command() + "' is not part of a chain");
        }
        return chain.append(next);
    }

    /**
     * Children between the command and the colon.
     */
    protected List<Element> header() {
        int colon = indexOfLeaf(":");
        int end = colon < 0 ? childCount() : colon;
        List<Element> header = new ArrayList<>();
        for (int i = commandIndex() + 1; i < end; i++) {
            Element child = child(i);
            if (!(child instanceof Node node && node.symbol() == Symbol.SUITE) && !(child instanceof Whitespace)) {
                header.add(child);
            }
        }
        return header;
    }

    /**
     * The expressions this segment evaluates: the condition of {@code if/elif/while},
     * the exception of {@code except}, the context managers of {@code with}.
     */
    public List<Element> inputs() {
        List<Element> inputs = new ArrayList<>();
        for (Element element : header()) {
            if (element.hasValue("as")) {
                break;
            }
            if (element instanceof Operator || element instanceof Node error && error.symbol() == Symbol.ERROR_NODE) {
                continue;
            }
            if (element instanceof Node item && item.symbol() == Symbol.WITH_ITEM) {
                inputs.add(item.child(0));
            } else {
                inputs.add(element);
            }
        }
        return inputs;
    }

    /**
     * Names bound by the segment header: {@code except E as name}, {@code with x as target}.
     */
    public List<Name> setVars() {
        List<Name> names = new ArrayList<>();
        List<Element> header = header();
        for (int i = 0; i < header.size(); i++) {
            Element element = header.get(i);
            if (element.hasValue("as") && i + 1 < header.size() && header.get(i + 1) instanceof Name name) {
                names.add(name);
            } else if (element instanceof Node node && node.symbol() == Symbol.WITH_ITEM && node.childCount() == 3) {
                names.addAll(AssignmentTargets.unpack(node.child(2)));
            }
        }
        return names;
    }

    /**
     * Names of the namespace this flow lives in; flows do not open one themselves.
     */
    @Override
    public List<Name> getDefinedNames() {
        Element owner = getParentUntil(ClassOrFunc.class, Module.class);
        if (owner != this && owner instanceof Scope scope) {
            return scope.getDefinedNames();
        }
        return getDefinedNames(true);
    }

    /**
     * With {@code internal}: header variables, walrus targets in the inputs, the names of
     * the following segments and the body names. Otherwise as {@link #getDefinedNames()}.
     */
    public List<Name> getDefinedNames(boolean internal) {
        if (!internal) {
            return getDefinedNames();
        }
        List<Flow> segments = segmentsFromHere();
        List<Name> names = new ArrayList<>();
        for (Flow segment : segments) {
            names.addAll(segment.setVars());
            for (Element input : segment.inputs()) {
                names.addAll(AssignmentTargets.walrusTargets(input));
            }
        }
        for (int i = segments.size() - 1; i >= 0; i--) {
            names.addAll(segments.get(i).bodyDefinedNames());
        }
        return names;
    }

    /**
     * This segment followed by the later segments of its chain.
     */
    List<Flow> segmentsFromHere() {
        FlowChain chain = chain();
        if (chain == null) {
            return List.of(this);
        }
        List<Flow> segments = chain.segments();
        for (int i = 0; i < segments.size(); i++) {
            if (segments.get(i) == this) {
                return segments.subList(i, segments.size());
            }
        }
        return List.of(this);
    }

    @Override
    public List<Import> getImports() {
        List<Import> imports = new ArrayList<>();
        for (Flow segment : segmentsFromHere()) {
            imports.addAll(segment.ownImports());
        }
        return imports;
    }

    @Override
    protected List<Element> additionalPositionChecks() {
        return inputs();
    }
}
