package com.pyparser.ast;

import java.util.ArrayList;
import java.util.List;

final class Docstrings {

    private Docstrings() {
    }

    /**
     * Value of a string literal or implicitly concatenated strings, or "" for anything else.
     */
    static String evaluate(Element element) {
        List<Element> parts;
        if (element instanceof Literal) {
            parts = List.of(element);
        } else if (element instanceof Node node && node.symbol() == Symbol.STRINGS) {
            parts = node.children();
        } else {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Element part : parts) {
            if (!(part instanceof Literal literal) || !literal.isString()) {
                return "";
            }
            try {
                Object value = literal.eval();
                if (!(value instanceof String text)) {
                    return "";
                }
                sb.append(text);
            } catch (IllegalStateException e) {
                return "";
            }
        }
        return sb.toString();
    }

    /**
     * Strips the uniform indentation of all lines after the first, expands tabs and drops
     * blank leading and trailing lines.
     */
    static String cleandoc(String doc) {
        if (doc.isEmpty()) {
            return doc;
        }
        String[] raw = doc.replace("\t", "        ").split("\r\n|\r|\n", -1);
        List<String> lines = new ArrayList<>();
        for (String line : raw) {
            lines.add(line);
        }
        int margin = Integer.MAX_VALUE;
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            String stripped = line.stripLeading();
            if (!stripped.isEmpty()) {
                margin = Math.min(margin, line.length() - stripped.length());
            }
        }
        lines.set(0, lines.get(0).stripLeading());
        if (margin != Integer.MAX_VALUE) {
            for (int i = 1; i < lines.size(); i++) {
                String line = lines.get(i);
                lines.set(i, line.length() >= margin ? line.substring(margin) : line.stripLeading());
            }
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        while (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        return String.join("\n", lines);
    }
}
