package com.example.jsonapi.dispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dotted {@code include} paths folded into a tree, e.g. {@code author,author.books} becomes
 * {@code author -> books}. Children keep the order they were first requested in.
 */
final class IncludeTree {

    private final Map<String, IncludeTree> children = new LinkedHashMap<>();

    private IncludeTree() {
    }

    static IncludeTree parse(List<String> paths) {
        IncludeTree root = new IncludeTree();
        for (String path : paths) {
            IncludeTree node = root;
            for (String name : path.split("\\.", -1)) {
                node = node.children.computeIfAbsent(name, key -> new IncludeTree());
            }
        }
        return root;
    }

    Map<String, IncludeTree> children() {
        return Collections.unmodifiableMap(children);
    }

    boolean isEmpty() {
        return children.isEmpty();
    }
}
