package me.christianrobert.cpp2py.transformation.type;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Lexical scopes of declared variable types, innermost first.
 * Used by the converter to annotate identifiers with their normalized C++ type.
 */
public class TypeScope {

    private final Deque<Map<String, String>> scopes = new ArrayDeque<>();

    public TypeScope() {
        scopes.push(new HashMap<>());
    }

    public void push() {
        scopes.push(new HashMap<>());
    }

    public void pop() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("Cannot pop the global scope");
        }
        scopes.pop();
    }

    public void declare(String name, String normalizedType) {
        scopes.peek().put(name, normalizedType);
    }

    /**
     * Innermost declared type of {@code name}, or null when undeclared or untyped.
     */
    public String lookup(String name) {
        for (Map<String, String> scope : scopes) {
            if (scope.containsKey(name)) {
                return scope.get(name);
            }
        }
        return null;
    }

    public int depth() {
        return scopes.size();
    }
}
