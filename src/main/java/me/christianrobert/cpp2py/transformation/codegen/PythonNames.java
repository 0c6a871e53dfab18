package me.christianrobert.cpp2py.transformation.codegen;

import java.util.Set;

/**
 * Makes C++ names legal in Python: {@code ::} becomes {@code .} and names that are
 * Python keywords get a trailing underscore ({@code lambda} → {@code lambda_}).
 */
public final class PythonNames {

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    private PythonNames() {
    }

    public static String name(String name) {
        return KEYWORDS.contains(name) ? name + "_" : name;
    }

    /**
     * Dotted rendering of a possibly qualified C++ name; each segment is escaped.
     */
    public static String qualified(String name) {
        String stripped = name.startsWith("::") ? name.substring(2) : name;
        String[] segments = stripped.split("::");
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                result.append('.');
            }
            result.append(name(segments[i]));
        }
        return result.toString();
    }

    public static boolean isKeyword(String name) {
        return KEYWORDS.contains(name);
    }
}
