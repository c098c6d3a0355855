package com.bhagwad.playground.compiler.generator;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Escaped names always end with "__" and are never dunders or class-private; untouched names
 * never end with '_'. Internal names end with a digit and a single '_'.
 */
final class PythonNames {

    static final String ENTRY_FUNCTION = "__bhagwad_entry_";

    private static final String ESCAPE_SUFFIX = "__";
    private static final Pattern DUNDER_PREFIX = Pattern.compile("u*__.*");

    private static final Set<String> RESERVED = Set.of(
            // keywords
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return",
            "try", "while", "with", "yield",
            // builtins the generated code calls
            "print", "range", "str", "len", "int", "bool", "list", "object", "Exception",
            "staticmethod");

    private PythonNames() {
    }

    static String escape(String name) {
        if (DUNDER_PREFIX.matcher(name).matches()) {
            return "u" + name + ESCAPE_SUFFIX;
        }
        if (RESERVED.contains(name) || name.endsWith("_")) {
            return name + ESCAPE_SUFFIX;
        }
        return name;
    }

    static String internal(String stem, int serial) {
        return stem + "_" + serial + "_";
    }
}
