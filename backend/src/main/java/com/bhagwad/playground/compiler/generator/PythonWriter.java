package com.bhagwad.playground.compiler.generator;

final class PythonWriter {

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int level;

    PythonWriter line(String text) {
        out.append(INDENT.repeat(level)).append(text).append('\n');
        return this;
    }

    PythonWriter blankLine() {
        out.append('\n');
        return this;
    }

    void indent() {
        level++;
    }

    void dedent() {
        if (level == 0) {
            throw new IllegalStateException("dedent below top level");
        }
        level--;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
