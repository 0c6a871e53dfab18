package me.christianrobert.cpp2py.transformation.tree;

import java.util.Objects;

/**
 * Position of a construct in the original C++ source (1-based line, 1-based column).
 * Used for diagnostics only; never part of node equality.
 */
public final class SourceLocation {

    private final int line;
    private final int column;

    public SourceLocation(int line, int column) {
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceLocation)) {
            return false;
        }
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column);
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
