package io.github.eutro.ssadce.core.ssa;

import java.util.Objects;

/**
 * A position in the source that an instruction was lowered from.
 */
public final class SourceSpan {
    public final String file;
    public final int line;
    public final int column;

    public SourceSpan(String file, int line, int column) {
        this.file = file;
        this.line = line;
        this.column = column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceSpan that = (SourceSpan) o;
        return line == that.line && column == that.column && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
