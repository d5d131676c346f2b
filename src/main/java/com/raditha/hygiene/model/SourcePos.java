package com.raditha.hygiene.model;

/**
 * Source position of a node in the original (pre-lowering) program.
 * Used for diagnostics only; passes copy it onto the nodes they rebuild.
 *
 * @param file   source file name, may be empty
 * @param line   1-based line, 0 when unknown
 * @param column 1-based column, 0 when unknown
 */
public record SourcePos(String file, int line, int column) {

    public static final SourcePos UNKNOWN = new SourcePos("", 0, 0);

    public SourcePos {
        if (file == null) {
            file = "";
        }
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        return isKnown() ? String.format("%s:%d:%d", file, line, column) : "<unknown>";
    }
}
