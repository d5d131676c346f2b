package com.raditha.hygiene.model;

/**
 * The four function definition forms.
 */
public enum DefKind {
    DEF("def", false),
    DEFP("defp", true),
    DEFMACRO("defmacro", false),
    DEFMACROP("defmacrop", true);

    private final String keyword;
    private final boolean isPrivate;

    DefKind(String keyword, boolean isPrivate) {
        this.keyword = keyword;
        this.isPrivate = isPrivate;
    }

    public String keyword() {
        return keyword;
    }

    public boolean isPrivate() {
        return isPrivate;
    }

    public boolean isMacro() {
        return this == DEFMACRO || this == DEFMACROP;
    }
}
