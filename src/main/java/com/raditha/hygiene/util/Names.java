package com.raditha.hygiene.util;

import java.util.Set;

/**
 * Identifier helpers for Elixir variable and function names.
 */
public final class Names {

    /**
     * Words that cannot be used as variable names.
     */
    public static final Set<String> RESERVED = Set.of(
            "end", "do", "fn", "when", "in", "nil", "true", "false", "not", "and", "or",
            "catch", "rescue", "after", "else");

    private Names() {
        /* this is only a utility class */
    }

    public static boolean isIdentChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '?' || c == '!';
    }

    public static boolean isIdentStart(char c) {
        return Character.isLowerCase(c) || c == '_';
    }

    /**
     * True for a syntactically valid variable name, e.g. {@code count}, {@code _acc}, {@code valid?}.
     */
    public static boolean isVariableName(String s) {
        if (s == null || s.isEmpty() || !isIdentStart(s.charAt(0))) {
            return false;
        }
        for (int i = 1; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean trailingMark = (c == '?' || c == '!') && i == s.length() - 1;
            if (!(Character.isLetterOrDigit(c) || c == '_' || trailingMark)) {
                return false;
            }
        }
        return !RESERVED.contains(s);
    }

    /**
     * True for {@code _name}; false for the bare wildcard {@code _}.
     */
    public static boolean isUnderscored(String name) {
        return name.length() > 1 && name.charAt(0) == '_';
    }

    public static boolean isWildcard(String name) {
        return "_".equals(name);
    }

    /** {@code _count -> count}; other names are returned unchanged. */
    public static String stripUnderscore(String name) {
        String n = name;
        while (isUnderscored(n)) {
            n = n.substring(1);
        }
        return n;
    }

    /** {@code count -> _count}; already underscored names and {@code _} are returned unchanged. */
    public static String underscore(String name) {
        if (name.startsWith("_")) {
            return name;
        }
        return "_" + name;
    }

    /**
     * camelCase to snake_case. {@code userId -> user_id}, {@code parseHTTPHeader -> parse_http_header}.
     * Leading underscores and trailing {@code ?}/{@code !} are kept.
     */
    public static String toSnakeCase(String name) {
        StringBuilder sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                boolean prevLower = i > 0 && (Character.isLowerCase(name.charAt(i - 1))
                        || Character.isDigit(name.charAt(i - 1)));
                boolean nextLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                boolean prevUpper = i > 0 && Character.isUpperCase(name.charAt(i - 1));
                if (i > 0 && name.charAt(i - 1) != '_' && (prevLower || (prevUpper && nextLower))) {
                    sb.append('_');
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static boolean hasUpperCase(String name) {
        for (int i = 0; i < name.length(); i++) {
            if (Character.isUpperCase(name.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
