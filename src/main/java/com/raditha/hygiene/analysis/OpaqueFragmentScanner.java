package com.raditha.hygiene.analysis;

import com.raditha.hygiene.util.Names;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Token-boundary scanning of opaque code fragments.
 * <p>
 * A name is mentioned by a fragment when it occurs with no identifier character immediately
 * before or after it, so {@code count} is not found inside {@code counter} or {@code recount}.
 * Everything else (field position, atom position) still counts: the scanner over-approximates.
 */
public final class OpaqueFragmentScanner {

    /**
     * Constructs whose variable reads cannot be enumerated from the text.
     */
    private static final List<String> WILDCARD_MARKERS = List.of("binding()", "var!(", "Code.eval");

    private OpaqueFragmentScanner() {
        /* this is only a utility class */
    }

    public static boolean mentions(String code, String name) {
        if (name.isEmpty()) {
            return false;
        }
        int from = 0;
        while (true) {
            int at = code.indexOf(name, from);
            if (at < 0) {
                return false;
            }
            int end = at + name.length();
            boolean leftOk = at == 0 || !Names.isIdentChar(code.charAt(at - 1));
            boolean rightOk = end >= code.length() || !Names.isIdentChar(code.charAt(end));
            if (leftOk && rightOk) {
                return true;
            }
            from = at + 1;
        }
    }

    /**
     * True when the fragment may read variables it does not name.
     */
    public static boolean isWildcard(String code) {
        for (String marker : WILDCARD_MARKERS) {
            if (code.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Every identifier-shaped token of the fragment.
     */
    public static Set<String> tokens(String code) {
        Set<String> result = new LinkedHashSet<>();
        int i = 0;
        while (i < code.length()) {
            char c = code.charAt(i);
            if (Names.isIdentStart(c) || Character.isUpperCase(c)) {
                int j = i + 1;
                while (j < code.length() && Names.isIdentChar(code.charAt(j))) {
                    j++;
                }
                result.add(code.substring(i, j));
                i = j;
            } else {
                i++;
            }
        }
        return result;
    }

    /**
     * Replace variable occurrences of {@code from} by {@code to}. Occurrences in field, atom or
     * call position are left alone.
     */
    public static String replaceToken(String text, String from, String to) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            int at = text.indexOf(from, i);
            if (at < 0) {
                sb.append(text.substring(i));
                break;
            }
            int end = at + from.length();
            char before = at > 0 ? text.charAt(at - 1) : ' ';
            boolean leftOk = at == 0 || !Names.isIdentChar(before);
            boolean rightOk = end >= text.length() || !Names.isIdentChar(text.charAt(end));
            boolean variablePosition = before != '.' && before != ':'
                    && (end >= text.length() || text.charAt(end) != '(');
            sb.append(text, i, at);
            sb.append(leftOk && rightOk && variablePosition ? to : from);
            i = end;
        }
        return sb.toString();
    }
}
