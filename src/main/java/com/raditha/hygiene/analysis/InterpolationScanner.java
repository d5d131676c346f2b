package com.raditha.hygiene.analysis;

import com.raditha.hygiene.util.Names;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tokenizes the {@code #{...}} spans of a raw string literal.
 * <p>
 * A span that is a bare identifier is an exact read. A well formed span with more structure
 * contributes every identifier-like token it contains (calls and field names excluded). A span
 * whose braces never balance cannot be understood at all and makes the whole literal a
 * wildcard: every name is then considered read.
 */
public final class InterpolationScanner {

    private static final Set<String> KEYWORDS = Set.of(
            "do", "end", "fn", "when", "in", "nil", "true", "false", "not", "and", "or",
            "if", "unless", "case", "cond", "else", "after", "catch", "rescue", "try", "with", "for");

    private InterpolationScanner() {
        /* this is only a utility class */
    }

    /**
     * One {@code #{...}} span: offsets of the contents (without the delimiters) in the raw string.
     */
    public record Span(int start, int end, String text, boolean wellFormed) {
        public boolean isBareIdentifier() {
            return wellFormed && Names.isVariableName(text.strip());
        }
    }

    /**
     * Reads found in one string literal.
     *
     * @param names    identifiers the interpolations read
     * @param wildcard true when some span could not be parsed
     */
    public record Result(Set<String> names, boolean wildcard) {
        public static final Result EMPTY = new Result(Set.of(), false);
    }

    public static List<Span> spans(String raw) {
        List<Span> spans = new ArrayList<>();
        int i = 0;
        while (i < raw.length() - 1) {
            char c = raw.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '#' && raw.charAt(i + 1) == '{') {
                int start = i + 2;
                int end = findClose(raw, start);
                if (end < 0) {
                    spans.add(new Span(start, raw.length(), raw.substring(start), false));
                    return spans;
                }
                spans.add(new Span(start, end, raw.substring(start, end), true));
                i = end + 1;
                continue;
            }
            i++;
        }
        return spans;
    }

    /**
     * Index of the brace closing the span that starts at {@code from}, or -1.
     * Nested braces and quoted strings inside the span are skipped.
     */
    private static int findClose(String raw, int from) {
        int depth = 0;
        for (int i = from; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\\') {
                i++;
                continue;
            }
            if (c == '"') {
                int quote = closingQuote(raw, i);
                if (quote < 0) {
                    return -1;
                }
                i = quote;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }

    /**
     * Index of the quote ending the string literal opened at {@code open}, or -1. Interpolations
     * nested in that literal may contain quotes of their own.
     */
    private static int closingQuote(String text, int open) {
        for (int i = open + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
                continue;
            }
            if (c == '#' && i + 1 < text.length() && text.charAt(i + 1) == '{') {
                int end = findClose(text, i + 2);
                if (end < 0) {
                    return -1;
                }
                i = end;
            } else if (c == '"') {
                return i;
            }
        }
        return -1;
    }

    public static Result scan(String raw) {
        if (!raw.contains("#{")) {
            return Result.EMPTY;
        }
        Set<String> names = new LinkedHashSet<>();
        boolean wildcard = false;
        for (Span span : spans(raw)) {
            if (!span.wellFormed()) {
                wildcard = true;
            } else if (span.isBareIdentifier()) {
                names.add(span.text().strip());
            } else if (collect(span.text(), names)) {
                wildcard = true;
            }
        }
        return new Result(names, wildcard);
    }

    /**
     * Adds the variable-like tokens of an expression fragment to {@code names}. Tokens after a
     * dot, after a colon, before an opening parenthesis, and keywords are skipped. String
     * literals inside the fragment contribute the reads of their own interpolations.
     *
     * @return true when some nested literal could not be parsed
     */
    private static boolean collect(String text, Set<String> names) {
        boolean wildcard = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"') {
                int quote = closingQuote(text, i);
                if (quote < 0) {
                    return true;
                }
                Result nested = scan(text.substring(i + 1, quote));
                names.addAll(nested.names());
                wildcard |= nested.wildcard();
                i = quote + 1;
                continue;
            }
            if (Names.isIdentStart(c) && (i == 0 || !Names.isIdentChar(text.charAt(i - 1)))) {
                int j = i + 1;
                while (j < text.length() && Names.isIdentChar(text.charAt(j))) {
                    j++;
                }
                String token = text.substring(i, j);
                char before = i > 0 ? text.charAt(i - 1) : ' ';
                boolean afterDot = before == '.' && !(i > 1 && text.charAt(i - 2) == '.');
                boolean isAtom = before == ':';
                boolean isCall = j < text.length() && text.charAt(j) == '(';
                boolean isKeywordKey = j < text.length() - 1 && text.charAt(j) == ':' && text.charAt(j + 1) == ' ';
                if (!afterDot && !isAtom && !isCall && !isKeywordKey && !KEYWORDS.contains(token)) {
                    names.add(token);
                }
                i = j;
                continue;
            }
            i++;
        }
        return wildcard;
    }

    /**
     * Rename variable {@code from} to {@code to} inside every span of {@code raw}.
     *
     * @return the new raw text, or empty when a malformed span mentions {@code from}
     */
    public static Optional<String> rename(String raw, String from, String to) {
        List<Span> spans = spans(raw);
        if (spans.isEmpty()) {
            return Optional.of(raw);
        }
        StringBuilder sb = new StringBuilder();
        int last = 0;
        for (Span span : spans) {
            if (!span.wellFormed()) {
                if (OpaqueFragmentScanner.mentions(span.text(), from)) {
                    return Optional.empty();
                }
                continue;
            }
            Optional<String> renamed = renameCode(span.text(), from, to);
            if (renamed.isEmpty()) {
                return Optional.empty();
            }
            sb.append(raw, last, span.start());
            sb.append(renamed.get());
            last = span.end();
        }
        sb.append(raw.substring(last));
        return Optional.of(sb.toString());
    }

    /**
     * Rename inside the code of one span. Plain text of nested string literals is kept; only
     * their interpolations are renamed.
     */
    private static Optional<String> renameCode(String code, String from, String to) {
        StringBuilder sb = new StringBuilder();
        int last = 0;
        int i = 0;
        while (i < code.length()) {
            if (code.charAt(i) != '"') {
                i++;
                continue;
            }
            int quote = closingQuote(code, i);
            if (quote < 0) {
                return Optional.empty();
            }
            Optional<String> nested = rename(code.substring(i + 1, quote), from, to);
            if (nested.isEmpty()) {
                return Optional.empty();
            }
            sb.append(OpaqueFragmentScanner.replaceToken(code.substring(last, i), from, to));
            sb.append('"').append(nested.get()).append('"');
            i = quote + 1;
            last = i;
        }
        sb.append(OpaqueFragmentScanner.replaceToken(code.substring(last), from, to));
        return Optional.of(sb.toString());
    }
}
