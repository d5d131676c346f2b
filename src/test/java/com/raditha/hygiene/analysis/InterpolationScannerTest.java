package com.raditha.hygiene.analysis;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InterpolationScannerTest {

    @Test
    void testPlainStringHasNoReads() {
        assertEquals(InterpolationScanner.Result.EMPTY, InterpolationScanner.scan("hello world"));
    }

    @Test
    void testBareIdentifierIsExactRead() {
        InterpolationScanner.Result r = InterpolationScanner.scan("Hello #{name}!");

        assertEquals(Set.of("name"), r.names());
        assertFalse(r.wildcard());
    }

    @Test
    void testComplexSpanSkipsCallsFieldsAndAtoms() {
        InterpolationScanner.Result r = InterpolationScanner.scan("#{format(user.name, :upper) <> suffix}");

        assertEquals(Set.of("user", "suffix"), r.names());
    }

    @Test
    void testNestedBracesAndQuotesInsideSpan() {
        List<InterpolationScanner.Span> spans = InterpolationScanner.spans("a #{Map.get(m, \"}\")} b #{x}");

        assertEquals(2, spans.size());
        assertTrue(spans.get(0).wellFormed());
        assertEquals("x", spans.get(1).text());
    }

    @Test
    void testNestedInterpolationInsideSpanIsRead() {
        InterpolationScanner.Result r = InterpolationScanner.scan("#{if flag, do: \"x#{name}\", else: \"\"}");

        assertEquals(Set.of("flag", "name"), r.names());
        assertFalse(r.wildcard());
    }

    @Test
    void testQuotesInsideNestedInterpolation() {
        String raw = "#{if ok, do: \"#{Map.get(m, \"}\")} #{count}\"} tail #{rest}";

        List<InterpolationScanner.Span> spans = InterpolationScanner.spans(raw);

        assertEquals(2, spans.size());
        assertEquals("rest", spans.get(1).text());
        assertEquals(Set.of("ok", "m", "count", "rest"), InterpolationScanner.scan(raw).names());
    }

    @Test
    void testPlainTextOfNestedLiteralIsNotARead() {
        assertEquals(Set.of("x"), InterpolationScanner.scan("#{x <> \"count\"}").names());
    }

    @Test
    void testUnbalancedSpanIsWildcard() {
        InterpolationScanner.Result r = InterpolationScanner.scan("broken #{value");

        assertTrue(r.wildcard());
    }

    @Test
    void testEscapedInterpolationIsIgnored() {
        assertTrue(InterpolationScanner.spans("literal \\#{x}").isEmpty());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "#{x}|x|y|#{y}",
            "#{x + xs}|x|y|#{y + xs}",
            "#{foo.x}|x|y|#{foo.x}",
            "#{x(1)}|x|y|#{x(1)}",
            "no spans x|x|y|no spans x"
    })
    void testRename(String raw, String from, String to, String expected) {
        assertEquals(Optional.of(expected), InterpolationScanner.rename(raw, from, to));
    }

    @Test
    void testRenameReachesNestedInterpolationOnly() {
        String raw = "#{if x, do: \"x#{x}\", else: \"x\"}";

        assertEquals(Optional.of("#{if y, do: \"x#{y}\", else: \"x\"}"), InterpolationScanner.rename(raw, "x", "y"));
    }

    @Test
    void testRenameRefusesMalformedMention() {
        assertTrue(InterpolationScanner.rename("#{x", "x", "y").isEmpty());
        assertEquals(Optional.of("#{z"), InterpolationScanner.rename("#{z", "x", "y"));
    }
}
