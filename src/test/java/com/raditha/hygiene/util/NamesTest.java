package com.raditha.hygiene.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class NamesTest {

    @Test
    void testVariableNames() {
        assertTrue(Names.isVariableName("count"));
        assertTrue(Names.isVariableName("_acc"));
        assertTrue(Names.isVariableName("valid?"));
        assertTrue(Names.isVariableName("x1"));
        assertFalse(Names.isVariableName("Count"));
        assertFalse(Names.isVariableName("end"));
        assertFalse(Names.isVariableName("a?b"));
        assertFalse(Names.isVariableName(""));
        assertFalse(Names.isVariableName(null));
    }

    @Test
    void testUnderscoreHelpers() {
        assertTrue(Names.isUnderscored("_x"));
        assertFalse(Names.isUnderscored("_"));
        assertTrue(Names.isWildcard("_"));
        assertEquals("x", Names.stripUnderscore("__x"));
        assertEquals("_", Names.stripUnderscore("_"));
        assertEquals("_x", Names.underscore("x"));
        assertEquals("_x", Names.underscore("_x"));
    }

    @ParameterizedTest
    @CsvSource({
            "userId, user_id",
            "parseHTTPHeader, parse_http_header",
            "_tempValue, _temp_value",
            "already_snake, already_snake",
            "isValid?, is_valid?",
            "item2Count, item2_count"
    })
    void testToSnakeCase(String input, String expected) {
        assertEquals(expected, Names.toSnakeCase(input));
    }
}
