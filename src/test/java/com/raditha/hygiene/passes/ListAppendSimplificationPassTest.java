package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import org.junit.jupiter.api.Test;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class ListAppendSimplificationPassTest {

    private final ListAppendSimplificationPass pass = new ListAppendSimplificationPass();

    @Test
    void testEmptyOperandsDisappear() {
        assertEquals(var("xs"), pass.apply(op("++", list(), var("xs"))));
        assertEquals(var("xs"), pass.apply(op("++", var("xs"), list())));
    }

    @Test
    void testLiteralListsAreMerged() {
        Node before = op("++", op("++", list(num(1)), list(num(2))), list(var("x")));

        assertEquals(list(num(1), num(2), var("x")), pass.apply(before));
    }

    @Test
    void testDynamicAppendIsKept() {
        Node before = op("++", var("acc"), list(var("item")));

        assertSame(before, pass.apply(before));
    }
}
