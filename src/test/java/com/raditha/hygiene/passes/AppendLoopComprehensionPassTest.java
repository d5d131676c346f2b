package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Generator;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class AppendLoopComprehensionPassTest {

    private final AppendLoopComprehensionPass pass = new AppendLoopComprehensionPass();

    private static Node appendReduce() {
        return remote("Enum", "reduce", var("xs"), var("acc"),
                fn2("x", "acc", op("++", var("acc"), list(call("f", var("x"))))));
    }

    private static For comprehension() {
        return new For(List.of(new Generator(bind("x"), var("xs"))), List.of(), null, call("f", var("x")));
    }

    @Test
    void testInitLoopAndReadCollapse() {
        Node before = block(call("log"), assign("acc", list()), assign("acc", appendReduce()), var("acc"));

        assertEquals(block(call("log"), comprehension()), pass.apply(before));
    }

    @Test
    void testTrailingLoopCollapses() {
        Node before = block(call("log"), assign("acc", list()), assign("acc", appendReduce()));

        assertEquals(block(call("log"), comprehension()), pass.apply(before));
    }

    @Test
    void testOtherReadsKeepTheBinding() {
        Node before = block(assign("acc", list()), assign("acc", appendReduce()), call("use", var("acc")), num(0));

        assertEquals(block(assign("acc", comprehension()), call("use", var("acc")), num(0)), pass.apply(before));
    }

    @Test
    void testExistingComprehensionLosesOnlyTheInit() {
        Node before = block(assign("acc", list()), assign("acc", comprehension()), call("use", var("acc")), num(0));

        assertEquals(block(assign("acc", comprehension()), call("use", var("acc")), num(0)), pass.apply(before));
    }

    @Test
    void testElementReadingAccumulatorIsKept() {
        Node before = block(assign("acc", list()),
                assign("acc", remote("Enum", "reduce", var("xs"), var("acc"),
                        fn2("x", "acc", op("++", var("acc"), list(call("length", var("acc"))))))),
                var("acc"));

        assertSame(before, pass.apply(before));
    }
}
