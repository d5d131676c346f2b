package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import org.junit.jupiter.api.Test;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class LoopRebindToReducePassTest {

    private final LoopRebindToReducePass pass = new LoopRebindToReducePass();

    @Test
    void testEachWithOuterRebindBecomesReduce() {
        Node before = block(
                assign("total", num(0)),
                remote("Enum", "each", var("items"), fn("item", assign("total", op("+", var("total"), var("item"))))),
                var("total"));

        Node expected = block(
                assign("total", num(0)),
                assign("total", remote("Enum", "reduce", var("items"), var("total"),
                        fn2("item", "total", op("+", var("total"), var("item"))))),
                var("total"));
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testTrailingEffectKeepsAccumulatorAsResult() {
        Node before = block(
                assign("seen", list()),
                remote("Enum", "each", var("items"), fn("item", block(
                        assign("seen", op("++", var("seen"), list(var("item")))),
                        call("log", var("item"))))),
                var("seen"));

        Node expected = block(
                assign("seen", list()),
                assign("seen", remote("Enum", "reduce", var("items"), var("seen"),
                        fn2("item", "seen", block(
                                assign("seen", op("++", var("seen"), list(var("item")))),
                                call("log", var("item")),
                                var("seen"))))),
                var("seen"));
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testAccumulatorNotReadAfterLoopIsKept() {
        Node before = block(
                remote("Enum", "each", var("items"), fn("item", assign("total", op("+", var("total"), var("item"))))),
                call("done"));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testTwoRebindsAreKept() {
        Node before = block(
                remote("Enum", "each", var("items"), fn("item", block(
                        assign("a", op("+", var("a"), var("item"))),
                        assign("b", op("+", var("b"), num(1)))))),
                tuple(var("a"), var("b")));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testPlainEachIsKept() {
        Node before = block(remote("Enum", "each", var("items"), fn("item", call("log", var("item")))), call("done"));

        assertSame(before, pass.apply(before));
    }
}
