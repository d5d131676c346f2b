package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Meta;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import org.junit.jupiter.api.Test;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class AssignmentHygienePassTest {

    private final AssignmentHygienePass pass = new AssignmentHygienePass();

    @Test
    void testOverwrittenBindingIsMarked() {
        Node before = block(assign("x", call("first")), assign("x", call("second")), call("f", var("x")));

        Node expected = block(assign("_x", call("first")), assign("x", call("second")), call("f", var("x")));
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testUnusedTupleElementIsMarked() {
        Node before = block(match(ptuple(bind("a"), bind("b")), call("pair")), call("use", var("a")));

        Node expected = block(match(ptuple(bind("a"), bind("_b")), call("pair")), call("use", var("a")));
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testReadUnderscoredBindingIsUnmarked() {
        Node before = block(assign("_t", call("load")), call("log", var("_t")), var("_t"));

        assertEquals(block(assign("t", call("load")), call("log", var("t")), var("t")), pass.apply(before));
    }

    @Test
    void testSelfUpdateKeepsBindingLive() {
        Node before = block(assign("n", num(0)), assign("n", op("+", var("n"), num(1))), var("n"));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testWildcardFragmentKeepsBinding() {
        Node before = block(assign("x", num(1)), new Raw("IO.inspect(binding())"));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testPreservedStatementIsKept() {
        Node before = block(new Match(bind("_ignore"), call("value"), Meta.of(MetaFlag.PRESERVE_NAME)),
                call("log", var("_ignore")));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testUnmarkingBlockedByLaterRebind() {
        Node before = block(assign("_t", num(1)), call("log", var("_t")), assign("t", num(2)), var("t"));

        assertSame(before, pass.apply(before));
    }
}
