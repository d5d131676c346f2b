package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Meta;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Pattern.PBind;
import org.junit.jupiter.api.Test;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class RedundantTemporaryInliningPassTest {

    private final RedundantTemporaryInliningPass pass = new RedundantTemporaryInliningPass();

    @Test
    void testTrailingTemporaryIsInlined() {
        Node before = block(call("log"), assign("result", call("compute")), var("result"));

        assertEquals(block(call("log"), call("compute")), pass.apply(before));
    }

    @Test
    void testTemporaryMovesIntoFirstArgument() {
        Node before = block(assign("t", call("load")), call("process", var("t"), var("opts")), call("done"));

        assertEquals(block(call("process", call("load"), var("opts")), call("done")), pass.apply(before));
    }

    @Test
    void testRemoteCallOnMatchValue() {
        Node before = block(
                assign("t", call("load")),
                assign("r", remote("Enum", "sort", var("t"))),
                call("use", var("opts"), var("r")));

        Node expected = block(assign("r", remote("Enum", "sort", call("load"))), call("use", var("opts"), var("r")));
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testNotFirstArgumentIsKept() {
        Node before = block(assign("t", call("load")), call("process", var("opts"), var("t")), call("done"));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testReadAgainLaterIsKept() {
        Node before = block(assign("t", call("load")), call("process", var("t")), call("log", var("t")));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testPreservedTemporaryIsKept() {
        Node before = block(new Match(new PBind("t", Meta.of(MetaFlag.PRESERVE_NAME)), call("load")), var("t"));

        assertSame(before, pass.apply(before));
    }
}
