package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import org.junit.jupiter.api.Test;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class NilCheckNormalizationPassTest {

    private final NilCheckNormalizationPass pass = new NilCheckNormalizationPass();

    @Test
    void testEqualityWithNil() {
        assertEquals(call("is_nil", var("x")), pass.apply(op("==", var("x"), nil())));
        assertEquals(call("is_nil", var("x")), pass.apply(op("===", nil(), var("x"))));
    }

    @Test
    void testInequalityWithNil() {
        assertEquals(new Unary("not", call("is_nil", var("x"))), pass.apply(op("!=", var("x"), nil())));
    }

    @Test
    void testOtherComparisonsUnchanged() {
        Node before = op("==", var("x"), num(0));
        Node lessThan = op("<", var("x"), nil());

        assertSame(before, pass.apply(before));
        assertSame(lessThan, pass.apply(lessThan));
    }
}
