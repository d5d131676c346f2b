package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Meta;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import org.junit.jupiter.api.Test;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class DeadStatementEliminationPassTest {

    private final DeadStatementEliminationPass pass = new DeadStatementEliminationPass();

    @Test
    void testDiscardedPureExpressionsAreRemoved() {
        Node before = block(num(1), var("x"), atom("ok"), call("run"), var("result"));

        assertEquals(block(call("run"), var("result")), pass.apply(before));
    }

    @Test
    void testPureWildcardDiscardIsRemoved() {
        Node before = block(assign("_", var("unused")), call("run"));

        assertEquals(block(call("run")), pass.apply(before));
    }

    @Test
    void testEffectfulDiscardIsKept() {
        Node before = block(assign("_", call("send")), call("run"));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testDeadUnderscoreWriteIsRemoved() {
        Node before = block(assign("_tmp", var("y")), call("run"));

        assertEquals(block(call("run")), pass.apply(before));
    }

    @Test
    void testReadUnderscoreWriteIsKept() {
        Node before = block(assign("_tmp", var("y")), call("run", var("_tmp")));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testPreservedAndOpaqueStatementsAreKept() {
        Node preserved = new Match(bind("_ignore"), var("value"), Meta.of(MetaFlag.PRESERVE_NAME));
        Node before = block(preserved, new Raw("x"), call("run"));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testFinalStatementIsNeverRemoved() {
        Node before = block(call("run"), num(1));

        assertSame(before, pass.apply(before));
    }
}
