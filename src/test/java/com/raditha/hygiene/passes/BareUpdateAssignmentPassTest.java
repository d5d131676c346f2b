package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import org.junit.jupiter.api.Test;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class BareUpdateAssignmentPassTest {

    private final BareUpdateAssignmentPass pass = new BareUpdateAssignmentPass();

    @Test
    void testDiscardedUpdateBecomesAssignment() {
        Node before = block(op("+", var("count"), num(1)), call("report", var("count")));

        Node expected = block(assign("count", op("+", var("count"), num(1))), call("report", var("count")));
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testFinalExpressionIsAValue() {
        Node before = block(call("log"), op("+", var("count"), num(1)));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testUpdateInsideNonFinalBranch() {
        Node before = block(
                ifElse(var("hit"), op("<>", var("buf"), str("x")), null),
                var("buf"));

        Node expected = block(
                ifElse(var("hit"), assign("buf", op("<>", var("buf"), str("x"))), null),
                var("buf"));
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testUpdateAtEndOfCaseClauseBlock() {
        Node before = block(
                caseOf(var("m"), clause(bind("_"), block(call("log"), op("*", var("n"), num(2))))),
                var("n"));

        Node expected = block(
                caseOf(var("m"), clause(bind("_"), block(call("log"), assign("n", op("*", var("n"), num(2)))))),
                var("n"));
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testComparisonIsNotAnUpdate() {
        Node before = block(op("==", var("a"), num(1)), var("a"));

        assertSame(before, pass.apply(before));
    }
}
