package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class AccumulatorThreadingPassTest {

    private final AccumulatorThreadingPass pass = new AccumulatorThreadingPass();

    private static Map<String, Object> input(int n) {
        List<Object> xs = new ArrayList<>();
        for (long i = 1; i <= n; i++) {
            xs.add(i);
        }
        Map<String, Object> env = new HashMap<>();
        env.put("xs", xs);
        return env;
    }

    private static Node appendOnly() {
        return remote("Enum", "reduce", var("xs"), list(),
                fn2("x", "acc", op("++", var("acc"), list(op("*", var("x"), num(2))))));
    }

    private static Node rebindInBranch() {
        return remote("Enum", "reduce", var("xs"), num(0),
                fn2("x", "acc", block(
                        ifElse(op(">", var("x"), num(2)), assign("acc", op("+", var("acc"), var("x"))), null),
                        var("acc"))));
    }

    private static Node neverHalts() {
        return remote("Enum", "reduce_while", var("xs"), num(0),
                fn2("x", "acc", ifElse(op(">", var("x"), num(2)),
                        tuple(atom("cont"), op("+", var("acc"), var("x"))),
                        tuple(atom("cont"), var("acc")))));
    }

    @Test
    void testAppendOnlyReduceBecomesComprehension() {
        Node after = pass.apply(appendOnly());

        assertInstanceOf(For.class, after);
        assertEquals(op("*", var("x"), num(2)), ((For) after).body());
    }

    @Test
    void testRebindInBranchIsThreaded() {
        Node after = pass.apply(rebindInBranch());

        Node expected = remote("Enum", "reduce", var("xs"), num(0),
                fn2("x", "acc", ifElse(op(">", var("x"), num(2)),
                        block(assign("acc", op("+", var("acc"), var("x"))), var("acc")),
                        var("acc"))));
        assertEquals(expected, after);
    }

    @Test
    void testHaltFreeReduceWhileBecomesReduce() {
        RemoteCall after = (RemoteCall) pass.apply(neverHalts());

        assertEquals("reduce", after.name());
    }

    @Test
    void testHaltingReduceWhileIsKept() {
        Node before = remote("Enum", "reduce_while", var("xs"), num(0),
                fn2("x", "acc", ifElse(op(">", var("x"), num(2)),
                        tuple(atom("halt"), var("acc")),
                        tuple(atom("cont"), op("+", var("acc"), var("x"))))));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testStepReadingAccumulatorIsNotAComprehension() {
        Node before = remote("Enum", "reduce", var("xs"), list(),
                fn2("x", "acc", op("++", var("acc"), list(call("length", var("acc"))))));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testIdempotent() {
        Node once = pass.apply(rebindInBranch());

        assertSame(once, pass.apply(once));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 5, 100})
    void testComprehensionPreservesResult(int n) {
        FoldInterpreter interpreter = new FoldInterpreter(false);

        assertEquals(interpreter.eval(appendOnly(), input(n)), interpreter.eval(pass.apply(appendOnly()), input(n)));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 5, 100})
    void testThreadingComputesTheIntendedFold(int n) {
        Object intended = new FoldInterpreter(true).eval(rebindInBranch(), input(n));

        assertEquals(intended, new FoldInterpreter(false).eval(pass.apply(rebindInBranch()), input(n)));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 5, 100})
    void testReduceWhileRewritePreservesResult(int n) {
        FoldInterpreter interpreter = new FoldInterpreter(false);

        assertEquals(interpreter.eval(neverHalts(), input(n)), interpreter.eval(pass.apply(neverHalts()), input(n)));
    }

    @Test
    void testUnthreadedStepLosesTheRebind() {
        Object scoped = new FoldInterpreter(false).eval(rebindInBranch(), input(5));

        assertEquals(0L, scoped);
        assertEquals(12L, new FoldInterpreter(false).eval(pass.apply(rebindInBranch()), input(5)));
    }
}
