package com.raditha.hygiene.analysis;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.util.NodeQueries;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.Tuple;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class UsageAnalyzerTest {

    private static final List<String> NAMES = List.of("a", "b", "c", "d");

    @Test
    void testUsedLaterAndLiveAt() {
        List<Node> statements = List.of(
                assign("x", num(1)),
                call("log", var("y")),
                assign("x", num(2)),
                call("use", var("x")));
        UsageIndex index = UsageAnalyzer.build(statements);

        assertTrue(index.usedLater(1, "x"));
        assertFalse(index.liveAt(1, "x"), "the first binding is replaced before it is read");
        assertTrue(index.liveAt(3, "x"));
        assertFalse(index.usedLater(2, "y"));
        assertTrue(index.rebindsAt(2, "x"));
        assertFalse(index.rebindsAt(1, "x"));
    }

    @Test
    void testSelfUpdateReadsBeforeRebinding() {
        UsageIndex index = UsageAnalyzer.build(List.of(
                assign("n", num(0)),
                assign("n", op("+", var("n"), num(1)))));

        assertTrue(index.liveAt(1, "n"));
    }

    @Test
    void testWildcardStatementReadsEverything() {
        UsageIndex index = UsageAnalyzer.build(List.of(
                assign("secret", num(1)),
                new Raw("IO.inspect(binding())")));

        assertTrue(index.usedLater(1, "secret"));
        assertTrue(index.liveAt(1, "secret"));
        assertTrue(index.hasWildcardFrom(1));
        assertEquals(0, index.readCount(1, "secret"));
    }

    @Test
    void testReadCountSumsOccurrences() {
        UsageIndex index = UsageAnalyzer.build(List.of(
                call("f", var("t"), var("t")),
                call("g", var("t"))));

        assertEquals(3, index.readCount(0, "t"));
        assertEquals(1, index.readCount(1, "t"));
    }

    @Test
    void testClosureCaptureCountsAsRead() {
        UsageIndex index = UsageAnalyzer.buildFor(block(
                assign("factor", num(3)),
                call("map", var("xs"), fn("x", op("*", var("x"), var("factor"))))));

        assertTrue(index.usedLater(1, "factor"));
        assertFalse(index.usedLater(1, "x"));
    }

    @Test
    void testClauseUses() {
        assertTrue(UsageAnalyzer.clauseUses(call("is_atom", var("k")), nil(), "k"));
        assertTrue(UsageAnalyzer.clauseUses(null, str("#{k}"), "k"));
        assertFalse(UsageAnalyzer.clauseUses(null, var("other"), "k"));
    }

    /**
     * The index never reports a name as unused when a later statement mentions it.
     */
    @Property
    void usageIndexNeverMissesARead(@ForAll("statements") List<Node> statements) {
        UsageIndex index = UsageAnalyzer.build(statements);
        for (int i = 0; i <= statements.size(); i++) {
            for (String name : NAMES) {
                boolean mentioned = false;
                boolean wildcard = false;
                int firstRead = Integer.MAX_VALUE;
                int firstRebind = Integer.MAX_VALUE;
                for (int j = i; j < statements.size(); j++) {
                    Node s = statements.get(j);
                    boolean reads = NodeQueries.mentionsVar(s, name);
                    boolean wild = s instanceof Raw;
                    if ((reads || wild) && firstRead == Integer.MAX_VALUE) {
                        firstRead = j;
                    }
                    if (NodeQueries.statementBinds(s).contains(name) && firstRebind == Integer.MAX_VALUE) {
                        firstRebind = j;
                    }
                    mentioned |= reads;
                    wildcard |= wild;
                }
                assertEquals(mentioned || wildcard, index.usedLater(i, name));
                assertEquals(firstRead != Integer.MAX_VALUE && firstRead <= firstRebind, index.liveAt(i, name));
            }
        }
    }

    @Provide
    Arbitrary<List<Node>> statements() {
        Arbitrary<String> name = Arbitraries.of(NAMES);
        Arbitrary<Node> assignment = Combinators.combine(name, name, name)
                .as((target, l, r) -> assign(target, op("+", var(l), var(r))));
        Arbitrary<Node> effect = name.map(n -> call("emit", var(n)));
        Arbitrary<Node> closure = name.map(n -> call("run", fn("p", op("+", var("p"), var(n)))));
        Arbitrary<Node> constant = name.map(n -> assign(n, num(0)));
        Arbitrary<Node> opaque = Arbitraries.just(new Raw("IO.inspect(binding())"));
        Arbitrary<Node> statement = Arbitraries.frequencyOf(
                Tuple.of(4, assignment),
                Tuple.of(3, effect),
                Tuple.of(2, closure),
                Tuple.of(2, constant),
                Tuple.of(1, opaque));
        return statement.list().ofMinSize(0).ofMaxSize(8);
    }
}
