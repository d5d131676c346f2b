package com.raditha.hygiene.passes;

import com.raditha.hygiene.config.PipelineConfig;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.workflow.PassPipeline;
import com.raditha.hygiene.workflow.PassRegistry;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.Tuple;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Set;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class PassPropertiesTest {

    private static final List<String> NAMES = List.of("a", "b", "c", "d");

    /**
     * Every catalog pass reaches its normal form in one application.
     */
    @Property(tries = 200)
    void everyPassIsIdempotent(@ForAll("programs") List<Node> statements) {
        Node tree = module("M", def("run", binds("p"), block(statements)));
        for (NormalizationPass pass : PassRegistry.defaultOrder(PipelineConfig.defaults())) {
            Node once = pass.apply(tree);
            assertEquals(once, pass.apply(once), pass.name());
        }
    }

    /**
     * Collapsing alias chains never changes the value a block computes.
     */
    @Property(tries = 300)
    void aliasCollapseKeepsTheResult(@ForAll("programs") List<Node> statements) {
        Node before = block(statements);
        Node after = new AliasChainCollapsePass().apply(before);
        FoldInterpreter interpreter = new FoldInterpreter(false);

        assertEquals(interpreter.eval(before, new HashMap<>()), interpreter.eval(after, new HashMap<>()));
    }

    /**
     * A second run of the whole pipeline finds nothing left to do.
     */
    @Property(tries = 200)
    void pipelineIsIdempotent(@ForAll("programsWithBranches") List<Node> statements) {
        PipelineConfig config = new PipelineConfig(null, Set.of(), Set.of("Logger"), true, 16, Set.of(), false);
        Node tree = module("M", def("run", binds("p"), block(statements)));

        Node once = PassPipeline.normalize(tree, config);

        assertEquals(once, PassPipeline.normalize(once, config));
    }

    @Test
    void testUpdateThenDeadStatementMatchesDriverOrder() {
        Node tree = block(
                ifElse(var("flag"), block(call("log"), op("+", var("count"), num(1))), var("count")),
                match(bind("_"), var("x")),
                match(bind("_"), var("x")),
                assign("x", call("compute")),
                tuple(var("count"), var("x")));
        BareUpdateAssignmentPass update = new BareUpdateAssignmentPass();
        DeadStatementEliminationPass dead = new DeadStatementEliminationPass();

        Node expected = block(
                ifElse(var("flag"), block(call("log"), assign("count", op("+", var("count"), num(1)))), var("count")),
                assign("x", call("compute")),
                tuple(var("count"), var("x")));
        Node inOrder = dead.apply(update.apply(tree));

        assertEquals(expected, inOrder);
        assertEquals(inOrder, update.apply(dead.apply(tree)));
        assertEquals(inOrder, new PassPipeline(List.of(update, dead), PipelineConfig.fast()).run(tree).tree());
    }

    @Provide
    Arbitrary<List<Node>> programs() {
        Arbitrary<String> name = Arbitraries.of(NAMES);
        Arbitrary<Node> operand = Arbitraries.oneOf(name.map(n -> var(n)), Arbitraries.longs().between(0, 9).map(v -> num(v)));
        Arbitrary<Node> expression = Combinators.combine(Arbitraries.of("+", "-", "*"), operand, operand)
                .as((op, l, r) -> op(op, l, r));
        Arbitrary<Node> assignment = Combinators.combine(name, expression).as((n, e) -> assign(n, e));
        Arbitrary<Node> chain = Combinators.combine(name, name, expression)
                .as((x, y, e) -> match(bind(x), assign(y, e)));
        Arbitrary<Node> alias = Combinators.combine(name, name).as((x, y) -> assign(x, var(y)));
        Arbitrary<Node> update = Combinators.combine(name, operand).as((n, o) -> op("+", var(n), o));
        Arbitrary<Node> read = name.map(n -> var(n));
        Arbitrary<Node> statement = Arbitraries.frequencyOf(
                Tuple.of(4, assignment),
                Tuple.of(2, chain),
                Tuple.of(3, alias),
                Tuple.of(1, update),
                Tuple.of(1, read));
        return Combinators.combine(statement.list().ofMaxSize(8), name).as((body, result) -> {
            List<Node> program = new ArrayList<>();
            long value = 1;
            for (String n : NAMES) {
                program.add(assign(n, num(value++)));
            }
            program.addAll(body);
            program.add(var(result));
            return program;
        });
    }

    @Provide
    Arbitrary<List<Node>> programsWithBranches() {
        Arbitrary<String> name = Arbitraries.of(NAMES);
        Arbitrary<Node> operand = Arbitraries.oneOf(name.map(n -> var(n)), Arbitraries.longs().between(0, 9).map(v -> num(v)));
        Arbitrary<Node> expression = Combinators.combine(Arbitraries.of("+", "-", "*"), operand, operand)
                .as((op, l, r) -> op(op, l, r));
        Arbitrary<Node> discard = Combinators.combine(name, Arbitraries.oneOf(expression, operand))
                .as((n, e) -> assign("_" + n, e));
        Arbitrary<Node> assignment = Combinators.combine(name, expression).as((n, e) -> assign(n, e));
        Arbitrary<Node> update = Combinators.combine(name, operand).as((n, o) -> op("+", var(n), o));
        Arbitrary<Node> read = name.map(n -> var(n));
        Arbitrary<Node> inBranch = Arbitraries.frequencyOf(
                Tuple.of(3, assignment),
                Tuple.of(2, update),
                Tuple.of(1, read));
        Arbitrary<Node> branch = inBranch.list().ofMinSize(1).ofMaxSize(3).map(l -> block(l));
        Arbitrary<Node> orElse = Arbitraries.oneOf(branch, Arbitraries.just((Node) nil()));
        Arbitrary<Node> conditional = Combinators.combine(name, operand, branch, orElse)
                .as((n, o, t, e) -> ifElse(op(">", var(n), o), t, e));
        Arbitrary<Node> extra = Arbitraries.frequencyOf(
                Tuple.of(2, discard),
                Tuple.of(2, conditional));
        return Combinators.combine(programs(), extra.list().ofMaxSize(3), Arbitraries.integers().between(0, 8))
                .as((program, extras, at) -> {
                    List<Node> mixed = new ArrayList<>(program);
                    int position = NAMES.size() + Math.min(at, program.size() - NAMES.size() - 1);
                    mixed.addAll(position, extras);
                    return mixed;
                });
    }
}
