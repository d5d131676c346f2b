package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.FreeVariableCollector;
import com.raditha.hygiene.model.CaseClause;
import com.raditha.hygiene.model.CondClause;
import com.raditha.hygiene.model.FnClause;
import com.raditha.hygiene.model.Generator;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Nodes;
import com.raditha.hygiene.model.Pattern;
import com.raditha.hygiene.model.Pattern.PBind;
import com.raditha.hygiene.util.NodeQueries;
import com.raditha.hygiene.util.PatternUtility;
import com.raditha.hygiene.util.TreeTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Normalizes accumulator threading in {@code Enum.reduce} and {@code Enum.reduce_while}.
 * <p>
 * The step function is examined by a small state machine. In order of preference:
 * <ol>
 *     <li>a step that only appends one element to a list that starts empty becomes a
 *     comprehension: {@code Enum.reduce(xs, [], fn x, acc -> acc ++ [f(x)] end)} is
 *     {@code for x <- xs, do: f(x)}</li>
 *     <li>a step that rebinds the accumulator inside a conditional and then returns it is
 *     rewritten so that every branch returns its own accumulator; a rebind inside a branch is
 *     otherwise invisible to the trailing return</li>
 *     <li>a {@code reduce_while} that never halts becomes a plain {@code reduce}</li>
 * </ol>
 * Anything else is left untouched.
 */
public class AccumulatorThreadingPass implements NormalizationPass {

    private static final Logger logger = LoggerFactory.getLogger(AccumulatorThreadingPass.class);

    enum State {
        SCANNING_INIT,
        SCANNING_STEP_BODY,
        MATCHED_COMPREHENSION,
        MATCHED_ILLEGAL_REBIND,
        MATCHED_CONT_HALT,
        NO_MATCH
    }

    /**
     * The parts of a recognized fold.
     */
    record Fold(RemoteCall call, boolean halting, Node source, Node init, Pattern element, String acc,
                FnClause step) {

        static Fold of(RemoteCall call) {
            boolean halting = call.isOn("Enum", "reduce_while");
            if (!halting && !call.isOn("Enum", "reduce") || call.args().size() != 3
                    || !(call.args().get(2) instanceof Fn fn) || fn.clauses().size() != 1) {
                return null;
            }
            FnClause clause = fn.clauses().get(0);
            if (clause.guard() != null || clause.params().size() != 2
                    || !(clause.params().get(0) instanceof PBind)
                    || !(clause.params().get(1) instanceof PBind acc) || acc.isWildcard()) {
                return null;
            }
            return new Fold(call, halting, call.args().get(0), call.args().get(1), clause.params().get(0),
                    acc.name(), clause);
        }

        List<Node> statements() {
            return NodeQueries.statementsOf(step.body());
        }

        Node withBody(boolean keepHalting, Node body) {
            FnClause clause = new FnClause(step.params(), null, body);
            Fn fn = new Fn(List.of(clause), ((Fn) call.args().get(2)).meta());
            return new RemoteCall(call.module(), keepHalting ? "reduce_while" : "reduce",
                    List.of(source, init, fn), call.meta());
        }
    }

    @Override
    public String name() {
        return "accumulator-threading";
    }

    @Override
    public Node apply(Node root) {
        return TreeTransformer.transform(root, n -> n instanceof RemoteCall c ? normalize(c) : n);
    }

    /**
     * Runs the state machine until it stops matching. Every step either leaves a call behind
     * with one statement less in its step body, turns a reduce_while into a reduce, or produces a
     * comprehension, so this terminates.
     */
    private Node normalize(RemoteCall call) {
        Node current = call;
        while (current instanceof RemoteCall) {
            Node next = step((RemoteCall) current);
            if (next == current) {
                break;
            }
            current = next;
        }
        return current;
    }

    /**
     * One run of the state machine; returns the call itself when no shape matched.
     */
    Node step(RemoteCall call) {
        State state = State.SCANNING_INIT;
        Fold fold = null;
        Node comprehension = null;
        while (true) {
            switch (state) {
                case SCANNING_INIT:
                    fold = Fold.of(call);
                    state = fold == null ? State.NO_MATCH : State.SCANNING_STEP_BODY;
                    break;
                case SCANNING_STEP_BODY:
                    comprehension = comprehension(fold);
                    if (comprehension != null) {
                        state = State.MATCHED_COMPREHENSION;
                    } else if (illegalRebindAt(fold) >= 0) {
                        state = State.MATCHED_ILLEGAL_REBIND;
                    } else if (fold.halting() && haltFree(fold.step().body())) {
                        state = State.MATCHED_CONT_HALT;
                    } else {
                        state = State.NO_MATCH;
                    }
                    break;
                case MATCHED_COMPREHENSION:
                    logger.debug("Rewrote append-only {} into a comprehension", fold.call().name());
                    return comprehension;
                case MATCHED_ILLEGAL_REBIND:
                    logger.debug("Threaded accumulator {} through conditional branches", fold.acc());
                    return fold.withBody(fold.halting(), thread(fold));
                case MATCHED_CONT_HALT:
                    logger.debug("Rewrote halt-free reduce_while into reduce");
                    return fold.withBody(false, mapLeaves(fold.step().body(), leaf -> ((TupleLit) leaf).elements().get(1)));
                default:
                    return call;
            }
        }
    }

    // comprehension

    private static Node comprehension(Fold fold) {
        if (!(fold.init() instanceof ListLit init) || !init.elements().isEmpty()) {
            return null;
        }
        List<Node> statements = fold.statements();
        Node last = statements.get(statements.size() - 1);
        if (fold.halting()) {
            if (!(last instanceof TupleLit t) || t.elements().size() != 2 || !isTag(t.elements().get(0), "cont")) {
                return null;
            }
            last = t.elements().get(1);
        }
        if (!(last instanceof Binary b) || !"++".equals(b.op()) || !(b.left() instanceof Var v)
                || !v.name().equals(fold.acc()) || !(b.right() instanceof ListLit one) || one.elements().size() != 1) {
            return null;
        }
        List<Node> body = new ArrayList<>(statements.subList(0, statements.size() - 1));
        body.add(one.elements().get(0));
        Node forBody = Nodes.fromStatements(body, fold.step().body().meta());
        if (FreeVariableCollector.collect(forBody).reads(fold.acc())) {
            return null;
        }
        Generator generator = new Generator(fold.element(), fold.source());
        return new For(List.of(generator), List.of(), null, forBody, fold.call().meta());
    }

    // illegal rebind

    /**
     * Index of the conditional whose branches rebind the accumulator just before the final
     * return, or -1.
     */
    private static int illegalRebindAt(Fold fold) {
        List<Node> statements = fold.statements();
        if (statements.size() < 2) {
            return -1;
        }
        int at = statements.size() - 2;
        Node conditional = statements.get(at);
        Node last = statements.get(statements.size() - 1);
        if (fold.halting() && !isPair(last)) {
            return -1;
        }
        FreeVariableCollector.Reads lastReads = FreeVariableCollector.collect(last);
        if (lastReads.wildcard() || !lastReads.reads(fold.acc())) {
            return -1;
        }
        List<Node> branches = branches(conditional);
        if (branches.isEmpty()) {
            return -1;
        }
        boolean rebinds = false;
        for (Node branch : branches) {
            for (Node s : NodeQueries.statementsOf(branch)) {
                Set<String> bound = NodeQueries.statementBinds(s);
                rebinds |= bound.contains(fold.acc());
                for (String name : bound) {
                    if (!name.equals(fold.acc()) && lastReads.reads(name)) {
                        return -1;
                    }
                }
            }
        }
        if (conditional instanceof Case c) {
            for (CaseClause clause : c.clauses()) {
                for (String name : PatternUtility.collectBound(clause.pattern())) {
                    if (lastReads.reads(name)) {
                        return -1;
                    }
                }
            }
        }
        return rebinds ? at : -1;
    }

    private static Node thread(Fold fold) {
        List<Node> statements = fold.statements();
        Node last = statements.get(statements.size() - 1);
        Node conditional = statements.get(statements.size() - 2);
        UnaryOperator<Node> append = branch -> {
            List<Node> s = new ArrayList<>(NodeQueries.statementsOf(branch));
            s.add(last);
            return Nodes.fromStatements(s, branch.meta());
        };
        Node threaded;
        if (conditional instanceof If n) {
            threaded = new If(n.condition(), append.apply(n.then()),
                    n.orElse() == null ? last : append.apply(n.orElse()), n.meta());
        } else if (conditional instanceof Unless n) {
            threaded = new Unless(n.condition(), append.apply(n.then()),
                    n.orElse() == null ? last : append.apply(n.orElse()), n.meta());
        } else if (conditional instanceof Case n) {
            List<CaseClause> clauses = new ArrayList<>();
            n.clauses().forEach(c -> clauses.add(c.withBody(append.apply(c.body()))));
            threaded = new Case(n.subject(), clauses, n.meta());
        } else {
            Cond n = (Cond) conditional;
            List<CondClause> clauses = new ArrayList<>();
            n.clauses().forEach(c -> clauses.add(new CondClause(c.condition(), append.apply(c.body()))));
            threaded = new Cond(clauses, n.meta());
        }
        List<Node> body = new ArrayList<>(statements.subList(0, statements.size() - 2));
        body.add(threaded);
        return Nodes.fromStatements(body, fold.step().body().meta());
    }

    // halt-free reduce_while

    private static boolean haltFree(Node body) {
        List<Node> leaves = new ArrayList<>();
        collectLeaves(body, leaves);
        for (Node leaf : leaves) {
            if (!(leaf instanceof TupleLit t) || t.elements().size() != 2 || !isTag(t.elements().get(0), "cont")) {
                return false;
            }
        }
        return true;
    }

    /**
     * The expressions that can become the value of {@code body}. An {@code if} without else
     * contributes a {@code nil} leaf.
     */
    private static void collectLeaves(Node body, List<Node> into) {
        Node last = NodeQueries.lastStatement(body);
        if (last instanceof If n) {
            collectLeaves(n.then(), into);
            collectLeaves(n.orElse() == null ? new NilLit() : n.orElse(), into);
        } else if (last instanceof Unless n) {
            collectLeaves(n.then(), into);
            collectLeaves(n.orElse() == null ? new NilLit() : n.orElse(), into);
        } else if (last instanceof Case n) {
            n.clauses().forEach(c -> collectLeaves(c.body(), into));
        } else if (last instanceof Cond n) {
            n.clauses().forEach(c -> collectLeaves(c.body(), into));
        } else {
            into.add(last);
        }
    }

    private static Node mapLeaves(Node body, UnaryOperator<Node> fn) {
        List<Node> statements = new ArrayList<>(NodeQueries.statementsOf(body));
        Node last = statements.get(statements.size() - 1);
        Node mapped;
        if (last instanceof If n) {
            mapped = new If(n.condition(), mapLeaves(n.then(), fn), mapLeaves(n.orElse(), fn), n.meta());
        } else if (last instanceof Unless n) {
            mapped = new Unless(n.condition(), mapLeaves(n.then(), fn), mapLeaves(n.orElse(), fn), n.meta());
        } else if (last instanceof Case n) {
            List<CaseClause> clauses = new ArrayList<>();
            n.clauses().forEach(c -> clauses.add(c.withBody(mapLeaves(c.body(), fn))));
            mapped = new Case(n.subject(), clauses, n.meta());
        } else if (last instanceof Cond n) {
            List<CondClause> clauses = new ArrayList<>();
            n.clauses().forEach(c -> clauses.add(new CondClause(c.condition(), mapLeaves(c.body(), fn))));
            mapped = new Cond(clauses, n.meta());
        } else {
            mapped = fn.apply(last);
        }
        statements.set(statements.size() - 1, mapped);
        return body instanceof Block b ? b.withStatements(statements) : mapped;
    }

    private static List<Node> branches(Node n) {
        List<Node> result = new ArrayList<>();
        if (n instanceof If f) {
            result.add(f.then());
            if (f.orElse() != null) {
                result.add(f.orElse());
            }
        } else if (n instanceof Unless u) {
            result.add(u.then());
            if (u.orElse() != null) {
                result.add(u.orElse());
            }
        } else if (n instanceof Case c) {
            c.clauses().forEach(cl -> result.add(cl.body()));
        } else if (n instanceof Cond c) {
            c.clauses().forEach(cl -> result.add(cl.body()));
        }
        return result;
    }

    private static boolean isPair(Node n) {
        return n instanceof TupleLit t && t.elements().size() == 2
                && (isTag(t.elements().get(0), "cont") || isTag(t.elements().get(0), "halt"));
    }

    private static boolean isTag(Node n, String tag) {
        return n instanceof AtomLit a && a.name().equals(tag);
    }
}
