package com.raditha.hygiene.model;

import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Pattern.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Short static factories for building trees by hand. Used by passes that synthesize nodes and
 * heavily by the tests.
 */
public final class Nodes {

    private Nodes() {
        /* this is only a utility class */
    }

    public static Var var(String name) {
        return new Var(name);
    }

    public static IntLit num(long value) {
        return new IntLit(value);
    }

    public static StringLit str(String value) {
        return new StringLit(value);
    }

    public static AtomLit atom(String name) {
        return new AtomLit(name);
    }

    public static NilLit nil() {
        return new NilLit();
    }

    public static BoolLit bool(boolean value) {
        return new BoolLit(value);
    }

    public static ListLit list(Node... elements) {
        return new ListLit(Arrays.asList(elements));
    }

    public static TupleLit tuple(Node... elements) {
        return new TupleLit(Arrays.asList(elements));
    }

    public static Binary op(String op, Node left, Node right) {
        return new Binary(op, left, right);
    }

    public static Block block(Node... statements) {
        return new Block(Arrays.asList(statements));
    }

    public static Block block(List<Node> statements) {
        return new Block(statements);
    }

    public static Match assign(String name, Node value) {
        return new Match(new PBind(name), value);
    }

    public static Match match(Pattern pattern, Node value) {
        return new Match(pattern, value);
    }

    public static LocalCall call(String name, Node... args) {
        return new LocalCall(name, Arrays.asList(args));
    }

    public static RemoteCall remote(String module, String name, Node... args) {
        return new RemoteCall(new AliasRef(module), name, Arrays.asList(args));
    }

    public static Fn fn(List<Pattern> params, Node body) {
        return new Fn(List.of(new FnClause(params, body)));
    }

    public static Fn fn(String param, Node body) {
        return fn(List.of(new PBind(param)), body);
    }

    public static Fn fn2(String first, String second, Node body) {
        return fn(List.of(new PBind(first), new PBind(second)), body);
    }

    public static If ifElse(Node condition, Node then, Node orElse) {
        return new If(condition, then, orElse);
    }

    public static Case caseOf(Node subject, CaseClause... clauses) {
        return new Case(subject, Arrays.asList(clauses));
    }

    public static CaseClause clause(Pattern pattern, Node body) {
        return new CaseClause(pattern, body);
    }

    public static FunctionDef def(String name, List<Pattern> params, Node body) {
        return new FunctionDef(name, DefKind.DEF, params, body);
    }

    public static FunctionDef defp(String name, List<Pattern> params, Node body) {
        return new FunctionDef(name, DefKind.DEFP, params, body);
    }

    public static ModuleDef module(String name, Node... body) {
        return new ModuleDef(name, new Block(Arrays.asList(body)));
    }

    public static PBind bind(String name) {
        return new PBind(name);
    }

    public static List<Pattern> binds(String... names) {
        List<Pattern> result = new ArrayList<>();
        for (String n : names) {
            result.add(new PBind(n));
        }
        return result;
    }

    public static PTuple ptuple(Pattern... elements) {
        return new PTuple(Arrays.asList(elements));
    }

    public static PLiteral plit(Node literal) {
        return new PLiteral(literal);
    }

    /** {@code {:tag, p1, p2...}} tagged tuple pattern. */
    public static PTuple tagged(String tag, Pattern... payload) {
        List<Pattern> elements = new ArrayList<>();
        elements.add(new PLiteral(new AtomLit(tag)));
        elements.addAll(Arrays.asList(payload));
        return new PTuple(elements);
    }

    /** Wraps a node in a block unless it already is one. */
    public static Block asBlock(Node node) {
        return node instanceof Block b ? b : new Block(List.of(node));
    }

    /**
     * Reduces a statement list to a single expression node: the only statement, a block of
     * several, or {@code nil} when empty.
     */
    public static Node fromStatements(List<Node> statements, Meta meta) {
        if (statements.isEmpty()) {
            return new NilLit(meta);
        }
        if (statements.size() == 1) {
            return statements.get(0);
        }
        return new Block(statements, meta);
    }
}
