package com.raditha.hygiene.util;

import com.raditha.hygiene.TransformDefectException;
import com.raditha.hygiene.model.CaseClause;
import com.raditha.hygiene.model.CatchClause;
import com.raditha.hygiene.model.CondClause;
import com.raditha.hygiene.model.FnClause;
import com.raditha.hygiene.model.Generator;
import com.raditha.hygiene.model.MapEntry;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.NodeVisitor;
import com.raditha.hygiene.model.RescueClause;
import com.raditha.hygiene.model.WithClause;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Generic bottom-up rewrite driver.
 * <p>
 * Children are rewritten first and the parent is rebuilt from them; then the node function is
 * applied to the rebuilt parent. The function therefore always sees subtrees that have already
 * been transformed, including earlier statements of the same block. When neither the children
 * nor the function change anything the original instance is returned, so callers can use
 * reference equality to detect "no change".
 * <p>
 * Patterns are not entered. Guards, clause bodies and every other node-valued field are.
 */
public final class TreeTransformer implements NodeVisitor<Node> {

    private final UnaryOperator<Node> fn;

    private TreeTransformer(UnaryOperator<Node> fn) {
        this.fn = fn;
    }

    /**
     * Apply {@code fn} at every level of {@code root}, children first.
     *
     * @param root tree to rewrite
     * @param fn   node function; returning its argument is a no-op, returning {@code null} is a defect
     * @return the rewritten tree, or {@code root} itself when nothing changed
     */
    public static Node transform(Node root, UnaryOperator<Node> fn) {
        return root.accept(new TreeTransformer(fn));
    }

    private Node apply(Node rebuilt) {
        Node result = fn.apply(rebuilt);
        if (result == null) {
            throw new TransformDefectException(
                    "Node function returned null for " + rebuilt.getClass().getSimpleName(),
                    rebuilt.getClass().getSimpleName());
        }
        return result;
    }

    private Node child(Node n) {
        return n == null ? null : n.accept(this);
    }

    private List<Node> children(List<Node> nodes) {
        List<Node> result = null;
        for (int i = 0; i < nodes.size(); i++) {
            Node original = nodes.get(i);
            Node rewritten = original.accept(this);
            if (rewritten != original && result == null) {
                result = new ArrayList<>(nodes.subList(0, i));
            }
            if (result != null) {
                result.add(rewritten);
            }
        }
        return result == null ? nodes : result;
    }

    private List<MapEntry> entries(List<MapEntry> list) {
        List<MapEntry> result = new ArrayList<>(list.size());
        boolean changed = false;
        for (MapEntry e : list) {
            Node k = child(e.key());
            Node v = child(e.value());
            if (k != e.key() || v != e.value()) {
                changed = true;
                result.add(new MapEntry(k, v));
            } else {
                result.add(e);
            }
        }
        return changed ? result : list;
    }

    private List<CaseClause> caseClauses(List<CaseClause> list) {
        List<CaseClause> result = new ArrayList<>(list.size());
        boolean changed = false;
        for (CaseClause c : list) {
            Node g = child(c.guard());
            Node b = child(c.body());
            if (g != c.guard() || b != c.body()) {
                changed = true;
                result.add(new CaseClause(c.pattern(), g, b));
            } else {
                result.add(c);
            }
        }
        return changed ? result : list;
    }

    private static boolean same(List<?> a, List<?> b) {
        return a == b;
    }

    // --- leaves ---

    @Override
    public Node visit(IntLit n) {
        return apply(n);
    }

    @Override
    public Node visit(FloatLit n) {
        return apply(n);
    }

    @Override
    public Node visit(StringLit n) {
        return apply(n);
    }

    @Override
    public Node visit(BoolLit n) {
        return apply(n);
    }

    @Override
    public Node visit(AtomLit n) {
        return apply(n);
    }

    @Override
    public Node visit(NilLit n) {
        return apply(n);
    }

    @Override
    public Node visit(Var n) {
        return apply(n);
    }

    @Override
    public Node visit(AliasRef n) {
        return apply(n);
    }

    @Override
    public Node visit(AttributeRef n) {
        return apply(n);
    }

    @Override
    public Node visit(CaptureArg n) {
        return apply(n);
    }

    @Override
    public Node visit(Alias n) {
        return apply(n);
    }

    @Override
    public Node visit(Require n) {
        return apply(n);
    }

    @Override
    public Node visit(Raw n) {
        return apply(n);
    }

    // --- containers ---

    @Override
    public Node visit(ListLit n) {
        List<Node> el = children(n.elements());
        return apply(same(el, n.elements()) ? n : new ListLit(el, n.meta()));
    }

    @Override
    public Node visit(ConsLit n) {
        List<Node> heads = children(n.heads());
        Node tail = child(n.tail());
        return apply(same(heads, n.heads()) && tail == n.tail() ? n : new ConsLit(heads, tail, n.meta()));
    }

    @Override
    public Node visit(TupleLit n) {
        List<Node> el = children(n.elements());
        return apply(same(el, n.elements()) ? n : new TupleLit(el, n.meta()));
    }

    @Override
    public Node visit(MapLit n) {
        List<MapEntry> e = entries(n.entries());
        return apply(same(e, n.entries()) ? n : new MapLit(e, n.meta()));
    }

    @Override
    public Node visit(MapUpdate n) {
        Node base = child(n.base());
        List<MapEntry> e = entries(n.entries());
        return apply(base == n.base() && same(e, n.entries()) ? n : new MapUpdate(base, e, n.meta()));
    }

    @Override
    public Node visit(StructLit n) {
        List<MapEntry> f = entries(n.fields());
        return apply(same(f, n.fields()) ? n : new StructLit(n.module(), f, n.meta()));
    }

    // --- references and operators ---

    @Override
    public Node visit(Field n) {
        Node t = child(n.target());
        return apply(t == n.target() ? n : new Field(t, n.field(), n.meta()));
    }

    @Override
    public Node visit(Access n) {
        Node t = child(n.target());
        Node k = child(n.key());
        return apply(t == n.target() && k == n.key() ? n : new Access(t, k, n.meta()));
    }

    @Override
    public Node visit(Binary n) {
        Node l = child(n.left());
        Node r = child(n.right());
        return apply(l == n.left() && r == n.right() ? n : new Binary(n.op(), l, r, n.meta()));
    }

    @Override
    public Node visit(Unary n) {
        Node o = child(n.operand());
        return apply(o == n.operand() ? n : new Unary(n.op(), o, n.meta()));
    }

    // --- control forms ---

    @Override
    public Node visit(Block n) {
        List<Node> s = children(n.statements());
        return apply(same(s, n.statements()) ? n : new Block(s, n.meta()));
    }

    @Override
    public Node visit(If n) {
        Node c = child(n.condition());
        Node t = child(n.then());
        Node e = child(n.orElse());
        return apply(c == n.condition() && t == n.then() && e == n.orElse() ? n : new If(c, t, e, n.meta()));
    }

    @Override
    public Node visit(Unless n) {
        Node c = child(n.condition());
        Node t = child(n.then());
        Node e = child(n.orElse());
        return apply(c == n.condition() && t == n.then() && e == n.orElse() ? n : new Unless(c, t, e, n.meta()));
    }

    @Override
    public Node visit(Case n) {
        Node s = child(n.subject());
        List<CaseClause> cl = caseClauses(n.clauses());
        return apply(s == n.subject() && same(cl, n.clauses()) ? n : new Case(s, cl, n.meta()));
    }

    @Override
    public Node visit(Cond n) {
        List<CondClause> result = new ArrayList<>();
        boolean changed = false;
        for (CondClause c : n.clauses()) {
            Node cond = child(c.condition());
            Node body = child(c.body());
            changed |= cond != c.condition() || body != c.body();
            result.add(cond == c.condition() && body == c.body() ? c : new CondClause(cond, body));
        }
        return apply(changed ? new Cond(result, n.meta()) : n);
    }

    @Override
    public Node visit(With n) {
        List<WithClause> result = new ArrayList<>();
        boolean changed = false;
        for (WithClause c : n.clauses()) {
            Node g = child(c.guard());
            Node v = child(c.value());
            changed |= g != c.guard() || v != c.value();
            result.add(g == c.guard() && v == c.value() ? c : new WithClause(c.pattern(), g, v));
        }
        Node body = child(n.body());
        List<CaseClause> el = caseClauses(n.elseClauses());
        changed |= body != n.body() || !same(el, n.elseClauses());
        return apply(changed ? new With(result, body, el, n.meta()) : n);
    }

    @Override
    public Node visit(Try n) {
        Node body = child(n.body());
        boolean changed = body != n.body();
        List<RescueClause> rescues = new ArrayList<>();
        for (RescueClause r : n.rescues()) {
            Node b = child(r.body());
            changed |= b != r.body();
            rescues.add(b == r.body() ? r : new RescueClause(r.binder(), r.exceptions(), b));
        }
        List<CatchClause> catches = new ArrayList<>();
        for (CatchClause c : n.catches()) {
            Node g = child(c.guard());
            Node b = child(c.body());
            changed |= g != c.guard() || b != c.body();
            catches.add(g == c.guard() && b == c.body() ? c : new CatchClause(c.kind(), c.value(), g, b));
        }
        List<CaseClause> el = caseClauses(n.elseClauses());
        Node after = child(n.after());
        changed |= !same(el, n.elseClauses()) || after != n.after();
        return apply(changed ? new Try(body, rescues, catches, el, after, n.meta()) : n);
    }

    @Override
    public Node visit(Receive n) {
        List<CaseClause> cl = caseClauses(n.clauses());
        Node timeout = child(n.timeout());
        Node after = child(n.afterBody());
        boolean unchanged = same(cl, n.clauses()) && timeout == n.timeout() && after == n.afterBody();
        return apply(unchanged ? n : new Receive(cl, timeout, after, n.meta()));
    }

    // --- binding forms ---

    @Override
    public Node visit(Match n) {
        Node v = child(n.value());
        return apply(v == n.value() ? n : new Match(n.pattern(), v, n.meta()));
    }

    @Override
    public Node visit(For n) {
        List<Generator> gens = new ArrayList<>();
        boolean changed = false;
        for (Generator g : n.generators()) {
            Node src = child(g.source());
            changed |= src != g.source();
            gens.add(src == g.source() ? g : new Generator(g.pattern(), src));
        }
        List<Node> filters = children(n.filters());
        Node into = child(n.into());
        Node body = child(n.body());
        changed |= !same(filters, n.filters()) || into != n.into() || body != n.body();
        return apply(changed ? new For(gens, filters, into, body, n.meta()) : n);
    }

    // --- calls ---

    @Override
    public Node visit(LocalCall n) {
        List<Node> args = children(n.args());
        return apply(same(args, n.args()) ? n : new LocalCall(n.name(), args, n.meta()));
    }

    @Override
    public Node visit(RemoteCall n) {
        Node m = child(n.module());
        List<Node> args = children(n.args());
        return apply(m == n.module() && same(args, n.args()) ? n : new RemoteCall(m, n.name(), args, n.meta()));
    }

    @Override
    public Node visit(ApplyFn n) {
        Node f = child(n.fn());
        List<Node> args = children(n.args());
        return apply(f == n.fn() && same(args, n.args()) ? n : new ApplyFn(f, args, n.meta()));
    }

    @Override
    public Node visit(Fn n) {
        List<FnClause> result = new ArrayList<>();
        boolean changed = false;
        for (FnClause c : n.clauses()) {
            Node g = child(c.guard());
            Node b = child(c.body());
            changed |= g != c.guard() || b != c.body();
            result.add(g == c.guard() && b == c.body() ? c : new FnClause(c.params(), g, b));
        }
        return apply(changed ? new Fn(result, n.meta()) : n);
    }

    @Override
    public Node visit(Capture n) {
        Node m = child(n.module());
        return apply(m == n.module() ? n : new Capture(m, n.name(), n.arity(), n.meta()));
    }

    // --- module level ---

    @Override
    public Node visit(ModuleDef n) {
        Node body = child(n.body());
        Block block = body instanceof Block b ? b : new Block(List.of(body), n.body().meta());
        return apply(body == n.body() ? n : new ModuleDef(n.name(), block, n.meta()));
    }

    @Override
    public Node visit(FunctionDef n) {
        Node g = child(n.guard());
        Node b = child(n.body());
        return apply(g == n.guard() && b == n.body() ? n
                : new FunctionDef(n.name(), n.kind(), n.params(), g, b, n.meta()));
    }

    @Override
    public Node visit(Import n) {
        Node o = child(n.options());
        return apply(o == n.options() ? n : new Import(n.module(), o, n.meta()));
    }

    @Override
    public Node visit(Use n) {
        Node o = child(n.options());
        return apply(o == n.options() ? n : new Use(n.module(), o, n.meta()));
    }

    @Override
    public Node visit(Attribute n) {
        Node v = child(n.value());
        return apply(v == n.value() ? n : new Attribute(n.name(), v, n.meta()));
    }
}
