package com.raditha.hygiene.analysis;

import com.raditha.hygiene.model.CaseClause;
import com.raditha.hygiene.model.CatchClause;
import com.raditha.hygiene.model.CondClause;
import com.raditha.hygiene.model.FnClause;
import com.raditha.hygiene.model.Generator;
import com.raditha.hygiene.model.MapEntry;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.NodeVisitor;
import com.raditha.hygiene.model.Pattern;
import com.raditha.hygiene.model.RescueClause;
import com.raditha.hygiene.model.WithClause;
import com.raditha.hygiene.util.NodeQueries;
import com.raditha.hygiene.util.Names;
import com.raditha.hygiene.util.PatternUtility;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects the variables a node reads from its enclosing scope.
 * <p>
 * Names bound inside the node (clause heads, closure parameters, earlier statements of a nested
 * block) shadow the outer binding and are not reported. Reads inside closures are reported like
 * any other read: a closure reads what it captures at the point where it is created.
 * Interpolated strings and opaque fragments are scanned; when either cannot be understood the
 * result is marked as a wildcard and every name must be considered read.
 */
public class FreeVariableCollector implements NodeVisitor<Void> {

    /**
     * Free reads of one node.
     *
     * @param counts   read occurrences per name
     * @param wildcard true when the node may read names it does not spell out
     */
    public record Reads(Map<String, Integer> counts, boolean wildcard) {
        public static final Reads NONE = new Reads(Map.of(), false);

        public boolean reads(String name) {
            return wildcard || counts.containsKey(name);
        }

        public int count(String name) {
            return counts.getOrDefault(name, 0);
        }

        public Set<String> names() {
            return counts.keySet();
        }
    }

    private final Map<String, Integer> counts = new LinkedHashMap<>();
    private Set<String> bound;
    private boolean wildcard;

    private FreeVariableCollector(Set<String> bound) {
        this.bound = bound;
    }

    public static Reads collect(Node node) {
        return collect(node, Set.of());
    }

    /**
     * @param node        the node to scan
     * @param alreadyBound names that are local to the node's own scope and must not be reported
     */
    public static Reads collect(Node node, Set<String> alreadyBound) {
        if (node == null) {
            return Reads.NONE;
        }
        FreeVariableCollector collector = new FreeVariableCollector(new HashSet<>(alreadyBound));
        node.accept(collector);
        return new Reads(Collections.unmodifiableMap(collector.counts), collector.wildcard);
    }

    /**
     * Reads of a clause: pins of the head, then guard and body with the head's binders in scope.
     */
    public static Reads collectClause(List<Pattern> heads, Node guard, Node body) {
        FreeVariableCollector collector = new FreeVariableCollector(new HashSet<>());
        collector.clause(heads, guard, body);
        return new Reads(Collections.unmodifiableMap(collector.counts), collector.wildcard);
    }

    private void read(String name) {
        if (!bound.contains(name)) {
            counts.merge(name, 1, Integer::sum);
        }
    }

    private void scan(Node n) {
        if (n != null) {
            n.accept(this);
        }
    }

    private void scanAll(List<Node> nodes) {
        for (Node n : nodes) {
            n.accept(this);
        }
    }

    private void pins(Pattern p) {
        for (String name : PatternUtility.collectPinned(p)) {
            read(name);
        }
    }

    /**
     * Scans the guard and body with the binders of {@code heads} added to the current scope.
     */
    private void clause(List<Pattern> heads, Node guard, Node body) {
        Set<String> saved = bound;
        for (Pattern p : heads) {
            pins(p);
        }
        bound = new HashSet<>(saved);
        bound.addAll(PatternUtility.collectBound(heads));
        scan(guard);
        scan(body);
        bound = saved;
    }

    private void caseClauses(List<CaseClause> clauses) {
        for (CaseClause c : clauses) {
            clause(List.of(c.pattern()), c.guard(), c.body());
        }
    }

    private void entries(List<MapEntry> entries) {
        for (MapEntry e : entries) {
            e.key().accept(this);
            e.value().accept(this);
        }
    }

    private Void leaf() {
        return null;
    }

    public Void visit(IntLit n) {
        return leaf();
    }

    public Void visit(FloatLit n) {
        return leaf();
    }

    public Void visit(StringLit n) {
        InterpolationScanner.Result r = InterpolationScanner.scan(n.value());
        r.names().forEach(this::read);
        wildcard |= r.wildcard();
        return null;
    }

    public Void visit(BoolLit n) {
        return leaf();
    }

    public Void visit(AtomLit n) {
        return leaf();
    }

    public Void visit(NilLit n) {
        return leaf();
    }

    public Void visit(ListLit n) {
        scanAll(n.elements());
        return null;
    }

    public Void visit(ConsLit n) {
        scanAll(n.heads());
        n.tail().accept(this);
        return null;
    }

    public Void visit(TupleLit n) {
        scanAll(n.elements());
        return null;
    }

    public Void visit(MapLit n) {
        entries(n.entries());
        return null;
    }

    public Void visit(MapUpdate n) {
        n.base().accept(this);
        entries(n.entries());
        return null;
    }

    public Void visit(StructLit n) {
        entries(n.fields());
        return null;
    }

    public Void visit(Var n) {
        read(n.name());
        return null;
    }

    public Void visit(AliasRef n) {
        return leaf();
    }

    public Void visit(Field n) {
        n.target().accept(this);
        return null;
    }

    public Void visit(Access n) {
        n.target().accept(this);
        n.key().accept(this);
        return null;
    }

    public Void visit(AttributeRef n) {
        return leaf();
    }

    public Void visit(Binary n) {
        n.left().accept(this);
        n.right().accept(this);
        return null;
    }

    public Void visit(Unary n) {
        n.operand().accept(this);
        return null;
    }

    public Void visit(Block n) {
        Set<String> saved = bound;
        bound = new HashSet<>(saved);
        for (Node statement : n.statements()) {
            statement.accept(this);
            bound.addAll(NodeQueries.statementBinds(statement));
        }
        bound = saved;
        return null;
    }

    public Void visit(If n) {
        n.condition().accept(this);
        n.then().accept(this);
        scan(n.orElse());
        return null;
    }

    public Void visit(Unless n) {
        n.condition().accept(this);
        n.then().accept(this);
        scan(n.orElse());
        return null;
    }

    public Void visit(Case n) {
        n.subject().accept(this);
        caseClauses(n.clauses());
        return null;
    }

    public Void visit(Cond n) {
        for (CondClause c : n.clauses()) {
            c.condition().accept(this);
            c.body().accept(this);
        }
        return null;
    }

    public Void visit(With n) {
        Set<String> saved = bound;
        bound = new HashSet<>(saved);
        for (WithClause c : n.clauses()) {
            c.value().accept(this);
            pins(c.pattern());
            bound.addAll(PatternUtility.collectBound(c.pattern()));
            scan(c.guard());
        }
        n.body().accept(this);
        bound = saved;
        caseClauses(n.elseClauses());
        return null;
    }

    public Void visit(Try n) {
        n.body().accept(this);
        for (RescueClause r : n.rescues()) {
            clause(r.binder() == null ? List.of() : List.of(r.binder()), null, r.body());
        }
        for (CatchClause c : n.catches()) {
            List<Pattern> heads = c.kind() == null ? List.of(c.value()) : List.of(c.kind(), c.value());
            clause(heads, c.guard(), c.body());
        }
        caseClauses(n.elseClauses());
        scan(n.after());
        return null;
    }

    public Void visit(Receive n) {
        caseClauses(n.clauses());
        scan(n.timeout());
        scan(n.afterBody());
        return null;
    }

    public Void visit(Match n) {
        n.value().accept(this);
        pins(n.pattern());
        return null;
    }

    public Void visit(For n) {
        Set<String> saved = bound;
        bound = new HashSet<>(saved);
        for (Generator g : n.generators()) {
            g.source().accept(this);
            pins(g.pattern());
            bound.addAll(PatternUtility.collectBound(g.pattern()));
        }
        scanAll(n.filters());
        scan(n.body());
        bound = saved;
        scan(n.into());
        return null;
    }

    public Void visit(LocalCall n) {
        scanAll(n.args());
        return null;
    }

    public Void visit(RemoteCall n) {
        n.module().accept(this);
        scanAll(n.args());
        return null;
    }

    public Void visit(ApplyFn n) {
        n.fn().accept(this);
        scanAll(n.args());
        return null;
    }

    public Void visit(Fn n) {
        for (FnClause c : n.clauses()) {
            clause(c.params(), c.guard(), c.body());
        }
        return null;
    }

    public Void visit(Capture n) {
        scan(n.module());
        return null;
    }

    public Void visit(CaptureArg n) {
        return leaf();
    }

    public Void visit(ModuleDef n) {
        n.body().accept(this);
        return null;
    }

    public Void visit(FunctionDef n) {
        clause(n.params(), n.guard(), n.body());
        return null;
    }

    public Void visit(Import n) {
        scan(n.options());
        return null;
    }

    public Void visit(Alias n) {
        return leaf();
    }

    public Void visit(Require n) {
        return leaf();
    }

    public Void visit(Use n) {
        scan(n.options());
        return null;
    }

    public Void visit(Attribute n) {
        n.value().accept(this);
        return null;
    }

    public Void visit(Raw n) {
        if (OpaqueFragmentScanner.isWildcard(n.code())) {
            wildcard = true;
        }
        for (String token : OpaqueFragmentScanner.tokens(n.code())) {
            if (Names.isIdentStart(token.charAt(0))) {
                read(token);
            }
        }
        return null;
    }
}
