package com.raditha.hygiene.util;

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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Read-only structural queries over the tree.
 */
public final class NodeQueries {

    private static final ChildCollector CHILDREN = new ChildCollector();

    private NodeQueries() {
        /* this is only a utility class */
    }

    /**
     * Direct node children, in evaluation order where there is one. Patterns are not included.
     */
    public static List<Node> children(Node node) {
        return node.accept(CHILDREN);
    }

    /**
     * Pre-order walk. The visitor returns {@code false} to skip the children of a node.
     */
    public static void walk(Node root, Predicate<Node> visitor) {
        if (root == null || !visitor.test(root)) {
            return;
        }
        for (Node child : children(root)) {
            walk(child, visitor);
        }
    }

    public static boolean anyMatch(Node root, Predicate<Node> predicate) {
        if (root == null) {
            return false;
        }
        if (predicate.test(root)) {
            return true;
        }
        for (Node child : children(root)) {
            if (anyMatch(child, predicate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Patterns held directly by this node (not by its children).
     */
    public static List<Pattern> patternsOf(Node node) {
        List<Pattern> result = new ArrayList<>();
        if (node instanceof Match m) {
            result.add(m.pattern());
        } else if (node instanceof Case c) {
            c.clauses().forEach(cl -> result.add(cl.pattern()));
        } else if (node instanceof Receive r) {
            r.clauses().forEach(cl -> result.add(cl.pattern()));
        } else if (node instanceof Fn f) {
            f.clauses().forEach(cl -> result.addAll(cl.params()));
        } else if (node instanceof For f) {
            f.generators().forEach(g -> result.add(g.pattern()));
        } else if (node instanceof With w) {
            w.clauses().forEach(cl -> result.add(cl.pattern()));
            w.elseClauses().forEach(cl -> result.add(cl.pattern()));
        } else if (node instanceof Try t) {
            for (RescueClause r : t.rescues()) {
                if (r.binder() != null) {
                    result.add(r.binder());
                }
            }
            for (CatchClause c : t.catches()) {
                if (c.kind() != null) {
                    result.add(c.kind());
                }
                result.add(c.value());
            }
            t.elseClauses().forEach(cl -> result.add(cl.pattern()));
        } else if (node instanceof FunctionDef d) {
            result.addAll(d.params());
        }
        return result;
    }

    /**
     * Every name bound by any pattern anywhere inside {@code root}, including nested closures.
     */
    public static Set<String> boundAnywhere(Node root) {
        Set<String> result = new LinkedHashSet<>();
        walk(root, n -> {
            for (Pattern p : patternsOf(n)) {
                result.addAll(PatternUtility.collectBound(p));
            }
            return true;
        });
        return result;
    }

    /**
     * Every name pinned ({@code ^name}) by any pattern inside {@code root}.
     */
    public static Set<String> pinnedAnywhere(Node root) {
        Set<String> result = new LinkedHashSet<>();
        walk(root, n -> {
            for (Pattern p : patternsOf(n)) {
                result.addAll(PatternUtility.collectPinned(p));
            }
            return true;
        });
        return result;
    }

    /**
     * Names a statement binds in the enclosing block: the pattern of a top-level match, and of
     * chained matches {@code a = b = expr}.
     */
    public static Set<String> statementBinds(Node statement) {
        Set<String> result = new LinkedHashSet<>();
        Node current = statement;
        while (current instanceof Match m) {
            result.addAll(PatternUtility.collectBound(m.pattern()));
            current = m.value();
        }
        return result;
    }

    public static boolean isLiteral(Node n) {
        return n instanceof IntLit || n instanceof FloatLit || n instanceof BoolLit || n instanceof AtomLit
                || n instanceof NilLit || (n instanceof StringLit s && !s.isInterpolated());
    }

    /**
     * Side-effect free and exception free by construction: literals, variable and attribute
     * reads, captures and closures, and containers of those.
     */
    public static boolean isTriviallyPure(Node n) {
        if (n == null) {
            return true;
        }
        if (isLiteral(n) || n instanceof Var || n instanceof AliasRef || n instanceof AttributeRef
                || n instanceof Capture || n instanceof Fn) {
            return true;
        }
        if (n instanceof StringLit s) {
            // interpolation calls String.Chars, which may raise
            return !s.isInterpolated();
        }
        if (n instanceof Unary u && u.op().equals("-")) {
            return u.operand() instanceof IntLit || u.operand() instanceof FloatLit;
        }
        if (n instanceof ListLit || n instanceof TupleLit || n instanceof MapLit || n instanceof ConsLit) {
            for (Node c : children(n)) {
                if (!isTriviallyPure(c)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    public static boolean containsRaw(Node root) {
        return anyMatch(root, n -> n instanceof Raw);
    }

    /**
     * True when {@code root} reads {@code name} as a plain variable somewhere, ignoring scoping.
     */
    public static boolean mentionsVar(Node root, String name) {
        return anyMatch(root, n -> n instanceof Var v && v.name().equals(name));
    }

    /**
     * The statements of a block, or a singleton list for any other node.
     */
    public static List<Node> statementsOf(Node n) {
        return n instanceof Block b ? b.statements() : List.of(n);
    }

    /**
     * The value-producing last statement of a body.
     */
    public static Node lastStatement(Node n) {
        List<Node> s = statementsOf(n);
        return s.isEmpty() ? n : s.get(s.size() - 1);
    }

    private static final class ChildCollector implements NodeVisitor<List<Node>> {

        private static List<Node> of(Node... nodes) {
            List<Node> result = new ArrayList<>(nodes.length);
            for (Node n : nodes) {
                if (n != null) {
                    result.add(n);
                }
            }
            return result;
        }

        private static List<Node> entries(List<MapEntry> entries) {
            List<Node> result = new ArrayList<>();
            for (MapEntry e : entries) {
                result.add(e.key());
                result.add(e.value());
            }
            return result;
        }

        private static void clauses(List<Node> into, List<CaseClause> clauses) {
            for (CaseClause c : clauses) {
                if (c.guard() != null) {
                    into.add(c.guard());
                }
                into.add(c.body());
            }
        }

        public List<Node> visit(IntLit n) {
            return List.of();
        }

        public List<Node> visit(FloatLit n) {
            return List.of();
        }

        public List<Node> visit(StringLit n) {
            return List.of();
        }

        public List<Node> visit(BoolLit n) {
            return List.of();
        }

        public List<Node> visit(AtomLit n) {
            return List.of();
        }

        public List<Node> visit(NilLit n) {
            return List.of();
        }

        public List<Node> visit(ListLit n) {
            return n.elements();
        }

        public List<Node> visit(ConsLit n) {
            List<Node> result = new ArrayList<>(n.heads());
            result.add(n.tail());
            return result;
        }

        public List<Node> visit(TupleLit n) {
            return n.elements();
        }

        public List<Node> visit(MapLit n) {
            return entries(n.entries());
        }

        public List<Node> visit(MapUpdate n) {
            List<Node> result = new ArrayList<>();
            result.add(n.base());
            result.addAll(entries(n.entries()));
            return result;
        }

        public List<Node> visit(StructLit n) {
            return entries(n.fields());
        }

        public List<Node> visit(Var n) {
            return List.of();
        }

        public List<Node> visit(AliasRef n) {
            return List.of();
        }

        public List<Node> visit(Field n) {
            return List.of(n.target());
        }

        public List<Node> visit(Access n) {
            return List.of(n.target(), n.key());
        }

        public List<Node> visit(AttributeRef n) {
            return List.of();
        }

        public List<Node> visit(Binary n) {
            return List.of(n.left(), n.right());
        }

        public List<Node> visit(Unary n) {
            return List.of(n.operand());
        }

        public List<Node> visit(Block n) {
            return n.statements();
        }

        public List<Node> visit(If n) {
            return of(n.condition(), n.then(), n.orElse());
        }

        public List<Node> visit(Unless n) {
            return of(n.condition(), n.then(), n.orElse());
        }

        public List<Node> visit(Case n) {
            List<Node> result = new ArrayList<>();
            result.add(n.subject());
            clauses(result, n.clauses());
            return result;
        }

        public List<Node> visit(Cond n) {
            List<Node> result = new ArrayList<>();
            for (CondClause c : n.clauses()) {
                result.add(c.condition());
                result.add(c.body());
            }
            return result;
        }

        public List<Node> visit(With n) {
            List<Node> result = new ArrayList<>();
            for (WithClause c : n.clauses()) {
                result.add(c.value());
                if (c.guard() != null) {
                    result.add(c.guard());
                }
            }
            result.add(n.body());
            clauses(result, n.elseClauses());
            return result;
        }

        public List<Node> visit(Try n) {
            List<Node> result = new ArrayList<>();
            result.add(n.body());
            n.rescues().forEach(r -> result.add(r.body()));
            for (CatchClause c : n.catches()) {
                if (c.guard() != null) {
                    result.add(c.guard());
                }
                result.add(c.body());
            }
            clauses(result, n.elseClauses());
            if (n.after() != null) {
                result.add(n.after());
            }
            return result;
        }

        public List<Node> visit(Receive n) {
            List<Node> result = new ArrayList<>();
            clauses(result, n.clauses());
            result.addAll(of(n.timeout(), n.afterBody()));
            return result;
        }

        public List<Node> visit(Match n) {
            return List.of(n.value());
        }

        public List<Node> visit(For n) {
            List<Node> result = new ArrayList<>();
            for (Generator g : n.generators()) {
                result.add(g.source());
            }
            result.addAll(n.filters());
            result.addAll(of(n.into(), n.body()));
            return result;
        }

        public List<Node> visit(LocalCall n) {
            return n.args();
        }

        public List<Node> visit(RemoteCall n) {
            List<Node> result = new ArrayList<>();
            result.add(n.module());
            result.addAll(n.args());
            return result;
        }

        public List<Node> visit(ApplyFn n) {
            List<Node> result = new ArrayList<>();
            result.add(n.fn());
            result.addAll(n.args());
            return result;
        }

        public List<Node> visit(Fn n) {
            List<Node> result = new ArrayList<>();
            for (FnClause c : n.clauses()) {
                if (c.guard() != null) {
                    result.add(c.guard());
                }
                result.add(c.body());
            }
            return result;
        }

        public List<Node> visit(Capture n) {
            return of(n.module());
        }

        public List<Node> visit(CaptureArg n) {
            return List.of();
        }

        public List<Node> visit(ModuleDef n) {
            return List.of(n.body());
        }

        public List<Node> visit(FunctionDef n) {
            return of(n.guard(), n.body());
        }

        public List<Node> visit(Import n) {
            return of(n.options());
        }

        public List<Node> visit(Alias n) {
            return List.of();
        }

        public List<Node> visit(Require n) {
            return List.of();
        }

        public List<Node> visit(Use n) {
            return of(n.options());
        }

        public List<Node> visit(Attribute n) {
            return List.of(n.value());
        }

        public List<Node> visit(Raw n) {
            return List.of();
        }
    }
}
