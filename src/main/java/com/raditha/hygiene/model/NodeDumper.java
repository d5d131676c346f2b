package com.raditha.hygiene.model;

import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Pattern.*;

import java.util.List;

/**
 * Renders a tree as an indented, Elixir-flavoured outline for logs, traces and test failure
 * messages. This is not the source printer: the output is readable but not guaranteed to be valid
 * Elixir. Blocks put one statement per line so that line diffs between passes stay small.
 */
public class NodeDumper implements NodeVisitor<Void> {

    private final StringBuilder out = new StringBuilder();
    private int indent;

    public static String dump(Node node) {
        NodeDumper dumper = new NodeDumper();
        node.accept(dumper);
        return dumper.out.toString();
    }

    public static String dump(Pattern pattern) {
        return pattern(pattern);
    }

    private void line() {
        out.append('\n').append("  ".repeat(indent));
    }

    private void node(Node n) {
        if (n == null) {
            out.append("nil");
        } else {
            n.accept(this);
        }
    }

    private void nodes(List<Node> list) {
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            node(list.get(i));
        }
    }

    private void entries(List<MapEntry> list) {
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            node(list.get(i).key());
            out.append(" => ");
            node(list.get(i).value());
        }
    }

    private void body(Node n) {
        indent++;
        if (n instanceof Block b) {
            for (Node s : b.statements()) {
                line();
                node(s);
            }
        } else {
            line();
            node(n);
        }
        indent--;
    }

    private void guard(Node g) {
        if (g != null) {
            out.append(" when ");
            node(g);
        }
    }

    private void clauses(List<CaseClause> list) {
        indent++;
        for (CaseClause c : list) {
            line();
            out.append(pattern(c.pattern()));
            guard(c.guard());
            out.append(" ->");
            body(c.body());
        }
        indent--;
    }

    static String pattern(Pattern p) {
        return p.accept(new PatternVisitor<>() {
            public String visit(PBind b) {
                return b.name();
            }

            public String visit(PTuple t) {
                return "{" + join(t.elements()) + "}";
            }

            public String visit(PList l) {
                return "[" + join(l.elements()) + "]";
            }

            public String visit(PCons c) {
                return "[" + join(c.heads()) + " | " + pattern(c.tail()) + "]";
            }

            public String visit(PMap m) {
                return "%{" + entries(m.entries()) + "}";
            }

            public String visit(PStruct s) {
                return "%" + s.module() + "{" + entries(s.fields()) + "}";
            }

            public String visit(PPin pin) {
                return "^" + pin.name();
            }

            public String visit(PAlias a) {
                return pattern(a.inner()) + " = " + a.name();
            }

            public String visit(PLiteral l) {
                return dump(l.literal());
            }

            private String join(List<Pattern> ps) {
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < ps.size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    sb.append(pattern(ps.get(i)));
                }
                return sb.toString();
            }

            private String entries(List<PMapEntry> es) {
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < es.size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    sb.append(dump(es.get(i).key())).append(" => ").append(pattern(es.get(i).value()));
                }
                return sb.toString();
            }
        });
    }

    @Override
    public Void visit(IntLit n) {
        out.append(n.value());
        return null;
    }

    @Override
    public Void visit(FloatLit n) {
        out.append(n.value());
        return null;
    }

    @Override
    public Void visit(StringLit n) {
        out.append('"').append(n.value()).append('"');
        return null;
    }

    @Override
    public Void visit(BoolLit n) {
        out.append(n.value());
        return null;
    }

    @Override
    public Void visit(AtomLit n) {
        out.append(':').append(n.name());
        return null;
    }

    @Override
    public Void visit(NilLit n) {
        out.append("nil");
        return null;
    }

    @Override
    public Void visit(ListLit n) {
        out.append('[');
        nodes(n.elements());
        out.append(']');
        return null;
    }

    @Override
    public Void visit(ConsLit n) {
        out.append('[');
        nodes(n.heads());
        out.append(" | ");
        node(n.tail());
        out.append(']');
        return null;
    }

    @Override
    public Void visit(TupleLit n) {
        out.append('{');
        nodes(n.elements());
        out.append('}');
        return null;
    }

    @Override
    public Void visit(MapLit n) {
        out.append("%{");
        entries(n.entries());
        out.append('}');
        return null;
    }

    @Override
    public Void visit(MapUpdate n) {
        out.append("%{");
        node(n.base());
        out.append(" | ");
        entries(n.entries());
        out.append('}');
        return null;
    }

    @Override
    public Void visit(StructLit n) {
        out.append('%').append(n.module()).append('{');
        entries(n.fields());
        out.append('}');
        return null;
    }

    @Override
    public Void visit(Var n) {
        out.append(n.name());
        return null;
    }

    @Override
    public Void visit(AliasRef n) {
        out.append(n.name());
        return null;
    }

    @Override
    public Void visit(Field n) {
        node(n.target());
        out.append('.').append(n.field());
        return null;
    }

    @Override
    public Void visit(Access n) {
        node(n.target());
        out.append('[');
        node(n.key());
        out.append(']');
        return null;
    }

    @Override
    public Void visit(AttributeRef n) {
        out.append('@').append(n.name());
        return null;
    }

    @Override
    public Void visit(Binary n) {
        out.append('(');
        node(n.left());
        out.append(' ').append(n.op()).append(' ');
        node(n.right());
        out.append(')');
        return null;
    }

    @Override
    public Void visit(Unary n) {
        out.append(n.op());
        if (Character.isLetter(n.op().charAt(0))) {
            out.append(' ');
        }
        node(n.operand());
        return null;
    }

    @Override
    public Void visit(Block n) {
        out.append("(");
        body(n);
        line();
        out.append(")");
        return null;
    }

    @Override
    public Void visit(If n) {
        conditional("if", n.condition(), n.then(), n.orElse());
        return null;
    }

    @Override
    public Void visit(Unless n) {
        conditional("unless", n.condition(), n.then(), n.orElse());
        return null;
    }

    private void conditional(String keyword, Node condition, Node then, Node orElse) {
        out.append(keyword).append(' ');
        node(condition);
        out.append(" do");
        body(then);
        if (orElse != null) {
            line();
            out.append("else");
            body(orElse);
        }
        line();
        out.append("end");
    }

    @Override
    public Void visit(Case n) {
        out.append("case ");
        node(n.subject());
        out.append(" do");
        clauses(n.clauses());
        line();
        out.append("end");
        return null;
    }

    @Override
    public Void visit(Cond n) {
        out.append("cond do");
        indent++;
        for (CondClause c : n.clauses()) {
            line();
            node(c.condition());
            out.append(" ->");
            body(c.body());
        }
        indent--;
        line();
        out.append("end");
        return null;
    }

    @Override
    public Void visit(With n) {
        out.append("with ");
        for (int i = 0; i < n.clauses().size(); i++) {
            WithClause c = n.clauses().get(i);
            if (i > 0) {
                out.append(", ");
            }
            out.append(pattern(c.pattern()));
            guard(c.guard());
            out.append(" <- ");
            node(c.value());
        }
        out.append(" do");
        body(n.body());
        if (!n.elseClauses().isEmpty()) {
            line();
            out.append("else");
            clauses(n.elseClauses());
        }
        line();
        out.append("end");
        return null;
    }

    @Override
    public Void visit(Try n) {
        out.append("try do");
        body(n.body());
        if (!n.rescues().isEmpty()) {
            line();
            out.append("rescue");
            indent++;
            for (RescueClause r : n.rescues()) {
                line();
                if (r.binder() != null) {
                    out.append(pattern(r.binder()));
                    if (!r.exceptions().isEmpty()) {
                        out.append(" in ");
                    }
                }
                out.append(String.join(", ", r.exceptions())).append(" ->");
                body(r.body());
            }
            indent--;
        }
        if (!n.catches().isEmpty()) {
            line();
            out.append("catch");
            indent++;
            for (CatchClause c : n.catches()) {
                line();
                if (c.kind() != null) {
                    out.append(pattern(c.kind())).append(", ");
                }
                out.append(pattern(c.value()));
                guard(c.guard());
                out.append(" ->");
                body(c.body());
            }
            indent--;
        }
        if (!n.elseClauses().isEmpty()) {
            line();
            out.append("else");
            clauses(n.elseClauses());
        }
        if (n.after() != null) {
            line();
            out.append("after");
            body(n.after());
        }
        line();
        out.append("end");
        return null;
    }

    @Override
    public Void visit(Receive n) {
        out.append("receive do");
        clauses(n.clauses());
        if (n.afterBody() != null) {
            line();
            out.append("after ");
            node(n.timeout());
            out.append(" ->");
            body(n.afterBody());
        }
        line();
        out.append("end");
        return null;
    }

    @Override
    public Void visit(Match n) {
        out.append(pattern(n.pattern())).append(" = ");
        node(n.value());
        return null;
    }

    @Override
    public Void visit(For n) {
        out.append("for ");
        for (int i = 0; i < n.generators().size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            out.append(pattern(n.generators().get(i).pattern())).append(" <- ");
            node(n.generators().get(i).source());
        }
        for (Node f : n.filters()) {
            out.append(", ");
            node(f);
        }
        if (n.into() != null) {
            out.append(", into: ");
            node(n.into());
        }
        out.append(" do");
        body(n.body());
        line();
        out.append("end");
        return null;
    }

    @Override
    public Void visit(LocalCall n) {
        out.append(n.name()).append('(');
        nodes(n.args());
        out.append(')');
        return null;
    }

    @Override
    public Void visit(RemoteCall n) {
        node(n.module());
        out.append('.').append(n.name()).append('(');
        nodes(n.args());
        out.append(')');
        return null;
    }

    @Override
    public Void visit(ApplyFn n) {
        node(n.fn());
        out.append(".(");
        nodes(n.args());
        out.append(')');
        return null;
    }

    @Override
    public Void visit(Fn n) {
        out.append("fn");
        indent++;
        for (FnClause c : n.clauses()) {
            line();
            for (int i = 0; i < c.params().size(); i++) {
                out.append(i > 0 ? ", " : "").append(pattern(c.params().get(i)));
            }
            guard(c.guard());
            out.append(" ->");
            body(c.body());
        }
        indent--;
        line();
        out.append("end");
        return null;
    }

    @Override
    public Void visit(Capture n) {
        out.append('&');
        if (n.module() != null) {
            node(n.module());
            out.append('.');
        }
        out.append(n.name()).append('/').append(n.arity());
        return null;
    }

    @Override
    public Void visit(CaptureArg n) {
        out.append('&').append(n.index());
        return null;
    }

    @Override
    public Void visit(ModuleDef n) {
        out.append("defmodule ").append(n.name()).append(" do");
        body(n.body());
        line();
        out.append("end");
        return null;
    }

    @Override
    public Void visit(FunctionDef n) {
        out.append(n.kind().keyword()).append(' ').append(n.name()).append('(');
        for (int i = 0; i < n.params().size(); i++) {
            out.append(i > 0 ? ", " : "").append(pattern(n.params().get(i)));
        }
        out.append(')');
        guard(n.guard());
        out.append(" do");
        body(n.body());
        line();
        out.append("end");
        return null;
    }

    @Override
    public Void visit(Import n) {
        out.append("import ").append(n.module());
        if (n.options() != null) {
            out.append(", ");
            node(n.options());
        }
        return null;
    }

    @Override
    public Void visit(Alias n) {
        out.append("alias ").append(n.module());
        if (n.as() != null) {
            out.append(", as: ").append(n.as());
        }
        return null;
    }

    @Override
    public Void visit(Require n) {
        out.append("require ").append(n.module());
        if (n.as() != null) {
            out.append(", as: ").append(n.as());
        }
        return null;
    }

    @Override
    public Void visit(Use n) {
        out.append("use ").append(n.module());
        if (n.options() != null) {
            out.append(", ");
            node(n.options());
        }
        return null;
    }

    @Override
    public Void visit(Attribute n) {
        out.append('@').append(n.name()).append(' ');
        node(n.value());
        return null;
    }

    @Override
    public Void visit(Raw n) {
        out.append(n.code());
        return null;
    }
}
