package com.raditha.hygiene.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable intermediate tree of generated Elixir source.
 * <p>
 * Every variant is a record; rewrites always build new instances. Dispatch over the variants goes
 * through {@link NodeVisitor}, which has one method per record, so adding a variant without
 * teaching the visitors about it is a compile error rather than a silent fallback.
 */
public sealed interface Node {

    Meta meta();

    Node withMeta(Meta meta);

    <R> R accept(NodeVisitor<R> visitor);

    default boolean has(MetaFlag flag) {
        return meta().has(flag);
    }

    // --- Literals ---

    record IntLit(long value, Meta meta) implements Node {
        public IntLit(long value) {
            this(value, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new IntLit(value, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    record FloatLit(double value, Meta meta) implements Node {
        public FloatLit(double value) {
            this(value, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new FloatLit(value, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /**
     * Double-quoted string. {@code value} is the raw source text between the quotes and may
     * contain {@code #{...}} interpolation spans.
     */
    record StringLit(String value, Meta meta) implements Node {
        public StringLit {
            Objects.requireNonNull(value, "value");
        }

        public StringLit(String value) {
            this(value, Meta.NONE);
        }

        public boolean isInterpolated() {
            return value.contains("#{");
        }

        public Node withMeta(Meta m) {
            return new StringLit(value, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    record BoolLit(boolean value, Meta meta) implements Node {
        public BoolLit(boolean value) {
            this(value, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new BoolLit(value, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    record AtomLit(String name, Meta meta) implements Node {
        public AtomLit {
            Objects.requireNonNull(name, "name");
        }

        public AtomLit(String name) {
            this(name, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new AtomLit(name, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    record NilLit(Meta meta) implements Node {
        public NilLit() {
            this(Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new NilLit(m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    // --- Containers ---

    record ListLit(List<Node> elements, Meta meta) implements Node {
        public ListLit {
            elements = List.copyOf(elements);
        }

        public ListLit(List<Node> elements) {
            this(elements, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new ListLit(elements, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** {@code [h1, h2 | tail]} in expression position. */
    record ConsLit(List<Node> heads, Node tail, Meta meta) implements Node {
        public ConsLit {
            heads = List.copyOf(heads);
            Objects.requireNonNull(tail, "tail");
        }

        public ConsLit(List<Node> heads, Node tail) {
            this(heads, tail, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new ConsLit(heads, tail, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    record TupleLit(List<Node> elements, Meta meta) implements Node {
        public TupleLit {
            elements = List.copyOf(elements);
        }

        public TupleLit(List<Node> elements) {
            this(elements, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new TupleLit(elements, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    record MapLit(List<MapEntry> entries, Meta meta) implements Node {
        public MapLit {
            entries = List.copyOf(entries);
        }

        public MapLit(List<MapEntry> entries) {
            this(entries, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new MapLit(entries, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** {@code %{base | k => v}}. */
    record MapUpdate(Node base, List<MapEntry> entries, Meta meta) implements Node {
        public MapUpdate {
            Objects.requireNonNull(base, "base");
            entries = List.copyOf(entries);
        }

        public MapUpdate(Node base, List<MapEntry> entries) {
            this(base, entries, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new MapUpdate(base, entries, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    record StructLit(String module, List<MapEntry> fields, Meta meta) implements Node {
        public StructLit {
            Objects.requireNonNull(module, "module");
            fields = List.copyOf(fields);
        }

        public StructLit(String module, List<MapEntry> fields) {
            this(module, fields, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new StructLit(module, fields, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    // --- References ---

    record Var(String name, Meta meta) implements Node {
        public Var {
            Objects.requireNonNull(name, "name");
        }

        public Var(String name) {
            this(name, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Var(name, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** A module name such as {@code Enum} or {@code MyApp.Repo}. */
    record AliasRef(String name, Meta meta) implements Node {
        public AliasRef {
            Objects.requireNonNull(name, "name");
        }

        public AliasRef(String name) {
            this(name, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new AliasRef(name, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** {@code target.field} without parentheses. */
    record Field(Node target, String field, Meta meta) implements Node {
        public Field {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(field, "field");
        }

        public Field(Node target, String field) {
            this(target, field, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Field(target, field, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** {@code target[key]}. */
    record Access(Node target, Node key, Meta meta) implements Node {
        public Access {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(key, "key");
        }

        public Access(Node target, Node key) {
            this(target, key, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Access(target, key, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** A read of a module attribute, {@code @name}. */
    record AttributeRef(String name, Meta meta) implements Node {
        public AttributeRef {
            Objects.requireNonNull(name, "name");
        }

        public AttributeRef(String name) {
            this(name, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new AttributeRef(name, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    // --- Operators ---

    record Binary(String op, Node left, Node right, Meta meta) implements Node {
        public Binary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        public Binary(String op, Node left, Node right) {
            this(op, left, right, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Binary(op, left, right, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    record Unary(String op, Node operand, Meta meta) implements Node {
        public Unary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
        }

        public Unary(String op, Node operand) {
            this(op, operand, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Unary(op, operand, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    // --- Control forms ---

    /** A statement sequence; its value is the value of the last statement. */
    record Block(List<Node> statements, Meta meta) implements Node {
        public Block {
            statements = List.copyOf(statements);
        }

        public Block(List<Node> statements) {
            this(statements, Meta.NONE);
        }

        public Block withStatements(List<Node> stmts) {
            return new Block(stmts, meta);
        }

        public Node withMeta(Meta m) {
            return new Block(statements, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** {@code if}; {@code orElse} is {@code null} when there is no else branch. */
    record If(Node condition, Node then, Node orElse, Meta meta) implements Node {
        public If {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(then, "then");
        }

        public If(Node condition, Node then, Node orElse) {
            this(condition, then, orElse, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new If(condition, then, orElse, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    record Unless(Node condition, Node then, Node orElse, Meta meta) implements Node {
        public Unless {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(then, "then");
        }

        public Unless(Node condition, Node then, Node orElse) {
            this(condition, then, orElse, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Unless(condition, then, orElse, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    record Case(Node subject, List<CaseClause> clauses, Meta meta) implements Node {
        public Case {
            Objects.requireNonNull(subject, "subject");
            clauses = List.copyOf(clauses);
        }

        public Case(Node subject, List<CaseClause> clauses) {
            this(subject, clauses, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Case(subject, clauses, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    record Cond(List<CondClause> clauses, Meta meta) implements Node {
        public Cond {
            clauses = List.copyOf(clauses);
        }

        public Cond(List<CondClause> clauses) {
            this(clauses, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Cond(clauses, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    record With(List<WithClause> clauses, Node body, List<CaseClause> elseClauses, Meta meta) implements Node {
        public With {
            clauses = List.copyOf(clauses);
            Objects.requireNonNull(body, "body");
            elseClauses = elseClauses == null ? List.of() : List.copyOf(elseClauses);
        }

        public With(List<WithClause> clauses, Node body, List<CaseClause> elseClauses) {
            this(clauses, body, elseClauses, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new With(clauses, body, elseClauses, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** {@code try} with optional rescue, catch, else and after sections; {@code after} may be {@code null}. */
    record Try(Node body, List<RescueClause> rescues, List<CatchClause> catches,
               List<CaseClause> elseClauses, Node after, Meta meta) implements Node {
        public Try {
            Objects.requireNonNull(body, "body");
            rescues = rescues == null ? List.of() : List.copyOf(rescues);
            catches = catches == null ? List.of() : List.copyOf(catches);
            elseClauses = elseClauses == null ? List.of() : List.copyOf(elseClauses);
        }

        public Try(Node body, List<RescueClause> rescues, List<CatchClause> catches,
                   List<CaseClause> elseClauses, Node after) {
            this(body, rescues, catches, elseClauses, after, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Try(body, rescues, catches, elseClauses, after, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** {@code receive}; {@code timeout} and {@code afterBody} are both {@code null} without an after section. */
    record Receive(List<CaseClause> clauses, Node timeout, Node afterBody, Meta meta) implements Node {
        public Receive {
            clauses = List.copyOf(clauses);
        }

        public Receive(List<CaseClause> clauses, Node timeout, Node afterBody) {
            this(clauses, timeout, afterBody, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Receive(clauses, timeout, afterBody, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    // --- Binding forms ---

    /** {@code pattern = value}. */
    record Match(Pattern pattern, Node value, Meta meta) implements Node {
        public Match {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(value, "value");
        }

        public Match(Pattern pattern, Node value) {
            this(pattern, value, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Match(pattern, value, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** Comprehension; {@code into} may be {@code null}. */
    record For(List<Generator> generators, List<Node> filters, Node into, Node body, Meta meta) implements Node {
        public For {
            generators = List.copyOf(generators);
            filters = filters == null ? List.of() : List.copyOf(filters);
            Objects.requireNonNull(body, "body");
        }

        public For(List<Generator> generators, List<Node> filters, Node into, Node body) {
            this(generators, filters, into, body, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new For(generators, filters, into, body, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    // --- Calls ---

    record LocalCall(String name, List<Node> args, Meta meta) implements Node {
        public LocalCall {
            Objects.requireNonNull(name, "name");
            args = List.copyOf(args);
        }

        public LocalCall(String name, List<Node> args) {
            this(name, args, Meta.NONE);
        }

        public int arity() {
            return args.size();
        }

        public Node withMeta(Meta m) {
            return new LocalCall(name, args, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** {@code Module.name(args)}; the module is usually an {@link AliasRef} or an {@link AtomLit}. */
    record RemoteCall(Node module, String name, List<Node> args, Meta meta) implements Node {
        public RemoteCall {
            Objects.requireNonNull(module, "module");
            Objects.requireNonNull(name, "name");
            args = List.copyOf(args);
        }

        public RemoteCall(Node module, String name, List<Node> args) {
            this(module, name, args, Meta.NONE);
        }

        public RemoteCall(String module, String name, List<Node> args) {
            this(new AliasRef(module), name, args, Meta.NONE);
        }

        public boolean isOn(String moduleName, String function) {
            return module instanceof AliasRef a && a.name().equals(moduleName) && name.equals(function);
        }

        public Node withMeta(Meta m) {
            return new RemoteCall(module, name, args, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** {@code fun.(args)}. */
    record ApplyFn(Node fn, List<Node> args, Meta meta) implements Node {
        public ApplyFn {
            Objects.requireNonNull(fn, "fn");
            args = List.copyOf(args);
        }

        public ApplyFn(Node fn, List<Node> args) {
            this(fn, args, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new ApplyFn(fn, args, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** Anonymous function literal with one or more clauses. */
    record Fn(List<FnClause> clauses, Meta meta) implements Node {
        public Fn {
            clauses = List.copyOf(clauses);
        }

        public Fn(List<FnClause> clauses) {
            this(clauses, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Fn(clauses, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** {@code &name/arity} or {@code &Module.name/arity}; {@code module} is {@code null} for local captures. */
    record Capture(Node module, String name, int arity, Meta meta) implements Node {
        public Capture {
            Objects.requireNonNull(name, "name");
        }

        public Capture(Node module, String name, int arity) {
            this(module, name, arity, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Capture(module, name, arity, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** {@code &1}, {@code &2}, ... inside a capture expression. */
    record CaptureArg(int index, Meta meta) implements Node {
        public CaptureArg(int index) {
            this(index, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new CaptureArg(index, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    // --- Module level forms ---

    record ModuleDef(String name, Block body, Meta meta) implements Node {
        public ModuleDef {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(body, "body");
        }

        public ModuleDef(String name, Block body) {
            this(name, body, Meta.NONE);
        }

        public ModuleDef withBody(List<Node> statements) {
            return new ModuleDef(name, body.withStatements(statements), meta);
        }

        public Node withMeta(Meta m) {
            return new ModuleDef(name, body, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** One clause of a named function; {@code guard} may be {@code null}. */
    record FunctionDef(String name, DefKind kind, List<Pattern> params, Node guard, Node body, Meta meta)
            implements Node {
        public FunctionDef {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(kind, "kind");
            params = List.copyOf(params);
            Objects.requireNonNull(body, "body");
        }

        public FunctionDef(String name, DefKind kind, List<Pattern> params, Node body) {
            this(name, kind, params, null, body, Meta.NONE);
        }

        public int arity() {
            return params.size();
        }

        public String signature() {
            return name + "/" + params.size();
        }

        public Node withMeta(Meta m) {
            return new FunctionDef(name, kind, params, guard, body, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** {@code import Module, options}; {@code options} may be {@code null}. */
    record Import(String module, Node options, Meta meta) implements Node {
        public Import {
            Objects.requireNonNull(module, "module");
        }

        public Import(String module) {
            this(module, null, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Import(module, options, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** {@code alias Module} or {@code alias Module, as: As}; {@code as} may be {@code null}. */
    record Alias(String module, String as, Meta meta) implements Node {
        public Alias {
            Objects.requireNonNull(module, "module");
        }

        public Alias(String module, String as) {
            this(module, as, Meta.NONE);
        }

        /** The short name this directive makes available. */
        public String effectiveName() {
            if (as != null) {
                return as;
            }
            int dot = module.lastIndexOf('.');
            return dot < 0 ? module : module.substring(dot + 1);
        }

        public Node withMeta(Meta m) {
            return new Alias(module, as, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    record Require(String module, String as, Meta meta) implements Node {
        public Require {
            Objects.requireNonNull(module, "module");
        }

        public Require(String module) {
            this(module, null, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Require(module, as, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    record Use(String module, Node options, Meta meta) implements Node {
        public Use {
            Objects.requireNonNull(module, "module");
        }

        public Use(String module) {
            this(module, null, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Use(module, options, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** Module attribute definition {@code @name value}. */
    record Attribute(String name, Node value, Meta meta) implements Node {
        public Attribute {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }

        public Attribute(String name, Node value) {
            this(name, value, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Attribute(name, value, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }

    // --- Escape hatch ---

    /**
     * Source text the builder could not structure. Analyses treat it conservatively: any
     * identifier that appears in it on token boundaries counts as read.
     */
    record Raw(String code, Meta meta) implements Node {
        public Raw {
            Objects.requireNonNull(code, "code");
        }

        public Raw(String code) {
            this(code, Meta.NONE);
        }

        public Node withMeta(Meta m) {
            return new Raw(code, m);
        }

        public <R> R accept(NodeVisitor<R> v) {
            return v.visit(this);
        }
    }
}
