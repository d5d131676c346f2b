package com.raditha.hygiene.model;

/**
 * Exhaustive visitor over {@link Node} variants. One overload per record.
 *
 * @param <R> result type
 */
public interface NodeVisitor<R> {

    R visit(Node.IntLit n);

    R visit(Node.FloatLit n);

    R visit(Node.StringLit n);

    R visit(Node.BoolLit n);

    R visit(Node.AtomLit n);

    R visit(Node.NilLit n);

    R visit(Node.ListLit n);

    R visit(Node.ConsLit n);

    R visit(Node.TupleLit n);

    R visit(Node.MapLit n);

    R visit(Node.MapUpdate n);

    R visit(Node.StructLit n);

    R visit(Node.Var n);

    R visit(Node.AliasRef n);

    R visit(Node.Field n);

    R visit(Node.Access n);

    R visit(Node.AttributeRef n);

    R visit(Node.Binary n);

    R visit(Node.Unary n);

    R visit(Node.Block n);

    R visit(Node.If n);

    R visit(Node.Unless n);

    R visit(Node.Case n);

    R visit(Node.Cond n);

    R visit(Node.With n);

    R visit(Node.Try n);

    R visit(Node.Receive n);

    R visit(Node.Match n);

    R visit(Node.For n);

    R visit(Node.LocalCall n);

    R visit(Node.RemoteCall n);

    R visit(Node.ApplyFn n);

    R visit(Node.Fn n);

    R visit(Node.Capture n);

    R visit(Node.CaptureArg n);

    R visit(Node.ModuleDef n);

    R visit(Node.FunctionDef n);

    R visit(Node.Import n);

    R visit(Node.Alias n);

    R visit(Node.Require n);

    R visit(Node.Use n);

    R visit(Node.Attribute n);

    R visit(Node.Raw n);
}
