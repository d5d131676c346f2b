package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.ClosureCaptureAnalyzer;
import com.raditha.hygiene.analysis.UsageIndex;
import com.raditha.hygiene.model.FnClause;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Nodes;
import com.raditha.hygiene.model.Pattern;
import com.raditha.hygiene.model.Pattern.PBind;
import com.raditha.hygiene.util.Names;
import com.raditha.hygiene.util.NodeQueries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A loop body that rebinds an outer variable has no effect outside the closure:
 * <pre>
 * Enum.each(xs, fn x -> acc = g(acc, x) end)
 * </pre>
 * When that variable is read after the loop, the loop is turned into a reduce that threads it:
 * <pre>
 * acc = Enum.reduce(xs, acc, fn x, acc -> g(acc, x) end)
 * </pre>
 */
public class LoopRebindToReducePass extends AbstractStatementWindowPass {

    private static final Logger logger = LoggerFactory.getLogger(LoopRebindToReducePass.class);

    @Override
    public String name() {
        return "loop-rebind-to-reduce";
    }

    @Override
    protected Optional<Rewrite> matchAt(List<Node> statements, int i, UsageIndex usage) {
        if (isLast(statements, i) || !(statements.get(i) instanceof RemoteCall call)
                || !call.isOn("Enum", "each") || call.args().size() != 2
                || !(call.args().get(1) instanceof Fn fn) || fn.clauses().size() != 1) {
            return Optional.empty();
        }
        FnClause clause = fn.clauses().get(0);
        if (clause.guard() != null || clause.params().size() != 1 || !(clause.params().get(0) instanceof PBind x)) {
            return Optional.empty();
        }
        Set<String> captured = ClosureCaptureAnalyzer.findCapturedVariables(fn).names();
        Set<String> rebound = ClosureCaptureAnalyzer.findShadowingRebinds(fn, captured);
        if (rebound.size() != 1) {
            return Optional.empty();
        }
        String acc = rebound.iterator().next();
        if (acc.equals(x.name()) || Names.isUnderscored(acc) || !usage.usedLater(i + 1, acc)) {
            return Optional.empty();
        }

        List<Node> body = new ArrayList<>(NodeQueries.statementsOf(clause.body()));
        Node last = body.get(body.size() - 1);
        if (last instanceof Match m && m.pattern() instanceof PBind b && b.name().equals(acc)) {
            body.set(body.size() - 1, m.value());
        } else {
            body.add(new Var(acc));
        }
        List<Pattern> params = List.of(x, new PBind(acc));
        Fn step = new Fn(List.of(new FnClause(params, Nodes.fromStatements(body, clause.body().meta()))), fn.meta());
        Node reduce = new RemoteCall(call.module(), "reduce", List.of(call.args().get(0), new Var(acc), step),
                call.meta());
        logger.debug("Rewrote Enum.each rebinding {} into Enum.reduce", acc);
        return Optional.of(Rewrite.of(1, new Match(new PBind(acc), reduce, call.meta())));
    }
}
