package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.UsageIndex;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Pattern.PBind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Inlines single-use temporaries:
 * <ul>
 *     <li>{@code t = e; t} at the end of a block becomes {@code e}</li>
 *     <li>{@code t = e; f(t, ...)} becomes {@code f(e, ...)} when {@code t} is read nowhere else in
 *     the call and never afterwards; the call may also be the value of a match</li>
 * </ul>
 * Moving {@code e} into the first argument keeps evaluation order: it is still evaluated before
 * every other argument. Binders flagged {@code PRESERVE_NAME} are not inlined.
 */
public class RedundantTemporaryInliningPass extends AbstractStatementWindowPass {

    private static final Logger logger = LoggerFactory.getLogger(RedundantTemporaryInliningPass.class);

    @Override
    public String name() {
        return "redundant-temporary-inlining";
    }

    @Override
    protected Optional<Rewrite> matchAt(List<Node> statements, int i, UsageIndex usage) {
        if (i + 1 >= statements.size() || !(statements.get(i) instanceof Match m)
                || !(m.pattern() instanceof PBind t) || t.isWildcard() || t.has(MetaFlag.PRESERVE_NAME)) {
            return Optional.empty();
        }
        Node next = statements.get(i + 1);
        if (isLast(statements, i + 1) && next instanceof Var v && v.name().equals(t.name())) {
            logger.debug("Inlined trailing temporary {}", t.name());
            return Optional.of(Rewrite.of(2, m.value()));
        }
        if (usage.readsAt(i + 1).wildcard() || usage.readsAt(i + 1).count(t.name()) != 1
                || usage.usedLater(i + 2, t.name())) {
            return Optional.empty();
        }
        Node call = next instanceof Match nm ? nm.value() : next;
        Node inlined = withFirstArgument(call, t.name(), m.value());
        if (inlined == null) {
            return Optional.empty();
        }
        Node replacement = next instanceof Match nm ? new Match(nm.pattern(), inlined, nm.meta()) : inlined;
        logger.debug("Inlined temporary {} into the following call", t.name());
        return Optional.of(Rewrite.of(2, replacement));
    }

    private static Node withFirstArgument(Node call, String name, Node value) {
        if (call instanceof LocalCall c && firstArgIs(c.args(), name)) {
            return new LocalCall(c.name(), replaceFirst(c.args(), value), c.meta());
        }
        if (call instanceof RemoteCall c && c.module() instanceof AliasRef && firstArgIs(c.args(), name)) {
            return new RemoteCall(c.module(), c.name(), replaceFirst(c.args(), value), c.meta());
        }
        return null;
    }

    private static boolean firstArgIs(List<Node> args, String name) {
        return !args.isEmpty() && args.get(0) instanceof Var v && v.name().equals(name);
    }

    private static List<Node> replaceFirst(List<Node> args, Node value) {
        List<Node> copy = new ArrayList<>(args);
        copy.set(0, value);
        return copy;
    }
}
