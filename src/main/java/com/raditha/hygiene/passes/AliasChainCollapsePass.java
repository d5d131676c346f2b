package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.UsageIndex;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.Match;
import com.raditha.hygiene.model.Node.Var;
import com.raditha.hygiene.model.Pattern.PBind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Collapses redundant intermediate bindings left behind by lowering.
 * <p>
 * Two shapes are recognized, where the usage question is always asked about the statements after
 * the chain:
 * <ul>
 *     <li>{@code a = b = expr}: keep whichever name is still read, or {@code a} when neither is</li>
 *     <li>{@code b = expr; a = b}: {@code a = expr} when {@code b} is not read again, otherwise
 *     {@code b = expr} alone when {@code a} is not read again</li>
 * </ul>
 * A name flagged {@code PRESERVE_NAME} is never the one dropped.
 */
public class AliasChainCollapsePass extends AbstractStatementWindowPass {

    private static final Logger logger = LoggerFactory.getLogger(AliasChainCollapsePass.class);

    @Override
    public String name() {
        return "alias-chain-collapse";
    }

    @Override
    protected Optional<Rewrite> matchAt(List<Node> statements, int i, UsageIndex usage) {
        Node statement = statements.get(i);
        if (!(statement instanceof Match outer) || !(outer.pattern() instanceof PBind a) || a.isWildcard()) {
            return Optional.empty();
        }
        if (outer.value() instanceof Match inner && inner.pattern() instanceof PBind b && !b.isWildcard()) {
            return nested(statements, i, usage, outer, a, inner, b);
        }
        if (i + 1 < statements.size() && statements.get(i + 1) instanceof Match next
                && next.pattern() instanceof PBind alias && !alias.isWildcard()
                && next.value() instanceof Var v && v.name().equals(a.name()) && !alias.name().equals(a.name())) {
            return sequential(statements, i, usage, outer, a, next, alias);
        }
        return Optional.empty();
    }

    private Optional<Rewrite> nested(List<Node> statements, int i, UsageIndex usage,
                                     Match outer, PBind a, Match inner, PBind b) {
        if (a.name().equals(b.name())) {
            return Optional.of(Rewrite.of(1, new Match(a, inner.value(), outer.meta())));
        }
        boolean aUsed = usage.usedLater(i + 1, a.name()) || isLast(statements, i);
        boolean bUsed = usage.usedLater(i + 1, b.name());
        if (!bUsed && !b.has(MetaFlag.PRESERVE_NAME)) {
            logger.debug("Collapsed {} = {} = ... keeping {}", a.name(), b.name(), a.name());
            return Optional.of(Rewrite.of(1, new Match(a, inner.value(), outer.meta())));
        }
        if (!aUsed && !a.has(MetaFlag.PRESERVE_NAME)) {
            logger.debug("Collapsed {} = {} = ... keeping {}", a.name(), b.name(), b.name());
            return Optional.of(Rewrite.of(1, new Match(b, inner.value(), outer.meta())));
        }
        return Optional.empty();
    }

    private Optional<Rewrite> sequential(List<Node> statements, int i, UsageIndex usage,
                                         Match first, PBind b, Match second, PBind a) {
        boolean bUsed = usage.usedLater(i + 2, b.name());
        if (!bUsed && !b.has(MetaFlag.PRESERVE_NAME)) {
            logger.debug("Collapsed {} = expr; {} = {}", b.name(), a.name(), b.name());
            return Optional.of(Rewrite.of(2, new Match(a, first.value(), second.meta())));
        }
        boolean aUsed = usage.usedLater(i + 2, a.name()) || isLast(statements, i + 1);
        if (!aUsed && !a.has(MetaFlag.PRESERVE_NAME)) {
            logger.debug("Dropped unused alias {} of {}", a.name(), b.name());
            return Optional.of(Rewrite.of(2, first));
        }
        return Optional.empty();
    }
}
