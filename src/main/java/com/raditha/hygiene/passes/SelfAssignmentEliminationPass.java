package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.UsageIndex;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.Match;
import com.raditha.hygiene.model.Node.Var;
import com.raditha.hygiene.model.Pattern.PBind;

import java.util.List;
import java.util.Optional;

/**
 * Removes {@code x = x}. In final position the statement is replaced by the read {@code x}.
 */
public class SelfAssignmentEliminationPass extends AbstractStatementWindowPass {

    @Override
    public String name() {
        return "self-assignment-elimination";
    }

    @Override
    protected Optional<Rewrite> matchAt(List<Node> statements, int i, UsageIndex usage) {
        if (statements.get(i) instanceof Match m && m.pattern() instanceof PBind b
                && m.value() instanceof Var v && v.name().equals(b.name())) {
            return Optional.of(isLast(statements, i) ? Rewrite.of(1, v) : Rewrite.drop(1));
        }
        return Optional.empty();
    }
}
