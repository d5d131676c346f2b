package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.UsageIndex;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.Match;
import com.raditha.hygiene.model.Pattern;
import com.raditha.hygiene.model.Pattern.PBind;
import com.raditha.hygiene.util.Names;
import com.raditha.hygiene.util.NodeQueries;
import com.raditha.hygiene.util.PatternUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Block-level counterpart of {@link BinderHygienePass}: the binders of a {@code pattern = value}
 * statement are marked unused when the binding dies before it is read, and unmarked when later
 * statements read them under the underscored name.
 * <p>
 * Liveness stops at the next rebind of the name: in {@code x = 1; x = 2; f(x)} the first
 * {@code x} becomes {@code _x}.
 */
public class AssignmentHygienePass extends AbstractStatementWindowPass {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentHygienePass.class);

    @Override
    public String name() {
        return "assignment-hygiene";
    }

    @Override
    protected Optional<Rewrite> matchAt(List<Node> statements, int i, UsageIndex usage) {
        if (!(statements.get(i) instanceof Match m) || m.value() instanceof Match || m.has(MetaFlag.PRESERVE_NAME)) {
            return Optional.empty();
        }
        Map<String, Integer> counts = new HashMap<>();
        for (PBind b : PatternUtility.binders(m.pattern())) {
            counts.merge(b.name(), 1, Integer::sum);
        }
        for (PBind b : PatternUtility.binders(m.pattern())) {
            String name = b.name();
            if (b.isWildcard() || b.has(MetaFlag.PRESERVE_NAME) || counts.get(name) != 1) {
                continue;
            }
            if (!Names.isUnderscored(name)) {
                Optional<Rewrite> r = markUnused(m, i, usage, name, counts);
                if (r.isPresent()) {
                    return r;
                }
            } else {
                Optional<Rewrite> r = unmark(statements, m, i, usage, name, counts);
                if (r.isPresent()) {
                    return r;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Rewrite> markUnused(Match m, int i, UsageIndex usage, String name, Map<String, Integer> counts) {
        String target = Names.underscore(name);
        if (usage.liveAt(i + 1, name) || counts.containsKey(target) || usage.usedLater(i + 1, target)) {
            return Optional.empty();
        }
        logger.debug("Binding {} is dead; marking it unused", name);
        Pattern p = PatternUtility.renameBinder(m.pattern(), name, target);
        return Optional.of(Rewrite.of(1, new Match(p, m.value(), m.meta())));
    }

    private Optional<Rewrite> unmark(List<Node> statements, Match m, int i, UsageIndex usage,
                                     String name, Map<String, Integer> counts) {
        String target = name.substring(1);
        if (!Names.isVariableName(target) || counts.containsKey(target)
                || usage.readCount(i + 1, name) == 0 || usage.hasWildcardFrom(i + 1)
                || usage.usedLater(i + 1, target)) {
            return Optional.empty();
        }
        List<Node> rest = statements.subList(i + 1, statements.size());
        for (Node later : rest) {
            Set<String> bound = NodeQueries.boundAnywhere(later);
            if (bound.contains(name) || bound.contains(target) || NodeQueries.pinnedAnywhere(later).contains(name)) {
                return Optional.empty();
            }
        }
        List<Node> renamed = new ArrayList<>(rest.size() + 1);
        renamed.add(new Match(PatternUtility.renameBinder(m.pattern(), name, target), m.value(), m.meta()));
        for (Node later : rest) {
            Optional<Node> r = PatternUtility.renameReads(later, name, target);
            if (r.isEmpty()) {
                return Optional.empty();
            }
            renamed.add(r.get());
        }
        logger.debug("Binding {} is read later; renaming it to {}", name, target);
        return Optional.of(new Rewrite(rest.size() + 1, renamed));
    }
}
