package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.FreeVariableCollector;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.FunctionDef;
import com.raditha.hygiene.model.Pattern;
import com.raditha.hygiene.model.Pattern.PBind;
import com.raditha.hygiene.util.Names;
import com.raditha.hygiene.util.NodeQueries;
import com.raditha.hygiene.util.PatternUtility;
import com.raditha.hygiene.util.TreeTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repairs clauses whose head binds {@code _value} while the body reads {@code value}.
 * <p>
 * The lowering marks a binder unused before the body that reads it has been generated, so the
 * read refers to nothing. When {@code value} is not bound anywhere in the enclosing function
 * definition the binder is renamed to {@code value}, together with any reads of {@code _value}.
 */
public class UnderscoreBinderPromotionPass extends AbstractClausePass {

    private static final Logger logger = LoggerFactory.getLogger(UnderscoreBinderPromotionPass.class);

    @Override
    public String name() {
        return "underscore-binder-promotion";
    }

    @Override
    public Node apply(Node root) {
        boolean[] sawDef = {false};
        Node result = TreeTransformer.transform(root, n -> {
            if (n instanceof FunctionDef d) {
                sawDef[0] = true;
                return promoteWithin(d);
            }
            return n;
        });
        return sawDef[0] ? result : promoteWithin(root);
    }

    private Node promoteWithin(Node scope) {
        Set<String> bound = NodeQueries.boundAnywhere(scope);
        return TreeTransformer.transform(scope, n -> rewriteClauses(n,
                (kind, heads, guard, body) -> promote(heads, guard, body, bound)));
    }

    /**
     * @param enclosingBound every name bound anywhere in the enclosing definition
     */
    Clause promote(List<Pattern> heads, Node guard, Node body, Set<String> enclosingBound) {
        Set<String> headBound = PatternUtility.collectBound(heads);
        FreeVariableCollector.Reads reads = FreeVariableCollector.collectClause(heads, guard, body);

        List<Pattern> newHeads = new ArrayList<>(heads);
        Node newGuard = guard;
        Node newBody = body;
        boolean changed = false;
        for (int h = 0; h < newHeads.size(); h++) {
            for (PBind b : PatternUtility.binders(newHeads.get(h))) {
                String from = b.name();
                if (!Names.isUnderscored(from) || b.has(MetaFlag.PRESERVE_NAME)) {
                    continue;
                }
                String to = from.substring(1);
                if (!Names.isVariableName(to) || enclosingBound.contains(to) || headBound.contains(to)
                        || reads.count(to) == 0) {
                    continue;
                }
                Optional<Clause> renamed = renameInClause(newHeads, h, newGuard, newBody, from, to);
                if (renamed.isEmpty()) {
                    continue;
                }
                logger.debug("Promoting binder {} to {}: the body reads it under that name", from, to);
                newHeads = renamed.get().heads();
                newGuard = renamed.get().guard();
                newBody = renamed.get().body();
                changed = true;
            }
        }
        return changed ? new Clause(newHeads, newGuard, newBody) : null;
    }
}
