package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.OpaqueFragmentScanner;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Pattern;
import com.raditha.hygiene.util.NodeQueries;
import com.raditha.hygiene.util.PatternUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes module-level {@code alias} directives whose short name is never referenced.
 * <p>
 * References are module names in calls, captures and struct literals or patterns, other
 * directives, and mentions inside opaque fragments and interpolated strings. Nested modules see
 * the aliases of the module around them, so they are scanned too.
 */
public class UnusedAliasRemovalPass extends AbstractModulePass {

    private static final Logger logger = LoggerFactory.getLogger(UnusedAliasRemovalPass.class);

    @Override
    public String name() {
        return "unused-alias-removal";
    }

    @Override
    protected Node rewriteModule(ModuleDef module) {
        List<Node> kept = new ArrayList<>();
        boolean changed = false;
        for (Node statement : module.body().statements()) {
            if (statement instanceof Alias a && !a.has(MetaFlag.PRESERVE_NAME)
                    && !isReferenced(module, a, a.effectiveName())) {
                logger.debug("Removing unused alias {} in {}", a.module(), module.name());
                changed = true;
                continue;
            }
            kept.add(statement);
        }
        return changed ? module.withBody(kept) : module;
    }

    private static boolean isReferenced(ModuleDef module, Alias self, String shortName) {
        return NodeQueries.anyMatch(module.body(), n -> n != self && references(n, shortName));
    }

    private static boolean references(Node n, String shortName) {
        if (n instanceof AliasRef r) {
            return refersTo(r.name(), shortName);
        }
        if (n instanceof StructLit s) {
            return refersTo(s.module(), shortName);
        }
        if (n instanceof Alias a) {
            return refersTo(a.module(), shortName);
        }
        if (n instanceof Import i) {
            return refersTo(i.module(), shortName);
        }
        if (n instanceof Require r) {
            return refersTo(r.module(), shortName);
        }
        if (n instanceof Use u) {
            return refersTo(u.module(), shortName);
        }
        if (n instanceof Raw raw) {
            return OpaqueFragmentScanner.mentions(raw.code(), shortName);
        }
        if (n instanceof StringLit s && s.isInterpolated()) {
            return OpaqueFragmentScanner.mentions(s.value(), shortName);
        }
        for (Pattern p : NodeQueries.patternsOf(n)) {
            for (String module : PatternUtility.structModules(p)) {
                if (refersTo(module, shortName)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean refersTo(String module, String shortName) {
        return module.equals(shortName) || module.startsWith(shortName + ".");
    }
}
