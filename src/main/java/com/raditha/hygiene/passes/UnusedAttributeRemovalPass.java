package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.OpaqueFragmentScanner;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes module attributes that are defined but never read. Attributes the compiler itself
 * consumes ({@code @doc}, {@code @spec}, {@code @behaviour} and the like) are always kept.
 */
public class UnusedAttributeRemovalPass extends AbstractModulePass {

    private static final Logger logger = LoggerFactory.getLogger(UnusedAttributeRemovalPass.class);

    static final Set<String> RESERVED = Set.of(
            "moduledoc", "doc", "spec", "type", "typep", "opaque", "callback", "macrocallback",
            "behaviour", "impl", "derive", "enforce_keys", "compile", "dialyzer", "before_compile",
            "after_compile", "on_definition", "external_resource", "optional_callbacks", "deprecated",
            "since", "typedoc", "on_load", "vsn", "file");

    @Override
    public String name() {
        return "unused-attribute-removal";
    }

    @Override
    protected Node rewriteModule(ModuleDef module) {
        Set<String> read = new HashSet<>();
        List<String> text = new ArrayList<>();
        walkOwn(module, n -> {
            if (n instanceof AttributeRef r) {
                read.add(r.name());
            } else if (n instanceof Raw raw) {
                text.add(raw.code());
            } else if (n instanceof StringLit s && s.isInterpolated()) {
                text.add(s.value());
            }
            return true;
        });

        List<Node> kept = new ArrayList<>();
        boolean changed = false;
        for (Node statement : module.body().statements()) {
            if (statement instanceof Attribute a && isRemovable(a, read, text)) {
                logger.debug("Removing unused attribute @{} in {}", a.name(), module.name());
                changed = true;
                continue;
            }
            kept.add(statement);
        }
        return changed ? module.withBody(kept) : module;
    }

    private static boolean isRemovable(Attribute a, Set<String> read, List<String> text) {
        if (RESERVED.contains(a.name()) || a.has(MetaFlag.PRESERVE_NAME) || read.contains(a.name())) {
            return false;
        }
        for (String t : text) {
            if (OpaqueFragmentScanner.mentions(t, "@" + a.name())) {
                return false;
            }
        }
        return true;
    }
}
