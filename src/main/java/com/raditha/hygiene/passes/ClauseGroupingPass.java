package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.Attribute;
import com.raditha.hygiene.model.Node.FunctionDef;
import com.raditha.hygiene.model.Node.ModuleDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Makes the clauses of each function adjacent. A clause that appears after other definitions
 * moves up to follow the last clause of its group; everything else keeps its relative order.
 * {@code @doc}, {@code @spec} and {@code @impl} attributes directly above a clause move with it.
 */
public class ClauseGroupingPass extends AbstractModulePass {

    private static final Logger logger = LoggerFactory.getLogger(ClauseGroupingPass.class);

    private static final Set<String> ATTACHED = Set.of("doc", "spec", "impl");

    /**
     * A clause with the attributes attached to it, or a single other statement.
     */
    private record Unit(List<Node> statements, String signature) {
    }

    @Override
    public String name() {
        return "clause-grouping";
    }

    @Override
    protected Node rewriteModule(ModuleDef module) {
        List<Unit> units = units(module.body().statements());
        List<Unit> ordered = new ArrayList<>(units.size());
        Set<String> placed = new HashSet<>();
        for (Unit u : units) {
            if (u.signature() == null) {
                ordered.add(u);
            } else if (placed.add(u.signature())) {
                for (Unit other : units) {
                    if (u.signature().equals(other.signature())) {
                        ordered.add(other);
                    }
                }
            }
        }
        if (ordered.equals(units)) {
            return module;
        }
        logger.debug("Regrouped function clauses in {}", module.name());
        List<Node> out = new ArrayList<>();
        for (Unit u : ordered) {
            out.addAll(u.statements());
        }
        return module.withBody(out);
    }

    private static List<Unit> units(List<Node> statements) {
        List<Unit> result = new ArrayList<>();
        List<Node> pending = new ArrayList<>();
        for (Node s : statements) {
            if (s instanceof Attribute a && ATTACHED.contains(a.name())) {
                pending.add(s);
            } else if (s instanceof FunctionDef d) {
                pending.add(s);
                result.add(new Unit(List.copyOf(pending), d.signature()));
                pending.clear();
            } else {
                for (Node p : pending) {
                    result.add(new Unit(List.of(p), null));
                }
                pending.clear();
                result.add(new Unit(List.of(s), null));
            }
        }
        for (Node p : pending) {
            result.add(new Unit(List.of(p), null));
        }
        return result;
    }
}
