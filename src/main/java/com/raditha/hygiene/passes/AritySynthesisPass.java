package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Meta;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.NodeDumper;
import com.raditha.hygiene.model.Nodes;
import com.raditha.hygiene.model.Pattern;
import com.raditha.hygiene.model.Pattern.PBind;
import com.raditha.hygiene.util.Names;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Synthesizes missing lower-arity entry points.
 * <p>
 * When a module calls {@code f/k} locally but only defines {@code f/n} for some {@code n > k},
 * a delegating {@code f/k} is added that passes {@code nil} for the missing trailing arguments.
 * The smallest such {@code n} is chosen. The shim has the visibility of the function it
 * delegates to, is flagged {@code SYNTHESIZED}, and is inserted right after that function's
 * last clause. Macros are never shimmed, nor are names an import may supply.
 */
public class AritySynthesisPass extends AbstractModulePass {

    private static final Logger logger = LoggerFactory.getLogger(AritySynthesisPass.class);

    static final Set<String> KERNEL_FUNCTIONS = Set.of(
            "abs", "apply", "binary_part", "bit_size", "byte_size", "ceil", "div", "elem", "exit", "floor",
            "hd", "inspect", "is_atom", "is_binary", "is_boolean", "is_function", "is_integer", "is_list",
            "is_map", "is_nil", "is_number", "is_tuple", "length", "map_size", "max", "min", "node",
            "put_elem", "raise", "rem", "round", "self", "send", "spawn", "throw", "tl", "to_string",
            "trunc", "tuple_size");

    @Override
    public String name() {
        return "arity-shim-synthesis";
    }

    @Override
    protected Node rewriteModule(ModuleDef module) {
        List<Node> statements = module.body().statements();
        // name -> arity -> first clause
        Map<String, TreeMap<Integer, FunctionDef>> defined = new HashMap<>();
        Map<String, Integer> lastClause = new HashMap<>();
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i) instanceof FunctionDef d) {
                defined.computeIfAbsent(d.name(), k -> new TreeMap<>()).putIfAbsent(d.arity(), d);
                lastClause.put(d.signature(), i);
            }
        }
        if (defined.isEmpty()) {
            return module;
        }

        List<Import> imports = new ArrayList<>();
        Map<String, Set<Integer>> called = new LinkedHashMap<>();
        walkOwn(module, n -> {
            if (n instanceof Import im) {
                imports.add(im);
            }
            if (n instanceof LocalCall c) {
                called.computeIfAbsent(c.name(), k -> new HashSet<>()).add(c.arity());
            } else if (n instanceof Capture c && c.module() == null) {
                called.computeIfAbsent(c.name(), k -> new HashSet<>()).add(c.arity());
            }
            return true;
        });

        // index of the statement to insert after -> shims, in call order
        Map<Integer, List<Node>> shims = new TreeMap<>();
        for (Map.Entry<String, Set<Integer>> e : called.entrySet()) {
            TreeMap<Integer, FunctionDef> arities = defined.get(e.getKey());
            if (arities == null || KERNEL_FUNCTIONS.contains(e.getKey()) || mayBeImported(e.getKey(), imports)) {
                continue;
            }
            for (int k : new TreeSet<>(e.getValue())) {
                if (arities.containsKey(k)) {
                    continue;
                }
                Map.Entry<Integer, FunctionDef> target = arities.higherEntry(k);
                if (target == null || target.getValue().kind().isMacro()) {
                    continue;
                }
                FunctionDef shim = shim(target.getValue(), k);
                logger.debug("Synthesizing {}/{} delegating to {}", e.getKey(), k, target.getValue().signature());
                shims.computeIfAbsent(lastClause.get(target.getValue().signature()), x -> new ArrayList<>()).add(shim);
            }
        }
        if (shims.isEmpty()) {
            return module;
        }
        List<Node> out = new ArrayList<>();
        for (int i = 0; i < statements.size(); i++) {
            out.add(statements.get(i));
            out.addAll(shims.getOrDefault(i, List.of()));
        }
        return module.withBody(out);
    }

    /**
     * An import without options may bring in any name; one with options is assumed to list it.
     */
    private static boolean mayBeImported(String name, List<Import> imports) {
        for (Import im : imports) {
            if (im.options() == null || NodeDumper.dump(im.options()).contains(name)) {
                return true;
            }
        }
        return false;
    }

    private static FunctionDef shim(FunctionDef target, int arity) {
        List<Pattern> params = new ArrayList<>();
        List<Node> args = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (int i = 0; i < arity; i++) {
            String name = paramName(target.params().get(i), i, used);
            params.add(new PBind(name));
            args.add(Nodes.var(name));
        }
        for (int i = arity; i < target.arity(); i++) {
            args.add(Nodes.nil());
        }
        Node body = new LocalCall(target.name(), args, Meta.of(MetaFlag.SYNTHESIZED));
        return new FunctionDef(target.name(), target.kind(), params, null, body, Meta.of(MetaFlag.SYNTHESIZED));
    }

    private static String paramName(Pattern p, int index, Set<String> used) {
        if (p instanceof PBind b && !b.isWildcard()) {
            String name = Names.stripUnderscore(b.name());
            if (Names.isVariableName(name) && used.add(name)) {
                return name;
            }
        }
        String fallback = "arg" + (index + 1);
        while (!used.add(fallback)) {
            fallback = "_" + fallback;
        }
        return fallback;
    }
}
