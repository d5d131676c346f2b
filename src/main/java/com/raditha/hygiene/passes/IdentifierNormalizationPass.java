package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.InterpolationScanner;
import com.raditha.hygiene.analysis.OpaqueFragmentScanner;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Pattern;
import com.raditha.hygiene.util.Names;
import com.raditha.hygiene.util.NodeQueries;
import com.raditha.hygiene.util.PatternUtility;
import com.raditha.hygiene.util.TreeTransformer;
import com.raditha.hygiene.util.VariableRenamer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts camelCase variable, binder and function names to snake_case, and renames binders
 * that collide with reserved words to {@code <word>_value}.
 * <p>
 * Variables are renamed per function definition so that collisions are judged against every
 * name the function already uses. A name is left alone when it carries {@code PRESERVE_NAME},
 * when an opaque fragment mentions it, or when its new spelling is already taken.
 */
public class IdentifierNormalizationPass implements NormalizationPass {

    private static final Logger logger = LoggerFactory.getLogger(IdentifierNormalizationPass.class);

    @Override
    public String name() {
        return "identifier-normalization";
    }

    @Override
    public Node apply(Node root) {
        Node withFunctions = renameFunctions(root);
        boolean[] sawDef = {false};
        Node result = TreeTransformer.transform(withFunctions, n -> {
            if (n instanceof FunctionDef d) {
                sawDef[0] = true;
                return renameVariables(d);
            }
            return n;
        });
        return sawDef[0] ? result : renameVariables(result);
    }

    // 1. function names

    private Node renameFunctions(Node root) {
        Set<String> defined = new HashSet<>();
        List<String> raw = new ArrayList<>();
        NodeQueries.walk(root, n -> {
            if (n instanceof FunctionDef d) {
                defined.add(d.name());
            } else if (n instanceof Raw r) {
                raw.add(r.code());
            }
            return true;
        });
        Map<String, String> mapping = new HashMap<>();
        Set<String> targets = new HashSet<>();
        for (String name : defined) {
            if (!Names.hasUpperCase(name) || !Names.isIdentStart(name.charAt(0))) {
                continue;
            }
            String target = Names.toSnakeCase(name);
            if (defined.contains(target) || !targets.add(target) || mentionedIn(raw, name)) {
                logger.debug("Keeping function name {}: {} is taken or the name is opaque", name, target);
                continue;
            }
            mapping.put(name, target);
        }
        if (mapping.isEmpty()) {
            return root;
        }
        return TreeTransformer.transform(root, n -> {
            if (n instanceof FunctionDef d && mapping.containsKey(d.name())) {
                return new FunctionDef(mapping.get(d.name()), d.kind(), d.params(), d.guard(), d.body(), d.meta());
            }
            if (n instanceof LocalCall c && mapping.containsKey(c.name())) {
                return new LocalCall(mapping.get(c.name()), c.args(), c.meta());
            }
            if (n instanceof Capture c && c.module() == null && mapping.containsKey(c.name())) {
                return new Capture(null, mapping.get(c.name()), c.arity(), c.meta());
            }
            return n;
        });
    }

    // 2. variables

    private Node renameVariables(Node scope) {
        Set<String> names = new LinkedHashSet<>();
        List<String> raw = new ArrayList<>();
        List<String> strings = new ArrayList<>();
        NodeQueries.walk(scope, n -> {
            if (n instanceof Var v) {
                names.add(v.name());
            } else if (n instanceof Raw r) {
                raw.add(r.code());
            } else if (n instanceof StringLit s && s.isInterpolated()) {
                strings.add(s.value());
            } else if (n instanceof FunctionDef && n != scope) {
                return false;
            }
            for (Pattern p : NodeQueries.patternsOf(n)) {
                names.addAll(PatternUtility.collectBound(p));
                names.addAll(PatternUtility.collectPinned(p));
            }
            return true;
        });

        Map<String, String> mapping = new LinkedHashMap<>();
        Set<String> targets = new HashSet<>();
        for (String name : names) {
            String target = targetFor(name);
            if (target == null || names.contains(target) || !targets.add(target)) {
                continue;
            }
            if (mentionedIn(raw, name) || malformedMention(strings, name)
                    || VariableRenamer.isPreserved(scope, name)) {
                logger.debug("Keeping variable {}: opaque or preserved", name);
                continue;
            }
            mapping.put(name, target);
        }
        if (mapping.isEmpty()) {
            return scope;
        }
        logger.debug("Normalizing identifiers {}", mapping);
        return VariableRenamer.renameAll(scope, mapping);
    }

    private static String targetFor(String name) {
        if (name.isEmpty() || !Names.isIdentStart(name.charAt(0))) {
            return null;
        }
        if (Names.RESERVED.contains(name)) {
            return name + "_value";
        }
        if (Names.hasUpperCase(name)) {
            return Names.toSnakeCase(name);
        }
        return null;
    }

    private static boolean mentionedIn(List<String> fragments, String name) {
        for (String code : fragments) {
            if (OpaqueFragmentScanner.mentions(code, name)) {
                return true;
            }
        }
        return false;
    }

    private static boolean malformedMention(List<String> strings, String name) {
        for (String s : strings) {
            if (InterpolationScanner.rename(s, name, name + "_").isEmpty()) {
                return true;
            }
        }
        return false;
    }
}
