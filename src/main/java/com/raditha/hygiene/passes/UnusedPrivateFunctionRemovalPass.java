package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.OpaqueFragmentScanner;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.util.NodeQueries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes private functions that nothing in the module calls.
 * <p>
 * A call from the function's own clauses does not keep it alive. Captures, atoms naming the
 * function and mentions in opaque fragments or interpolations do. Removing one function can
 * orphan another, so the pass repeats until nothing more goes. {@code @doc} and {@code @spec}
 * attributes directly above a removed clause go with it.
 */
public class UnusedPrivateFunctionRemovalPass extends AbstractModulePass {

    private static final Logger logger = LoggerFactory.getLogger(UnusedPrivateFunctionRemovalPass.class);

    @Override
    public String name() {
        return "unused-private-function-removal";
    }

    @Override
    protected Node rewriteModule(ModuleDef module) {
        List<Node> statements = module.body().statements();
        boolean changedAny = false;
        while (true) {
            Set<String> unused = unusedPrivate(statements);
            if (unused.isEmpty()) {
                break;
            }
            logger.debug("Removing unused private functions {} from {}", unused, module.name());
            statements = remove(statements, unused);
            changedAny = true;
        }
        return changedAny ? module.withBody(statements) : module;
    }

    private static Set<String> unusedPrivate(List<Node> statements) {
        Set<String> candidates = new HashSet<>();
        for (Node s : statements) {
            if (s instanceof FunctionDef d && d.kind().isPrivate() && !d.has(MetaFlag.PRESERVE_NAME)) {
                candidates.add(d.signature());
            }
        }
        Set<String> unused = new HashSet<>();
        for (String signature : candidates) {
            String name = signature.substring(0, signature.lastIndexOf('/'));
            int arity = Integer.parseInt(signature.substring(signature.lastIndexOf('/') + 1));
            boolean used = false;
            for (Node s : statements) {
                if (s instanceof FunctionDef d && d.signature().equals(signature)) {
                    continue;
                }
                if (NodeQueries.anyMatch(s, n -> uses(n, name, arity))) {
                    used = true;
                    break;
                }
            }
            if (!used) {
                unused.add(signature);
            }
        }
        return unused;
    }

    private static boolean uses(Node n, String name, int arity) {
        if (n instanceof LocalCall c) {
            return c.name().equals(name) && c.arity() == arity;
        }
        if (n instanceof Capture c) {
            return c.module() == null && c.name().equals(name) && c.arity() == arity;
        }
        if (n instanceof AtomLit a) {
            return a.name().equals(name);
        }
        if (n instanceof Raw r) {
            return OpaqueFragmentScanner.mentions(r.code(), name);
        }
        if (n instanceof StringLit s && s.isInterpolated()) {
            return OpaqueFragmentScanner.mentions(s.value(), name);
        }
        return false;
    }

    private static List<Node> remove(List<Node> statements, Set<String> signatures) {
        List<Node> out = new ArrayList<>();
        for (Node s : statements) {
            if (s instanceof FunctionDef d && signatures.contains(d.signature())) {
                while (!out.isEmpty() && out.get(out.size() - 1) instanceof Attribute a
                        && (a.name().equals("doc") || a.name().equals("spec"))) {
                    out.remove(out.size() - 1);
                }
                continue;
            }
            out.add(s);
        }
        return out;
    }
}
