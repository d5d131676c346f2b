package com.raditha.hygiene.passes;

import com.raditha.hygiene.config.PipelineConfig;
import com.raditha.hygiene.model.Meta;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.util.TreeTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Makes macros available where they are used.
 * <ol>
 *     <li>{@code require} directives that are non-final statements of a function body move to the
 *     top of the module</li>
 *     <li>a module that calls into one of the configured macro modules without requiring it gets
 *     a {@code require}, flagged {@code SYNTHESIZED}</li>
 * </ol>
 * New directives go after the leading run of {@code @moduledoc}, {@code use}, {@code import},
 * {@code alias} and {@code require} statements.
 */
public class RequireHoistingPass extends AbstractModulePass {

    private static final Logger logger = LoggerFactory.getLogger(RequireHoistingPass.class);

    private final PipelineConfig config;

    public RequireHoistingPass(PipelineConfig config) {
        this.config = config;
    }

    @Override
    public String name() {
        return "require-hoisting";
    }

    @Override
    protected Node rewriteModule(ModuleDef module) {
        Map<String, Require> needed = new LinkedHashMap<>();
        List<Node> statements = new ArrayList<>();
        boolean removedAny = false;

        // 1. pull nested requires out of function bodies
        for (Node statement : module.body().statements()) {
            if (statement instanceof FunctionDef d) {
                Node body = TreeTransformer.transform(d.body(), n -> n instanceof Block b ? dropRequires(b, needed) : n);
                if (body != d.body()) {
                    removedAny = true;
                    statement = new FunctionDef(d.name(), d.kind(), d.params(), d.guard(), body, d.meta());
                }
            }
            statements.add(statement);
        }

        // 2. macro modules called without a require
        walkOwn(module, n -> {
            if (n instanceof RemoteCall c && c.module() instanceof AliasRef r
                    && config.macroModules().contains(r.name()) && !needed.containsKey(r.name())) {
                needed.put(r.name(), new Require(r.name(), null, Meta.of(MetaFlag.SYNTHESIZED)));
            }
            return true;
        });

        // 3. drop what the module already requires at top level
        for (Node statement : statements) {
            if (statement instanceof Require r) {
                needed.remove(r.module());
            }
        }
        if (needed.isEmpty()) {
            return removedAny ? module.withBody(statements) : module;
        }

        int at = 0;
        while (at < statements.size() && isPrefixDirective(statements.get(at))) {
            at++;
        }
        logger.debug("Adding require of {} to module {}", needed.keySet(), module.name());
        statements.addAll(at, needed.values());
        return module.withBody(statements);
    }

    private static Node dropRequires(Block block, Map<String, Require> needed) {
        List<Node> kept = new ArrayList<>();
        List<Node> statements = block.statements();
        for (int i = 0; i < statements.size(); i++) {
            Node s = statements.get(i);
            if (s instanceof Require r && i < statements.size() - 1) {
                needed.putIfAbsent(r.module(), r);
            } else {
                kept.add(s);
            }
        }
        return kept.size() == statements.size() ? block : block.withStatements(kept);
    }

    private static boolean isPrefixDirective(Node n) {
        return n instanceof Use || n instanceof Import || n instanceof Alias || n instanceof Require
                || (n instanceof Attribute a && a.name().equals("moduledoc"));
    }
}
