package com.raditha.hygiene.passes;

import com.raditha.hygiene.config.PipelineConfig;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.Alias;
import com.raditha.hygiene.model.Node.AliasRef;
import com.raditha.hygiene.model.Node.StructLit;
import com.raditha.hygiene.model.Pattern;
import com.raditha.hygiene.util.NodeQueries;
import com.raditha.hygiene.util.PatternUtility;
import com.raditha.hygiene.util.TreeTransformer;
import com.raditha.hygiene.util.VariableRenamer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Qualifies references to application modules with the application root: {@code Repo.get(...)}
 * becomes {@code MyApp.Repo.get(...)} when {@code Repo} is listed as an application module.
 * <p>
 * Module references, struct literals and struct patterns are rewritten. A name that an
 * {@code alias} directive anywhere in the tree makes available is left alone.
 */
public class ModuleQualificationPass implements NormalizationPass {

    private static final Logger logger = LoggerFactory.getLogger(ModuleQualificationPass.class);

    private final PipelineConfig config;

    public ModuleQualificationPass(PipelineConfig config) {
        this.config = config;
    }

    @Override
    public String name() {
        return "module-qualification";
    }

    @Override
    public Node apply(Node root) {
        if (config.rootModule() == null || config.appModules().isEmpty()) {
            return root;
        }
        Set<String> targets = new HashSet<>(config.appModules());
        NodeQueries.walk(root, n -> {
            if (n instanceof Alias a && targets.remove(a.effectiveName())) {
                logger.debug("{} is aliased; not qualifying it", a.effectiveName());
            }
            return true;
        });
        targets.removeIf(t -> t.contains(".") || t.equals(config.rootModule()));
        if (targets.isEmpty()) {
            return root;
        }
        UnaryOperator<String> qualify = m -> targets.contains(m) ? config.rootModule() + "." + m : m;
        UnaryOperator<Pattern> patterns = p -> PatternUtility.rewriteStructModules(p, qualify);
        return TreeTransformer.transform(root, n -> {
            if (n instanceof AliasRef r && targets.contains(r.name())) {
                return new AliasRef(qualify.apply(r.name()), r.meta());
            }
            if (n instanceof StructLit s && targets.contains(s.module())) {
                return new StructLit(qualify.apply(s.module()), s.fields(), s.meta());
            }
            return VariableRenamer.mapOwnPatterns(n, patterns);
        });
    }
}
