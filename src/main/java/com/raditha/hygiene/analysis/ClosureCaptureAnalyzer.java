package com.raditha.hygiene.analysis;

import com.raditha.hygiene.model.FnClause;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.Fn;
import com.raditha.hygiene.util.NodeQueries;
import com.raditha.hygiene.util.PatternUtility;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Analyzes anonymous functions to find variables captured from the outer scope.
 */
public final class ClosureCaptureAnalyzer {

    private ClosureCaptureAnalyzer() {
        /* this is only a utility class */
    }

    /**
     * Variables a specific closure captures.
     */
    public static FreeVariableCollector.Reads findCapturedVariables(Fn fn) {
        return FreeVariableCollector.collect(fn);
    }

    /**
     * Names that a closure body rebinds at its top level and that are also bound by the
     * enclosing scope. In the target language such a rebind is local to the closure: the outer
     * binding is never updated, which is almost always a lowering mistake.
     */
    public static Set<String> findShadowingRebinds(Fn fn, Set<String> outerNames) {
        Set<String> result = new LinkedHashSet<>();
        for (FnClause clause : fn.clauses()) {
            Set<String> params = PatternUtility.collectBound(clause.params());
            for (Node statement : NodeQueries.statementsOf(clause.body())) {
                for (String name : NodeQueries.statementBinds(statement)) {
                    if (outerNames.contains(name) && !params.contains(name)) {
                        result.add(name);
                    }
                }
            }
        }
        return result;
    }
}
