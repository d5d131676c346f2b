package com.raditha.hygiene.analysis;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.util.NodeQueries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Answers "is this variable referenced from here on" for the hygiene passes.
 * <p>
 * The analysis is conservative. Anything it cannot see through (a malformed interpolation, an
 * opaque fragment that evaluates code) counts as reading every name, so a binder is only ever
 * reported unused when no path can reach a read of it.
 */
public final class UsageAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(UsageAnalyzer.class);

    private UsageAnalyzer() {
        /* this is only a utility class */
    }

    /**
     * Builds the index for a statement sequence in one pass over the statements.
     *
     * @param statements the statements of a block, in order
     * @return the forward usage index
     */
    public static UsageIndex build(List<Node> statements) {
        List<FreeVariableCollector.Reads> perStatement = new ArrayList<>(statements.size());
        Map<String, List<Integer>> reads = new HashMap<>();
        Map<String, List<Integer>> rebinds = new HashMap<>();
        List<Integer> wildcards = new ArrayList<>();

        for (int i = 0; i < statements.size(); i++) {
            Node statement = statements.get(i);
            FreeVariableCollector.Reads r = FreeVariableCollector.collect(statement);
            perStatement.add(r);
            for (String name : r.names()) {
                reads.computeIfAbsent(name, k -> new ArrayList<>()).add(i);
            }
            if (r.wildcard()) {
                wildcards.add(i);
            }
            for (String name : NodeQueries.statementBinds(statement)) {
                rebinds.computeIfAbsent(name, k -> new ArrayList<>()).add(i);
            }
        }
        if (!wildcards.isEmpty()) {
            logger.trace("Usage index over {} statements has wildcards at {}", statements.size(), wildcards);
        }
        return new UsageIndex(perStatement, toArrays(reads), toArrays(rebinds), toArray(wildcards));
    }

    /**
     * Builds the index over the statements of a body (a block, or a single expression).
     */
    public static UsageIndex buildFor(Node body) {
        return build(NodeQueries.statementsOf(body));
    }

    /**
     * One-shot query on a whole node: does it read {@code name} from its enclosing scope?
     */
    public static boolean reads(Node node, String name) {
        return FreeVariableCollector.collect(node).reads(name);
    }

    /**
     * Is {@code name}, bound by one of the clause heads, read by the guard or the body?
     * Pins in the heads read the enclosing scope, never a sibling binder.
     */
    public static boolean clauseUses(Node guard, Node body, String name) {
        FreeVariableCollector.Reads inGuard = FreeVariableCollector.collect(guard);
        FreeVariableCollector.Reads inBody = FreeVariableCollector.collect(body);
        return inGuard.reads(name) || inBody.reads(name);
    }

    private static Map<String, int[]> toArrays(Map<String, List<Integer>> in) {
        Map<String, int[]> out = new HashMap<>(in.size() * 2);
        in.forEach((k, v) -> out.put(k, toArray(v)));
        return out;
    }

    private static int[] toArray(List<Integer> values) {
        int[] result = new int[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }
}
