package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.MapEntry;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.util.NodeQueries;
import com.raditha.hygiene.util.TreeTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses {@code Map.put(%{...}, key, value)} over a map literal into the literal itself.
 * Nested puts collapse from the inside out, so a whole chain ends up as one literal in which the
 * last write of a key wins.
 */
public class MapPutChainCollapsePass implements NormalizationPass {

    private static final Logger logger = LoggerFactory.getLogger(MapPutChainCollapsePass.class);

    @Override
    public String name() {
        return "map-put-chain-collapse";
    }

    @Override
    public Node apply(Node root) {
        return TreeTransformer.transform(root, n -> {
            if (n instanceof RemoteCall call && call.isOn("Map", "put") && call.args().size() == 3
                    && call.args().get(0) instanceof MapLit map && isConstantKey(call.args().get(1))) {
                return put(map, call.args().get(1), call.args().get(2), call);
            }
            return n;
        });
    }

    private Node put(MapLit map, Node key, Node value, RemoteCall original) {
        List<MapEntry> entries = new ArrayList<>(map.entries());
        for (int i = 0; i < entries.size(); i++) {
            if (sameKey(entries.get(i).key(), key)) {
                // the overwritten value is no longer evaluated and the new one moves ahead of later entries
                if (!NodeQueries.isTriviallyPure(entries.get(i).value())
                        || (!NodeQueries.isTriviallyPure(value) && !allPure(entries.subList(i + 1, entries.size())))) {
                    return original;
                }
                entries.set(i, new MapEntry(entries.get(i).key(), value));
                logger.debug("Collapsed Map.put over existing key into map literal");
                return new MapLit(entries, map.meta());
            }
        }
        entries.add(new MapEntry(key, value));
        logger.debug("Collapsed Map.put into map literal");
        return new MapLit(entries, map.meta());
    }

    private static boolean allPure(List<MapEntry> entries) {
        for (MapEntry e : entries) {
            if (!NodeQueries.isTriviallyPure(e.value())) {
                return false;
            }
        }
        return true;
    }

    private static boolean sameKey(Node a, Node b) {
        if (a instanceof AtomLit x && b instanceof AtomLit y) {
            return x.name().equals(y.name());
        }
        return a instanceof StringLit x && b instanceof StringLit y && x.value().equals(y.value());
    }

    private static boolean isConstantKey(Node key) {
        return key instanceof AtomLit || (key instanceof StringLit s && !s.isInterpolated());
    }
}
