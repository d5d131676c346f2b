package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.NodeDumper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes repeated {@code import}, {@code alias}, {@code require} and {@code use} directives
 * within one block; the first occurrence is kept. A repeat that restores a short name after
 * another directive rebound it is not a duplicate.
 */
public class DirectiveDeduplicationPass extends AbstractBlockPass {

    private static final Logger logger = LoggerFactory.getLogger(DirectiveDeduplicationPass.class);

    @Override
    public String name() {
        return "directive-deduplication";
    }

    @Override
    protected Node rewriteBlock(Block block) {
        List<Node> statements = block.statements();
        List<Node> kept = new ArrayList<>(statements.size());
        // key -> the short name the directive introduced, and who owns that name now
        Map<String, String> seen = new HashMap<>();
        Map<String, String> owner = new HashMap<>();
        for (int i = 0; i < statements.size(); i++) {
            Node s = statements.get(i);
            String key = key(s);
            if (key == null) {
                kept.add(s);
                continue;
            }
            String shortName = shortName(s);
            boolean duplicate = seen.containsKey(key)
                    && (shortName == null || key.equals(owner.get(shortName)));
            if (duplicate && i < statements.size() - 1) {
                logger.debug("Dropping duplicate directive {}", key);
                continue;
            }
            seen.put(key, shortName);
            if (shortName != null) {
                owner.put(shortName, key);
            }
            kept.add(s);
        }
        return kept.size() == statements.size() ? block : block.withStatements(kept);
    }

    static String key(Node n) {
        if (n instanceof Import im) {
            return "import " + im.module() + options(im.options());
        }
        if (n instanceof Alias a) {
            return "alias " + a.module() + (a.as() == null ? "" : " as " + a.as());
        }
        if (n instanceof Require r) {
            return "require " + r.module() + (r.as() == null ? "" : " as " + r.as());
        }
        if (n instanceof Use u) {
            return "use " + u.module() + options(u.options());
        }
        return null;
    }

    private static String shortName(Node n) {
        if (n instanceof Alias a) {
            return a.effectiveName();
        }
        if (n instanceof Require r && r.as() != null) {
            return r.as();
        }
        return null;
    }

    private static String options(Node options) {
        return options == null ? "" : " " + NodeDumper.dump(options);
    }
}
