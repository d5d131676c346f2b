package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.UsageIndex;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Pattern.PBind;
import com.raditha.hygiene.util.Names;
import com.raditha.hygiene.util.NodeQueries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Removes non-final statements that compute nothing observable:
 * <ul>
 *     <li>pure expressions whose value is discarded (literals, variable and attribute reads)</li>
 *     <li>{@code _ = <pure>} discards</li>
 *     <li>{@code _name = <variable or literal>} when {@code _name} is never read afterwards</li>
 * </ul>
 * Statements flagged {@code PRESERVE_NAME} are kept, which is how the {@code _ignore = value}
 * idiom of the upstream builder survives.
 */
public class DeadStatementEliminationPass extends AbstractStatementWindowPass {

    private static final Logger logger = LoggerFactory.getLogger(DeadStatementEliminationPass.class);

    @Override
    public String name() {
        return "dead-statement-elimination";
    }

    @Override
    protected Optional<Rewrite> matchAt(List<Node> statements, int i, UsageIndex usage) {
        if (isLast(statements, i)) {
            return Optional.empty();
        }
        Node statement = statements.get(i);
        if (statement.has(MetaFlag.PRESERVE_NAME) || statement instanceof Raw) {
            return Optional.empty();
        }
        if (!(statement instanceof Match) && NodeQueries.isTriviallyPure(statement)) {
            logger.debug("Removing discarded pure statement at {}", i);
            return Optional.of(Rewrite.drop(1));
        }
        if (statement instanceof Match m && m.pattern() instanceof PBind b && !b.has(MetaFlag.PRESERVE_NAME)) {
            if (b.isWildcard() && NodeQueries.isTriviallyPure(m.value())) {
                logger.debug("Removing pure discard at {}", i);
                return Optional.of(Rewrite.drop(1));
            }
            boolean simpleValue = m.value() instanceof Var || NodeQueries.isLiteral(m.value());
            if (Names.isUnderscored(b.name()) && simpleValue && !usage.usedLater(i + 1, b.name())) {
                logger.debug("Removing dead write to {} at {}", b.name(), i);
                return Optional.of(Rewrite.drop(1));
            }
        }
        return Optional.empty();
    }
}
