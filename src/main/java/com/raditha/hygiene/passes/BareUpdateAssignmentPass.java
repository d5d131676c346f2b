package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.UsageIndex;
import com.raditha.hygiene.model.CaseClause;
import com.raditha.hygiene.model.CondClause;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Nodes;
import com.raditha.hygiene.model.Pattern.PBind;
import com.raditha.hygiene.util.NodeQueries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A compound assignment lowered without its assignment ({@code count + 1} as a statement whose
 * value is thrown away) becomes {@code count = count + 1}.
 * <p>
 * Applies to non-final statements of a block, and to the final statement of each branch of a
 * conditional that is itself a non-final statement. Branch-local rebinds produced here are lifted
 * out of the conditional later by {@link BranchAssignmentLiftPass}.
 */
public class BareUpdateAssignmentPass extends AbstractStatementWindowPass {

    private static final Logger logger = LoggerFactory.getLogger(BareUpdateAssignmentPass.class);

    private static final Set<String> UPDATE_OPERATORS = Set.of("+", "-", "*", "/", "<>", "++");

    @Override
    public String name() {
        return "bare-update-assignment";
    }

    @Override
    protected Optional<Rewrite> matchAt(List<Node> statements, int i, UsageIndex usage) {
        if (isLast(statements, i)) {
            return Optional.empty();
        }
        Node statement = statements.get(i);
        Node rewritten = asUpdate(statement);
        if (rewritten == null) {
            rewritten = inBranches(statement);
        }
        return rewritten == null ? Optional.empty() : Optional.of(Rewrite.of(1, rewritten));
    }

    private static Node asUpdate(Node statement) {
        if (statement instanceof Binary b && UPDATE_OPERATORS.contains(b.op()) && b.left() instanceof Var v
                && !v.name().equals("_")) {
            logger.debug("Restoring assignment of bare update to {}", v.name());
            return new Match(new PBind(v.name()), b, b.meta());
        }
        return null;
    }

    /**
     * Rewrites the last statement of every branch; null when no branch changed.
     */
    private static Node inBranches(Node statement) {
        if (statement instanceof If n) {
            Node then = branch(n.then());
            Node orElse = n.orElse() == null ? null : branch(n.orElse());
            return then == n.then() && orElse == n.orElse() ? null : new If(n.condition(), then, orElse, n.meta());
        }
        if (statement instanceof Unless n) {
            Node then = branch(n.then());
            Node orElse = n.orElse() == null ? null : branch(n.orElse());
            return then == n.then() && orElse == n.orElse() ? null : new Unless(n.condition(), then, orElse, n.meta());
        }
        if (statement instanceof Case n) {
            List<CaseClause> clauses = new ArrayList<>();
            boolean changed = false;
            for (CaseClause c : n.clauses()) {
                CaseClause r = c.withBody(branch(c.body()));
                changed |= r != c;
                clauses.add(r);
            }
            return changed ? new Case(n.subject(), clauses, n.meta()) : null;
        }
        if (statement instanceof Cond n) {
            List<CondClause> clauses = new ArrayList<>();
            boolean changed = false;
            for (CondClause c : n.clauses()) {
                Node body = branch(c.body());
                changed |= body != c.body();
                clauses.add(body == c.body() ? c : new CondClause(c.condition(), body));
            }
            return changed ? new Cond(clauses, n.meta()) : null;
        }
        return null;
    }

    private static Node branch(Node body) {
        List<Node> statements = NodeQueries.statementsOf(body);
        if (statements.isEmpty()) {
            return body;
        }
        Node last = statements.get(statements.size() - 1);
        Node update = asUpdate(last);
        if (update == null) {
            update = inBranches(last);
        }
        if (update == null) {
            return body;
        }
        if (!(body instanceof Block b)) {
            return update;
        }
        List<Node> copy = new ArrayList<>(statements);
        copy.set(copy.size() - 1, update);
        return Nodes.fromStatements(copy, b.meta());
    }
}
