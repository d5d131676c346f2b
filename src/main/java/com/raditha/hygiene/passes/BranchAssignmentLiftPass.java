package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.UsageIndex;
import com.raditha.hygiene.model.CaseClause;
import com.raditha.hygiene.model.CondClause;
import com.raditha.hygiene.model.Meta;
import com.raditha.hygiene.model.MetaFlag;
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

/**
 * Lifts a rebind that every branch of a conditional performs out of the conditional:
 * <pre>
 * if c do x = a else x = b end      =>      x = if c do a else b end
 * </pre>
 * Bindings made inside a branch do not escape it, so without the lift the rebind is lost. The
 * lift happens only when {@code x} is read after the conditional. An {@code if} or
 * {@code unless} without else gets an else branch returning the current {@code x}, which requires
 * {@code x} to be bound already: it must be bound earlier in the block or read by the branch.
 */
public class BranchAssignmentLiftPass extends AbstractStatementWindowPass {

    private static final Logger logger = LoggerFactory.getLogger(BranchAssignmentLiftPass.class);

    @Override
    public String name() {
        return "branch-assignment-lift";
    }

    @Override
    protected Optional<Rewrite> matchAt(List<Node> statements, int i, UsageIndex usage) {
        if (isLast(statements, i)) {
            return Optional.empty();
        }
        Node statement = statements.get(i);
        List<Node> branches = branchesOf(statement);
        if (branches.isEmpty()) {
            return Optional.empty();
        }
        PBind target = commonTarget(branches);
        if (target == null || target.isWildcard() || !usage.usedLater(i + 1, target.name())) {
            return Optional.empty();
        }
        boolean needsElse = (statement instanceof If f && f.orElse() == null)
                || (statement instanceof Unless u && u.orElse() == null);
        if (needsElse && !boundBefore(statements, i, target.name()) && !readsOwnTarget(branches, target.name())) {
            logger.debug("Not lifting {}: no prior binding to fall back to", target.name());
            return Optional.empty();
        }
        Node lifted = lift(statement, target.name());
        logger.debug("Lifted branch assignments of {} out of the conditional", target.name());
        return Optional.of(Rewrite.of(1, new Match(target, lifted, statement.meta())));
    }

    private static List<Node> branchesOf(Node n) {
        List<Node> result = new ArrayList<>();
        if (n instanceof If f) {
            result.add(f.then());
            if (f.orElse() != null) {
                result.add(f.orElse());
            }
        } else if (n instanceof Unless u) {
            result.add(u.then());
            if (u.orElse() != null) {
                result.add(u.orElse());
            }
        } else if (n instanceof Case c) {
            c.clauses().forEach(cl -> result.add(cl.body()));
        } else if (n instanceof Cond c) {
            c.clauses().forEach(cl -> result.add(cl.body()));
        }
        return result;
    }

    private static PBind commonTarget(List<Node> branches) {
        PBind target = null;
        for (Node branch : branches) {
            Node last = NodeQueries.lastStatement(branch);
            if (!(last instanceof Match m) || !(m.pattern() instanceof PBind b)) {
                return null;
            }
            if (target == null) {
                target = b;
            } else if (!target.name().equals(b.name())) {
                return null;
            }
        }
        return target;
    }

    private static boolean boundBefore(List<Node> statements, int i, String name) {
        for (int k = 0; k < i; k++) {
            if (NodeQueries.statementBinds(statements.get(k)).contains(name)) {
                return true;
            }
        }
        return false;
    }

    private static boolean readsOwnTarget(List<Node> branches, String name) {
        for (Node branch : branches) {
            Node last = NodeQueries.lastStatement(branch);
            if (last instanceof Match m && NodeQueries.mentionsVar(m.value(), name)) {
                return true;
            }
        }
        return false;
    }

    private static Node lift(Node statement, String name) {
        if (statement instanceof If f) {
            Node orElse = f.orElse() == null ? fallback(name) : unwrap(f.orElse());
            return new If(f.condition(), unwrap(f.then()), orElse, f.meta());
        }
        if (statement instanceof Unless u) {
            Node orElse = u.orElse() == null ? fallback(name) : unwrap(u.orElse());
            return new Unless(u.condition(), unwrap(u.then()), orElse, u.meta());
        }
        if (statement instanceof Case c) {
            List<CaseClause> clauses = new ArrayList<>();
            for (CaseClause cl : c.clauses()) {
                clauses.add(cl.withBody(unwrap(cl.body())));
            }
            return new Case(c.subject(), clauses, c.meta());
        }
        Cond c = (Cond) statement;
        List<CondClause> clauses = new ArrayList<>();
        for (CondClause cl : c.clauses()) {
            clauses.add(new CondClause(cl.condition(), unwrap(cl.body())));
        }
        return new Cond(clauses, c.meta());
    }

    private static Node fallback(String name) {
        return new Var(name, Meta.of(MetaFlag.SYNTHESIZED));
    }

    /**
     * Replaces the branch's final {@code x = e} by {@code e}.
     */
    private static Node unwrap(Node branch) {
        List<Node> statements = new ArrayList<>(NodeQueries.statementsOf(branch));
        Match last = (Match) statements.get(statements.size() - 1);
        statements.set(statements.size() - 1, last.value());
        return Nodes.fromStatements(statements, branch.meta());
    }
}
