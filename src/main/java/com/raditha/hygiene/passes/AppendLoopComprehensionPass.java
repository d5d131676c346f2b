package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.FreeVariableCollector;
import com.raditha.hygiene.analysis.UsageIndex;
import com.raditha.hygiene.model.FnClause;
import com.raditha.hygiene.model.Generator;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Pattern.PBind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Collapses the "build a list in a loop" idiom:
 * <pre>
 * acc = []
 * acc = Enum.reduce(xs, acc, fn x, acc -> acc ++ [f(x)] end)     (or acc = for x &lt;- xs, do: f(x))
 * acc
 * </pre>
 * becomes the single comprehension {@code for x <- xs, do: f(x)}. When {@code acc} is read by
 * something other than a trailing bare read, the empty initialization is dropped and
 * {@code acc = for ...} remains.
 */
public class AppendLoopComprehensionPass extends AbstractStatementWindowPass {

    private static final Logger logger = LoggerFactory.getLogger(AppendLoopComprehensionPass.class);

    @Override
    public String name() {
        return "append-loop-comprehension";
    }

    @Override
    protected Optional<Rewrite> matchAt(List<Node> statements, int i, UsageIndex usage) {
        if (i + 1 >= statements.size() || !(statements.get(i) instanceof Match init)
                || !(init.pattern() instanceof PBind acc) || acc.isWildcard() || acc.has(MetaFlag.PRESERVE_NAME)
                || !(init.value() instanceof ListLit empty) || !empty.elements().isEmpty()) {
            return Optional.empty();
        }
        if (!(statements.get(i + 1) instanceof Match loop) || !(loop.pattern() instanceof PBind target)
                || !target.name().equals(acc.name())) {
            return Optional.empty();
        }
        For comprehension = comprehensionOf(loop.value(), acc.name());
        if (comprehension == null) {
            return Optional.empty();
        }
        if (i + 2 >= statements.size()) {
            logger.debug("Replaced trailing append loop over {} by a comprehension", acc.name());
            return Optional.of(Rewrite.of(2, comprehension));
        }
        if (isLast(statements, i + 2) && statements.get(i + 2) instanceof Var v && v.name().equals(acc.name())) {
            logger.debug("Replaced append loop over {} and its read by a comprehension", acc.name());
            return Optional.of(Rewrite.of(3, comprehension));
        }
        if (comprehension == loop.value()) {
            // already a comprehension bound to acc: only the empty initialization goes
            return Optional.of(Rewrite.of(2, loop));
        }
        return Optional.of(Rewrite.of(2, new Match(loop.pattern(), comprehension, loop.meta())));
    }

    /**
     * The comprehension equivalent of {@code value} when it builds a fresh list from {@code acc = []},
     * or null.
     */
    private static For comprehensionOf(Node value, String acc) {
        if (value instanceof For f) {
            return f.into() == null && !FreeVariableCollector.collect(f).reads(acc) ? f : null;
        }
        if (!(value instanceof RemoteCall call) || !call.isOn("Enum", "reduce") || call.args().size() != 3
                || !(call.args().get(1) instanceof Var init) || !init.name().equals(acc)
                || !(call.args().get(2) instanceof Fn fn) || fn.clauses().size() != 1) {
            return null;
        }
        FnClause step = fn.clauses().get(0);
        if (step.guard() != null || step.params().size() != 2 || !(step.params().get(1) instanceof PBind inner)) {
            return null;
        }
        if (!(step.body() instanceof Binary b) || !"++".equals(b.op()) || !(b.left() instanceof Var v)
                || !v.name().equals(inner.name()) || !(b.right() instanceof ListLit one) || one.elements().size() != 1) {
            return null;
        }
        Node element = one.elements().get(0);
        FreeVariableCollector.Reads reads = FreeVariableCollector.collect(element);
        if (reads.reads(inner.name()) || reads.reads(acc) || FreeVariableCollector.collect(call.args().get(0)).reads(acc)) {
            return null;
        }
        return new For(List.of(new Generator(step.params().get(0), call.args().get(0))), List.of(), null,
                element, call.meta());
    }
}
