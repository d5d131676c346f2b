package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.util.TreeTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Rewrites {@code <>} concatenations that involve a string literal into one interpolated
 * string. {@code "Value: " <> to_string(t)} becomes {@code "Value: #{t}"}.
 * <p>
 * Only operands that can be written back as source text are folded in: literals, variables,
 * field reads on variables and {@code to_string} of those. Concatenation is handled from the
 * innermost operator outwards, so a whole chain becomes a single literal.
 */
public class StringConcatInterpolationPass implements NormalizationPass {

    private static final Logger logger = LoggerFactory.getLogger(StringConcatInterpolationPass.class);

    @Override
    public String name() {
        return "string-concat-interpolation";
    }

    @Override
    public Node apply(Node root) {
        return TreeTransformer.transform(root, n -> {
            if (!(n instanceof Binary b) || !"<>".equals(b.op())) {
                return n;
            }
            if (!(b.left() instanceof StringLit) && !(b.right() instanceof StringLit)) {
                return n;
            }
            Optional<String> left = render(b.left());
            Optional<String> right = render(b.right());
            if (left.isEmpty() || right.isEmpty()) {
                return n;
            }
            Optional<String> joined = join(left.get(), right.get());
            if (joined.isEmpty()) {
                logger.debug("Not folding concatenation: the operands would merge into an escape");
                return n;
            }
            logger.debug("Folded string concatenation into interpolation");
            return new StringLit(joined.get(), b.meta());
        });
    }

    /**
     * Concatenate two raw literal texts so that the result reads the same characters.
     * A trailing {@code #} that meets a leading <code>{</code> is escaped. A trailing lone
     * backslash would escape the first character of the right side, so that join is refused.
     */
    static Optional<String> join(String left, String right) {
        int end = left.length();
        if (trailingBackslashes(left, end) % 2 == 1) {
            return Optional.empty();
        }
        if (end > 0 && left.charAt(end - 1) == '#' && right.startsWith("{")
                && trailingBackslashes(left, end - 1) % 2 == 0) {
            return Optional.of(left.substring(0, end - 1) + "\\#" + right);
        }
        return Optional.of(left + right);
    }

    private static int trailingBackslashes(String text, int end) {
        int count = 0;
        while (end - count > 0 && text.charAt(end - count - 1) == '\\') {
            count++;
        }
        return count;
    }

    private static Optional<String> render(Node n) {
        if (n instanceof StringLit s) {
            return Optional.of(s.value());
        }
        return expression(unwrapToString(n)).map(e -> "#{" + e + "}");
    }

    private static Node unwrapToString(Node n) {
        if (n instanceof LocalCall c && "to_string".equals(c.name()) && c.args().size() == 1) {
            return c.args().get(0);
        }
        if (n instanceof RemoteCall c && c.isOn("Kernel", "to_string") && c.args().size() == 1) {
            return c.args().get(0);
        }
        return n;
    }

    private static Optional<String> expression(Node n) {
        if (n instanceof Var v) {
            return Optional.of(v.name());
        }
        if (n instanceof Field f) {
            return expression(f.target()).map(t -> t + "." + f.field());
        }
        if (n instanceof IntLit i) {
            return Optional.of(Long.toString(i.value()));
        }
        if (n instanceof AtomLit a) {
            return Optional.of(":" + a.name());
        }
        return Optional.empty();
    }
}
