package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.DefKind;
import com.raditha.hygiene.model.Meta;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import org.junit.jupiter.api.Test;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class UnusedPrivateFunctionRemovalPassTest {

    private final UnusedPrivateFunctionRemovalPass pass = new UnusedPrivateFunctionRemovalPass();

    @Test
    void testUnusedChainIsRemovedWithItsDocs() {
        Node run = def("run", binds("x"), call("helper", var("x")));
        Node helper = defp("helper", binds("x"), var("x"));
        Node before = module("M",
                run,
                helper,
                new Attribute("doc", bool(false)),
                defp("orphan", binds(), call("other")),
                defp("other", binds(), num(1)));

        assertEquals(module("M", run, helper), pass.apply(before));
    }

    @Test
    void testSelfRecursionDoesNotKeepAlive() {
        Node before = module("M",
                def("pub", binds(), num(0)),
                defp("loop", binds("n"), call("loop", op("-", var("n"), num(1)))));

        assertEquals(module("M", def("pub", binds(), num(0))), pass.apply(before));
    }

    @Test
    void testIndirectReferencesKeepAlive() {
        Node before = module("M",
                def("a", binds(), new Capture(null, "by_capture", 1)),
                def("b", binds(), remote("Kernel", "apply", new Raw("__MODULE__"), atom("by_atom"), list())),
                def("c", binds(), new Raw("by_raw(1)")),
                defp("by_capture", binds("x"), var("x")),
                defp("by_atom", binds(), num(1)),
                defp("by_raw", binds("x"), var("x")));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testCallWithOtherArityDoesNotCount() {
        Node run = def("run", binds(), call("h", num(1), num(2)));
        Node before = module("M", run, defp("h", binds("a"), var("a")));

        assertEquals(module("M", run), pass.apply(before));
    }

    @Test
    void testPublicAndPreservedFunctionsStay() {
        Node before = module("M",
                def("api", binds(), num(1)),
                new FunctionDef("hook", DefKind.DEFP, binds(), null, num(2), Meta.of(MetaFlag.PRESERVE_NAME)));

        assertSame(before, pass.apply(before));
    }
}
