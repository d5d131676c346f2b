package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.DefKind;
import com.raditha.hygiene.model.Meta;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Pattern.PBind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class AritySynthesisPassTest {

    private final AritySynthesisPass pass = new AritySynthesisPass();

    private static FunctionDef shim(String name, DefKind kind, List<String> params, List<Node> args) {
        return new FunctionDef(name, kind, binds(params.toArray(new String[0])), null,
                new LocalCall(name, args, Meta.of(MetaFlag.SYNTHESIZED)), Meta.of(MetaFlag.SYNTHESIZED));
    }

    @Test
    void testMissingArityDelegatesWithNil() {
        FunctionDef greet = def("greet", binds("name", "greeting"), str("#{greeting} #{name}"));
        FunctionDef run = def("run", binds(), call("greet", str("bob")));
        Node before = module("M", greet, run);

        Node expected = module("M",
                greet,
                shim("greet", DefKind.DEF, List.of("name"), List.of(var("name"), nil())),
                run);
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testShimFollowsVisibilityAndStripsUnderscores() {
        FunctionDef fetch = defp("fetch", List.of(bind("_id"), ptuple(bind("a"), bind("b")), bind("opts")), num(1));
        FunctionDef run = def("run", binds(), call("fetch", num(1), num(2)));
        Node before = module("M", fetch, run);

        Node expected = module("M",
                fetch,
                shim("fetch", DefKind.DEFP, List.of("id", "arg2"), List.of(var("id"), var("arg2"), nil())),
                run);
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testSmallestHigherArityIsChosen() {
        FunctionDef three = def("f", binds("a", "b", "c"), num(3));
        FunctionDef two = def("f", binds("a", "b"), num(2));
        Node before = module("M", three, two, def("run", binds(), new Capture(null, "f", 1)));

        ModuleDef after = (ModuleDef) pass.apply(before);

        FunctionDef generated = (FunctionDef) after.body().statements().get(2);
        assertEquals(shim("f", DefKind.DEF, List.of("a"), List.of(var("a"), nil())), generated);
    }

    @Test
    void testKernelImportsAndMacrosAreSkipped() {
        Node kernel = module("M", def("length", binds("a", "b"), num(0)), def("run", binds(), call("length", var("x"))));
        Node imported = module("M", new Import("Helpers"), def("h", binds("a", "b"), num(0)),
                def("run", binds(), call("h", num(1))));
        Node macro = module("M", new FunctionDef("m", DefKind.DEFMACRO, binds("a", "b"), num(0)),
                def("run", binds(), call("m", num(1))));

        assertSame(kernel, pass.apply(kernel));
        assertSame(imported, pass.apply(imported));
        assertSame(macro, pass.apply(macro));
    }

    @Test
    void testExistingArityNeedsNoShim() {
        Node before = module("M", def("f", binds("a"), num(1)), def("f", binds("a", "b"), num(2)),
                def("run", binds(), call("f", num(1))));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testIdempotent() {
        Node once = pass.apply(module("M", def("g", binds("x", "y"), num(0)), def("run", binds(), call("g", num(1)))));

        assertSame(once, pass.apply(once));
        assertTrue(((ModuleDef) once).body().statements().get(1).has(MetaFlag.SYNTHESIZED));
        assertEquals(new PBind("x"), ((FunctionDef) ((ModuleDef) once).body().statements().get(1)).params().get(0));
    }
}
