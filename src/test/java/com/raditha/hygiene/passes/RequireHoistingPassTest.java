package com.raditha.hygiene.passes;

import com.raditha.hygiene.config.PipelineConfig;
import com.raditha.hygiene.model.Meta;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class RequireHoistingPassTest {

    private final RequireHoistingPass pass = new RequireHoistingPass(
            new PipelineConfig(null, Set.of(), Set.of("Logger", "Ecto.Query"), true, 4, Set.of(), false));

    @Test
    void testMissingRequireOfMacroModuleIsAdded() {
        Node before = module("Worker",
                new Use("GenServer"),
                def("run", binds("x"), remote("Logger", "info", var("x"))));

        Node expected = module("Worker",
                new Use("GenServer"),
                new Require("Logger", null, Meta.of(MetaFlag.SYNTHESIZED)),
                def("run", binds("x"), remote("Logger", "info", var("x"))));
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testExistingRequireIsRespected() {
        Node before = module("Worker",
                new Require("Logger"),
                def("run", binds("x"), remote("Logger", "info", var("x"))));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testNestedRequireIsHoisted() {
        Node before = module("Queries",
                new Attribute("moduledoc", str("Queries")),
                def("recent", binds(), block(
                        new Require("Ecto.Query"),
                        remote("Ecto.Query", "from", var("p")))));

        Node expected = module("Queries",
                new Attribute("moduledoc", str("Queries")),
                new Require("Ecto.Query"),
                def("recent", binds(), block(remote("Ecto.Query", "from", var("p")))));
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testFinalRequireInBodyStays() {
        Node before = module("Odd", def("f", binds(), block(call("prepare"), new Require("Other"))));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testNestedModuleIsHandledSeparately() {
        Node inner = module("Outer.Inner", def("log", binds(), remote("Logger", "debug", str("x"))));
        Node before = module("Outer", inner);

        ModuleDef after = (ModuleDef) pass.apply(before);

        assertEquals(1, after.body().statements().size());
        ModuleDef rewrittenInner = (ModuleDef) after.body().statements().get(0);
        assertEquals(new Require("Logger", null, Meta.of(MetaFlag.SYNTHESIZED)), rewrittenInner.body().statements().get(0));
    }
}
