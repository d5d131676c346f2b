package com.raditha.hygiene.passes;

import com.raditha.hygiene.config.PipelineConfig;
import com.raditha.hygiene.model.MapEntry;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Pattern.PMapEntry;
import com.raditha.hygiene.model.Pattern.PStruct;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class ModuleQualificationPassTest {

    private final ModuleQualificationPass pass = new ModuleQualificationPass(
            PipelineConfig.defaults().withRootModule("MyApp", Set.of("Repo", "Accounts", "MyApp", "Ecto.Repo")));

    @Test
    void testCallsAndStructsAreQualified() {
        Node before = module("MyApp.Web",
                def("show", binds("id"), block(
                        assign("user", remote("Repo", "get", var("id"))),
                        new StructLit("Accounts", List.of(new MapEntry(atom("user"), var("user")))))));

        Node expected = module("MyApp.Web",
                def("show", binds("id"), block(
                        assign("user", remote("MyApp.Repo", "get", var("id"))),
                        new StructLit("MyApp.Accounts", List.of(new MapEntry(atom("user"), var("user")))))));
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testStructPatternsAreQualified() {
        Node before = caseOf(var("x"),
                clause(new PStruct("Accounts", List.of(new PMapEntry(atom("id"), bind("id")))), var("id")));

        Node expected = caseOf(var("x"),
                clause(new PStruct("MyApp.Accounts", List.of(new PMapEntry(atom("id"), bind("id")))), var("id")));
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testAliasedNameIsLeftAlone() {
        Node before = module("MyApp.Web",
                new Alias("MyApp.Repo", null),
                def("all", binds(), remote("Repo", "all", var("q"))));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testUnknownModulesAreLeftAlone() {
        Node before = remote("Enum", "map", var("xs"), var("f"));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testWithoutRootModuleNothingHappens() {
        ModuleQualificationPass unconfigured = new ModuleQualificationPass(PipelineConfig.defaults());
        Node before = remote("Repo", "get", num(1));

        assertSame(before, unconfigured.apply(before));
    }
}
