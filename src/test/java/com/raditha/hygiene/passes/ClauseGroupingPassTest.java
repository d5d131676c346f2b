package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class ClauseGroupingPassTest {

    private final ClauseGroupingPass pass = new ClauseGroupingPass();

    @Test
    void testScatteredClausesAreRegrouped() {
        Node a1 = def("a", List.of(plit(num(1))), atom("one"));
        Node b = def("b", binds(), atom("b"));
        Node doc = new Attribute("doc", str("fallback"));
        Node a2 = def("a", binds("_"), atom("other"));
        Node before = module("M", a1, b, doc, a2);

        assertEquals(module("M", a1, doc, a2, b), pass.apply(before));
    }

    @Test
    void testOtherStatementsKeepTheirPlace() {
        Node use = new Use("GenServer");
        Node a1 = def("a", binds("x"), var("x"));
        Node attr = new Attribute("limit", num(3));
        Node a2 = def("a", binds("_"), num(0));
        Node c = def("c", binds(), new AttributeRef("limit"));
        Node before = module("M", use, a1, attr, c, a2);

        assertEquals(module("M", use, a1, a2, attr, c), pass.apply(before));
    }

    @Test
    void testDifferentAritiesAreDifferentGroups() {
        Node before = module("M",
                def("f", binds("a"), num(1)),
                def("g", binds(), num(0)),
                def("f", binds("a", "b"), num(2)));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testGroupedModuleIsUnchanged() {
        Node before = module("M", def("a", binds("x"), num(1)), def("a", binds("y"), num(2)), def("b", binds(), num(3)));

        assertSame(before, pass.apply(before));
    }
}
