package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import org.junit.jupiter.api.Test;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class UnusedAttributeRemovalPassTest {

    private final UnusedAttributeRemovalPass pass = new UnusedAttributeRemovalPass();

    @Test
    void testUnreadAttributeIsRemoved() {
        Node before = module("M",
                new Attribute("moduledoc", str("Docs")),
                new Attribute("timeout", num(500)),
                new Attribute("unused", num(1)),
                def("wait", binds(), call("sleep", new AttributeRef("timeout"))));

        Node expected = module("M",
                new Attribute("moduledoc", str("Docs")),
                new Attribute("timeout", num(500)),
                def("wait", binds(), call("sleep", new AttributeRef("timeout"))));
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testReservedAttributesAreKept() {
        Node before = module("M",
                new Attribute("behaviour", new AliasRef("GenServer")),
                new Attribute("doc", str("Runs")),
                new Attribute("impl", bool(true)),
                def("init", binds("s"), tuple(atom("ok"), var("s"))));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testTextualMentionsKeepAttribute() {
        Node before = module("M",
                new Attribute("limit", num(10)),
                new Attribute("prefix", str("p")),
                def("a", binds(), new Raw("Enum.take(xs, @limit)")),
                def("b", binds(), str("#{@prefix}-id")));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testReadInNestedModuleDoesNotCount() {
        Node before = module("M",
                new Attribute("limit", num(10)),
                module("M.Inner", def("f", binds(), new AttributeRef("limit"))));

        Node expected = module("M", module("M.Inner", def("f", binds(), new AttributeRef("limit"))));
        assertEquals(expected, pass.apply(before));
    }
}
