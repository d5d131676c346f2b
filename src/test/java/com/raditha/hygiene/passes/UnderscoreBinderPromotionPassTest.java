package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.DefKind;
import com.raditha.hygiene.model.Meta;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.FunctionDef;
import com.raditha.hygiene.model.Pattern.PPin;
import com.raditha.hygiene.model.Pattern.PBind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class UnderscoreBinderPromotionPassTest {

    private final UnderscoreBinderPromotionPass pass = new UnderscoreBinderPromotionPass();

    @Test
    void testParameterReadUnderPlainNameIsPromoted() {
        Node before = def("f", binds("_value"), op("*", var("value"), num(2)));

        assertEquals(def("f", binds("value"), op("*", var("value"), num(2))), pass.apply(before));
    }

    @Test
    void testGuardReadsAreRenamedWithTheBinder() {
        Node before = new FunctionDef("f", DefKind.DEF, binds("_v"), op(">", var("_v"), num(0)), var("v"), Meta.NONE);

        Node expected = new FunctionDef("f", DefKind.DEF, binds("v"), op(">", var("v"), num(0)), var("v"), Meta.NONE);
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testPinnedBinderIsNotPromoted() {
        Node before = def("f", binds("_v", "x"),
                block(call("use", var("v")), caseOf(var("x"), clause(new PPin("_v"), num(1)))));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testNestedClauseIsPromoted() {
        Node before = def("g", binds("x"),
                caseOf(var("x"), clause(tagged("ok", bind("_n")), var("n"))));

        Node expected = def("g", binds("x"),
                caseOf(var("x"), clause(tagged("ok", bind("n")), var("n"))));
        assertEquals(expected, pass.apply(before));
    }

    @Test
    void testNameBoundElsewhereInDefinitionBlocksPromotion() {
        Node before = def("f", binds("_value"),
                block(call("use", var("value")), fn("value", var("value"))));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testUnreadPlainNameIsNotPromoted() {
        Node before = def("f", binds("_value"), num(1));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testPreservedBinderIsKept() {
        Node before = fn(List.of(new PBind("_raw", Meta.of(MetaFlag.PRESERVE_NAME))), var("raw"));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testTreeWithoutDefinitions() {
        Node before = fn("_item", call("log", var("item")));

        assertEquals(fn("item", call("log", var("item"))), pass.apply(before));
    }
}
