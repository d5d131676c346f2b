package com.raditha.hygiene.util;

import com.raditha.hygiene.model.Meta;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.Raw;
import com.raditha.hygiene.model.Pattern;
import com.raditha.hygiene.model.Pattern.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class PatternUtilityTest {

    @Test
    void testCollectBoundSkipsWildcardAndPins() {
        Pattern p = ptuple(bind("a"), bind("_"), new PPin("b"), new PList(List.of(bind("c"), bind("_d"))));

        assertEquals(List.of("a", "c", "_d"), List.copyOf(PatternUtility.collectBound(p)));
        assertEquals(Set.of("b"), PatternUtility.collectPinned(p));
    }

    @Test
    void testCollectBoundIncludesAliasName() {
        Pattern p = new PAlias("whole", tagged("ok", bind("v")));

        assertEquals(Set.of("whole", "v"), PatternUtility.collectBound(p));
    }

    @Test
    void testRewriteBindersPreservesIdentityWhenUnchanged() {
        Pattern p = ptuple(bind("a"), new PCons(List.of(bind("h")), bind("t")));

        assertSame(p, PatternUtility.rewriteBinders(p, b -> b));
        assertSame(p, PatternUtility.renameBinder(p, "missing", "other"));
    }

    @Test
    void testRenameBinderInsideStruct() {
        Pattern p = new PStruct("User", List.of(new PMapEntry(atom("name"), bind("n"))));

        Pattern renamed = PatternUtility.renameBinder(p, "n", "name");

        assertEquals(Set.of("name"), PatternUtility.collectBound(renamed));
    }

    @Test
    void testRenamePinsLeavesBindersAlone() {
        Pattern p = ptuple(bind("x"), new PPin("x"));

        Pattern renamed = PatternUtility.renamePins(p, "x", "y");

        assertEquals(ptuple(bind("x"), new PPin("y")), renamed);
    }

    @Test
    void testRenameConsistentlyRenamesBinderAndReads() {
        Pattern p = tagged("ok", bind("_value"));
        Node body = call("use", var("_value"), str("got #{_value}"));

        Optional<PatternUtility.Renamed> r = PatternUtility.renameConsistently(p, body, "_value", "value");

        assertTrue(r.isPresent());
        assertEquals(tagged("ok", bind("value")), r.get().pattern());
        assertEquals(call("use", var("value"), str("got #{value}")), r.get().body());
    }

    @Test
    void testRenameConsistentlyRefusesWhenTargetBoundInPattern() {
        Pattern p = ptuple(bind("_v"), bind("v"));

        assertTrue(PatternUtility.renameConsistently(p, var("_v"), "_v", "v").isEmpty());
    }

    @Test
    void testRenameConsistentlyRefusesWhenBodyRebinds() {
        Pattern p = bind("x");
        Node body = block(assign("x", num(1)), var("x"));

        assertTrue(PatternUtility.renameConsistently(p, body, "x", "y").isEmpty());
    }

    @Test
    void testRenameConsistentlyRefusesOpaqueMention() {
        Pattern p = bind("x");
        Node body = new Raw("IO.inspect(x)", Meta.NONE);

        assertTrue(PatternUtility.renameConsistently(p, body, "x", "y").isEmpty());
    }

    @Test
    void testRenameConsistentlyRefusesMalformedInterpolation() {
        Pattern p = bind("x");
        Node body = str("value #{x");

        assertTrue(PatternUtility.renameConsistently(p, body, "x", "y").isEmpty());
    }

    @Test
    void testRenameConsistentlyRefusesUnboundSource() {
        assertTrue(PatternUtility.renameConsistently(bind("a"), var("b"), "b", "c").isEmpty());
    }

    @Test
    void testBindersKeepsMeta() {
        PBind preserved = new PBind("keep", Meta.of(MetaFlag.PRESERVE_NAME));
        List<PBind> binders = PatternUtility.binders(ptuple(preserved, bind("other")));

        assertTrue(binders.get(0).has(MetaFlag.PRESERVE_NAME));
        assertFalse(binders.get(1).has(MetaFlag.PRESERVE_NAME));
    }

    @Test
    void testStructModules() {
        Pattern p = ptuple(new PStruct("User", List.of()), new PStruct("Accounts.Role", List.of()));

        assertEquals(Set.of("User", "Accounts.Role"), PatternUtility.structModules(p));
        Pattern rewritten = PatternUtility.rewriteStructModules(p, m -> m.equals("User") ? "App.User" : m);
        assertEquals(Set.of("App.User", "Accounts.Role"), PatternUtility.structModules(rewritten));
    }
}
