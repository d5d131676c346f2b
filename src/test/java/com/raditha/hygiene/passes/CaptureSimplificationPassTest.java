package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class CaptureSimplificationPassTest {

    private final CaptureSimplificationPass pass = new CaptureSimplificationPass();

    @Test
    void testLocalForwardingClosure() {
        Node before = fn2("a", "b", call("combine", var("a"), var("b")));

        assertEquals(new Capture(null, "combine", 2), pass.apply(before));
    }

    @Test
    void testRemoteForwardingClosure() {
        Node before = fn("s", remote("String", "upcase", var("s")));

        assertEquals(new Capture(new AliasRef("String"), "upcase", 1), pass.apply(before));
    }

    @Test
    void testReorderedArgumentsAreKept() {
        Node before = fn2("a", "b", call("combine", var("b"), var("a")));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testExtraArgumentIsKept() {
        Node before = fn("a", call("combine", var("a"), num(1)));

        assertSame(before, pass.apply(before));
    }

    @Test
    void testCallOnDynamicModuleIsKept() {
        Node before = fn("a", new RemoteCall(var("mod"), "run", List.of(var("a"))));

        assertSame(before, pass.apply(before));
    }
}
