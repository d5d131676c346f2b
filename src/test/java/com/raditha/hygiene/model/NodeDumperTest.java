package com.raditha.hygiene.model;

import org.junit.jupiter.api.Test;

import static com.raditha.hygiene.model.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class NodeDumperTest {

    @Test
    void testOneStatementPerLine() {
        Node tree = module("M", def("run", binds("x"), block(assign("y", num(1)), var("y"))));

        String expected = String.join("\n",
                "defmodule M do",
                "  def run(x) do",
                "    y = 1",
                "    y",
                "  end",
                "end");
        assertEquals(expected, NodeDumper.dump(tree));
    }

    @Test
    void testPatternDump() {
        assertEquals("{a, b}", NodeDumper.dump(ptuple(bind("a"), bind("b"))));
    }
}
