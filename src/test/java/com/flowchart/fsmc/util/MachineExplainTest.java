package com.flowchart.fsmc.util;

import static org.junit.Assert.*;

import org.junit.Test;

import com.flowchart.fsmc.io.DiagramParser;
import com.flowchart.fsmc.model.ParsedMachine;

public class MachineExplainTest {
    private static final String DIAGRAM = "flowchart TD\n"
            + "Start --> Check[Check it]\n"
            + "Check -->|yes| Done((Bye))\n"
            + "Island --> Done\n"
            + "class Start,Check,Done,Island core-machine\n";

    private static ParsedMachine parse(String text) {
        return new DiagramParser().parse(text, "sample").machines().get(0);
    }

    @Test
    public void testDump() {
        String dump = new MachineExplain(parse(DIAGRAM)).dump();
        String expected = "Machine sample (core, 4 states, 3 transitions):\n"
                + "  [0] Start (INITIAL) -> Check\n"
                + "  [1] Check -> Done [yes]\n"
                + "  [2] Done (FINAL)\n"
                + "  [3] Island (UNREACHABLE) -> Done\n";
        assertEquals(expected, dump);
    }

    @Test
    public void testToFlowchart() {
        String chart = new MachineExplain(parse(DIAGRAM)).toFlowchart();
        assertTrue(chart.startsWith("flowchart TD\n"));
        assertTrue(chart.contains("  Check[\"Check it\"]\n"));
        assertTrue(chart.contains("  Done((\"Bye\"))\n"));
        assertTrue(chart.contains("  Check -->|yes| Done\n"));
        assertTrue(chart.contains("  Start --> Check\n"));
        assertTrue(chart.contains("  class Island core-machine\n"));
    }

    @Test
    public void testFlowchartParsesBack() {
        ParsedMachine original = parse(DIAGRAM);
        ParsedMachine reparsed = parse(new MachineExplain(original).toFlowchart());
        assertEquals(original.nodes().size(), reparsed.nodes().size());
        assertEquals(original.edges().size(), reparsed.edges().size());
        assertEquals(original.category(), reparsed.category());
        assertTrue(reparsed.isFinal("Done"));
    }

    @Test(expected = NullPointerException.class)
    public void testNullMachineRejected() {
        new MachineExplain(null);
    }
}
