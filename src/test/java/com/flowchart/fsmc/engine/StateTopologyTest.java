package com.flowchart.fsmc.engine;

import org.junit.Test;

import java.util.BitSet;
import java.util.List;

import static org.junit.Assert.*;

public class StateTopologyTest {

    @Test
    public void testEmptyTopology() {
        StateTopology topo = StateTopology.builder().build();
        assertEquals(0, topo.stateCount());
        assertFalse(topo.contains("A"));
    }

    @Test
    public void testLinearChain() {
        // A -> B -> C
        StateTopology topo = StateTopology.builder()
                .addState("A").addState("B").addState("C")
                .addTransition("A", "B")
                .addTransition("B", "C")
                .build();

        assertEquals(3, topo.stateCount());
        assertEquals("A", topo.name(0));
        assertEquals(2, topo.index("C"));
        assertEquals(1, topo.targetCount(0));
        assertEquals(1, topo.target(0, 0));
        assertEquals(0, topo.targetCount(2));
        assertEquals(3, topo.reachableFrom("A").cardinality());
        assertTrue(topo.unreachableFrom("A").isEmpty());
    }

    @Test
    public void testCyclesAreAllowed() {
        // A -> B -> A, C isolated
        StateTopology topo = StateTopology.builder()
                .addState("A").addState("B").addState("C")
                .addTransition("A", "B")
                .addTransition("B", "A")
                .build();

        BitSet reachable = topo.reachableFrom("B");
        assertTrue(reachable.get(0));
        assertTrue(reachable.get(1));
        assertFalse(reachable.get(2));
        assertEquals(List.of("C"), topo.unreachableFrom("A"));
    }

    @Test
    public void testReachabilityIsTransitive() {
        // Only direct targets of A would miss D
        StateTopology topo = StateTopology.builder()
                .addState("A").addState("B").addState("C").addState("D")
                .addTransition("A", "B")
                .addTransition("B", "C")
                .addTransition("C", "D")
                .build();
        assertTrue(topo.unreachableFrom("A").isEmpty());
        assertEquals(List.of("A", "B", "C"), topo.unreachableFrom("D"));
    }

    @Test
    public void testShortestPathTree() {
        // A -> B -> D, A -> C -> D, E unreachable
        StateTopology topo = StateTopology.builder()
                .addState("A").addState("B").addState("C").addState("D").addState("E")
                .addTransition("A", "B")
                .addTransition("A", "C")
                .addTransition("B", "D")
                .addTransition("C", "D")
                .build();

        int[] pred = topo.shortestPathTree("A");
        assertEquals(-1, pred[topo.index("A")]);
        assertEquals(topo.index("A"), pred[topo.index("B")]);
        assertEquals(topo.index("A"), pred[topo.index("C")]);
        // First discovered parent wins
        assertEquals(topo.index("B"), pred[topo.index("D")]);
        assertEquals(-2, pred[topo.index("E")]);
    }

    @Test
    public void testDuplicateStatesIgnored() {
        StateTopology topo = StateTopology.builder()
                .addState("A").addState("A").addState("B")
                .addTransition("A", "B")
                .addTransition("A", "B")
                .build();
        assertEquals(2, topo.stateCount());
        assertEquals(2, topo.targetCount(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTransitionToUnknownStateRejected() {
        StateTopology.builder().addState("A").addTransition("A", "Missing");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownStateIndexRejected() {
        StateTopology.builder().addState("A").build().index("B");
    }
}
