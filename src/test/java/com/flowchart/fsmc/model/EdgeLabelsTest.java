package com.flowchart.fsmc.model;

import org.junit.Test;

import static org.junit.Assert.*;

public class EdgeLabelsTest {

    @Test
    public void testGuardForms() {
        assertEquals("isAdult", EdgeLabels.guardOf("submit guard:isAdult"));
        assertEquals("hasPin", EdgeLabels.guardOf("submit [hasPin]"));
        assertEquals("ready", EdgeLabels.guardOf("go when ready"));
        assertNull(EdgeLabels.guardOf("plain label"));
        assertNull(EdgeLabels.guardOf(null));
    }

    @Test
    public void testGuardPriority() {
        // guard: outranks the bracket form
        assertEquals("first", EdgeLabels.guardOf("[second] guard:first"));
    }

    @Test
    public void testActionForms() {
        assertEquals("save", EdgeLabels.actionOf("submit action:save"));
        assertEquals("log", EdgeLabels.actionOf("submit do:log"));
        assertEquals("notify", EdgeLabels.actionOf("submit execute:notify"));
        assertEquals("save", EdgeLabels.actionOf("do:log action:save"));
        assertNull(EdgeLabels.actionOf(""));
    }

    @Test
    public void testStripAnnotations() {
        assertEquals("submit", EdgeLabels.stripAnnotations("submit guard:isAdult do:save"));
        assertEquals("pay", EdgeLabels.stripAnnotations("pay [hasFunds]"));
        assertEquals("", EdgeLabels.stripAnnotations(null));
    }
}
