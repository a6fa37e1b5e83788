package com.flowchart.fsmc.model;

import org.junit.Test;

import static org.junit.Assert.*;

public class TransitionKindTest {

    @Test
    public void testUnlabeledIsSystemAction() {
        assertEquals(TransitionKind.SYSTEM_ACTION, TransitionKind.classify(null));
        assertEquals(TransitionKind.SYSTEM_ACTION, TransitionKind.classify("  "));
        assertEquals(TransitionKind.SYSTEM_ACTION, TransitionKind.classify("CONTINUE"));
    }

    @Test
    public void testKeywords() {
        assertEquals(TransitionKind.USER_INPUT, TransitionKind.classify("Enter PIN input"));
        assertEquals(TransitionKind.USER_INPUT, TransitionKind.classify("SELECT_BALANCE"));
        assertEquals(TransitionKind.ERROR, TransitionKind.classify("login failed"));
        assertEquals(TransitionKind.TIMEOUT, TransitionKind.classify("TIMEOUT"));
        assertEquals(TransitionKind.EXTERNAL, TransitionKind.classify("verify pin"));
        assertEquals(TransitionKind.CONDITIONAL, TransitionKind.classify("Yes"));
    }

    @Test
    public void testDeclarationOrderWins() {
        // Contains both "input" and "error"
        assertEquals(TransitionKind.USER_INPUT, TransitionKind.classify("input error"));
        // "notify" contains "if"
        assertEquals(TransitionKind.CONDITIONAL, TransitionKind.classify("notify"));
    }
}
