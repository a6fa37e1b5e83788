package com.flowchart.fsmc;

import static org.junit.Assert.*;

import org.junit.Test;

import com.flowchart.fsmc.io.ParseResult;

public class FlowchartCompilerTest {

    @Test
    public void testParseUsesDefaultSourceName() {
        ParseResult result = FlowchartCompiler.parse("flowchart TD\nStart --> Next");
        assertEquals(1, result.machines().size());
        assertEquals("ussd", result.machines().get(0).id());
    }

    @Test
    public void testLint() {
        assertTrue(FlowchartCompiler.lint("```mermaid\nflowchart TD\nStart --> Next\n```\n").isValid());
        assertFalse(FlowchartCompiler.lint("```mermaid\nflowchart TD\nStart --> Next\n").isValid());
    }

    @Test
    public void testCreate() {
        assertNotNull(FlowchartCompiler.create().registry());
        CompilerConfig config = new CompilerConfig();
        assertSame(config, FlowchartCompiler.create(config).config());
    }
}
