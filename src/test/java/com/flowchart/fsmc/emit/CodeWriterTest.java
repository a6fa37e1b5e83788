package com.flowchart.fsmc.emit;

import org.junit.Test;

import static org.junit.Assert.*;

public class CodeWriterTest {

    @Test
    public void testQuote() {
        assertEquals("null", CodeWriter.quote(null));
        assertEquals("\"a\\\"b\\\\c\\n\"", CodeWriter.quote("a\"b\\c\n"));
        assertEquals("\"\\u00e9\"", CodeWriter.quote("\u00e9"));
    }

    @Test
    public void testDocText() {
        assertEquals("a *&#47; b", CodeWriter.docText("a */ b"));
        assertEquals("one two", CodeWriter.docText("one\ntwo"));
        assertEquals("", CodeWriter.docText(null));
    }

    @Test
    public void testIndentation() {
        CodeWriter w = new CodeWriter();
        w.open("class A").line("int x;").line("").close();
        assertEquals("class A {\n    int x;\n\n}\n", w.toString());
    }

    @Test
    public void testCamel() {
        assertEquals("SelectOption", Sources.camel("SELECT_OPTION"));
        assertEquals("State", Sources.camel("__"));
    }
}
