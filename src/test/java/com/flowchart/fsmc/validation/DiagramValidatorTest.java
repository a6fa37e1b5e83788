package com.flowchart.fsmc.validation;

import com.flowchart.fsmc.api.Diagnostic;
import com.flowchart.fsmc.api.Severity;

import org.junit.Test;

import static org.junit.Assert.*;

public class DiagramValidatorTest {

    private final DiagramValidator validator = new DiagramValidator();

    private static String block(String... lines) {
        return "```mermaid\n" + String.join("\n", lines) + "\n```\n";
    }

    @Test
    public void testCleanDiagram() {
        ValidationResult r = validator.validate(block("flowchart TD", "Start -->|NEXT| MainMenu", "MainMenu --> Done((Bye))"));
        assertTrue(r.isValid());
        assertEquals(0, r.totalIssues());
    }

    @Test
    public void testUnfencedTextIsOneBlock() {
        ValidationResult r = validator.validate("flowchart LR\nA --> B");
        assertEquals(0, r.totalIssues());
    }

    @Test
    public void testNoContent() {
        ValidationResult r = validator.validate("");
        assertTrue(r.isValid());
        assertEquals(1, r.ofKind("No Mermaid content").size());
        assertEquals(1, validator.validate(null).warningCount());
    }

    @Test
    public void testUnclosedBlock() {
        ValidationResult r = validator.validate("intro\n```mermaid\nflowchart TD\nA --> B\n");
        assertEquals(1, r.errorCount());
        Diagnostic d = r.errors().get(0);
        assertEquals("Unclosed Mermaid block", d.kind());
        assertEquals(Integer.valueOf(2), d.line());
        assertTrue(r.ofKind("No Mermaid content").isEmpty());
    }

    @Test
    public void testEmptyBlock() {
        ValidationResult r = validator.validate("```mermaid\n\n```");
        assertEquals(1, r.errorCount());
        assertEquals("Empty Mermaid block", r.errors().get(0).kind());
    }

    @Test
    public void testNestedFence() {
        ValidationResult r = validator.validate("```mermaid\nflowchart TD\n```js\nA --> B\n```");
        assertEquals(1, r.ofKind("Nested Mermaid blocks").size());
    }

    @Test
    public void testOtherCodeBlocksIgnored() {
        ValidationResult r = validator.validate("```java\nclass Foo {}\n```\n" + block("flowchart TD", "A --> B"));
        assertEquals(0, r.totalIssues());
    }

    @Test
    public void testInvalidDeclaration() {
        ValidationResult r = validator.validate(block("flowchart XY", "A --> B"));
        assertEquals(1, r.errorCount());
        Diagnostic d = r.errors().get(0);
        assertEquals("Invalid flowchart declaration", d.kind());
        assertEquals(Integer.valueOf(2), d.line());
    }

    @Test
    public void testMissingDeclarationStillChecksFirstStatement() {
        ValidationResult r = validator.validate(block("1bad --> B"));
        assertEquals(1, r.ofKind("Invalid flowchart declaration").size());
        assertEquals(1, r.ofKind("Invalid state name").size());
    }

    @Test
    public void testMultipleDeclarations() {
        ValidationResult r = validator.validate(block("flowchart TD", "A --> B", "graph LR"));
        assertEquals(1, r.ofKind("Multiple diagram declarations").size());
    }

    @Test
    public void testInvalidTransitionSyntax() {
        ValidationResult r = validator.validate(block("flowchart TD", "A -->"));
        assertEquals(1, r.errorCount());
        assertEquals("Invalid transition syntax", r.errors().get(0).kind());
        assertNotNull(r.errors().get(0).suggestion());
    }

    @Test
    public void testInvalidStateNameReportedOnce() {
        ValidationResult r = validator.validate(block("flowchart TD", "1bad --> B", "B --> 1bad"));
        assertEquals(1, r.ofKind("Invalid state name").size());
    }

    @Test
    public void testReservedAndNamingWarnings() {
        ValidationResult r = validator.validate(block("flowchart TD", "start -->|go next| MainMenu"));
        assertTrue(r.isValid());
        assertEquals(1, r.ofKind("Reserved state name").size());
        assertEquals(1, r.ofKind("State naming convention").size());
        Diagnostic event = r.ofKind("Event naming convention").get(0);
        assertEquals("Rename to GO_NEXT", event.suggestion());
    }

    @Test
    public void testNamingAsErrorsInStrictMode() {
        ValidationConfig config = new ValidationConfig();
        config.setNamingViolationsAsErrors(true);
        ValidationResult r = new DiagramValidator(config).validate(block("flowchart TD", "main_menu --> Next"));
        assertEquals(Severity.ERROR, r.ofKind("State naming convention").get(0).severity());

        config.setStrictMode(false);
        r = new DiagramValidator(config).validate(block("flowchart TD", "main_menu --> Next"));
        assertTrue(r.isValid());
    }

    @Test
    public void testNamingChecksCanBeDisabled() {
        ValidationConfig config = new ValidationConfig();
        config.setValidateNaming(false);
        ValidationResult r = new DiagramValidator(config).validate(block("flowchart TD", "main_menu -->|go| next"));
        assertEquals(0, r.totalIssues());
    }

    @Test
    public void testEmptyTransitionLabel() {
        ValidationResult r = validator.validate(block("flowchart TD", "A -->|| B"));
        assertEquals(1, r.ofKind("Empty transition label").size());
    }

    @Test
    public void testClassDefinitions() {
        ValidationResult r = validator.validate(block("flowchart TD", "A --> B",
                "classDef 9bad fill:#fff", "classDef ok fill", "class A,B user-machine"));
        assertEquals(1, r.ofKind("Invalid class name").size());
        assertEquals(1, r.ofKind("Invalid class style").size());
        assertEquals(1, r.errorCount());
    }

    @Test
    public void testSubgraphWarning() {
        ValidationResult r = validator.validate(block("flowchart TD", "subgraph Menu", "A --> B", "end"));
        assertEquals(1, r.warningCount());
        assertEquals("Subgraph usage", r.warnings().get(0).kind());
    }

    @Test
    public void testToPascalCase() {
        assertEquals("MainMenu", DiagramValidator.toPascalCase("main_menu"));
        assertEquals("EnterPin", DiagramValidator.toPascalCase("enter-pin"));
    }
}
