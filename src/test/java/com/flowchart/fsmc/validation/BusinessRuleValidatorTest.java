package com.flowchart.fsmc.validation;

import com.flowchart.fsmc.api.Diagnostic;
import com.flowchart.fsmc.api.Severity;
import com.flowchart.fsmc.io.DiagramParser;
import com.flowchart.fsmc.model.MachineCategory;
import com.flowchart.fsmc.model.Node;
import com.flowchart.fsmc.model.ParsedMachine;
import com.flowchart.fsmc.validation.MachineView.StateView;
import com.flowchart.fsmc.validation.MachineView.TransitionView;

import org.junit.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.Assert.*;

public class BusinessRuleValidatorTest {

    private final BusinessRuleValidator validator = new BusinessRuleValidator();

    private static StateView state(String name, boolean fin, TransitionView... transitions) {
        return new StateView(name, fin, List.of(transitions));
    }

    private static TransitionView on(String event, String target) {
        return new TransitionView(event, target);
    }

    private static MachineView machine(String name, MachineCategory category, String initial, StateView... states) {
        return new MachineView(name + "Machine", name, category, initial, List.of(states));
    }

    @Test
    public void testFinalStateWithTransitionsIsExactlyOneError() {
        MachineView m = machine("Login", MachineCategory.USER, "Start",
                state("Start", false, on("NEXT", "Done")),
                state("Done", true, on("BACK", "Start")));

        ValidationResult r = validator.validate(List.of(m));
        assertEquals(1, r.errorCount());
        assertEquals(1, r.ofKind("Final state with transitions").size());
    }

    @Test
    public void testFinalStateWithTransitionsFromDiagram() {
        List<ParsedMachine> machines = new DiagramParser()
                .parse("flowchart TD\nStart --> Done((Done))\nDone -->|BACK| Start", "login").machines();
        ValidationResult r = validator.validateMachines(machines);
        assertEquals(1, r.errorCount());
        assertEquals("Final state with transitions", r.errors().get(0).kind());
    }

    @Test
    public void testDeadEndWarningOnly() {
        List<ParsedMachine> machines = new DiagramParser()
                .parse("flowchart LR\nStart-->Process\nProcess-->|DONE|End", "simple").machines();
        ValidationResult r = validator.validateMachines(machines);
        assertTrue(r.isValid());
        List<Diagnostic> deadEnds = r.ofKind("Dead-end state");
        assertEquals(1, deadEnds.size());
        assertTrue(deadEnds.get(0).message().contains("'End'"));
        assertEquals(1, r.ofKind("No final state").size());
    }

    @Test
    public void testUnreachableStatesNamed() {
        MachineView m = machine("Menu", MachineCategory.CORE, "Route",
                state("Route", false, on("GO", "Step")),
                state("Step", false, on("NEXT", "Closed")),
                state("Closed", true),
                state("Orphan", false, on("NEXT", "Closed")));

        ValidationResult r = validator.validate(List.of(m));
        List<Diagnostic> unreachable = r.ofKind("Unreachable state");
        assertEquals(1, unreachable.size());
        assertTrue(unreachable.get(0).message().contains("'Orphan'"));
        assertTrue(r.isValid());
    }

    @Test
    public void testInvalidTransitionTarget() {
        MachineView m = machine("Router", MachineCategory.CORE, "Route",
                state("Route", false, on("GO", "Nowhere"), on("STOP", "Closed")),
                state("Closed", true));

        ValidationResult r = validator.validate(List.of(m));
        assertEquals(1, r.errorCount());
        assertEquals("Invalid transition target", r.errors().get(0).kind());
        assertTrue(r.ofKind("Unreachable state").isEmpty());
    }

    @Test
    public void testStructureErrors() {
        MachineView noInitial = machine("Router", MachineCategory.CORE, null, state("Route", true));
        assertEquals(1, validator.validate(List.of(noInitial)).ofKind("Missing initial state").size());

        MachineView badInitial = machine("Router", MachineCategory.CORE, "Ghost", state("Route", true));
        assertEquals(1, validator.validate(List.of(badInitial)).ofKind("Invalid initial state").size());

        MachineView empty = machine("Router", MachineCategory.CORE, "Route");
        ValidationResult r = validator.validate(List.of(empty));
        assertEquals(1, r.ofKind("No states").size());
        assertTrue(r.ofKind("Missing initial state").isEmpty());

        MachineView nameless = new MachineView(" ", null, null, "A", List.of(state("A", true)));
        r = validator.validate(List.of(nameless));
        assertEquals(1, r.ofKind("Missing machine id").size());
        assertEquals(1, r.ofKind("Missing machine name").size());
        assertEquals(1, r.ofKind("Missing category").size());
    }

    @Test
    public void testNamelessStateIsReported() {
        MachineView m = machine("Router", MachineCategory.CORE, "Route",
                state("Route", false, on("GO", null)),
                state(null, true),
                state(" ", true));
        ValidationResult r = validator.validate(List.of(m));
        assertEquals(2, r.ofKind("Missing state name").size());
        assertFalse(r.isValid());
        assertTrue(r.ofKind("Invalid transition target").isEmpty());
    }

    @Test
    public void testDuplicateState() {
        MachineView m = machine("Router", MachineCategory.CORE, "Route",
                state("Route", false, on("GO", "Closed")),
                state("Route", false, on("GO", "Closed")),
                state("Closed", true));
        assertEquals(1, validator.validate(List.of(m)).ofKind("Duplicate state").size());
    }

    @Test
    public void testDisallowedCategory() {
        ValidationConfig config = new ValidationConfig();
        config.setAllowedCategories(EnumSet.of(MachineCategory.CORE));
        MachineView m = machine("Info", MachineCategory.INFO, "Page", state("Page", true));
        ValidationResult r = new BusinessRuleValidator(config).validate(List.of(m));
        assertEquals(1, r.ofKind("Invalid category").size());
    }

    @Test
    public void testLimits() {
        ValidationConfig config = new ValidationConfig();
        config.setMaxStatesPerMachine(2);
        config.setMaxTransitionsPerState(1);
        config.setMaxFinalStates(1);
        MachineView m = machine("Router", MachineCategory.CORE, "Route",
                state("Route", false, on("A", "Left"), on("B", "Right")),
                state("Left", true),
                state("Right", true));
        ValidationResult r = new BusinessRuleValidator(config).validate(List.of(m));
        assertEquals(1, r.ofKind("Too many states").size());
        assertEquals(1, r.ofKind("Too many transitions").size());
        assertEquals(1, r.ofKind("Too many final states").size());
        assertTrue(r.isValid());
    }

    @Test
    public void testUserHeuristics() {
        MachineView m = machine("Pay", MachineCategory.USER, "Start",
                state("Start", false, on("NEXT", "EnterAmount")),
                state("EnterAmount", false, on("SUBMIT", "Done")),
                state("Done", true));
        ValidationResult r = validator.validate(List.of(m));
        assertEquals(1, r.ofKind("Missing authentication").size());
        assertEquals(1, r.ofKind("Missing menu").size());
        assertEquals(1, r.ofKind("Missing error handling").size());
    }

    @Test
    public void testInputRecoveryViaEventOrTarget() {
        MachineView m = machine("Pay", MachineCategory.USER, "Login",
                state("Login", false, on("NEXT", "MainMenu")),
                state("MainMenu", false, on("PAY", "EnterAmount")),
                state("EnterAmount", false, on("SUBMIT", "Done"), on("CANCEL", "MainMenu")),
                state("EnterPin", false, on("SUBMIT", "Done"), on("WRONG", "InvalidPin")),
                state("InvalidPin", false, on("RETRY", "EnterPin")),
                state("Done", true));
        assertTrue(validator.validate(List.of(m)).ofKind("Missing error handling").isEmpty());
    }

    @Test
    public void testCategoryHeuristics() {
        MachineView agent = machine("Agent", MachineCategory.AGENT, "Start", state("Start", true));
        MachineView account = machine("Account", MachineCategory.ACCOUNT, "Start", state("Start", true));
        MachineView core = machine("Core", MachineCategory.CORE, "Start", state("Start", true));
        ValidationResult r = validator.validate(List.of(agent, account, core));
        assertEquals(1, r.ofKind("Missing authorization").size());
        assertEquals(1, r.ofKind("Missing account validation").size());
        assertEquals(1, r.ofKind("Missing routing").size());

        ValidationConfig config = new ValidationConfig();
        config.setCheckBusinessRules(false);
        r = new BusinessRuleValidator(config).validate(List.of(agent, account, core));
        assertTrue(r.ofKind("Missing routing").isEmpty());
    }

    @Test
    public void testNamingSeverity() {
        MachineView m = machine("Router", MachineCategory.CORE, "route",
                state("route", false, on("go", "Closed")),
                state("Closed", true));
        ValidationResult r = validator.validate(List.of(m));
        assertEquals(Severity.WARNING, r.ofKind("State naming convention").get(0).severity());
        assertEquals(Severity.WARNING, r.ofKind("Event naming convention").get(0).severity());

        ValidationConfig config = new ValidationConfig();
        config.setNamingViolationsAsErrors(true);
        r = new BusinessRuleValidator(config).validate(List.of(m));
        assertEquals(2, r.errorCount());
    }

    @Test
    public void testBatchChecks() {
        MachineView a = machine("Menu", MachineCategory.INFO, "Page", state("Page", true));
        MachineView b = machine("Menu", MachineCategory.INFO, "Page", state("Page", true));
        MachineView c = machine("Menu", MachineCategory.INFO, "Page", state("Page", true));
        ValidationResult r = validator.validate(List.of(a, b, c));
        assertEquals(1, r.ofKind("Duplicate machine name").size());
        assertEquals(1, r.ofKind("Missing user machine").size());
        assertEquals(1, r.ofKind("Missing core machine").size());
    }

    @Test
    public void testEmptyBatch() {
        ValidationResult r = validator.validate(List.of());
        assertTrue(r.isValid());
        assertEquals("No machines", r.warnings().get(0).kind());
    }

    @Test
    public void testEveryStateReachableOrNamed() {
        String text = String.join("\n",
                "flowchart TD",
                "Start --> Login",
                "Login -->|ok| MainMenu",
                "Island --> MainMenu",
                "MainMenu --> Done((Done))");
        ParsedMachine pm = new DiagramParser().parse(text, "ussd").machines().get(0);
        ValidationResult r = validator.validateMachines(List.of(pm));
        assertTrue(r.isValid());
        for (Node node : pm.nodes()) {
            boolean reachable = !node.id().equals("Island");
            boolean named = r.ofKind("Unreachable state").stream()
                    .anyMatch(d -> d.message().contains("'" + node.id() + "'"));
            assertTrue(node.id(), reachable || named);
        }
    }
}
