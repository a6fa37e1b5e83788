package com.flowchart.fsmc.validation;

import com.flowchart.fsmc.model.MachineCategory;

import java.util.EnumSet;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/** Settings shared by {@link DiagramValidator} and {@link BusinessRuleValidator}. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ValidationConfig {
    private boolean strictMode = true;
    private boolean validateNaming = true;
    /** Reports naming convention violations as errors. Only honored in strict mode. */
    private boolean namingViolationsAsErrors = false;
    private boolean checkBusinessRules = true;
    private int maxStatesPerMachine = 50;
    private int maxTransitionsPerState = 20;
    private int maxFinalStates = 5;
    private Set<MachineCategory> allowedCategories = EnumSet.allOf(MachineCategory.class);

    boolean namingIsError() {
        return strictMode && namingViolationsAsErrors;
    }
}
