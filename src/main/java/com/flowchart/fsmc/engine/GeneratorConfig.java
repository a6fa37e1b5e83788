package com.flowchart.fsmc.engine;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/** Switches for {@link SemanticGenerator}. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GeneratorConfig {
    private boolean generateContext = true;
    private boolean inferEvents = true;
    private boolean generateGuards = true;
    private boolean generateActions = true;
    private boolean generateActors = true;
    private String guardPrefix = "is";
    /** Extra fully qualified imports added to every generated machine. */
    private List<String> additionalImports = new ArrayList<>();
}
