package com.flowchart.fsmc;

import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flowchart.fsmc.emit.OutputLayout;
import com.flowchart.fsmc.emit.TestStyle;
import com.flowchart.fsmc.engine.GeneratorConfig;
import com.flowchart.fsmc.validation.ValidationConfig;

import lombok.Data;

/**
 * Settings of one compiler instance. Readable from JSON, see
 * {@link com.flowchart.fsmc.io.ConfigLoader}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CompilerConfig {
    private static final Pattern PACKAGE_NAME = Pattern.compile("[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$]*)*");

    private String outputDir = "generated/machines";
    private String serviceDir = "generated/services";
    private String basePackage = "com.flowchart.generated.machines";
    private String servicePackage = "com.flowchart.generated.services";

    private boolean generateTests = true;
    private TestStyle testStyle = TestStyle.SMOKE;
    private boolean includeTransitionTests = true;
    private boolean includeErrorTests = true;
    private boolean generateDemos = true;
    private boolean generateServices = true;
    /** Writes the {@code GeneratedMachines} index of each batch. */
    private boolean createIndexFiles = true;

    /** Runs the whole pipeline but hands nothing to the sink and leaves the manifest alone. */
    private boolean dryRun = false;
    private boolean incremental = true;
    private boolean blockOnValidationErrors = false;
    private boolean placeholderForEmptyDiagram = true;

    private ValidationConfig validation = new ValidationConfig();
    private GeneratorConfig generator = new GeneratorConfig();

    /**
     * Checks directories and package names.
     *
     * @throws IllegalArgumentException on the first invalid setting
     */
    public CompilerConfig validate() {
        requireText("outputDir", outputDir);
        requireText("serviceDir", serviceDir);
        requirePackage("basePackage", basePackage);
        requirePackage("servicePackage", servicePackage);
        if (testStyle == null)
            throw new IllegalArgumentException("testStyle must not be null");
        if (validation == null)
            throw new IllegalArgumentException("validation settings must not be null");
        if (generator == null)
            throw new IllegalArgumentException("generator settings must not be null");
        return this;
    }

    /** Output layout derived from the directory and package settings. */
    public OutputLayout toLayout() {
        return new OutputLayout(outputDir, serviceDir, basePackage, servicePackage);
    }

    private static void requireText(String name, String value) {
        if (value == null || value.isBlank())
            throw new IllegalArgumentException(name + " must not be blank");
    }

    private static void requirePackage(String name, String value) {
        requireText(name, value);
        if (!PACKAGE_NAME.matcher(value).matches())
            throw new IllegalArgumentException(name + " is not a valid Java package name: " + value);
    }
}
