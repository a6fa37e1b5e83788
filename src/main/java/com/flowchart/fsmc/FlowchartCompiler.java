package com.flowchart.fsmc;

import com.flowchart.fsmc.io.DiagramParser;
import com.flowchart.fsmc.io.ParseResult;
import com.flowchart.fsmc.validation.DiagramValidator;
import com.flowchart.fsmc.validation.ValidationResult;

/**
 * Entry points of the flowchart to state machine compiler.
 *
 * <h2>Pipeline</h2>
 * <p>
 * A diagram is a text containing one or more fenced flowchart blocks. Each
 * block becomes one machine:
 * <ul>
 * <li><b>Parse:</b> statements become nodes and edges, classes pick the
 * machine category ({@link DiagramParser}).</li>
 * <li><b>Validate:</b> syntax lint on the raw text and business rules on the
 * parsed machines. Problems are diagnostics, not exceptions.</li>
 * <li><b>Generate:</b> an immutable IR with context, events, guards and
 * actions, rendered by one emitter per artifact kind.</li>
 * <li><b>Write:</b> files go to an artifact sink; a hash manifest lets
 * unchanged batches be skipped.</li>
 * </ul>
 */
public final class FlowchartCompiler {

    private FlowchartCompiler() {
    }

    /** Creates a compiler writing relative to the working directory. */
    public static DiagramCompiler create(CompilerConfig config) {
        return new DiagramCompiler(config);
    }

    public static DiagramCompiler create() {
        return create(new CompilerConfig());
    }

    /** Lints diagram text with the default validation settings. */
    public static ValidationResult lint(String text) {
        return new DiagramValidator().validate(text);
    }

    /** Parses diagram text without validating or generating anything. */
    public static ParseResult parse(String text) {
        return new DiagramParser().parse(text, null);
    }
}
