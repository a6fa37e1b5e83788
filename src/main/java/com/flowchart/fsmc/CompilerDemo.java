package com.flowchart.fsmc;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.flowchart.fsmc.api.Diagnostic;
import com.flowchart.fsmc.api.GeneratedFile;

/**
 * Compiles the bundled USSD menu diagram in dry-run mode and logs the result.
 */
public class CompilerDemo {
    private static final Logger log = LogManager.getLogger(CompilerDemo.class);

    static final String SAMPLE = "diagrams/ussd-menu.md";

    public static void main(String[] args) throws IOException {
        log.info("Starting compiler demo...");

        // 1. Load the sample diagram from the classpath
        String text;
        try (InputStream in = CompilerDemo.class.getClassLoader().getResourceAsStream(SAMPLE)) {
            if (in == null)
                throw new IOException("Missing resource " + SAMPLE);
            text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        // 2. Lint
        var lint = FlowchartCompiler.lint(text);
        log.info("Lint: {} error(s), {} warning(s)", lint.errorCount(), lint.warningCount());

        // 3. Compile without touching the file system
        CompilerConfig config = new CompilerConfig();
        config.setDryRun(true);
        BatchSummary summary = FlowchartCompiler.create(config).compileText(text, "ussd-menu");

        for (GeneratedFile f : summary.generatedFiles())
            log.info("  {} {} ({} lines)", f.kind().label(), f.path(), f.lineCount());
        for (Diagnostic d : summary.errors())
            log.error("  {}", d);
        for (Diagnostic d : summary.warnings())
            log.warn("  {}", d);
        log.info("{}", summary);
    }
}
