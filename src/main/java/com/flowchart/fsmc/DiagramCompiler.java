package com.flowchart.fsmc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.flowchart.fsmc.api.ArtifactSink;
import com.flowchart.fsmc.api.Diagnostic;
import com.flowchart.fsmc.api.Diagnostics;
import com.flowchart.fsmc.api.Emitter;
import com.flowchart.fsmc.api.EmitterKind;
import com.flowchart.fsmc.api.GeneratedFile;
import com.flowchart.fsmc.build.IncrementalBuildManager;
import com.flowchart.fsmc.emit.EmitterRegistry;
import com.flowchart.fsmc.emit.MachineCatalogEmitter;
import com.flowchart.fsmc.emit.OutputLayout;
import com.flowchart.fsmc.engine.SemanticGenerator;
import com.flowchart.fsmc.io.DiagramParser;
import com.flowchart.fsmc.io.FileSystemArtifactSink;
import com.flowchart.fsmc.io.ParseResult;
import com.flowchart.fsmc.ir.GeneratedMachine;
import com.flowchart.fsmc.model.ParsedMachine;
import com.flowchart.fsmc.util.MachineExplain;
import com.flowchart.fsmc.validation.BusinessRuleValidator;
import com.flowchart.fsmc.validation.DiagramValidator;
import com.flowchart.fsmc.validation.ValidationResult;

/**
 * Runs the whole pipeline for a batch of diagrams: parse, validate, build the
 * IR, emit, and hand the files to an {@link ArtifactSink}.
 *
 * <p>
 * This class handles:
 * <ul>
 * <li>Skipping runs whose sources are unchanged since the last commit</li>
 * <li>Collecting diagnostics of every stage into one {@link BatchSummary}</li>
 * <li>Isolating failures: an unreadable source, a failing emitter or an
 * unwritable target only costs that file</li>
 * </ul>
 * Not thread-safe; use one instance per thread.
 */
public class DiagramCompiler {
    private static final Logger log = LogManager.getLogger(DiagramCompiler.class);

    static final String NO_MACHINES = "No machines found in diagram";

    private final CompilerConfig config;
    private final Path workDir;
    private final ArtifactSink sink;
    private final Clock clock;
    private final OutputLayout layout;
    private final EmitterRegistry registry;
    private final DiagramParser parser;
    private final DiagramValidator lint;
    private final BusinessRuleValidator rules;
    private final SemanticGenerator generator;

    public DiagramCompiler(CompilerConfig config) {
        this(config, Path.of(""));
    }

    /** Compiler writing below {@code workDir}, overwriting existing files. */
    public DiagramCompiler(CompilerConfig config, Path workDir) {
        this(config, workDir, new FileSystemArtifactSink(workDir, true, false), Clock.systemUTC());
    }

    /**
     * @param workDir directory the configured output paths are relative to
     * @param sink    receives the generated files
     * @param clock   time source for statistics and the manifest
     */
    public DiagramCompiler(CompilerConfig config, Path workDir, ArtifactSink sink, Clock clock) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.workDir = Objects.requireNonNull(workDir, "workDir");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.layout = config.toLayout();
        this.registry = new EmitterRegistry(config.getTestStyle());
        this.parser = new DiagramParser(config.isPlaceholderForEmptyDiagram());
        this.lint = new DiagramValidator(config.getValidation());
        this.rules = new BusinessRuleValidator(config.getValidation());
        this.generator = new SemanticGenerator(config.getGenerator());
    }

    public CompilerConfig config() {
        return config;
    }

    /** Emitter factories used by this compiler; replace entries to customize output. */
    public EmitterRegistry registry() {
        return registry;
    }

    // --- Entry points ---

    /**
     * Compiles diagram files. With incremental builds on, a batch whose
     * sources and outputs are unchanged since the last commit is skipped.
     * The manifest is committed only when every source was read and every
     * file was generated and written.
     */
    public BatchSummary compile(List<Path> sources) {
        long start = clock.millis();
        log.info("Compiling {} diagram file(s)", sources.size());
        IncrementalBuildManager manifest = config.isIncremental() && !config.isDryRun()
                ? new IncrementalBuildManager(workDir.resolve(config.getOutputDir()), clock)
                : null;
        if (manifest != null && !sources.isEmpty() && manifest.isUpToDate(sources)) {
            log.info("Generated files are up to date, nothing to do");
            return new BatchSummary(List.of(), List.of(), List.of(), new BatchSummary.Stats(0, 0, 0,
                    clock.millis() - start), true);
        }

        Run run = new Run();
        List<ParsedMachine> machines = new ArrayList<>();
        for (Path source : sources) {
            String text;
            try {
                text = Files.readString(source);
            } catch (IOException e) {
                run.failures++;
                log.error("Cannot read {}: {}", source, e.getMessage());
                run.diagnostics.error("I/O error", "Cannot read " + source + ": " + e.getMessage(), null);
                continue;
            }
            parseInto(text, DiagramParser.baseName(source), machines, run.diagnostics);
        }

        generate(machines, run);
        write(run);

        if (manifest != null && run.failures == 0 && !run.files.isEmpty()) {
            List<Path> written = new ArrayList<>(run.files.size());
            for (GeneratedFile f : run.files)
                written.add(workDir.resolve(f.path()));
            manifest.commit(sources, written);
        } else if (manifest != null && run.failures > 0) {
            log.warn("{} failure(s) in this batch, manifest not updated", run.failures);
        }
        return finish(run, start);
    }

    /**
     * Compiles diagram text. No input is read from disk and the manifest is
     * neither consulted nor updated.
     *
     * @param sourceName base of the machine ids, {@code null} for the default
     */
    public BatchSummary compileText(String text, String sourceName) {
        long start = clock.millis();
        Run run = new Run();
        List<ParsedMachine> machines = new ArrayList<>();
        parseInto(text == null ? "" : text, sourceName, machines, run.diagnostics);

        generate(machines, run);
        write(run);
        return finish(run, start);
    }

    // --- Stages ---

    /** Mutable state of one batch. */
    private static final class Run {
        final Diagnostics diagnostics = new Diagnostics();
        final List<GeneratedFile> files = new ArrayList<>();
        int machines;
        /** Unreadable sources, failed builds, failed emitters and failed writes. */
        int failures;
    }

    private void parseInto(String text, String sourceName, List<ParsedMachine> machines, Diagnostics diagnostics) {
        ParseResult parsed = parser.parse(text, sourceName);
        diagnostics.addAll(parsed.diagnostics());
        ValidationResult linted = lint.validate(text);
        diagnostics.addAll(linted.all());
        machines.addAll(parsed.machines());
        log.debug("Parsed {}: {} machine(s), {} diagnostic(s)", parsed.sourceName(), parsed.machines().size(),
                parsed.diagnostics().size());
    }

    /** Validates, builds the IR and emits into {@code run}. */
    private void generate(List<ParsedMachine> machines, Run run) {
        Diagnostics diagnostics = run.diagnostics;
        if (machines.isEmpty()) {
            diagnostics.error("No machines", NO_MACHINES, null);
            return;
        }
        if (config.getValidation().isCheckBusinessRules())
            diagnostics.addAll(rules.validateMachines(machines).all());
        if (config.isBlockOnValidationErrors() && diagnostics.hasErrors()) {
            log.warn("Validation failed with {} error(s), emission blocked", diagnostics.errors().size());
            return;
        }

        List<EmitterKind> kinds = enabledKinds();
        List<GeneratedMachine> generated = new ArrayList<>();
        for (ParsedMachine pm : machines) {
            if (log.isDebugEnabled())
                log.debug("\n{}", new MachineExplain(pm).dump());
            GeneratedMachine gm;
            try {
                gm = generator.generate(pm);
            } catch (RuntimeException e) {
                run.failures++;
                log.error("Cannot build machine {}", pm.id(), e);
                diagnostics.error("Generation failed", "Cannot build machine " + pm.id() + ": " + e.getMessage(), null);
                continue;
            }
            generated.add(gm);
            for (EmitterKind kind : kinds) {
                try {
                    Emitter emitter = registry.create(kind, layout);
                    run.files.add(GeneratedFile.of(layout.path(kind, gm), kind.artifactKind(), emitter.render(gm)));
                } catch (RuntimeException e) {
                    run.failures++;
                    log.error("{} emitter failed for {}", kind, gm.id(), e);
                    diagnostics.error("Emitter failed",
                            kind + " emitter failed for " + gm.id() + ": " + e.getMessage(), null);
                }
            }
        }
        if (config.isCreateIndexFiles() && !generated.isEmpty())
            run.files.add(new MachineCatalogEmitter(layout).file(generated));
        run.machines = generated.size();
    }

    /** Hands files to the sink unless this is a dry run. */
    private void write(Run run) {
        if (config.isDryRun()) {
            log.info("Dry run: {} file(s) not written", run.files.size());
            return;
        }
        for (GeneratedFile f : run.files) {
            try {
                sink.write(f);
            } catch (IOException | RuntimeException e) {
                run.failures++;
                log.error("Cannot write {}: {}", f.path(), e.getMessage());
                run.diagnostics.error("I/O error", "Cannot write " + f.path() + ": " + e.getMessage(), null);
            }
        }
    }

    List<EmitterKind> enabledKinds() {
        List<EmitterKind> kinds = new ArrayList<>();
        kinds.add(EmitterKind.MACHINE);
        if (config.isGenerateTests()) {
            kinds.add(EmitterKind.SMOKE_TEST);
            if (config.isIncludeTransitionTests())
                kinds.add(EmitterKind.TRANSITION_TEST);
            if (config.isIncludeErrorTests())
                kinds.add(EmitterKind.ERROR_TEST);
        }
        if (config.isGenerateDemos())
            kinds.add(EmitterKind.DEMO);
        if (config.isGenerateServices())
            kinds.add(EmitterKind.SERVICE);
        kinds.removeIf(kind -> !registry.isRegistered(kind));
        return kinds;
    }

    private BatchSummary finish(Run run, long start) {
        long lines = 0;
        for (GeneratedFile f : run.files)
            lines += f.lineCount();
        List<Diagnostic> errors = run.diagnostics.errors();
        BatchSummary summary = new BatchSummary(run.files, errors, run.diagnostics.warnings(),
                new BatchSummary.Stats(run.machines, run.files.size(), lines, clock.millis() - start), false);
        log.info("Compiled {} machine(s) into {} file(s), {} error(s), {} warning(s)", run.machines,
                run.files.size(), errors.size(), summary.warnings().size());
        return summary;
    }
}
