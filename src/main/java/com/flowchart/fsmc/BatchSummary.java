package com.flowchart.fsmc;

import java.util.List;

import com.flowchart.fsmc.api.Diagnostic;
import com.flowchart.fsmc.api.GeneratedFile;

/**
 * Result of one compile run. Always returned, also when everything failed.
 *
 * @param generatedFiles files proposed in this run, in emission order
 * @param errors         errors of all stages
 * @param warnings       warnings of all stages
 * @param stats          run statistics
 * @param upToDate       whether the run was skipped because nothing changed
 */
public record BatchSummary(List<GeneratedFile> generatedFiles, List<Diagnostic> errors, List<Diagnostic> warnings,
        Stats stats, boolean upToDate) {

    public BatchSummary {
        generatedFiles = List.copyOf(generatedFiles);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    /**
     * @param machinesGenerated machines that reached emission
     * @param filesCreated      number of generated files
     * @param linesOfCode       total lines of the generated files
     * @param durationMs        wall time of the run
     */
    public record Stats(int machinesGenerated, int filesCreated, long linesOfCode, long durationMs) {
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public GeneratedFile file(String path) {
        for (GeneratedFile f : generatedFiles)
            if (f.path().equals(path))
                return f;
        return null;
    }

    @Override
    public String toString() {
        return "BatchSummary{machines=" + stats.machinesGenerated() + ", files=" + stats.filesCreated() + ", lines="
                + stats.linesOfCode() + ", errors=" + errors.size() + ", warnings=" + warnings.size() + ", upToDate="
                + upToDate + ", " + stats.durationMs() + "ms}";
    }
}
