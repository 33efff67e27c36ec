package com.bsa.analyzer.static_analysis;

import com.bsa.analyzer.ast.AstLoader;
import com.bsa.analyzer.ast.AstNode;
import com.bsa.analyzer.build.ForgeProject;
import com.bsa.analyzer.build.ForgeRunner;
import com.bsa.analyzer.config.AnalyzerConfig;
import com.bsa.analyzer.detector.DetectorRegistry;
import com.bsa.analyzer.detector.Finding;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestrates the analysis of one Foundry project.
 * Produces one summary per contract name found in the project's AST artifacts.
 */
public class ProjectAnalyzer {

    private final AstLoader loader = new AstLoader();
    private final ContractAssembler assembler = new ContractAssembler();

    /**
     * @throws AstLoader.AstLoadException if an AST artifact cannot be read
     */
    public List<ContractSummary> analyze(Path projectRoot, AnalyzerConfig config) {
        // 1. Produce AST artifacts
        if (!config.isSkipBuild()) {
            System.err.println("[bsa] Building project: " + projectRoot);
            if (!new ForgeRunner(config.getForgeCommand()).prepare(projectRoot)) {
                System.err.println("[bsa] Build step failed, no AST files available");
                return List.of();
            }
        }

        // 2. Locate sources and artifacts
        ForgeProject project = new ForgeProject(config.getSrcDir(), config.getOutDir());
        Map<String, Path> sources = project.findSourceFiles(projectRoot);
        List<Path> astFiles = project.findAstFiles(projectRoot, sources.keySet());
        System.err.println("[bsa] Found " + sources.size() + " source files, " + astFiles.size() + " AST files");

        // 3. Assemble contracts; the same contract appears in every artifact of its file
        Map<String, ContractSummary> contracts = new LinkedHashMap<>();
        for (Path astFile : astFiles) {
            AstNode sourceUnit = loader.loadSourceUnit(astFile);
            String sourceText = readSource(sources.get(sourceName(astFile)));
            for (ContractSummary c : assembler.assemble(sourceUnit, sourceText)) {
                contracts.putIfAbsent(c.name(), c);
            }
        }
        System.err.println("[bsa] Analysed " + contracts.size() + " contracts");
        return new ArrayList<>(contracts.values());
    }

    /**
     * Runs the selected detectors over every contract and groups the findings by detector name.
     */
    public Map<String, List<Finding>> detect(List<ContractSummary> contracts, DetectorRegistry registry,
                                             List<String> selection) {
        Map<String, List<Finding>> byDetector = new LinkedHashMap<>();
        for (ContractSummary contract : contracts) {
            for (Map.Entry<String, List<Finding>> e : registry.runSelected(selection, contract).entrySet()) {
                byDetector.computeIfAbsent(e.getKey(), k -> new ArrayList<>()).addAll(e.getValue());
            }
        }
        return byDetector;
    }

    /** {@code out/Vault.sol/Vault.json} belongs to source {@code Vault}. */
    static String sourceName(Path astFile) {
        String dir = astFile.getParent().getFileName().toString();
        return dir.endsWith(".sol") ? dir.substring(0, dir.length() - ".sol".length()) : dir;
    }

    private static String readSource(Path source) {
        if (source == null || !Files.isRegularFile(source)) return "";
        try {
            return Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read source " + source, e);
        }
    }
}
