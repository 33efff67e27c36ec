package com.bsa.analyzer;

import com.bsa.analyzer.ast.AstLoader;
import com.bsa.analyzer.config.AnalyzerConfig;
import com.bsa.analyzer.config.ConfigReader;
import com.bsa.analyzer.detector.DetectionMode;
import com.bsa.analyzer.detector.DetectorRegistry;
import com.bsa.analyzer.detector.Finding;
import com.bsa.analyzer.ir.AnalysisSerializer;
import com.bsa.analyzer.ir.SummaryExporter;
import com.bsa.analyzer.report.ReportPrinter;
import com.bsa.analyzer.static_analysis.ContractSummary;
import com.bsa.analyzer.static_analysis.ProjectAnalyzer;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar bsa-analyzer-java.jar <project-path> \
 *     [--config <bsa.json>] [--output <dir>] [--skip-build] [--mode order|reachability]
 */
public class AnalyzerMain {

    public static void main(String[] args) {
        try {
            run(args, System.out);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[bsa] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar bsa-analyzer-java.jar <project-path> "
                    + "[--config <file>] [--output <dir>] [--skip-build] [--mode order|reachability]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[bsa] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Analyses the project named by {@code args}, printing the report to {@code out}.
     *
     * @return the analysed contracts, empty when nothing could be analysed
     */
    static List<ContractSummary> run(String[] args, PrintStream out) {
        if (args.length == 0) {
            throw new UsageException("No project path specified");
        }

        // Parse flags
        String projectPath = null;
        String configPath = null;
        String outputDir = null;
        String mode = null;
        boolean skipBuild = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config"     -> configPath = requireNext(args, i++, "--config");
                case "--output"     -> outputDir  = requireNext(args, i++, "--output");
                case "--mode"       -> mode       = requireNext(args, i++, "--mode");
                case "--skip-build" -> skipBuild  = true;
                default -> {
                    if (args[i].startsWith("--")) throw new UsageException("Unknown flag: " + args[i]);
                    if (projectPath != null) throw new UsageException("Unexpected argument: " + args[i]);
                    projectPath = args[i];
                }
            }
        }
        if (projectPath == null) throw new UsageException("No project path specified");
        if (mode != null) {
            try {
                DetectionMode.parse(mode);
            } catch (IllegalArgumentException e) {
                throw new UsageException(e.getMessage());
            }
        }

        Path projectRoot = Paths.get(projectPath).toAbsolutePath().normalize();
        if (!Files.exists(projectRoot)) {
            out.println("Path does not exist: " + projectPath);
            return List.of();
        }

        // 1. Configuration
        ConfigReader configReader = new ConfigReader();
        AnalyzerConfig config = configPath != null
                ? configReader.read(Paths.get(configPath))
                : configReader.readOrDefault(projectRoot);
        if (skipBuild) config.setSkipBuild(true);
        if (mode != null) config.setDetectionMode(mode);

        // 2. Analysis
        System.err.println("[bsa] Analysing project: " + projectRoot);
        ProjectAnalyzer analyzer = new ProjectAnalyzer();
        List<ContractSummary> contracts;
        try {
            contracts = analyzer.analyze(projectRoot, config);
        } catch (AstLoader.AstLoadException e) {
            out.println("Parser initialization failed: " + e.getMessage());
            return List.of();
        }
        if (contracts.isEmpty()) {
            out.println("No src/ AST files found");
            return List.of();
        }

        // 3. Report and detectors
        ReportPrinter printer = new ReportPrinter(out);
        printer.printContracts(contracts);
        DetectorRegistry registry = DetectorRegistry.withDefaults(config.getDetectionMode());
        Map<String, List<Finding>> findings = analyzer.detect(contracts, registry, config.getDetectors());
        printer.printFindings(findings);

        // 4. Optional export
        if (outputDir != null) {
            SummaryExporter exporter = new SummaryExporter();
            new AnalysisSerializer().write(
                    exporter.export(projectRoot.getFileName().toString(), contracts, byContract(findings)),
                    Paths.get(outputDir));
        }

        System.err.println("[bsa] Done.");
        return contracts;
    }

    private static Map<String, List<Finding>> byContract(Map<String, List<Finding>> byDetector) {
        Map<String, List<Finding>> out = new LinkedHashMap<>();
        for (List<Finding> findings : byDetector.values()) {
            for (Finding f : findings) {
                out.computeIfAbsent(f.contract(), k -> new ArrayList<>()).add(f);
            }
        }
        return out;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
