package com.bsa.analyzer.report;

import com.bsa.analyzer.calls.CallSite;
import com.bsa.analyzer.detector.Finding;
import com.bsa.analyzer.ssa.SsaBlock;
import com.bsa.analyzer.static_analysis.ContractSummary;
import com.bsa.analyzer.static_analysis.FunctionSummary;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Human-readable report. Downstream tooling greps these lines, so their shape is fixed.
 */
public class ReportPrinter {

    static final int SAMPLE_STATEMENTS = 2;

    private final PrintStream out;

    public ReportPrinter(PrintStream out) {
        this.out = out;
    }

    public void printContracts(List<ContractSummary> contracts) {
        for (ContractSummary contract : contracts) {
            out.println("Contract: " + contract.name());
            if (contract.entrypoints().isEmpty()) {
                out.println("No Entrypoints found in src/ files");
                continue;
            }
            for (FunctionSummary fn : contract.entrypoints()) {
                printEntrypoint(fn);
            }
        }
    }

    private void printEntrypoint(FunctionSummary fn) {
        out.println("Entrypoint: " + fn.name() + " at " + fn.location());
        out.println("  Blocks: " + fn.blocks().size());
        out.println("  SSA Blocks: " + fn.ssa().size());

        int reads = 0;
        int writes = 0;
        for (SsaBlock b : fn.ssa()) {
            reads += b.accesses().reads().size();
            writes += b.accesses().writes().size();
        }
        out.println("  Variable Accesses: " + reads + " reads, " + writes + " writes");

        if (!fn.ssa().isEmpty()) {
            List<String> statements = fn.ssa().get(0).statements();
            out.println("  SSA Sample:");
            for (int i = 0; i < Math.min(SAMPLE_STATEMENTS, statements.size()); i++) {
                out.println("    " + statements.get(i));
            }
            if (statements.size() > SAMPLE_STATEMENTS) {
                out.println("    ...");
            }
        }
        printCalls(fn.calls());
    }

    private void printCalls(List<CallSite> calls) {
        if (calls.isEmpty()) {
            out.println("  No function calls");
            return;
        }
        List<String> internal = new ArrayList<>();
        List<String> external = new ArrayList<>();
        for (CallSite call : calls) {
            String scope = call.inContract() ? "this contract" : "unknown";
            String line = call.name() + " (" + scope + ") at " + call.location();
            if (call.isExternal()) external.add(line);
            else internal.add(line);
        }
        if (internal.isEmpty()) {
            out.println("  No internal calls");
        } else {
            out.println("  Internal calls: " + String.join(", ", internal));
        }
        if (!external.isEmpty()) {
            out.println("  External calls: " + String.join(", ", external));
        }
    }

    /** One block per {@code Contract.Function} and detector, first finding wins. */
    public void printFindings(Map<String, List<Finding>> findingsByDetector) {
        for (Map.Entry<String, List<Finding>> e : findingsByDetector.entrySet()) {
            Set<String> seen = new HashSet<>();
            for (Finding f : e.getValue()) {
                String key = f.contract() + "." + f.function();
                if (!seen.add(key)) continue;
                out.println("!!!! " + e.getKey().toUpperCase(Locale.ROOT) + " found in " + key);
                out.println("     Description: " + f.description());
                out.println("     Severity: " + f.severity());
            }
        }
    }
}
