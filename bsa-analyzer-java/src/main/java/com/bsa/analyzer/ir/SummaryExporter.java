package com.bsa.analyzer.ir;

import com.bsa.analyzer.ast.SourceLocation;
import com.bsa.analyzer.calls.CallSite;
import com.bsa.analyzer.detector.Finding;
import com.bsa.analyzer.ir.AnalysisModel.AnalysisRoot;
import com.bsa.analyzer.ir.AnalysisModel.BlockEntry;
import com.bsa.analyzer.ir.AnalysisModel.CallEntry;
import com.bsa.analyzer.ir.AnalysisModel.ContractEntry;
import com.bsa.analyzer.ir.AnalysisModel.EntrypointEntry;
import com.bsa.analyzer.ir.AnalysisModel.EventEntry;
import com.bsa.analyzer.ir.AnalysisModel.FindingEntry;
import com.bsa.analyzer.ir.AnalysisModel.FunctionEntry;
import com.bsa.analyzer.ir.AnalysisModel.StateVarEntry;
import com.bsa.analyzer.ssa.SsaBlock;
import com.bsa.analyzer.static_analysis.ContractSummary;
import com.bsa.analyzer.static_analysis.FunctionSummary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts contract summaries and their findings into the export model.
 */
public class SummaryExporter {

    public static final String TOOL_VERSION = "0.1.0";

    public AnalysisRoot export(String project, List<ContractSummary> contracts, Map<String, List<Finding>> findings) {
        AnalysisRoot root = new AnalysisRoot();
        root.toolVersion = TOOL_VERSION;
        root.project = project;
        root.contracts = new ArrayList<>();
        for (ContractSummary c : contracts) {
            root.contracts.add(contract(c, findings.getOrDefault(c.name(), List.of())));
        }
        return root;
    }

    private ContractEntry contract(ContractSummary c, List<Finding> findings) {
        ContractEntry e = new ContractEntry();
        e.name = c.name();
        e.pragma = c.pragma();
        e.location = location(c.location());

        e.stateVars = new ArrayList<>();
        for (ContractSummary.StateVariable v : c.stateVars()) {
            StateVarEntry s = new StateVarEntry();
            s.name = v.name();
            s.type = v.type();
            s.location = location(v.location());
            e.stateVars.add(s);
        }

        e.functions = new LinkedHashMap<>();
        for (Map.Entry<String, ContractSummary.FunctionInfo> f : c.functions().entrySet()) {
            FunctionEntry fe = new FunctionEntry();
            fe.visibility = f.getValue().visibility();
            fe.location = location(f.getValue().location());
            e.functions.put(f.getKey(), fe);
        }

        e.events = new ArrayList<>();
        for (ContractSummary.EventInfo ev : c.events()) {
            EventEntry ee = new EventEntry();
            ee.name = ev.name();
            ee.location = location(ev.location());
            e.events.add(ee);
        }

        e.entrypoints = new ArrayList<>();
        for (FunctionSummary fn : c.entrypoints()) {
            e.entrypoints.add(entrypoint(fn));
        }

        e.findings = new ArrayList<>();
        for (Finding f : findings) {
            FindingEntry fe = new FindingEntry();
            fe.detector = f.detector();
            fe.function = f.function();
            fe.description = f.description();
            fe.severity = f.severity();
            e.findings.add(fe);
        }
        return e;
    }

    private EntrypointEntry entrypoint(FunctionSummary fn) {
        EntrypointEntry e = new EntrypointEntry();
        e.name = fn.name();
        e.visibility = fn.visibility();
        e.location = location(fn.location());
        e.ssa = new ArrayList<>();
        for (SsaBlock b : fn.ssa()) {
            BlockEntry be = new BlockEntry();
            be.id = b.id();
            be.statements = b.statements();
            be.terminator = b.terminator().render();
            be.reads = new ArrayList<>(b.accesses().reads());
            be.writes = new ArrayList<>(b.accesses().writes());
            e.ssa.add(be);
        }
        e.calls = new ArrayList<>();
        for (CallSite site : fn.calls()) {
            CallEntry ce = new CallEntry();
            ce.name = site.name();
            ce.callType = site.callType().tag();
            ce.inContract = site.inContract();
            ce.isExternal = site.isExternal();
            ce.location = location(site.location());
            e.calls.add(ce);
        }
        return e;
    }

    private static List<Integer> location(SourceLocation loc) {
        return List.of(loc.line(), loc.column());
    }
}
