package com.bsa.analyzer.detector;

import com.bsa.analyzer.access.CompositeNames;
import com.bsa.analyzer.cfg.ControlFlowGraph;
import com.bsa.analyzer.ssa.Instruction;
import com.bsa.analyzer.ssa.SsaBlock;
import com.bsa.analyzer.static_analysis.ContractSummary;
import com.bsa.analyzer.static_analysis.FunctionSummary;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Flags entrypoints where a call leaving the contract precedes a write to contract storage.
 *
 * <p>In {@link DetectionMode#ORDER} mode "precedes" means an earlier block in creation order.
 * That can flag a write on a branch the call never reaches, and miss a write that only happens
 * through a loop back-edge. {@link DetectionMode#REACHABILITY} follows CFG edges instead.
 */
public class ReentrancyDetector implements Detector {

    public static final String NAME = "Reentrancy";
    static final String SEVERITY = "High";

    private final DetectionMode mode;

    public ReentrancyDetector(DetectionMode mode) {
        this.mode = mode;
    }

    @Override
    public String name() { return NAME; }

    @Override
    public List<Finding> detect(ContractSummary contract) {
        Set<String> stateVars = contract.stateVarNames();
        List<Finding> findings = new ArrayList<>();
        for (FunctionSummary fn : contract.entrypoints()) {
            StateWrite write = mode == DetectionMode.ORDER
                    ? writeAfterCallByOrder(fn.ssa(), stateVars)
                    : writeAfterCallByReachability(fn, stateVars);
            if (write != null) {
                findings.add(new Finding(NAME, contract.name(), fn.name(),
                        "External call detected before state variable write ("
                                + write.instruction().render() + " at " + write.blockId() + ")",
                        SEVERITY));
            }
        }
        return findings;
    }

    private record StateWrite(String blockId, Instruction instruction) {}

    private StateWrite writeAfterCallByOrder(List<SsaBlock> blocks, Set<String> stateVars) {
        int firstCall = -1;
        for (int i = 0; i < blocks.size() && firstCall < 0; i++) {
            if (firstExternalCall(blocks.get(i)) >= 0) firstCall = i;
        }
        if (firstCall < 0) return null;
        for (int w = firstCall + 1; w < blocks.size(); w++) {
            Instruction write = firstStateWrite(blocks.get(w), 0, stateVars);
            if (write != null) return new StateWrite(blocks.get(w).id(), write);
        }
        return null;
    }

    private StateWrite writeAfterCallByReachability(FunctionSummary fn, Set<String> stateVars) {
        ControlFlowGraph graph = new ControlFlowGraph(fn.blocks());
        for (SsaBlock block : fn.ssa()) {
            int call = firstExternalCall(block);
            if (call < 0) continue;
            Instruction sameBlock = firstStateWrite(block, call + 1, stateVars);
            if (sameBlock != null) return new StateWrite(block.id(), sameBlock);

            Set<String> reachable = graph.reachableFrom(block.id());
            for (SsaBlock later : fn.ssa()) {
                if (!reachable.contains(later.id())) continue;
                Instruction write = firstStateWrite(later, 0, stateVars);
                if (write != null) return new StateWrite(later.id(), write);
            }
        }
        return null;
    }

    private static int firstExternalCall(SsaBlock block) {
        List<Instruction> instructions = block.instructions();
        for (int i = 0; i < instructions.size(); i++) {
            if (instructions.get(i).isExternalCall()) return i;
        }
        return -1;
    }

    private static Instruction firstStateWrite(SsaBlock block, int from, Set<String> stateVars) {
        List<Instruction> instructions = block.instructions();
        for (int i = from; i < instructions.size(); i++) {
            Instruction ins = instructions.get(i);
            if (ins.isPhi() || ins.target() == null) continue;
            if (stateVars.contains(CompositeNames.rootOf(ins.target().name()))) return ins;
        }
        return null;
    }
}
