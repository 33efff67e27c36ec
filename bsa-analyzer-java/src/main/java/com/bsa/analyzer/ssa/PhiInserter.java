package com.bsa.analyzer.ssa;

import com.bsa.analyzer.cfg.BasicBlock;
import com.bsa.analyzer.cfg.ControlFlowGraph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Places phi functions at merge blocks and loop headers, and fills in their arguments once
 * every block has been versioned.
 *
 * <p>A variable is merged at a block when two or more predecessors write it, when some
 * predecessor writes it and the block reads it, or when it is loop-carried through an
 * external call. Placement only looks at accesses, so {@link SsaConverter} can give each phi
 * its version on entry to the block, before the block's own writes.
 */
public class PhiInserter {

    /** Variables to merge, keyed by block id, in block order. */
    public Map<String, Set<String>> place(List<BasicBlock> blocks) {
        ControlFlowGraph graph = new ControlFlowGraph(blocks);
        Set<String> headers = graph.loopHeaders();

        Map<String, Set<String>> placement = new LinkedHashMap<>();
        for (BasicBlock block : blocks) {
            List<String> preds = graph.predecessors(block.getId());
            if (preds.size() < 2 && !headers.contains(block.getId())) continue;

            Set<String> needed = needed(block, preds, graph);
            if (needed.isEmpty()) continue;
            if (preds.isEmpty()) {
                throw new SsaInvariantException("Phi required at " + block.getId() + " which has no predecessors");
            }
            placement.put(block.getId(), needed);
        }
        return placement;
    }

    /**
     * Prepends the phis whose destinations were allocated during versioning.
     *
     * @param dests phi destination version per variable, keyed by block id
     */
    public void insert(List<BasicBlock> blocks, Map<String, Map<String, Integer>> dests) {
        ControlFlowGraph graph = new ControlFlowGraph(blocks);
        for (BasicBlock block : blocks) {
            Map<String, Integer> blockDests = dests.get(block.getId());
            if (blockDests == null || blockDests.isEmpty()) continue;

            List<Instruction> rewritten = new ArrayList<>();
            for (Map.Entry<String, Integer> d : blockDests.entrySet()) {
                String var = d.getKey();
                List<VersionedVar> args = new ArrayList<>();
                List<String> sources = new ArrayList<>();
                for (String pred : graph.predecessors(block.getId())) {
                    args.add(new VersionedVar(var, liveOut(pred, var, graph, dests, new HashSet<>())));
                    sources.add(pred);
                }
                rewritten.add(Instruction.phi(new VersionedVar(var, d.getValue()), args, sources));
            }
            rewritten.addAll(block.getInstructions());
            block.setInstructions(rewritten);
        }
    }

    private static Set<String> needed(BasicBlock block, List<String> preds, ControlFlowGraph graph) {
        Set<String> candidates = new TreeSet<>(block.getLoopCarried());
        for (String p : preds) {
            candidates.addAll(graph.block(p).getAccesses().writes());
        }
        Set<String> needed = new TreeSet<>();
        for (String var : candidates) {
            int writers = 0;
            for (String p : preds) {
                if (graph.block(p).getAccesses().writes().contains(var)) writers++;
            }
            boolean read = block.getAccesses().reads().contains(var);
            if (writers > 1 || (writers > 0 && read) || block.getLoopCarried().contains(var)) {
                needed.add(var);
            }
        }
        return needed;
    }

    /** Version of {@code var} leaving {@code blockId}: its own write, else what flowed in. */
    private static int liveOut(String blockId, String var, ControlFlowGraph graph,
                               Map<String, Map<String, Integer>> dests, Set<String> visiting) {
        Integer own = graph.block(blockId).getWriteVersions().get(var);
        if (own != null) return own;
        Map<String, Integer> merged = dests.get(blockId);
        if (merged != null && merged.containsKey(var)) return merged.get(var);
        if (!visiting.add(blockId)) return 0;
        int at = graph.indexOf(blockId);
        for (String pred : graph.predecessors(blockId)) {
            if (graph.indexOf(pred) < at) {
                return liveOut(pred, var, graph, dests, visiting);
            }
        }
        return 0;
    }
}
