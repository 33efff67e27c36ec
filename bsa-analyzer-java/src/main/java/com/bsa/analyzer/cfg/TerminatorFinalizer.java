package com.bsa.analyzer.cfg;

import java.util.List;

/**
 * Resolves every {@link Terminator.Kind#PENDING} terminator. Runs once per function after
 * refinement and before anything reads the graph's edges.
 */
public class TerminatorFinalizer {

    public List<BasicBlock> finalizeAll(List<BasicBlock> blocks) {
        for (int i = 0; i < blocks.size(); i++) {
            BasicBlock block = blocks.get(i);
            if (!block.getTerminator().isPending()) continue;

            List<TypedStatement> statements = block.getStatements();
            if (Statements.endsWithReturn(statements)) {
                block.setTerminator(Terminator.RETURN);
            } else if (Statements.containsRevert(statements)) {
                block.setTerminator(Terminator.REVERT);
            } else if (block.getBranchSide() != null || block.getRole() == LoopRole.EXIT) {
                // left pending by the refiner only when nothing followed the construct
                block.setTerminator(Terminator.RETURN);
            } else if (i + 1 < blocks.size()) {
                block.setTerminator(Terminator.goTo(blocks.get(i + 1).getId()));
            } else {
                block.setTerminator(Terminator.RETURN);
            }
        }
        verify(blocks);
        return blocks;
    }

    /**
     * @throws CfgInvariantException if a pending terminator remains or an edge targets an unknown block
     */
    public static void verify(List<BasicBlock> blocks) {
        ControlFlowGraph graph = new ControlFlowGraph(blocks);
        for (BasicBlock block : blocks) {
            if (block.getTerminator().isPending()) {
                throw new CfgInvariantException("Block " + block.getId() + " still has a pending terminator");
            }
            for (String target : block.getTerminator().successors()) {
                if (!graph.contains(target)) {
                    throw new CfgInvariantException("Block " + block.getId() + " jumps to unknown block " + target);
                }
            }
        }
    }
}
