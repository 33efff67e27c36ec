package com.bsa.analyzer.ssa;

import com.bsa.analyzer.ast.AstNode;
import com.bsa.analyzer.ast.NodeType;
import com.bsa.analyzer.calls.CallClassifier;
import com.bsa.analyzer.cfg.BasicBlock;
import com.bsa.analyzer.cfg.ControlFlowGraph;
import com.bsa.analyzer.cfg.LoopRole;
import com.bsa.analyzer.cfg.Terminator;
import com.bsa.analyzer.cfg.TypedStatement;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Marks variables written inside loops that call out of the contract, so the loop header
 * merges them even when the plain predecessor rule would not. Works on statements and
 * accesses, so it runs before versioning.
 */
public class LoopCallAnalyzer {

    private final CallClassifier classifier;

    public LoopCallAnalyzer(CallClassifier classifier) {
        this.classifier = classifier;
    }

    public void analyze(List<BasicBlock> blocks) {
        ControlFlowGraph graph = new ControlFlowGraph(blocks);
        for (String headerId : graph.loopHeaders()) {
            BasicBlock header = graph.block(headerId);
            List<BasicBlock> chain = bodyChain(header, graph);
            if (callsOut(chain)) {
                for (BasicBlock b : chain) {
                    header.getLoopCarried().addAll(b.getAccesses().writes());
                }
            }
        }
    }

    /** Blocks from the header's taken edge, following gotos until the loop closes or exits. */
    static List<BasicBlock> bodyChain(BasicBlock header, ControlFlowGraph graph) {
        List<BasicBlock> chain = new ArrayList<>();
        Terminator t = header.getTerminator();
        String next = t.kind() == Terminator.Kind.BRANCH ? t.thenTarget() : null;
        Set<String> seen = new HashSet<>();
        while (next != null && !next.equals(header.getId()) && seen.add(next)) {
            BasicBlock b = graph.block(next);
            if (b == null || b.getRole() == LoopRole.EXIT) break;
            chain.add(b);
            Terminator bt = b.getTerminator();
            next = bt.kind() == Terminator.Kind.GOTO ? bt.target() : null;
        }
        return chain;
    }

    private boolean callsOut(List<BasicBlock> chain) {
        for (BasicBlock b : chain) {
            for (TypedStatement stmt : b.getStatements()) {
                if (callsOut(stmt.node())) return true;
            }
        }
        return false;
    }

    private boolean callsOut(AstNode node) {
        if (node.is(NodeType.FUNCTION_CALL) && !CallClassifier.isTypeConversion(node)
                && classifier.classify(node).isExternalFamily()) {
            return true;
        }
        for (AstNode child : node.children()) {
            if (callsOut(child)) return true;
        }
        return false;
    }
}
