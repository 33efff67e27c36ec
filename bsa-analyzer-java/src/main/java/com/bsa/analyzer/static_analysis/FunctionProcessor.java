package com.bsa.analyzer.static_analysis;

import com.bsa.analyzer.access.AccessTracker;
import com.bsa.analyzer.ast.AstNode;
import com.bsa.analyzer.calls.CallClassifier;
import com.bsa.analyzer.calls.InternalCallInliner;
import com.bsa.analyzer.cfg.BasicBlock;
import com.bsa.analyzer.cfg.BasicBlockBuilder;
import com.bsa.analyzer.cfg.ControlFlowRefiner;
import com.bsa.analyzer.cfg.StatementClassifier;
import com.bsa.analyzer.cfg.TerminatorFinalizer;
import com.bsa.analyzer.cfg.TypedStatement;
import com.bsa.analyzer.ssa.InstructionSplitter;
import com.bsa.analyzer.ssa.LoopCallAnalyzer;
import com.bsa.analyzer.ssa.PhiInserter;
import com.bsa.analyzer.ssa.SsaBuildContext;
import com.bsa.analyzer.ssa.SsaConverter;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the per-function pipeline: blocks, refinement, terminators, accesses, SSA and phis.
 * Entrypoints go through {@link #inline} afterwards.
 */
public class FunctionProcessor {

    /** Output of the standalone pass, kept as inlining material. */
    public record FirstPass(AstNode definition, List<AstNode> body, List<BasicBlock> blocks, SsaBuildContext ctx) {}

    private final BasicBlockBuilder blockBuilder = new BasicBlockBuilder();
    private final ControlFlowRefiner refiner = new ControlFlowRefiner();
    private final TerminatorFinalizer finalizer = new TerminatorFinalizer();
    private final AccessTracker accessTracker = new AccessTracker();
    private final PhiInserter phiInserter = new PhiInserter();
    private final InstructionSplitter splitter = new InstructionSplitter();
    private final CallClassifier classifier;
    private final LoopCallAnalyzer loopCalls;
    private final SsaConverter converter;

    public FunctionProcessor(CallClassifier classifier) {
        this.classifier = classifier;
        this.loopCalls = new LoopCallAnalyzer(classifier);
        this.converter = new SsaConverter(classifier);
    }

    public FirstPass process(AstNode definition) {
        SsaBuildContext ctx = new SsaBuildContext();
        List<AstNode> body = definition.get("body").bodyStatements();

        List<TypedStatement> typed = StatementClassifier.classify(body);
        List<BasicBlock> blocks = blockBuilder.split(typed, ctx);
        blocks = refiner.refine(blocks, ctx);
        finalizer.finalizeAll(blocks);
        accessTracker.track(blocks);
        loopCalls.analyze(blocks);
        SsaConverter.Conversion conversion = converter.convert(blocks, phiInserter.place(blocks), ctx);
        phiInserter.insert(blocks, conversion.phis());
        return new FirstPass(definition, body, blocks, ctx);
    }

    /**
     * Versions copies of a first pass's blocks again with internal calls expanded in place,
     * then splits the blocks that grew. The first pass itself is left as is.
     */
    public List<BasicBlock> inline(FirstPass pass, InternalCallInliner inliner) {
        SsaBuildContext ctx = pass.ctx().restart();
        List<BasicBlock> blocks = new ArrayList<>();
        for (BasicBlock b : pass.blocks()) blocks.add(b.copy());

        SsaConverter inlining = new SsaConverter(classifier, inliner);
        SsaConverter.Conversion conversion = inlining.convert(blocks, phiInserter.place(blocks), ctx);
        phiInserter.insert(blocks, conversion.phis());
        blocks = splitter.split(blocks, conversion.grown(), ctx);
        TerminatorFinalizer.verify(blocks);
        return blocks;
    }

    public static List<String> parameterNames(AstNode definition) {
        List<String> names = new ArrayList<>();
        for (AstNode p : definition.get("parameters").list("parameters")) {
            names.add(p.name());
        }
        return names;
    }
}
