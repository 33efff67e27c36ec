package com.bsa.analyzer.ssa;

import com.bsa.analyzer.cfg.BasicBlock;
import com.bsa.analyzer.cfg.Terminator;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Re-applies the block boundary rules to instruction lists that grew during inlining.
 *
 * <p>Conditions, returns and emits always end a piece. Calls, assignments and declarations end
 * one unless they are last. The first piece keeps the block's id; later pieces get fresh ids
 * and are chained by gotos, and the last piece takes over the original terminator.
 */
public class InstructionSplitter {

    public List<BasicBlock> split(List<BasicBlock> blocks, Set<String> grown, SsaBuildContext ctx) {
        List<BasicBlock> out = new ArrayList<>();
        for (BasicBlock block : blocks) {
            if (!grown.contains(block.getId())) {
                out.add(block);
                continue;
            }
            out.addAll(splitBlock(block, ctx));
        }
        return out;
    }

    private List<BasicBlock> splitBlock(BasicBlock block, SsaBuildContext ctx) {
        List<List<Instruction>> pieces = pieces(block.getInstructions());
        if (pieces.size() < 2) return List.of(block);

        List<BasicBlock> out = new ArrayList<>(pieces.size());
        BasicBlock first = block.copy();
        first.setInstructions(pieces.get(0));
        first.setAccesses(block.getAccesses().union(InstructionAccesses.of(pieces.get(0))));
        out.add(first);
        for (int i = 1; i < pieces.size(); i++) {
            BasicBlock piece = new BasicBlock(ctx.nextBlockId(), List.of());
            piece.setInstructions(pieces.get(i));
            piece.setAccesses(InstructionAccesses.of(pieces.get(i)));
            recordVersions(piece);
            out.add(piece);
        }
        for (int i = 0; i < out.size() - 1; i++) {
            out.get(i).setTerminator(Terminator.goTo(out.get(i + 1).getId()));
        }
        out.get(out.size() - 1).setTerminator(block.getTerminator());
        return out;
    }

    static List<List<Instruction>> pieces(List<Instruction> instructions) {
        List<List<Instruction>> pieces = new ArrayList<>();
        List<Instruction> current = new ArrayList<>();
        for (int i = 0; i < instructions.size(); i++) {
            Instruction ins = instructions.get(i);
            current.add(ins);
            boolean last = i == instructions.size() - 1;
            if (endsPiece(ins.opcode(), last)) {
                pieces.add(current);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) pieces.add(current);
        return pieces;
    }

    private static boolean endsPiece(Opcode opcode, boolean last) {
        return switch (opcode) {
            case CONDITION, RETURN, EMIT -> true;
            case CALL, ASSIGN, DECLARE -> !last;
            case PHI, EXPRESSION -> false;
        };
    }

    private static void recordVersions(BasicBlock piece) {
        for (Instruction i : piece.getInstructions()) {
            for (VersionedVar v : i.readVars()) {
                if (!InstructionAccesses.isResultSlot(v)) piece.getReadVersions().putIfAbsent(v.name(), v.version());
            }
            VersionedVar t = i.target();
            if (t != null && !InstructionAccesses.isResultSlot(t)) piece.getWriteVersions().put(t.name(), t.version());
        }
    }
}
