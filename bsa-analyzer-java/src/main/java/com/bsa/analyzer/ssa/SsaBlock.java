package com.bsa.analyzer.ssa;

import com.bsa.analyzer.access.AccessSet;
import com.bsa.analyzer.cfg.BasicBlock;
import com.bsa.analyzer.cfg.Terminator;

import java.util.ArrayList;
import java.util.List;

/**
 * A finished SSA block: id, instructions, terminator and accesses only.
 */
public record SsaBlock(String id, List<Instruction> instructions, Terminator terminator, AccessSet accesses) {

    public SsaBlock {
        instructions = List.copyOf(instructions);
    }

    public static SsaBlock of(BasicBlock block) {
        return new SsaBlock(block.getId(), block.getInstructions(), block.getTerminator(), block.getAccesses());
    }

    public static List<SsaBlock> strip(List<BasicBlock> blocks) {
        List<SsaBlock> out = new ArrayList<>(blocks.size());
        for (BasicBlock b : blocks) out.add(of(b));
        return out;
    }

    /** Rendered instruction text, one entry per instruction. */
    public List<String> statements() {
        List<String> out = new ArrayList<>(instructions.size());
        for (Instruction i : instructions) out.add(i.render());
        return out;
    }
}
