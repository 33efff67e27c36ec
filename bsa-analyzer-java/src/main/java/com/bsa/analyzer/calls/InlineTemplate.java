package com.bsa.analyzer.calls;

import com.bsa.analyzer.cfg.BasicBlock;
import com.bsa.analyzer.ssa.Instruction;
import com.bsa.analyzer.ssa.Opcode;

import java.util.ArrayList;
import java.util.List;

/**
 * A function body as inlining material: its first-pass instructions in block order, without
 * phis (they do not cross function boundaries) and without returns.
 */
public record InlineTemplate(String name, List<String> parameters, List<Instruction> body) {

    public InlineTemplate {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    public static InlineTemplate of(String name, List<String> parameters, List<BasicBlock> blocks) {
        List<Instruction> body = new ArrayList<>();
        for (BasicBlock b : blocks) {
            for (Instruction i : b.getInstructions()) {
                if (i.opcode() == Opcode.PHI || i.opcode() == Opcode.RETURN) continue;
                body.add(i);
            }
        }
        return new InlineTemplate(name, parameters, body);
    }
}
