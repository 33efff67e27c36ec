package com.bsa.analyzer.cfg;

import com.bsa.analyzer.ssa.SsaBuildContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a flat statement list into basic blocks.
 *
 * Control flow, returns and emits always end a block. Calls, assignments and declarations end
 * a block unless they are the last statement, so every side effect is block-final.
 */
public class BasicBlockBuilder {

    public List<BasicBlock> split(List<TypedStatement> statements, SsaBuildContext ctx) {
        List<BasicBlock> blocks = new ArrayList<>();
        List<TypedStatement> current = new ArrayList<>();

        for (int i = 0; i < statements.size(); i++) {
            TypedStatement stmt = statements.get(i);
            current.add(stmt);
            boolean last = i == statements.size() - 1;
            StatementKind kind = stmt.kind();
            if (kind.alwaysEndsBlock() || (kind.isEffectful() && !last)) {
                blocks.add(new BasicBlock(ctx.nextBlockId(), current));
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            blocks.add(new BasicBlock(ctx.nextBlockId(), current));
        }
        return blocks;
    }
}
