package com.bsa.analyzer.ssa;

import com.bsa.analyzer.access.AccessSet;
import com.bsa.analyzer.access.CompositeNames;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read and write sets recovered from instructions, for blocks whose code did not come from
 * source statements. Call-result slots are not variables and are left out.
 */
public final class InstructionAccesses {

    private InstructionAccesses() {}

    public static AccessSet of(List<Instruction> instructions) {
        Set<String> reads = new TreeSet<>();
        Set<String> writes = new TreeSet<>();
        for (Instruction i : instructions) {
            for (VersionedVar v : i.readVars()) {
                if (!isResultSlot(v)) reads.add(v.name());
            }
            VersionedVar target = i.target();
            if (target != null && !isResultSlot(target)) {
                writes.add(CompositeNames.rootOf(target.name()));
                writes.add(target.name());
            }
        }
        return AccessSet.of(reads, writes);
    }

    static boolean isResultSlot(VersionedVar v) {
        return SsaBuildContext.RESULT_SLOT.equals(v.name());
    }
}
