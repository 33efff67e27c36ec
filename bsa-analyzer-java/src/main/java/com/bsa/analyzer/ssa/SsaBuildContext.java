package com.bsa.analyzer.ssa;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-function mutable state shared by the CFG and SSA passes: block ids, version counters,
 * the current version of every variable and the call-result slot counter.
 *
 * <p>One instance is created per function and per inlining pass; nothing is shared between
 * functions.
 */
public class SsaBuildContext {

    public static final String RESULT_SLOT = "ret";

    private int nextBlock;
    private int nextRet;
    private final Map<String, Integer> counters = new HashMap<>();
    private final Map<String, Integer> current = new HashMap<>();

    public String nextBlockId() {
        return "Block" + nextBlock++;
    }

    /** Makes {@code var} known at version 0 unless it already has a version. */
    public void seed(String var) {
        counters.putIfAbsent(var, 0);
        current.putIfAbsent(var, 0);
    }

    /** Allocates the next version of {@code var} and makes it current. */
    public int nextVersion(String var) {
        int v = counters.getOrDefault(var, 0) + 1;
        counters.put(var, v);
        current.put(var, v);
        return v;
    }

    /** Current version of {@code var}, 0 when it was never written. */
    public int latest(String var) {
        return current.getOrDefault(var, 0);
    }

    public VersionedVar latestVar(String var) {
        return new VersionedVar(var, latest(var));
    }

    public VersionedVar nextResultSlot() {
        return new VersionedVar(RESULT_SLOT, ++nextRet);
    }

    /**
     * A context that continues block numbering where this one stands but starts versions and
     * result slots afresh, for versioning the same blocks a second time.
     */
    public SsaBuildContext restart() {
        SsaBuildContext c = new SsaBuildContext();
        c.nextBlock = nextBlock;
        return c;
    }
}
