package com.bsa.analyzer.ssa;

/** Internal SSA construction error, e.g. a merge required at a block nothing flows into. */
public class SsaInvariantException extends RuntimeException {
    public SsaInvariantException(String message) { super(message); }
}
