package com.bsa.analyzer.cfg;

/**
 * Internal control-flow invariant breach. Signals a bug in the analyzer, not bad input.
 */
public class CfgInvariantException extends RuntimeException {
    public CfgInvariantException(String message) { super(message); }
}
