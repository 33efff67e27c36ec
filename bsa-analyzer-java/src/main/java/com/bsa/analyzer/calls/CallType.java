package com.bsa.analyzer.calls;

/** How a call site leaves (or stays in) the current contract. */
public enum CallType {
    INTERNAL("internal"),
    EXTERNAL("external"),
    LOW_LEVEL_EXTERNAL("low_level_external"),
    DELEGATECALL("delegatecall"),
    STATICCALL("staticcall"),
    REVERT("revert");

    private final String tag;

    CallType(String tag) {
        this.tag = tag;
    }

    /** Lower-case tag used in rendered instructions, e.g. {@code call[low_level_external]}. */
    public String tag() { return tag; }

    /** Calls that hand control to code outside the contract. Revert-family builtins are not. */
    public boolean isExternalFamily() {
        return this == EXTERNAL || this == LOW_LEVEL_EXTERNAL || this == DELEGATECALL || this == STATICCALL;
    }
}
