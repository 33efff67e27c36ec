package com.bsa.analyzer.ssa;

/**
 * A variable at one SSA version. Version 0 is the value on entry to the function.
 */
public record VersionedVar(String name, int version) {

    public String render() { return name + "_" + version; }

    @Override
    public String toString() { return render(); }
}
