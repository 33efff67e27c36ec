package com.bsa.analyzer.calls;

import com.bsa.analyzer.ast.SourceLocation;

/**
 * A call made by an entrypoint, listed once per callee name.
 */
public record CallSite(String name, CallType callType, SourceLocation location) {

    public boolean inContract() { return callType == CallType.INTERNAL; }

    public boolean isExternal() { return callType.isExternalFamily(); }
}
