package com.bsa.analyzer.static_analysis;

import com.bsa.analyzer.ast.SourceLocation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything the analysis knows about one contract definition.
 *
 * @param functions every declared function by name, in declaration order
 * @param entrypoints external and public functions, after inlining
 */
public record ContractSummary(
    String name,
    String pragma,
    SourceLocation location,
    List<StateVariable> stateVars,
    Map<String, FunctionInfo> functions,
    List<EventInfo> events,
    List<FunctionSummary> entrypoints
) {

    public record StateVariable(String name, String type, SourceLocation location) {}

    public record FunctionInfo(String visibility, SourceLocation location) {

        /** External and public functions are reachable by an attacker. */
        public boolean isEntrypoint() {
            return "external".equals(visibility) || "public".equals(visibility);
        }
    }

    public record EventInfo(String name, SourceLocation location) {}

    public Set<String> stateVarNames() {
        Set<String> names = new LinkedHashSet<>();
        for (StateVariable v : stateVars) names.add(v.name());
        return names;
    }
}
