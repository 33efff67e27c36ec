package com.bsa.analyzer.static_analysis;

import com.bsa.analyzer.ast.AstNode;
import com.bsa.analyzer.ast.SourceLocation;
import com.bsa.analyzer.calls.CallSite;
import com.bsa.analyzer.cfg.BasicBlock;
import com.bsa.analyzer.ssa.SsaBlock;

import java.util.List;

/**
 * One analysed function.
 *
 * @param bodyRaw the function's body statements as they appear in the AST
 * @param blocks full blocks, including statements and versions
 * @param ssa the same blocks stripped to id, instructions, terminator and accesses
 */
public record FunctionSummary(
    String name,
    String visibility,
    SourceLocation location,
    List<AstNode> bodyRaw,
    List<BasicBlock> blocks,
    List<SsaBlock> ssa,
    List<CallSite> calls
) {
}
