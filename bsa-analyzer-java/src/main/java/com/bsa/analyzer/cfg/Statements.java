package com.bsa.analyzer.cfg;

import com.bsa.analyzer.ast.AstNode;
import com.bsa.analyzer.ast.NodeType;

import java.util.List;

/**
 * Small predicates over typed statements shared by the CFG passes.
 */
final class Statements {

    private Statements() {}

    /** {@code revert(...)} call or a {@code revert Error(...)} statement. */
    static boolean isRevert(TypedStatement stmt) {
        AstNode node = stmt.node();
        if (node.is(NodeType.REVERT_STATEMENT)) return true;
        if (stmt.kind() != StatementKind.FUNCTION_CALL) return false;
        AstNode callee = node.get("expression").get("expression");
        return callee.is(NodeType.IDENTIFIER) && "revert".equals(callee.name());
    }

    static boolean containsRevert(List<TypedStatement> statements) {
        for (TypedStatement s : statements) {
            if (isRevert(s)) return true;
        }
        return false;
    }

    static boolean endsWithReturn(List<TypedStatement> statements) {
        return !statements.isEmpty() && statements.get(statements.size() - 1).kind() == StatementKind.RETURN;
    }
}
