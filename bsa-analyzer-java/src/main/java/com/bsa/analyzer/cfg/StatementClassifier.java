package com.bsa.analyzer.cfg;

import com.bsa.analyzer.ast.AstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Tags raw statement nodes with a {@link StatementKind}. Total: unrecognised nodes are UNKNOWN.
 */
public final class StatementClassifier {

    private StatementClassifier() {}

    public static List<TypedStatement> classify(List<AstNode> statements) {
        List<TypedStatement> typed = new ArrayList<>(statements.size());
        for (AstNode stmt : statements) {
            typed.add(new TypedStatement(kindOf(stmt), stmt));
        }
        return typed;
    }

    public static StatementKind kindOf(AstNode stmt) {
        return switch (stmt.type()) {
            case EXPRESSION_STATEMENT -> switch (stmt.get("expression").type()) {
                case ASSIGNMENT -> StatementKind.ASSIGNMENT;
                case FUNCTION_CALL -> StatementKind.FUNCTION_CALL;
                default -> StatementKind.EXPRESSION;
            };
            case EXPRESSION -> StatementKind.EXPRESSION;
            case EMIT_STATEMENT -> StatementKind.EMIT_STATEMENT;
            case IF_STATEMENT -> StatementKind.IF_STATEMENT;
            case RETURN, RETURN_STATEMENT -> StatementKind.RETURN;
            case VARIABLE_DECLARATION_STATEMENT -> StatementKind.VARIABLE_DECLARATION;
            case FOR_STATEMENT -> StatementKind.FOR_LOOP;
            case WHILE_STATEMENT -> StatementKind.WHILE_LOOP;
            case BLOCK -> StatementKind.BLOCK;
            case SOURCE_UNIT, PRAGMA_DIRECTIVE, CONTRACT_DEFINITION, VARIABLE_DECLARATION,
                 FUNCTION_DEFINITION, EVENT_DEFINITION, REVERT_STATEMENT, ASSIGNMENT, FUNCTION_CALL,
                 FUNCTION_CALL_OPTIONS, IDENTIFIER, MEMBER_ACCESS, INDEX_ACCESS, LITERAL,
                 BINARY_OPERATION, UNARY_OPERATION, TUPLE_EXPRESSION, CONDITIONAL,
                 ELEMENTARY_TYPE_NAME_EXPRESSION, UNKNOWN -> StatementKind.UNKNOWN;
        };
    }
}
