package com.bsa.analyzer.ast;

import java.util.HashMap;
import java.util.Map;

/**
 * The compiler AST node types the analyzer understands. Anything else maps to {@link #UNKNOWN}.
 */
public enum NodeType {
    SOURCE_UNIT("SourceUnit"),
    PRAGMA_DIRECTIVE("PragmaDirective"),
    CONTRACT_DEFINITION("ContractDefinition"),
    VARIABLE_DECLARATION("VariableDeclaration"),
    FUNCTION_DEFINITION("FunctionDefinition"),
    EVENT_DEFINITION("EventDefinition"),
    BLOCK("Block"),
    EXPRESSION_STATEMENT("ExpressionStatement"),
    EMIT_STATEMENT("EmitStatement"),
    IF_STATEMENT("IfStatement"),
    RETURN("Return"),
    RETURN_STATEMENT("ReturnStatement"),
    VARIABLE_DECLARATION_STATEMENT("VariableDeclarationStatement"),
    FOR_STATEMENT("ForStatement"),
    WHILE_STATEMENT("WhileStatement"),
    REVERT_STATEMENT("RevertStatement"),
    /** Synthetic wrapper used for loop-header conditions. */
    EXPRESSION("Expression"),
    ASSIGNMENT("Assignment"),
    FUNCTION_CALL("FunctionCall"),
    FUNCTION_CALL_OPTIONS("FunctionCallOptions"),
    IDENTIFIER("Identifier"),
    MEMBER_ACCESS("MemberAccess"),
    INDEX_ACCESS("IndexAccess"),
    LITERAL("Literal"),
    BINARY_OPERATION("BinaryOperation"),
    UNARY_OPERATION("UnaryOperation"),
    TUPLE_EXPRESSION("TupleExpression"),
    CONDITIONAL("Conditional"),
    ELEMENTARY_TYPE_NAME_EXPRESSION("ElementaryTypeNameExpression"),
    UNKNOWN("Unknown");

    private static final Map<String, NodeType> BY_NAME = new HashMap<>();

    static {
        for (NodeType t : values()) {
            BY_NAME.put(t.jsonName, t);
        }
    }

    private final String jsonName;

    NodeType(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() { return jsonName; }

    public static NodeType of(String nodeType) {
        if (nodeType == null) return UNKNOWN;
        return BY_NAME.getOrDefault(nodeType, UNKNOWN);
    }
}
