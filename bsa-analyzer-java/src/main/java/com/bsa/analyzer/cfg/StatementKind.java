package com.bsa.analyzer.cfg;

public enum StatementKind {
    ASSIGNMENT("Assignment"),
    FUNCTION_CALL("FunctionCall"),
    EXPRESSION("Expression"),
    EMIT_STATEMENT("EmitStatement"),
    IF_STATEMENT("IfStatement"),
    RETURN("Return"),
    VARIABLE_DECLARATION("VariableDeclaration"),
    FOR_LOOP("ForLoop"),
    WHILE_LOOP("WhileLoop"),
    BLOCK("Block"),
    UNKNOWN("Unknown");

    private final String label;

    StatementKind(String label) {
        this.label = label;
    }

    public String label() { return label; }

    /** Kinds that always end the current basic block. */
    public boolean alwaysEndsBlock() {
        return this == IF_STATEMENT || this == FOR_LOOP || this == WHILE_LOOP
                || this == RETURN || this == EMIT_STATEMENT;
    }

    /** Kinds that end the current basic block unless they are the last statement. */
    public boolean isEffectful() {
        return this == FUNCTION_CALL || this == ASSIGNMENT || this == VARIABLE_DECLARATION;
    }

    public boolean isControlFlow() {
        return this == IF_STATEMENT || this == FOR_LOOP || this == WHILE_LOOP;
    }
}
