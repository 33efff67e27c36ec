package com.bsa.analyzer.ssa;

public enum Opcode {
    ASSIGN,
    DECLARE,
    CALL,
    CONDITION,
    RETURN,
    EMIT,
    PHI,
    EXPRESSION
}
