package com.bsa.analyzer.cfg;

import com.bsa.analyzer.ast.AstNode;

public record TypedStatement(StatementKind kind, AstNode node) {

    @Override
    public String toString() {
        return kind.label() + ":" + node.src();
    }
}
