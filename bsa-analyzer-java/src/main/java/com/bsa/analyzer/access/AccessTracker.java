package com.bsa.analyzer.access;

import com.bsa.analyzer.ast.AstNode;
import com.bsa.analyzer.ast.NodeType;
import com.bsa.analyzer.cfg.BasicBlock;
import com.bsa.analyzer.cfg.StatementClassifier;
import com.bsa.analyzer.cfg.StatementKind;
import com.bsa.analyzer.cfg.TypedStatement;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the read and write sets of each block.
 *
 * <p>A member or index access records both its base and its composite name, so consumers can
 * work at either granularity.
 */
public class AccessTracker {

    public void track(List<BasicBlock> blocks) {
        for (BasicBlock block : blocks) {
            block.setAccesses(accessesOf(block.getStatements()));
        }
    }

    public AccessSet accessesOf(List<TypedStatement> statements) {
        Set<String> reads = new TreeSet<>();
        Set<String> writes = new TreeSet<>();
        for (TypedStatement stmt : statements) {
            visit(stmt, reads, writes);
        }
        return AccessSet.of(reads, writes);
    }

    private void visit(TypedStatement stmt, Set<String> reads, Set<String> writes) {
        AstNode node = stmt.node();
        switch (stmt.kind()) {
            case ASSIGNMENT -> assignment(node.get("expression"), reads, writes);
            case FUNCTION_CALL -> collectReads(node.get("expression"), reads);
            case EMIT_STATEMENT -> emit(node.get("eventCall"), reads);
            case IF_STATEMENT -> collectReads(node.get("condition"), reads);
            case RETURN -> collectReads(node.get("expression"), reads);
            case VARIABLE_DECLARATION -> declaration(node, reads, writes);
            case FOR_LOOP -> forLoop(node, reads, writes);
            case WHILE_LOOP -> collectReads(node.get("condition"), reads);
            case EXPRESSION -> expression(node, reads, writes);
            case BLOCK -> {
                for (TypedStatement inner : StatementClassifier.classify(node.list("statements"))) {
                    visit(inner, reads, writes);
                }
            }
            case UNKNOWN -> { }
        }
    }

    private void assignment(AstNode assignment, Set<String> reads, Set<String> writes) {
        collectWrites(assignment.get("leftHandSide"), reads, writes);
        collectReads(assignment.get("rightHandSide"), reads);
    }

    private void declaration(AstNode node, Set<String> reads, Set<String> writes) {
        for (AstNode decl : node.list("declarations")) {
            if (!decl.name().isEmpty()) writes.add(decl.name());
        }
        collectReads(node.get("initialValue"), reads);
    }

    private void expression(AstNode node, Set<String> reads, Set<String> writes) {
        AstNode expr = node.get("expression");
        if (isStep(expr)) {
            AstNode target = expr.get("subExpression");
            collectWrites(target, reads, writes);
            reads.addAll(CompositeNames.prefixNames(target));
            return;
        }
        if (expr.is(NodeType.ASSIGNMENT)) {
            assignment(expr, reads, writes);
            return;
        }
        collectReads(expr, reads);
    }

    /**
     * Transfer events minting from or burning to {@code address(0)} always read the
     * counterparty and the amount.
     */
    private void emit(AstNode eventCall, Set<String> reads) {
        List<AstNode> args = eventCall.list("arguments");
        for (AstNode arg : args) {
            if (isAddressCast(arg)) continue;
            collectReads(arg, reads);
        }
        if ("Transfer".equals(eventCall.get("expression").name()) && args.size() >= 3) {
            if (isZeroAddress(args.get(0))) {
                collectReads(args.get(1), reads);
                collectReads(args.get(2), reads);
            } else if (isZeroAddress(args.get(1))) {
                collectReads(args.get(0), reads);
                collectReads(args.get(2), reads);
            }
        }
    }

    private void forLoop(AstNode loop, Set<String> reads, Set<String> writes) {
        AstNode init = loop.get("initializationExpression");
        if (init.is(NodeType.VARIABLE_DECLARATION_STATEMENT)) {
            declaration(init, reads, writes);
        } else if (init.isPresent()) {
            expression(init, reads, writes);
        }
        collectReads(loop.get("condition"), reads);
        AstNode step = loop.get("loopExpression");
        if (step.isPresent()) {
            expression(step, reads, writes);
        }
        // i++ and x = x + 1 idioms inside the body
        for (AstNode stmt : loop.get("body").bodyStatements()) {
            if (!stmt.is(NodeType.EXPRESSION_STATEMENT)) continue;
            AstNode expr = stmt.get("expression");
            if (isStep(expr) || expr.is(NodeType.ASSIGNMENT)) {
                expression(stmt, reads, writes);
            }
        }
    }

    /**
     * Records the location written by an assignment target. Index expressions inside the
     * target are reads.
     */
    public static void collectWrites(AstNode target, Set<String> reads, Set<String> writes) {
        switch (target.type()) {
            case IDENTIFIER, MEMBER_ACCESS, INDEX_ACCESS -> {
                writes.addAll(CompositeNames.prefixNames(target));
                collectIndexReads(target, reads);
            }
            case TUPLE_EXPRESSION -> {
                for (AstNode component : target.list("components")) {
                    collectWrites(component, reads, writes);
                }
            }
            default -> { }
        }
    }

    private static void collectIndexReads(AstNode node, Set<String> reads) {
        if (node.is(NodeType.INDEX_ACCESS)) {
            collectIndexReads(node.get("baseExpression"), reads);
            collectReads(node.get("indexExpression"), reads);
        } else if (node.is(NodeType.MEMBER_ACCESS)) {
            collectIndexReads(node.get("expression"), reads);
        }
    }

    /** Every variable an expression reads, at both coarse and composite granularity. */
    public static void collectReads(AstNode node, Set<String> reads) {
        switch (node.type()) {
            case IDENTIFIER -> {
                if (!node.name().isEmpty()) reads.add(node.name());
            }
            case MEMBER_ACCESS -> {
                reads.addAll(CompositeNames.prefixNames(node));
                AstNode base = node.get("expression");
                if (!base.is(NodeType.IDENTIFIER)) collectReads(base, reads);
            }
            case INDEX_ACCESS -> {
                reads.addAll(CompositeNames.prefixNames(node));
                collectReads(node.get("baseExpression"), reads);
                collectReads(node.get("indexExpression"), reads);
            }
            case BINARY_OPERATION -> {
                collectReads(node.get("leftExpression"), reads);
                collectReads(node.get("rightExpression"), reads);
            }
            case UNARY_OPERATION -> collectReads(node.get("subExpression"), reads);
            case FUNCTION_CALL -> {
                for (AstNode arg : node.list("arguments")) collectReads(arg, reads);
                AstNode callee = node.get("expression");
                if (callee.is(NodeType.FUNCTION_CALL_OPTIONS)) {
                    for (AstNode option : callee.list("options")) collectReads(option, reads);
                    callee = callee.get("expression");
                }
                if (callee.is(NodeType.MEMBER_ACCESS)) {
                    collectReads(callee.get("expression"), reads);
                }
            }
            case TUPLE_EXPRESSION -> {
                for (AstNode component : node.list("components")) collectReads(component, reads);
            }
            case CONDITIONAL -> {
                collectReads(node.get("condition"), reads);
                collectReads(node.get("trueExpression"), reads);
                collectReads(node.get("falseExpression"), reads);
            }
            case EXPRESSION -> collectReads(node.get("expression"), reads);
            default -> { }
        }
    }

    static boolean isStep(AstNode expr) {
        if (!expr.is(NodeType.UNARY_OPERATION)) return false;
        String op = expr.string("operator", "");
        return op.equals("++") || op.equals("--");
    }

    static boolean isAddressCast(AstNode node) {
        return node.is(NodeType.FUNCTION_CALL)
                && node.get("expression").is(NodeType.ELEMENTARY_TYPE_NAME_EXPRESSION)
                && "address".equals(castTypeName(node.get("expression")));
    }

    static boolean isZeroAddress(AstNode node) {
        if (!isAddressCast(node)) return false;
        List<AstNode> args = node.list("arguments");
        return args.size() == 1 && args.get(0).is(NodeType.LITERAL)
                && "0".equals(args.get(0).string("value", ""));
    }

    private static String castTypeName(AstNode typeExpr) {
        AstNode typeName = typeExpr.get("typeName");
        return typeName.isPresent() ? typeName.string("name", "") : typeExpr.string("typeName", "");
    }
}
