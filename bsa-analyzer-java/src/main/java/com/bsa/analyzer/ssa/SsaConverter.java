package com.bsa.analyzer.ssa;

import com.bsa.analyzer.access.AccessSet;
import com.bsa.analyzer.access.CompositeNames;
import com.bsa.analyzer.ast.AstNode;
import com.bsa.analyzer.ast.ExpressionText;
import com.bsa.analyzer.ast.NodeType;
import com.bsa.analyzer.calls.CallClassifier;
import com.bsa.analyzer.calls.CallType;
import com.bsa.analyzer.calls.InternalCallInliner;
import com.bsa.analyzer.cfg.BasicBlock;
import com.bsa.analyzer.cfg.StatementClassifier;
import com.bsa.analyzer.cfg.StatementKind;
import com.bsa.analyzer.cfg.TypedStatement;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Versioning pass: walks blocks in creation order, gives every write a fresh version and
 * lowers each statement to {@link Instruction}s that reference the versions current at that
 * point. Phis placed by {@link PhiInserter#place} get their version on entry to their block,
 * before the block's own writes.
 *
 * <p>When built with an {@link InternalCallInliner}, every internal call is followed by the
 * callee's body, versioned against the caller's state at the call.
 */
public class SsaConverter {

    /** Phi destinations per block, and the blocks that received inlined code. */
    public record Conversion(Map<String, Map<String, Integer>> phis, Set<String> grown) {}

    private final CallClassifier classifier;
    private final InternalCallInliner inliner;

    public SsaConverter(CallClassifier classifier) {
        this(classifier, null);
    }

    public SsaConverter(CallClassifier classifier, InternalCallInliner inliner) {
        this.classifier = classifier;
        this.inliner = inliner;
    }

    public Conversion convert(List<BasicBlock> blocks, Map<String, Set<String>> placement, SsaBuildContext ctx) {
        for (BasicBlock block : blocks) {
            AccessSet accesses = block.getAccesses();
            accesses.reads().forEach(ctx::seed);
            accesses.writes().forEach(ctx::seed);
        }
        Map<String, Map<String, Integer>> phis = new LinkedHashMap<>();
        Set<String> grown = new LinkedHashSet<>();
        for (BasicBlock block : blocks) {
            Map<String, Integer> dests = new TreeMap<>();
            for (String var : placement.getOrDefault(block.getId(), Set.of())) {
                dests.put(var, ctx.nextVersion(var));
            }
            if (!dests.isEmpty()) phis.put(block.getId(), dests);
            if (convertBlock(block, dests, ctx)) grown.add(block.getId());
        }
        return new Conversion(phis, grown);
    }

    /** Returns whether inlined code was added to the block. */
    private boolean convertBlock(BasicBlock block, Map<String, Integer> phiDests, SsaBuildContext ctx) {
        AccessSet accesses = block.getAccesses();
        Map<String, Integer> reads = block.getReadVersions();
        Map<String, Integer> writes = block.getWriteVersions();
        reads.clear();
        writes.clear();
        for (String r : accesses.reads()) {
            reads.put(r, ctx.latest(r));
        }

        Set<String> written = new HashSet<>();
        List<Instruction> instructions = new ArrayList<>();
        List<Instruction> inlined = new ArrayList<>();
        for (TypedStatement stmt : flatten(block.getStatements())) {
            List<Instruction> lowered = new ArrayList<>();
            lower(stmt, ctx, written, lowered);
            for (Instruction i : lowered) {
                instructions.add(i);
                if (inliner == null) continue;
                List<Instruction> body = inliner.expand(i, ctx);
                instructions.addAll(body);
                inlined.addAll(body);
            }
        }
        // writes the instructions do not name, e.g. inside an unexpanded nested loop
        for (String w : accesses.writes()) {
            if (!written.contains(w)) ctx.nextVersion(w);
            writes.put(w, ctx.latest(w));
        }
        if (block.contains(StatementKind.IF_STATEMENT)) {
            for (String r : accesses.reads()) {
                if (writes.containsKey(r)) reads.put(r, writes.get(r));
            }
        }
        for (Map.Entry<String, Integer> phi : phiDests.entrySet()) {
            reads.put(phi.getKey(), phi.getValue());
            writes.putIfAbsent(phi.getKey(), phi.getValue());
        }
        block.setInstructions(instructions);
        if (inlined.isEmpty()) return false;

        block.setAccesses(accesses.union(InstructionAccesses.of(inlined)));
        recordVersions(block, inlined);
        return true;
    }

    /** Nested blocks are lowered statement by statement, so inlined code lands in order. */
    private static List<TypedStatement> flatten(List<TypedStatement> statements) {
        List<TypedStatement> out = new ArrayList<>();
        for (TypedStatement stmt : statements) {
            if (stmt.kind() == StatementKind.BLOCK) {
                out.addAll(flatten(StatementClassifier.classify(stmt.node().list("statements"))));
            } else {
                out.add(stmt);
            }
        }
        return out;
    }

    private static void recordVersions(BasicBlock block, List<Instruction> inlined) {
        for (Instruction i : inlined) {
            for (VersionedVar v : i.readVars()) {
                if (!SsaBuildContext.RESULT_SLOT.equals(v.name())) {
                    block.getReadVersions().putIfAbsent(v.name(), v.version());
                }
            }
            VersionedVar t = i.target();
            if (t != null && !SsaBuildContext.RESULT_SLOT.equals(t.name())) {
                block.getWriteVersions().put(t.name(), t.version());
            }
        }
    }

    private void lower(TypedStatement stmt, SsaBuildContext ctx, Set<String> written, List<Instruction> out) {
        AstNode node = stmt.node();
        switch (stmt.kind()) {
            case ASSIGNMENT -> out.add(assignment(node.get("expression"), ctx, written));
            case FUNCTION_CALL -> out.add(callStatement(node.get("expression"), ctx));
            case VARIABLE_DECLARATION -> {
                Instruction decl = declaration(node, ctx, written);
                if (decl != null) out.add(decl);
            }
            case EMIT_STATEMENT -> out.add(emit(node.get("eventCall"), ctx));
            case IF_STATEMENT -> out.add(Instruction.condition(conditionOperands(node.get("condition"), ctx)));
            case RETURN -> out.add(Instruction.ret(leaves(node.get("expression"), ctx)));
            case EXPRESSION -> {
                Instruction expr = expression(node, ctx, written);
                if (expr != null) out.add(expr);
            }
            case FOR_LOOP, WHILE_LOOP -> out.add(Instruction.condition(conditionOperands(node.get("condition"), ctx)));
            case BLOCK -> { } // flattened before lowering
            case UNKNOWN -> {
                if (node.is(NodeType.REVERT_STATEMENT)) {
                    AstNode error = node.get("errorCall");
                    out.add(Instruction.call(null, CallType.REVERT, "revert", arguments(error, ctx)));
                }
            }
        }
    }

    private Instruction assignment(AstNode assignment, SsaBuildContext ctx, Set<String> written) {
        AstNode lhs = assignment.get("leftHandSide");
        AstNode rhs = assignment.get("rightHandSide");
        String operator = assignment.string("operator", "=");

        if (isCall(rhs)) {
            CallType kind = classifier.classify(rhs);
            List<Operand> args = arguments(rhs, ctx);
            return Instruction.call(write(lhs, ctx, written), kind, CallClassifier.callName(rhs), args);
        }
        List<Operand> operands = valueOperands(rhs, ctx);
        if (operator.equals("=")) {
            return Instruction.assign(write(lhs, ctx, written), operands);
        }
        VersionedVar base = ctx.latestVar(targetName(lhs));
        VersionedVar target = write(lhs, ctx, written);
        return Instruction.compound(target, operator.substring(0, operator.length() - 1), base, operands);
    }

    private Instruction callStatement(AstNode call, SsaBuildContext ctx) {
        if (CallClassifier.isTypeConversion(call)) {
            return Instruction.expression(leaves(call, ctx));
        }
        CallType kind = classifier.classify(call);
        List<Operand> args = arguments(call, ctx);
        VersionedVar slot = kind == CallType.REVERT ? null : ctx.nextResultSlot();
        return Instruction.call(slot, kind, CallClassifier.callName(call), args);
    }

    private Instruction declaration(AstNode node, SsaBuildContext ctx, Set<String> written) {
        List<String> names = new ArrayList<>();
        for (AstNode decl : node.list("declarations")) {
            if (!decl.name().isEmpty()) names.add(decl.name());
        }
        AstNode init = node.get("initialValue");
        if (isCall(init)) {
            CallType kind = classifier.classify(init);
            List<Operand> args = arguments(init, ctx);
            VersionedVar target = names.isEmpty() ? ctx.nextResultSlot() : writeAll(names, ctx, written);
            return Instruction.call(target, kind, CallClassifier.callName(init), args);
        }
        if (names.isEmpty()) return null;
        List<Operand> operands = init.isPresent() ? valueOperands(init, ctx) : List.of(Operand.literal("default"));
        return Instruction.declare(writeAll(names, ctx, written), operands);
    }

    private Instruction emit(AstNode eventCall, SsaBuildContext ctx) {
        return Instruction.emit(ExpressionText.of(eventCall.get("expression")), arguments(eventCall, ctx));
    }

    private Instruction expression(AstNode node, SsaBuildContext ctx, Set<String> written) {
        AstNode expr = node.get("expression");
        if (node.is(NodeType.EXPRESSION)) {
            return Instruction.condition(conditionOperands(expr, ctx));
        }
        if (expr.is(NodeType.UNARY_OPERATION)) {
            String op = expr.string("operator", "");
            if (op.equals("++") || op.equals("--")) {
                AstNode target = expr.get("subExpression");
                VersionedVar base = ctx.latestVar(targetName(target));
                VersionedVar result = write(target, ctx, written);
                return Instruction.compound(result, op.substring(1), base, List.of(Operand.literal("1")));
            }
        }
        if (expr.is(NodeType.ASSIGNMENT)) {
            return assignment(expr, ctx, written);
        }
        List<Operand> operands = leaves(expr, ctx);
        return operands.isEmpty() ? null : Instruction.expression(operands);
    }

    /** Bumps every name the target is known by and returns the most precise one. */
    private VersionedVar write(AstNode target, SsaBuildContext ctx, Set<String> written) {
        if (target.is(NodeType.TUPLE_EXPRESSION)) {
            VersionedVar first = null;
            for (AstNode component : target.list("components")) {
                if (!component.isPresent()) continue;
                VersionedVar v = write(component, ctx, written);
                if (first == null) first = v;
            }
            if (first != null) return first;
        }
        List<String> names = CompositeNames.prefixNames(target);
        if (names.isEmpty()) {
            names = List.of(ExpressionText.of(target));
        }
        for (String name : names) {
            ctx.nextVersion(name);
            written.add(name);
        }
        String precise = names.get(names.size() - 1);
        return ctx.latestVar(precise);
    }

    private VersionedVar writeAll(List<String> names, SsaBuildContext ctx, Set<String> written) {
        for (String name : names) {
            ctx.nextVersion(name);
            written.add(name);
        }
        return ctx.latestVar(names.get(0));
    }

    private static String targetName(AstNode target) {
        String precise = CompositeNames.preciseName(target);
        return precise != null ? precise : ExpressionText.of(target);
    }

    private static boolean isCall(AstNode node) {
        return node.is(NodeType.FUNCTION_CALL) && !CallClassifier.isTypeConversion(node);
    }

    private static boolean isLiteralCast(AstNode node) {
        if (!node.is(NodeType.FUNCTION_CALL) || !CallClassifier.isTypeConversion(node)) return false;
        List<AstNode> args = node.list("arguments");
        return args.size() == 1 && args.get(0).is(NodeType.LITERAL);
    }

    /** Right-hand side operands: a literal verbatim, otherwise the variables read. */
    List<Operand> valueOperands(AstNode rhs, SsaBuildContext ctx) {
        if (rhs.is(NodeType.LITERAL)) return List.of(Operand.literal(ExpressionText.literal(rhs)));
        if (isLiteralCast(rhs)) return List.of(Operand.literal(ExpressionText.of(rhs)));
        List<Operand> operands = leaves(rhs, ctx);
        return operands.isEmpty() ? List.of(Operand.literal(ExpressionText.of(rhs))) : operands;
    }

    /** One operand per call argument, so parameters can be bound positionally. */
    List<Operand> arguments(AstNode call, SsaBuildContext ctx) {
        List<Operand> args = new ArrayList<>();
        for (AstNode arg : call.list("arguments")) {
            args.add(argument(arg, ctx));
        }
        return args;
    }

    private Operand argument(AstNode arg, SsaBuildContext ctx) {
        String precise = CompositeNames.preciseName(arg);
        if (precise != null) return Operand.var(ctx.latestVar(precise));
        if (arg.is(NodeType.LITERAL)) return Operand.literal(ExpressionText.literal(arg));
        if (isLiteralCast(arg)) return Operand.literal(ExpressionText.of(arg));
        List<Operand> parts = leaves(arg, ctx);
        if (parts.isEmpty()) return Operand.literal(ExpressionText.of(arg));
        return parts.size() == 1 ? parts.get(0) : Operand.expr(parts);
    }

    private List<Operand> conditionOperands(AstNode condition, SsaBuildContext ctx) {
        if (condition.is(NodeType.BINARY_OPERATION)) {
            String left = CompositeNames.preciseName(condition.get("leftExpression"));
            if (left != null) return List.of(Operand.var(ctx.latestVar(left)));
        }
        List<Operand> operands = leaves(condition, ctx);
        return operands.isEmpty() ? List.of(Operand.literal(ExpressionText.of(condition))) : operands;
    }

    /** Variables read by an expression, most precise name per location, deduplicated in source order. */
    List<Operand> leaves(AstNode expr, SsaBuildContext ctx) {
        Set<String> names = new LinkedHashSet<>();
        collectLeaves(expr, names);
        List<Operand> out = new ArrayList<>(names.size());
        for (String name : names) {
            out.add(Operand.var(ctx.latestVar(name)));
        }
        return out;
    }

    private static void collectLeaves(AstNode node, Set<String> names) {
        switch (node.type()) {
            case IDENTIFIER -> {
                if (!node.name().isEmpty()) names.add(node.name());
            }
            case MEMBER_ACCESS -> {
                String precise = CompositeNames.preciseName(node);
                if (precise != null) names.add(precise);
                else collectLeaves(node.get("expression"), names);
            }
            case INDEX_ACCESS -> {
                String precise = CompositeNames.preciseName(node);
                if (precise != null) {
                    names.add(precise);
                } else {
                    collectLeaves(node.get("baseExpression"), names);
                    collectLeaves(node.get("indexExpression"), names);
                }
            }
            case BINARY_OPERATION -> {
                collectLeaves(node.get("leftExpression"), names);
                collectLeaves(node.get("rightExpression"), names);
            }
            case UNARY_OPERATION -> collectLeaves(node.get("subExpression"), names);
            case FUNCTION_CALL -> {
                for (AstNode arg : node.list("arguments")) collectLeaves(arg, names);
            }
            case FUNCTION_CALL_OPTIONS -> {
                collectLeaves(node.get("expression"), names);
                for (AstNode option : node.list("options")) collectLeaves(option, names);
            }
            case TUPLE_EXPRESSION -> {
                for (AstNode component : node.list("components")) collectLeaves(component, names);
            }
            case CONDITIONAL -> {
                collectLeaves(node.get("condition"), names);
                collectLeaves(node.get("trueExpression"), names);
                collectLeaves(node.get("falseExpression"), names);
            }
            case EXPRESSION -> collectLeaves(node.get("expression"), names);
            default -> { }
        }
    }
}
