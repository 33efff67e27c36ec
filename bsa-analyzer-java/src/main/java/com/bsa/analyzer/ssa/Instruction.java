package com.bsa.analyzer.ssa;

import com.bsa.analyzer.calls.CallType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * One SSA instruction. Immutable; the rewriting passes build modified copies.
 *
 * <p>Text is produced only by {@link #render()}:
 * <pre>
 *   balances[to]_1 = balances[to]_0 + amount_0     compound ASSIGN
 *   ret_1 = call[low_level_external](msg.sender.call, amount_0)
 *   if (amount_0)
 *   emit Withdrawn(msg.sender_0, amount_0)
 *   x_3 = phi(x_1, x_2)
 * </pre>
 */
public final class Instruction {

    private final Opcode opcode;
    private final VersionedVar target;
    private final String operator;
    private final VersionedVar base;
    private final List<Operand> operands;
    private final CallType callKind;
    private final String callee;
    private final List<String> sources;

    private Instruction(Opcode opcode, VersionedVar target, String operator, VersionedVar base,
                        List<Operand> operands, CallType callKind, String callee, List<String> sources) {
        this.opcode = opcode;
        this.target = target;
        this.operator = operator;
        this.base = base;
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        this.callKind = callKind;
        this.callee = callee;
        this.sources = Collections.unmodifiableList(new ArrayList<>(sources));
    }

    public static Instruction assign(VersionedVar target, List<Operand> operands) {
        return new Instruction(Opcode.ASSIGN, target, null, null, operands, null, null, List.of());
    }

    /** {@code target = base op operands}, as produced by {@code +=} or {@code x++}. */
    public static Instruction compound(VersionedVar target, String operator, VersionedVar base, List<Operand> operands) {
        return new Instruction(Opcode.ASSIGN, target, operator, base, operands, null, null, List.of());
    }

    public static Instruction declare(VersionedVar target, List<Operand> operands) {
        return new Instruction(Opcode.DECLARE, target, null, null, operands, null, null, List.of());
    }

    /** @param target result slot, or null for calls whose value is discarded */
    public static Instruction call(VersionedVar target, CallType kind, String callee, List<Operand> args) {
        return new Instruction(Opcode.CALL, target, null, null, args, kind, callee, List.of());
    }

    public static Instruction condition(List<Operand> operands) {
        return new Instruction(Opcode.CONDITION, null, null, null, operands, null, null, List.of());
    }

    public static Instruction ret(List<Operand> operands) {
        return new Instruction(Opcode.RETURN, null, null, null, operands, null, null, List.of());
    }

    public static Instruction emit(String event, List<Operand> args) {
        return new Instruction(Opcode.EMIT, null, null, null, args, null, event, List.of());
    }

    public static Instruction expression(List<Operand> operands) {
        return new Instruction(Opcode.EXPRESSION, null, null, null, operands, null, null, List.of());
    }

    /**
     * @param sourceBlocks predecessor block ids, parallel to {@code args}
     */
    public static Instruction phi(VersionedVar target, List<VersionedVar> args, List<String> sourceBlocks) {
        List<Operand> operands = new ArrayList<>(args.size());
        for (VersionedVar v : args) operands.add(Operand.var(v));
        return new Instruction(Opcode.PHI, target, null, null, operands, null, null, sourceBlocks);
    }

    public Opcode opcode() { return opcode; }
    public VersionedVar target() { return target; }
    public String operator() { return operator; }
    public VersionedVar base() { return base; }
    public List<Operand> operands() { return operands; }
    public CallType callKind() { return callKind; }

    /** Callee text for calls, event name for emits. */
    public String callee() { return callee; }

    public List<String> sources() { return sources; }

    public boolean isPhi() { return opcode == Opcode.PHI; }

    public boolean isCall() { return opcode == Opcode.CALL; }

    public boolean isExternalCall() { return isCall() && callKind.isExternalFamily(); }

    public boolean isInternalCall() { return isCall() && callKind == CallType.INTERNAL; }

    /** Every variable this instruction reads, the compound base first. */
    public List<VersionedVar> readVars() {
        List<VersionedVar> out = new ArrayList<>();
        if (base != null) out.add(base);
        for (Operand op : operands) out.addAll(op.vars());
        return out;
    }

    /** Rewrites read positions only; the target is untouched. */
    public Instruction mapReads(UnaryOperator<VersionedVar> fn) {
        List<Operand> mapped = new ArrayList<>(operands.size());
        for (Operand op : operands) mapped.add(op.mapVars(fn));
        return new Instruction(opcode, target, operator, base == null ? null : fn.apply(base),
                mapped, callKind, callee, sources);
    }

    /**
     * Replaces operand variables through {@code operandFn} and the compound base through
     * {@code baseFn}. The target is untouched.
     */
    public Instruction substitute(Function<VersionedVar, Operand> operandFn, UnaryOperator<VersionedVar> baseFn) {
        List<Operand> mapped = new ArrayList<>(operands.size());
        for (Operand op : operands) mapped.add(op.substitute(operandFn));
        return new Instruction(opcode, target, operator, base == null ? null : baseFn.apply(base),
                mapped, callKind, callee, sources);
    }

    /**
     * Drops operands that repeat an earlier operand. Calls, emits and phis keep
     * their positional operands.
     */
    public Instruction withoutRepeatedOperands() {
        if (opcode == Opcode.CALL || opcode == Opcode.EMIT || opcode == Opcode.PHI) return this;
        Set<String> seen = new LinkedHashSet<>();
        List<Operand> kept = new ArrayList<>(operands.size());
        for (Operand op : operands) {
            if (seen.add(op.render())) kept.add(op);
        }
        return kept.size() == operands.size() ? this : withOperands(kept);
    }

    public Instruction withTarget(VersionedVar newTarget) {
        return new Instruction(opcode, newTarget, operator, base, operands, callKind, callee, sources);
    }

    public Instruction withOperands(List<Operand> newOperands) {
        return new Instruction(opcode, target, operator, base, newOperands, callKind, callee, sources);
    }

    public String render() {
        return switch (opcode) {
            case ASSIGN, DECLARE -> {
                StringBuilder sb = new StringBuilder(target.render()).append(" = ");
                if (base != null) {
                    sb.append(base.render()).append(' ').append(operator);
                    if (!operands.isEmpty()) sb.append(' ');
                }
                yield sb.append(join(" ")).toString();
            }
            case CALL -> {
                String args = operands.isEmpty() ? "" : ", " + join(", ");
                String call = "call[" + callKind.tag() + "](" + callee + args + ")";
                yield target == null ? call : target.render() + " = " + call;
            }
            case CONDITION -> "if (" + join(" ") + ")";
            case RETURN -> operands.isEmpty() ? "return" : "return " + join(" ");
            case EMIT -> "emit " + callee + "(" + join(", ") + ")";
            case PHI -> target.render() + " = phi(" + join(", ") + ")";
            case EXPRESSION -> join(" ");
        };
    }

    private String join(String separator) {
        List<String> parts = new ArrayList<>(operands.size());
        for (Operand op : operands) parts.add(op.render());
        return String.join(separator, parts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instruction)) return false;
        Instruction other = (Instruction) o;
        return opcode == other.opcode && Objects.equals(target, other.target)
                && Objects.equals(operator, other.operator) && Objects.equals(base, other.base)
                && operands.equals(other.operands) && callKind == other.callKind
                && Objects.equals(callee, other.callee) && sources.equals(other.sources);
    }

    @Override
    public int hashCode() {
        return Objects.hash(opcode, target, operator, base, operands, callKind, callee, sources);
    }

    @Override
    public String toString() { return render(); }
}
