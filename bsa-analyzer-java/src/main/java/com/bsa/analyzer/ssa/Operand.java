package com.bsa.analyzer.ssa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * One operand of an {@link Instruction}: a versioned variable, literal text, or a group of
 * operands standing for a compound expression (rendered space-separated).
 */
public final class Operand {

    public enum Kind { VAR, LITERAL, EXPR }

    private final Kind kind;
    private final VersionedVar var;
    private final String text;
    private final List<Operand> parts;

    private Operand(Kind kind, VersionedVar var, String text, List<Operand> parts) {
        this.kind = kind;
        this.var = var;
        this.text = text;
        this.parts = parts;
    }

    public static Operand var(VersionedVar var) {
        return new Operand(Kind.VAR, var, null, List.of());
    }

    public static Operand literal(String text) {
        return new Operand(Kind.LITERAL, null, text, List.of());
    }

    public static Operand expr(List<Operand> parts) {
        return new Operand(Kind.EXPR, null, null, Collections.unmodifiableList(new ArrayList<>(parts)));
    }

    public Kind kind() { return kind; }

    /** The variable of a VAR operand, null otherwise. */
    public VersionedVar var() { return var; }

    public boolean isVar() { return kind == Kind.VAR; }

    /** Every variable this operand reads, in order. */
    public List<VersionedVar> vars() {
        return switch (kind) {
            case VAR -> List.of(var);
            case LITERAL -> List.of();
            case EXPR -> {
                List<VersionedVar> out = new ArrayList<>();
                for (Operand p : parts) out.addAll(p.vars());
                yield out;
            }
        };
    }

    public Operand mapVars(UnaryOperator<VersionedVar> fn) {
        return switch (kind) {
            case VAR -> var(fn.apply(var));
            case LITERAL -> this;
            case EXPR -> {
                List<Operand> mapped = new ArrayList<>(parts.size());
                for (Operand p : parts) mapped.add(p.mapVars(fn));
                yield expr(mapped);
            }
        };
    }

    /** Replaces each variable with an arbitrary operand, e.g. a bound call argument. */
    public Operand substitute(Function<VersionedVar, Operand> fn) {
        return switch (kind) {
            case VAR -> fn.apply(var);
            case LITERAL -> this;
            case EXPR -> {
                List<Operand> mapped = new ArrayList<>(parts.size());
                for (Operand p : parts) mapped.add(p.substitute(fn));
                yield expr(mapped);
            }
        };
    }

    public String render() {
        return switch (kind) {
            case VAR -> var.render();
            case LITERAL -> text;
            case EXPR -> {
                List<String> rendered = new ArrayList<>(parts.size());
                for (Operand p : parts) rendered.add(p.render());
                yield String.join(" ", rendered);
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Operand)) return false;
        Operand other = (Operand) o;
        return kind == other.kind && Objects.equals(var, other.var)
                && Objects.equals(text, other.text) && parts.equals(other.parts);
    }

    @Override
    public int hashCode() { return Objects.hash(kind, var, text, parts); }

    @Override
    public String toString() { return render(); }
}
