package com.bsa.analyzer.cfg;

import com.bsa.analyzer.ast.AstNode;
import com.bsa.analyzer.ast.ExpressionText;

import java.util.List;

/**
 * How control leaves a basic block.
 */
public record Terminator(Kind kind, String target, AstNode condition, String thenTarget, String elseTarget) {

    public enum Kind { GOTO, BRANCH, RETURN, REVERT, PENDING }

    public static final Terminator RETURN = new Terminator(Kind.RETURN, null, null, null, null);
    public static final Terminator REVERT = new Terminator(Kind.REVERT, null, null, null, null);
    public static final Terminator PENDING = new Terminator(Kind.PENDING, null, null, null, null);

    public static Terminator goTo(String target) {
        return new Terminator(Kind.GOTO, target, null, null, null);
    }

    public static Terminator branch(AstNode condition, String thenTarget, String elseTarget) {
        return new Terminator(Kind.BRANCH, null, condition, thenTarget, elseTarget);
    }

    public boolean isPending() { return kind == Kind.PENDING; }

    public List<String> successors() {
        return switch (kind) {
            case GOTO -> List.of(target);
            case BRANCH -> List.of(thenTarget, elseTarget);
            default -> List.of();
        };
    }

    public String render() {
        return switch (kind) {
            case GOTO -> "goto " + target;
            case BRANCH -> "if " + conditionText() + " then goto " + thenTarget
                    + " else goto " + elseTarget;
            case RETURN -> "return";
            case REVERT -> "revert";
            case PENDING -> "pending";
        };
    }

    private String conditionText() {
        return condition != null && condition.isPresent() ? ExpressionText.of(condition) : "true";
    }

    @Override
    public String toString() { return render(); }
}
