package com.bsa.analyzer.calls;

import com.bsa.analyzer.access.CompositeNames;
import com.bsa.analyzer.ssa.Instruction;
import com.bsa.analyzer.ssa.Operand;
import com.bsa.analyzer.ssa.SsaBuildContext;
import com.bsa.analyzer.ssa.VersionedVar;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands internal calls into the callee's body while the caller is being versioned.
 *
 * <p>Parameters are bound positionally to the call's arguments. Other reads see the caller's
 * versions at the call site, and every write inside the callee gets a fresh version from the
 * caller's context, so the caller's later statements read it. Calls inside the callee are
 * expanded in turn unless the callee is already being expanded.
 */
public class InternalCallInliner {

    private final Map<String, InlineTemplate> templates;

    public InternalCallInliner(Map<String, InlineTemplate> templates) {
        this.templates = Map.copyOf(templates);
    }

    /** The instructions to place right after {@code call}; empty unless it is an internal call. */
    public List<Instruction> expand(Instruction call, SsaBuildContext ctx) {
        List<Instruction> out = new ArrayList<>();
        expand(call, ctx, new ArrayDeque<>(), out);
        return out;
    }

    private void expand(Instruction call, SsaBuildContext ctx, Deque<String> stack, List<Instruction> out) {
        if (!call.isInternalCall()) return;
        InlineTemplate template = templates.get(call.callee());
        if (template == null || stack.contains(template.name())) return;

        stack.push(template.name());
        Map<String, Operand> bound = new HashMap<>();
        List<Operand> args = call.operands();
        for (int p = 0; p < template.parameters().size() && p < args.size(); p++) {
            bound.put(template.parameters().get(p), args.get(p));
        }
        Map<String, VersionedVar> renamed = new HashMap<>();

        for (Instruction original : template.body()) {
            Instruction ins = original
                    .substitute(v -> resolve(v, bound, renamed, ctx), v -> resolveVar(v, bound, renamed, ctx))
                    .withoutRepeatedOperands();
            if (ins.target() != null) {
                ins = ins.withTarget(fresh(ins.target(), bound, renamed, ctx));
            }
            out.add(ins);
            expand(ins, ctx, stack, out);
        }
        stack.pop();
    }

    private Operand resolve(VersionedVar v, Map<String, Operand> bound,
                            Map<String, VersionedVar> renamed, SsaBuildContext ctx) {
        VersionedVar local = renamed.get(v.name());
        if (local != null) return Operand.var(local);
        Operand arg = bound.get(v.name());
        if (arg != null) return arg;
        String name = rebase(v.name(), bound);
        local = renamed.get(name);
        return Operand.var(local != null ? local : ctx.latestVar(name));
    }

    private VersionedVar resolveVar(VersionedVar v, Map<String, Operand> bound,
                                    Map<String, VersionedVar> renamed, SsaBuildContext ctx) {
        Operand op = resolve(v, bound, renamed, ctx);
        return op.isVar() ? op.var() : ctx.latestVar(rebase(v.name(), bound));
    }

    private VersionedVar fresh(VersionedVar target, Map<String, Operand> bound,
                               Map<String, VersionedVar> renamed, SsaBuildContext ctx) {
        if (SsaBuildContext.RESULT_SLOT.equals(target.name())) {
            return ctx.nextResultSlot();
        }
        // a write to a parameter shadows it locally instead of touching the caller's argument
        String name = bound.containsKey(target.name()) ? target.name() : rebase(target.name(), bound);
        String root = CompositeNames.rootOf(name);
        if (!root.equals(name)) {
            renamed.put(root, new VersionedVar(root, ctx.nextVersion(root)));
        }
        VersionedVar v = new VersionedVar(name, ctx.nextVersion(name));
        renamed.put(target.name(), v);
        renamed.put(name, v);
        return v;
    }

    /**
     * Rewrites parameter names used as an index or as the root of a composite name:
     * {@code balanceOf[to]} with {@code to} bound to {@code msg.sender_0} becomes
     * {@code balanceOf[msg.sender]}.
     */
    static String rebase(String name, Map<String, Operand> bound) {
        String out = name;
        for (Map.Entry<String, Operand> e : bound.entrySet()) {
            if (!e.getValue().isVar()) continue;
            String param = e.getKey();
            String arg = e.getValue().var().name();
            out = out.replace("[" + param + "]", "[" + arg + "]");
            if (!out.equals(param) && CompositeNames.rootOf(out).equals(param)) {
                out = arg + out.substring(param.length());
            }
        }
        return out;
    }
}
