package com.bsa.analyzer.cfg;

import com.bsa.analyzer.ast.AstNode;
import com.bsa.analyzer.ast.NodeType;
import com.bsa.analyzer.ssa.SsaBuildContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands the first {@code if}, {@code for} or {@code while} of each block into explicit
 * branch / loop blocks. Blocks without such a statement pass through unchanged.
 *
 * <p>New block ids continue the function's running counter. Nested constructs inside the
 * generated branch and body blocks are not expanded again.
 */
public class ControlFlowRefiner {

    public List<BasicBlock> refine(List<BasicBlock> blocks, SsaBuildContext ctx) {
        List<BasicBlock> refined = new ArrayList<>();
        for (int i = 0; i < blocks.size(); i++) {
            BasicBlock block = blocks.get(i);
            String next = i + 1 < blocks.size() ? blocks.get(i + 1).getId() : null;

            int at = indexOf(block, StatementKind.IF_STATEMENT);
            if (at >= 0) {
                refineIf(block, at, next, ctx, refined);
                continue;
            }
            at = indexOf(block, StatementKind.FOR_LOOP);
            if (at >= 0) {
                refineFor(block, at, next, ctx, refined);
                continue;
            }
            at = indexOf(block, StatementKind.WHILE_LOOP);
            if (at >= 0) {
                refineWhile(block, at, next, ctx, refined);
                continue;
            }
            refined.add(block);
        }
        return refined;
    }

    private void refineIf(BasicBlock block, int at, String next, SsaBuildContext ctx, List<BasicBlock> out) {
        TypedStatement ifStmt = block.getStatements().get(at);
        AstNode node = ifStmt.node();

        List<TypedStatement> condStatements = new ArrayList<>(block.getStatements().subList(0, at));
        condStatements.add(ifStmt);
        BasicBlock cond = new BasicBlock(block.getId(), condStatements);

        BasicBlock whenTrue = new BasicBlock(ctx.nextBlockId(),
                StatementClassifier.classify(node.get("trueBody").bodyStatements()));
        whenTrue.setBranchSide(BranchSide.TRUE);
        BasicBlock whenFalse = new BasicBlock(ctx.nextBlockId(),
                StatementClassifier.classify(node.get("falseBody").bodyStatements()));
        whenFalse.setBranchSide(BranchSide.FALSE);

        cond.setTerminator(Terminator.branch(node.get("condition"), whenTrue.getId(), whenFalse.getId()));
        whenTrue.setTerminator(branchExit(whenTrue, next));
        whenFalse.setTerminator(branchExit(whenFalse, next));

        out.add(cond);
        out.add(whenTrue);
        out.add(whenFalse);
    }

    private Terminator branchExit(BasicBlock branch, String next) {
        if (Statements.containsRevert(branch.getStatements())) return Terminator.REVERT;
        if (Statements.endsWithReturn(branch.getStatements())) return Terminator.RETURN;
        return next != null ? Terminator.goTo(next) : Terminator.PENDING;
    }

    private void refineFor(BasicBlock block, int at, String next, SsaBuildContext ctx, List<BasicBlock> out) {
        AstNode loop = block.getStatements().get(at).node();
        AstNode init = loop.get("initializationExpression");
        AstNode condition = loop.get("condition");
        AstNode increment = loop.get("loopExpression");

        List<TypedStatement> initStatements = new ArrayList<>(block.getStatements().subList(0, at));
        if (init.isPresent()) {
            initStatements.add(new TypedStatement(StatementClassifier.kindOf(init), init));
        }
        BasicBlock initBlock = new BasicBlock(block.getId(), initStatements);
        initBlock.setRole(LoopRole.INIT);

        BasicBlock header = header(condition, ctx);
        BasicBlock body = new BasicBlock(ctx.nextBlockId(),
                StatementClassifier.classify(loop.get("body").bodyStatements()));
        body.setRole(LoopRole.BODY);
        BasicBlock step = new BasicBlock(ctx.nextBlockId(), increment.isPresent()
                ? List.of(new TypedStatement(StatementClassifier.kindOf(increment), increment))
                : List.of());
        step.setRole(LoopRole.INCREMENT);
        BasicBlock exit = exit(next, ctx);

        initBlock.setTerminator(Terminator.goTo(header.getId()));
        header.setTerminator(Terminator.branch(condition, body.getId(), exit.getId()));
        body.setTerminator(Terminator.goTo(step.getId()));
        step.setTerminator(Terminator.goTo(header.getId()));

        out.add(initBlock);
        out.add(header);
        out.add(body);
        out.add(step);
        out.add(exit);
    }

    private void refineWhile(BasicBlock block, int at, String next, SsaBuildContext ctx, List<BasicBlock> out) {
        AstNode loop = block.getStatements().get(at).node();
        AstNode condition = loop.get("condition");

        BasicBlock pre = new BasicBlock(block.getId(), block.getStatements().subList(0, at));
        pre.setRole(LoopRole.INIT);
        BasicBlock header = header(condition, ctx);
        BasicBlock body = new BasicBlock(ctx.nextBlockId(),
                StatementClassifier.classify(loop.get("body").bodyStatements()));
        body.setRole(LoopRole.BODY);
        BasicBlock exit = exit(next, ctx);

        pre.setTerminator(Terminator.goTo(header.getId()));
        header.setTerminator(Terminator.branch(condition, body.getId(), exit.getId()));
        body.setTerminator(Terminator.goTo(header.getId()));

        out.add(pre);
        out.add(header);
        out.add(body);
        out.add(exit);
    }

    private BasicBlock header(AstNode condition, SsaBuildContext ctx) {
        List<TypedStatement> statements = condition.isPresent()
                ? List.of(new TypedStatement(StatementKind.EXPRESSION,
                        AstNode.synthetic(NodeType.EXPRESSION, "expression", condition)))
                : List.of();
        BasicBlock header = new BasicBlock(ctx.nextBlockId(), statements);
        header.setRole(LoopRole.HEADER);
        return header;
    }

    private BasicBlock exit(String next, SsaBuildContext ctx) {
        BasicBlock exit = new BasicBlock(ctx.nextBlockId(), List.of());
        exit.setRole(LoopRole.EXIT);
        exit.setTerminator(next != null ? Terminator.goTo(next) : Terminator.PENDING);
        return exit;
    }

    private static int indexOf(BasicBlock block, StatementKind kind) {
        List<TypedStatement> statements = block.getStatements();
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i).kind() == kind) return i;
        }
        return -1;
    }
}
