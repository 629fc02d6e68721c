package astbridge.base.node;

/**
 * Walks statements, instructions, lvalues and expressions in source order.
 * Subclasses override the visits they care about and call super to keep descending.
 * Types and symbol records are not entered.
 */
public abstract class AstDescendVisitor extends AstNopVisitor<Void> {

    @Override
    public Void visitBlock(AstBlock stmt) {
        stmt.getStmts().forEach(s -> s.accept(this));
        return null;
    }

    @Override
    public Void visitInstrSequence(AstInstrSequence stmt) {
        stmt.getInstructions().forEach(i -> i.accept(this));
        return null;
    }

    @Override
    public Void visitBranch(AstBranch stmt) {
        stmt.getCondition().accept(this);
        stmt.getIfStmt().accept(this);
        stmt.getElseStmt().accept(this);
        return null;
    }

    @Override
    public Void visitLoop(AstLoop stmt) {
        stmt.getBody().accept(this);
        return null;
    }

    @Override
    public Void visitReturn(AstReturn stmt) {
        if (stmt.hasReturnValue()) {
            stmt.getExpr().accept(this);
        }
        return null;
    }

    @Override
    public Void visitSwitch(AstSwitch stmt) {
        stmt.getSwitchExpr().accept(this);
        stmt.getCases().accept(this);
        return null;
    }

    @Override
    public Void visitAssign(AstAssign instr) {
        instr.getLhs().accept(this);
        instr.getRhs().accept(this);
        return null;
    }

    @Override
    public Void visitCall(AstCall instr) {
        if (instr.hasLhs()) {
            instr.getLhs().accept(this);
        }
        instr.getTarget().accept(this);
        instr.getArguments().forEach(a -> a.accept(this));
        return null;
    }

    @Override
    public Void visitLval(AstLval lval) {
        lval.getHost().accept(this);
        lval.getOffset().accept(this);
        return null;
    }

    @Override
    public Void visitMemRef(AstMemRef memref) {
        memref.getMemExp().accept(this);
        return null;
    }

    @Override
    public Void visitFieldOffset(AstFieldOffset offset) {
        offset.getSubOffset().accept(this);
        return null;
    }

    @Override
    public Void visitIndexOffset(AstIndexOffset offset) {
        offset.getIndexExpr().accept(this);
        offset.getSubOffset().accept(this);
        return null;
    }

    @Override
    public Void visitLvalExpr(AstLvalExpr expr) {
        expr.getLval().accept(this);
        return null;
    }

    @Override
    public Void visitCastExpr(AstCastExpr expr) {
        expr.getExpr().accept(this);
        return null;
    }

    @Override
    public Void visitUnaryOp(AstUnaryOp expr) {
        expr.getExpr().accept(this);
        return null;
    }

    @Override
    public Void visitBinaryOp(AstBinaryOp expr) {
        expr.getLeft().accept(this);
        expr.getRight().accept(this);
        return null;
    }

    @Override
    public Void visitQuestion(AstQuestion expr) {
        expr.getCondition().accept(this);
        expr.getTrueExpr().accept(this);
        expr.getFalseExpr().accept(this);
        return null;
    }

    @Override
    public Void visitAddressOf(AstAddressOf expr) {
        expr.getLval().accept(this);
        return null;
    }

    @Override
    public Void visitSubstitutedExpr(AstSubstitutedExpr expr) {
        expr.getSuperLval().accept(this);
        expr.getSubstitute().accept(this);
        return null;
    }
}
