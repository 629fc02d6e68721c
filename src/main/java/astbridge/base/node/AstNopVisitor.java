package astbridge.base.node;

import astbridge.base.symbol.VarInfo;
import astbridge.base.type.*;

/**
 * Visitor that does nothing for every node kind. Passes that only care about a few kinds extend this
 * and override what they need.
 */
public abstract class AstNopVisitor<R> implements AstVisitor<R> {

    protected R defaultResult(AstNode node) {
        return null;
    }

    @Override
    public R visitBlock(AstBlock stmt) {
        return defaultResult(stmt);
    }

    @Override
    public R visitInstrSequence(AstInstrSequence stmt) {
        return defaultResult(stmt);
    }

    @Override
    public R visitBranch(AstBranch stmt) {
        return defaultResult(stmt);
    }

    @Override
    public R visitLoop(AstLoop stmt) {
        return defaultResult(stmt);
    }

    @Override
    public R visitReturn(AstReturn stmt) {
        return defaultResult(stmt);
    }

    @Override
    public R visitGoto(AstGoto stmt) {
        return defaultResult(stmt);
    }

    @Override
    public R visitSwitch(AstSwitch stmt) {
        return defaultResult(stmt);
    }

    @Override
    public R visitAssign(AstAssign instr) {
        return defaultResult(instr);
    }

    @Override
    public R visitCall(AstCall instr) {
        return defaultResult(instr);
    }

    @Override
    public R visitLval(AstLval lval) {
        return defaultResult(lval);
    }

    @Override
    public R visitVariable(AstVariable var) {
        return defaultResult(var);
    }

    @Override
    public R visitMemRef(AstMemRef memref) {
        return defaultResult(memref);
    }

    @Override
    public R visitNoOffset(AstNoOffset offset) {
        return defaultResult(offset);
    }

    @Override
    public R visitFieldOffset(AstFieldOffset offset) {
        return defaultResult(offset);
    }

    @Override
    public R visitIndexOffset(AstIndexOffset offset) {
        return defaultResult(offset);
    }

    @Override
    public R visitIntegerConstant(AstIntegerConstant expr) {
        return defaultResult(expr);
    }

    @Override
    public R visitStringConstant(AstStringConstant expr) {
        return defaultResult(expr);
    }

    @Override
    public R visitLvalExpr(AstLvalExpr expr) {
        return defaultResult(expr);
    }

    @Override
    public R visitCastExpr(AstCastExpr expr) {
        return defaultResult(expr);
    }

    @Override
    public R visitUnaryOp(AstUnaryOp expr) {
        return defaultResult(expr);
    }

    @Override
    public R visitBinaryOp(AstBinaryOp expr) {
        return defaultResult(expr);
    }

    @Override
    public R visitQuestion(AstQuestion expr) {
        return defaultResult(expr);
    }

    @Override
    public R visitAddressOf(AstAddressOf expr) {
        return defaultResult(expr);
    }

    @Override
    public R visitSizeOf(AstSizeOf expr) {
        return defaultResult(expr);
    }

    @Override
    public R visitSubstitutedExpr(AstSubstitutedExpr expr) {
        return defaultResult(expr);
    }

    @Override
    public R visitVoidType(TypVoid typ) {
        return defaultResult(typ);
    }

    @Override
    public R visitIntType(TypInt typ) {
        return defaultResult(typ);
    }

    @Override
    public R visitFloatType(TypFloat typ) {
        return defaultResult(typ);
    }

    @Override
    public R visitPointerType(TypPtr typ) {
        return defaultResult(typ);
    }

    @Override
    public R visitArrayType(TypArray typ) {
        return defaultResult(typ);
    }

    @Override
    public R visitFunctionType(TypFun typ) {
        return defaultResult(typ);
    }

    @Override
    public R visitFunArg(FunArg funarg) {
        return defaultResult(funarg);
    }

    @Override
    public R visitCompType(TypComp typ) {
        return defaultResult(typ);
    }

    @Override
    public R visitEnumType(TypEnum typ) {
        return defaultResult(typ);
    }

    @Override
    public R visitNamedType(TypNamed typ) {
        return defaultResult(typ);
    }

    @Override
    public R visitVarInfo(VarInfo vinfo) {
        return defaultResult(vinfo);
    }

    @Override
    public R visitCompInfo(CompInfo cinfo) {
        return defaultResult(cinfo);
    }

    @Override
    public R visitFieldInfo(FieldInfo finfo) {
        return defaultResult(finfo);
    }

    @Override
    public R visitEnumInfo(EnumInfo einfo) {
        return defaultResult(einfo);
    }
}
