package astbridge.base.node;

import astbridge.base.symbol.VarInfo;
import astbridge.base.type.CompInfo;
import astbridge.base.type.EnumInfo;
import astbridge.base.type.FieldInfo;
import astbridge.base.type.FunArg;
import astbridge.base.type.TypArray;
import astbridge.base.type.TypComp;
import astbridge.base.type.TypEnum;
import astbridge.base.type.TypFloat;
import astbridge.base.type.TypFun;
import astbridge.base.type.TypInt;
import astbridge.base.type.TypNamed;
import astbridge.base.type.TypPtr;
import astbridge.base.type.TypVoid;

/**
 * One method per concrete node kind in {@link NodeTag}.
 * @param <R> the result of visiting a node
 */
public interface AstVisitor<R> {

    R visitBlock(AstBlock stmt);

    R visitInstrSequence(AstInstrSequence stmt);

    R visitBranch(AstBranch stmt);

    R visitLoop(AstLoop stmt);

    R visitReturn(AstReturn stmt);

    R visitGoto(AstGoto stmt);

    R visitSwitch(AstSwitch stmt);

    R visitAssign(AstAssign instr);

    R visitCall(AstCall instr);

    R visitLval(AstLval lval);

    R visitVariable(AstVariable var);

    R visitMemRef(AstMemRef memref);

    R visitNoOffset(AstNoOffset offset);

    R visitFieldOffset(AstFieldOffset offset);

    R visitIndexOffset(AstIndexOffset offset);

    R visitIntegerConstant(AstIntegerConstant expr);

    R visitStringConstant(AstStringConstant expr);

    R visitLvalExpr(AstLvalExpr expr);

    R visitCastExpr(AstCastExpr expr);

    R visitUnaryOp(AstUnaryOp expr);

    R visitBinaryOp(AstBinaryOp expr);

    R visitQuestion(AstQuestion expr);

    R visitAddressOf(AstAddressOf expr);

    R visitSizeOf(AstSizeOf expr);

    R visitSubstitutedExpr(AstSubstitutedExpr expr);

    R visitVoidType(TypVoid typ);

    R visitIntType(TypInt typ);

    R visitFloatType(TypFloat typ);

    R visitPointerType(TypPtr typ);

    R visitArrayType(TypArray typ);

    R visitFunctionType(TypFun typ);

    R visitFunArg(FunArg funarg);

    R visitCompType(TypComp typ);

    R visitEnumType(TypEnum typ);

    R visitNamedType(TypNamed typ);

    R visitVarInfo(VarInfo vinfo);

    R visitCompInfo(CompInfo cinfo);

    R visitFieldInfo(FieldInfo finfo);

    R visitEnumInfo(EnumInfo einfo);
}
