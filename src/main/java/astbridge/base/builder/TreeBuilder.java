package astbridge.base.builder;

import astbridge.base.node.AstAddressOf;
import astbridge.base.node.AstAssign;
import astbridge.base.node.AstBinaryOp;
import astbridge.base.node.AstBlock;
import astbridge.base.node.AstBranch;
import astbridge.base.node.AstCall;
import astbridge.base.node.AstCastExpr;
import astbridge.base.node.AstExpr;
import astbridge.base.node.AstFieldOffset;
import astbridge.base.node.AstGoto;
import astbridge.base.node.AstIndexOffset;
import astbridge.base.node.AstInstrSequence;
import astbridge.base.node.AstInstruction;
import astbridge.base.node.AstIntegerConstant;
import astbridge.base.node.AstLHost;
import astbridge.base.node.AstLoop;
import astbridge.base.node.AstLval;
import astbridge.base.node.AstLvalExpr;
import astbridge.base.node.AstMemRef;
import astbridge.base.node.AstNoOffset;
import astbridge.base.node.AstOffset;
import astbridge.base.node.AstQuestion;
import astbridge.base.node.AstReturn;
import astbridge.base.node.AstSizeOf;
import astbridge.base.node.AstStmt;
import astbridge.base.node.AstStringConstant;
import astbridge.base.node.AstSubstitutedExpr;
import astbridge.base.node.AstSwitch;
import astbridge.base.node.AstUnaryOp;
import astbridge.base.node.AstVariable;
import astbridge.base.provenance.Provenance;
import astbridge.base.symbol.LocalSymbolTable;
import astbridge.base.symbol.VarInfo;
import astbridge.base.type.AstTyp;
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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates the nodes of all trees of one function.
 * <p>
 * Ids come from the shared {@link ProgramContext}; pass an explicit id (anything but {@link #FRESH})
 * to rebuild a node that already has one. The builder also keeps the function's symbol table,
 * provenance, address spans and storage records.
 */
public class TreeBuilder {
    public static final int FRESH = -1;

    private final ProgramContext context;
    private final LocalSymbolTable symbolTable;
    private final Provenance provenance = new Provenance();
    private final Map<Integer, List<AddressSpan>> spans = new LinkedHashMap<>();
    private final Map<Integer, Storage> storage = new LinkedHashMap<>();
    private int tmpCounter = 0;

    public TreeBuilder(ProgramContext context) {
        this.context = context;
        this.symbolTable = new LocalSymbolTable(context.getGlobalSymbolTable());
    }

    public ProgramContext getContext() {
        return context;
    }

    public LocalSymbolTable getSymbolTable() {
        return symbolTable;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public Map<Integer, List<AddressSpan>> getSpans() {
        return Collections.unmodifiableMap(spans);
    }

    public List<AddressSpan> getSpans(int id) {
        return spans.getOrDefault(id, List.of());
    }

    public void addSpans(int id, List<AddressSpan> newSpans) {
        if (newSpans == null || newSpans.isEmpty()) {
            return;
        }
        var current = spans.computeIfAbsent(id, k -> new ArrayList<>());
        for (var span : newSpans) {
            if (!current.contains(span)) {
                current.add(span);
            }
        }
    }

    public Map<Integer, Storage> getStorage() {
        return Collections.unmodifiableMap(storage);
    }

    public boolean hasStorage(int lvalId) {
        return storage.containsKey(lvalId);
    }

    public Storage getStorage(int lvalId) {
        return storage.get(lvalId);
    }

    public void addStorage(int lvalId, Storage record) {
        storage.put(lvalId, record);
    }

    private int stmtId(int optId) {
        if (optId == FRESH) {
            return context.nextStmtId();
        }
        context.reserveStmtId(optId);
        return optId;
    }

    private int lvalId(int optId) {
        if (optId == FRESH) {
            return context.nextLvalId();
        }
        context.reserveLvalId(optId);
        return optId;
    }

    private int exprId(int optId) {
        if (optId == FRESH) {
            return context.nextExprId();
        }
        context.reserveExprId(optId);
        return optId;
    }

    // ---------------------------------------------------------------- statements

    public AstBlock mkBlock(List<AstStmt> stmts) {
        return mkBlock(stmts, List.of(), FRESH);
    }

    public AstBlock mkBlock(List<AstStmt> stmts, List<String> labels, int optId) {
        return new AstBlock(stmtId(optId), stmts, labels);
    }

    public AstInstrSequence mkInstrSequence(List<AstInstruction> instrs) {
        return mkInstrSequence(instrs, List.of(), FRESH);
    }

    public AstInstrSequence mkInstrSequence(List<AstInstruction> instrs, List<String> labels, int optId) {
        return new AstInstrSequence(stmtId(optId), instrs, labels);
    }

    public AstBranch mkBranch(AstExpr condition, AstStmt ifStmt, AstStmt elseStmt, String targetAddress) {
        return mkBranch(condition, ifStmt, elseStmt, targetAddress, List.of(), FRESH);
    }

    public AstBranch mkBranch(AstExpr condition, AstStmt ifStmt, AstStmt elseStmt, String targetAddress,
                              List<String> labels, int optId) {
        return new AstBranch(stmtId(optId), condition, ifStmt, elseStmt, targetAddress, labels);
    }

    public AstLoop mkLoop(AstStmt body) {
        return mkLoop(body, List.of(), FRESH);
    }

    public AstLoop mkLoop(AstStmt body, List<String> labels, int optId) {
        return new AstLoop(stmtId(optId), body, labels);
    }

    /**
     * @param expr the returned value, null for a plain return
     */
    public AstReturn mkReturn(AstExpr expr) {
        return mkReturn(expr, List.of(), FRESH);
    }

    public AstReturn mkReturn(AstExpr expr, List<String> labels, int optId) {
        return new AstReturn(stmtId(optId), expr, labels);
    }

    public AstGoto mkGoto(String destinationLabel, String destinationAddress) {
        return mkGoto(destinationLabel, destinationAddress, List.of(), FRESH);
    }

    public AstGoto mkGoto(String destinationLabel, String destinationAddress, List<String> labels, int optId) {
        return new AstGoto(stmtId(optId), destinationLabel, destinationAddress, labels);
    }

    public AstSwitch mkSwitch(AstExpr switchExpr, AstStmt cases) {
        return mkSwitch(switchExpr, cases, List.of(), FRESH);
    }

    public AstSwitch mkSwitch(AstExpr switchExpr, AstStmt cases, List<String> labels, int optId) {
        return new AstSwitch(stmtId(optId), switchExpr, cases, labels);
    }

    // ---------------------------------------------------------------- instructions

    public AstAssign mkAssign(AstLval lhs, AstExpr rhs) {
        return mkAssign(lhs, rhs, List.of(), FRESH);
    }

    public AstAssign mkAssign(AstLval lhs, AstExpr rhs, List<AddressSpan> instrSpans) {
        return mkAssign(lhs, rhs, instrSpans, FRESH);
    }

    public AstAssign mkAssign(AstLval lhs, AstExpr rhs, List<AddressSpan> instrSpans, int optId) {
        var assign = new AstAssign(stmtId(optId), lhs, rhs);
        addSpans(assign.getInstrId(), instrSpans);
        return assign;
    }

    /**
     * Assignment to a local variable, registering the variable if needed.
     */
    public AstAssign mkVarAssign(String name, AstExpr rhs, List<AddressSpan> instrSpans) {
        var lval = mkLval(mkVariable(name), mkNoOffset());
        return mkAssign(lval, rhs, instrSpans);
    }

    /**
     * @param lhs receives the return value, null if it is discarded
     */
    public AstCall mkCall(AstLval lhs, AstExpr target, List<AstExpr> arguments) {
        return mkCall(lhs, target, arguments, List.of(), FRESH);
    }

    public AstCall mkCall(AstLval lhs, AstExpr target, List<AstExpr> arguments, List<AddressSpan> instrSpans) {
        return mkCall(lhs, target, arguments, instrSpans, FRESH);
    }

    public AstCall mkCall(AstLval lhs, AstExpr target, List<AstExpr> arguments, List<AddressSpan> instrSpans,
                          int optId) {
        var call = new AstCall(stmtId(optId), lhs, target, arguments);
        addSpans(call.getInstrId(), instrSpans);
        return call;
    }

    // ---------------------------------------------------------------- lvalues

    public AstLval mkLval(AstLHost host, AstOffset offset) {
        return mkLval(host, offset, FRESH);
    }

    public AstLval mkLval(AstLHost host, AstOffset offset, int optId) {
        return new AstLval(lvalId(optId), host, offset);
    }

    public AstVariable mkVariable(VarInfo vinfo) {
        return new AstVariable(vinfo);
    }

    public AstVariable mkVariable(String name) {
        return new AstVariable(symbolTable.addSymbol(name));
    }

    public AstMemRef mkMemRef(AstExpr memExp) {
        return new AstMemRef(memExp);
    }

    public AstNoOffset mkNoOffset() {
        return AstNoOffset.INSTANCE;
    }

    public AstFieldOffset mkFieldOffset(String fieldName, int compKey, AstOffset subOffset) {
        return new AstFieldOffset(fieldName, compKey, subOffset);
    }

    public AstIndexOffset mkIndexOffset(AstExpr indexExpr, AstOffset subOffset) {
        return new AstIndexOffset(indexExpr, subOffset);
    }

    private AstLval mkNamedLval(VarInfo vinfo, Storage record, int optId) {
        var lval = mkLval(new AstVariable(vinfo), mkNoOffset(), optId);
        if (record != null) {
            addStorage(lval.getLvalId(), record);
        }
        return lval;
    }

    public AstLval mkRegisterLval(String register) {
        return mkRegisterLval(register, register, null, null, FRESH);
    }

    public AstLval mkRegisterLval(String name, String register, AstTyp typ, Integer parameter, int optId) {
        var vinfo = symbolTable.addSymbol(name, typ, parameter, null, null);
        return mkNamedLval(vinfo, Storage.register(register, null), optId);
    }

    public AstLval mkFlagLval(String flag) {
        return mkFlagLval(flag, null, FRESH);
    }

    public AstLval mkFlagLval(String flag, String description, int optId) {
        var vinfo = symbolTable.addSymbol(flag, null, null, null, description);
        return mkNamedLval(vinfo, Storage.flag(flag), optId);
    }

    public AstLval mkStackLval(int offset) {
        return mkStackLval(offset, null, null, null, null, FRESH);
    }

    /**
     * @param name variable name; derived from the offset if null
     */
    public AstLval mkStackLval(int offset, String name, AstTyp typ, Integer parameter, Integer size, int optId) {
        var vname = name != null ? name : offset < 0 ? "localvar_" + (-offset) : "argvar_" + offset;
        var vinfo = symbolTable.addSymbol(vname, typ, parameter, null, null);
        return mkNamedLval(vinfo, Storage.stack(offset, size), optId);
    }

    public AstLval mkGlobalLval(String name, String address) {
        return mkGlobalLval(name, address, null, null, FRESH);
    }

    public AstLval mkGlobalLval(String name, String address, AstTyp typ, Integer size, int optId) {
        var vinfo = context.getGlobalSymbolTable().addSymbol(name, typ, null, address, null);
        return mkNamedLval(vinfo, Storage.global(address, size), optId);
    }

    public AstLval mkTmpLval() {
        return mkTmpLval(null, FRESH);
    }

    public AstLval mkTmpLval(String description, int optId) {
        var name = "__asttmp_" + tmpCounter++ + "__";
        var vinfo = symbolTable.addSymbol(name, null, null, null, description);
        return mkNamedLval(vinfo, null, optId);
    }

    public AstLval mkMemRefLval(AstExpr memExp) {
        return mkMemRefLval(memExp, mkNoOffset(), FRESH);
    }

    public AstLval mkMemRefLval(AstExpr memExp, AstOffset offset, int optId) {
        return mkLval(mkMemRef(memExp), offset, optId);
    }

    /**
     * @throws UnsupportedOperationException if the expression does not denote a location
     */
    public AstLval mkLvalFromExpr(AstExpr expr) {
        if (expr instanceof AstLvalExpr lvalExpr) {
            return lvalExpr.getLval();
        }
        if (expr instanceof AstSubstitutedExpr subst) {
            return subst.getSuperLval();
        }
        throw new UnsupportedOperationException("Expression is not an lvalue: " + expr);
    }

    // ---------------------------------------------------------------- expressions

    public AstIntegerConstant mkIntegerConstant(long value) {
        return mkIntegerConstant(BigInteger.valueOf(value), FRESH);
    }

    public AstIntegerConstant mkIntegerConstant(BigInteger value, int optId) {
        return new AstIntegerConstant(exprId(optId), value);
    }

    public AstStringConstant mkStringConstant(String value, String stringAddress) {
        return mkStringConstant(value, stringAddress, FRESH);
    }

    public AstStringConstant mkStringConstant(String value, String stringAddress, int optId) {
        return new AstStringConstant(exprId(optId), value, stringAddress);
    }

    public AstLvalExpr mkLvalExpr(AstLval lval) {
        return mkLvalExpr(lval, FRESH);
    }

    public AstLvalExpr mkLvalExpr(AstLval lval, int optId) {
        return new AstLvalExpr(exprId(optId), lval);
    }

    public AstCastExpr mkCastExpr(AstTyp typ, AstExpr expr) {
        return mkCastExpr(typ, expr, FRESH);
    }

    public AstCastExpr mkCastExpr(AstTyp typ, AstExpr expr, int optId) {
        return new AstCastExpr(exprId(optId), typ, expr);
    }

    public AstUnaryOp mkUnaryOp(String op, AstExpr expr) {
        return mkUnaryOp(op, expr, FRESH);
    }

    public AstUnaryOp mkUnaryOp(String op, AstExpr expr, int optId) {
        return new AstUnaryOp(exprId(optId), op, expr);
    }

    public AstBinaryOp mkBinaryOp(String op, AstExpr left, AstExpr right) {
        return mkBinaryOp(op, left, right, FRESH);
    }

    public AstBinaryOp mkBinaryOp(String op, AstExpr left, AstExpr right, int optId) {
        return new AstBinaryOp(exprId(optId), op, left, right);
    }

    public AstQuestion mkQuestion(AstExpr condition, AstExpr trueExpr, AstExpr falseExpr) {
        return mkQuestion(condition, trueExpr, falseExpr, FRESH);
    }

    public AstQuestion mkQuestion(AstExpr condition, AstExpr trueExpr, AstExpr falseExpr, int optId) {
        return new AstQuestion(exprId(optId), condition, trueExpr, falseExpr);
    }

    public AstAddressOf mkAddressOf(AstLval lval) {
        return mkAddressOf(lval, FRESH);
    }

    public AstAddressOf mkAddressOf(AstLval lval, int optId) {
        return new AstAddressOf(exprId(optId), lval);
    }

    public AstSizeOf mkSizeOf(AstTyp typ) {
        return mkSizeOf(typ, FRESH);
    }

    public AstSizeOf mkSizeOf(AstTyp typ, int optId) {
        return new AstSizeOf(exprId(optId), typ);
    }

    public AstSubstitutedExpr mkSubstitutedExpr(AstLval superLval, int assignId, AstExpr substitute) {
        return mkSubstitutedExpr(superLval, assignId, substitute, FRESH);
    }

    public AstSubstitutedExpr mkSubstitutedExpr(AstLval superLval, int assignId, AstExpr substitute, int optId) {
        return new AstSubstitutedExpr(exprId(optId), superLval, assignId, substitute);
    }

    // ---------------------------------------------------------------- types

    public TypVoid mkVoidType() {
        return new TypVoid();
    }

    public TypInt mkIntType(String ikind) {
        return new TypInt(ikind);
    }

    public TypFloat mkFloatType(String fkind) {
        return new TypFloat(fkind);
    }

    public TypPtr mkPointerType(AstTyp targetType) {
        return new TypPtr(targetType);
    }

    /**
     * @param sizeExpr null for an array of unknown size
     */
    public TypArray mkArrayType(AstTyp elementType, AstExpr sizeExpr) {
        return new TypArray(elementType, sizeExpr);
    }

    public TypFun mkFunctionType(AstTyp returnType, List<FunArg> funArgs, boolean varArgs) {
        return new TypFun(returnType, funArgs, varArgs);
    }

    public FunArg mkFunArg(String name, AstTyp argType) {
        return new FunArg(name, argType);
    }

    public TypComp mkCompType(String name, int compKey) {
        context.getGlobalSymbolTable().markCompReferenced(compKey);
        return new TypComp(name, compKey);
    }

    public TypEnum mkEnumType(String name) {
        context.getGlobalSymbolTable().markEnumReferenced(name);
        return new TypEnum(name);
    }

    public TypNamed mkTypedef(String name, AstTyp typ) {
        return new TypNamed(name, typ);
    }

    /**
     * Create and register a struct/union definition.
     * @throws IllegalStateException if another layout is registered under the key
     */
    public CompInfo mkCompInfo(String name, int compKey, boolean union, List<FieldInfo> fieldInfos) {
        return context.getGlobalSymbolTable().addCompInfo(new CompInfo(name, compKey, union, fieldInfos));
    }

    public FieldInfo mkFieldInfo(String name, AstTyp fieldType, int compKey, Integer byteOffset) {
        return new FieldInfo(name, fieldType, compKey, byteOffset);
    }

    public EnumInfo mkEnumInfo(String name, String ikind, Map<String, BigInteger> items) {
        return context.getGlobalSymbolTable().addEnumInfo(new EnumInfo(name, ikind, items));
    }
}
