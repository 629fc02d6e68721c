package astbridge.serialize;

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
import astbridge.base.node.AstIntegerConstant;
import astbridge.base.node.AstLval;
import astbridge.base.node.AstLvalExpr;
import astbridge.base.node.AstLoop;
import astbridge.base.node.AstMemRef;
import astbridge.base.node.AstNoOffset;
import astbridge.base.node.AstNode;
import astbridge.base.node.AstQuestion;
import astbridge.base.node.AstReturn;
import astbridge.base.node.AstSizeOf;
import astbridge.base.node.AstStmt;
import astbridge.base.node.AstStringConstant;
import astbridge.base.node.AstSubstitutedExpr;
import astbridge.base.node.AstSwitch;
import astbridge.base.node.AstUnaryOp;
import astbridge.base.node.AstVariable;
import astbridge.base.node.AstVisitor;
import astbridge.base.node.NodeTag;
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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns nodes into dictionary records and returns their record ids.
 * <p>
 * Statement and instruction ids are always part of a record key. Lvalue and expression ids are stored
 * (and keyed) only for the ones that provenance or storage refer to; the others collapse with any
 * structurally identical node.
 */
class NodeEncoder implements AstVisitor<Integer> {
    static final int NONE = -1;

    private final ObjectMapper mapper;
    private final NodeDictionary dictionary;
    private final Set<Integer> annotatedLvals;
    private final Set<Integer> annotatedExprs;

    NodeEncoder(ObjectMapper mapper, NodeDictionary dictionary, Set<Integer> annotatedLvals,
                Set<Integer> annotatedExprs) {
        this.mapper = mapper;
        this.dictionary = dictionary;
        this.annotatedLvals = annotatedLvals;
        this.annotatedExprs = annotatedExprs;
    }

    int index(AstNode node) {
        return node == null ? NONE : node.accept(this);
    }

    private ObjectNode record(NodeTag tag) {
        var record = mapper.createObjectNode();
        record.put("tag", tag.getWireName());
        return record;
    }

    private static List<String> tags(NodeTag tag, Object... extra) {
        List<String> result = new ArrayList<>();
        result.add(tag.getWireName());
        for (var e : extra) {
            result.add(String.valueOf(e));
        }
        return result;
    }

    private static List<Integer> args(int... ids) {
        List<Integer> result = new ArrayList<>();
        for (var id : ids) {
            result.add(id);
        }
        return result;
    }

    private int addStmt(AstStmt stmt, List<String> tags, List<Integer> children, ObjectNode record) {
        if (stmt.hasLabels()) {
            var labels = record.putArray("labels");
            stmt.getLabels().forEach(labels::add);
            tags.add("labels=" + String.join("|", stmt.getLabels()));
        }
        List<Integer> args = new ArrayList<>();
        args.add(stmt.getStmtId());
        args.addAll(children);
        return dictionary.add(tags, args, record);
    }

    private int addExpr(AstExpr expr, List<String> tags, List<Integer> args, ObjectNode record) {
        if (annotatedExprs.contains(expr.getExprId())) {
            record.put("exprid", expr.getExprId());
            tags.add("exprid=" + expr.getExprId());
        }
        return dictionary.add(tags, args, record);
    }

    // statements

    @Override
    public Integer visitBlock(AstBlock stmt) {
        List<Integer> children = new ArrayList<>();
        stmt.getStmts().forEach(s -> children.add(index(s)));
        return addStmt(stmt, tags(NodeTag.BLOCK), children, record(NodeTag.BLOCK));
    }

    @Override
    public Integer visitInstrSequence(AstInstrSequence stmt) {
        List<Integer> children = new ArrayList<>();
        stmt.getInstructions().forEach(i -> children.add(index(i)));
        return addStmt(stmt, tags(NodeTag.INSTRS), children, record(NodeTag.INSTRS));
    }

    @Override
    public Integer visitBranch(AstBranch stmt) {
        var record = record(NodeTag.IF);
        if (stmt.getTargetAddress() != null) {
            record.put("target-address", stmt.getTargetAddress());
        }
        return addStmt(stmt, tags(NodeTag.IF, stmt.getTargetAddress()),
                args(index(stmt.getCondition()), index(stmt.getIfStmt()), index(stmt.getElseStmt())), record);
    }

    @Override
    public Integer visitLoop(AstLoop stmt) {
        return addStmt(stmt, tags(NodeTag.LOOP), args(index(stmt.getBody())), record(NodeTag.LOOP));
    }

    @Override
    public Integer visitReturn(AstReturn stmt) {
        var value = stmt.hasReturnValue() ? index(stmt.getExpr()) : NONE;
        return addStmt(stmt, tags(NodeTag.RETURN), args(value), record(NodeTag.RETURN));
    }

    @Override
    public Integer visitGoto(AstGoto stmt) {
        var record = record(NodeTag.GOTO);
        record.put("destination", stmt.getDestinationLabel());
        if (stmt.getDestinationAddress() != null) {
            record.put("destination-address", stmt.getDestinationAddress());
        }
        return addStmt(stmt, tags(NodeTag.GOTO, stmt.getDestinationLabel(), stmt.getDestinationAddress()),
                args(), record);
    }

    @Override
    public Integer visitSwitch(AstSwitch stmt) {
        return addStmt(stmt, tags(NodeTag.SWITCH), args(index(stmt.getSwitchExpr()), index(stmt.getCases())),
                record(NodeTag.SWITCH));
    }

    // instructions

    @Override
    public Integer visitAssign(AstAssign instr) {
        return dictionary.add(tags(NodeTag.ASSIGN),
                args(instr.getInstrId(), index(instr.getLhs()), index(instr.getRhs())), record(NodeTag.ASSIGN));
    }

    @Override
    public Integer visitCall(AstCall instr) {
        var args = args(instr.getInstrId(), index(instr.getLhs()), index(instr.getTarget()));
        instr.getArguments().forEach(a -> args.add(index(a)));
        return dictionary.add(tags(NodeTag.CALL), args, record(NodeTag.CALL));
    }

    // lvalues

    @Override
    public Integer visitLval(AstLval lval) {
        var record = record(NodeTag.LVAL);
        var tags = tags(NodeTag.LVAL);
        if (annotatedLvals.contains(lval.getLvalId())) {
            record.put("lvalid", lval.getLvalId());
            tags.add("lvalid=" + lval.getLvalId());
        }
        return dictionary.add(tags, args(index(lval.getHost()), index(lval.getOffset())), record);
    }

    @Override
    public Integer visitVariable(AstVariable var) {
        var record = record(NodeTag.VAR);
        record.put("name", var.getName());
        return dictionary.add(tags(NodeTag.VAR, var.getName()), args(index(var.getVarInfo())), record);
    }

    @Override
    public Integer visitMemRef(AstMemRef memref) {
        return dictionary.add(tags(NodeTag.MEMREF), args(index(memref.getMemExp())), record(NodeTag.MEMREF));
    }

    @Override
    public Integer visitNoOffset(AstNoOffset offset) {
        return dictionary.add(tags(NodeTag.NO_OFFSET), args(), record(NodeTag.NO_OFFSET));
    }

    @Override
    public Integer visitFieldOffset(AstFieldOffset offset) {
        var record = record(NodeTag.FIELD_OFFSET);
        record.put("name", offset.getFieldName());
        record.put("compkey", offset.getCompKey());
        return dictionary.add(tags(NodeTag.FIELD_OFFSET, offset.getFieldName(), offset.getCompKey()),
                args(index(offset.getSubOffset())), record);
    }

    @Override
    public Integer visitIndexOffset(AstIndexOffset offset) {
        return dictionary.add(tags(NodeTag.INDEX_OFFSET),
                args(index(offset.getIndexExpr()), index(offset.getSubOffset())), record(NodeTag.INDEX_OFFSET));
    }

    // expressions

    @Override
    public Integer visitIntegerConstant(AstIntegerConstant expr) {
        var record = record(NodeTag.INTEGER_CONSTANT);
        record.put("value", expr.getValue().toString());
        return addExpr(expr, tags(NodeTag.INTEGER_CONSTANT, expr.getValue()), args(), record);
    }

    @Override
    public Integer visitStringConstant(AstStringConstant expr) {
        var record = record(NodeTag.STRING_CONSTANT);
        record.put("cstr", expr.getValue());
        if (expr.getStringAddress() != null) {
            record.put("string-address", expr.getStringAddress());
        }
        return addExpr(expr, tags(NodeTag.STRING_CONSTANT, expr.getValue(), expr.getStringAddress()), args(),
                record);
    }

    @Override
    public Integer visitLvalExpr(AstLvalExpr expr) {
        return addExpr(expr, tags(NodeTag.LVAL_EXPR), args(index(expr.getLval())), record(NodeTag.LVAL_EXPR));
    }

    @Override
    public Integer visitCastExpr(AstCastExpr expr) {
        return addExpr(expr, tags(NodeTag.CAST_EXPR), args(index(expr.getCastType()), index(expr.getExpr())),
                record(NodeTag.CAST_EXPR));
    }

    @Override
    public Integer visitUnaryOp(AstUnaryOp expr) {
        var record = record(NodeTag.UNARY_OP);
        record.put("op", expr.getOp());
        return addExpr(expr, tags(NodeTag.UNARY_OP, expr.getOp()), args(index(expr.getExpr())), record);
    }

    @Override
    public Integer visitBinaryOp(AstBinaryOp expr) {
        var record = record(NodeTag.BINARY_OP);
        record.put("op", expr.getOp());
        return addExpr(expr, tags(NodeTag.BINARY_OP, expr.getOp()),
                args(index(expr.getLeft()), index(expr.getRight())), record);
    }

    @Override
    public Integer visitQuestion(AstQuestion expr) {
        return addExpr(expr, tags(NodeTag.QUESTION),
                args(index(expr.getCondition()), index(expr.getTrueExpr()), index(expr.getFalseExpr())),
                record(NodeTag.QUESTION));
    }

    @Override
    public Integer visitAddressOf(AstAddressOf expr) {
        return addExpr(expr, tags(NodeTag.ADDRESS_OF), args(index(expr.getLval())), record(NodeTag.ADDRESS_OF));
    }

    @Override
    public Integer visitSizeOf(AstSizeOf expr) {
        return addExpr(expr, tags(NodeTag.SIZE_OF), args(index(expr.getTyp())), record(NodeTag.SIZE_OF));
    }

    @Override
    public Integer visitSubstitutedExpr(AstSubstitutedExpr expr) {
        var record = record(NodeTag.SUBSTITUTED_EXPR);
        record.put("assigned", expr.getAssignId());
        return addExpr(expr, tags(NodeTag.SUBSTITUTED_EXPR, expr.getAssignId()),
                args(index(expr.getSuperLval()), index(expr.getSubstitute())), record);
    }

    // types

    @Override
    public Integer visitVoidType(TypVoid typ) {
        return dictionary.add(tags(NodeTag.VOID), args(), record(NodeTag.VOID));
    }

    @Override
    public Integer visitIntType(TypInt typ) {
        var record = record(NodeTag.INT);
        record.put("ikind", typ.getIkind());
        return dictionary.add(tags(NodeTag.INT, typ.getIkind()), args(), record);
    }

    @Override
    public Integer visitFloatType(TypFloat typ) {
        var record = record(NodeTag.FLOAT);
        record.put("fkind", typ.getFkind());
        return dictionary.add(tags(NodeTag.FLOAT, typ.getFkind()), args(), record);
    }

    @Override
    public Integer visitPointerType(TypPtr typ) {
        return dictionary.add(tags(NodeTag.PTR), args(index(typ.getTargetType())), record(NodeTag.PTR));
    }

    @Override
    public Integer visitArrayType(TypArray typ) {
        return dictionary.add(tags(NodeTag.ARRAY), args(index(typ.getElementType()), index(typ.getSizeExpr())),
                record(NodeTag.ARRAY));
    }

    @Override
    public Integer visitFunctionType(TypFun typ) {
        var record = record(NodeTag.FUNTYPE);
        record.put("varargs", typ.isVarArgs());
        var args = args(index(typ.getReturnType()));
        typ.getFunArgs().forEach(a -> args.add(index(a)));
        return dictionary.add(tags(NodeTag.FUNTYPE, typ.isVarArgs()), args, record);
    }

    @Override
    public Integer visitFunArg(FunArg funarg) {
        var record = record(NodeTag.FUNARG);
        record.put("name", funarg.getName());
        return dictionary.add(tags(NodeTag.FUNARG, funarg.getName()), args(index(funarg.getArgType())), record);
    }

    @Override
    public Integer visitCompType(TypComp typ) {
        var record = record(NodeTag.COMPTYP);
        record.put("name", typ.getName());
        record.put("compkey", typ.getCompKey());
        return dictionary.add(tags(NodeTag.COMPTYP, typ.getName(), typ.getCompKey()), args(), record);
    }

    @Override
    public Integer visitEnumType(TypEnum typ) {
        var record = record(NodeTag.ENUMTYP);
        record.put("name", typ.getName());
        return dictionary.add(tags(NodeTag.ENUMTYP, typ.getName()), args(), record);
    }

    @Override
    public Integer visitNamedType(TypNamed typ) {
        var record = record(NodeTag.TYPDEF);
        record.put("name", typ.getName());
        return dictionary.add(tags(NodeTag.TYPDEF, typ.getName()), args(index(typ.getTypedef())), record);
    }

    // symbols and definitions

    @Override
    public Integer visitVarInfo(VarInfo vinfo) {
        var record = record(NodeTag.VARINFO);
        record.put("name", vinfo.getName());
        if (vinfo.isGlobal()) {
            record.put("global", true);
        }
        if (vinfo.isParameter()) {
            record.put("parameter", vinfo.getParameter());
        }
        if (vinfo.hasGlobalAddress()) {
            record.put("global-address", vinfo.getGlobalAddress());
        }
        if (vinfo.hasDescription()) {
            record.put("descr", vinfo.getDescription());
        }
        var tags = tags(NodeTag.VARINFO, vinfo.getName(), vinfo.isGlobal(), vinfo.getParameter(),
                vinfo.getGlobalAddress(), vinfo.getDescription());
        return dictionary.add(tags, args(index(vinfo.getType())), record);
    }

    @Override
    public Integer visitCompInfo(CompInfo cinfo) {
        var record = record(NodeTag.COMPINFO);
        record.put("name", cinfo.getName());
        record.put("compkey", cinfo.getCompKey());
        record.put("union", cinfo.isUnion());
        List<Integer> args = new ArrayList<>();
        cinfo.getFieldInfos().forEach(f -> args.add(index(f)));
        return dictionary.add(tags(NodeTag.COMPINFO, cinfo.getName(), cinfo.getCompKey(), cinfo.isUnion()), args,
                record);
    }

    @Override
    public Integer visitFieldInfo(FieldInfo finfo) {
        var record = record(NodeTag.FIELDINFO);
        record.put("name", finfo.getName());
        record.put("compkey", finfo.getCompKey());
        if (finfo.hasByteOffset()) {
            record.put("byte-offset", finfo.getByteOffset());
        }
        return dictionary.add(tags(NodeTag.FIELDINFO, finfo.getName(), finfo.getCompKey(), finfo.getByteOffset()),
                args(index(finfo.getFieldType())), record);
    }

    @Override
    public Integer visitEnumInfo(EnumInfo einfo) {
        var record = record(NodeTag.ENUMINFO);
        record.put("name", einfo.getName());
        record.put("ikind", einfo.getIkind());
        var items = record.putArray("items");
        var tags = tags(NodeTag.ENUMINFO, einfo.getName(), einfo.getIkind());
        for (var item : einfo.getItems().entrySet()) {
            var itemNode = items.addObject();
            itemNode.put("name", item.getKey());
            itemNode.put("value", item.getValue().toString());
            tags.add(item.getKey() + "=" + item.getValue());
        }
        return dictionary.add(tags, args(), record);
    }
}
