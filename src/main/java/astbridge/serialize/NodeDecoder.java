package astbridge.serialize;

import astbridge.base.builder.TreeBuilder;
import astbridge.base.node.AstExpr;
import astbridge.base.node.AstInstruction;
import astbridge.base.node.AstLHost;
import astbridge.base.node.AstLval;
import astbridge.base.node.AstOffset;
import astbridge.base.node.AstStmt;
import astbridge.base.node.NodeTag;
import astbridge.base.symbol.VarInfo;
import astbridge.base.type.AstTyp;
import astbridge.base.type.FieldInfo;
import astbridge.base.type.FunArg;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds nodes from dictionary records. Every record is built once; later references get the same node.
 */
class NodeDecoder {
    private final TreeBuilder builder;
    private final Map<Integer, JsonNode> records = new HashMap<>();
    private final Map<Integer, Object> built = new HashMap<>();

    NodeDecoder(TreeBuilder builder, JsonNode nodes) {
        this.builder = builder;
        if (nodes == null || !nodes.isArray()) {
            throw new PirFormatException("Node records must be an array");
        }
        for (var record : nodes) {
            records.put(PirFields.requireInt(record, "id"), record);
        }
    }

    int recordCount() {
        return records.size();
    }

    Object node(int id) {
        var existing = built.get(id);
        if (existing != null) {
            return existing;
        }
        var record = records.get(id);
        if (record == null) {
            throw new PirFormatException("No node record with id " + id);
        }
        Object result;
        try {
            result = build(record);
        } catch (IllegalArgumentException e) {
            throw new PirFormatException(String.format("Invalid record %d: %s", id, e.getMessage()), e);
        }
        built.put(id, result);
        return result;
    }

    private <T> T node(int id, Class<T> kind) {
        var result = node(id);
        if (!kind.isInstance(result)) {
            throw new PirFormatException(String.format("Record %d is not a %s but %s", id, kind.getSimpleName(),
                    result.getClass().getSimpleName()));
        }
        return kind.cast(result);
    }

    AstStmt stmt(int id) {
        return node(id, AstStmt.class);
    }

    AstTyp typ(int id) {
        return node(id, AstTyp.class);
    }

    private AstExpr expr(int id) {
        return node(id, AstExpr.class);
    }

    private AstExpr optExpr(int id) {
        return id == NodeEncoder.NONE ? null : expr(id);
    }

    private AstLval lval(int id) {
        return node(id, AstLval.class);
    }

    private static List<Integer> args(JsonNode record) {
        var argsNode = record.get("args");
        if (argsNode == null || !argsNode.isArray()) {
            throw new PirFormatException("Record without args: " + record);
        }
        List<Integer> result = new ArrayList<>();
        argsNode.forEach(a -> result.add(a.asInt()));
        return result;
    }

    private static int arg(List<Integer> args, int index, JsonNode record) {
        if (index >= args.size()) {
            throw new PirFormatException(String.format("Record needs at least %d args: %s", index + 1, record));
        }
        return args.get(index);
    }

    private static List<String> labels(JsonNode record) {
        List<String> result = new ArrayList<>();
        var labels = record.get("labels");
        if (labels != null) {
            labels.forEach(l -> result.add(l.asText()));
        }
        return result;
    }

    private static int optId(JsonNode record, String field) {
        return record.has(field) ? record.get(field).asInt() : TreeBuilder.FRESH;
    }

    private Object build(JsonNode record) {
        var wireName = PirFields.requireText(record, "tag");
        var tag = NodeTag.fromWireName(wireName);
        if (tag == null) {
            throw new PirFormatException("Unknown node tag: " + wireName);
        }
        var args = args(record);
        return switch (tag) {
            case BLOCK -> {
                List<AstStmt> stmts = new ArrayList<>();
                args.subList(Math.min(1, args.size()), args.size()).forEach(a -> stmts.add(stmt(a)));
                yield builder.mkBlock(stmts, labels(record), arg(args, 0, record));
            }
            case INSTRS -> {
                List<AstInstruction> instrs = new ArrayList<>();
                args.subList(Math.min(1, args.size()), args.size())
                        .forEach(a -> instrs.add(node(a, AstInstruction.class)));
                yield builder.mkInstrSequence(instrs, labels(record), arg(args, 0, record));
            }
            case IF -> builder.mkBranch(expr(arg(args, 1, record)), stmt(arg(args, 2, record)),
                    stmt(arg(args, 3, record)), PirFields.optText(record, "target-address"), labels(record),
                    arg(args, 0, record));
            case LOOP -> builder.mkLoop(stmt(arg(args, 1, record)), labels(record), arg(args, 0, record));
            case RETURN -> builder.mkReturn(optExpr(arg(args, 1, record)), labels(record), arg(args, 0, record));
            case GOTO -> builder.mkGoto(PirFields.requireText(record, "destination"),
                    PirFields.optText(record, "destination-address"), labels(record), arg(args, 0, record));
            case SWITCH -> builder.mkSwitch(expr(arg(args, 1, record)), stmt(arg(args, 2, record)), labels(record),
                    arg(args, 0, record));
            case ASSIGN -> builder.mkAssign(lval(arg(args, 1, record)), expr(arg(args, 2, record)), List.of(),
                    arg(args, 0, record));
            case CALL -> {
                var lhsId = arg(args, 1, record);
                var lhs = lhsId == NodeEncoder.NONE ? null : lval(lhsId);
                List<AstExpr> arguments = new ArrayList<>();
                args.subList(Math.min(3, args.size()), args.size()).forEach(a -> arguments.add(expr(a)));
                yield builder.mkCall(lhs, expr(arg(args, 2, record)), arguments, List.of(), arg(args, 0, record));
            }
            case LVAL -> builder.mkLval(node(arg(args, 0, record), AstLHost.class),
                    node(arg(args, 1, record), AstOffset.class), optId(record, "lvalid"));
            case VAR -> builder.mkVariable(node(arg(args, 0, record), VarInfo.class));
            case MEMREF -> builder.mkMemRef(expr(arg(args, 0, record)));
            case NO_OFFSET -> builder.mkNoOffset();
            case FIELD_OFFSET -> builder.mkFieldOffset(PirFields.requireText(record, "name"),
                    PirFields.requireInt(record, "compkey"), node(arg(args, 0, record), AstOffset.class));
            case INDEX_OFFSET -> builder.mkIndexOffset(expr(arg(args, 0, record)),
                    node(arg(args, 1, record), AstOffset.class));
            case INTEGER_CONSTANT -> builder.mkIntegerConstant(
                    parseInteger(PirFields.requireText(record, "value")), optId(record, "exprid"));
            case STRING_CONSTANT -> builder.mkStringConstant(PirFields.requireText(record, "cstr"),
                    PirFields.optText(record, "string-address"), optId(record, "exprid"));
            case LVAL_EXPR -> builder.mkLvalExpr(lval(arg(args, 0, record)), optId(record, "exprid"));
            case CAST_EXPR -> builder.mkCastExpr(typ(arg(args, 0, record)), expr(arg(args, 1, record)),
                    optId(record, "exprid"));
            case UNARY_OP -> builder.mkUnaryOp(PirFields.requireText(record, "op"), expr(arg(args, 0, record)),
                    optId(record, "exprid"));
            case BINARY_OP -> builder.mkBinaryOp(PirFields.requireText(record, "op"), expr(arg(args, 0, record)),
                    expr(arg(args, 1, record)), optId(record, "exprid"));
            case QUESTION -> builder.mkQuestion(expr(arg(args, 0, record)), expr(arg(args, 1, record)),
                    expr(arg(args, 2, record)), optId(record, "exprid"));
            case ADDRESS_OF -> builder.mkAddressOf(lval(arg(args, 0, record)), optId(record, "exprid"));
            case SIZE_OF -> builder.mkSizeOf(typ(arg(args, 0, record)), optId(record, "exprid"));
            case SUBSTITUTED_EXPR -> builder.mkSubstitutedExpr(lval(arg(args, 0, record)),
                    PirFields.requireInt(record, "assigned"), expr(arg(args, 1, record)), optId(record, "exprid"));
            case VOID -> builder.mkVoidType();
            case INT -> builder.mkIntType(PirFields.requireText(record, "ikind"));
            case FLOAT -> builder.mkFloatType(PirFields.requireText(record, "fkind"));
            case PTR -> builder.mkPointerType(typ(arg(args, 0, record)));
            case ARRAY -> builder.mkArrayType(typ(arg(args, 0, record)), optExpr(arg(args, 1, record)));
            case FUNTYPE -> {
                List<FunArg> funArgs = new ArrayList<>();
                args.subList(Math.min(1, args.size()), args.size()).forEach(a -> funArgs.add(node(a, FunArg.class)));
                yield builder.mkFunctionType(typ(arg(args, 0, record)), funArgs,
                        record.path("varargs").asBoolean(false));
            }
            case FUNARG -> builder.mkFunArg(PirFields.requireText(record, "name"), typ(arg(args, 0, record)));
            case COMPTYP -> builder.mkCompType(PirFields.requireText(record, "name"),
                    PirFields.requireInt(record, "compkey"));
            case ENUMTYP -> builder.mkEnumType(PirFields.requireText(record, "name"));
            case TYPDEF -> builder.mkTypedef(PirFields.requireText(record, "name"), typ(arg(args, 0, record)));
            case VARINFO -> buildVarInfo(record, args);
            case COMPINFO -> {
                List<FieldInfo> fields = new ArrayList<>();
                args.forEach(a -> fields.add(node(a, FieldInfo.class)));
                yield builder.mkCompInfo(PirFields.requireText(record, "name"), PirFields.requireInt(record, "compkey"),
                        record.path("union").asBoolean(false), fields);
            }
            case FIELDINFO -> builder.mkFieldInfo(PirFields.requireText(record, "name"), typ(arg(args, 0, record)),
                    PirFields.requireInt(record, "compkey"),
                    record.has("byte-offset") ? Integer.valueOf(record.get("byte-offset").asInt()) : null);
            case ENUMINFO -> {
                Map<String, BigInteger> items = new LinkedHashMap<>();
                var itemsNode = record.get("items");
                if (itemsNode != null) {
                    for (var item : itemsNode) {
                        items.put(PirFields.requireText(item, "name"),
                                parseInteger(PirFields.requireText(item, "value")));
                    }
                }
                yield builder.mkEnumInfo(PirFields.requireText(record, "name"), PirFields.requireText(record, "ikind"),
                        items);
            }
        };
    }

    private VarInfo buildVarInfo(JsonNode record, List<Integer> args) {
        var name = PirFields.requireText(record, "name");
        var typId = arg(args, 0, record);
        var typ = typId == NodeEncoder.NONE ? null : typ(typId);
        var globalAddress = PirFields.optText(record, "global-address");
        var description = PirFields.optText(record, "descr");
        if (record.path("global").asBoolean(false) || globalAddress != null) {
            return builder.getContext().getGlobalSymbolTable().addSymbol(name, typ, null, globalAddress, description);
        }
        Integer parameter = record.has("parameter") ? Integer.valueOf(record.get("parameter").asInt()) : null;
        return builder.getSymbolTable().addSymbol(name, typ, parameter, null, description);
    }

    private static BigInteger parseInteger(String text) {
        try {
            return new BigInteger(text);
        } catch (NumberFormatException e) {
            throw new PirFormatException("Not an integer: " + text, e);
        }
    }
}
