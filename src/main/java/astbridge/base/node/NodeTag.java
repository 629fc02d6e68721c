package astbridge.base.node;

import java.util.HashMap;
import java.util.Map;

/**
 * Every kind of node that can appear in a tree, with the name it carries on the wire.
 * Visitors dispatch over exactly this set.
 */
public enum NodeTag {
    // statements
    BLOCK("block"),
    INSTRS("instrs"),
    IF("if"),
    LOOP("loop"),
    RETURN("return"),
    GOTO("goto"),
    SWITCH("switch"),

    // instructions
    ASSIGN("assign"),
    CALL("call"),

    // lvalues
    LVAL("lval"),
    VAR("var"),
    MEMREF("memref"),
    NO_OFFSET("no-offset"),
    FIELD_OFFSET("field-offset"),
    INDEX_OFFSET("index-offset"),

    // expressions
    INTEGER_CONSTANT("integer-constant"),
    STRING_CONSTANT("string-constant"),
    LVAL_EXPR("lval-expr"),
    CAST_EXPR("cast-expr"),
    UNARY_OP("unary-op"),
    BINARY_OP("binary-op"),
    QUESTION("question"),
    ADDRESS_OF("address-of"),
    SIZE_OF("size-of"),
    SUBSTITUTED_EXPR("substituted-expr"),

    // types
    VOID("void"),
    INT("int"),
    FLOAT("float"),
    PTR("ptr"),
    ARRAY("array"),
    FUNTYPE("funtype"),
    FUNARG("funarg"),
    COMPTYP("comptyp"),
    ENUMTYP("enumtyp"),
    TYPDEF("typdef"),

    // symbols and definitions
    VARINFO("varinfo"),
    COMPINFO("compinfo"),
    FIELDINFO("fieldinfo"),
    ENUMINFO("enuminfo");

    private static final Map<String, NodeTag> byWireName = new HashMap<>();

    static {
        for (var tag: values()) {
            byWireName.put(tag.wireName, tag);
        }
    }

    private final String wireName;

    NodeTag(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * @return the tag with the given wire name, or null if there is none
     */
    public static NodeTag fromWireName(String name) {
        return byWireName.get(name);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
