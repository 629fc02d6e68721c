package astbridge.base.type;

import astbridge.base.node.AstNode;
import astbridge.base.node.AstVisitor;
import astbridge.base.node.NodeTag;

public class FieldInfo extends AstNode {
    private final String name;
    private final AstTyp fieldType;
    private final int compKey;
    /** byte offset within the enclosing struct, null if unknown */
    private final Integer byteOffset;

    public FieldInfo(String name, AstTyp fieldType, int compKey, Integer byteOffset) {
        super(NodeTag.FIELDINFO);
        this.name = name;
        this.fieldType = fieldType;
        this.compKey = compKey;
        this.byteOffset = byteOffset;
    }

    public String getName() {
        return name;
    }

    public AstTyp getFieldType() {
        return fieldType;
    }

    public int getCompKey() {
        return compKey;
    }

    public boolean hasByteOffset() {
        return byteOffset != null;
    }

    public Integer getByteOffset() {
        return byteOffset;
    }

    public String layoutKey() {
        return name + ":" + fieldType.typeKey() + "@" + (hasByteOffset() ? byteOffset : "?");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFieldInfo(this);
    }

    @Override
    public String toString() {
        return fieldType + " " + name + ";";
    }
}
