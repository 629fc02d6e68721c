package astbridge.base.node;

import java.util.Set;

public class AstFieldOffset extends AstOffset {
    private final String fieldName;
    private final int compKey;
    private final AstOffset subOffset;

    public AstFieldOffset(String fieldName, int compKey, AstOffset subOffset) {
        super(NodeTag.FIELD_OFFSET);
        this.fieldName = fieldName;
        this.compKey = compKey;
        this.subOffset = subOffset;
    }

    public String getFieldName() {
        return fieldName;
    }

    public int getCompKey() {
        return compKey;
    }

    public AstOffset getSubOffset() {
        return subOffset;
    }

    @Override
    public Set<String> use() {
        return subOffset.use();
    }

    @Override
    public Set<String> addressTaken() {
        return subOffset.addressTaken();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFieldOffset(this);
    }

    @Override
    public String toString() {
        return "." + fieldName + subOffset;
    }
}
