package astbridge.base.type;

import astbridge.base.node.AstVisitor;
import astbridge.base.node.NodeTag;

public class TypPtr extends AstTyp {
    private final AstTyp targetType;

    public TypPtr(AstTyp targetType) {
        super(NodeTag.PTR);
        this.targetType = targetType;
    }

    public AstTyp getTargetType() {
        return targetType;
    }

    @Override
    public String typeKey() {
        return "ptr(" + targetType.typeKey() + ")";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitPointerType(this);
    }

    @Override
    public String toString() {
        return targetType + " *";
    }
}
