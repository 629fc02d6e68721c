package astbridge.base.type;

import astbridge.base.node.AstVisitor;
import astbridge.base.node.NodeTag;

public class TypVoid extends AstTyp {

    public TypVoid() {
        super(NodeTag.VOID);
    }

    @Override
    public String typeKey() {
        return "void";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVoidType(this);
    }

    @Override
    public String toString() {
        return "void";
    }
}
