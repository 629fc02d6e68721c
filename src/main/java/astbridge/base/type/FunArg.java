package astbridge.base.type;

import astbridge.base.node.AstNode;
import astbridge.base.node.AstVisitor;
import astbridge.base.node.NodeTag;

public class FunArg extends AstNode {
    private final String name;
    private final AstTyp argType;

    public FunArg(String name, AstTyp argType) {
        super(NodeTag.FUNARG);
        this.name = name;
        this.argType = argType;
    }

    public String getName() {
        return name;
    }

    public AstTyp getArgType() {
        return argType;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunArg(this);
    }

    @Override
    public String toString() {
        return argType + " " + name;
    }
}
