package astbridge.base.type;

import astbridge.base.node.AstVisitor;
import astbridge.base.node.NodeTag;

/**
 * A typedef name together with the type it stands for.
 */
public class TypNamed extends AstTyp {
    private final String name;
    private final AstTyp typedef;

    public TypNamed(String name, AstTyp typedef) {
        super(NodeTag.TYPDEF);
        this.name = name;
        this.typedef = typedef;
    }

    public String getName() {
        return name;
    }

    public AstTyp getTypedef() {
        return typedef;
    }

    @Override
    public String typeKey() {
        return "named(" + name + "," + typedef.typeKey() + ")";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNamedType(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
