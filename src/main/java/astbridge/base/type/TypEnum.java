package astbridge.base.type;

import astbridge.base.node.AstVisitor;
import astbridge.base.node.NodeTag;

public class TypEnum extends AstTyp {
    private final String name;

    public TypEnum(String name) {
        super(NodeTag.ENUMTYP);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String typeKey() {
        return "enum(" + name + ")";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitEnumType(this);
    }

    @Override
    public String toString() {
        return "enum " + name;
    }
}
