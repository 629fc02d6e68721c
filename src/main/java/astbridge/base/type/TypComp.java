package astbridge.base.type;

import astbridge.base.node.AstVisitor;
import astbridge.base.node.NodeTag;

/**
 * Reference to a struct or union through its compinfo key.
 */
public class TypComp extends AstTyp {
    private final String name;
    private final int compKey;

    public TypComp(String name, int compKey) {
        super(NodeTag.COMPTYP);
        this.name = name;
        this.compKey = compKey;
    }

    public String getName() {
        return name;
    }

    public int getCompKey() {
        return compKey;
    }

    @Override
    public String typeKey() {
        return "comp(" + compKey + ")";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCompType(this);
    }

    @Override
    public String toString() {
        return "struct " + name;
    }
}
