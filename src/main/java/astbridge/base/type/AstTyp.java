package astbridge.base.type;

import astbridge.base.node.AstNode;
import astbridge.base.node.NodeTag;

/**
 * Base of all type nodes. Two types are equal when their structural keys are equal.
 */
public abstract class AstTyp extends AstNode {

    protected AstTyp(NodeTag tag) {
        super(tag);
    }

    /**
     * A string that identifies the structure of this type.
     */
    public abstract String typeKey();

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof AstTyp other)) {
            return false;
        }
        return typeKey().equals(other.typeKey());
    }

    @Override
    public int hashCode() {
        return typeKey().hashCode();
    }
}
