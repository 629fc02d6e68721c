package astbridge.base.node;

import java.util.Set;

/**
 * Base of every tree element. Children are held by reference, so one subtree may hang under several parents.
 */
public abstract class AstNode {
    private final NodeTag tag;

    protected AstNode(NodeTag tag) {
        this.tag = tag;
    }

    public NodeTag getTag() {
        return tag;
    }

    public abstract <R> R accept(AstVisitor<R> visitor);

    /**
     * Names of the variables whose value is read when this node is evaluated.
     */
    public Set<String> use() {
        return Set.of();
    }

    /**
     * Names of all variables that appear in this node, read or written.
     */
    public Set<String> variablesUsed() {
        return use();
    }

    /**
     * Names of the variables whose address is taken somewhere inside this node.
     */
    public Set<String> addressTaken() {
        return Set.of();
    }
}
