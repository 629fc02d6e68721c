package astbridge.base.node;

public abstract class AstOffset extends AstNode {

    protected AstOffset(NodeTag tag) {
        super(tag);
    }
}
