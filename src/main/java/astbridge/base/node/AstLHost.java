package astbridge.base.node;

public abstract class AstLHost extends AstNode {

    protected AstLHost(NodeTag tag) {
        super(tag);
    }
}
