package astbridge.base.node;

public abstract class AstExpr extends AstNode {
    private final int exprId;

    protected AstExpr(NodeTag tag, int exprId) {
        super(tag);
        this.exprId = exprId;
    }

    public int getExprId() {
        return exprId;
    }
}
