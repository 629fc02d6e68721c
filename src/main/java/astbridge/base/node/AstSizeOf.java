package astbridge.base.node;

import astbridge.base.type.AstTyp;

public class AstSizeOf extends AstExpr {
    private final AstTyp typ;

    public AstSizeOf(int exprId, AstTyp typ) {
        super(NodeTag.SIZE_OF, exprId);
        this.typ = typ;
    }

    public AstTyp getTyp() {
        return typ;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSizeOf(this);
    }

    @Override
    public String toString() {
        return "sizeof(" + typ + ")";
    }
}
