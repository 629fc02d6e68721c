package astbridge.base.node;

import java.util.Set;

public class AstLvalExpr extends AstExpr {
    private final AstLval lval;

    public AstLvalExpr(int exprId, AstLval lval) {
        super(NodeTag.LVAL_EXPR, exprId);
        this.lval = lval;
    }

    public AstLval getLval() {
        return lval;
    }

    @Override
    public Set<String> use() {
        return lval.use();
    }

    @Override
    public Set<String> variablesUsed() {
        return lval.variablesUsed();
    }

    @Override
    public Set<String> addressTaken() {
        return lval.addressTaken();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLvalExpr(this);
    }

    @Override
    public String toString() {
        return lval.toString();
    }
}
