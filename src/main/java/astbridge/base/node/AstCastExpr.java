package astbridge.base.node;

import astbridge.base.type.AstTyp;

import java.util.Set;

public class AstCastExpr extends AstExpr {
    private final AstTyp castType;
    private final AstExpr expr;

    public AstCastExpr(int exprId, AstTyp castType, AstExpr expr) {
        super(NodeTag.CAST_EXPR, exprId);
        this.castType = castType;
        this.expr = expr;
    }

    public AstTyp getCastType() {
        return castType;
    }

    public AstExpr getExpr() {
        return expr;
    }

    @Override
    public Set<String> use() {
        return expr.use();
    }

    @Override
    public Set<String> variablesUsed() {
        return expr.variablesUsed();
    }

    @Override
    public Set<String> addressTaken() {
        return expr.addressTaken();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCastExpr(this);
    }

    @Override
    public String toString() {
        return "(" + castType + ")" + OperatorNames.parenthesize(expr);
    }
}
