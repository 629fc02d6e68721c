package astbridge.base.node;

import java.util.Set;

public class AstUnaryOp extends AstExpr {
    private final String op;
    private final AstExpr expr;

    public AstUnaryOp(int exprId, String op, AstExpr expr) {
        super(NodeTag.UNARY_OP, exprId);
        OperatorNames.unarySymbol(op);
        this.op = op;
        this.expr = expr;
    }

    public String getOp() {
        return op;
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
        return visitor.visitUnaryOp(this);
    }

    @Override
    public String toString() {
        return OperatorNames.unarySymbol(op) + OperatorNames.parenthesize(expr);
    }
}
