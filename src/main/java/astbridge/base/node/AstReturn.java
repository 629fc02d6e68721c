package astbridge.base.node;

import java.util.List;
import java.util.Set;

public class AstReturn extends AstStmt {
    /** null if the function returns void */
    private final AstExpr expr;

    public AstReturn(int stmtId, AstExpr expr, List<String> labels) {
        super(NodeTag.RETURN, stmtId, labels);
        this.expr = expr;
    }

    public boolean hasReturnValue() {
        return expr != null;
    }

    public AstExpr getExpr() {
        if (expr == null) {
            throw new IllegalStateException("Return statement has no return value");
        }
        return expr;
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public Set<String> use() {
        return hasReturnValue() ? expr.use() : Set.of();
    }

    @Override
    public Set<String> variablesUsed() {
        return hasReturnValue() ? expr.variablesUsed() : Set.of();
    }

    @Override
    public Set<String> addressTaken() {
        return hasReturnValue() ? expr.addressTaken() : Set.of();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}
