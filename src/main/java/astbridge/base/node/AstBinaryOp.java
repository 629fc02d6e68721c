package astbridge.base.node;

import java.util.HashSet;
import java.util.Set;

public class AstBinaryOp extends AstExpr {
    private final String op;
    private final AstExpr left;
    private final AstExpr right;

    public AstBinaryOp(int exprId, String op, AstExpr left, AstExpr right) {
        super(NodeTag.BINARY_OP, exprId);
        OperatorNames.binarySymbol(op);
        this.op = op;
        this.left = left;
        this.right = right;
    }

    public String getOp() {
        return op;
    }

    public AstExpr getLeft() {
        return left;
    }

    public AstExpr getRight() {
        return right;
    }

    @Override
    public Set<String> use() {
        Set<String> result = new HashSet<>(left.use());
        result.addAll(right.use());
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new HashSet<>(left.variablesUsed());
        result.addAll(right.variablesUsed());
        return result;
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new HashSet<>(left.addressTaken());
        result.addAll(right.addressTaken());
        return result;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public String toString() {
        return OperatorNames.parenthesize(left) + " " + OperatorNames.binarySymbol(op) + " "
                + OperatorNames.parenthesize(right);
    }
}
