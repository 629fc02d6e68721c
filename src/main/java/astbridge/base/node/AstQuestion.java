package astbridge.base.node;

import java.util.HashSet;
import java.util.Set;

public class AstQuestion extends AstExpr {
    private final AstExpr condition;
    private final AstExpr trueExpr;
    private final AstExpr falseExpr;

    public AstQuestion(int exprId, AstExpr condition, AstExpr trueExpr, AstExpr falseExpr) {
        super(NodeTag.QUESTION, exprId);
        this.condition = condition;
        this.trueExpr = trueExpr;
        this.falseExpr = falseExpr;
    }

    public AstExpr getCondition() {
        return condition;
    }

    public AstExpr getTrueExpr() {
        return trueExpr;
    }

    public AstExpr getFalseExpr() {
        return falseExpr;
    }

    @Override
    public Set<String> use() {
        Set<String> result = new HashSet<>(condition.use());
        result.addAll(trueExpr.use());
        result.addAll(falseExpr.use());
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new HashSet<>(condition.variablesUsed());
        result.addAll(trueExpr.variablesUsed());
        result.addAll(falseExpr.variablesUsed());
        return result;
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new HashSet<>(condition.addressTaken());
        result.addAll(trueExpr.addressTaken());
        result.addAll(falseExpr.addressTaken());
        return result;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitQuestion(this);
    }

    @Override
    public String toString() {
        return OperatorNames.parenthesize(condition) + " ? " + OperatorNames.parenthesize(trueExpr)
                + " : " + OperatorNames.parenthesize(falseExpr);
    }
}
