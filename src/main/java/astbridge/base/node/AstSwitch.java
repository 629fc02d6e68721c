package astbridge.base.node;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A switch on an expression. The cases are one statement, normally a block whose children carry the case labels.
 */
public class AstSwitch extends AstStmt {
    private final AstExpr switchExpr;
    private final AstStmt cases;

    public AstSwitch(int stmtId, AstExpr switchExpr, AstStmt cases, List<String> labels) {
        super(NodeTag.SWITCH, stmtId, labels);
        this.switchExpr = switchExpr;
        this.cases = cases;
    }

    public AstExpr getSwitchExpr() {
        return switchExpr;
    }

    public AstStmt getCases() {
        return cases;
    }

    @Override
    public boolean isEmpty() {
        return cases.isEmpty();
    }

    @Override
    public Set<String> use() {
        Set<String> result = new HashSet<>(switchExpr.use());
        result.addAll(cases.use());
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new HashSet<>(switchExpr.variablesUsed());
        result.addAll(cases.variablesUsed());
        return result;
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new HashSet<>(switchExpr.addressTaken());
        result.addAll(cases.addressTaken());
        return result;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSwitch(this);
    }
}
