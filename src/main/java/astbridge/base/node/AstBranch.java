package astbridge.base.node;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class AstBranch extends AstStmt {
    private final AstExpr condition;
    private final AstStmt ifStmt;
    private final AstStmt elseStmt;
    /** Hex address of the branch target, as given by the decoder */
    private final String targetAddress;

    public AstBranch(int stmtId, AstExpr condition, AstStmt ifStmt, AstStmt elseStmt,
                     String targetAddress, List<String> labels) {
        super(NodeTag.IF, stmtId, labels);
        this.condition = condition;
        this.ifStmt = ifStmt;
        this.elseStmt = elseStmt;
        this.targetAddress = targetAddress;
    }

    public AstExpr getCondition() {
        return condition;
    }

    public AstStmt getIfStmt() {
        return ifStmt;
    }

    public AstStmt getElseStmt() {
        return elseStmt;
    }

    public String getTargetAddress() {
        return targetAddress;
    }

    @Override
    public boolean isEmpty() {
        return ifStmt.isEmpty() && elseStmt.isEmpty();
    }

    @Override
    public Set<String> use() {
        Set<String> result = new HashSet<>(condition.use());
        result.addAll(ifStmt.use());
        result.addAll(elseStmt.use());
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new HashSet<>(condition.variablesUsed());
        result.addAll(ifStmt.variablesUsed());
        result.addAll(elseStmt.variablesUsed());
        return result;
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new HashSet<>(condition.addressTaken());
        result.addAll(ifStmt.addressTaken());
        result.addAll(elseStmt.addressTaken());
        return result;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBranch(this);
    }
}
