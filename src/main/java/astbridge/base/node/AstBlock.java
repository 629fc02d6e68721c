package astbridge.base.node;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class AstBlock extends AstStmt {
    private final List<AstStmt> stmts;

    public AstBlock(int stmtId, List<AstStmt> stmts, List<String> labels) {
        super(NodeTag.BLOCK, stmtId, labels);
        this.stmts = List.copyOf(stmts);
    }

    public List<AstStmt> getStmts() {
        return stmts;
    }

    @Override
    public boolean isEmpty() {
        return stmts.stream().allMatch(AstStmt::isEmpty);
    }

    @Override
    public Set<String> use() {
        Set<String> result = new HashSet<>();
        stmts.forEach(s -> result.addAll(s.use()));
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new HashSet<>();
        stmts.forEach(s -> result.addAll(s.variablesUsed()));
        return result;
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new HashSet<>();
        stmts.forEach(s -> result.addAll(s.addressTaken()));
        return result;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
