package astbridge.base.node;

import java.util.List;
import java.util.Set;

public class AstLoop extends AstStmt {
    private final AstStmt body;

    public AstLoop(int stmtId, AstStmt body, List<String> labels) {
        super(NodeTag.LOOP, stmtId, labels);
        this.body = body;
    }

    public AstStmt getBody() {
        return body;
    }

    /** A loop is never empty: dropping it would turn a non-terminating path into a terminating one. */
    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public Set<String> use() {
        return body.use();
    }

    @Override
    public Set<String> variablesUsed() {
        return body.variablesUsed();
    }

    @Override
    public Set<String> addressTaken() {
        return body.addressTaken();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLoop(this);
    }
}
