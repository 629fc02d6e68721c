package astbridge.base.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public abstract class AstStmt extends AstNode {
    private final int stmtId;
    private final List<String> labels;

    protected AstStmt(NodeTag tag, int stmtId, List<String> labels) {
        super(tag);
        this.stmtId = stmtId;
        this.labels = labels == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(labels));
    }

    public int getStmtId() {
        return stmtId;
    }

    public List<String> getLabels() {
        return labels;
    }

    public boolean hasLabels() {
        return !labels.isEmpty();
    }

    /**
     * A statement is empty if executing it has no effect.
     */
    public abstract boolean isEmpty();
}
