package astbridge.base.node;

import java.util.HashSet;
import java.util.Set;

public class AstIndexOffset extends AstOffset {
    private final AstExpr indexExpr;
    private final AstOffset subOffset;

    public AstIndexOffset(AstExpr indexExpr, AstOffset subOffset) {
        super(NodeTag.INDEX_OFFSET);
        this.indexExpr = indexExpr;
        this.subOffset = subOffset;
    }

    public AstExpr getIndexExpr() {
        return indexExpr;
    }

    public AstOffset getSubOffset() {
        return subOffset;
    }

    @Override
    public Set<String> use() {
        Set<String> result = new HashSet<>(indexExpr.use());
        result.addAll(subOffset.use());
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new HashSet<>(indexExpr.variablesUsed());
        result.addAll(subOffset.variablesUsed());
        return result;
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new HashSet<>(indexExpr.addressTaken());
        result.addAll(subOffset.addressTaken());
        return result;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIndexOffset(this);
    }

    @Override
    public String toString() {
        return "[" + indexExpr + "]" + subOffset;
    }
}
