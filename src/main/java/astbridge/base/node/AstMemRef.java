package astbridge.base.node;

import java.util.Set;

public class AstMemRef extends AstLHost {
    private final AstExpr memExp;

    public AstMemRef(AstExpr memExp) {
        super(NodeTag.MEMREF);
        this.memExp = memExp;
    }

    public AstExpr getMemExp() {
        return memExp;
    }

    @Override
    public Set<String> use() {
        return memExp.use();
    }

    @Override
    public Set<String> variablesUsed() {
        return memExp.variablesUsed();
    }

    @Override
    public Set<String> addressTaken() {
        return memExp.addressTaken();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitMemRef(this);
    }

    @Override
    public String toString() {
        return "*(" + memExp + ")";
    }
}
