package astbridge.base.node;

import java.util.HashSet;
import java.util.Set;

public class AstAddressOf extends AstExpr {
    private final AstLval lval;

    public AstAddressOf(int exprId, AstLval lval) {
        super(NodeTag.ADDRESS_OF, exprId);
        this.lval = lval;
    }

    public AstLval getLval() {
        return lval;
    }

    /**
     * Taking the address reads only what the location itself depends on.
     */
    @Override
    public Set<String> use() {
        return lval.addressUse();
    }

    @Override
    public Set<String> variablesUsed() {
        return lval.variablesUsed();
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new HashSet<>(lval.addressTaken());
        if (lval.getHost() instanceof AstVariable var) {
            result.add(var.getName());
        }
        return result;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAddressOf(this);
    }

    @Override
    public String toString() {
        return "&" + (lval.hasOffset() || lval.isMemref() ? "(" + lval + ")" : lval.toString());
    }
}
