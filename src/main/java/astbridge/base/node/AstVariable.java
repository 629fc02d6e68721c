package astbridge.base.node;

import astbridge.base.symbol.VarInfo;

import java.util.Set;

public class AstVariable extends AstLHost {
    private final VarInfo varInfo;

    public AstVariable(VarInfo varInfo) {
        super(NodeTag.VAR);
        this.varInfo = varInfo;
    }

    public VarInfo getVarInfo() {
        return varInfo;
    }

    public String getName() {
        return varInfo.getName();
    }

    @Override
    public Set<String> use() {
        return Set.of(getName());
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String toString() {
        return getName();
    }
}
