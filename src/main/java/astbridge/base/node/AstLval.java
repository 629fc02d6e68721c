package astbridge.base.node;

import java.util.HashSet;
import java.util.Set;

/**
 * An assignable location: a host (variable or dereferenced address) with an optional field/index offset.
 */
public class AstLval extends AstNode {
    private final int lvalId;
    private final AstLHost host;
    private final AstOffset offset;

    public AstLval(int lvalId, AstLHost host, AstOffset offset) {
        super(NodeTag.LVAL);
        this.lvalId = lvalId;
        this.host = host;
        this.offset = offset;
    }

    public int getLvalId() {
        return lvalId;
    }

    public AstLHost getHost() {
        return host;
    }

    public AstOffset getOffset() {
        return offset;
    }

    public boolean isMemref() {
        return host instanceof AstMemRef;
    }

    public boolean isVariable() {
        return host instanceof AstVariable;
    }

    public boolean isGlobal() {
        return host instanceof AstVariable var && var.getVarInfo().isGlobal();
    }

    public boolean hasOffset() {
        return !(offset instanceof AstNoOffset);
    }

    /**
     * A plain variable without sub-offset; the only kind of lvalue the dataflow passes track by name.
     */
    public boolean isSimpleVariable() {
        return isVariable() && !hasOffset();
    }

    /**
     * Names read to compute the location itself, not its content.
     */
    public Set<String> addressUse() {
        Set<String> result = new HashSet<>(offset.use());
        if (host instanceof AstMemRef memref) {
            result.addAll(memref.getMemExp().use());
        }
        return result;
    }

    @Override
    public Set<String> use() {
        Set<String> result = new HashSet<>(host.use());
        result.addAll(offset.use());
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new HashSet<>(host.variablesUsed());
        result.addAll(offset.variablesUsed());
        return result;
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new HashSet<>(host.addressTaken());
        result.addAll(offset.addressTaken());
        return result;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLval(this);
    }

    @Override
    public String toString() {
        if (isMemref() && hasOffset()) {
            return "(" + host + ")" + offset;
        }
        return host.toString() + offset;
    }
}
