package astbridge.base.node;

import java.util.HashSet;
import java.util.Set;

public class AstAssign extends AstInstruction {
    private final AstLval lhs;
    private final AstExpr rhs;

    public AstAssign(int instrId, AstLval lhs, AstExpr rhs) {
        super(NodeTag.ASSIGN, instrId);
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public AstLval getLhs() {
        return lhs;
    }

    public AstExpr getRhs() {
        return rhs;
    }

    @Override
    public AstLval define() {
        return lhs;
    }

    @Override
    public Set<String> kill() {
        return Set.of(lhs.toString());
    }

    @Override
    public Set<String> use() {
        Set<String> result = new HashSet<>(lhs.addressUse());
        result.addAll(rhs.use());
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new HashSet<>(lhs.variablesUsed());
        result.addAll(rhs.variablesUsed());
        return result;
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new HashSet<>(lhs.addressTaken());
        result.addAll(rhs.addressTaken());
        return result;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }

    @Override
    public String toString() {
        return lhs + " = " + rhs + ";";
    }
}
