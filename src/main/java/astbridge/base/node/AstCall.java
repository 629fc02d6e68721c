package astbridge.base.node;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public class AstCall extends AstInstruction {
    /** null if the return value is not assigned */
    private final AstLval lhs;
    private final AstExpr target;
    private final List<AstExpr> arguments;

    public AstCall(int instrId, AstLval lhs, AstExpr target, List<AstExpr> arguments) {
        super(NodeTag.CALL, instrId);
        this.lhs = lhs;
        this.target = target;
        this.arguments = List.copyOf(arguments);
    }

    public boolean hasLhs() {
        return lhs != null;
    }

    public AstLval getLhs() {
        return lhs;
    }

    public AstExpr getTarget() {
        return target;
    }

    public List<AstExpr> getArguments() {
        return arguments;
    }

    @Override
    public AstLval define() {
        return lhs;
    }

    @Override
    public Set<String> kill() {
        return hasLhs() ? Set.of(lhs.toString()) : Set.of();
    }

    @Override
    public Set<String> use() {
        Set<String> result = new HashSet<>(target.use());
        arguments.forEach(a -> result.addAll(a.use()));
        if (hasLhs()) {
            result.addAll(lhs.addressUse());
        }
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new HashSet<>(target.variablesUsed());
        arguments.forEach(a -> result.addAll(a.variablesUsed()));
        if (hasLhs()) {
            result.addAll(lhs.variablesUsed());
        }
        return result;
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new HashSet<>(target.addressTaken());
        arguments.forEach(a -> result.addAll(a.addressTaken()));
        if (hasLhs()) {
            result.addAll(lhs.addressTaken());
        }
        return result;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public String toString() {
        String call = target + "(" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ");";
        return hasLhs() ? lhs + " = " + call : call;
    }
}
