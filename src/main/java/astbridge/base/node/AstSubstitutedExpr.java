package astbridge.base.node;

import java.util.Set;

/**
 * A read of {@code superLval} replaced by the value assigned to it in instruction {@code assignId}.
 * Prints as the substitute; the original lvalue is kept for provenance.
 */
public class AstSubstitutedExpr extends AstExpr {
    private final AstLval superLval;
    private final int assignId;
    private final AstExpr substitute;

    public AstSubstitutedExpr(int exprId, AstLval superLval, int assignId, AstExpr substitute) {
        super(NodeTag.SUBSTITUTED_EXPR, exprId);
        this.superLval = superLval;
        this.assignId = assignId;
        this.substitute = substitute;
    }

    public AstLval getSuperLval() {
        return superLval;
    }

    public int getAssignId() {
        return assignId;
    }

    public AstExpr getSubstitute() {
        return substitute;
    }

    @Override
    public Set<String> use() {
        return substitute.use();
    }

    @Override
    public Set<String> variablesUsed() {
        return substitute.variablesUsed();
    }

    @Override
    public Set<String> addressTaken() {
        return substitute.addressTaken();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSubstitutedExpr(this);
    }

    @Override
    public String toString() {
        return substitute.toString();
    }
}
