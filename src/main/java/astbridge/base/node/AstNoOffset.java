package astbridge.base.node;

public class AstNoOffset extends AstOffset {
    public static final AstNoOffset INSTANCE = new AstNoOffset();

    private AstNoOffset() {
        super(NodeTag.NO_OFFSET);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNoOffset(this);
    }

    @Override
    public String toString() {
        return "";
    }
}
