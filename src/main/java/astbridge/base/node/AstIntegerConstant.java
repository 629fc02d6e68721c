package astbridge.base.node;

import java.math.BigInteger;

public class AstIntegerConstant extends AstExpr {
    private static final BigInteger HEX_THRESHOLD = BigInteger.valueOf(16);

    private final BigInteger value;

    public AstIntegerConstant(int exprId, BigInteger value) {
        super(NodeTag.INTEGER_CONSTANT, exprId);
        this.value = value;
    }

    public BigInteger getValue() {
        return value;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIntegerConstant(this);
    }

    @Override
    public String toString() {
        if (value.abs().compareTo(HEX_THRESHOLD) < 0) {
            return value.toString();
        }
        return (value.signum() < 0 ? "-0x" : "0x") + value.abs().toString(16);
    }
}
