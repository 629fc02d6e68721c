package astbridge.base.node;

public class AstStringConstant extends AstExpr {
    private final String value;
    /** address the string was loaded from, may be null */
    private final String stringAddress;

    public AstStringConstant(int exprId, String value, String stringAddress) {
        super(NodeTag.STRING_CONSTANT, exprId);
        this.value = value;
        this.stringAddress = stringAddress;
    }

    public String getValue() {
        return value;
    }

    public String getStringAddress() {
        return stringAddress;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitStringConstant(this);
    }

    @Override
    public String toString() {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }
}
