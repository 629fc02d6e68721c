package astbridge.base.type;

import astbridge.base.node.AstExpr;
import astbridge.base.node.AstVisitor;
import astbridge.base.node.NodeTag;

public class TypArray extends AstTyp {
    private final AstTyp elementType;
    /** null for an array of unknown size */
    private final AstExpr sizeExpr;

    public TypArray(AstTyp elementType, AstExpr sizeExpr) {
        super(NodeTag.ARRAY);
        this.elementType = elementType;
        this.sizeExpr = sizeExpr;
    }

    public AstTyp getElementType() {
        return elementType;
    }

    public boolean hasSizeExpr() {
        return sizeExpr != null;
    }

    public AstExpr getSizeExpr() {
        return sizeExpr;
    }

    @Override
    public String typeKey() {
        return "array(" + elementType.typeKey() + "," + (hasSizeExpr() ? sizeExpr.toString() : "") + ")";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitArrayType(this);
    }

    @Override
    public String toString() {
        return elementType + "[" + (hasSizeExpr() ? sizeExpr.toString() : "") + "]";
    }
}
