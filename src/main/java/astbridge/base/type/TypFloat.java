package astbridge.base.type;

import astbridge.base.node.AstVisitor;
import astbridge.base.node.NodeTag;

import java.util.Map;

public class TypFloat extends AstTyp {
    public static final Map<String, String> FKINDS = Map.of(
            "ffloat", "float",
            "fdouble", "double",
            "flongdouble", "long double"
    );

    private final String fkind;

    public TypFloat(String fkind) {
        super(NodeTag.FLOAT);
        if (!FKINDS.containsKey(fkind)) {
            throw new IllegalArgumentException("Unknown float kind: " + fkind);
        }
        this.fkind = fkind;
    }

    public String getFkind() {
        return fkind;
    }

    @Override
    public String typeKey() {
        return fkind;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFloatType(this);
    }

    @Override
    public String toString() {
        return FKINDS.get(fkind);
    }
}
