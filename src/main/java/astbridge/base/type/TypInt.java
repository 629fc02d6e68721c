package astbridge.base.type;

import astbridge.base.node.AstVisitor;
import astbridge.base.node.NodeTag;

import java.util.Map;

public class TypInt extends AstTyp {
    public static final Map<String, String> IKINDS = Map.ofEntries(
            Map.entry("ichar", "char"),
            Map.entry("ischar", "signed char"),
            Map.entry("iuchar", "unsigned char"),
            Map.entry("ibool", "_Bool"),
            Map.entry("iint", "int"),
            Map.entry("iuint", "unsigned int"),
            Map.entry("ishort", "short"),
            Map.entry("iushort", "unsigned short"),
            Map.entry("ilong", "long"),
            Map.entry("iulong", "unsigned long"),
            Map.entry("ilonglong", "long long"),
            Map.entry("iulonglong", "unsigned long long"),
            Map.entry("iint128", "__int128"),
            Map.entry("iuint128", "unsigned __int128")
    );

    private final String ikind;

    public TypInt(String ikind) {
        super(NodeTag.INT);
        if (!IKINDS.containsKey(ikind)) {
            throw new IllegalArgumentException("Unknown integer kind: " + ikind);
        }
        this.ikind = ikind;
    }

    public String getIkind() {
        return ikind;
    }

    @Override
    public String typeKey() {
        return ikind;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIntType(this);
    }

    @Override
    public String toString() {
        return IKINDS.get(ikind);
    }
}
