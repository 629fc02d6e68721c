package astbridge.base.type;

import astbridge.base.node.AstNode;
import astbridge.base.node.AstVisitor;
import astbridge.base.node.NodeTag;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

public class EnumInfo extends AstNode {
    private final String name;
    private final String ikind;
    /** item name to value, in declaration order */
    private final Map<String, BigInteger> items;

    public EnumInfo(String name, String ikind, Map<String, BigInteger> items) {
        super(NodeTag.ENUMINFO);
        this.name = name;
        this.ikind = ikind;
        this.items = Collections.unmodifiableMap(new LinkedHashMap<>(items));
    }

    public String getName() {
        return name;
    }

    public String getIkind() {
        return ikind;
    }

    public Map<String, BigInteger> getItems() {
        return items;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitEnumInfo(this);
    }

    @Override
    public String toString() {
        return "enum " + name + " {"
                + items.entrySet().stream().map(e -> e.getKey() + " = " + e.getValue()).collect(Collectors.joining(", "))
                + "}";
    }
}
