package astbridge.base.type;

import astbridge.base.node.AstNode;
import astbridge.base.node.AstVisitor;
import astbridge.base.node.NodeTag;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Definition of a struct or union, identified by its compinfo key.
 */
public class CompInfo extends AstNode {
    private final String name;
    private final int compKey;
    private final boolean union;
    private final List<FieldInfo> fieldInfos;

    public CompInfo(String name, int compKey, boolean union, List<FieldInfo> fieldInfos) {
        super(NodeTag.COMPINFO);
        this.name = name;
        this.compKey = compKey;
        this.union = union;
        this.fieldInfos = List.copyOf(fieldInfos);
    }

    public String getName() {
        return name;
    }

    public int getCompKey() {
        return compKey;
    }

    public boolean isUnion() {
        return union;
    }

    public List<FieldInfo> getFieldInfos() {
        return fieldInfos;
    }

    public Optional<FieldInfo> getField(String fieldName) {
        return fieldInfos.stream().filter(f -> f.getName().equals(fieldName)).findFirst();
    }

    /**
     * Two definitions with the same layout key describe the same layout.
     */
    public String layoutKey() {
        return (union ? "union " : "struct ") + name + "{"
                + fieldInfos.stream().map(FieldInfo::layoutKey).collect(Collectors.joining(";")) + "}";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCompInfo(this);
    }

    @Override
    public String toString() {
        return (union ? "union " : "struct ") + name + " {"
                + fieldInfos.stream().map(FieldInfo::toString).collect(Collectors.joining(" ")) + "}";
    }
}
