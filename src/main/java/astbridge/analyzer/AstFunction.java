package astbridge.analyzer;

import astbridge.base.builder.TreeBuilder;
import astbridge.base.node.AstStmt;

import java.util.List;

/**
 * The trees reconstructed for one function. Roots are ordered from the most reduced (high-level)
 * to the ground truth (low-level).
 */
public class AstFunction {
    public final String name;
    public final String address;
    private final TreeBuilder builder;
    private final List<AstStmt> roots;

    public AstFunction(String name, String address, TreeBuilder builder, List<AstStmt> roots) {
        if (roots.size() < 2) {
            throw new IllegalArgumentException("A function needs at least a high-level and a low-level tree: " + name);
        }
        this.name = name;
        this.address = address;
        this.builder = builder;
        this.roots = List.copyOf(roots);
    }

    public TreeBuilder getBuilder() {
        return builder;
    }

    public List<AstStmt> getRoots() {
        return roots;
    }

    public AstStmt getHighLevelTree() {
        return roots.get(0);
    }

    public AstStmt getLowLevelTree() {
        return roots.get(roots.size() - 1);
    }

    @Override
    public String toString() {
        return "AstFunction{" + name + "@" + address + "}";
    }
}
