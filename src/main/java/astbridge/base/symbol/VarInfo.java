package astbridge.base.symbol;

import astbridge.base.node.AstNode;
import astbridge.base.node.AstVisitor;
import astbridge.base.node.NodeTag;
import astbridge.base.type.AstTyp;

/**
 * The single record of a named variable within one scope.
 * Type and description may be filled in by later registrations but are never replaced.
 */
public class VarInfo extends AstNode {
    private final String name;
    private final boolean global;
    private AstTyp typ;
    private Integer parameter;
    private String globalAddress;
    private String description;

    public VarInfo(String name, AstTyp typ, Integer parameter, String globalAddress, String description,
                   boolean global) {
        super(NodeTag.VARINFO);
        this.name = name;
        this.typ = typ;
        this.parameter = parameter;
        this.globalAddress = globalAddress;
        this.description = description;
        this.global = global;
    }

    public String getName() {
        return name;
    }

    public boolean isGlobal() {
        return global;
    }

    public synchronized boolean hasType() {
        return typ != null;
    }

    public synchronized AstTyp getType() {
        return typ;
    }

    public synchronized boolean isParameter() {
        return parameter != null;
    }

    public synchronized Integer getParameter() {
        return parameter;
    }

    public synchronized boolean hasGlobalAddress() {
        return globalAddress != null;
    }

    public synchronized String getGlobalAddress() {
        return globalAddress;
    }

    public synchronized boolean hasDescription() {
        return description != null;
    }

    public synchronized String getDescription() {
        return description;
    }

    /**
     * Fill in whatever this record is still missing.
     */
    synchronized void merge(AstTyp newTyp, Integer newParameter, String newGlobalAddress, String newDescription) {
        if (typ == null && newTyp != null) {
            typ = newTyp;
        }
        if (parameter == null && newParameter != null) {
            parameter = newParameter;
        }
        if (globalAddress == null && newGlobalAddress != null) {
            globalAddress = newGlobalAddress;
        }
        if (description == null && newDescription != null) {
            description = newDescription;
        }
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVarInfo(this);
    }

    @Override
    public String toString() {
        return hasType() ? typ + " " + name : name;
    }
}
