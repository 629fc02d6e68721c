package astbridge.base.type;

import astbridge.base.node.AstVisitor;
import astbridge.base.node.NodeTag;

import java.util.List;
import java.util.stream.Collectors;

public class TypFun extends AstTyp {
    private final AstTyp returnType;
    private final List<FunArg> funArgs;
    private final boolean varArgs;

    public TypFun(AstTyp returnType, List<FunArg> funArgs, boolean varArgs) {
        super(NodeTag.FUNTYPE);
        this.returnType = returnType;
        this.funArgs = List.copyOf(funArgs);
        this.varArgs = varArgs;
    }

    public AstTyp getReturnType() {
        return returnType;
    }

    public List<FunArg> getFunArgs() {
        return funArgs;
    }

    public boolean isVarArgs() {
        return varArgs;
    }

    @Override
    public String typeKey() {
        return "fun(" + returnType.typeKey() + ";"
                + funArgs.stream().map(a -> a.getArgType().typeKey()).collect(Collectors.joining(","))
                + (varArgs ? ";..." : "") + ")";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionType(this);
    }

    @Override
    public String toString() {
        var args = funArgs.stream().map(FunArg::toString).collect(Collectors.joining(", "));
        if (varArgs) {
            args = args.isEmpty() ? "..." : args + ", ...";
        }
        return returnType + " (" + args + ")";
    }
}
