package astbridge.base.node;

import java.util.Map;

/**
 * Operator names accepted on the wire and their C spelling.
 */
public class OperatorNames {
    public static final Map<String, String> UNARY = Map.of(
            "neg", "-",
            "bnot", "~",
            "lnot", "!"
    );

    public static final Map<String, String> BINARY = Map.ofEntries(
            Map.entry("plus", "+"),
            Map.entry("minus", "-"),
            Map.entry("mult", "*"),
            Map.entry("div", "/"),
            Map.entry("mod", "%"),
            Map.entry("lsl", "<<"),
            Map.entry("lsr", ">>"),
            Map.entry("asr", ">>"),
            Map.entry("lt", "<"),
            Map.entry("gt", ">"),
            Map.entry("le", "<="),
            Map.entry("ge", ">="),
            Map.entry("eq", "=="),
            Map.entry("ne", "!="),
            Map.entry("band", "&"),
            Map.entry("bxor", "^"),
            Map.entry("bor", "|"),
            Map.entry("land", "&&"),
            Map.entry("lor", "||")
    );

    public static String unarySymbol(String op) {
        var symbol = UNARY.get(op);
        if (symbol == null) {
            throw new IllegalArgumentException("Unknown unary operator: " + op);
        }
        return symbol;
    }

    public static String binarySymbol(String op) {
        var symbol = BINARY.get(op);
        if (symbol == null) {
            throw new IllegalArgumentException("Unknown binary operator: " + op);
        }
        return symbol;
    }

    /**
     * Compound operands are wrapped in parentheses when printed inside another operator.
     */
    static String parenthesize(AstExpr expr) {
        var inner = expr instanceof AstSubstitutedExpr subst ? subst.getSubstitute() : expr;
        if (inner instanceof AstBinaryOp || inner instanceof AstQuestion) {
            return "(" + expr + ")";
        }
        return expr.toString();
    }
}
