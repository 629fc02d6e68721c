package astbridge.analyzer;

import astbridge.base.node.AstBlock;
import astbridge.base.node.AstBranch;
import astbridge.base.node.AstGoto;
import astbridge.base.node.AstInstrSequence;
import astbridge.base.node.AstLoop;
import astbridge.base.node.AstReturn;
import astbridge.base.node.AstStmt;
import astbridge.base.node.AstSwitch;
import astbridge.base.symbol.VarInfo;

import java.util.stream.Collectors;

/**
 * Prints a tree as C-like source text.
 */
public class CPrettyPrinter {
    private static final String INDENT = "  ";

    private final StringBuilder sb = new StringBuilder();
    private int level = 0;

    public static String print(AstStmt root) {
        var printer = new CPrettyPrinter();
        printer.printStmt(root);
        return printer.sb.toString();
    }

    public static String print(AstFunction function) {
        var printer = new CPrettyPrinter();
        var symbols = function.getBuilder().getSymbolTable();
        String params = symbols.getFormals().stream().map(VarInfo::toString).collect(Collectors.joining(", "));
        String returnType = symbols.hasPrototype() ? symbols.getPrototype().getReturnType().toString() : "int";
        printer.sb.append(returnType).append(" ").append(function.name).append("(").append(params).append(")\n");
        printer.printStmt(function.getHighLevelTree());
        return printer.sb.toString();
    }

    private void line(String text) {
        sb.append(INDENT.repeat(level)).append(text).append("\n");
    }

    private void printLabels(AstStmt stmt) {
        for (var label : stmt.getLabels()) {
            sb.append(INDENT.repeat(Math.max(0, level - 1))).append(label).append(":\n");
        }
    }

    /**
     * Loop bodies, branch arms and switch cases always print as a braced block.
     */
    private void printNested(AstStmt stmt) {
        if (stmt instanceof AstBlock && !stmt.hasLabels()) {
            printStmt(stmt);
            return;
        }
        line("{");
        level++;
        printStmt(stmt);
        level--;
        line("}");
    }

    private void printStmt(AstStmt stmt) {
        printLabels(stmt);
        if (stmt instanceof AstBlock block) {
            line("{");
            level++;
            block.getStmts().forEach(this::printStmt);
            level--;
            line("}");
        } else if (stmt instanceof AstInstrSequence seq) {
            seq.getInstructions().forEach(i -> line(i.toString()));
        } else if (stmt instanceof AstBranch branch) {
            line("if (" + branch.getCondition() + ")");
            printNested(branch.getIfStmt());
            if (!branch.getElseStmt().isEmpty()) {
                line("else");
                printNested(branch.getElseStmt());
            }
        } else if (stmt instanceof AstLoop loop) {
            line("while (1)");
            printNested(loop.getBody());
        } else if (stmt instanceof AstReturn ret) {
            line(ret.hasReturnValue() ? "return " + ret.getExpr() + ";" : "return;");
        } else if (stmt instanceof AstGoto gt) {
            line("goto " + gt.getDestinationLabel() + ";");
        } else if (stmt instanceof AstSwitch sw) {
            line("switch (" + sw.getSwitchExpr() + ")");
            printNested(sw.getCases());
        } else {
            throw new UnsupportedOperationException("Unsupported statement: " + stmt.getTag());
        }
    }
}
