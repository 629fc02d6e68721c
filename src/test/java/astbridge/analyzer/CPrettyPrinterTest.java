package astbridge.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import astbridge.base.builder.ProgramContext;
import astbridge.base.builder.TreeBuilder;
import astbridge.base.node.AstLval;
import astbridge.base.node.AstLvalExpr;
import org.junit.jupiter.api.Test;

import java.util.List;

public class CPrettyPrinterTest {
    private final TreeBuilder builder = new TreeBuilder(new ProgramContext());

    private AstLval var(String name) {
        return builder.mkLval(builder.mkVariable(name), builder.mkNoOffset());
    }

    private AstLvalExpr read(String name) {
        return builder.mkLvalExpr(var(name));
    }

    @Test
    public void testStatements() {
        var step = builder.mkAssign(var("x"), builder.mkBinaryOp("plus", read("x"), builder.mkIntegerConstant(1)));
        var branch = builder.mkBranch(builder.mkBinaryOp("lt", read("x"), builder.mkIntegerConstant(10)),
                builder.mkInstrSequence(List.of(step)), builder.mkBlock(List.of()), "0x40");
        var root = builder.mkBlock(List.of(
                builder.mkInstrSequence(List.of(builder.mkAssign(var("x"), builder.mkIntegerConstant(0)))),
                builder.mkLoop(builder.mkBlock(List.of(branch, builder.mkGoto("L1", "0x50")))),
                builder.mkInstrSequence(List.of(), List.of("L1"), TreeBuilder.FRESH),
                builder.mkReturn(read("x"))));

        var expected = "{\n"
                + "  x = 0;\n"
                + "  while (1)\n"
                + "  {\n"
                + "    if (x < 10)\n"
                + "    {\n"
                + "      x = x + 1;\n"
                + "    }\n"
                + "    goto L1;\n"
                + "  }\n"
                + "L1:\n"
                + "  return x;\n"
                + "}\n";
        assertEquals(expected, CPrettyPrinter.print(root));
    }

    @Test
    public void testLoopBodySequenceIsBraced() {
        var copy = builder.mkAssign(var("y"), read("a"));
        var step = builder.mkAssign(var("a"), builder.mkBinaryOp("plus", read("a"), builder.mkIntegerConstant(1)));
        var root = builder.mkBlock(List.of(builder.mkLoop(builder.mkInstrSequence(List.of(copy, step)))));

        var expected = "{\n"
                + "  while (1)\n"
                + "  {\n"
                + "    y = a;\n"
                + "    a = a + 1;\n"
                + "  }\n"
                + "}\n";
        assertEquals(expected, CPrettyPrinter.print(root));
    }

    @Test
    public void testBranchArmsAreBraced() {
        var branch = builder.mkBranch(read("c"),
                builder.mkInstrSequence(List.of(builder.mkAssign(var("x"), builder.mkIntegerConstant(1)),
                        builder.mkAssign(var("y"), builder.mkIntegerConstant(2)))),
                builder.mkReturn(null), "0x20");

        var expected = "if (c)\n"
                + "{\n"
                + "  x = 1;\n"
                + "  y = 2;\n"
                + "}\n"
                + "else\n"
                + "{\n"
                + "  return;\n"
                + "}\n";
        assertEquals(expected, CPrettyPrinter.print(branch));
    }

    @Test
    public void testFunctionHeader() {
        var intType = builder.mkIntType("iint");
        builder.mkRegisterLval("a0", "RDI", intType, 0, TreeBuilder.FRESH);
        builder.getSymbolTable().setPrototype(builder.mkFunctionType(intType,
                List.of(builder.mkFunArg("a0", intType)), false));
        var root = builder.mkBlock(List.of(builder.mkReturn(read("a0"))));
        var function = new AstFunction("identity", "0x400", builder, List.of(root, root));

        assertEquals("int identity(int a0)\n{\n  return a0;\n}\n", CPrettyPrinter.print(function));
    }
}
