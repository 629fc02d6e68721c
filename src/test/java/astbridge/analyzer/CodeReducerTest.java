package astbridge.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import astbridge.base.builder.ProgramContext;
import astbridge.base.builder.TreeBuilder;
import astbridge.base.node.AstBlock;
import astbridge.base.node.AstLval;
import astbridge.base.node.AstLvalExpr;
import astbridge.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

public class CodeReducerTest {
    private FunctionReconstructor reconstructor;
    private TreeBuilder builder;

    @BeforeEach
    public void setUp() {
        Logging.init();
        reconstructor = new FunctionReconstructor(new ProgramContext());
        builder = reconstructor.newBuilder();
    }

    private AstLval var(String name) {
        return builder.mkLval(builder.mkVariable(name), builder.mkNoOffset());
    }

    private AstLvalExpr read(String name) {
        return builder.mkLvalExpr(var(name));
    }

    @Test
    public void testSubstitutedDefinitionIsDropped() {
        var root = builder.mkBlock(List.of(
                builder.mkInstrSequence(List.of(builder.mkAssign(var("x"), builder.mkIntegerConstant(1)))),
                builder.mkReturn(read("x"))));
        var function = reconstructor.reconstruct(builder, "one", "0x10", root, null);

        assertEquals("{\n  return 1;\n}\n", CPrettyPrinter.print(function.getHighLevelTree()));
    }

    @Test
    public void testStoreFlagKeepsDeadAssignment() {
        var assign = builder.mkAssign(var("x"), builder.mkIntegerConstant(1));
        builder.getProvenance().markStore(assign.getLhs().getLvalId());
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(assign))));
        var function = reconstructor.reconstruct(builder, "store", "0x10", root, null);

        assertEquals("{\n  x = 1;\n}\n", CPrettyPrinter.print(function.getHighLevelTree()));
    }

    @Test
    public void testUnusedVariableIsDropped() {
        // y is live but the caller knows the function never reads it
        var root = builder.mkBlock(List.of(
                builder.mkInstrSequence(List.of(builder.mkAssign(var("y"), read("R0")))),
                builder.mkGoto("L1", "0x20")));
        var function = reconstructor.reconstruct(builder, "unused", "0x10", root, Set.of("R0"));

        assertEquals("{\n  goto L1;\n}\n", CPrettyPrinter.print(function.getHighLevelTree()));
    }

    @Test
    public void testEmptyBranchCollapses() {
        var branch = builder.mkBranch(read("c"),
                builder.mkInstrSequence(List.of(builder.mkAssign(var("y"), builder.mkIntegerConstant(2)))),
                builder.mkBlock(List.of()), "0x30");
        var root = builder.mkBlock(List.of(branch, builder.mkReturn(null)));
        var function = reconstructor.reconstruct(builder, "branch", "0x10", root, null);

        var high = (AstBlock) function.getHighLevelTree();
        assertEquals(1, high.getStmts().size());
        assertEquals("{\n  return;\n}\n", CPrettyPrinter.print(high));
    }

    @Test
    public void testLabelledEmptyStatementIsKept() {
        var dead = builder.mkAssign(var("y"), builder.mkIntegerConstant(2));
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(dead), List.of("L1"), TreeBuilder.FRESH),
                builder.mkReturn(null)));
        var function = reconstructor.reconstruct(builder, "label", "0x10", root, null);

        var high = (AstBlock) function.getHighLevelTree();
        assertEquals(2, high.getStmts().size());
        assertEquals(List.of("L1"), high.getStmts().get(0).getLabels());
        assertTrue(high.getStmts().get(0).isEmpty());
    }

    @Test
    public void testStatementsAreMappedToOrigins() {
        var ret = builder.mkReturn(null);
        var root = builder.mkBlock(List.of(ret));
        var function = reconstructor.reconstruct(builder, "map", "0x10", root, null);

        var high = (AstBlock) function.getHighLevelTree();
        var provenance = builder.getProvenance();
        assertNotEquals(root.getStmtId(), high.getStmtId());
        assertEquals(List.of(root.getStmtId()), provenance.getInstructionsMapped(high.getStmtId()));
        assertEquals(List.of(ret.getStmtId()), provenance.getInstructionsMapped(high.getStmts().get(0).getStmtId()));
    }
}
