package astbridge.base.dataflow.solver;

import static org.junit.jupiter.api.Assertions.*;

import astbridge.base.builder.AddressSpan;
import astbridge.base.builder.ProgramContext;
import astbridge.base.builder.Storage;
import astbridge.base.builder.TreeBuilder;
import astbridge.base.node.AstAssign;
import astbridge.base.node.AstBinaryOp;
import astbridge.base.node.AstBlock;
import astbridge.base.node.AstInstrSequence;
import astbridge.base.node.AstLoop;
import astbridge.base.node.AstLval;
import astbridge.base.node.AstLvalExpr;
import astbridge.base.node.AstStmt;
import astbridge.base.node.AstSubstitutedExpr;
import astbridge.base.provenance.AddressIndex;
import astbridge.base.provenance.RawUses;
import astbridge.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

public class ExprPropagatorTest {
    private TreeBuilder builder;

    @BeforeEach
    public void setUp() {
        Logging.init();
        builder = new TreeBuilder(new ProgramContext());
    }

    private AstLval var(String name) {
        return builder.mkLval(builder.mkVariable(name), builder.mkNoOffset());
    }

    private AstLvalExpr read(String name) {
        return builder.mkLvalExpr(var(name));
    }

    private AstStmt propagate(ExprPropagator propagator, AstStmt root) {
        builder.getProvenance().resolve(new AddressIndex(root, builder.getSpans()));
        return propagator.propagate(root);
    }

    private static AstAssign assignAt(AstStmt root, int stmt, int instr) {
        var seq = (AstInstrSequence) ((AstBlock) root).getStmts().get(stmt);
        return (AstAssign) seq.getInstructions().get(instr);
    }

    @Test
    public void testSubstitution() {
        var defX = builder.mkAssign(var("x"), builder.mkBinaryOp("plus", read("R0"), builder.mkIntegerConstant(4)));
        var useX = builder.mkAssign(var("y"), builder.mkBinaryOp("mult", read("x"), builder.mkIntegerConstant(2)));
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(defX, useX))));
        var propagator = new ExprPropagator(builder);
        var result = propagate(propagator, root);

        var newUse = assignAt(result, 0, 1);
        assertEquals("y = (R0 + 4) * 2;", newUse.toString());
        assertEquals(useX.getInstrId(), newUse.getInstrId());
        assertEquals(root.getStmtId(), result.getStmtId());
        assertSame(defX, assignAt(result, 0, 0));

        var subst = (AstSubstitutedExpr) ((AstBinaryOp) newUse.getRhs()).getLeft();
        assertEquals(defX.getInstrId(), subst.getAssignId());
        assertEquals("x", subst.getSuperLval().toString());
        assertTrue(propagator.getSubstitutedLvals().contains(defX.getLhs().getLvalId()));
        assertTrue(propagator.getSubstitutedAssigns().contains(defX.getInstrId()));
        assertTrue(builder.getProvenance().hasExpressionMapped(subst.getExprId()));
        assertTrue(builder.getProvenance().hasExpressionMapped(newUse.getRhs().getExprId()));
        // the input tree is left untouched
        assertEquals("y = x * 2;", useX.toString());
    }

    @Test
    public void testUnchangedTreeIsShared() {
        var a = builder.mkAssign(var("a"), builder.mkIntegerConstant(1));
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(a)), builder.mkReturn(read("b"))));
        assertSame(root, propagate(new ExprPropagator(builder), root));
    }

    @Test
    public void testExposedDefinitionIsNotSubstituted() {
        var defX = builder.mkAssign(var("x"), builder.mkIntegerConstant(9));
        var useX = builder.mkAssign(var("y"), read("x"));
        builder.getProvenance().markExpose(defX.getLhs().getLvalId());
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(defX, useX))));
        var result = propagate(new ExprPropagator(builder), root);

        assertEquals("y = x;", assignAt(result, 0, 1).toString());
    }

    @Test
    public void testHighLevelUseBlocksSubstitution() {
        var defX = builder.mkAssign(var("x"), builder.mkIntegerConstant(9), List.of(new AddressSpan("0x10", 2)));
        var useX = builder.mkAssign(var("y"), read("x"), List.of(new AddressSpan("0x12", 2)));
        builder.getProvenance().addLvalDefUsesHigh(defX.getLhs().getLvalId(), new RawUses("x", List.of("0x12")));
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(defX, useX))));
        var propagator = new ExprPropagator(builder);
        var result = propagate(propagator, root);

        assertEquals("y = x;", assignAt(result, 0, 1).toString());
        assertTrue(propagator.getSubstitutedLvals().isEmpty());
    }

    @Test
    public void testMemoryWriteStopsLoadPropagation() {
        var load = builder.mkAssign(var("a"), builder.mkLvalExpr(builder.mkMemRefLval(read("p"))));
        var store = builder.mkAssign(builder.mkMemRefLval(read("q")), builder.mkIntegerConstant(0));
        var useA = builder.mkAssign(var("b"), read("a"));
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(load, store, useA))));
        var result = propagate(new ExprPropagator(builder), root);

        assertEquals("b = a;", assignAt(result, 0, 2).toString());
    }

    @Test
    public void testPropagationIntoAddress() {
        var defT = builder.mkAssign(var("t"), builder.mkBinaryOp("plus", read("R0"), builder.mkIntegerConstant(4)));
        var target = builder.mkMemRefLval(read("t"));
        builder.addStorage(target.getLvalId(), Storage.base("R0", 4, 4));
        var store = builder.mkAssign(target, builder.mkIntegerConstant(1));
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(defT, store))));
        var result = propagate(new ExprPropagator(builder), root);

        var newStore = assignAt(result, 0, 1);
        assertEquals("*(R0 + 4) = 1;", newStore.toString());
        int newLvalId = newStore.getLhs().getLvalId();
        assertNotEquals(target.getLvalId(), newLvalId);
        assertEquals(Integer.valueOf(target.getLvalId()), builder.getProvenance().getLvalMapped(newLvalId));
        assertTrue(builder.hasStorage(newLvalId));
    }

    @Test
    public void testLoopDefinitionsDoNotEnterLoop() {
        var init = builder.mkAssign(var("i"), builder.mkIntegerConstant(0));
        var step = builder.mkAssign(var("i"), builder.mkBinaryOp("plus", read("i"), builder.mkIntegerConstant(1)));
        var copy = builder.mkAssign(var("j"), read("k"));
        var defK = builder.mkAssign(var("k"), builder.mkIntegerConstant(5));
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(defK, init)),
                builder.mkLoop(builder.mkInstrSequence(List.of(step, copy)))));
        var result = propagate(new ExprPropagator(builder), root);

        var body = (AstInstrSequence) ((AstLoop) ((AstBlock) result).getStmts().get(1)).getBody();
        // i is redefined in the body, k is not
        assertEquals("i = i + 1;", body.getInstructions().get(0).toString());
        assertEquals("j = 5;", body.getInstructions().get(1).toString());
    }

    private static AstInstrSequence loopBody(AstStmt root, int stmt) {
        return (AstInstrSequence) ((AstLoop) ((AstBlock) root).getStmts().get(stmt)).getBody();
    }

    @Test
    public void testValueReadingLoopVariableDoesNotEnterLoop() {
        var defX = builder.mkAssign(var("x"), read("a"));
        var copy = builder.mkAssign(var("y"), read("x"));
        var step = builder.mkAssign(var("a"), builder.mkBinaryOp("plus", read("a"), builder.mkIntegerConstant(1)));
        var call = builder.mkCall(null, read("f"), List.of(read("y")));
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(defX)),
                builder.mkLoop(builder.mkInstrSequence(List.of(copy, step, call)))));
        var propagator = new ExprPropagator(builder);
        var result = propagate(propagator, root);

        assertEquals("y = x;", loopBody(result, 1).getInstructions().get(0).toString());
        assertFalse(propagator.getSubstitutedAssigns().contains(defX.getInstrId()));
    }

    @Test
    public void testStoreInLoopStopsLoadPropagation() {
        var load = builder.mkAssign(var("a"), builder.mkLvalExpr(builder.mkMemRefLval(read("p"))));
        var useA = builder.mkAssign(var("b"), read("a"));
        var store = builder.mkAssign(builder.mkMemRefLval(read("q")), builder.mkIntegerConstant(0));
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(load)),
                builder.mkLoop(builder.mkInstrSequence(List.of(useA, store)))));
        var result = propagate(new ExprPropagator(builder), root);

        assertEquals("b = a;", loopBody(result, 1).getInstructions().get(0).toString());
    }

    @Test
    public void testCallInLoopKillsAddressTakenValues() {
        var defX = builder.mkAssign(var("x"), read("a"));
        var copy = builder.mkAssign(var("y"), read("x"));
        var call = builder.mkCall(null, read("g"), List.of(builder.mkAddressOf(var("a"))));
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(defX)),
                builder.mkLoop(builder.mkInstrSequence(List.of(copy, call)))));
        var result = propagate(new ExprPropagator(builder), root);

        assertEquals("y = x;", loopBody(result, 1).getInstructions().get(0).toString());
    }

    @Test
    public void testLabelResetsState() {
        var defX = builder.mkAssign(var("x"), builder.mkIntegerConstant(3));
        var useX = builder.mkAssign(var("y"), read("x"));
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(defX)),
                builder.mkInstrSequence(List.of(useX), List.of("L1"), TreeBuilder.FRESH)));
        var result = propagate(new ExprPropagator(builder), root);

        assertEquals("y = x;", assignAt(result, 1, 0).toString());
    }
}
