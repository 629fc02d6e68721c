package astbridge.base.dataflow.solver;

import static org.junit.jupiter.api.Assertions.*;

import astbridge.base.builder.ProgramContext;
import astbridge.base.builder.TreeBuilder;
import astbridge.base.node.AstExpr;
import astbridge.base.node.AstLval;
import astbridge.base.node.AstLvalExpr;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

public class LivenessSolverTest {
    private TreeBuilder builder;
    private LivenessSolver solver;

    @BeforeEach
    public void setUp() {
        builder = new TreeBuilder(new ProgramContext());
        solver = new LivenessSolver();
    }

    private AstLval var(String name) {
        return builder.mkLval(builder.mkVariable(name), builder.mkNoOffset());
    }

    private AstLvalExpr read(String name) {
        return builder.mkLvalExpr(var(name));
    }

    private AstExpr f() {
        return builder.mkLvalExpr(builder.mkGlobalLval("f", "0x2000"));
    }

    @Test
    public void testDeadAssignment() {
        var live = builder.mkAssign(var("x"), builder.mkIntegerConstant(1));
        var dead = builder.mkAssign(var("y"), builder.mkIntegerConstant(2));
        var ret = builder.mkReturn(read("x"));
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(live, dead)), ret));
        solver.solve(root);

        assertTrue(solver.isLiveInstr(live.getInstrId()));
        assertFalse(solver.isLiveInstr(dead.getInstrId()));
        assertTrue(solver.isLiveOnExit(live.getInstrId(), "x"));
        assertFalse(solver.isLiveOnExit(dead.getInstrId(), "y"));
        assertTrue(solver.getLiveSymbols().contains("x"));
        assertFalse(solver.getLiveSymbols().contains("y"));
        assertTrue(solver.getLiveStmts().contains(root.getStmtId()));
    }

    @Test
    public void testOverwrittenBeforeUse() {
        var first = builder.mkAssign(var("x"), builder.mkIntegerConstant(1));
        var second = builder.mkAssign(var("x"), builder.mkIntegerConstant(2));
        var call = builder.mkCall(null, f(), List.of(read("x")));
        solver.solve(builder.mkBlock(List.of(builder.mkInstrSequence(List.of(first, second, call)))));

        assertFalse(solver.isLiveInstr(first.getInstrId()));
        assertTrue(solver.isLiveInstr(second.getInstrId()));
        assertTrue(solver.isLiveInstr(call.getInstrId()));
    }

    @Test
    public void testLoopCarriedValue() {
        var init = builder.mkAssign(var("i"), builder.mkIntegerConstant(0));
        var call = builder.mkCall(null, f(), List.of(read("i")));
        var step = builder.mkAssign(var("i"), builder.mkBinaryOp("plus", read("i"), builder.mkIntegerConstant(1)));
        var loop = builder.mkLoop(builder.mkInstrSequence(List.of(call, step)));
        solver.solve(builder.mkBlock(List.of(builder.mkInstrSequence(List.of(init)), loop)));

        // the increment is only read by the next iteration
        assertTrue(solver.isLiveInstr(step.getInstrId()));
        assertTrue(solver.isLiveInstr(init.getInstrId()));
        assertTrue(solver.isLiveOnExit(step.getInstrId(), "i"));
    }

    @Test
    public void testBranchJoinsBothArms() {
        var a = builder.mkAssign(var("a"), builder.mkIntegerConstant(1));
        var b = builder.mkAssign(var("b"), builder.mkIntegerConstant(2));
        var branch = builder.mkBranch(read("c"), builder.mkReturn(read("a")), builder.mkReturn(read("b")), "0x40");
        solver.solve(builder.mkBlock(List.of(builder.mkInstrSequence(List.of(a, b)), branch)));

        assertTrue(solver.isLiveInstr(a.getInstrId()));
        assertTrue(solver.isLiveInstr(b.getInstrId()));
        assertTrue(solver.getLiveSymbols().contains("c"));
    }

    @Test
    public void testMemoryWritesAndGlobalsAreLive() {
        var store = builder.mkAssign(builder.mkMemRefLval(read("p")), builder.mkIntegerConstant(0));
        var global = builder.mkAssign(builder.mkGlobalLval("g", "0x3000"), builder.mkIntegerConstant(1));
        var assignP = builder.mkAssign(var("p"), builder.mkIntegerConstant(64));
        solver.solve(builder.mkBlock(List.of(builder.mkInstrSequence(List.of(assignP, store, global)))));

        assertTrue(solver.isLiveInstr(store.getInstrId()));
        assertTrue(solver.isLiveInstr(global.getInstrId()));
        // p is needed to compute the stored-to address
        assertTrue(solver.isLiveInstr(assignP.getInstrId()));
    }

    @Test
    public void testGotoKeepsEverythingLive() {
        var a = builder.mkAssign(var("a"), builder.mkIntegerConstant(1));
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(a)), builder.mkGoto("L1", "0x80"),
                builder.mkReturn(read("a"))));
        solver.solve(root);

        assertTrue(solver.isLiveInstr(a.getInstrId()));
    }
}
