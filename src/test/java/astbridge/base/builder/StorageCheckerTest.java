package astbridge.base.builder;

import static org.junit.jupiter.api.Assertions.*;

import astbridge.base.node.AstLval;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

public class StorageCheckerTest {
    private TreeBuilder builder;

    @BeforeEach
    public void setUp() {
        builder = new TreeBuilder(new ProgramContext());
    }

    private AstLval var(String name) {
        return builder.mkLval(builder.mkVariable(name), builder.mkNoOffset());
    }

    @Test
    public void testMissingAndUnsizedStorage() {
        var local = builder.mkStackLval(-8, null, null, null, 4, TreeBuilder.FRESH);
        var reg = builder.mkRegisterLval("R0");
        var tmp = var("t");
        var assign = builder.mkAssign(local, builder.mkBinaryOp("plus",
                builder.mkLvalExpr(reg), builder.mkLvalExpr(tmp)));
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(assign))));

        var checker = new StorageChecker(builder.getStorage());
        checker.check(root);

        assertEquals(Set.of(tmp.getLvalId()), checker.getMissing().keySet());
        assertEquals(Set.of(reg.getLvalId()), checker.getNoSize().keySet());
        assertEquals("t", checker.getMissing().get(tmp.getLvalId()).lval);
        assertEquals("localvar_8 = R0 + t;", checker.getMissing().get(tmp.getLvalId()).instruction);
    }

    @Test
    public void testCallTargetIsNotChecked() {
        var arg = var("a");
        var call = builder.mkCall(null, builder.mkLvalExpr(var("f")), List.of(builder.mkLvalExpr(arg)));
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(call))));

        var checker = new StorageChecker(builder.getStorage());
        checker.check(root);

        assertEquals(Set.of(arg.getLvalId()), checker.getMissing().keySet());
        assertTrue(checker.getNoSize().isEmpty());
    }

    @Test
    public void testReport() {
        var tmp = var("t");
        var root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(
                builder.mkAssign(tmp, builder.mkIntegerConstant(1))))));

        var report = new StorageChecker(builder.getStorage()).check(root);
        var expected = "Missing lval-ids\n"
                + "================\n"
                + String.format("%4d  t (in t = 1;)\n", tmp.getLvalId())
                + "\nLvals without size\n"
                + "==================\n";
        assertEquals(expected, report);
    }
}
