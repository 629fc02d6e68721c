package astbridge.base.node;

import static org.junit.jupiter.api.Assertions.*;

import astbridge.base.builder.ProgramContext;
import astbridge.base.builder.TreeBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

public class AstExprTest {
    private TreeBuilder builder;

    @BeforeEach
    public void setUp() {
        builder = new TreeBuilder(new ProgramContext());
    }

    private AstLvalExpr read(String name) {
        return builder.mkLvalExpr(builder.mkLval(builder.mkVariable(name), builder.mkNoOffset()));
    }

    @Test
    public void testIntegerConstantPrinting() {
        assertEquals("0", builder.mkIntegerConstant(0).toString());
        assertEquals("15", builder.mkIntegerConstant(15).toString());
        assertEquals("-15", builder.mkIntegerConstant(-15).toString());
        assertEquals("0x10", builder.mkIntegerConstant(16).toString());
        assertEquals("0xff", builder.mkIntegerConstant(255).toString());
        assertEquals("-0x20", builder.mkIntegerConstant(-32).toString());
        var big = builder.mkIntegerConstant(new BigInteger("ffffffffffffffff", 16), TreeBuilder.FRESH);
        assertEquals("0xffffffffffffffff", big.toString());
    }

    @Test
    public void testOperatorValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> builder.mkBinaryOp("rotl", read("a"), read("b")));
        assertThrows(IllegalArgumentException.class, () -> builder.mkUnaryOp("plus", read("a")));
        assertEquals("-a", builder.mkUnaryOp("neg", read("a")).toString());
    }

    @Test
    public void testNestedOperatorsAreParenthesized() {
        var sum = builder.mkBinaryOp("plus", read("a"), builder.mkIntegerConstant(4));
        var product = builder.mkBinaryOp("mult", sum, read("b"));
        assertEquals("(a + 4) * b", product.toString());

        var subst = builder.mkSubstitutedExpr(builder.mkLval(builder.mkVariable("c"), builder.mkNoOffset()), 1, sum);
        assertEquals("(a + 4) & 0xff", builder.mkBinaryOp("band", subst, builder.mkIntegerConstant(255)).toString());
    }

    @Test
    public void testLvalPrinting() {
        var base = builder.mkBinaryOp("plus", read("R0"), builder.mkIntegerConstant(4));
        var memref = builder.mkMemRefLval(base);
        assertEquals("*(R0 + 4)", memref.toString());
        assertTrue(memref.isMemref());
        assertFalse(memref.isSimpleVariable());

        var field = builder.mkLval(builder.mkMemRef(read("p")), builder.mkFieldOffset("next", 1,
                builder.mkNoOffset()));
        assertEquals("(*(p)).next", field.toString());

        var index = builder.mkLval(builder.mkVariable("arr"), builder.mkIndexOffset(read("i"), builder.mkNoOffset()));
        assertEquals("arr[i]", index.toString());
        assertEquals(Set.of("i"), index.addressUse());
        assertFalse(index.isSimpleVariable());
    }

    @Test
    public void testUseAndAddressTaken() {
        var target = builder.mkMemRefLval(read("p"));
        var assign = builder.mkAssign(target, builder.mkBinaryOp("plus", read("x"), read("y")));
        // the written location is not read, its address is
        assertEquals(Set.of("p", "x", "y"), assign.use());
        assertEquals(Set.of("*(p)"), assign.kill());
        assertEquals("*(p) = x + y;", assign.toString());

        var addr = builder.mkAddressOf(builder.mkLval(builder.mkVariable("buf"), builder.mkNoOffset()));
        var call = builder.mkCall(null, read("memset"), List.of(addr, builder.mkIntegerConstant(0)));
        assertEquals(Set.of("buf"), call.addressTaken());
        assertEquals("memset(&buf, 0);", call.toString());
        assertTrue(call.kill().isEmpty());
    }

    @Test
    public void testStringConstantEscaping() {
        var str = builder.mkStringConstant("a\"b\n", "0x7000");
        assertEquals("\"a\\\"b\\n\"", str.toString());
    }
}
