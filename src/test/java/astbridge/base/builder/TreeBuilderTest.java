package astbridge.base.builder;

import static org.junit.jupiter.api.Assertions.*;

import astbridge.base.node.AstVariable;
import astbridge.base.type.TypInt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

public class TreeBuilderTest {
    private ProgramContext context;
    private TreeBuilder builder;

    @BeforeEach
    public void setUp() {
        context = new ProgramContext();
        builder = new TreeBuilder(context);
    }

    @Test
    public void testStatementsAndInstructionsShareIds() {
        var assign = builder.mkVarAssign("x", builder.mkIntegerConstant(1), List.of());
        var seq = builder.mkInstrSequence(List.of(assign));
        var block = builder.mkBlock(List.of(seq));

        assertEquals(assign.getInstrId() + 1, seq.getStmtId());
        assertEquals(seq.getStmtId() + 1, block.getStmtId());
    }

    @Test
    public void testExplicitIdsReserveCounter() {
        var constant = builder.mkIntegerConstant(BigInteger.ONE, 100);
        assertEquals(100, constant.getExprId());
        assertTrue(builder.mkIntegerConstant(2).getExprId() > 100);

        builder.mkBlock(List.of(), List.of(), 40);
        assertTrue(builder.mkReturn(null).getStmtId() > 40);

        // a lower explicit id does not move the counter back
        var lval = builder.mkTmpLval("t", 50);
        builder.mkTmpLval("u", 3);
        assertTrue(builder.mkTmpLval().getLvalId() > lval.getLvalId());
    }

    @Test
    public void testBuildersShareProgramContext() {
        var other = new TreeBuilder(context);
        var a = builder.mkIntegerConstant(1);
        var b = other.mkIntegerConstant(1);
        assertNotEquals(a.getExprId(), b.getExprId());
        assertNotSame(builder.getSymbolTable(), other.getSymbolTable());
        assertSame(builder.getSymbolTable().getGlobalTable(), other.getSymbolTable().getGlobalTable());
    }

    @Test
    public void testStorageLvals() {
        var reg = builder.mkRegisterLval("R0");
        assertEquals("R0", reg.toString());
        assertEquals(Storage.Kind.REGISTER, builder.getStorage(reg.getLvalId()).getKind());

        var local = builder.mkStackLval(-8);
        var arg = builder.mkStackLval(4);
        assertEquals("localvar_8", local.toString());
        assertEquals("argvar_4", arg.toString());
        assertEquals(Integer.valueOf(-8), builder.getStorage(local.getLvalId()).getOffset());

        var global = builder.mkGlobalLval("errno", "0x6000");
        assertTrue(global.isGlobal());
        assertEquals("0x6000", builder.getStorage(global.getLvalId()).getAddress());
        assertTrue(context.getGlobalSymbolTable().hasSymbolAtAddress("0x6000"));

        var tmp = builder.mkTmpLval();
        assertEquals("__asttmp_0__", tmp.toString());
        assertFalse(builder.hasStorage(tmp.getLvalId()));
        assertEquals("__asttmp_1__", builder.mkTmpLval().toString());

        var param = builder.mkRegisterLval("arg0", "RDI", new TypInt("iint"), 0, TreeBuilder.FRESH);
        var vinfo = ((AstVariable) param.getHost()).getVarInfo();
        assertTrue(vinfo.isParameter());
        assertEquals(1, builder.getSymbolTable().getFormals().size());
    }

    @Test
    public void testSpansAreDeduplicated() {
        var span = new AddressSpan("0x1000", 4);
        var assign = builder.mkVarAssign("x", builder.mkIntegerConstant(0), List.of(span));
        builder.addSpans(assign.getInstrId(), List.of(new AddressSpan("0x1000", 4), new AddressSpan("0x1004", 2)));

        assertEquals(List.of(span, new AddressSpan("0x1004", 2)), builder.getSpans(assign.getInstrId()));
        assertTrue(builder.getSpans(12345).isEmpty());
    }

    @Test
    public void testLvalFromExpr() {
        var lval = builder.mkRegisterLval("R3");
        assertSame(lval, builder.mkLvalFromExpr(builder.mkLvalExpr(lval)));

        var subst = builder.mkSubstitutedExpr(lval, 7, builder.mkIntegerConstant(3));
        assertSame(lval, builder.mkLvalFromExpr(subst));

        assertThrows(UnsupportedOperationException.class,
                () -> builder.mkLvalFromExpr(builder.mkIntegerConstant(3)));
    }

    @Test
    public void testTypeDefinitionsAreReferenced() {
        builder.mkCompInfo("node", 9, false, List.of(builder.mkFieldInfo("next", builder.mkPointerType(
                builder.mkCompType("node", 9)), 9, 0)));
        var globals = context.getGlobalSymbolTable();
        assertTrue(globals.hasCompInfo(9));
        assertEquals(1, globals.getReferencedCompInfos().size());
    }

    @Test
    public void testStorageKindWireNames() {
        assertEquals(Storage.Kind.STACK, Storage.Kind.fromWireName("stack"));
        assertEquals("reg", Storage.Kind.REGISTER.getWireName());
        assertThrows(IllegalArgumentException.class, () -> Storage.Kind.fromWireName("heap"));
    }
}
