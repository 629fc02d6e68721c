package astbridge.base.provenance;

import static org.junit.jupiter.api.Assertions.*;

import astbridge.base.builder.AddressSpan;
import astbridge.base.builder.ProgramContext;
import astbridge.base.builder.TreeBuilder;
import astbridge.base.node.AstAssign;
import astbridge.base.node.AstCall;
import astbridge.base.node.AstLvalExpr;
import astbridge.base.node.AstStmt;
import astbridge.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

public class ProvenanceTest {
    private TreeBuilder builder;
    private Provenance provenance;
    private AstAssign def;
    private AstLvalExpr useOfX;
    private AstCall call;
    private AstStmt root;

    @BeforeEach
    public void setUp() {
        Logging.init();
        builder = new TreeBuilder(new ProgramContext());
        provenance = builder.getProvenance();

        // 0x100: x = 5;  0x104: f(x);
        def = builder.mkVarAssign("x", builder.mkIntegerConstant(5), List.of(new AddressSpan("0x100", 4)));
        useOfX = builder.mkLvalExpr(builder.mkLval(builder.mkVariable("x"), builder.mkNoOffset()));
        call = builder.mkCall(null, builder.mkLvalExpr(builder.mkGlobalLval("f", "0x2000")), List.of(useOfX),
                List.of(new AddressSpan("0x104", 4)));
        root = builder.mkBlock(List.of(builder.mkInstrSequence(List.of(def, call))));
    }

    private void resolve() {
        provenance.resolve(new AddressIndex(root, builder.getSpans()));
    }

    @Test
    public void testResolveReachingDefinitions() {
        provenance.addExprReachingDefs(useOfX.getExprId(), List.of(new RawDefinition("x", List.of("0x100"))));
        resolve();

        assertTrue(provenance.hasReachingDefs(useOfX.getExprId()));
        assertEquals(Set.of(def.getInstrId()), provenance.getReachingDefs(useOfX.getExprId()));
        assertEquals(Set.of(call.getInstrId()), provenance.getDefUseGraph().getUses(def.getInstrId()));
    }

    @Test
    public void testResolveDefUses() {
        int lvalId = def.getLhs().getLvalId();
        provenance.addLvalDefUses(lvalId, new RawUses("x", List.of("0x104")));
        provenance.addLvalDefUsesHigh(lvalId, new RawUses("x", List.of("0x104")));
        resolve();

        assertEquals(Set.of(call.getInstrId()), provenance.getLvalDefUse(lvalId).getRecorded());
        assertTrue(provenance.hasActiveLvalDefUseHigh(lvalId));
        assertEquals(2, provenance.getDefUseGraph().edgeCount());
    }

    @Test
    public void testUnmatchedLocationsAreDropped() {
        // wrong variable at the right address, and an address without instructions
        provenance.addExprReachingDefs(useOfX.getExprId(), List.of(new RawDefinition("y", List.of("0x100")),
                new RawDefinition("x", List.of("0x900"))));
        provenance.addLvalDefUsesHigh(def.getLhs().getLvalId(), new RawUses("x", List.of("0x900")));
        resolve();

        assertFalse(provenance.hasReachingDefs(useOfX.getExprId()));
        assertTrue(provenance.getReachingDefs(useOfX.getExprId()).isEmpty());
        assertFalse(provenance.hasLvalDefUseHigh(def.getLhs().getLvalId()));
        assertFalse(provenance.hasActiveLvalDefUseHigh(def.getLhs().getLvalId()));
    }

    @Test
    public void testInactivate() {
        int lvalId = def.getLhs().getLvalId();
        provenance.addLvalDefUsesHigh(lvalId, new RawUses("x", List.of("0x104")));
        resolve();

        provenance.inactivate(lvalId, call.getInstrId());
        assertFalse(provenance.hasActiveLvalDefUseHigh(lvalId));
        // the use stays recorded
        assertTrue(provenance.hasLvalDefUseHigh(lvalId));
        assertEquals(Set.of(call.getInstrId()), provenance.getLvalDefUseHigh(lvalId).getInactive());

        // unknown uses are ignored
        provenance.inactivate(lvalId, 9999);
        provenance.inactivate(9999, call.getInstrId());
        assertEquals(1, provenance.getLvalDefUseHigh(lvalId).getRecorded().size());
    }

    @Test
    public void testResolutionState() {
        assertFalse(provenance.isResolved());
        assertThrows(IllegalStateException.class, () -> provenance.hasReachingDefs(1));
        assertThrows(IllegalStateException.class, () -> provenance.getDefUseGraph());
        assertThrows(IllegalStateException.class, () -> provenance.inactivate(1, 2));

        resolve();
        assertTrue(provenance.isResolved());
        assertThrows(IllegalStateException.class, this::resolve);
        assertThrows(IllegalStateException.class,
                () -> provenance.addLvalDefUses(1, new RawUses("x", List.of("0x104"))));
    }

    @Test
    public void testIdMappings() {
        provenance.addInstructionMapping(10, 1);
        provenance.addInstructionMapping(10, 2);
        provenance.addInstructionMapping(10, 1);
        provenance.addExpressionMapping(20, 3);
        provenance.addLvalMapping(30, 4);

        assertEquals(List.of(1, 2), provenance.getInstructionsMapped(10));
        assertTrue(provenance.getInstructionsMapped(11).isEmpty());
        assertEquals(Integer.valueOf(3), provenance.getExpressionMapped(20));
        assertTrue(provenance.hasLvalMapped(30));
        assertFalse(provenance.hasLvalMapped(4));

        provenance.markExpose(4);
        provenance.markStore(5);
        assertTrue(provenance.isExposed(4));
        assertTrue(provenance.isStore(5));
        assertFalse(provenance.isStore(4));
    }

    @Test
    public void testAddressIndex() {
        var index = new AddressIndex(root, builder.getSpans());
        assertEquals(2, index.size());
        assertEquals(List.of(def.getInstrId()), index.getDefinitionsAt("0x100", "x"));
        assertTrue(index.getDefinitionsAt("0x104", "x").isEmpty());
        assertEquals(List.of(call.getInstrId()), index.getUsesAt("0x104"));
        assertEquals(Integer.valueOf(call.getInstrId()), index.getEnclosingInstruction(useOfX.getExprId()));
        assertEquals(Integer.valueOf(def.getInstrId()), index.getDefiningInstruction(def.getLhs().getLvalId()));
    }
}
