package astbridge.analyzer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import astbridge.base.builder.ProgramContext;
import astbridge.base.builder.TreeBuilder;
import astbridge.base.node.AstBlock;
import astbridge.base.node.AstExpr;
import astbridge.base.node.AstInstrSequence;
import astbridge.base.node.AstInstruction;
import astbridge.base.provenance.RawUses;
import astbridge.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

@ExtendWith(MockitoExtension.class)
public class FunctionReconstructorTest {
    @Mock
    private InstructionLowering unsupportedLowering;

    private FunctionReconstructor reconstructor;

    @BeforeEach
    public void setUp() {
        Logging.init();
        reconstructor = new FunctionReconstructor(new ProgramContext());
    }

    private static AstExpr read(TreeBuilder b, String name) {
        return b.mkLvalExpr(b.mkLval(b.mkVariable(name), b.mkNoOffset()));
    }

    /**
     * t := R0 + 4; R1 := *(t); R1 := R1 & 0xff
     */
    private static List<LoweringUnit> maskedLoad(int[] maskLvalId, String highUseAddress) {
        List<LoweringUnit> units = new ArrayList<>();
        units.add(new LoweringUnit("0x1000", 4, (b, spans) -> List.of(b.mkVarAssign("t",
                b.mkBinaryOp("plus", b.mkLvalExpr(b.mkRegisterLval("R0")), b.mkIntegerConstant(4)), spans))));
        units.add(new LoweringUnit("0x1004", 4, (b, spans) -> List.of(b.mkAssign(b.mkRegisterLval("R1"),
                b.mkLvalExpr(b.mkMemRefLval(read(b, "t"))), spans))));
        units.add(new LoweringUnit("0x1008", 4, (b, spans) -> {
            var lhs = b.mkRegisterLval("R1");
            maskLvalId[0] = lhs.getLvalId();
            if (highUseAddress != null) {
                b.getProvenance().addLvalDefUsesHigh(lhs.getLvalId(), new RawUses("R1", List.of(highUseAddress)));
            }
            return List.of(b.mkAssign(lhs, b.mkBinaryOp("band", b.mkLvalExpr(b.mkRegisterLval("R1")),
                    b.mkIntegerConstant(0xff)), spans));
        }));
        return units;
    }

    private static List<AstInstruction> highInstructions(AstFunction function) {
        var high = (AstBlock) function.getHighLevelTree();
        if (high.getStmts().isEmpty()) {
            return List.of();
        }
        return ((AstInstrSequence) high.getStmts().get(0)).getInstructions();
    }

    @Test
    public void testUnobservedValuesAreDropped() {
        var function = reconstructor.reconstruct("masked_load", "0x1000", maskedLoad(new int[1], null));

        assertEquals(3, function.getRoots().size());
        assertTrue(function.getHighLevelTree().isEmpty());
        assertTrue(highInstructions(function).isEmpty());
        var low = (AstInstrSequence) ((AstBlock) function.getLowLevelTree()).getStmts().get(0);
        assertEquals(3, low.getInstructions().size());
        assertEquals(0, reconstructor.getFailedUnits());
    }

    @Test
    public void testObservedValueIsReconstructed() {
        int[] maskLvalId = new int[1];
        var units = maskedLoad(maskLvalId, "0x100c");
        units.add(new LoweringUnit("0x100c", 4, (b, spans) -> List.of(b.mkCall(null,
                b.mkLvalExpr(b.mkGlobalLval("f", "0x2000")), List.of(b.mkLvalExpr(b.mkRegisterLval("R1"))),
                spans))));
        var function = reconstructor.reconstruct("masked_load", "0x1000", units);

        var instrs = highInstructions(function);
        assertEquals(2, instrs.size());
        assertEquals("R1 = *(R0 + 4) & 0xff;", instrs.get(0).toString());
        assertEquals("f(R1);", instrs.get(1).toString());
        assertEquals("{\n  R1 = *(R0 + 4) & 0xff;\n  f(R1);\n}\n", CPrettyPrinter.print(function.getHighLevelTree()));

        // the kept assignment stands for the whole low-level sequence
        var provenance = function.getBuilder().getProvenance();
        var low = ((AstInstrSequence) ((AstBlock) function.getLowLevelTree()).getStmts().get(0)).getInstructions();
        var mapped = provenance.getInstructionsMapped(instrs.get(0).getInstrId());
        assertTrue(mapped.containsAll(List.of(low.get(0).getInstrId(), low.get(1).getInstrId(),
                low.get(2).getInstrId())));
        var highLval = instrs.get(0).define().getLvalId();
        assertEquals(Integer.valueOf(maskLvalId[0]), provenance.getLvalMapped(highLval));
        assertTrue(function.getBuilder().getSpans(instrs.get(0).getInstrId()).size() > 0);

        // the high-level use of the mask reaches the call in the instruction graph
        var graph = provenance.getDefUseGraph();
        assertTrue(graph.getUses(low.get(2).getInstrId()).contains(low.get(3).getInstrId()));
        assertTrue(graph.getDefinitions(low.get(3).getInstrId()).contains(low.get(2).getInstrId()));
    }

    @Test
    public void testDeadDefinitionLosesHighLevelUses() {
        int[] tLvalId = new int[1];
        List<LoweringUnit> units = List.of(
                new LoweringUnit("0x2000", 2, (b, spans) -> {
                    var lhs = b.mkLval(b.mkVariable("t"), b.mkNoOffset());
                    tLvalId[0] = lhs.getLvalId();
                    b.getProvenance().addLvalDefUsesHigh(lhs.getLvalId(), new RawUses("t", List.of("0x2002")));
                    return List.of(b.mkAssign(lhs, b.mkLvalExpr(b.mkRegisterLval("R0")), spans));
                }),
                new LoweringUnit("0x2002", 2, (b, spans) -> List.of(b.mkAssign(b.mkRegisterLval("R2"),
                        b.mkIntegerConstant(1), spans))));
        var function = reconstructor.reconstruct("dead", "0x2000", units);

        var provenance = function.getBuilder().getProvenance();
        assertTrue(provenance.hasLvalDefUseHigh(tLvalId[0]));
        assertFalse(provenance.hasActiveLvalDefUseHigh(tLvalId[0]));
        assertEquals(1, provenance.getLvalDefUseHigh(tLvalId[0]).getInactive().size());
        assertTrue(function.getHighLevelTree().isEmpty());
    }

    @Test
    public void testFailedLoweringIsSkipped() {
        when(unsupportedLowering.lower(any(), any())).thenThrow(new UnsupportedOperationException("rep movsb"));
        List<LoweringUnit> units = List.of(
                new LoweringUnit("0x3000", 4, (b, spans) -> List.of(b.mkAssign(b.mkGlobalLval("g", "0x8000"),
                        b.mkIntegerConstant(1), spans))),
                new LoweringUnit("0x3004", 2, unsupportedLowering));
        var function = reconstructor.reconstruct("partial", "0x3000", units);

        assertEquals(1, reconstructor.getFailedUnits());
        verify(unsupportedLowering).lower(any(TreeBuilder.class), any());
        assertEquals(List.of("g = 1;"), highInstructions(function).stream().map(Object::toString).toList());
    }

    @Test
    public void testFunctionNeedsTwoTrees() {
        var builder = reconstructor.newBuilder();
        var root = builder.mkBlock(List.of());
        assertThrows(IllegalArgumentException.class, () -> new AstFunction("f", "0x0", builder, List.of(root)));
    }
}
