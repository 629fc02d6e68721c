package astbridge.analyzer;

import astbridge.base.builder.AddressSpan;
import astbridge.base.builder.TreeBuilder;
import astbridge.base.node.AstInstruction;

import java.util.List;

/**
 * One decoded instruction: where it lives and how it is lowered.
 */
public class LoweringUnit {
    public final String address;
    public final int size;
    private final InstructionLowering lowering;

    public LoweringUnit(String address, int size, InstructionLowering lowering) {
        this.address = address;
        this.size = size;
        this.lowering = lowering;
    }

    public List<AddressSpan> getSpans() {
        return List.of(new AddressSpan(address, size));
    }

    public List<AstInstruction> lower(TreeBuilder builder) {
        return lowering.lower(builder, getSpans());
    }

    @Override
    public String toString() {
        return "LoweringUnit@" + address;
    }
}
