package astbridge.analyzer;

import astbridge.base.builder.AddressSpan;
import astbridge.base.builder.TreeBuilder;
import astbridge.base.node.AstInstruction;

import java.util.List;

/**
 * Turns the semantics of one decoded instruction into low-level tree instructions.
 * Implementations may also record provenance facts and lowering flags through the builder.
 */
@FunctionalInterface
public interface InstructionLowering {

    /**
     * @param builder the builder of the function being reconstructed
     * @param spans the address span of the decoded instruction, to be attached to the created instructions
     * @return the created instructions in execution order
     * @throws UnsupportedOperationException if the instruction has no lowering for its operand shapes
     */
    List<AstInstruction> lower(TreeBuilder builder, List<AddressSpan> spans);
}
