package astbridge.base.node;

import java.util.Set;

public abstract class AstInstruction extends AstNode {
    private final int instrId;

    protected AstInstruction(NodeTag tag, int instrId) {
        super(tag);
        this.instrId = instrId;
    }

    public int getInstrId() {
        return instrId;
    }

    /**
     * @return the lvalue written by this instruction, or null if it writes nothing
     */
    public abstract AstLval define();

    /**
     * Names whose current value no longer holds after this instruction.
     */
    public abstract Set<String> kill();
}
