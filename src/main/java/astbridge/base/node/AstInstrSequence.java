package astbridge.base.node;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class AstInstrSequence extends AstStmt {
    private final List<AstInstruction> instructions;

    public AstInstrSequence(int stmtId, List<AstInstruction> instructions, List<String> labels) {
        super(NodeTag.INSTRS, stmtId, labels);
        this.instructions = List.copyOf(instructions);
    }

    public List<AstInstruction> getInstructions() {
        return instructions;
    }

    @Override
    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    @Override
    public Set<String> use() {
        Set<String> result = new HashSet<>();
        instructions.forEach(i -> result.addAll(i.use()));
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new HashSet<>();
        instructions.forEach(i -> result.addAll(i.variablesUsed()));
        return result;
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new HashSet<>();
        instructions.forEach(i -> result.addAll(i.addressTaken()));
        return result;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitInstrSequence(this);
    }
}
