package astbridge.base.node;

import java.util.List;

public class AstGoto extends AstStmt {
    private final String destinationLabel;
    private final String destinationAddress;

    public AstGoto(int stmtId, String destinationLabel, String destinationAddress, List<String> labels) {
        super(NodeTag.GOTO, stmtId, labels);
        this.destinationLabel = destinationLabel;
        this.destinationAddress = destinationAddress;
    }

    public String getDestinationLabel() {
        return destinationLabel;
    }

    public String getDestinationAddress() {
        return destinationAddress;
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitGoto(this);
    }
}
