package astbridge.base.builder;

import astbridge.base.node.AstAssign;
import astbridge.base.node.AstCall;
import astbridge.base.node.AstDescendVisitor;
import astbridge.base.node.AstLval;
import astbridge.base.node.AstStmt;

import java.util.Map;
import java.util.TreeMap;

/**
 * Finds the lvalues of a tree that have no storage record, and those whose record has no size.
 */
public class StorageChecker extends AstDescendVisitor {
    public static class Entry {
        public final String lval;
        public final String instruction;

        Entry(String lval, String instruction) {
            this.lval = lval;
            this.instruction = instruction;
        }
    }

    private final Map<Integer, Storage> storage;
    private final Map<Integer, Entry> missing = new TreeMap<>();
    private final Map<Integer, Entry> noSize = new TreeMap<>();
    private String currentInstr = null;

    public StorageChecker(Map<Integer, Storage> storage) {
        this.storage = storage;
    }

    /**
     * @return the report for {@code root}, see {@link #report()}
     */
    public String check(AstStmt root) {
        root.accept(this);
        return report();
    }

    public Map<Integer, Entry> getMissing() {
        return missing;
    }

    public Map<Integer, Entry> getNoSize() {
        return noSize;
    }

    public String report() {
        var sb = new StringBuilder();
        sb.append("Missing lval-ids\n");
        sb.append("================\n");
        missing.forEach((id, e) -> appendEntry(sb, id, e));
        sb.append("\nLvals without size\n");
        sb.append("==================\n");
        noSize.forEach((id, e) -> appendEntry(sb, id, e));
        return sb.toString();
    }

    private static void appendEntry(StringBuilder sb, int id, Entry entry) {
        sb.append(String.format("%4d  %s (in %s)\n", id, entry.lval, entry.instruction));
    }

    @Override
    public Void visitAssign(AstAssign instr) {
        currentInstr = instr.toString();
        return super.visitAssign(instr);
    }

    @Override
    public Void visitCall(AstCall instr) {
        currentInstr = instr.toString();
        // the call target is a code address, not a storage location
        if (instr.hasLhs()) {
            instr.getLhs().accept(this);
        }
        instr.getArguments().forEach(a -> a.accept(this));
        return null;
    }

    @Override
    public Void visitLval(AstLval lval) {
        super.visitLval(lval);
        var record = storage.get(lval.getLvalId());
        if (record == null) {
            missing.put(lval.getLvalId(), new Entry(lval.toString(), String.valueOf(currentInstr)));
        } else if (!record.hasSize()) {
            noSize.put(lval.getLvalId(), new Entry(lval.toString(), String.valueOf(currentInstr)));
        }
        return null;
    }
}
