package astbridge.base.provenance;

import astbridge.base.builder.AddressSpan;
import astbridge.base.node.AstAssign;
import astbridge.base.node.AstCall;
import astbridge.base.node.AstDescendVisitor;
import astbridge.base.node.AstExpr;
import astbridge.base.node.AstInstruction;
import astbridge.base.node.AstIntegerConstant;
import astbridge.base.node.AstLvalExpr;
import astbridge.base.node.AstStmt;
import astbridge.base.node.AstStringConstant;
import astbridge.base.node.AstSubstitutedExpr;
import astbridge.base.node.AstAddressOf;
import astbridge.base.node.AstBinaryOp;
import astbridge.base.node.AstCastExpr;
import astbridge.base.node.AstQuestion;
import astbridge.base.node.AstSizeOf;
import astbridge.base.node.AstUnaryOp;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup from instruction addresses to the instructions of one tree that were lowered from them.
 * Only instructions with a recorded address span are indexed.
 */
public class AddressIndex {
    private final Map<String, List<AstInstruction>> instructionsAt = new LinkedHashMap<>();
    private final Map<Integer, Integer> exprToInstr = new HashMap<>();
    private final Map<Integer, Integer> lvalToDefiningInstr = new HashMap<>();

    public AddressIndex(AstStmt root, Map<Integer, List<AddressSpan>> spans) {
        root.accept(new Indexer(spans));
    }

    private class Indexer extends AstDescendVisitor {
        private final Map<Integer, List<AddressSpan>> spans;
        private AstInstruction current;

        Indexer(Map<Integer, List<AddressSpan>> spans) {
            this.spans = spans;
        }

        private Void enter(AstInstruction instr, Runnable descend) {
            var instrSpans = spans.get(instr.getInstrId());
            if (instrSpans != null) {
                for (var span : instrSpans) {
                    instructionsAt.computeIfAbsent(span.getBaseVa(), k -> new ArrayList<>()).add(instr);
                }
            }
            if (instr.define() != null) {
                lvalToDefiningInstr.put(instr.define().getLvalId(), instr.getInstrId());
            }
            current = instr;
            descend.run();
            current = null;
            return null;
        }

        private void record(AstExpr expr) {
            if (current != null) {
                exprToInstr.putIfAbsent(expr.getExprId(), current.getInstrId());
            }
        }

        @Override
        public Void visitAssign(AstAssign instr) {
            return enter(instr, () -> super.visitAssign(instr));
        }

        @Override
        public Void visitCall(AstCall instr) {
            return enter(instr, () -> super.visitCall(instr));
        }

        @Override
        public Void visitIntegerConstant(AstIntegerConstant expr) {
            record(expr);
            return null;
        }

        @Override
        public Void visitStringConstant(AstStringConstant expr) {
            record(expr);
            return null;
        }

        @Override
        public Void visitSizeOf(AstSizeOf expr) {
            record(expr);
            return null;
        }

        @Override
        public Void visitLvalExpr(AstLvalExpr expr) {
            record(expr);
            return super.visitLvalExpr(expr);
        }

        @Override
        public Void visitCastExpr(AstCastExpr expr) {
            record(expr);
            return super.visitCastExpr(expr);
        }

        @Override
        public Void visitUnaryOp(AstUnaryOp expr) {
            record(expr);
            return super.visitUnaryOp(expr);
        }

        @Override
        public Void visitBinaryOp(AstBinaryOp expr) {
            record(expr);
            return super.visitBinaryOp(expr);
        }

        @Override
        public Void visitQuestion(AstQuestion expr) {
            record(expr);
            return super.visitQuestion(expr);
        }

        @Override
        public Void visitAddressOf(AstAddressOf expr) {
            record(expr);
            return super.visitAddressOf(expr);
        }

        @Override
        public Void visitSubstitutedExpr(AstSubstitutedExpr expr) {
            record(expr);
            return super.visitSubstitutedExpr(expr);
        }
    }

    public List<AstInstruction> getInstructionsAt(String address) {
        return instructionsAt.getOrDefault(address, List.of());
    }

    /**
     * @return ids of the instructions at the address that write the named variable
     */
    public List<Integer> getDefinitionsAt(String address, String variable) {
        List<Integer> result = new ArrayList<>();
        for (var instr : getInstructionsAt(address)) {
            var lhs = instr.define();
            if (lhs != null && lhs.toString().equals(variable)) {
                result.add(instr.getInstrId());
            }
        }
        return result;
    }

    public List<Integer> getUsesAt(String address) {
        List<Integer> result = new ArrayList<>();
        for (var instr : getInstructionsAt(address)) {
            result.add(instr.getInstrId());
        }
        return result;
    }

    /**
     * @return id of the instruction containing the expression, or null if it is not in the tree
     */
    public Integer getEnclosingInstruction(int exprId) {
        return exprToInstr.get(exprId);
    }

    public Integer getDefiningInstruction(int lvalId) {
        return lvalToDefiningInstr.get(lvalId);
    }

    public int size() {
        return instructionsAt.size();
    }
}
