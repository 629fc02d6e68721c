package astbridge.analyzer;

import astbridge.base.builder.TreeBuilder;
import astbridge.base.dataflow.solver.LivenessSolver;
import astbridge.base.node.AstAssign;
import astbridge.base.node.AstBlock;
import astbridge.base.node.AstBranch;
import astbridge.base.node.AstCall;
import astbridge.base.node.AstDescendVisitor;
import astbridge.base.node.AstGoto;
import astbridge.base.node.AstInstrSequence;
import astbridge.base.node.AstInstruction;
import astbridge.base.node.AstLoop;
import astbridge.base.node.AstLval;
import astbridge.base.node.AstReturn;
import astbridge.base.node.AstStmt;
import astbridge.base.node.AstSubstitutedExpr;
import astbridge.base.node.AstSwitch;
import astbridge.base.node.AstVariable;
import astbridge.base.provenance.Provenance;
import astbridge.utils.Logging;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the high-level tree from the propagated tree by dropping assignments whose value
 * is never observed and pruning the statements left empty.
 */
public class CodeReducer {
    private final TreeBuilder builder;
    private final Provenance provenance;
    private final LivenessSolver liveness;
    private final Set<Integer> substitutedLvals;
    private Set<String> variablesUsed;
    private int dropped = 0;

    public CodeReducer(TreeBuilder builder, LivenessSolver liveness, Set<Integer> substitutedLvals) {
        this.builder = builder;
        this.provenance = builder.getProvenance();
        this.liveness = liveness;
        this.substitutedLvals = substitutedLvals;
    }

    public AstStmt reduce(AstStmt root) {
        return reduce(root, liveness.getLiveSymbols());
    }

    /**
     * @param variablesUsed names the function is known to read; assignments to other locals are dropped
     */
    public AstStmt reduce(AstStmt root, Set<String> variablesUsed) {
        this.variablesUsed = variablesUsed;
        this.dropped = 0;
        inactivateDeadDefinitions(root);
        var result = reduceStmt(root);
        Logging.debug("CodeReducer", String.format("Dropped %d assignments", dropped));
        return result;
    }

    public int getDropped() {
        return dropped;
    }

    private void inactivateDeadDefinitions(AstStmt root) {
        root.accept(new AstDescendVisitor() {
            @Override
            public Void visitAssign(AstAssign instr) {
                var lhs = instr.getLhs();
                if (lhs.isSimpleVariable() && !lhs.isGlobal() && !liveness.isLiveInstr(instr.getInstrId())) {
                    var uses = provenance.getLvalDefUseHigh(lhs.getLvalId());
                    for (var use : uses.getActive()) {
                        provenance.inactivate(lhs.getLvalId(), use);
                    }
                }
                return null;
            }

            @Override
            public Void visitCall(AstCall instr) {
                return null;
            }
        });
    }

    private static String hostName(AstLval lval) {
        return lval.getHost() instanceof AstVariable var ? var.getName() : lval.toString();
    }

    private int originLvalId(AstLval lval) {
        return provenance.hasLvalMapped(lval.getLvalId())
                ? provenance.getLvalMapped(lval.getLvalId()) : lval.getLvalId();
    }

    boolean keepAssign(AstAssign assign) {
        var lhs = assign.getLhs();
        int lvalId = originLvalId(lhs);
        if (substitutedLvals.contains(lvalId)
                && !liveness.isLiveOnExit(assign.getInstrId(), lhs.toString())
                && !provenance.isExposed(lvalId)) {
            return false;
        }
        if (provenance.isStore(lvalId)) {
            return true;
        }
        if (provenance.isExposed(lvalId)) {
            return true;
        }
        if (lhs.isGlobal() || lhs.isMemref()) {
            return true;
        }
        if (!variablesUsed.contains(hostName(lhs))) {
            return false;
        }
        if (provenance.hasActiveLvalDefUseHigh(lvalId)) {
            return true;
        }
        return false;
    }

    private AstStmt reduceStmt(AstStmt stmt) {
        AstStmt result;
        if (stmt instanceof AstBlock block) {
            List<AstStmt> stmts = new ArrayList<>();
            for (var child : block.getStmts()) {
                var newChild = reduceStmt(child);
                if (!newChild.isEmpty() || newChild.hasLabels()) {
                    stmts.add(newChild);
                }
            }
            result = builder.mkBlock(stmts, block.getLabels(), TreeBuilder.FRESH);
        } else if (stmt instanceof AstInstrSequence seq) {
            List<AstInstruction> instrs = new ArrayList<>();
            for (var instr : seq.getInstructions()) {
                if (instr instanceof AstAssign assign && !keepAssign(assign)) {
                    dropped++;
                    Logging.trace("CodeReducer", "Drop " + assign);
                    continue;
                }
                instrs.add(remint(instr));
            }
            result = builder.mkInstrSequence(instrs, seq.getLabels(), TreeBuilder.FRESH);
        } else if (stmt instanceof AstBranch branch) {
            var ifStmt = reduceStmt(branch.getIfStmt());
            var elseStmt = reduceStmt(branch.getElseStmt());
            if (ifStmt.isEmpty() && elseStmt.isEmpty()) {
                result = builder.mkBlock(List.of(), branch.getLabels(), TreeBuilder.FRESH);
            } else {
                result = builder.mkBranch(branch.getCondition(), ifStmt, elseStmt, branch.getTargetAddress(),
                        branch.getLabels(), TreeBuilder.FRESH);
            }
        } else if (stmt instanceof AstLoop loop) {
            result = builder.mkLoop(reduceStmt(loop.getBody()), loop.getLabels(), TreeBuilder.FRESH);
        } else if (stmt instanceof AstReturn ret) {
            result = builder.mkReturn(ret.hasReturnValue() ? ret.getExpr() : null, ret.getLabels(),
                    TreeBuilder.FRESH);
        } else if (stmt instanceof AstGoto gt) {
            result = builder.mkGoto(gt.getDestinationLabel(), gt.getDestinationAddress(), gt.getLabels(),
                    TreeBuilder.FRESH);
        } else if (stmt instanceof AstSwitch sw) {
            result = builder.mkSwitch(sw.getSwitchExpr(), reduceStmt(sw.getCases()), sw.getLabels(),
                    TreeBuilder.FRESH);
        } else {
            throw new UnsupportedOperationException("Unsupported statement: " + stmt.getTag());
        }
        provenance.addInstructionMapping(result.getStmtId(), stmt.getStmtId());
        builder.addSpans(result.getStmtId(), builder.getSpans(stmt.getStmtId()));
        return result;
    }

    private AstLval remintLval(AstLval lval) {
        var newLval = builder.mkLval(lval.getHost(), lval.getOffset());
        provenance.addLvalMapping(newLval.getLvalId(), originLvalId(lval));
        if (builder.hasStorage(lval.getLvalId())) {
            builder.addStorage(newLval.getLvalId(), builder.getStorage(lval.getLvalId()));
        }
        return newLval;
    }

    private AstInstruction remint(AstInstruction instr) {
        AstInstruction result;
        var spans = builder.getSpans(instr.getInstrId());
        if (instr instanceof AstAssign assign) {
            result = builder.mkAssign(remintLval(assign.getLhs()), assign.getRhs(), spans);
        } else if (instr instanceof AstCall call) {
            var lhs = call.hasLhs() ? remintLval(call.getLhs()) : null;
            result = builder.mkCall(lhs, call.getTarget(), call.getArguments(), spans);
        } else {
            throw new UnsupportedOperationException("Unsupported instruction: " + instr.getTag());
        }
        provenance.addInstructionMapping(result.getInstrId(), instr.getInstrId());
        for (var assignId : substitutedAssigns(instr)) {
            provenance.addInstructionMapping(result.getInstrId(), assignId);
        }
        return result;
    }

    private static Set<Integer> substitutedAssigns(AstInstruction instr) {
        Set<Integer> result = new LinkedHashSet<>();
        instr.accept(new AstDescendVisitor() {
            @Override
            public Void visitSubstitutedExpr(AstSubstitutedExpr expr) {
                result.add(expr.getAssignId());
                return super.visitSubstitutedExpr(expr);
            }
        });
        return result;
    }
}
