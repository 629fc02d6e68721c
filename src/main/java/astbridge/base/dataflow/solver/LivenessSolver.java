package astbridge.base.dataflow.solver;

import astbridge.base.node.AstAssign;
import astbridge.base.node.AstBlock;
import astbridge.base.node.AstBranch;
import astbridge.base.node.AstCall;
import astbridge.base.node.AstGoto;
import astbridge.base.node.AstInstrSequence;
import astbridge.base.node.AstInstruction;
import astbridge.base.node.AstLoop;
import astbridge.base.node.AstLval;
import astbridge.base.node.AstReturn;
import astbridge.base.node.AstStmt;
import astbridge.base.node.AstSwitch;
import astbridge.utils.Logging;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Backward liveness over one function tree.
 * Records the names live on exit of every statement and instruction and which of them are live.
 */
public class LivenessSolver {
    private final Map<Integer, Set<String>> liveOnExit = new HashMap<>();
    private final Set<Integer> liveStmts = new LinkedHashSet<>();
    private final Set<Integer> liveInstrs = new LinkedHashSet<>();
    private final Set<String> liveSymbols = new HashSet<>();
    private Set<String> allVariables = Set.of();

    public void solve(AstStmt root) {
        liveOnExit.clear();
        liveStmts.clear();
        liveInstrs.clear();
        liveSymbols.clear();
        allVariables = root.variablesUsed();
        solveStmt(root, Set.of());
        Logging.debug("LivenessSolver", String.format("Live instructions: %d, live symbols: %s",
                liveInstrs.size(), liveSymbols));
    }

    public Set<String> getLiveOnExit(int id) {
        return Collections.unmodifiableSet(liveOnExit.getOrDefault(id, Set.of()));
    }

    public boolean isLiveOnExit(int id, String name) {
        return liveOnExit.getOrDefault(id, Set.of()).contains(name);
    }

    public Set<Integer> getLiveStmts() {
        return Collections.unmodifiableSet(liveStmts);
    }

    public Set<Integer> getLiveInstrs() {
        return Collections.unmodifiableSet(liveInstrs);
    }

    public boolean isLiveInstr(int instrId) {
        return liveInstrs.contains(instrId);
    }

    public Set<String> getLiveSymbols() {
        return Collections.unmodifiableSet(liveSymbols);
    }

    private void recordExit(int id, Set<String> live) {
        liveOnExit.computeIfAbsent(id, k -> new HashSet<>()).addAll(live);
    }

    /**
     * @return the names live on entry of the statement
     */
    private Set<String> solveStmt(AstStmt stmt, Set<String> liveOut) {
        recordExit(stmt.getStmtId(), liveOut);
        Set<String> liveIn;
        boolean live;
        if (stmt instanceof AstBlock block) {
            liveIn = liveOut;
            live = false;
            var stmts = block.getStmts();
            for (int i = stmts.size() - 1; i >= 0; i--) {
                liveIn = solveStmt(stmts.get(i), liveIn);
                live |= liveStmts.contains(stmts.get(i).getStmtId());
            }
        } else if (stmt instanceof AstInstrSequence seq) {
            liveIn = liveOut;
            live = false;
            var instrs = seq.getInstructions();
            for (int i = instrs.size() - 1; i >= 0; i--) {
                liveIn = solveInstr(instrs.get(i), liveIn);
                live |= liveInstrs.contains(instrs.get(i).getInstrId());
            }
        } else if (stmt instanceof AstBranch branch) {
            liveIn = new HashSet<>(solveStmt(branch.getIfStmt(), liveOut));
            liveIn.addAll(solveStmt(branch.getElseStmt(), liveOut));
            liveIn.addAll(branch.getCondition().use());
            liveSymbols.addAll(branch.getCondition().variablesUsed());
            live = liveStmts.contains(branch.getIfStmt().getStmtId())
                    || liveStmts.contains(branch.getElseStmt().getStmtId());
        } else if (stmt instanceof AstLoop loop) {
            liveIn = solveLoop(loop, liveOut);
            live = liveStmts.contains(loop.getBody().getStmtId());
        } else if (stmt instanceof AstReturn ret) {
            liveIn = new HashSet<>();
            if (ret.hasReturnValue()) {
                liveIn.addAll(ret.getExpr().use());
                liveSymbols.addAll(ret.getExpr().variablesUsed());
            }
            live = true;
        } else if (stmt instanceof AstGoto) {
            liveIn = allVariables;
            live = true;
        } else if (stmt instanceof AstSwitch sw) {
            liveIn = new HashSet<>(solveStmt(sw.getCases(), allVariables));
            liveIn.addAll(sw.getSwitchExpr().use());
            liveSymbols.addAll(sw.getSwitchExpr().variablesUsed());
            live = true;
        } else {
            throw new UnsupportedOperationException("Unsupported statement: " + stmt.getTag());
        }
        if (live) {
            liveStmts.add(stmt.getStmtId());
        }
        return liveIn;
    }

    private Set<String> solveLoop(AstLoop loop, Set<String> liveOut) {
        Set<String> bodyOut = new HashSet<>(liveOut);
        Set<String> bodyIn = Set.of();
        int iterations = 0;
        while (true) {
            iterations++;
            bodyIn = solveStmt(loop.getBody(), bodyOut);
            if (bodyOut.containsAll(bodyIn)) {
                break;
            }
            bodyOut.addAll(bodyIn);
        }
        Logging.trace("LivenessSolver", String.format("Loop %d stable after %d iterations",
                loop.getStmtId(), iterations));
        Set<String> result = new HashSet<>(bodyIn);
        result.addAll(liveOut);
        return result;
    }

    private static boolean isTrivial(AstLval lval) {
        return lval.isSimpleVariable() && !lval.isGlobal();
    }

    private Set<String> solveInstr(AstInstruction instr, Set<String> liveOut) {
        recordExit(instr.getInstrId(), liveOut);
        Set<String> liveIn = new HashSet<>(liveOut);
        if (instr instanceof AstAssign assign) {
            var lhs = assign.getLhs();
            if (isTrivial(lhs)) {
                var name = lhs.toString();
                liveIn.remove(name);
                if (liveOut.contains(name)) {
                    liveIn.addAll(assign.getRhs().use());
                    markLive(instr);
                }
            } else {
                liveIn.addAll(assign.use());
                markLive(instr);
            }
        } else if (instr instanceof AstCall call) {
            if (call.hasLhs() && isTrivial(call.getLhs())) {
                liveIn.remove(call.getLhs().toString());
            }
            liveIn.addAll(call.use());
            markLive(instr);
        } else {
            throw new UnsupportedOperationException("Unsupported instruction: " + instr.getTag());
        }
        return liveIn;
    }

    private void markLive(AstInstruction instr) {
        liveInstrs.add(instr.getInstrId());
        liveSymbols.addAll(instr.variablesUsed());
    }
}
