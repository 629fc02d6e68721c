package astbridge.base.dataflow.solver;

import astbridge.base.builder.TreeBuilder;
import astbridge.base.dataflow.UseDef;
import astbridge.base.node.AstAddressOf;
import astbridge.base.node.AstAssign;
import astbridge.base.node.AstBinaryOp;
import astbridge.base.node.AstBlock;
import astbridge.base.node.AstBranch;
import astbridge.base.node.AstCall;
import astbridge.base.node.AstCastExpr;
import astbridge.base.node.AstDescendVisitor;
import astbridge.base.node.AstExpr;
import astbridge.base.node.AstFieldOffset;
import astbridge.base.node.AstGoto;
import astbridge.base.node.AstIndexOffset;
import astbridge.base.node.AstInstrSequence;
import astbridge.base.node.AstInstruction;
import astbridge.base.node.AstLoop;
import astbridge.base.node.AstLval;
import astbridge.base.node.AstLvalExpr;
import astbridge.base.node.AstMemRef;
import astbridge.base.node.AstOffset;
import astbridge.base.node.AstQuestion;
import astbridge.base.node.AstReturn;
import astbridge.base.node.AstStmt;
import astbridge.base.node.AstSwitch;
import astbridge.base.node.AstUnaryOp;
import astbridge.base.provenance.Provenance;
import astbridge.utils.Logging;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Forward value propagation over one function tree.
 * <p>
 * Reads of plain variables whose defining expression is still valid are replaced by substituted
 * expressions. The result is a new tree sharing every unchanged subtree with the input; statement and
 * instruction ids are kept, rewritten expressions and lvalues get fresh ids mapped back to the originals.
 */
public class ExprPropagator {
    private final TreeBuilder builder;
    private final Provenance provenance;
    private final Set<Integer> substitutedLvals = new LinkedHashSet<>();
    private final Set<Integer> substitutedAssigns = new LinkedHashSet<>();
    private Set<String> addressTaken = Set.of();
    private UseDef state = UseDef.empty();
    private int substitutions = 0;

    public ExprPropagator(TreeBuilder builder) {
        this.builder = builder;
        this.provenance = builder.getProvenance();
    }

    public AstStmt propagate(AstStmt root) {
        addressTaken = root.addressTaken();
        state = UseDef.empty();
        var result = propagateStmt(root);
        Logging.debug("ExprPropagator", String.format("Performed %d substitutions", substitutions));
        return result;
    }

    /**
     * @return ids of the defining lvalues whose value was substituted into some later read
     */
    public Set<Integer> getSubstitutedLvals() {
        return substitutedLvals;
    }

    /**
     * @return ids of the assignments whose value was substituted into some later read
     */
    public Set<Integer> getSubstitutedAssigns() {
        return substitutedAssigns;
    }

    public UseDef getState() {
        return state;
    }

    private AstStmt propagateStmt(AstStmt stmt) {
        if (stmt.hasLabels()) {
            state = UseDef.empty();
        }
        if (stmt instanceof AstBlock block) {
            return propagateBlock(block);
        } else if (stmt instanceof AstInstrSequence seq) {
            return propagateInstrSequence(seq);
        } else if (stmt instanceof AstBranch branch) {
            return propagateBranch(branch);
        } else if (stmt instanceof AstLoop loop) {
            return propagateLoop(loop);
        } else if (stmt instanceof AstReturn ret) {
            if (!ret.hasReturnValue()) {
                return ret;
            }
            var expr = propagateExpr(ret.getExpr());
            return expr == ret.getExpr() ? ret : new AstReturn(ret.getStmtId(), expr, ret.getLabels());
        } else if (stmt instanceof AstGoto) {
            state = UseDef.empty();
            return stmt;
        } else if (stmt instanceof AstSwitch sw) {
            var expr = propagateExpr(sw.getSwitchExpr());
            var cases = propagateStmt(sw.getCases());
            state = UseDef.empty();
            return expr == sw.getSwitchExpr() && cases == sw.getCases() ? sw
                    : new AstSwitch(sw.getStmtId(), expr, cases, sw.getLabels());
        }
        throw new UnsupportedOperationException("Unsupported statement: " + stmt.getTag());
    }

    private AstStmt propagateBlock(AstBlock block) {
        List<AstStmt> stmts = new ArrayList<>();
        boolean changed = false;
        for (var child : block.getStmts()) {
            var newChild = propagateStmt(child);
            changed |= newChild != child;
            stmts.add(newChild);
        }
        return changed ? new AstBlock(block.getStmtId(), stmts, block.getLabels()) : block;
    }

    private AstStmt propagateInstrSequence(AstInstrSequence seq) {
        List<AstInstruction> instrs = new ArrayList<>();
        boolean changed = false;
        for (var instr : seq.getInstructions()) {
            var newInstr = propagateInstr(instr);
            changed |= newInstr != instr;
            instrs.add(newInstr);
        }
        return changed ? new AstInstrSequence(seq.getStmtId(), instrs, seq.getLabels()) : seq;
    }

    private AstStmt propagateBranch(AstBranch branch) {
        var cond = propagateExpr(branch.getCondition());
        var entry = state;
        var ifStmt = propagateStmt(branch.getIfStmt());
        var ifState = state;
        state = entry;
        var elseStmt = propagateStmt(branch.getElseStmt());
        state = ifState.join(state);
        if (cond == branch.getCondition() && ifStmt == branch.getIfStmt() && elseStmt == branch.getElseStmt()) {
            return branch;
        }
        return new AstBranch(branch.getStmtId(), cond, ifStmt, elseStmt, branch.getTargetAddress(),
                branch.getLabels());
    }

    private AstStmt propagateLoop(AstLoop loop) {
        var entry = loopEntryState(loop.getBody());
        state = entry;
        var body = propagateStmt(loop.getBody());
        state = entry.join(state);
        return body == loop.getBody() ? loop : new AstLoop(loop.getStmtId(), body, loop.getLabels());
    }

    /**
     * The state that holds on every iteration: nothing the body may overwrite survives, directly or through
     * a value that reads it.
     */
    private UseDef loopEntryState(AstStmt body) {
        Set<String> defined = new HashSet<>();
        var effects = new AstDescendVisitor() {
            boolean writesMemory = false;
            boolean hasCall = false;

            @Override
            public Void visitAssign(AstAssign instr) {
                defined.addAll(instr.kill());
                writesMemory |= instr.getLhs().isMemref();
                return null;
            }

            @Override
            public Void visitCall(AstCall instr) {
                defined.addAll(instr.kill());
                hasCall = true;
                writesMemory |= instr.hasLhs() && instr.getLhs().isMemref();
                return null;
            }
        };
        body.accept(effects);
        if (effects.hasCall) {
            defined.addAll(addressTaken);
        }
        var entry = state.without(defined);
        return effects.writesMemory ? entry.killMemoryReads() : entry;
    }

    private AstInstruction propagateInstr(AstInstruction instr) {
        if (instr instanceof AstAssign assign) {
            var rhs = propagateExpr(assign.getRhs());
            var lhs = propagateLvalAddress(assign.getLhs());
            state = state.applyAssign(assign.getInstrId(), lhs, rhs);
            if (rhs == assign.getRhs() && lhs == assign.getLhs()) {
                return assign;
            }
            return new AstAssign(assign.getInstrId(), lhs, rhs);
        } else if (instr instanceof AstCall call) {
            var target = propagateExpr(call.getTarget());
            List<AstExpr> args = new ArrayList<>();
            boolean changed = target != call.getTarget();
            for (var arg : call.getArguments()) {
                var newArg = propagateExpr(arg);
                changed |= newArg != arg;
                args.add(newArg);
            }
            var lhs = call.hasLhs() ? propagateLvalAddress(call.getLhs()) : null;
            changed |= lhs != call.getLhs();
            Set<String> kill = new HashSet<>(call.kill());
            kill.addAll(addressTaken);
            state = state.applyCall(kill);
            return changed ? new AstCall(call.getInstrId(), lhs, target, args) : call;
        }
        throw new UnsupportedOperationException("Unsupported instruction: " + instr.getTag());
    }

    private boolean isBlocked(AstLval defLval) {
        int lvalId = defLval.getLvalId();
        return provenance.hasActiveLvalDefUseHigh(lvalId)
                || provenance.isExposed(lvalId)
                || provenance.isStore(lvalId);
    }

    private AstExpr propagateExpr(AstExpr expr) {
        if (expr instanceof AstLvalExpr lvalExpr) {
            var lval = lvalExpr.getLval();
            if (lval.isSimpleVariable()) {
                var name = lval.toString();
                var def = state.get(name);
                if (def == null || def.expr.use().contains(name) || isBlocked(def.lval)) {
                    return expr;
                }
                var subst = builder.mkSubstitutedExpr(lval, def.instrId, def.expr);
                provenance.addExpressionMapping(subst.getExprId(), expr.getExprId());
                substitutedLvals.add(def.lval.getLvalId());
                substitutedAssigns.add(def.instrId);
                substitutions++;
                Logging.trace("ExprPropagator", String.format("Substitute %s with %s from %d",
                        name, def.expr, def.instrId));
                return subst;
            }
            var newLval = propagateLvalAddress(lval);
            return newLval == lval ? expr : mapped(builder.mkLvalExpr(newLval), expr);
        } else if (expr instanceof AstCastExpr cast) {
            var inner = propagateExpr(cast.getExpr());
            return inner == cast.getExpr() ? expr : mapped(builder.mkCastExpr(cast.getCastType(), inner), expr);
        } else if (expr instanceof AstUnaryOp unop) {
            var inner = propagateExpr(unop.getExpr());
            return inner == unop.getExpr() ? expr : mapped(builder.mkUnaryOp(unop.getOp(), inner), expr);
        } else if (expr instanceof AstBinaryOp binop) {
            var left = propagateExpr(binop.getLeft());
            var right = propagateExpr(binop.getRight());
            if (left == binop.getLeft() && right == binop.getRight()) {
                return expr;
            }
            return mapped(builder.mkBinaryOp(binop.getOp(), left, right), expr);
        } else if (expr instanceof AstQuestion question) {
            var cond = propagateExpr(question.getCondition());
            var t = propagateExpr(question.getTrueExpr());
            var f = propagateExpr(question.getFalseExpr());
            if (cond == question.getCondition() && t == question.getTrueExpr() && f == question.getFalseExpr()) {
                return expr;
            }
            return mapped(builder.mkQuestion(cond, t, f), expr);
        } else if (expr instanceof AstAddressOf addressOf) {
            var newLval = propagateLvalAddress(addressOf.getLval());
            return newLval == addressOf.getLval() ? expr : mapped(builder.mkAddressOf(newLval), expr);
        }
        // constants, sizeof and already substituted expressions
        return expr;
    }

    private AstExpr mapped(AstExpr newExpr, AstExpr original) {
        provenance.addExpressionMapping(newExpr.getExprId(), original.getExprId());
        return newExpr;
    }

    /**
     * Propagate into the expressions that compute the location, never into the written variable itself.
     */
    private AstLval propagateLvalAddress(AstLval lval) {
        var host = lval.getHost();
        if (host instanceof AstMemRef memref) {
            var memExp = propagateExpr(memref.getMemExp());
            if (memExp != memref.getMemExp()) {
                host = builder.mkMemRef(memExp);
            }
        }
        var offset = propagateOffset(lval.getOffset());
        if (host == lval.getHost() && offset == lval.getOffset()) {
            return lval;
        }
        var newLval = builder.mkLval(host, offset);
        provenance.addLvalMapping(newLval.getLvalId(), lval.getLvalId());
        if (builder.hasStorage(lval.getLvalId())) {
            builder.addStorage(newLval.getLvalId(), builder.getStorage(lval.getLvalId()));
        }
        return newLval;
    }

    private AstOffset propagateOffset(AstOffset offset) {
        if (offset instanceof AstFieldOffset field) {
            var sub = propagateOffset(field.getSubOffset());
            return sub == field.getSubOffset() ? offset
                    : builder.mkFieldOffset(field.getFieldName(), field.getCompKey(), sub);
        } else if (offset instanceof AstIndexOffset index) {
            var indexExpr = propagateExpr(index.getIndexExpr());
            var sub = propagateOffset(index.getSubOffset());
            return indexExpr == index.getIndexExpr() && sub == index.getSubOffset() ? offset
                    : builder.mkIndexOffset(indexExpr, sub);
        }
        return offset;
    }
}
