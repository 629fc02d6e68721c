package astbridge.analyzer;

import astbridge.base.builder.ProgramContext;
import astbridge.base.builder.TreeBuilder;
import astbridge.base.dataflow.solver.ExprPropagator;
import astbridge.base.dataflow.solver.LivenessSolver;
import astbridge.base.node.AstInstruction;
import astbridge.base.node.AstStmt;
import astbridge.base.provenance.AddressIndex;
import astbridge.utils.Logging;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Runs the per-function pipeline: lowering, provenance resolution, value propagation,
 * liveness and code reduction.
 */
public class FunctionReconstructor {
    private final ProgramContext context;
    private int failedUnits = 0;

    public FunctionReconstructor(ProgramContext context) {
        this.context = context;
    }

    public TreeBuilder newBuilder() {
        return new TreeBuilder(context);
    }

    /**
     * @return how many lowering units failed during the last reconstruction
     */
    public int getFailedUnits() {
        return failedUnits;
    }

    public AstFunction reconstruct(String name, String address, List<LoweringUnit> units) {
        var builder = newBuilder();
        List<AstInstruction> instrs = new ArrayList<>();
        failedUnits = 0;
        for (var unit : units) {
            try {
                instrs.addAll(unit.lower(builder));
            } catch (UnsupportedOperationException | IllegalArgumentException e) {
                failedUnits++;
                Logging.error("FunctionReconstructor", String.format("Failed to lower instruction at %s in %s: %s",
                        unit.address, name, e.getMessage()));
            }
        }
        var lowRoot = builder.mkBlock(List.of(builder.mkInstrSequence(instrs)));
        return reconstruct(builder, name, address, lowRoot, null);
    }

    /**
     * @param lowRoot the low-level tree, built with {@code builder}
     * @param variablesUsed names known to be read by the function, or null to use the live symbols
     */
    public AstFunction reconstruct(TreeBuilder builder, String name, String address, AstStmt lowRoot,
                                   Set<String> variablesUsed) {
        Logging.info("FunctionReconstructor", String.format("Reconstructing %s@%s", name, address));
        var provenance = builder.getProvenance();
        provenance.resolve(new AddressIndex(lowRoot, builder.getSpans()));

        var propagator = new ExprPropagator(builder);
        var propagated = propagator.propagate(lowRoot);

        var liveness = new LivenessSolver();
        liveness.solve(propagated);

        var reducer = new CodeReducer(builder, liveness, propagator.getSubstitutedLvals());
        var high = variablesUsed == null ? reducer.reduce(propagated) : reducer.reduce(propagated, variablesUsed);

        var graph = provenance.getDefUseGraph();
        Logging.debug("FunctionReconstructor", String.format("%s: %d def-use edges over %d instructions",
                name, graph.edgeCount(), graph.getInstructions().size()));
        Logging.debug("FunctionReconstructor", String.format("%s: %d substituted definitions, %d dropped assignments",
                name, propagator.getSubstitutedLvals().size(), reducer.getDropped()));
        return new AstFunction(name, address, builder, List.of(high, propagated, lowRoot));
    }
}
