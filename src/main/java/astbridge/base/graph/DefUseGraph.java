package astbridge.base.graph;

import astbridge.utils.Logging;
import org.jgrapht.Graph;
import org.jgrapht.graph.DirectedMultigraph;

import java.util.HashSet;
import java.util.Set;

/**
 * Directed graph over low-level instruction ids: an edge runs from a defining instruction to an instruction
 * that uses the defined value.
 * <p>
 * Built by {@code Provenance.resolve} from the address-level facts. The propagator and the reducer work on
 * lvalue ids and never read it; it is the instruction-level view handed to consumers of a reconstructed
 * function, which ask for users of a definition or definitions reaching a use.
 */
public class DefUseGraph {
    // Edge type enum
    public enum EdgeType {
        REACHING_DEF,
        FLAG_REACHING_DEF,
        DEF_USE,
        DEF_USE_HIGH
    }

    public static class DefUseEdge {
        private final EdgeType type;

        public DefUseEdge(EdgeType type) {
            this.type = type;
        }

        public EdgeType getType() {
            return type;
        }

        @Override
        public String toString() {
            return "DefUseEdge[" + type + "]";
        }
    }

    private final Graph<Integer, DefUseEdge> graph;

    public DefUseGraph() {
        this.graph = new DirectedMultigraph<>(DefUseEdge.class);
    }

    public void addEdge(int defInstrId, int useInstrId, EdgeType type) {
        graph.addVertex(defInstrId);
        graph.addVertex(useInstrId);
        for (var edge : graph.getAllEdges(defInstrId, useInstrId)) {
            if (edge.getType() == type) {
                return;
            }
        }
        graph.addEdge(defInstrId, useInstrId, new DefUseEdge(type));
        Logging.trace("DefUseGraph", String.format("Add edge: %d ---%s---> %d", defInstrId, type, useInstrId));
    }

    public boolean containsInstruction(int instrId) {
        return graph.containsVertex(instrId);
    }

    /**
     * @return ids of the instructions using a value defined by the given instruction
     */
    public Set<Integer> getUses(int defInstrId) {
        Set<Integer> result = new HashSet<>();
        if (!graph.containsVertex(defInstrId)) {
            return result;
        }
        for (var edge : graph.outgoingEdgesOf(defInstrId)) {
            result.add(graph.getEdgeTarget(edge));
        }
        return result;
    }

    /**
     * @return ids of the instructions whose definitions reach the given instruction
     */
    public Set<Integer> getDefinitions(int useInstrId) {
        Set<Integer> result = new HashSet<>();
        if (!graph.containsVertex(useInstrId)) {
            return result;
        }
        for (var edge : graph.incomingEdgesOf(useInstrId)) {
            result.add(graph.getEdgeSource(edge));
        }
        return result;
    }

    public Set<Integer> getInstructions() {
        return graph.vertexSet();
    }

    public int edgeCount() {
        return graph.edgeSet().size();
    }
}
