package astbridge.base.graph;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import java.util.Set;

public class DefUseGraphTest {
    @Test
    public void testDuplicateEdgesAreSuppressed() {
        var graph = new DefUseGraph();
        graph.addEdge(1, 3, DefUseGraph.EdgeType.REACHING_DEF);
        graph.addEdge(1, 3, DefUseGraph.EdgeType.REACHING_DEF);
        graph.addEdge(1, 3, DefUseGraph.EdgeType.DEF_USE);
        graph.addEdge(2, 3, DefUseGraph.EdgeType.FLAG_REACHING_DEF);

        assertEquals(3, graph.edgeCount());
        assertEquals(Set.of(3), graph.getUses(1));
        assertEquals(Set.of(1, 2), graph.getDefinitions(3));
        assertEquals(Set.of(1, 2, 3), graph.getInstructions());
        assertTrue(graph.containsInstruction(2));
        assertTrue(graph.getUses(42).isEmpty());
        assertTrue(graph.getDefinitions(42).isEmpty());
    }
}
