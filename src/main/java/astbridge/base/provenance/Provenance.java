package astbridge.base.provenance;

import astbridge.base.graph.DefUseGraph;
import astbridge.utils.Logging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Relation between the nodes of the trees of one function.
 * <p>
 * Id-based mappings may be added at any time. Address-based facts are collected first and turned into
 * instruction ids by a single call to {@link #resolve(AddressIndex)}; the resolved facts can only be
 * queried afterwards.
 */
public class Provenance {
    private final Map<Integer, Set<Integer>> instructionMapping = new LinkedHashMap<>();
    private final Map<Integer, Integer> expressionMapping = new LinkedHashMap<>();
    private final Map<Integer, Integer> lvalMapping = new LinkedHashMap<>();

    private final Map<Integer, List<RawDefinition>> rawReachingDefs = new LinkedHashMap<>();
    private final Map<Integer, List<RawDefinition>> rawFlagReachingDefs = new LinkedHashMap<>();
    private final Map<Integer, RawUses> rawDefUses = new LinkedHashMap<>();
    private final Map<Integer, RawUses> rawDefUsesHigh = new LinkedHashMap<>();

    private final Map<Integer, Set<Integer>> reachingDefs = new LinkedHashMap<>();
    private final Map<Integer, Set<Integer>> flagReachingDefs = new LinkedHashMap<>();
    private final Map<Integer, UseLocations> defUses = new LinkedHashMap<>();
    private final Map<Integer, UseLocations> defUsesHigh = new LinkedHashMap<>();

    private final Set<Integer> exposed = new LinkedHashSet<>();
    private final Set<Integer> stores = new LinkedHashSet<>();

    private final DefUseGraph defUseGraph = new DefUseGraph();
    private boolean resolved = false;

    // ---------------------------------------------------------------- id-based mappings

    public void addInstructionMapping(int hiId, int loId) {
        instructionMapping.computeIfAbsent(hiId, k -> new LinkedHashSet<>()).add(loId);
    }

    public void addExpressionMapping(int hiId, int loId) {
        expressionMapping.put(hiId, loId);
    }

    public void addLvalMapping(int hiId, int loId) {
        lvalMapping.put(hiId, loId);
    }

    public boolean hasInstructionMapped(int hiId) {
        return instructionMapping.containsKey(hiId);
    }

    public List<Integer> getInstructionsMapped(int hiId) {
        var result = instructionMapping.get(hiId);
        return result == null ? List.of() : List.copyOf(result);
    }

    public boolean hasExpressionMapped(int hiId) {
        return expressionMapping.containsKey(hiId);
    }

    public Integer getExpressionMapped(int hiId) {
        return expressionMapping.get(hiId);
    }

    public boolean hasLvalMapped(int hiId) {
        return lvalMapping.containsKey(hiId);
    }

    public Integer getLvalMapped(int hiId) {
        return lvalMapping.get(hiId);
    }

    public Map<Integer, Set<Integer>> getInstructionMapping() {
        return Collections.unmodifiableMap(instructionMapping);
    }

    public Map<Integer, Integer> getExpressionMapping() {
        return Collections.unmodifiableMap(expressionMapping);
    }

    public Map<Integer, Integer> getLvalMapping() {
        return Collections.unmodifiableMap(lvalMapping);
    }

    // ---------------------------------------------------------------- address-based facts

    private void checkUnresolved(String what) {
        if (resolved) {
            throw new IllegalStateException("Cannot record " + what + " after provenance is resolved");
        }
    }

    public void addExprReachingDefs(int exprId, List<RawDefinition> defs) {
        checkUnresolved("reaching definitions");
        rawReachingDefs.computeIfAbsent(exprId, k -> new ArrayList<>()).addAll(defs);
    }

    public void addFlagExprReachingDefs(int exprId, List<RawDefinition> defs) {
        checkUnresolved("flag reaching definitions");
        rawFlagReachingDefs.computeIfAbsent(exprId, k -> new ArrayList<>()).addAll(defs);
    }

    public void addLvalDefUses(int lvalId, RawUses uses) {
        checkUnresolved("def-uses");
        rawDefUses.put(lvalId, uses);
    }

    public void addLvalDefUsesHigh(int lvalId, RawUses uses) {
        checkUnresolved("def-uses-high");
        rawDefUsesHigh.put(lvalId, uses);
    }

    public Map<Integer, List<RawDefinition>> getRawReachingDefs() {
        return Collections.unmodifiableMap(rawReachingDefs);
    }

    public Map<Integer, List<RawDefinition>> getRawFlagReachingDefs() {
        return Collections.unmodifiableMap(rawFlagReachingDefs);
    }

    public Map<Integer, RawUses> getRawDefUses() {
        return Collections.unmodifiableMap(rawDefUses);
    }

    public Map<Integer, RawUses> getRawDefUsesHigh() {
        return Collections.unmodifiableMap(rawDefUsesHigh);
    }

    // ---------------------------------------------------------------- lowering flags

    /**
     * The value of this lvalue is observable outside the function and must stay visible.
     */
    public void markExpose(int lvalId) {
        exposed.add(lvalId);
    }

    /**
     * This lvalue must be materialized even if nothing reads it.
     */
    public void markStore(int lvalId) {
        stores.add(lvalId);
    }

    public boolean isExposed(int lvalId) {
        return exposed.contains(lvalId);
    }

    public boolean isStore(int lvalId) {
        return stores.contains(lvalId);
    }

    public Set<Integer> getExposed() {
        return Collections.unmodifiableSet(exposed);
    }

    public Set<Integer> getStores() {
        return Collections.unmodifiableSet(stores);
    }

    // ---------------------------------------------------------------- resolution

    public boolean isResolved() {
        return resolved;
    }

    /**
     * Turn every address-based fact into instruction ids of the tree behind the index.
     * Locations that match nothing are dropped with a warning.
     */
    public void resolve(AddressIndex index) {
        if (resolved) {
            throw new IllegalStateException("Provenance is already resolved");
        }
        resolveReachingDefs(index, rawReachingDefs, reachingDefs, DefUseGraph.EdgeType.REACHING_DEF);
        resolveReachingDefs(index, rawFlagReachingDefs, flagReachingDefs, DefUseGraph.EdgeType.FLAG_REACHING_DEF);
        resolveDefUses(index, rawDefUses, defUses, DefUseGraph.EdgeType.DEF_USE);
        resolveDefUses(index, rawDefUsesHigh, defUsesHigh, DefUseGraph.EdgeType.DEF_USE_HIGH);
        resolved = true;
        Logging.debug("Provenance", String.format("Resolved %d reaching-defs, %d def-uses, %d def-uses-high",
                reachingDefs.size(), defUses.size(), defUsesHigh.size()));
    }

    private void resolveReachingDefs(AddressIndex index, Map<Integer, List<RawDefinition>> raw,
                                     Map<Integer, Set<Integer>> target, DefUseGraph.EdgeType edgeType) {
        for (var entry : raw.entrySet()) {
            int exprId = entry.getKey();
            Set<Integer> defs = new LinkedHashSet<>();
            for (var def : entry.getValue()) {
                for (var location : def.getLocations()) {
                    var found = index.getDefinitionsAt(location, def.getVariable());
                    if (found.isEmpty()) {
                        Logging.warn("Provenance", String.format("No definition of %s at %s for expr %d",
                                def.getVariable(), location, exprId));
                        continue;
                    }
                    defs.addAll(found);
                }
            }
            if (defs.isEmpty()) {
                continue;
            }
            target.put(exprId, defs);
            var user = index.getEnclosingInstruction(exprId);
            if (user != null) {
                defs.forEach(d -> defUseGraph.addEdge(d, user, edgeType));
            }
        }
    }

    private void resolveDefUses(AddressIndex index, Map<Integer, RawUses> raw,
                                Map<Integer, UseLocations> target, DefUseGraph.EdgeType edgeType) {
        for (var entry : raw.entrySet()) {
            int lvalId = entry.getKey();
            var uses = new UseLocations();
            for (var location : entry.getValue().getLocations()) {
                var found = index.getUsesAt(location);
                if (found.isEmpty()) {
                    Logging.warn("Provenance", String.format("No use of %s at %s for lval %d",
                            entry.getValue().getVariable(), location, lvalId));
                    continue;
                }
                found.forEach(uses::add);
            }
            if (uses.isEmpty()) {
                continue;
            }
            target.put(lvalId, uses);
            var definer = index.getDefiningInstruction(lvalId);
            if (definer != null) {
                uses.getRecorded().forEach(u -> defUseGraph.addEdge(definer, u, edgeType));
            }
        }
    }

    private void checkResolved() {
        if (!resolved) {
            throw new IllegalStateException("Provenance is not resolved yet");
        }
    }

    public boolean hasReachingDefs(int exprId) {
        checkResolved();
        return reachingDefs.containsKey(exprId);
    }

    public Set<Integer> getReachingDefs(int exprId) {
        checkResolved();
        return Collections.unmodifiableSet(reachingDefs.getOrDefault(exprId, Set.of()));
    }

    public boolean hasFlagReachingDefs(int exprId) {
        checkResolved();
        return flagReachingDefs.containsKey(exprId);
    }

    public Set<Integer> getFlagReachingDefs(int exprId) {
        checkResolved();
        return Collections.unmodifiableSet(flagReachingDefs.getOrDefault(exprId, Set.of()));
    }

    public boolean hasLvalDefUse(int lvalId) {
        checkResolved();
        return defUses.containsKey(lvalId);
    }

    public UseLocations getLvalDefUse(int lvalId) {
        checkResolved();
        return defUses.getOrDefault(lvalId, new UseLocations());
    }

    public boolean hasLvalDefUseHigh(int lvalId) {
        checkResolved();
        return defUsesHigh.containsKey(lvalId);
    }

    public UseLocations getLvalDefUseHigh(int lvalId) {
        checkResolved();
        return defUsesHigh.getOrDefault(lvalId, new UseLocations());
    }

    /**
     * @return true if some recorded high-level use of the lvalue has not been inactivated
     */
    public boolean hasActiveLvalDefUseHigh(int lvalId) {
        checkResolved();
        var uses = defUsesHigh.get(lvalId);
        return uses != null && uses.hasActive();
    }

    /**
     * Suppress one high-level use of a definition. The use stays recorded.
     */
    public void inactivate(int lvalId, int useInstrId) {
        checkResolved();
        var uses = defUsesHigh.get(lvalId);
        if (uses == null || !uses.inactivate(useInstrId)) {
            Logging.warn("Provenance", String.format("No use %d recorded for lval %d", useInstrId, lvalId));
            return;
        }
        Logging.debug("Provenance", String.format("Inactivated use %d of lval %d", useInstrId, lvalId));
    }

    public Map<Integer, Set<Integer>> getReachingDefs() {
        checkResolved();
        return Collections.unmodifiableMap(reachingDefs);
    }

    public Map<Integer, Set<Integer>> getFlagReachingDefs() {
        checkResolved();
        return Collections.unmodifiableMap(flagReachingDefs);
    }

    public Map<Integer, UseLocations> getDefUses() {
        checkResolved();
        return Collections.unmodifiableMap(defUses);
    }

    public Map<Integer, UseLocations> getDefUsesHigh() {
        checkResolved();
        return Collections.unmodifiableMap(defUsesHigh);
    }

    public DefUseGraph getDefUseGraph() {
        checkResolved();
        return defUseGraph;
    }
}
