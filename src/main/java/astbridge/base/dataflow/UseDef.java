package astbridge.base.dataflow;

import astbridge.base.node.AstExpr;
import astbridge.base.node.AstLval;
import astbridge.base.node.AstLvalExpr;
import astbridge.base.node.AstDescendVisitor;
import astbridge.base.node.AstMemRef;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable propagation state: for each variable name, the instruction, lvalue and expression
 * that currently define its value.
 */
public class UseDef {
    private static final UseDef EMPTY = new UseDef(Map.of());

    public static class Definition {
        public final int instrId;
        public final AstLval lval;
        public final AstExpr expr;

        public Definition(int instrId, AstLval lval, AstExpr expr) {
            this.instrId = instrId;
            this.lval = lval;
            this.expr = expr;
        }

        boolean mentions(String name) {
            return lval.use().contains(name) || expr.use().contains(name);
        }

        @Override
        public String toString() {
            return lval + " := " + expr + " @" + instrId;
        }
    }

    private final Map<String, Definition> defs;

    private UseDef(Map<String, Definition> defs) {
        this.defs = Collections.unmodifiableMap(defs);
    }

    public static UseDef empty() {
        return EMPTY;
    }

    public boolean has(String name) {
        return defs.containsKey(name);
    }

    public Definition get(String name) {
        return defs.get(name);
    }

    public Set<String> names() {
        return defs.keySet();
    }

    public boolean isEmpty() {
        return defs.isEmpty();
    }

    /**
     * State after {@code lval := rhs}, where rhs has already been propagated.
     */
    public UseDef applyAssign(int instrId, AstLval lval, AstExpr rhs) {
        if (!lval.isSimpleVariable()) {
            return lval.isMemref() ? killMemoryReads() : this;
        }
        var kill = lval.toString();
        Map<String, Definition> result = new LinkedHashMap<>();
        for (var entry : defs.entrySet()) {
            if (!entry.getKey().equals(kill) && !entry.getValue().mentions(kill)) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        if (!rhs.use().contains(kill)) {
            result.put(kill, new Definition(instrId, lval, rhs));
        }
        return new UseDef(result);
    }

    /**
     * State after a call that may overwrite every name in {@code kill}.
     */
    public UseDef applyCall(Collection<String> kill) {
        Map<String, Definition> result = new LinkedHashMap<>();
        for (var entry : defs.entrySet()) {
            if (kill.contains(entry.getKey()) || kill.stream().anyMatch(entry.getValue()::mentions)) {
                continue;
            }
            result.put(entry.getKey(), entry.getValue());
        }
        return new UseDef(result);
    }

    /**
     * Drop the definitions of {@code names} and every definition whose value or location reads one of them.
     */
    public UseDef without(Collection<String> names) {
        return applyCall(names);
    }

    /**
     * Keep only the names defined by the same instruction in both states.
     */
    public UseDef join(UseDef other) {
        Map<String, Definition> result = new LinkedHashMap<>();
        for (var entry : defs.entrySet()) {
            var otherDef = other.defs.get(entry.getKey());
            if (otherDef != null && otherDef.instrId == entry.getValue().instrId) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return new UseDef(result);
    }

    /**
     * A write through memory may change any value that was loaded from memory.
     */
    public UseDef killMemoryReads() {
        Map<String, Definition> result = new LinkedHashMap<>();
        for (var entry : defs.entrySet()) {
            if (!readsMemory(entry.getValue().expr)) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result.size() == defs.size() ? this : new UseDef(result);
    }

    private static boolean readsMemory(AstExpr expr) {
        var finder = new AstDescendVisitor() {
            boolean found = false;

            @Override
            public Void visitLvalExpr(AstLvalExpr e) {
                if (e.getLval().getHost() instanceof AstMemRef) {
                    found = true;
                }
                return super.visitLvalExpr(e);
            }
        };
        expr.accept(finder);
        return finder.found;
    }

    @Override
    public String toString() {
        return defs.toString();
    }
}
