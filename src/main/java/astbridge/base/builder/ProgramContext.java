package astbridge.base.builder;

import astbridge.base.symbol.GlobalSymbolTable;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * State shared by every function of one binary: the id counters and the global symbol table.
 * Statements and instructions draw from one counter, lvalues and expressions from their own.
 */
public class ProgramContext {
    private final AtomicInteger stmtIdCounter = new AtomicInteger(0);
    private final AtomicInteger lvalIdCounter = new AtomicInteger(0);
    private final AtomicInteger exprIdCounter = new AtomicInteger(0);
    private final GlobalSymbolTable globalSymbolTable;

    public ProgramContext() {
        this(new GlobalSymbolTable());
    }

    public ProgramContext(GlobalSymbolTable globalSymbolTable) {
        this.globalSymbolTable = globalSymbolTable;
    }

    public GlobalSymbolTable getGlobalSymbolTable() {
        return globalSymbolTable;
    }

    public int nextStmtId() {
        return stmtIdCounter.getAndIncrement();
    }

    public int nextInstrId() {
        return stmtIdCounter.getAndIncrement();
    }

    public int nextLvalId() {
        return lvalIdCounter.getAndIncrement();
    }

    public int nextExprId() {
        return exprIdCounter.getAndIncrement();
    }

    /**
     * Make sure ids minted from now on are greater than an id already in use.
     */
    public void reserveStmtId(int usedId) {
        stmtIdCounter.accumulateAndGet(usedId + 1, Math::max);
    }

    public void reserveLvalId(int usedId) {
        lvalIdCounter.accumulateAndGet(usedId + 1, Math::max);
    }

    public void reserveExprId(int usedId) {
        exprIdCounter.accumulateAndGet(usedId + 1, Math::max);
    }
}
