package astbridge.base.symbol;

import astbridge.base.type.AstTyp;

import java.util.Collection;
import java.util.Map;

public abstract class SymbolTable {
    protected final Map<String, VarInfo> symbols;

    protected SymbolTable(Map<String, VarInfo> symbols) {
        this.symbols = symbols;
    }

    /**
     * Register a symbol, or merge the given attributes into the existing record with the same name.
     * @return the one VarInfo for this name in this scope
     */
    public abstract VarInfo addSymbol(String name, AstTyp typ, Integer parameter, String globalAddress,
                                      String description);

    public VarInfo addSymbol(String name) {
        return addSymbol(name, null, null, null, null);
    }

    public VarInfo addSymbol(String name, AstTyp typ) {
        return addSymbol(name, typ, null, null, null);
    }

    public boolean hasSymbol(String name) {
        return symbols.containsKey(name);
    }

    public VarInfo getSymbol(String name) {
        var vinfo = symbols.get(name);
        if (vinfo == null) {
            throw new IllegalArgumentException("Symbol not found: " + name);
        }
        return vinfo;
    }

    public Collection<VarInfo> getSymbols() {
        return symbols.values();
    }

    public int size() {
        return symbols.size();
    }
}
