package astbridge.base.symbol;

import astbridge.base.type.AstTyp;
import astbridge.base.type.TypFun;
import astbridge.base.type.TypNamed;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Symbols of one function. Names not defined locally are looked up in the global table.
 */
public class LocalSymbolTable extends SymbolTable {
    private final GlobalSymbolTable globalTable;
    private TypFun prototype;

    public LocalSymbolTable(GlobalSymbolTable globalTable) {
        super(new LinkedHashMap<>());
        this.globalTable = globalTable;
    }

    public GlobalSymbolTable getGlobalTable() {
        return globalTable;
    }

    @Override
    public VarInfo addSymbol(String name, AstTyp typ, Integer parameter, String globalAddress, String description) {
        if (globalAddress != null) {
            return globalTable.addSymbol(name, typ, parameter, globalAddress, description);
        }
        if (!symbols.containsKey(name) && globalTable.hasSymbol(name)) {
            return globalTable.addSymbol(name, typ, parameter, null, description);
        }
        var vinfo = symbols.computeIfAbsent(name, k -> new VarInfo(name, typ, parameter, null, description, false));
        vinfo.merge(typ, parameter, null, description);
        return vinfo;
    }

    public boolean hasLocalSymbol(String name) {
        return symbols.containsKey(name);
    }

    @Override
    public boolean hasSymbol(String name) {
        return symbols.containsKey(name) || globalTable.hasSymbol(name);
    }

    @Override
    public VarInfo getSymbol(String name) {
        if (symbols.containsKey(name)) {
            return symbols.get(name);
        }
        return globalTable.getSymbol(name);
    }

    /**
     * @return the formal parameters ordered by parameter index
     */
    public List<VarInfo> getFormals() {
        List<VarInfo> formals = new ArrayList<>();
        for (var vinfo : symbols.values()) {
            if (vinfo.isParameter()) {
                formals.add(vinfo);
            }
        }
        formals.sort(Comparator.comparingInt(VarInfo::getParameter));
        return formals;
    }

    public boolean hasPrototype() {
        return prototype != null;
    }

    public TypFun getPrototype() {
        return prototype;
    }

    public void setPrototype(AstTyp typ) {
        var resolved = typ;
        while (resolved instanceof TypNamed named) {
            resolved = named.getTypedef();
        }
        if (!(resolved instanceof TypFun fun)) {
            throw new IllegalArgumentException("Function prototype must be a function type: " + typ);
        }
        prototype = fun;
    }
}
