package astbridge.base.symbol;

import astbridge.base.type.AstTyp;
import astbridge.base.type.CompInfo;
import astbridge.base.type.EnumInfo;
import astbridge.utils.Logging;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Symbols and type definitions shared by every function of one binary.
 * Safe to use from functions built in parallel.
 */
public class GlobalSymbolTable extends SymbolTable {
    private final Map<String, String> addressToName = new ConcurrentHashMap<>();
    private final Map<Integer, CompInfo> compInfos = new ConcurrentHashMap<>();
    private final Map<String, EnumInfo> enumInfos = new ConcurrentHashMap<>();
    private final Set<Integer> referencedCompKeys = ConcurrentHashMap.newKeySet();
    private final Set<String> referencedEnums = ConcurrentHashMap.newKeySet();

    public GlobalSymbolTable() {
        super(new ConcurrentHashMap<>());
    }

    @Override
    public VarInfo addSymbol(String name, AstTyp typ, Integer parameter, String globalAddress, String description) {
        if (parameter != null) {
            throw new IllegalArgumentException("Global symbol cannot be a parameter: " + name);
        }
        var vinfo = symbols.computeIfAbsent(name,
                k -> new VarInfo(name, typ, null, globalAddress, description, true));
        vinfo.merge(typ, null, globalAddress, description);
        if (vinfo.hasGlobalAddress()) {
            addressToName.putIfAbsent(vinfo.getGlobalAddress(), name);
        }
        return vinfo;
    }

    public boolean hasSymbolAtAddress(String address) {
        return addressToName.containsKey(address);
    }

    public Optional<VarInfo> getSymbolAtAddress(String address) {
        return Optional.ofNullable(addressToName.get(address)).map(symbols::get);
    }

    /**
     * Register a struct/union layout. Re-registering the same layout is a no-op.
     * @throws IllegalStateException if a different layout is already registered under the key
     */
    public CompInfo addCompInfo(CompInfo cinfo) {
        var existing = compInfos.putIfAbsent(cinfo.getCompKey(), cinfo);
        if (existing == null) {
            return cinfo;
        }
        if (!existing.layoutKey().equals(cinfo.layoutKey())) {
            throw new IllegalStateException(String.format("Conflicting compinfo for key %d: %s vs %s",
                    cinfo.getCompKey(), existing, cinfo));
        }
        return existing;
    }

    public boolean hasCompInfo(int compKey) {
        return compInfos.containsKey(compKey);
    }

    public CompInfo getCompInfo(int compKey) {
        var cinfo = compInfos.get(compKey);
        if (cinfo == null) {
            throw new IllegalArgumentException("Compinfo not found: " + compKey);
        }
        return cinfo;
    }

    public EnumInfo addEnumInfo(EnumInfo einfo) {
        var existing = enumInfos.putIfAbsent(einfo.getName(), einfo);
        if (existing != null && !existing.getItems().equals(einfo.getItems())) {
            Logging.warn("GlobalSymbolTable", String.format("Ignoring redefinition of enum %s", einfo.getName()));
        }
        return existing == null ? einfo : existing;
    }

    public boolean hasEnumInfo(String name) {
        return enumInfos.containsKey(name);
    }

    public EnumInfo getEnumInfo(String name) {
        var einfo = enumInfos.get(name);
        if (einfo == null) {
            throw new IllegalArgumentException("Enuminfo not found: " + name);
        }
        return einfo;
    }

    public void markCompReferenced(int compKey) {
        referencedCompKeys.add(compKey);
    }

    public void markEnumReferenced(String name) {
        referencedEnums.add(name);
    }

    /**
     * @return the struct/union definitions that some type reference points at, ordered by key
     */
    public List<CompInfo> getReferencedCompInfos() {
        List<CompInfo> result = new ArrayList<>();
        for (var key : referencedCompKeys) {
            var cinfo = compInfos.get(key);
            if (cinfo != null) {
                result.add(cinfo);
            }
        }
        result.sort(Comparator.comparingInt(CompInfo::getCompKey));
        return result;
    }

    public List<EnumInfo> getReferencedEnumInfos() {
        List<EnumInfo> result = new ArrayList<>();
        for (var name : referencedEnums) {
            var einfo = enumInfos.get(name);
            if (einfo != null) {
                result.add(einfo);
            }
        }
        result.sort(Comparator.comparing(EnumInfo::getName));
        return result;
    }
}
