package astbridge.serialize;

import astbridge.analyzer.AstFunction;
import astbridge.base.builder.TreeBuilder;
import astbridge.base.provenance.Provenance;
import astbridge.base.provenance.RawDefinition;
import astbridge.base.provenance.RawUses;
import astbridge.base.symbol.GlobalSymbolTable;
import astbridge.base.symbol.VarInfo;
import astbridge.utils.Logging;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.File;
import java.io.IOException;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes {@link PirDocument}s in the PIR JSON format.
 */
public class PirSerializer {
    private final ObjectMapper mapper = new ObjectMapper();

    /** records offered and records written by the last {@link #serializeFunction} call */
    private int lastNodeCount = 0;
    private int lastRecordCount = 0;

    public ObjectMapper getMapper() {
        return mapper;
    }

    public int getLastNodeCount() {
        return lastNodeCount;
    }

    public int getLastRecordCount() {
        return lastRecordCount;
    }

    public ObjectNode serialize(PirDocument document) {
        var root = mapper.createObjectNode();
        root.put("pir-version", document.getVersion());
        root.set("global-symbol-table", serializeGlobalSymbolTable(document.getContext().getGlobalSymbolTable()));
        var fragments = root.putArray("code-fragments");
        document.getCodeFragments().forEach(fragments::add);
        var functions = root.putArray("functions");
        for (var function : document.getFunctions()) {
            functions.add(serializeFunction(function));
        }
        return root;
    }

    public void write(PirDocument document, File file) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(file, serialize(document));
        Logging.debug("PirSerializer", "Successfully wrote PIR to file: " + file);
    }

    public ObjectNode serializeGlobalSymbolTable(GlobalSymbolTable table) {
        var dictionary = new NodeDictionary(mapper);
        var encoder = new NodeEncoder(mapper, dictionary, Set.of(), Set.of());
        var result = mapper.createObjectNode();
        var globals = mapper.createArrayNode();
        table.getSymbols().stream()
                .sorted(Comparator.comparing(VarInfo::getName))
                .forEach(v -> globals.add(encoder.index(v)));
        var compinfos = mapper.createArrayNode();
        table.getReferencedCompInfos().forEach(c -> compinfos.add(encoder.index(c)));
        var enuminfos = mapper.createArrayNode();
        table.getReferencedEnumInfos().forEach(e -> enuminfos.add(encoder.index(e)));
        result.set("nodes", dictionary.toJson());
        result.set("globals", globals);
        result.set("compinfos", compinfos);
        result.set("enuminfos", enuminfos);
        return result;
    }

    private static Set<Integer> annotatedLvals(TreeBuilder builder) {
        var provenance = builder.getProvenance();
        Set<Integer> result = new HashSet<>(builder.getStorage().keySet());
        result.addAll(provenance.getLvalMapping().keySet());
        result.addAll(provenance.getLvalMapping().values());
        result.addAll(provenance.getRawDefUses().keySet());
        result.addAll(provenance.getRawDefUsesHigh().keySet());
        result.addAll(provenance.getExposed());
        result.addAll(provenance.getStores());
        return result;
    }

    private static Set<Integer> annotatedExprs(TreeBuilder builder) {
        var provenance = builder.getProvenance();
        Set<Integer> result = new HashSet<>(provenance.getExpressionMapping().keySet());
        result.addAll(provenance.getExpressionMapping().values());
        result.addAll(provenance.getRawReachingDefs().keySet());
        result.addAll(provenance.getRawFlagReachingDefs().keySet());
        return result;
    }

    public ObjectNode serializeFunction(AstFunction function) {
        var builder = function.getBuilder();
        var dictionary = new NodeDictionary(mapper);
        var encoder = new NodeEncoder(mapper, dictionary, annotatedLvals(builder), annotatedExprs(builder));

        var result = mapper.createObjectNode();
        result.put("name", function.name);
        result.put("va", function.address);

        var startNodes = mapper.createArrayNode();
        for (var root : function.getRoots()) {
            startNodes.add(encoder.index(root));
        }
        var symbols = builder.getSymbolTable();
        if (symbols.hasPrototype()) {
            result.put("prototype", encoder.index(symbols.getPrototype()));
        }
        var formals = mapper.createArrayNode();
        symbols.getFormals().forEach(f -> formals.add(encoder.index(f)));
        result.set("formals", formals);

        var ast = result.putObject("ast");
        ast.set("nodes", dictionary.toJson());
        ast.set("startnodes", startNodes);

        result.set("spans", serializeSpans(builder));
        result.set("storage", serializeStorage(builder));
        result.set("provenance", serializeProvenance(builder.getProvenance()));
        result.set("reaching-definition-records", serializeRawRecords(builder.getProvenance()));

        lastNodeCount = dictionary.getLookups();
        lastRecordCount = dictionary.size();
        Logging.debug("PirSerializer", String.format("%s: %d nodes written as %d records",
                function.name, lastNodeCount, lastRecordCount));
        return result;
    }

    private ArrayNode serializeSpans(TreeBuilder builder) {
        var result = mapper.createArrayNode();
        for (var entry : builder.getSpans().entrySet()) {
            var item = result.addObject();
            item.put("id", entry.getKey());
            var spans = item.putArray("spans");
            for (var span : entry.getValue()) {
                var spanNode = spans.addObject();
                spanNode.put("base_va", span.getBaseVa());
                spanNode.put("size", span.getSize());
            }
        }
        return result;
    }

    private ArrayNode serializeStorage(TreeBuilder builder) {
        var result = mapper.createArrayNode();
        for (var entry : builder.getStorage().entrySet()) {
            var storage = entry.getValue();
            var item = result.addObject();
            item.put("lvalid", entry.getKey());
            item.put("kind", storage.getKind().getWireName());
            if (storage.getName() != null) {
                item.put("name", storage.getName());
            }
            if (storage.getOffset() != null) {
                item.put("offset", storage.getOffset());
            }
            if (storage.getAddress() != null) {
                item.put("address", storage.getAddress());
            }
            if (storage.hasSize()) {
                item.put("size", storage.getSize());
            }
        }
        return result;
    }

    private ObjectNode idSetMap(Map<Integer, ? extends Iterable<Integer>> map) {
        var result = mapper.createObjectNode();
        for (var entry : map.entrySet()) {
            var ids = result.putArray(String.valueOf(entry.getKey()));
            entry.getValue().forEach(ids::add);
        }
        return result;
    }

    private ObjectNode idMap(Map<Integer, Integer> map) {
        var result = mapper.createObjectNode();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private ObjectNode serializeProvenance(Provenance provenance) {
        var result = mapper.createObjectNode();
        result.set("instruction-mapping", idSetMap(provenance.getInstructionMapping()));
        result.set("expression-mapping", idMap(provenance.getExpressionMapping()));
        result.set("lval-mapping", idMap(provenance.getLvalMapping()));
        if (provenance.isResolved()) {
            result.set("reaching-definitions", idSetMap(provenance.getReachingDefs()));
            result.set("flag-reaching-definitions", idSetMap(provenance.getFlagReachingDefs()));
            var defUses = mapper.createObjectNode();
            provenance.getDefUses().forEach((k, v) -> {
                var ids = defUses.putArray(String.valueOf(k));
                v.getRecorded().forEach(ids::add);
            });
            result.set("definitions-used", defUses);
            var defUsesHigh = mapper.createObjectNode();
            provenance.getDefUsesHigh().forEach((k, v) -> {
                var item = defUsesHigh.putObject(String.valueOf(k));
                var uses = item.putArray("uses");
                v.getRecorded().forEach(uses::add);
                var inactive = item.putArray("inactive");
                v.getInactive().forEach(inactive::add);
            });
            result.set("definitions-used-high", defUsesHigh);
        }
        var exposed = result.putArray("exposed");
        provenance.getExposed().forEach(exposed::add);
        var stores = result.putArray("stores");
        provenance.getStores().forEach(stores::add);
        return result;
    }

    private ObjectNode rawUses(RawUses uses) {
        var result = mapper.createObjectNode();
        result.put("variable", uses.getVariable());
        var locations = result.putArray("locations");
        uses.getLocations().forEach(locations::add);
        return result;
    }

    private ObjectNode rawDefinitions(Map<Integer, List<RawDefinition>> map) {
        var result = mapper.createObjectNode();
        for (var entry : map.entrySet()) {
            var defs = result.putArray(String.valueOf(entry.getKey()));
            for (var def : entry.getValue()) {
                var item = defs.addObject();
                item.put("variable", def.getVariable());
                var locations = item.putArray("locations");
                def.getLocations().forEach(locations::add);
            }
        }
        return result;
    }

    private ObjectNode serializeRawRecords(Provenance provenance) {
        var result = mapper.createObjectNode();
        result.set("reaching-definitions", rawDefinitions(provenance.getRawReachingDefs()));
        result.set("flag-reaching-definitions", rawDefinitions(provenance.getRawFlagReachingDefs()));
        var defUses = result.putObject("definitions-used");
        provenance.getRawDefUses().forEach((k, v) -> defUses.set(String.valueOf(k), rawUses(v)));
        var defUsesHigh = result.putObject("definitions-used-high");
        provenance.getRawDefUsesHigh().forEach((k, v) -> defUsesHigh.set(String.valueOf(k), rawUses(v)));
        return result;
    }
}
