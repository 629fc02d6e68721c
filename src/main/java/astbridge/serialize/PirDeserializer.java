package astbridge.serialize;

import astbridge.analyzer.AstFunction;
import astbridge.base.builder.AddressSpan;
import astbridge.base.builder.ProgramContext;
import astbridge.base.builder.Storage;
import astbridge.base.builder.TreeBuilder;
import astbridge.base.node.AstStmt;
import astbridge.base.provenance.AddressIndex;
import astbridge.base.provenance.Provenance;
import astbridge.base.provenance.RawDefinition;
import astbridge.base.provenance.RawUses;
import astbridge.utils.Logging;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Reads PIR JSON documents back into trees, symbol tables and provenance.
 * Address-based provenance records are resolved again against the decoded low-level tree.
 */
public class PirDeserializer {
    private final ObjectMapper mapper = new ObjectMapper();

    public PirDocument read(File file) throws IOException {
        return deserialize(mapper.readTree(file));
    }

    public PirDocument deserialize(String json) throws IOException {
        return deserialize(mapper.readTree(json));
    }

    public PirDocument deserialize(JsonNode root) {
        var version = PirFields.requireText(root, "pir-version");
        var context = new ProgramContext();
        var document = new PirDocument(version, context);
        decodeGlobalSymbolTable(PirFields.require(root, "global-symbol-table"), context);
        for (var fragment : PirFields.require(root, "code-fragments")) {
            document.addCodeFragment(fragment.asText());
        }
        for (var function : PirFields.require(root, "functions")) {
            document.addFunction(decodeFunction(function, context));
        }
        Logging.info("PirDeserializer", String.format("Decoded %d functions (pir version %s)",
                document.getFunctions().size(), version));
        return document;
    }

    private void decodeGlobalSymbolTable(JsonNode table, ProgramContext context) {
        var decoder = new NodeDecoder(new TreeBuilder(context), PirFields.require(table, "nodes"));
        for (var field : List.of("globals", "compinfos", "enuminfos")) {
            for (var id : PirFields.require(table, field)) {
                decoder.node(id.asInt());
            }
        }
    }

    public AstFunction decodeFunction(JsonNode function, ProgramContext context) {
        var name = PirFields.requireText(function, "name");
        var va = PirFields.requireText(function, "va");
        var builder = new TreeBuilder(context);

        var ast = PirFields.require(function, "ast");
        var decoder = new NodeDecoder(builder, PirFields.require(ast, "nodes"));
        List<AstStmt> roots = new ArrayList<>();
        for (var id : PirFields.require(ast, "startnodes")) {
            roots.add(decoder.stmt(id.asInt()));
        }
        if (roots.size() < 2) {
            throw new PirFormatException("Function " + name + " needs at least two start nodes");
        }
        if (function.has("prototype")) {
            builder.getSymbolTable().setPrototype(decoder.typ(PirFields.requireInt(function, "prototype")));
        }
        for (var id : function.path("formals")) {
            decoder.node(id.asInt());
        }

        for (var item : PirFields.require(function, "spans")) {
            List<AddressSpan> spans = new ArrayList<>();
            for (var span : PirFields.require(item, "spans")) {
                spans.add(new AddressSpan(PirFields.requireText(span, "base_va"), PirFields.requireInt(span, "size")));
            }
            builder.addSpans(PirFields.requireInt(item, "id"), spans);
        }
        for (var item : PirFields.require(function, "storage")) {
            builder.addStorage(PirFields.requireInt(item, "lvalid"), decodeStorage(item));
        }

        var provenanceNode = PirFields.require(function, "provenance");
        var provenance = builder.getProvenance();
        decodeMappings(provenanceNode, provenance);
        decodeRawRecords(PirFields.require(function, "reaching-definition-records"), provenance);
        provenance.resolve(new AddressIndex(roots.get(roots.size() - 1), builder.getSpans()));
        forEachEntry(provenanceNode.path("definitions-used-high"), (lvalId, item) -> {
            for (var use : item.path("inactive")) {
                provenance.inactivate(lvalId, use.asInt());
            }
        });

        Logging.debug("PirDeserializer", String.format("%s: decoded %d records", name, decoder.recordCount()));
        return new AstFunction(name, va, builder, roots);
    }

    private static Storage decodeStorage(JsonNode item) {
        Integer size = item.has("size") ? Integer.valueOf(item.get("size").asInt()) : null;
        Storage.Kind kind;
        try {
            kind = Storage.Kind.fromWireName(PirFields.requireText(item, "kind"));
        } catch (IllegalArgumentException e) {
            throw new PirFormatException(e.getMessage(), e);
        }
        return switch (kind) {
            case REGISTER -> Storage.register(PirFields.requireText(item, "name"), size);
            case FLAG -> Storage.flag(PirFields.requireText(item, "name"));
            case STACK -> Storage.stack(PirFields.requireInt(item, "offset"), size);
            case GLOBAL -> Storage.global(PirFields.requireText(item, "address"), size);
            case BASE -> Storage.base(PirFields.requireText(item, "name"), PirFields.requireInt(item, "offset"), size);
        };
    }

    private static void forEachEntry(JsonNode object, BiConsumer<Integer, JsonNode> action) {
        var fields = object.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            int key;
            try {
                key = Integer.parseInt(entry.getKey());
            } catch (NumberFormatException e) {
                throw new PirFormatException("Not an id: " + entry.getKey(), e);
            }
            action.accept(key, entry.getValue());
        }
    }

    private static void decodeMappings(JsonNode node, Provenance provenance) {
        forEachEntry(PirFields.require(node, "instruction-mapping"), (hi, los) -> {
            for (var lo : los) {
                provenance.addInstructionMapping(hi, lo.asInt());
            }
        });
        forEachEntry(PirFields.require(node, "expression-mapping"),
                (hi, lo) -> provenance.addExpressionMapping(hi, lo.asInt()));
        forEachEntry(PirFields.require(node, "lval-mapping"),
                (hi, lo) -> provenance.addLvalMapping(hi, lo.asInt()));
        for (var id : node.path("exposed")) {
            provenance.markExpose(id.asInt());
        }
        for (var id : node.path("stores")) {
            provenance.markStore(id.asInt());
        }
    }

    private static List<String> locations(JsonNode item) {
        List<String> result = new ArrayList<>();
        for (var location : PirFields.require(item, "locations")) {
            result.add(location.asText());
        }
        return result;
    }

    private static List<RawDefinition> rawDefinitions(JsonNode defs) {
        List<RawDefinition> result = new ArrayList<>();
        for (var def : defs) {
            result.add(new RawDefinition(PirFields.requireText(def, "variable"), locations(def)));
        }
        return result;
    }

    private static void decodeRawRecords(JsonNode node, Provenance provenance) {
        forEachEntry(node.path("reaching-definitions"),
                (exprId, defs) -> provenance.addExprReachingDefs(exprId, rawDefinitions(defs)));
        forEachEntry(node.path("flag-reaching-definitions"),
                (exprId, defs) -> provenance.addFlagExprReachingDefs(exprId, rawDefinitions(defs)));
        forEachEntry(node.path("definitions-used"), (lvalId, uses) -> provenance.addLvalDefUses(lvalId,
                new RawUses(PirFields.requireText(uses, "variable"), locations(uses))));
        forEachEntry(node.path("definitions-used-high"), (lvalId, uses) -> provenance.addLvalDefUsesHigh(lvalId,
                new RawUses(PirFields.requireText(uses, "variable"), locations(uses))));
    }
}
