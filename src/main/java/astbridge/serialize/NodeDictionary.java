package astbridge.serialize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Table of node records. A record whose key (tags and argument ids) has been seen before is not added
 * again; the id of the earlier record is returned instead.
 */
public class NodeDictionary {
    private final ObjectMapper mapper;
    private final Map<List<List<?>>, Integer> keyToId = new HashMap<>();
    private final List<ObjectNode> records = new ArrayList<>();
    private int lookups = 0;

    public NodeDictionary(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    static List<List<?>> key(List<String> tags, List<Integer> args) {
        return List.of(List.copyOf(tags), List.copyOf(args));
    }

    /**
     * @param record the tag-derived fields of the node; id and args are filled in here
     */
    public int add(List<String> tags, List<Integer> args, ObjectNode record) {
        lookups++;
        var key = key(tags, args);
        var existing = keyToId.get(key);
        if (existing != null) {
            return existing;
        }
        int id = records.size();
        record.put("id", id);
        var argsNode = record.putArray("args");
        args.forEach(argsNode::add);
        keyToId.put(key, id);
        records.add(record);
        return id;
    }

    public int size() {
        return records.size();
    }

    /**
     * @return how many nodes were offered to the table, shared ones counted each time
     */
    public int getLookups() {
        return lookups;
    }

    public ArrayNode toJson() {
        var array = mapper.createArrayNode();
        records.forEach(array::add);
        return array;
    }
}
