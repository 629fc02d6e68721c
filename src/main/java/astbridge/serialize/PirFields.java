package astbridge.serialize;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Field access on PIR records that fails with {@link PirFormatException}.
 */
final class PirFields {

    private PirFields() {
    }

    static JsonNode require(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            throw new PirFormatException("Missing required field '" + field + "'");
        }
        return value;
    }

    static String requireText(JsonNode node, String field) {
        return require(node, field).asText();
    }

    static int requireInt(JsonNode node, String field) {
        var value = require(node, field);
        if (!value.canConvertToInt() && !value.isTextual()) {
            throw new PirFormatException("Field '" + field + "' is not an integer: " + value);
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText());
            } catch (NumberFormatException e) {
                throw new PirFormatException("Field '" + field + "' is not an integer: " + value, e);
            }
        }
        return value.asInt();
    }

    static String optText(JsonNode node, String field) {
        var value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
