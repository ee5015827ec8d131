package com.samt.configservice.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.samt.configservice.exception.SchemaException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative description of a value's structure, parsed from a JSON schema document.
 *
 * Supported tags: object, string, number, boolean, array. A missing or
 * unknown {@code type} describes any value.
 */
public interface ShapeDescription {

    /**
     * @param closed true when {@code properties} was declared; other keys are then rejected
     */
    record ObjectShape(Map<String, ShapeDescription> properties, List<String> required, boolean closed)
            implements ShapeDescription {
    }

    record StringShape(List<String> allowedValues) implements ShapeDescription {
    }

    record NumberShape(BigDecimal minimum, BigDecimal maximum) implements ShapeDescription {
    }

    record BooleanShape() implements ShapeDescription {
    }

    record ArrayShape(ShapeDescription items) implements ShapeDescription {
    }

    record AnyShape() implements ShapeDescription {
    }

    /**
     * Parse a schema document.
     *
     * @throws SchemaException if the document is malformed
     */
    static ShapeDescription parse(JsonNode schema) {
        return parse(schema, "");
    }

    private static ShapeDescription parse(JsonNode schema, String path) {
        if (schema == null || !schema.isObject()) {
            throw malformed(path, "shape must be an object");
        }
        JsonNode typeNode = schema.get("type");
        if (typeNode != null && !typeNode.isTextual()) {
            throw malformed(path, "type must be a string");
        }
        String type = typeNode == null ? "" : typeNode.asText();
        return switch (type) {
            case "object" -> parseObject(schema, path);
            case "string" -> new StringShape(parseEnum(schema, path));
            case "number" -> parseNumber(schema, path);
            case "boolean" -> new BooleanShape();
            case "array" -> parseArray(schema, path);
            default -> new AnyShape();
        };
    }

    private static ObjectShape parseObject(JsonNode schema, String path) {
        Map<String, ShapeDescription> properties = new LinkedHashMap<>();
        JsonNode propertiesNode = schema.get("properties");
        if (propertiesNode != null) {
            if (!propertiesNode.isObject()) {
                throw malformed(path, "properties must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = propertiesNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                properties.put(field.getKey(), parse(field.getValue(), join(join(path, "properties"), field.getKey())));
            }
        }
        List<String> required = new ArrayList<>();
        JsonNode requiredNode = schema.get("required");
        if (requiredNode != null) {
            if (!requiredNode.isArray()) {
                throw malformed(path, "required must be an array");
            }
            for (JsonNode name : requiredNode) {
                if (!name.isTextual()) {
                    throw malformed(path, "required must only contain property names");
                }
                required.add(name.asText());
            }
        }
        return new ObjectShape(Collections.unmodifiableMap(properties), List.copyOf(required), propertiesNode != null);
    }

    private static List<String> parseEnum(JsonNode schema, String path) {
        JsonNode enumNode = schema.get("enum");
        if (enumNode == null) {
            return null;
        }
        if (!enumNode.isArray()) {
            throw malformed(path, "enum must be an array");
        }
        List<String> allowed = new ArrayList<>();
        for (JsonNode option : enumNode) {
            if (!option.isTextual()) {
                throw malformed(path, "enum must only contain strings");
            }
            allowed.add(option.asText());
        }
        return List.copyOf(allowed);
    }

    private static NumberShape parseNumber(JsonNode schema, String path) {
        BigDecimal minimum = parseBound(schema, "minimum", path);
        BigDecimal maximum = parseBound(schema, "maximum", path);
        if (minimum != null && maximum != null && minimum.compareTo(maximum) > 0) {
            throw malformed(path, "minimum must not be greater than maximum");
        }
        return new NumberShape(minimum, maximum);
    }

    private static BigDecimal parseBound(JsonNode schema, String name, String path) {
        JsonNode bound = schema.get(name);
        if (bound == null) {
            return null;
        }
        if (!bound.isNumber()) {
            throw malformed(path, name + " must be a number");
        }
        return bound.decimalValue();
    }

    private static ArrayShape parseArray(JsonNode schema, String path) {
        JsonNode items = schema.get("items");
        if (items == null) {
            return new ArrayShape(new AnyShape());
        }
        if (!items.isObject()) {
            throw malformed(path, "items must be an object");
        }
        return new ArrayShape(parse(items, join(path, "items")));
    }

    private static SchemaException malformed(String path, String reason) {
        return new SchemaException(path.isEmpty()
            ? "Invalid schema: " + reason
            : "Invalid schema at '" + path + "': " + reason);
    }

    private static String join(String path, String segment) {
        return path.isEmpty() ? segment : path + "." + segment;
    }
}
