package com.samt.configservice.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.samt.configservice.exception.SchemaException;
import com.samt.configservice.schema.ShapeDescription.AnyShape;
import com.samt.configservice.schema.ShapeDescription.ArrayShape;
import com.samt.configservice.schema.ShapeDescription.BooleanShape;
import com.samt.configservice.schema.ShapeDescription.NumberShape;
import com.samt.configservice.schema.ShapeDescription.ObjectShape;
import com.samt.configservice.schema.ShapeDescription.StringShape;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles shape descriptions into validators.
 *
 * Validation rules:
 * - object: declared properties are checked; once {@code properties} is declared any
 *   other key fails with "is not allowed"; an absent required property fails with "is required"
 * - number: numeric strings are accepted and normalized to numbers; bounds are inclusive
 * - boolean: "true"/"false" strings are accepted and normalized to booleans
 * - array: every element is checked against {@code items}
 *
 * All failing leaves are reported, not just the first one.
 */
@Component
public class SchemaCompiler {

    /**
     * Internal step of a compiled validator: returns the normalized value and
     * appends any failures to {@code errors}.
     */
    @FunctionalInterface
    private interface Check {
        JsonNode apply(JsonNode value, String path, List<FieldError> errors);
    }

    /**
     * @throws SchemaException if the schema document is malformed
     */
    public Validator compile(JsonNode schema) {
        return compile(ShapeDescription.parse(schema));
    }

    public Validator compile(ShapeDescription shape) {
        Check root = toCheck(shape);
        return value -> {
            List<FieldError> errors = new ArrayList<>();
            JsonNode normalized = root.apply(value, "", errors);
            return errors.isEmpty() ? ValidationResult.valid(normalized) : ValidationResult.invalid(errors);
        };
    }

    private Check toCheck(ShapeDescription shape) {
        if (shape instanceof ObjectShape object) {
            return objectCheck(object);
        }
        if (shape instanceof StringShape string) {
            return stringCheck(string);
        }
        if (shape instanceof NumberShape number) {
            return numberCheck(number);
        }
        if (shape instanceof BooleanShape) {
            return this::checkBoolean;
        }
        if (shape instanceof ArrayShape array) {
            return arrayCheck(array);
        }
        if (shape instanceof AnyShape) {
            return (value, path, errors) -> value;
        }
        throw new SchemaException("Unsupported shape: " + shape.getClass().getSimpleName());
    }

    private Check objectCheck(ObjectShape shape) {
        Map<String, Check> properties = new LinkedHashMap<>();
        shape.properties().forEach((name, property) -> properties.put(name, toCheck(property)));
        List<String> required = shape.required();

        return (value, path, errors) -> {
            if (value == null || !value.isObject()) {
                errors.add(new FieldError(path, "must be an object"));
                return value;
            }
            ObjectNode normalized = ((ObjectNode) value).deepCopy();
            for (String name : required) {
                if (!value.has(name)) {
                    errors.add(new FieldError(join(path, name), "is required"));
                }
            }
            if (shape.closed()) {
                value.fieldNames().forEachRemaining(name -> {
                    if (!properties.containsKey(name)) {
                        errors.add(new FieldError(join(path, name), "is not allowed"));
                    }
                });
            }
            properties.forEach((name, check) -> {
                JsonNode property = value.get(name);
                if (property != null) {
                    normalized.set(name, check.apply(property, join(path, name), errors));
                }
            });
            return normalized;
        };
    }

    private Check stringCheck(StringShape shape) {
        List<String> allowed = shape.allowedValues();
        return (value, path, errors) -> {
            if (value == null || !value.isTextual()) {
                errors.add(new FieldError(path, "must be a string"));
                return value;
            }
            if (allowed != null && !allowed.contains(value.asText())) {
                errors.add(new FieldError(path, "must be one of " + allowed));
            }
            return value;
        };
    }

    private Check numberCheck(NumberShape shape) {
        return (value, path, errors) -> {
            BigDecimal number = toNumber(value);
            if (number == null) {
                errors.add(new FieldError(path, "must be a number"));
                return value;
            }
            if (shape.minimum() != null && number.compareTo(shape.minimum()) < 0) {
                errors.add(new FieldError(path, "must be greater than or equal to " + shape.minimum().toPlainString()));
            }
            if (shape.maximum() != null && number.compareTo(shape.maximum()) > 0) {
                errors.add(new FieldError(path, "must be less than or equal to " + shape.maximum().toPlainString()));
            }
            return value.isNumber() ? value : JsonNodeFactory.instance.numberNode(number);
        };
    }

    private JsonNode checkBoolean(JsonNode value, String path, List<FieldError> errors) {
        if (value != null && value.isBoolean()) {
            return value;
        }
        if (value != null && value.isTextual()) {
            String text = value.asText().trim();
            if ("true".equalsIgnoreCase(text)) {
                return BooleanNode.TRUE;
            }
            if ("false".equalsIgnoreCase(text)) {
                return BooleanNode.FALSE;
            }
        }
        errors.add(new FieldError(path, "must be a boolean"));
        return value;
    }

    private Check arrayCheck(ArrayShape shape) {
        Check items = toCheck(shape.items());
        return (value, path, errors) -> {
            if (value == null || !value.isArray()) {
                errors.add(new FieldError(path, "must be an array"));
                return value;
            }
            ArrayNode normalized = JsonNodeFactory.instance.arrayNode(value.size());
            for (int i = 0; i < value.size(); i++) {
                normalized.add(items.apply(value.get(i), join(path, String.valueOf(i)), errors));
            }
            return normalized;
        };
    }

    private static BigDecimal toNumber(JsonNode value) {
        if (value == null) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String join(String path, String segment) {
        return path.isEmpty() ? segment : path + "." + segment;
    }
}
