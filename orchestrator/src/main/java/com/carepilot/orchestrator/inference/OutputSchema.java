package com.carepilot.orchestrator.inference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Strict result shape for one stage's model output.
 *
 * The same object drives three things:
 *   - {@link #toJsonSchema()}: the JSON Schema sent with the request and shown in the prompt
 *   - {@link #validate(JsonNode)}: the check applied to every response before it is used
 *   - field accessors in the stage agents, which can assume a validated node is complete
 *
 * Only the shapes the stages need are supported: strings, bounded numbers,
 * string enums, string arrays and arrays of objects.
 */
public final class OutputSchema {

    public enum Type { STRING, NUMBER, ENUM, STRING_ARRAY, OBJECT_ARRAY }

    private record Field(
            String       name,
            Type         type,
            boolean      required,
            String       description,
            double       min,
            double       max,
            int          minItems,
            List<String> allowed,
            OutputSchema nested) {}

    private final String      name;
    private final List<Field> fields;

    private OutputSchema(String name, List<Field> fields) {
        this.name   = name;
        this.fields = List.copyOf(fields);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() { return name; }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    /**
     * Check a response against this schema.
     *
     * @return one message per violation, each prefixed with a JSON path;
     *         empty when the node conforms
     */
    public List<String> validate(JsonNode node) {
        List<String> violations = new ArrayList<>();
        validateObject("$", node, violations);
        return violations;
    }

    private void validateObject(String path, JsonNode node, List<String> violations) {
        if (node == null || !node.isObject()) {
            violations.add(path + ": expected an object");
            return;
        }
        for (Field f : fields) {
            String fieldPath = path + "." + f.name();
            JsonNode value = node.get(f.name());
            if (value == null || value.isNull()) {
                if (f.required()) violations.add(fieldPath + ": required field missing");
                continue;
            }
            switch (f.type()) {
                case STRING -> {
                    if (!value.isTextual()) {
                        violations.add(fieldPath + ": expected a string");
                    } else if (f.required() && value.asText().isBlank()) {
                        violations.add(fieldPath + ": expected a non-blank string");
                    }
                }
                case NUMBER -> {
                    if (!value.isNumber()) {
                        violations.add(fieldPath + ": expected a number");
                    } else if (value.asDouble() < f.min() || value.asDouble() > f.max()) {
                        violations.add(fieldPath + ": " + value.asDouble()
                                + " outside [" + f.min() + ", " + f.max() + "]");
                    }
                }
                case ENUM -> {
                    if (!value.isTextual() || !containsIgnoreCase(f.allowed(), value.asText())) {
                        violations.add(fieldPath + ": expected one of " + f.allowed());
                    }
                }
                case STRING_ARRAY -> {
                    if (checkArray(fieldPath, value, f, violations)) {
                        for (int i = 0; i < value.size(); i++) {
                            if (!value.get(i).isTextual()) {
                                violations.add(fieldPath + "[" + i + "]: expected a string");
                            }
                        }
                    }
                }
                case OBJECT_ARRAY -> {
                    if (checkArray(fieldPath, value, f, violations)) {
                        for (int i = 0; i < value.size(); i++) {
                            f.nested().validateObject(fieldPath + "[" + i + "]", value.get(i), violations);
                        }
                    }
                }
            }
        }
    }

    private static boolean checkArray(String path, JsonNode value, Field f, List<String> violations) {
        if (!value.isArray()) {
            violations.add(path + ": expected an array");
            return false;
        }
        if (value.size() < f.minItems()) {
            violations.add(path + ": expected at least " + f.minItems() + " item(s), got " + value.size());
        }
        return true;
    }

    private static boolean containsIgnoreCase(List<String> allowed, String value) {
        String v = value.strip().toUpperCase(Locale.ROOT);
        return allowed.stream().anyMatch(a -> a.toUpperCase(Locale.ROOT).equals(v));
    }

    // ------------------------------------------------------------------
    // JSON Schema rendering
    // ------------------------------------------------------------------

    /** Render as a JSON Schema object (draft 2020-12 subset). */
    public ObjectNode toJsonSchema() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode root = f.objectNode();
        root.put("type", "object");
        ObjectNode props = root.putObject("properties");
        ArrayNode required = f.arrayNode();
        for (Field field : fields) {
            props.set(field.name(), fieldSchema(field));
            if (field.required()) required.add(field.name());
        }
        root.set("required", required);
        root.put("additionalProperties", true);
        return root;
    }

    private static ObjectNode fieldSchema(Field field) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        switch (field.type()) {
            case STRING -> node.put("type", "string");
            case NUMBER -> node.put("type", "number").put("minimum", field.min()).put("maximum", field.max());
            case ENUM -> {
                node.put("type", "string");
                ArrayNode values = node.putArray("enum");
                field.allowed().forEach(values::add);
            }
            case STRING_ARRAY -> {
                node.put("type", "array").put("minItems", field.minItems());
                node.putObject("items").put("type", "string");
            }
            case OBJECT_ARRAY -> {
                node.put("type", "array").put("minItems", field.minItems());
                node.set("items", field.nested().toJsonSchema());
            }
        }
        if (field.description() != null) {
            node.put("description", field.description());
        }
        return node;
    }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static final class Builder {
        private final String      name;
        private final List<Field> fields = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder requiredString(String field, String description) {
            return add(new Field(field, Type.STRING, true, description, 0, 0, 0, List.of(), null));
        }

        public Builder optionalString(String field, String description) {
            return add(new Field(field, Type.STRING, false, description, 0, 0, 0, List.of(), null));
        }

        public Builder requiredNumber(String field, double min, double max, String description) {
            return add(new Field(field, Type.NUMBER, true, description, min, max, 0, List.of(), null));
        }

        public Builder requiredEnum(String field, List<String> allowed, String description) {
            return add(new Field(field, Type.ENUM, true, description, 0, 0, 0, List.copyOf(allowed), null));
        }

        public Builder optionalEnum(String field, List<String> allowed, String description) {
            return add(new Field(field, Type.ENUM, false, description, 0, 0, 0, List.copyOf(allowed), null));
        }

        public Builder requiredStringArray(String field, int minItems, String description) {
            return add(new Field(field, Type.STRING_ARRAY, true, description, 0, 0, minItems, List.of(), null));
        }

        public Builder requiredObjectArray(String field, int minItems, OutputSchema items, String description) {
            return add(new Field(field, Type.OBJECT_ARRAY, true, description, 0, 0, minItems, List.of(), items));
        }

        private Builder add(Field field) {
            if (fields.stream().anyMatch(f -> f.name().equals(field.name()))) {
                throw new IllegalArgumentException("Duplicate field '" + field.name() + "' in schema " + name);
            }
            fields.add(field);
            return this;
        }

        public OutputSchema build() {
            return new OutputSchema(name, fields);
        }
    }
}
