package io.github.formtranscoder.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.formtranscoder.TranscodingException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed form schema: the root object plus its named definitions.
 *
 * <p>Accepts a bare schema ({@code {"properties": ..., "$defs": ...}}) or the workflow
 * service envelope ({@code {"schemas": {"RootModel": {...}}}}), which is unwrapped to its
 * {@code RootModel} entry. Definitions are merged from {@code definitions} and {@code $defs}
 * at both levels; {@code $ref} values are reduced to their last pointer segment once, at
 * parse time.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public final class SchemaModel {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final String ROOT_MODEL = "RootModel";
    private static final int MAX_REFERENCE_HOPS = 32;

    private final String name;
    private final SchemaNode.ObjectType root;
    private final Map<String, SchemaNode> definitions;

    private SchemaModel(String name, SchemaNode.ObjectType root, Map<String, SchemaNode> definitions) {
        this.name = name;
        this.root = root;
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    public static SchemaModel parse(String json) {
        try {
            return parse(OBJECT_MAPPER.readTree(json));
        } catch (IOException e) {
            throw new TranscodingException("Schema is not valid JSON", e);
        }
    }

    public static SchemaModel parse(JsonNode schema) {
        if (schema == null || !schema.isObject()) {
            throw new TranscodingException("Schema must be a JSON object");
        }

        JsonNode rootNode = schema;
        String name = text(schema, "workflow_name");
        Map<String, SchemaNode> definitions = new LinkedHashMap<>();
        collectDefinitions(schema, definitions);

        JsonNode wrapped = schema.get("schemas");
        if (wrapped != null && wrapped.isObject() && !schema.has("properties")) {
            rootNode = wrapped.has(ROOT_MODEL) ? wrapped.get(ROOT_MODEL) : firstObject(wrapped);
            if (rootNode == null) {
                throw new TranscodingException(name, "Schema envelope contains no schema object");
            }
            collectDefinitions(rootNode, definitions);
        }

        if (name == null) {
            name = text(rootNode, "title");
        }

        SchemaNode parsedRoot = parseNode(rootNode);
        SchemaNode.ObjectType root = parsedRoot instanceof SchemaNode.ObjectType object
                ? object
                : new SchemaNode.ObjectType(Map.of());
        return new SchemaModel(name, root, definitions);
    }

    /**
     * Parses one schema fragment.
     */
    static SchemaNode parseNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new SchemaNode.Scalar("any");
        }

        JsonNode ref = node.get("$ref");
        if (ref != null && ref.isTextual()) {
            return new SchemaNode.Reference(referenceName(ref.asText()));
        }

        JsonNode alternatives = node.has("anyOf") ? node.get("anyOf") : node.get("oneOf");
        if (alternatives != null && alternatives.isArray()) {
            List<SchemaNode.Reference> branches = new ArrayList<>();
            List<JsonNode> others = new ArrayList<>();
            for (JsonNode option : alternatives) {
                JsonNode optionRef = option.get("$ref");
                if (optionRef != null && optionRef.isTextual()) {
                    branches.add(new SchemaNode.Reference(referenceName(optionRef.asText())));
                } else if (!"null".equals(declaredType(option))) {
                    others.add(option);
                }
            }
            // Optional[X] without references: {"anyOf": [X, {"type": "null"}]}
            if (branches.isEmpty() && others.size() == 1) {
                return parseNode(others.get(0));
            }
            if (branches.isEmpty()) {
                return new SchemaNode.Scalar("any");
            }
            // Optional reference: {"anyOf": [{"$ref": ...}, {"type": "null"}]}
            if (branches.size() == 1 && others.isEmpty()) {
                return branches.get(0);
            }
            return new SchemaNode.Union(branches);
        }

        String type = declaredType(node);
        if ("array".equals(type)) {
            return new SchemaNode.ArrayType(parseNode(node.get("items")));
        }
        if ("object".equals(type) || node.has("properties")) {
            Map<String, SchemaNode> properties = new LinkedHashMap<>();
            JsonNode props = node.get("properties");
            if (props != null && props.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = props.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    properties.put(field.getKey(), parseNode(field.getValue()));
                }
            }
            return new SchemaNode.ObjectType(properties);
        }
        return new SchemaNode.Scalar(type.isEmpty() ? "any" : type);
    }

    /**
     * Reduces {@code #/$defs/RootModel_Store} to {@code RootModel_Store}.
     */
    static String referenceName(String ref) {
        String last = ref.substring(ref.lastIndexOf('/') + 1);
        return last.replace("~1", "/").replace("~0", "~");
    }

    private static String declaredType(JsonNode node) {
        JsonNode type = node.get("type");
        if (type == null) {
            return "";
        }
        if (type.isTextual()) {
            return type.asText();
        }
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (t.isTextual() && !"null".equals(t.asText())) {
                    return t.asText();
                }
            }
        }
        return "";
    }

    private static void collectDefinitions(JsonNode node, Map<String, SchemaNode> target) {
        for (String key : List.of("definitions", "$defs")) {
            JsonNode defs = node.get(key);
            if (defs != null && defs.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = defs.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> def = fields.next();
                    target.putIfAbsent(def.getKey(), parseNode(def.getValue()));
                }
            }
        }
    }

    private static JsonNode firstObject(JsonNode node) {
        for (JsonNode child : node) {
            if (child.isObject()) {
                return child;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    /**
     * Returns the schema or workflow name, if the document declares one.
     */
    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public SchemaNode.ObjectType getRoot() {
        return root;
    }

    public Map<String, SchemaNode> getDefinitions() {
        return definitions;
    }

    public Optional<SchemaNode> resolve(SchemaNode.Reference reference) {
        return Optional.ofNullable(definitions.get(reference.name()));
    }

    /**
     * Follows references until an object is reached. Empty when a reference does not
     * resolve, resolves to a non-object, or forms a cycle of references.
     */
    public Optional<SchemaNode.ObjectType> resolveObject(SchemaNode node) {
        SchemaNode current = node;
        for (int hops = 0; hops < MAX_REFERENCE_HOPS; hops++) {
            if (current instanceof SchemaNode.ObjectType object) {
                return Optional.of(object);
            }
            if (!(current instanceof SchemaNode.Reference reference)) {
                return Optional.empty();
            }
            SchemaNode target = definitions.get(reference.name());
            if (target == null) {
                return Optional.empty();
            }
            current = target;
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "SchemaModel{name=" + name + ", rootProperties=" + root.properties().keySet()
                + ", definitions=" + definitions.keySet() + '}';
    }
}
