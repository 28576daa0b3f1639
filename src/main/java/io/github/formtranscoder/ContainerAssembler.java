package io.github.formtranscoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.formtranscoder.schema.ArrayItemStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a flat form snapshot into the nested {@link Envelope}.
 *
 * <p>Keys are grouped per container item ({@code stores_0_...}), per nested item below a
 * container item ({@code stores_0_bike_sales_1_...}) and per unprefixed nested item
 * ({@code bike_sales_1_...}, emitted by older renderers). Each group is rebuilt by the
 * {@link FieldReconstructor} and merged into a copy of the literal container array, if the
 * snapshot carries one.</p>
 *
 * <p>Stateless; the snapshot is never modified.</p>
 */
public class ContainerAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(ContainerAssembler.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final TranscoderConfig config;
    private final CorrelationIdGenerator idGenerator;

    public ContainerAssembler() {
        this(TranscoderConfig.defaults());
    }

    public ContainerAssembler(TranscoderConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.idGenerator = new CorrelationIdGenerator(config);
    }

    public TranscodingResult assemble(ObjectNode snapshot, SchemaInfo info) {
        return assemble(snapshot, info, null, null, null);
    }

    /**
     * Rebuilds the container and wraps it in an envelope.
     *
     * @param revisionId       revision to report, or null for the configured default
     * @param identifier       identifier to report, or null to generate one
     * @param conversationFlow workflow name, or null for the configured default
     */
    public TranscodingResult assemble(ObjectNode snapshot, SchemaInfo info, String revisionId,
                                      String identifier, String conversationFlow) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(info, "info");

        Diagnostics diagnostics = new Diagnostics();
        String container = info.containerName();
        FieldReconstructor reconstructor = FieldReconstructor.forSchema(info, config);

        KeyGroups groups = groupKeys(snapshot, info, reconstructor, diagnostics);

        JsonNode literal = snapshot.get(container);
        ArrayNode items = literal instanceof ArrayNode array ? array.deepCopy() : NODES.arrayNode();

        groups.containerItems.forEach((index, fields) -> {
            try (Diagnostics.ScopeContext ignored = diagnostics.pushScope(container + "[" + index + "]")) {
                FieldReconstructor.placeAt(items, index, reconstructor.reconstructItem(fields, info, diagnostics));
            }
        });

        groups.nestedItems.forEach((nested, byIndex) -> byIndex.forEach((index, byNestedIndex) ->
                byNestedIndex.forEach((nestedIndex, fields) -> {
                    ObjectNode sub;
                    try (Diagnostics.ScopeContext ignored = diagnostics.pushScope(
                            container + "[" + index + "]." + nested + "[" + nestedIndex + "]")) {
                        sub = reconstructor.reconstructItem(fields, info, diagnostics);
                    }
                    FieldReconstructor.placeAt(items, index, NODES.objectNode());
                    ObjectNode item = (ObjectNode) items.get(index);
                    FieldReconstructor.placeAt(nestedArray(item, nested), nestedIndex, sub);
                })));

        if (!groups.unprefixedItems.isEmpty() && items.size() == 0) {
            items.addObject();
        }
        groups.unprefixedItems.forEach((nested, byNestedIndex) -> byNestedIndex.forEach((nestedIndex, fields) -> {
            ObjectNode sub;
            try (Diagnostics.ScopeContext ignored = diagnostics.pushScope(nested + "[" + nestedIndex + "]")) {
                sub = reconstructor.reconstructItem(fields, info, diagnostics);
            }
            for (JsonNode item : items) {
                if (item instanceof ObjectNode object) {
                    FieldReconstructor.placeAt(nestedArray(object, nested), nestedIndex, sub.deepCopy());
                }
            }
        }));

        if (config.isRepairDoubleNesting()) {
            repairDoubleNesting(items, container, diagnostics);
        }

        ObjectNode residual = residualFields(snapshot, info, groups.consumed);

        Envelope envelope = new Envelope(
                isBlank(revisionId) ? config.getDefaultRevisionId() : revisionId,
                isBlank(identifier) ? idGenerator.generateId() : identifier,
                container,
                items,
                isBlank(conversationFlow) ? config.getDefaultConversationFlow() : conversationFlow);

        LOG.debug("Assembled {} {} items, {} residual fields, {} diagnostics",
                items.size(), container, residual.size(), diagnostics.getEntries().size());
        return new TranscodingResult(envelope, residual, diagnostics.getEntries());
    }

    // ==================== Hyphen-indexed Fields ====================

    /**
     * Folds {@code {container}-{i}-{field}} keys into {@code container[i].field}.
     *
     * <p>Array values whose elements are objects of flat keys have each element rebuilt
     * with the schema's patterns. Returns a new snapshot; the hyphen keys are removed from it.</p>
     */
    public ObjectNode transformIndexedContainerFields(ObjectNode snapshot, SchemaInfo info) {
        return transformIndexedContainerFields(snapshot, info, Diagnostics.discarding());
    }

    public ObjectNode transformIndexedContainerFields(ObjectNode snapshot, SchemaInfo info, Diagnostics diagnostics) {
        Objects.requireNonNull(snapshot, "snapshot");
        String container = info.containerName();
        Pattern hyphenKey = Pattern.compile("^" + Pattern.quote(container) + "-(\\d+)-(.+)$");
        FieldReconstructor reconstructor = FieldReconstructor.forSchema(info, config);

        ObjectNode transformed = snapshot.deepCopy();
        TreeMap<Integer, Map<String, JsonNode>> indexed = new TreeMap<>();

        Iterator<Map.Entry<String, JsonNode>> fields = snapshot.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Matcher match = hyphenKey.matcher(field.getKey());
            if (!match.matches()) {
                continue;
            }
            Integer index = reconstructor.parseIndex(match.group(1), field.getKey(), diagnostics);
            if (index == null) {
                continue;
            }
            indexed.computeIfAbsent(index, k -> new LinkedHashMap<>()).put(match.group(2), field.getValue());
            transformed.remove(field.getKey());
        }

        if (indexed.isEmpty()) {
            return transformed;
        }

        JsonNode literal = transformed.get(container);
        ArrayNode items = literal instanceof ArrayNode array ? array : transformed.putArray(container);

        indexed.forEach((index, values) -> {
            ObjectNode update = NODES.objectNode();
            values.forEach((name, value) -> update.set(name, rebuildElements(value, info, reconstructor, diagnostics)));
            FieldReconstructor.placeAt(items, index, update);
        });

        LOG.debug("Folded hyphen-indexed fields into {} {} items", indexed.size(), container);
        return transformed;
    }

    private static JsonNode rebuildElements(JsonNode value, SchemaInfo info, FieldReconstructor reconstructor,
                                            Diagnostics diagnostics) {
        if (!(value instanceof ArrayNode array)) {
            return value.deepCopy();
        }
        ArrayNode rebuilt = NODES.arrayNode();
        for (JsonNode element : array) {
            rebuilt.add(element instanceof ObjectNode object
                    ? reconstructor.reconstructItem(object, info, diagnostics)
                    : element.deepCopy());
        }
        return rebuilt;
    }

    // ==================== Grouping ====================

    private KeyGroups groupKeys(ObjectNode snapshot, SchemaInfo info, FieldReconstructor reconstructor,
                                Diagnostics diagnostics) {
        String container = info.containerName();
        List<String> nestedFields = nestedArrayFields(info);

        Pattern containerKey = Pattern.compile("^" + Pattern.quote(container) + "_(\\d+)_(.+)$");
        Pattern containerItemKey = Pattern.compile("^" + Pattern.quote(container) + "_(\\d+)$");
        String nestedAlternation = nestedFields.stream().map(Pattern::quote).collect(Collectors.joining("|"));
        Pattern nestedKey = nestedFields.isEmpty() ? null
                : Pattern.compile("^(" + nestedAlternation + ")_(\\d+)_(.+)$");
        Pattern nestedItemKey = nestedFields.isEmpty() ? null
                : Pattern.compile("^(" + nestedAlternation + ")_(\\d+)$");

        KeyGroups groups = new KeyGroups();
        Iterator<Map.Entry<String, JsonNode>> fields = snapshot.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();

            // Trailing empty item written by the flattener: {container}_{i} = {}
            Matcher placeholder = containerItemKey.matcher(key);
            if (placeholder.matches() && isEmptyObject(field.getValue())) {
                Integer index = reconstructor.parseIndex(placeholder.group(1), key, diagnostics);
                if (index != null) {
                    groups.containerItems.computeIfAbsent(index, k -> new LinkedHashMap<>());
                    groups.consumed.add(key);
                }
                continue;
            }

            Matcher match = containerKey.matcher(key);
            if (match.matches()) {
                Integer index = reconstructor.parseIndex(match.group(1), key, diagnostics);
                if (index == null) {
                    continue;
                }
                Matcher nested = nestedKey == null ? null : nestedKey.matcher(match.group(2));
                Integer nestedIndex = nested != null && nested.matches()
                        ? reconstructor.parseIndex(nested.group(2), key, diagnostics)
                        : null;
                Matcher nestedPlaceholder = nestedItemKey == null ? null : nestedItemKey.matcher(match.group(2));
                if (nestedIndex != null) {
                    String name = nested.group(1);
                    nestedGroup(groups, name, index, nestedIndex)
                            .put(name + "_" + nestedIndex + "_" + nested.group(3), field.getValue());
                } else if (nestedPlaceholder != null && nestedPlaceholder.matches()
                        && isEmptyObject(field.getValue())) {
                    // Trailing empty nested item: {container}_{i}_{nested}_{j} = {}
                    Integer placeholderIndex = reconstructor.parseIndex(nestedPlaceholder.group(2), key, diagnostics);
                    if (placeholderIndex == null) {
                        continue;
                    }
                    nestedGroup(groups, nestedPlaceholder.group(1), index, placeholderIndex);
                } else {
                    groups.containerItems.computeIfAbsent(index, k -> new LinkedHashMap<>())
                            .put(key, field.getValue());
                }
                groups.consumed.add(key);
                continue;
            }

            Matcher unprefixed = nestedKey == null ? null : nestedKey.matcher(key);
            if (unprefixed != null && unprefixed.matches()) {
                Integer nestedIndex = reconstructor.parseIndex(unprefixed.group(2), key, diagnostics);
                if (nestedIndex == null) {
                    continue;
                }
                LOG.debug("Unprefixed nested key {}", key);
                groups.unprefixedItems
                        .computeIfAbsent(unprefixed.group(1), k -> new TreeMap<>())
                        .computeIfAbsent(nestedIndex, k -> new LinkedHashMap<>())
                        .put(key, field.getValue());
                groups.consumed.add(key);
            }
        }
        return groups;
    }

    private static Map<String, JsonNode> nestedGroup(KeyGroups groups, String nested, int index, int nestedIndex) {
        return groups.nestedItems
                .computeIfAbsent(nested, k -> new TreeMap<>())
                .computeIfAbsent(index, k -> new TreeMap<>())
                .computeIfAbsent(nestedIndex, k -> new LinkedHashMap<>());
    }

    private static boolean isEmptyObject(JsonNode node) {
        return node.isObject() && node.isEmpty();
    }

    /**
     * Nested array fields of container items, longest first so that the regex alternation
     * prefers {@code bike_sales_items} over {@code bike_sales}.
     */
    private static List<String> nestedArrayFields(SchemaInfo info) {
        String container = info.containerName();
        List<String> names = info.fieldHierarchy().get(container)
                .map(ArrayItemStructure::arrayFields)
                .orElse(List.of());
        if (names.isEmpty() && info.isLegacyMode()) {
            names = info.arrayFieldPatterns().stream()
                    .filter(name -> !name.equals(container))
                    .collect(Collectors.toList());
        }
        List<String> sorted = new ArrayList<>(names);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        return sorted;
    }

    private static ArrayNode nestedArray(ObjectNode item, String nested) {
        JsonNode existing = item.get(nested);
        return existing instanceof ArrayNode array ? array : item.putArray(nested);
    }

    // ==================== Repair & Residual ====================

    /**
     * An item holding a property named after the container was wrapped once too often.
     * The first inner element is merged over the item; later elements are dropped.
     */
    private static void repairDoubleNesting(ArrayNode items, String container, Diagnostics diagnostics) {
        for (int i = 0; i < items.size(); i++) {
            if (!(items.get(i) instanceof ObjectNode item) || !item.has(container)) {
                continue;
            }
            JsonNode inner = item.remove(container);
            if (inner instanceof ArrayNode && inner.size() > 0) {
                if (inner.get(0) instanceof ObjectNode first) {
                    item.setAll(first);
                }
                if (inner.size() > 1) {
                    LOG.warn("Double-nested {}[{}] held {} items, keeping only the first",
                            container, i, inner.size());
                }
            }
            LOG.debug("Repaired double nesting in {}[{}]", container, i);
            diagnostics.add(Diagnostics.Kind.DOUBLE_NESTING_REPAIRED, container + "[" + i + "]",
                    "Removed nested '" + container + "' property"
                            + (inner instanceof ArrayNode && inner.size() > 1
                            ? ", discarded " + (inner.size() - 1) + " later elements" : ""));
        }
    }

    private ObjectNode residualFields(ObjectNode snapshot, SchemaInfo info, Set<String> consumed) {
        String container = info.containerName();
        ObjectNode residual = NODES.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = snapshot.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            if (consumed.contains(key)
                    || key.equals(container)
                    || key.contains(container + "-")
                    || (key.startsWith(container) && key.contains("item"))
                    || info.discriminatorFields().contains(key)
                    || isTransient(key)) {
                continue;
            }
            residual.set(key, field.getValue().deepCopy());
        }
        return residual;
    }

    private boolean isTransient(String key) {
        for (String marker : config.getTransientKeyMarkers()) {
            if (key.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static final class KeyGroups {
        final TreeMap<Integer, Map<String, JsonNode>> containerItems = new TreeMap<>();
        final Map<String, TreeMap<Integer, TreeMap<Integer, Map<String, JsonNode>>>> nestedItems = new LinkedHashMap<>();
        final Map<String, TreeMap<Integer, Map<String, JsonNode>>> unprefixedItems = new LinkedHashMap<>();
        final Set<String> consumed = new HashSet<>();
    }
}
