package io.github.formtranscoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.primitives.Ints;
import io.github.formtranscoder.pattern.FieldPattern;
import io.github.formtranscoder.pattern.PatternKind;
import io.github.formtranscoder.schema.BranchNameTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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
 * Rebuilds one array item from its flat form keys.
 *
 * <p>Per key, the first matching {@link FieldPattern} decides where the value goes. Keys no
 * pattern matches lose a legacy {@code {prefix}_{index}_} prefix if they carry one, and
 * otherwise pass through unchanged. Values placed into nested arrays are collected per
 * index and rebuilt recursively with the same patterns.</p>
 *
 * <p>Stateless apart from configuration; safe to share between threads.</p>
 */
public class FieldReconstructor {

    private static final Logger LOG = LoggerFactory.getLogger(FieldReconstructor.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final BranchNameTable branchNames;
    private final Set<String> discriminatorFields;
    private final int maxArrayIndex;

    public FieldReconstructor(BranchNameTable branchNames, Set<String> discriminatorFields, int maxArrayIndex) {
        this.branchNames = Objects.requireNonNull(branchNames, "branchNames");
        this.discriminatorFields = Set.copyOf(discriminatorFields);
        this.maxArrayIndex = maxArrayIndex;
    }

    public static FieldReconstructor forSchema(SchemaInfo info, TranscoderConfig config) {
        return new FieldReconstructor(info.branchNames(), info.discriminatorFields(), config.getMaxArrayIndex());
    }

    public ObjectNode reconstructItem(Map<String, JsonNode> rawItemFields, SchemaInfo info, Diagnostics diagnostics) {
        return reconstructItem(rawItemFields, info.patterns(), info.arrayFieldPatterns(), diagnostics);
    }

    public ObjectNode reconstructItem(ObjectNode rawItemFields, SchemaInfo info, Diagnostics diagnostics) {
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = rawItemFields.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            fields.put(field.getKey(), field.getValue());
        }
        return reconstructItem(fields, info, diagnostics);
    }

    /**
     * @param rawItemFields  flat keys of one item, in snapshot order; values are copied
     * @param patterns       compiled patterns in priority order; may be empty
     * @param legacyPrefixes array field names whose {@code {name}_{index}_} prefix is stripped
     *                       from keys no pattern matches
     */
    public ObjectNode reconstructItem(Map<String, JsonNode> rawItemFields, List<FieldPattern> patterns,
                                      List<String> legacyPrefixes, Diagnostics diagnostics) {
        Objects.requireNonNull(rawItemFields, "rawItemFields");
        Pattern legacy = legacyPattern(legacyPrefixes);

        ObjectNode item = NODES.objectNode();
        Map<String, ObjectNode> groups = new LinkedHashMap<>();
        Map<String, TreeMap<Integer, Map<String, JsonNode>>> subItems = new LinkedHashMap<>();
        Map<String, String> branches = new LinkedHashMap<>();

        for (Map.Entry<String, JsonNode> field : rawItemFields.entrySet()) {
            String key = field.getKey();
            JsonNode value = field.getValue() == null ? NODES.nullNode() : field.getValue().deepCopy();

            if (applyPattern(key, value, patterns, item, groups, subItems, branches, diagnostics)) {
                continue;
            }

            Matcher legacyMatch = legacy == null ? null : legacy.matcher(key);
            if (legacyMatch != null && legacyMatch.matches()) {
                String name = legacyMatch.group(1);
                LOG.debug("Legacy match: {} -> {}", key, name);
                diagnostics.add(Diagnostics.Kind.LEGACY_FALLBACK, key, "Matched legacy prefix, stored as " + name);
                assign(item, name, value);
                continue;
            }

            LOG.debug("No pattern matched {}, keeping key unchanged", key);
            diagnostics.add(Diagnostics.Kind.UNMATCHED_FIELD_KEY, key, "No pattern matched");
            item.set(key, value);
        }

        branches.forEach((unionField, display) -> item.put(unionField, display));
        groups.forEach((name, group) -> mergeObject(item, name, group));
        subItems.forEach((name, byIndex) -> mergeSubItems(item, name, byIndex, patterns, legacyPrefixes, diagnostics));
        return item;
    }

    private boolean applyPattern(String key, JsonNode value, List<FieldPattern> patterns, ObjectNode item,
                                 Map<String, ObjectNode> groups,
                                 Map<String, TreeMap<Integer, Map<String, JsonNode>>> subItems,
                                 Map<String, String> branches, Diagnostics diagnostics) {
        for (FieldPattern pattern : patterns) {
            Matcher match = pattern.match(key);
            if (match == null) {
                continue;
            }
            LOG.debug("{} matched {}", key, pattern);
            switch (pattern.getKind()) {
                case FLATTENED_UNION -> {
                    item.set(pattern.getTargetField(), value);
                    if (match.groupCount() >= 1 && match.group(1) != null) {
                        branches.put(pattern.getSubField(), branchNames.resolve(match.group(1)));
                    }
                    return true;
                }
                case FLATTENED_DIRECT -> {
                    assign(item, pattern.getTargetField(), value);
                    return true;
                }
                case NESTED_ARRAY_DIRECT, NESTED_ARRAY_GENERIC -> {
                    String nested = pattern.getTargetField();
                    Integer index = parseIndex(match.group(1), key, diagnostics);
                    if (index == null) {
                        // Out of range: let a lower-priority pattern or the fallback have it
                        continue;
                    }
                    String rest = pattern.getKind() == PatternKind.NESTED_ARRAY_DIRECT
                            ? pattern.getSubField()
                            : match.group(2);
                    // Re-keyed onto the nested array so its own patterns apply
                    subItems.computeIfAbsent(nested, k -> new TreeMap<>())
                            .computeIfAbsent(index, k -> new LinkedHashMap<>())
                            .put(nested + "_" + index + "_" + rest, value);
                    return true;
                }
                case SIMPLE_NESTED, REFERENCE_NESTED -> {
                    groups.computeIfAbsent(pattern.getTargetField(), k -> NODES.objectNode())
                            .set(pattern.getSubField(), value);
                    return true;
                }
                case DIRECT -> {
                    assign(item, match.group(1), value);
                    return true;
                }
                default -> throw new IllegalStateException("Unhandled pattern kind " + pattern.getKind());
            }
        }
        return false;
    }

    /**
     * Top-level assignment; discriminator values are mapped to their display variant name.
     */
    private void assign(ObjectNode item, String name, JsonNode value) {
        if (discriminatorFields.contains(name) && value.isTextual()) {
            item.put(name, branchNames.resolve(value.asText()));
        } else {
            item.set(name, value);
        }
    }

    private void mergeSubItems(ObjectNode item, String name, TreeMap<Integer, Map<String, JsonNode>> byIndex,
                               List<FieldPattern> patterns, List<String> legacyPrefixes, Diagnostics diagnostics) {
        JsonNode existing = item.get(name);
        ArrayNode array = existing instanceof ArrayNode nestedArray ? nestedArray : item.putArray(name);

        byIndex.forEach((index, fields) -> {
            ObjectNode sub;
            try (Diagnostics.ScopeContext ignored = diagnostics.pushScope(name + "[" + index + "]")) {
                sub = reconstructItem(fields, patterns, legacyPrefixes, diagnostics);
            }
            placeAt(array, index, sub);
        });
    }

    /**
     * Shallow-merges {@code value} into {@code array[index]}, padding with empty objects.
     */
    static void placeAt(ArrayNode array, int index, ObjectNode value) {
        while (array.size() <= index) {
            array.addObject();
        }
        JsonNode current = array.get(index);
        if (current instanceof ObjectNode object) {
            object.setAll(value);
        } else {
            array.set(index, value);
        }
    }

    private static void mergeObject(ObjectNode item, String name, ObjectNode group) {
        JsonNode existing = item.get(name);
        if (existing instanceof ObjectNode object) {
            object.setAll(group);
        } else {
            item.set(name, group);
        }
    }

    /**
     * Parses an index segment; null when it overflows or exceeds the configured maximum.
     */
    Integer parseIndex(String segment, String key, Diagnostics diagnostics) {
        Integer index = Ints.tryParse(segment);
        if (index == null || index < 0 || index > maxArrayIndex) {
            LOG.debug("Index {} in {} is out of range (max {})", segment, key, maxArrayIndex);
            diagnostics.add(Diagnostics.Kind.INDEX_OUT_OF_RANGE, key,
                    "Index " + segment + " exceeds maximum " + maxArrayIndex);
            return null;
        }
        return index;
    }

    private static Pattern legacyPattern(List<String> prefixes) {
        if (prefixes == null || prefixes.isEmpty()) {
            return null;
        }
        String alternatives = prefixes.stream().map(Pattern::quote).collect(Collectors.joining("|"));
        return Pattern.compile("^(?:" + alternatives + ")_\\d+_(.+)$");
    }
}
