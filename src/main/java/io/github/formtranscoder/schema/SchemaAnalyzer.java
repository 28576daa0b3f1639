package io.github.formtranscoder.schema;

import io.github.formtranscoder.Diagnostics;
import io.github.formtranscoder.SchemaCache;
import io.github.formtranscoder.SchemaInfo;
import io.github.formtranscoder.SchemaMissingException;
import io.github.formtranscoder.TranscoderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Walks a {@link SchemaModel} and describes where arrays, unions and references sit,
 * which is what the pattern compiler needs to route flat form keys.
 *
 * <p>Failure policy: a reference that does not resolve degrades to an empty structure for
 * that branch only. The walk never aborts because of one bad definition.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public class SchemaAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaAnalyzer.class);

    private final TranscoderConfig config;

    public SchemaAnalyzer() {
        this(TranscoderConfig.defaults());
    }

    public SchemaAnalyzer(TranscoderConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    // ==================== Container Field ====================

    /**
     * Returns the first array-typed property of the root object.
     *
     * <p>When the root declares several arrays the first in declaration order wins.</p>
     *
     * @throws SchemaMissingException if {@code schema} is null or declares no array property
     */
    public String extractContainerFieldName(SchemaModel schema) {
        if (schema == null) {
            throw new SchemaMissingException("Cannot extract container field name: no schema available");
        }
        return findContainerFieldName(schema).orElseThrow(() -> new SchemaMissingException(
                schema.getName().orElse(null),
                "Cannot extract container field name: root declares no array property"));
    }

    /**
     * Like {@link #extractContainerFieldName(SchemaModel)}, falling back to the schema
     * cached under {@code schemaName} when {@code schema} is null or has no array property.
     */
    public String extractContainerFieldName(SchemaModel schema, String schemaName, SchemaCache cache) {
        if (schema != null) {
            Optional<String> direct = findContainerFieldName(schema);
            if (direct.isPresent()) {
                return direct.get();
            }
            LOG.warn("Schema {} declares no root array, trying cached schema", schemaName);
        }
        if (schemaName != null && cache != null) {
            Optional<SchemaModel> cached = cache.getSchema(schemaName);
            if (cached.isPresent()) {
                Optional<String> fromCache = findContainerFieldName(cached.get());
                if (fromCache.isPresent()) {
                    LOG.debug("Container field {} taken from cached schema {}", fromCache.get(), schemaName);
                    return fromCache.get();
                }
            }
        }
        throw new SchemaMissingException(schemaName,
                "Unable to determine container field name: no schema and no cached schema available");
    }

    public Optional<String> findContainerFieldName(SchemaModel schema) {
        for (Map.Entry<String, SchemaNode> property : schema.getRoot().properties().entrySet()) {
            if (property.getValue() instanceof SchemaNode.ArrayType) {
                return Optional.of(property.getKey());
            }
        }
        return Optional.empty();
    }

    // ==================== Legacy Prefixes ====================

    /**
     * Every array-typed property name reachable from the root or any definition, through
     * references, inline objects and array items, in discovery order. Used only as prefix
     * list for legacy matching. Falls back to the configured defaults when the schema is
     * null or declares no arrays.
     */
    public List<String> extractArrayFieldPatterns(SchemaModel schema) {
        if (schema == null) {
            LOG.warn("No schema available, using default array field patterns {}",
                    config.getDefaultArrayFieldPatterns());
            return config.getDefaultArrayFieldPatterns();
        }

        Set<String> patterns = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();
        collectArrayFields(schema, schema.getRoot(), patterns, visited);
        schema.getDefinitions().forEach((name, definition) -> {
            if (visited.add(name)) {
                collectArrayFields(schema, definition, patterns, visited);
            }
        });

        if (patterns.isEmpty()) {
            LOG.warn("No array field patterns detected, using defaults {}", config.getDefaultArrayFieldPatterns());
            return config.getDefaultArrayFieldPatterns();
        }
        LOG.debug("Array field patterns detected: {}", patterns);
        return List.copyOf(patterns);
    }

    private static void collectArrayFields(SchemaModel schema, SchemaNode node, Set<String> patterns,
                                           Set<String> visited) {
        if (node instanceof SchemaNode.ObjectType object) {
            object.properties().forEach((name, property) -> {
                if (property instanceof SchemaNode.ArrayType) {
                    patterns.add(name);
                }
                collectArrayFields(schema, property, patterns, visited);
            });
        } else if (node instanceof SchemaNode.ArrayType array) {
            collectArrayFields(schema, array.items(), patterns, visited);
        } else if (node instanceof SchemaNode.Reference reference) {
            followReference(schema, reference, patterns, visited);
        } else if (node instanceof SchemaNode.Union union) {
            union.branches().forEach(branch -> followReference(schema, branch, patterns, visited));
        }
    }

    private static void followReference(SchemaModel schema, SchemaNode.Reference reference, Set<String> patterns,
                                        Set<String> visited) {
        if (visited.add(reference.name())) {
            schema.resolve(reference).ifPresent(target -> collectArrayFields(schema, target, patterns, visited));
        }
    }

    // ==================== Field Hierarchy ====================

    public FieldHierarchy extractFieldHierarchy(SchemaModel schema) {
        return extractFieldHierarchy(schema, Diagnostics.discarding());
    }

    /**
     * Builds one hierarchy entry per array reachable from the root, parents before children.
     */
    public FieldHierarchy extractFieldHierarchy(SchemaModel schema, Diagnostics diagnostics) {
        if (schema == null) {
            LOG.warn("No schema available for field hierarchy extraction");
            return FieldHierarchy.empty();
        }

        Map<String, ArrayItemStructure> entries = new LinkedHashMap<>();
        schema.getRoot().properties().forEach((name, node) -> {
            if (node instanceof SchemaNode.ArrayType array) {
                analyzeArray(schema, name, null, array, entries, new HashSet<>(), diagnostics);
            }
        });

        LOG.debug("Extracted field hierarchy with {} entries: {}", entries.size(), entries.keySet());
        return new FieldHierarchy(entries);
    }

    /**
     * Container name, legacy prefixes, hierarchy and compiled patterns in one value.
     */
    public SchemaInfo extractSchemaInfo(SchemaModel schema, Diagnostics diagnostics) {
        return SchemaInfo.from(schema, config, diagnostics);
    }

    private void analyzeArray(SchemaModel schema, String field, String parentPath, SchemaNode.ArrayType array,
                              Map<String, ArrayItemStructure> entries, Set<String> visiting,
                              Diagnostics diagnostics) {
        String path = parentPath == null ? field : parentPath + "_" + field;

        Optional<SchemaNode.ObjectType> item = schema.resolveObject(array.items());
        if (item.isEmpty()) {
            unresolved(diagnostics, path, "Array items of " + path + " do not resolve to an object");
            entries.put(path, ArrayItemStructure.empty(field, parentPath));
            return;
        }

        String refName = array.items() instanceof SchemaNode.Reference reference ? reference.name() : null;
        if (refName != null && !visiting.add(refName)) {
            LOG.debug("Recursive definition {} reached again at {}, not descending", refName, path);
            entries.put(path, ArrayItemStructure.empty(field, parentPath));
            return;
        }

        List<String> directFields = new ArrayList<>();
        Map<String, NestedStructure> nestedObjects = new LinkedHashMap<>();
        List<String> arrayFields = new ArrayList<>();
        Map<String, SchemaNode.ArrayType> nestedArrays = new LinkedHashMap<>();

        for (Map.Entry<String, SchemaNode> property : item.get().properties().entrySet()) {
            String name = property.getKey();
            SchemaNode node = property.getValue();

            if (node instanceof SchemaNode.ArrayType nested) {
                arrayFields.add(name);
                nestedArrays.put(name, nested);
                nestedObjects.put(name, analyzeNestedArrayItems(schema, path + "_" + name, nested, diagnostics));
                LOG.debug("  {}.{}: nested array", path, name);
            } else if (node instanceof SchemaNode.Union union) {
                nestedObjects.put(name, new NestedStructure.SimpleList(
                        unionMemberProperties(schema, path + "." + name, union, diagnostics),
                        branchNames(union)));
                LOG.debug("  {}.{}: union over {}", path, name, branchNames(union));
            } else if (node instanceof SchemaNode.Reference reference) {
                String target = reference.name();
                Optional<SchemaNode.ObjectType> referenced = schema.resolveObject(node);
                if (referenced.isPresent()) {
                    nestedObjects.put(name, new NestedStructure.ReferenceFields(
                            target, new ArrayList<>(referenced.get().properties().keySet())));
                    LOG.debug("  {}.{}: reference to {}", path, name, target);
                } else {
                    unresolved(diagnostics, path + "." + name, "Reference " + target + " does not resolve");
                    nestedObjects.put(name, new NestedStructure.ReferenceFields(target, List.of()));
                }
            } else if (node instanceof SchemaNode.ObjectType inline) {
                nestedObjects.put(name, new NestedStructure.SimpleList(
                        new ArrayList<>(inline.properties().keySet()), List.of()));
                LOG.debug("  {}.{}: inline object", path, name);
            } else {
                directFields.add(name);
            }
        }

        entries.put(path, new ArrayItemStructure(field, parentPath, directFields, nestedObjects, arrayFields));

        nestedArrays.forEach((name, nested) ->
                analyzeArray(schema, name, path, nested, entries, visiting, diagnostics));

        if (refName != null) {
            visiting.remove(refName);
        }
    }

    /**
     * Item shape of a nested array: union properties are kept apart, everything else is direct.
     */
    private NestedStructure.NestedArrayFields analyzeNestedArrayItems(SchemaModel schema, String path,
                                                                      SchemaNode.ArrayType array,
                                                                      Diagnostics diagnostics) {
        Optional<SchemaNode.ObjectType> item = schema.resolveObject(array.items());
        if (item.isEmpty()) {
            unresolved(diagnostics, path, "Array items of " + path + " do not resolve to an object");
            return new NestedStructure.NestedArrayFields(List.of(), Map.of(), Map.of());
        }

        List<String> directFields = new ArrayList<>();
        Map<String, List<String>> unionFields = new LinkedHashMap<>();
        Map<String, List<String>> unionBranches = new LinkedHashMap<>();

        item.get().properties().forEach((name, node) -> {
            if (node instanceof SchemaNode.Union union) {
                unionFields.put(name, unionMemberProperties(schema, path + "." + name, union, diagnostics));
                unionBranches.put(name, branchNames(union));
            } else {
                directFields.add(name);
            }
        });

        return new NestedStructure.NestedArrayFields(directFields, unionFields, unionBranches);
    }

    /**
     * Union of the property names of every branch, in first-seen order.
     */
    private List<String> unionMemberProperties(SchemaModel schema, String path, SchemaNode.Union union,
                                               Diagnostics diagnostics) {
        Set<String> properties = new LinkedHashSet<>();
        for (SchemaNode.Reference branch : union.branches()) {
            Optional<SchemaNode.ObjectType> resolved = schema.resolveObject(branch);
            if (resolved.isPresent()) {
                properties.addAll(resolved.get().properties().keySet());
            } else {
                unresolved(diagnostics, path, "Union branch " + branch.name() + " does not resolve");
            }
        }
        return new ArrayList<>(properties);
    }

    private static List<String> branchNames(SchemaNode.Union union) {
        List<String> names = new ArrayList<>();
        for (SchemaNode.Reference branch : union.branches()) {
            names.add(branch.name());
        }
        return names;
    }

    private static void unresolved(Diagnostics diagnostics, String path, String message) {
        LOG.warn("{}, treating as empty", message);
        diagnostics.add(Diagnostics.Kind.UNRESOLVED_REFERENCE, path, message);
    }
}
