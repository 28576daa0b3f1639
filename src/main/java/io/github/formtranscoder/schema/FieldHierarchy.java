package io.github.formtranscoder.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Array item structures keyed by hierarchy path. Root arrays use their own name
 * ({@code stores}); nested arrays join the parent path and their name with an
 * underscore ({@code stores_bike_sales}).
 */
public final class FieldHierarchy {

    private static final FieldHierarchy EMPTY = new FieldHierarchy(Map.of());

    private final Map<String, ArrayItemStructure> entries;

    public FieldHierarchy(Map<String, ArrayItemStructure> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static FieldHierarchy empty() {
        return EMPTY;
    }

    public Map<String, ArrayItemStructure> getEntries() {
        return entries;
    }

    public Optional<ArrayItemStructure> get(String path) {
        return Optional.ofNullable(entries.get(path));
    }

    public Collection<ArrayItemStructure> structures() {
        return entries.values();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Every property name that holds a union, at any depth.
     */
    public Set<String> unionFieldNames() {
        Set<String> names = new LinkedHashSet<>();
        for (ArrayItemStructure structure : entries.values()) {
            structure.nestedObjects().forEach((name, nested) -> {
                if (nested instanceof NestedStructure.NestedArrayFields fields) {
                    names.addAll(fields.unionFields().keySet());
                } else if (nested instanceof NestedStructure.SimpleList list && !list.branches().isEmpty()) {
                    names.add(name);
                }
            });
        }
        return names;
    }

    /**
     * Every union branch definition name, at any depth.
     */
    public Set<String> branchDefinitions() {
        Set<String> branches = new LinkedHashSet<>();
        for (ArrayItemStructure structure : entries.values()) {
            for (NestedStructure nested : structure.nestedObjects().values()) {
                if (nested instanceof NestedStructure.NestedArrayFields fields) {
                    fields.unionBranches().values().forEach(branches::addAll);
                } else if (nested instanceof NestedStructure.SimpleList list) {
                    branches.addAll(list.branches());
                }
            }
        }
        return branches;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldHierarchy that)) return false;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "FieldHierarchy" + entries;
    }
}
