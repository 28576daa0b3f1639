package io.github.formtranscoder.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape of a non-scalar property found inside an array item.
 */
public sealed interface NestedStructure
        permits NestedStructure.NestedArrayFields, NestedStructure.ReferenceFields, NestedStructure.SimpleList {

    /**
     * Item shape of a nested array. Union-bearing when {@code unionFields} is non-empty:
     * union members are then flattened straight into the item.
     *
     * @param directFields  scalar properties of the nested item
     * @param unionFields   union property name to the member property names of all its branches
     * @param unionBranches union property name to the definition names of its branches
     */
    record NestedArrayFields(List<String> directFields,
                             Map<String, List<String>> unionFields,
                             Map<String, List<String>> unionBranches) implements NestedStructure {
        public NestedArrayFields {
            directFields = List.copyOf(directFields);
            unionFields = copy(unionFields);
            unionBranches = copy(unionBranches);
        }

        public boolean isUnionBearing() {
            return !unionFields.isEmpty();
        }
    }

    /**
     * {@code $ref} to another object; its properties are grouped under the field name.
     */
    record ReferenceFields(String refName, List<String> properties) implements NestedStructure {
        public ReferenceFields {
            properties = List.copyOf(properties);
        }
    }

    /**
     * Item-level union or inline object; its fields are grouped under the field name.
     * {@code branches} holds union branch definition names, empty for inline objects.
     */
    record SimpleList(List<String> fields, List<String> branches) implements NestedStructure {
        public SimpleList {
            fields = List.copyOf(fields);
            branches = List.copyOf(branches);
        }
    }

    private static Map<String, List<String>> copy(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }
}
