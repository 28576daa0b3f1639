package io.github.formtranscoder.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classified properties of the items of one array field.
 *
 * @param arrayField    the array property's own name, e.g. {@code bike_sales}
 * @param parentPath    hierarchy path of the enclosing array, or null for a root array
 * @param directFields  scalar properties
 * @param nestedObjects non-scalar properties by name
 * @param arrayFields   properties that are themselves arrays
 */
public record ArrayItemStructure(String arrayField,
                                 String parentPath,
                                 List<String> directFields,
                                 Map<String, NestedStructure> nestedObjects,
                                 List<String> arrayFields) {

    public ArrayItemStructure {
        directFields = List.copyOf(directFields);
        nestedObjects = Collections.unmodifiableMap(new LinkedHashMap<>(nestedObjects));
        arrayFields = List.copyOf(arrayFields);
    }

    /**
     * Structure used when the item definition cannot be resolved.
     */
    public static ArrayItemStructure empty(String arrayField, String parentPath) {
        return new ArrayItemStructure(arrayField, parentPath, List.of(), Map.of(), List.of());
    }

    public boolean isNested() {
        return parentPath != null;
    }

    public boolean isEmpty() {
        return directFields.isEmpty() && nestedObjects.isEmpty() && arrayFields.isEmpty();
    }
}
