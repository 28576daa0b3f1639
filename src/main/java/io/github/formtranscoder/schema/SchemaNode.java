package io.github.formtranscoder.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tree representation of a JSON-Schema-like form description.
 * Each node is an object, an array, a reference into the definitions map,
 * a union of references, or a scalar leaf.
 */
public sealed interface SchemaNode
        permits SchemaNode.ObjectType, SchemaNode.ArrayType, SchemaNode.Reference,
        SchemaNode.Union, SchemaNode.Scalar {

    /**
     * Object with ordered properties. Iteration order is the schema's declaration order.
     */
    record ObjectType(Map<String, SchemaNode> properties) implements SchemaNode {
        public ObjectType {
            properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }
    }

    /**
     * Array whose elements are described by {@code items}.
     */
    record ArrayType(SchemaNode items) implements SchemaNode {
        public ArrayType {
            Objects.requireNonNull(items, "items");
        }
    }

    /**
     * Reference to a named definition. The name is already stripped of its pointer prefix.
     */
    record Reference(String name) implements SchemaNode {
        public Reference {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * {@code anyOf}/{@code oneOf} over referenced definitions. Non-reference branches
     * (typically {@code {"type": "null"}}) are not kept.
     */
    record Union(List<Reference> branches) implements SchemaNode {
        public Union {
            branches = List.copyOf(branches);
        }
    }

    /**
     * Leaf value. {@code type} is the declared JSON type, or {@code "any"}.
     */
    record Scalar(String type) implements SchemaNode {
    }
}
