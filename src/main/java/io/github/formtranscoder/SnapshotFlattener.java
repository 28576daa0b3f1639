package io.github.formtranscoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.formtranscoder.schema.ArrayItemStructure;
import io.github.formtranscoder.schema.BranchNameTable;
import io.github.formtranscoder.schema.NestedStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes a nested container back into flat form keys: {@code stores_0_name},
 * {@code stores_0_bike_sales_1_quantity}.
 *
 * <p>With a {@link SchemaInfo}, members of unions inside union-bearing nested arrays are
 * written with their branch token ({@code stores_0_bike_sales_0_bike_mountainbike_price}) so
 * that assembly can restore the discriminator. Values nested deeper than
 * {@link TranscoderConfig#getMaxNestingDepth()} are written as JSON text. Empty objects
 * that pad an array before a later element are left out.</p>
 */
public class SnapshotFlattener {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotFlattener.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final int maxNestingDepth;

    public SnapshotFlattener() {
        this(TranscoderConfig.defaults());
    }

    public SnapshotFlattener(TranscoderConfig config) {
        this.maxNestingDepth = config.getMaxNestingDepth();
    }

    /**
     * Flattens without union awareness: every property joins its parent with {@code _}.
     */
    public ObjectNode flatten(ArrayNode container, String containerField) {
        return flatten(container, containerField, Map.of(), null);
    }

    public ObjectNode flatten(ArrayNode container, SchemaInfo info) {
        return flatten(container, info.containerName(), unionBearingArrays(info), info.branchNames());
    }

    private ObjectNode flatten(ArrayNode container, String containerField,
                               Map<String, NestedStructure.NestedArrayFields> unionArrays,
                               BranchNameTable branchNames) {
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(containerField, "containerField");

        ObjectNode flattened = NODES.objectNode();
        ArrayDeque<FlattenTask> taskQueue = new ArrayDeque<>();
        taskQueue.add(new FlattenTask(containerField, container, null, 0));

        while (!taskQueue.isEmpty()) {
            FlattenTask task = taskQueue.pollFirst();
            JsonNode value = task.value;

            if (task.depth > maxNestingDepth) {
                flattened.put(task.prefix, value.toString());
                continue;
            }

            if (value.isArray() && value.size() > 0) {
                for (int i = 0; i < value.size(); i++) {
                    String prefix = task.prefix + "_" + i;
                    JsonNode element = value.get(i);
                    if (isEmptyObject(element)) {
                        // Assembly pads with {} up to the highest index, so only a trailing one needs a key
                        if (i == value.size() - 1) {
                            flattened.set(prefix, element.deepCopy());
                        }
                        continue;
                    }
                    NestedStructure.NestedArrayFields union = task.field == null ? null : unionArrays.get(task.field);
                    if (union != null && element instanceof ObjectNode unionItem) {
                        expandUnionItem(prefix, unionItem, union, branchNames, task.depth + 1,
                                flattened, taskQueue);
                    } else {
                        taskQueue.add(new FlattenTask(prefix, element, null, task.depth + 1));
                    }
                }
            } else if (value.isObject() && value.size() > 0) {
                Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    taskQueue.add(new FlattenTask(task.prefix + "_" + field.getKey(), field.getValue(),
                            field.getKey(), task.depth + 1));
                }
            } else {
                // Scalars, nulls and empty containers are written as they are
                flattened.set(task.prefix, value.deepCopy());
            }
        }

        LOG.debug("Flattened {} into {} keys", containerField, flattened.size());
        return flattened;
    }

    /**
     * Item of a union-bearing nested array: the discriminator is written under the union
     * field, members under {@code union_token_member}.
     */
    private void expandUnionItem(String prefix, ObjectNode item, NestedStructure.NestedArrayFields shape,
                                 BranchNameTable branchNames, int depth, ObjectNode flattened,
                                 ArrayDeque<FlattenTask> taskQueue) {
        Map<String, String> memberOf = new LinkedHashMap<>();
        shape.unionFields().forEach((union, members) -> members.forEach(m -> memberOf.putIfAbsent(m, union)));

        Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            String union = memberOf.get(name);

            if (union == null || shape.directFields().contains(name)) {
                taskQueue.add(new FlattenTask(prefix + "_" + name, field.getValue(), name, depth));
                continue;
            }
            JsonNode discriminator = item.get(union);
            Optional<String> token = discriminator != null && discriminator.isTextual() && branchNames != null
                    ? branchNames.tokenFor(discriminator.asText())
                    : Optional.empty();
            // Unknown branches are written without a token; the discriminator keeps the value
            String key = token.map(t -> prefix + "_" + union + "_" + t + "_" + name)
                    .orElse(prefix + "_" + union + "_" + name);
            flattened.set(key, field.getValue().deepCopy());
        }
    }

    private static Map<String, NestedStructure.NestedArrayFields> unionBearingArrays(SchemaInfo info) {
        Map<String, NestedStructure.NestedArrayFields> arrays = new LinkedHashMap<>();
        for (ArrayItemStructure structure : info.fieldHierarchy().structures()) {
            structure.nestedObjects().forEach((name, nested) -> {
                if (nested instanceof NestedStructure.NestedArrayFields fields && fields.isUnionBearing()) {
                    arrays.putIfAbsent(name, fields);
                }
            });
        }
        return arrays;
    }

    private static boolean isEmptyObject(JsonNode node) {
        return node.isObject() && node.isEmpty();
    }

    private static final class FlattenTask {
        final String prefix;
        final JsonNode value;
        // Property name the value sits under; null for array elements
        final String field;
        final int depth;

        FlattenTask(String prefix, JsonNode value, String field, int depth) {
            this.prefix = prefix;
            this.value = value == null ? NODES.nullNode() : value;
            this.field = field;
            this.depth = depth;
        }
    }
}
