package io.github.formtranscoder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * The nested document sent to the evaluation backend:
 * <pre>
 * {
 *   "user_prompt": {"revision_id": ..., "identifier": ..., "&lt;container&gt;": [...]},
 *   "conversation_flow": ...
 * }
 * </pre>
 */
public final class Envelope {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final String revisionId;
    private final String identifier;
    private final String containerName;
    private final ArrayNode container;
    private final String conversationFlow;

    public Envelope(String revisionId, String identifier, String containerName, ArrayNode container,
                    String conversationFlow) {
        this.revisionId = Objects.requireNonNull(revisionId, "revisionId");
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.containerName = Objects.requireNonNull(containerName, "containerName");
        this.container = Objects.requireNonNull(container, "container").deepCopy();
        this.conversationFlow = Objects.requireNonNull(conversationFlow, "conversationFlow");
    }

    public String getRevisionId() {
        return revisionId;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getContainerName() {
        return containerName;
    }

    /**
     * Returns a copy of the rebuilt container array.
     */
    public ArrayNode getContainer() {
        return container.deepCopy();
    }

    public String getConversationFlow() {
        return conversationFlow;
    }

    public ObjectNode toJson() {
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        ObjectNode prompt = root.putObject("user_prompt");
        prompt.put("revision_id", revisionId);
        prompt.put("identifier", identifier);
        prompt.set(containerName, container.deepCopy());
        root.put("conversation_flow", conversationFlow);
        return root;
    }

    public String toJsonString() {
        try {
            return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson());
        } catch (JsonProcessingException e) {
            throw new TranscodingException("Failed to serialize envelope", e);
        }
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
