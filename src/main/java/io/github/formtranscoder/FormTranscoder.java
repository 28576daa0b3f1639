package io.github.formtranscoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.formtranscoder.schema.SchemaAnalyzer;
import io.github.formtranscoder.schema.SchemaModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point: turns a flat form snapshot into the nested request envelope.
 *
 * <p>The schema is resolved in this order: the schema passed with the call (which is
 * then cached under its name), the schema cached under the name, and otherwise a
 * {@link SchemaMissingException}. A passed schema without a root array is incomplete:
 * it is neither used nor cached, and the cached schema is used instead.</p>
 *
 * <pre>{@code
 * FormTranscoder transcoder = new FormTranscoder(TranscoderConfig.defaults(), new SchemaCache());
 * TranscodingResult result = transcoder.transcode(snapshot, schemaJson, "bike_store", null, null);
 * ObjectNode request = result.getEnvelope().toJson();
 * }</pre>
 */
public class FormTranscoder {

    private static final Logger LOG = LoggerFactory.getLogger(FormTranscoder.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final TranscoderConfig config;
    private final SchemaCache cache;
    private final ContainerAssembler assembler;
    private final SnapshotFlattener flattener;
    private final SchemaAnalyzer analyzer;

    public FormTranscoder() {
        this(TranscoderConfig.defaults());
    }

    public FormTranscoder(TranscoderConfig config) {
        this(config, new SchemaCache(config));
    }

    public FormTranscoder(TranscoderConfig config, SchemaCache cache) {
        this.config = Objects.requireNonNull(config, "config");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.assembler = new ContainerAssembler(config);
        this.flattener = new SnapshotFlattener(config);
        this.analyzer = new SchemaAnalyzer(config);
    }

    public TranscodingResult transcode(ObjectNode snapshot, String schemaJson, String schemaName,
                                       String revisionId, String identifier) {
        SchemaModel schema = schemaJson == null ? null : SchemaModel.parse(schemaJson);
        return transcode(snapshot, schema, schemaName, revisionId, identifier);
    }

    /**
     * @param schema     schema to use, or null to use the one cached under {@code schemaName}
     * @param schemaName cache key and reported conversation flow; may be null only if
     *                   {@code schema} is given
     * @throws SchemaMissingException if no schema is given and none is cached
     */
    public TranscodingResult transcode(ObjectNode snapshot, SchemaModel schema, String schemaName,
                                       String revisionId, String identifier) {
        Objects.requireNonNull(snapshot, "snapshot");
        Diagnostics diagnostics = new Diagnostics();
        SchemaInfo info = resolveSchemaInfo(schema, schemaName, diagnostics);

        ObjectNode folded = assembler.transformIndexedContainerFields(snapshot, info, diagnostics);
        TranscodingResult assembled = assembler.assemble(folded, info, revisionId, identifier, schemaName);

        if (diagnostics.isEmpty()) {
            return assembled;
        }
        List<Diagnostics.Diagnostic> all = new ArrayList<>(diagnostics.getEntries());
        all.addAll(assembled.getDiagnostics());
        return new TranscodingResult(assembled.getEnvelope(), assembled.getResidual(), all);
    }

    public TranscodingResult transcode(Map<String, ?> snapshot, String schemaJson, String schemaName,
                                       String revisionId, String identifier) {
        JsonNode tree = OBJECT_MAPPER.valueToTree(snapshot);
        return transcode((ObjectNode) tree, schemaJson, schemaName, revisionId, identifier);
    }

    /**
     * Flattens a nested container back into form keys, for editing an earlier request.
     */
    public ObjectNode flatten(ArrayNode container, String schemaName) {
        SchemaInfo info = resolveSchemaInfo(null, schemaName, Diagnostics.discarding());
        return flattener.flatten(container, info);
    }

    /**
     * Explicit schema first, then the cache.
     */
    SchemaInfo resolveSchemaInfo(SchemaModel schema, String schemaName, Diagnostics diagnostics) {
        if (schema != null) {
            if (analyzer.findContainerFieldName(schema).isPresent()) {
                if (schemaName != null) {
                    cache.put(schemaName, schema);
                    return cache.getSchemaInfo(schemaName, diagnostics).orElseThrow();
                }
                return SchemaInfo.from(schema, config, diagnostics);
            }
            LOG.warn("Schema given for {} declares no root array, trying the cached schema", schemaName);
        }

        Optional<SchemaInfo> cached = cache.getSchemaInfo(schemaName, diagnostics);
        if (cached.isPresent()) {
            LOG.debug("Using cached schema {}", schemaName);
            return cached.get();
        }
        LOG.warn("No schema given and none cached for {}", schemaName);
        throw new SchemaMissingException(schemaName,
                "Unable to determine container field name: no schema available");
    }

    public SchemaCache getCache() {
        return cache;
    }

    public TranscoderConfig getConfig() {
        return config;
    }
}
