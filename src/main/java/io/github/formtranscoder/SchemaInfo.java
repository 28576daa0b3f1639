package io.github.formtranscoder;

import io.github.formtranscoder.pattern.FieldPattern;
import io.github.formtranscoder.pattern.PatternCompiler;
import io.github.formtranscoder.pattern.PatternGenerationException;
import io.github.formtranscoder.schema.BranchNameTable;
import io.github.formtranscoder.schema.FieldHierarchy;
import io.github.formtranscoder.schema.SchemaAnalyzer;
import io.github.formtranscoder.schema.SchemaModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything derived from one schema that assembly needs.
 *
 * @param containerName       root array holding the form items
 * @param arrayFieldPatterns  legacy prefixes: every array property name in the schema
 * @param fieldHierarchy      array item structures by hierarchy path
 * @param patterns            compiled patterns; empty when compilation failed (legacy mode)
 * @param branchNames         union branch token table
 * @param discriminatorFields configured discriminator plus every union field name
 */
public record SchemaInfo(String containerName,
                         List<String> arrayFieldPatterns,
                         FieldHierarchy fieldHierarchy,
                         List<FieldPattern> patterns,
                         BranchNameTable branchNames,
                         Set<String> discriminatorFields) {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaInfo.class);

    public SchemaInfo {
        Objects.requireNonNull(containerName, "containerName");
        arrayFieldPatterns = List.copyOf(arrayFieldPatterns);
        Objects.requireNonNull(fieldHierarchy, "fieldHierarchy");
        patterns = List.copyOf(patterns);
        Objects.requireNonNull(branchNames, "branchNames");
        discriminatorFields = Set.copyOf(discriminatorFields);
    }

    public static SchemaInfo from(SchemaModel schema, TranscoderConfig config) {
        return from(schema, config, Diagnostics.discarding());
    }

    /**
     * Analyzes {@code schema} and compiles its patterns.
     *
     * <p>A hierarchy that does not compile leaves {@link #patterns()} empty; items are then
     * rebuilt by legacy prefix stripping only.</p>
     *
     * @throws SchemaMissingException if the schema declares no root array
     */
    public static SchemaInfo from(SchemaModel schema, TranscoderConfig config, Diagnostics diagnostics) {
        SchemaAnalyzer analyzer = new SchemaAnalyzer(config);
        String container = analyzer.extractContainerFieldName(schema);
        List<String> legacy = analyzer.extractArrayFieldPatterns(schema);
        FieldHierarchy hierarchy = analyzer.extractFieldHierarchy(schema, diagnostics);
        BranchNameTable branchNames = BranchNameTable.of(config.getBranchNames(), hierarchy.branchDefinitions());

        List<FieldPattern> patterns;
        try {
            patterns = new PatternCompiler(branchNames).generatePatterns(hierarchy);
        } catch (PatternGenerationException e) {
            LOG.warn("Pattern generation failed for schema {}, falling back to legacy matching: {}",
                    schema.getName().orElse("<unnamed>"), e.getMessage());
            diagnostics.add(Diagnostics.Kind.PATTERN_GENERATION_FAILURE, e.getArrayPath(), e.getMessage());
            patterns = List.of();
        }

        Set<String> discriminators = new LinkedHashSet<>();
        discriminators.add(config.getDiscriminatorField());
        discriminators.addAll(hierarchy.unionFieldNames());

        LOG.debug("Schema info: container={}, legacyPrefixes={}, patterns={}, discriminators={}",
                container, legacy, patterns.size(), discriminators);
        return new SchemaInfo(container, legacy, hierarchy, patterns, branchNames, discriminators);
    }

    /**
     * Info used without a schema: items are rebuilt by stripping the container prefix and
     * the configured default array prefixes.
     */
    public static SchemaInfo legacy(String containerName, TranscoderConfig config) {
        Set<String> prefixes = new LinkedHashSet<>();
        prefixes.add(containerName);
        prefixes.addAll(config.getDefaultArrayFieldPatterns());
        return new SchemaInfo(containerName, List.copyOf(prefixes), FieldHierarchy.empty(),
                List.of(), BranchNameTable.of(config.getBranchNames(), List.of()),
                Set.of(config.getDiscriminatorField()));
    }

    public boolean isLegacyMode() {
        return patterns.isEmpty();
    }
}
