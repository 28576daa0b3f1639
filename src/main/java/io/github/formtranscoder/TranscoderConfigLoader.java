package io.github.formtranscoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds a {@link TranscoderConfig} from a properties file or from environment variables.
 *
 * <p>Property keys map to environment variables by upper-casing, replacing dots with
 * underscores and prefixing {@code FORM_}: {@code transcoder.max.array.index} becomes
 * {@code FORM_TRANSCODER_MAX_ARRAY_INDEX}.</p>
 */
public final class TranscoderConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TranscoderConfigLoader.class);

    public static final String DEFAULT_CONFIG_FILE = "form-transcoder.properties";

    // Property keys
    static final String DISCRIMINATOR_FIELD = "transcoder.discriminator.field";
    static final String BRANCH_NAMES = "transcoder.branch.names";
    static final String LEGACY_ARRAY_FIELDS = "transcoder.legacy.array.fields";
    static final String IDENTIFIER_PREFIX = "transcoder.identifier.prefix";
    static final String DEFAULT_REVISION_ID = "transcoder.default.revision.id";
    static final String DEFAULT_CONVERSATION_FLOW = "transcoder.default.conversation.flow";
    static final String TRANSIENT_MARKERS = "transcoder.transient.markers";
    static final String MAX_ARRAY_INDEX = "transcoder.max.array.index";
    static final String MAX_NESTING_DEPTH = "transcoder.max.nesting.depth";
    static final String REPAIR_DOUBLE_NESTING = "transcoder.repair.double.nesting";
    static final String SCHEMA_CACHE_SIZE = "transcoder.schema.cache.size";

    private static final List<String> ALL_KEYS = List.of(
            DISCRIMINATOR_FIELD, BRANCH_NAMES, LEGACY_ARRAY_FIELDS, IDENTIFIER_PREFIX,
            DEFAULT_REVISION_ID, DEFAULT_CONVERSATION_FLOW, TRANSIENT_MARKERS,
            MAX_ARRAY_INDEX, MAX_NESTING_DEPTH, REPAIR_DOUBLE_NESTING, SCHEMA_CACHE_SIZE);

    private TranscoderConfigLoader() {
    }

    /**
     * Create config from a classpath properties file
     */
    public static TranscoderConfig fromProperties(String propertiesFile) throws IOException {
        return fromProperties(loadProperties(propertiesFile));
    }

    /**
     * Create config from the default properties file
     */
    public static TranscoderConfig fromDefaultProperties() throws IOException {
        return fromProperties(DEFAULT_CONFIG_FILE);
    }

    public static TranscoderConfig fromProperties(Properties props) {
        return apply(TranscoderConfig.builder(), props::getProperty).build();
    }

    /**
     * Create config from process environment variables
     */
    public static TranscoderConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static TranscoderConfig fromEnvironment(Map<String, String> env) {
        return apply(TranscoderConfig.builder(), key -> env.get(toEnvironmentName(key))).build();
    }

    static String toEnvironmentName(String propertyKey) {
        return "FORM_" + propertyKey.replace('.', '_').toUpperCase(Locale.ROOT);
    }

    private static TranscoderConfig.Builder apply(TranscoderConfig.Builder builder,
                                                  Function<String, String> source) {
        for (String key : ALL_KEYS) {
            String raw = source.apply(key);
            if (raw == null || raw.trim().isEmpty()) {
                continue;
            }
            String value = raw.trim();
            try {
                applyValue(builder, key, value);
            } catch (IllegalArgumentException e) {
                throw new TranscodingException("Invalid value for " + key + ": '" + value + "'", e);
            }
        }
        return builder;
    }

    private static void applyValue(TranscoderConfig.Builder builder, String key, String value) {
        switch (key) {
            case DISCRIMINATOR_FIELD -> builder.discriminatorField(value);
            case BRANCH_NAMES -> {
                builder.clearBranchNames();
                for (String pair : splitList(value)) {
                    int eq = pair.indexOf('=');
                    if (eq <= 0 || eq == pair.length() - 1) {
                        throw new IllegalArgumentException("Expected token=DisplayName but got '" + pair + "'");
                    }
                    builder.branchName(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
                }
            }
            case LEGACY_ARRAY_FIELDS -> builder.defaultArrayFieldPatterns(splitList(value));
            case IDENTIFIER_PREFIX -> builder.identifierPrefix(value);
            case DEFAULT_REVISION_ID -> builder.defaultRevisionId(value);
            case DEFAULT_CONVERSATION_FLOW -> builder.defaultConversationFlow(value);
            case TRANSIENT_MARKERS -> builder.transientKeyMarkers(splitList(value));
            case MAX_ARRAY_INDEX -> builder.maxArrayIndex(Integer.parseInt(value));
            case MAX_NESTING_DEPTH -> builder.maxNestingDepth(Integer.parseInt(value));
            case REPAIR_DOUBLE_NESTING -> builder.repairDoubleNesting(Boolean.parseBoolean(value));
            case SCHEMA_CACHE_SIZE -> builder.schemaCacheSize(Integer.parseInt(value));
            default -> LOG.debug("Ignoring unknown transcoder property {}", key);
        }
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static Properties loadProperties(String filename) throws IOException {
        Properties props = new Properties();

        try (InputStream is = TranscoderConfigLoader.class
                .getClassLoader().getResourceAsStream(filename)) {
            if (is != null) {
                props.load(is);
            } else {
                throw new IOException("Properties file not found: " + filename);
            }
        }

        LOG.debug("Loaded {} transcoder properties from {}", props.size(), filename);
        return props;
    }
}
