package io.github.formtranscoder;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration options for form transcoding.
 *
 * <p>This class uses the builder pattern for configuration and is immutable
 * once constructed.</p>
 */
public final class TranscoderConfig {

    public static final String DEFAULT_DISCRIMINATOR_FIELD = "bike";
    public static final String DEFAULT_IDENTIFIER_PREFIX = "test";
    public static final String DEFAULT_REVISION_ID = "no-version-selected";
    public static final String DEFAULT_CONVERSATION_FLOW = "unknown-workflow";

    // Union handling
    private final String discriminatorField;
    private final Map<String, String> branchNames;

    // Legacy matching
    private final List<String> defaultArrayFieldPatterns;

    // Envelope
    private final String identifierPrefix;
    private final String defaultRevisionId;
    private final String defaultConversationFlow;
    private final Clock clock;

    // Assembly
    private final List<String> transientKeyMarkers;
    private final int maxArrayIndex;
    private final int maxNestingDepth;
    private final boolean repairDoubleNesting;

    // Caching
    private final int schemaCacheSize;

    private TranscoderConfig(Builder builder) {
        this.discriminatorField = builder.discriminatorField;
        this.branchNames = Map.copyOf(builder.branchNames);
        this.defaultArrayFieldPatterns = List.copyOf(builder.defaultArrayFieldPatterns);
        this.identifierPrefix = builder.identifierPrefix;
        this.defaultRevisionId = builder.defaultRevisionId;
        this.defaultConversationFlow = builder.defaultConversationFlow;
        this.clock = builder.clock;
        this.transientKeyMarkers = List.copyOf(builder.transientKeyMarkers);
        this.maxArrayIndex = builder.maxArrayIndex;
        this.maxNestingDepth = builder.maxNestingDepth;
        this.repairDoubleNesting = builder.repairDoubleNesting;
        this.schemaCacheSize = builder.schemaCacheSize;
    }

    /**
     * Returns a builder with default settings.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the default configuration.
     */
    public static TranscoderConfig defaults() {
        return builder().build();
    }

    /**
     * Returns a builder pre-populated with this configuration's values.
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .discriminatorField(discriminatorField)
                .defaultArrayFieldPatterns(defaultArrayFieldPatterns)
                .identifierPrefix(identifierPrefix)
                .defaultRevisionId(defaultRevisionId)
                .defaultConversationFlow(defaultConversationFlow)
                .clock(clock)
                .transientKeyMarkers(transientKeyMarkers)
                .maxArrayIndex(maxArrayIndex)
                .maxNestingDepth(maxNestingDepth)
                .repairDoubleNesting(repairDoubleNesting)
                .schemaCacheSize(schemaCacheSize);
        builder.branchNames.clear();
        builder.branchNames.putAll(branchNames);
        return builder;
    }

    // Getters

    public String getDiscriminatorField() {
        return discriminatorField;
    }

    /**
     * Lower-cased discriminator token to display variant name.
     */
    public Map<String, String> getBranchNames() {
        return branchNames;
    }

    public List<String> getDefaultArrayFieldPatterns() {
        return defaultArrayFieldPatterns;
    }

    public String getIdentifierPrefix() {
        return identifierPrefix;
    }

    public String getDefaultRevisionId() {
        return defaultRevisionId;
    }

    public String getDefaultConversationFlow() {
        return defaultConversationFlow;
    }

    public Clock getClock() {
        return clock;
    }

    public List<String> getTransientKeyMarkers() {
        return transientKeyMarkers;
    }

    public int getMaxArrayIndex() {
        return maxArrayIndex;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public boolean isRepairDoubleNesting() {
        return repairDoubleNesting;
    }

    public int getSchemaCacheSize() {
        return schemaCacheSize;
    }

    @Override
    public String toString() {
        return "TranscoderConfig{" +
                "discriminatorField='" + discriminatorField + '\'' +
                ", branchNames=" + branchNames +
                ", defaultArrayFieldPatterns=" + defaultArrayFieldPatterns +
                ", identifierPrefix='" + identifierPrefix + '\'' +
                ", transientKeyMarkers=" + transientKeyMarkers +
                ", maxArrayIndex=" + maxArrayIndex +
                ", maxNestingDepth=" + maxNestingDepth +
                ", repairDoubleNesting=" + repairDoubleNesting +
                ", schemaCacheSize=" + schemaCacheSize +
                '}';
    }

    // Builder

    public static final class Builder {
        private String discriminatorField = DEFAULT_DISCRIMINATOR_FIELD;
        private final Map<String, String> branchNames = new LinkedHashMap<>();
        private List<String> defaultArrayFieldPatterns = List.of("bike_sales", "laptop_sales");
        private String identifierPrefix = DEFAULT_IDENTIFIER_PREFIX;
        private String defaultRevisionId = DEFAULT_REVISION_ID;
        private String defaultConversationFlow = DEFAULT_CONVERSATION_FLOW;
        private Clock clock = Clock.systemUTC();
        private List<String> transientKeyMarkers = List.of("-item-");
        private int maxArrayIndex = 1000;
        private int maxNestingDepth = 50;
        private boolean repairDoubleNesting = true;
        private int schemaCacheSize = 100;

        private Builder() {
            branchNames.put("rootmodel_mountainbike", "MountainBike");
            branchNames.put("rootmodel_roadbike", "RoadBike");
            branchNames.put("rootmodel_electricbike", "ElectricBike");
        }

        public Builder discriminatorField(String field) {
            this.discriminatorField = requireText(field, "discriminatorField");
            return this;
        }

        public Builder branchName(String token, String displayName) {
            this.branchNames.put(requireText(token, "token").toLowerCase(Locale.ROOT),
                    requireText(displayName, "displayName"));
            return this;
        }

        public Builder clearBranchNames() {
            this.branchNames.clear();
            return this;
        }

        public Builder defaultArrayFieldPatterns(List<String> patterns) {
            this.defaultArrayFieldPatterns = new ArrayList<>(Objects.requireNonNull(patterns, "patterns"));
            return this;
        }

        public Builder identifierPrefix(String prefix) {
            this.identifierPrefix = requireText(prefix, "identifierPrefix");
            return this;
        }

        public Builder defaultRevisionId(String revisionId) {
            this.defaultRevisionId = requireText(revisionId, "defaultRevisionId");
            return this;
        }

        public Builder defaultConversationFlow(String conversationFlow) {
            this.defaultConversationFlow = requireText(conversationFlow, "defaultConversationFlow");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder transientKeyMarkers(List<String> markers) {
            this.transientKeyMarkers = new ArrayList<>(Objects.requireNonNull(markers, "markers"));
            return this;
        }

        public Builder maxArrayIndex(int maxArrayIndex) {
            if (maxArrayIndex < 0) {
                throw new IllegalArgumentException("maxArrayIndex must be >= 0");
            }
            this.maxArrayIndex = maxArrayIndex;
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            if (maxNestingDepth < 1) {
                throw new IllegalArgumentException("maxNestingDepth must be >= 1");
            }
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder repairDoubleNesting(boolean repair) {
            this.repairDoubleNesting = repair;
            return this;
        }

        public Builder schemaCacheSize(int size) {
            if (size < 1) {
                throw new IllegalArgumentException("schemaCacheSize must be >= 1");
            }
            this.schemaCacheSize = size;
            return this;
        }

        public TranscoderConfig build() {
            return new TranscoderConfig(this);
        }

        private static String requireText(String value, String name) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException(name + " must not be blank");
            }
            return value;
        }
    }
}
