package io.github.formtranscoder;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import io.github.formtranscoder.schema.SchemaModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Parsed schemas and their derived {@link SchemaInfo}, keyed by schema (workflow) name.
 *
 * <p>Owned by the caller: populate it when a schema is fetched, invalidate it when the
 * schema changes. Bounded by {@link TranscoderConfig#getSchemaCacheSize()}, least recently
 * used entries are evicted first. Thread-safe.</p>
 */
public class SchemaCache {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaCache.class);

    private final TranscoderConfig config;
    private final Cache<String, Entry> cache;

    public SchemaCache() {
        this(TranscoderConfig.defaults());
    }

    public SchemaCache(TranscoderConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(config.getSchemaCacheSize())
                .recordStats()
                .removalListener(notification -> LOG.debug("Schema {} removed from cache ({})",
                        notification.getKey(), notification.getCause()))
                .build();
    }

    /**
     * Caches {@code schema} under {@code name}, replacing any previous entry.
     */
    public void put(String name, SchemaModel schema) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(schema, "schema");
        cache.put(name, new Entry(schema));
        LOG.debug("Cached schema {}", name);
    }

    public Optional<SchemaModel> getSchema(String name) {
        Entry entry = name == null ? null : cache.getIfPresent(name);
        return entry == null ? Optional.empty() : Optional.of(entry.schema);
    }

    /**
     * Returns the derived info for the cached schema, computing it on first access.
     * Findings of the analysis are kept with the entry and reported to every caller.
     *
     * @throws SchemaMissingException if the cached schema declares no root array
     */
    public Optional<SchemaInfo> getSchemaInfo(String name, Diagnostics diagnostics) {
        Entry entry = name == null ? null : cache.getIfPresent(name);
        if (entry == null) {
            return Optional.empty();
        }
        Analysis analysis = entry.analysis.get();
        if (analysis == null) {
            Diagnostics findings = new Diagnostics();
            analysis = new Analysis(SchemaInfo.from(entry.schema, config, findings), findings.getEntries());
            if (!entry.analysis.compareAndSet(null, analysis)) {
                analysis = entry.analysis.get();
            }
        }
        for (Diagnostics.Diagnostic finding : analysis.findings()) {
            diagnostics.add(finding.kind(), finding.key(), finding.message());
        }
        return Optional.of(analysis.info());
    }

    public boolean contains(String name) {
        return name != null && cache.getIfPresent(name) != null;
    }

    public void invalidate(String name) {
        cache.invalidate(name);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        return cache.size();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    private record Analysis(SchemaInfo info, List<Diagnostics.Diagnostic> findings) {
    }

    private static final class Entry {
        final SchemaModel schema;
        final AtomicReference<Analysis> analysis = new AtomicReference<>();

        Entry(SchemaModel schema) {
            this.schema = schema;
        }
    }
}
