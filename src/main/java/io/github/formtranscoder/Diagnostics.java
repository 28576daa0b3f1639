package io.github.formtranscoder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Accumulates non-fatal findings during a single transcoding call.
 *
 * <p>Nothing recorded here aborts the call: unmatched keys are passed through,
 * double nesting is repaired and unusable patterns fall back to legacy matching.
 * One instance belongs to one call and is not shared between threads.</p>
 */
public class Diagnostics {

    /**
     * Kinds of findings.
     */
    public enum Kind {
        UNMATCHED_FIELD_KEY,
        LEGACY_FALLBACK,
        PATTERN_GENERATION_FAILURE,
        DOUBLE_NESTING_REPAIRED,
        INDEX_OUT_OF_RANGE,
        UNRESOLVED_REFERENCE
    }

    /**
     * A single finding. {@code scope} is the item path at the time it was recorded.
     */
    public record Diagnostic(Kind kind, String scope, String key, String message) {

        @Override
        public String toString() {
            String where = scope == null || scope.isEmpty() ? "" : scope + ": ";
            return kind + " " + where + (key != null ? "'" + key + "' " : "") + message;
        }
    }

    private final List<Diagnostic> entries = new ArrayList<>();
    private final Deque<String> scope = new ArrayDeque<>();

    /**
     * Returns a sink that drops everything, for callers that do not want findings.
     */
    public static Diagnostics discarding() {
        return new Diagnostics() {
            @Override
            public void add(Kind kind, String key, String message) {
            }
        };
    }

    /**
     * Pushes an item path segment. The returned context pops it when closed.
     */
    public ScopeContext pushScope(String segment) {
        scope.push(segment);
        return new ScopeContext(this);
    }

    void popScope() {
        if (!scope.isEmpty()) {
            scope.pop();
        }
    }

    /**
     * Returns the current item path, outermost first.
     */
    public String getCurrentScope() {
        if (scope.isEmpty()) {
            return "";
        }
        List<String> segments = new ArrayList<>(scope);
        Collections.reverse(segments);
        return String.join(".", segments);
    }

    public void add(Kind kind, String key, String message) {
        entries.add(new Diagnostic(kind, getCurrentScope(), key, message));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<Diagnostic> getEntries() {
        return List.copyOf(entries);
    }

    public List<Diagnostic> getEntries(Kind kind) {
        return entries.stream().filter(d -> d.kind() == kind).collect(Collectors.toList());
    }

    public String format() {
        return entries.stream().map(Diagnostic::toString).collect(Collectors.joining("; "));
    }

    /**
     * AutoCloseable scope handle.
     */
    public static class ScopeContext implements AutoCloseable {
        private final Diagnostics diagnostics;

        ScopeContext(Diagnostics diagnostics) {
            this.diagnostics = diagnostics;
        }

        @Override
        public void close() {
            diagnostics.popScope();
        }
    }
}
