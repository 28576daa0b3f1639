package io.github.formtranscoder;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Result of one transcoding call: the envelope, the snapshot fields that were not
 * consumed, and any findings recorded on the way.
 */
public final class TranscodingResult {

    private final Envelope envelope;
    private final ObjectNode residual;
    private final List<Diagnostics.Diagnostic> diagnostics;

    public TranscodingResult(Envelope envelope, ObjectNode residual, List<Diagnostics.Diagnostic> diagnostics) {
        this.envelope = Objects.requireNonNull(envelope, "envelope");
        this.residual = Objects.requireNonNull(residual, "residual").deepCopy();
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public Envelope getEnvelope() {
        return envelope;
    }

    /**
     * Snapshot fields that belong to no container item and are not transient UI state.
     */
    public ObjectNode getResidual() {
        return residual.deepCopy();
    }

    public List<Diagnostics.Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostics.Diagnostic> getDiagnostics(Diagnostics.Kind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).collect(Collectors.toList());
    }

    /**
     * Returns true if nothing was recorded: every key matched a pattern and no repair ran.
     */
    public boolean isClean() {
        return diagnostics.isEmpty();
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    @Override
    public String toString() {
        return "TranscodingResult{envelope=" + envelope + ", residual=" + residual
                + ", diagnostics=" + diagnostics.size() + '}';
    }
}
