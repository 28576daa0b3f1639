package io.github.formtranscoder;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DiagnosticsTest {

    @Test
    @DisplayName("entries record the scope active when they were added")
    void scopes() {
        Diagnostics diagnostics = new Diagnostics();

        try (Diagnostics.ScopeContext outer = diagnostics.pushScope("stores[0]")) {
            try (Diagnostics.ScopeContext inner = diagnostics.pushScope("bike_sales[1]")) {
                diagnostics.add(Diagnostics.Kind.UNMATCHED_FIELD_KEY, "x", "No pattern matched");
            }
            diagnostics.add(Diagnostics.Kind.LEGACY_FALLBACK, "y", "Matched legacy prefix");
        }
        diagnostics.add(Diagnostics.Kind.DOUBLE_NESTING_REPAIRED, null, "Repaired");

        assertThat(diagnostics.getEntries()).extracting(Diagnostics.Diagnostic::scope)
                .containsExactly("stores[0].bike_sales[1]", "stores[0]", "");
        assertThat(diagnostics.getCurrentScope()).isEmpty();
    }

    @Test
    @DisplayName("entries can be filtered by kind and formatted")
    void filterAndFormat() {
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.add(Diagnostics.Kind.UNMATCHED_FIELD_KEY, "a", "No pattern matched");
        diagnostics.add(Diagnostics.Kind.INDEX_OUT_OF_RANGE, "b", "Index 5000 exceeds maximum 1000");

        assertThat(diagnostics.getEntries(Diagnostics.Kind.INDEX_OUT_OF_RANGE)).hasSize(1);
        assertThat(diagnostics.format())
                .isEqualTo("UNMATCHED_FIELD_KEY 'a' No pattern matched; INDEX_OUT_OF_RANGE 'b' Index 5000 exceeds maximum 1000");
    }

    @Test
    @DisplayName("discarding sink records nothing")
    void discarding() {
        Diagnostics diagnostics = Diagnostics.discarding();

        diagnostics.add(Diagnostics.Kind.UNMATCHED_FIELD_KEY, "a", "No pattern matched");

        assertThat(diagnostics.isEmpty()).isTrue();
    }
}
