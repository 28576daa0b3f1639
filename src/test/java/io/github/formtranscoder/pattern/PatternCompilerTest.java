package io.github.formtranscoder.pattern;

import io.github.formtranscoder.SchemaFixtures;
import io.github.formtranscoder.schema.ArrayItemStructure;
import io.github.formtranscoder.schema.BranchNameTable;
import io.github.formtranscoder.schema.FieldHierarchy;
import io.github.formtranscoder.schema.NestedStructure;
import io.github.formtranscoder.schema.SchemaAnalyzer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

import static org.assertj.core.api.Assertions.*;

class PatternCompilerTest {

    private FieldHierarchy hierarchy;
    private PatternCompiler compiler;

    @BeforeEach
    void setUp() {
        hierarchy = new SchemaAnalyzer().extractFieldHierarchy(SchemaFixtures.bikeStore());
        compiler = new PatternCompiler(BranchNameTable.of(Map.of(), hierarchy.branchDefinitions()));
    }

    private static Optional<FieldPattern> firstMatch(List<FieldPattern> patterns, String key) {
        return patterns.stream().filter(p -> p.match(key) != null).findFirst();
    }

    @Nested
    @DisplayName("ordering")
    class Ordering {

        @Test
        @DisplayName("patterns are sorted by kind priority")
        void sortedByPriority() {
            List<FieldPattern> patterns = compiler.generatePatterns(hierarchy);

            assertThat(patterns).extracting(FieldPattern::getKind).isSorted();
            assertThat(patterns.get(0).getKind()).isEqualTo(PatternKind.FLATTENED_UNION);
            assertThat(patterns.get(patterns.size() - 1).getKind()).isEqualTo(PatternKind.DIRECT);
        }

        @Test
        @DisplayName("one pattern per field and kind, no duplicates")
        void counts() {
            List<FieldPattern> patterns = compiler.generatePatterns(hierarchy);

            assertThat(patterns).filteredOn(p -> p.getKind() == PatternKind.FLATTENED_UNION).hasSize(3);
            assertThat(patterns).filteredOn(p -> p.getKind() == PatternKind.FLATTENED_DIRECT).hasSize(1);
            assertThat(patterns).filteredOn(p -> p.getKind() == PatternKind.NESTED_ARRAY_DIRECT).hasSize(2);
            assertThat(patterns).filteredOn(p -> p.getKind() == PatternKind.NESTED_ARRAY_GENERIC).hasSize(2);
            assertThat(patterns).filteredOn(p -> p.getKind() == PatternKind.SIMPLE_NESTED).hasSize(5);
            assertThat(patterns).filteredOn(p -> p.getKind() == PatternKind.REFERENCE_NESTED).hasSize(2);
            assertThat(patterns).filteredOn(p -> p.getKind() == PatternKind.DIRECT).hasSize(3);
            assertThat(patterns).doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("same hierarchy compiles to the same list")
        void deterministic() {
            assertThat(compiler.generatePatterns(hierarchy)).isEqualTo(compiler.generatePatterns(hierarchy));
        }
    }

    @Nested
    @DisplayName("matching")
    class Matching {

        @Test
        @DisplayName("union member with branch token wins over simple nested")
        void flattenedUnionWins() {
            List<FieldPattern> patterns = compiler.generatePatterns(hierarchy);

            FieldPattern pattern = firstMatch(patterns, "bike_sales_0_bike_mountainbike_price").orElseThrow();
            Matcher matcher = pattern.match("bike_sales_0_bike_mountainbike_price");

            assertThat(pattern.getKind()).isEqualTo(PatternKind.FLATTENED_UNION);
            assertThat(pattern.getTargetField()).isEqualTo("price");
            assertThat(pattern.getSubField()).isEqualTo("bike");
            assertThat(matcher.group(1)).isEqualTo("mountainbike");

            FieldPattern untokened = firstMatch(patterns, "bike_sales_0_bike_price").orElseThrow();
            assertThat(untokened.getKind()).isEqualTo(PatternKind.FLATTENED_UNION);
            assertThat(untokened.match("bike_sales_0_bike_price").group(1)).isNull();
        }

        @Test
        @DisplayName("long branch token is captured whole")
        void longToken() {
            List<FieldPattern> patterns = compiler.generatePatterns(hierarchy);
            String key = "bike_sales_3_bike_rootmodel_roadbike_weight";

            assertThat(firstMatch(patterns, key).orElseThrow().match(key).group(1))
                    .isEqualTo("rootmodel_roadbike");
        }

        @Test
        @DisplayName("each key shape maps to its kind")
        void kindsByKey() {
            List<FieldPattern> patterns = compiler.generatePatterns(hierarchy);

            assertThat(firstMatch(patterns, "bike_sales_0_quantity").orElseThrow().getKind())
                    .isEqualTo(PatternKind.FLATTENED_DIRECT);
            assertThat(firstMatch(patterns, "stores_0_laptop_sales_2_model").orElseThrow().getKind())
                    .isEqualTo(PatternKind.NESTED_ARRAY_DIRECT);
            assertThat(firstMatch(patterns, "stores_0_bike_sales_1_bike_price").orElseThrow().getKind())
                    .isEqualTo(PatternKind.NESTED_ARRAY_GENERIC);
            assertThat(firstMatch(patterns, "stores_0_manager_first").orElseThrow().getKind())
                    .isEqualTo(PatternKind.SIMPLE_NESTED);
            assertThat(firstMatch(patterns, "stores_0_address_city").orElseThrow().getKind())
                    .isEqualTo(PatternKind.REFERENCE_NESTED);
            assertThat(firstMatch(patterns, "stores_0_name").orElseThrow().getKind())
                    .isEqualTo(PatternKind.DIRECT);
            assertThat(firstMatch(patterns, "unrelated")).isEmpty();
        }

        @Test
        @DisplayName("field names with regex metacharacters are matched literally")
        void specialCharacters() {
            FieldHierarchy special = new FieldHierarchy(Map.of("line.items", new ArrayItemStructure(
                    "line.items", null, List.of("qty"),
                    Map.of("unit(price)", new NestedStructure.SimpleList(List.of("a+b"), List.of())),
                    List.of())));

            List<FieldPattern> patterns = new PatternCompiler().generatePatterns(special);

            assertThat(firstMatch(patterns, "line.items_0_unit(price)_a+b").orElseThrow().getKind())
                    .isEqualTo(PatternKind.SIMPLE_NESTED);
            assertThat(firstMatch(patterns, "lineXitems_0_qty")).isEmpty();
            assertThat(firstMatch(patterns, "line.items_0_unitprice_aab").orElseThrow().getKind())
                    .isEqualTo(PatternKind.DIRECT);
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("blank field name raises PatternGenerationException")
        void blankFieldName() {
            FieldHierarchy broken = new FieldHierarchy(Map.of("rows", new ArrayItemStructure(
                    "rows", null, List.of(),
                    Map.of("owner", new NestedStructure.ReferenceFields("Owner", List.of(""))),
                    List.of())));

            assertThatThrownBy(() -> compiler.generatePatterns(broken))
                    .isInstanceOf(PatternGenerationException.class)
                    .hasMessageContaining("rows")
                    .hasMessageContaining("reference property");
        }

        @Test
        @DisplayName("blank array field raises PatternGenerationException")
        void blankArrayField() {
            FieldHierarchy broken = new FieldHierarchy(Map.of("x", ArrayItemStructure.empty("", null)));

            assertThatThrownBy(() -> compiler.generatePatterns(broken))
                    .isInstanceOf(PatternGenerationException.class)
                    .satisfies(e -> assertThat(((PatternGenerationException) e).getArrayPath()).isEqualTo("x"));
        }

        @Test
        @DisplayName("empty hierarchy yields no patterns")
        void emptyHierarchy() {
            assertThat(compiler.generatePatterns(FieldHierarchy.empty())).isEmpty();
        }
    }
}
