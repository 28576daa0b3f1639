package io.github.formtranscoder.schema;

import io.github.formtranscoder.Diagnostics;
import io.github.formtranscoder.SchemaCache;
import io.github.formtranscoder.SchemaFixtures;
import io.github.formtranscoder.SchemaMissingException;
import io.github.formtranscoder.TranscoderConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.github.formtranscoder.SchemaFixtures.json;
import static org.assertj.core.api.Assertions.*;

class SchemaAnalyzerTest {

    private SchemaAnalyzer analyzer;
    private SchemaModel bikeStore;

    @BeforeEach
    void setUp() {
        analyzer = new SchemaAnalyzer();
        bikeStore = SchemaFixtures.bikeStore();
    }

    // ==================== Container Field ====================

    @Nested
    @DisplayName("container field name")
    class ContainerField {

        @Test
        @DisplayName("first root array property")
        void firstRootArray() {
            assertThat(analyzer.extractContainerFieldName(bikeStore)).isEqualTo("stores");
        }

        @Test
        @DisplayName("first array wins when the root declares several")
        void firstOfSeveral() {
            SchemaModel model = SchemaModel.parse(json(
                    "{'properties': {'title': {'type': 'string'},"
                            + " 'orders': {'type': 'array', 'items': {'type': 'string'}},"
                            + " 'returns': {'type': 'array', 'items': {'type': 'string'}}}}"));

            assertThat(analyzer.extractContainerFieldName(model)).isEqualTo("orders");
        }

        @Test
        @DisplayName("no schema fails with SchemaMissingException")
        void noSchema() {
            assertThatThrownBy(() -> analyzer.extractContainerFieldName(null))
                    .isInstanceOf(SchemaMissingException.class);
        }

        @Test
        @DisplayName("root without arrays fails")
        void noArrays() {
            SchemaModel model = SchemaModel.parse(json("{'title': 'flat', 'properties': {'a': {'type': 'string'}}}"));

            assertThatThrownBy(() -> analyzer.extractContainerFieldName(model))
                    .isInstanceOf(SchemaMissingException.class)
                    .hasMessageContaining("flat");
        }

        @Test
        @DisplayName("falls back to the cached schema")
        void cachedFallback() {
            SchemaCache cache = new SchemaCache();
            cache.put("bike_store", bikeStore);

            assertThat(analyzer.extractContainerFieldName(null, "bike_store", cache)).isEqualTo("stores");
        }

        @Test
        @DisplayName("no schema and nothing cached fails")
        void nothingCached() {
            assertThatThrownBy(() -> analyzer.extractContainerFieldName(null, "bike_store", new SchemaCache()))
                    .isInstanceOf(SchemaMissingException.class)
                    .hasMessageContaining("bike_store");
        }
    }

    // ==================== Array Field Patterns ====================

    @Nested
    @DisplayName("array field patterns")
    class ArrayFieldPatterns {

        @Test
        @DisplayName("every array property across root and definitions")
        void allArrays() {
            assertThat(analyzer.extractArrayFieldPatterns(bikeStore))
                    .containsExactly("stores", "bike_sales", "laptop_sales");
        }

        @Test
        @DisplayName("duplicates are listed once")
        void deduplicated() {
            SchemaModel model = SchemaModel.parse(json(
                    "{'properties': {'items': {'type': 'array', 'items': {'$ref': '#/$defs/A'}}},"
                            + " '$defs': {'A': {'type': 'object', 'properties': {'items': {'type': 'array', 'items': {}}}}}}"));

            assertThat(analyzer.extractArrayFieldPatterns(model)).containsExactly("items");
        }

        @Test
        @DisplayName("arrays inside inline objects and inline array items are found")
        void inlineArrays() {
            SchemaModel model = SchemaModel.parse(json(
                    "{'properties': {'rows': {'type': 'array', 'items': {'type': 'object', 'properties': {"
                            + "'parts': {'type': 'array', 'items': {'type': 'string'}},"
                            + "'meta': {'type': 'object', 'properties': {'tags': {'type': 'array', 'items': {}}}}}}}}}"));

            assertThat(analyzer.extractArrayFieldPatterns(model)).containsExactly("rows", "parts", "tags");
        }

        @Test
        @DisplayName("arrays behind union branches and self-referencing definitions are found once")
        void throughReferences() {
            SchemaModel model = SchemaModel.parse(json(
                    "{'properties': {'nodes': {'type': 'array', 'items': {'$ref': '#/$defs/Node'}}},"
                            + " '$defs': {"
                            + "'Node': {'type': 'object', 'properties': {"
                            + "'children': {'type': 'array', 'items': {'$ref': '#/$defs/Node'}},"
                            + "'payload': {'anyOf': [{'$ref': '#/$defs/Leaf'}, {'$ref': '#/$defs/Branch'}]}}},"
                            + "'Leaf': {'type': 'object', 'properties': {'values': {'type': 'array', 'items': {}}}},"
                            + "'Branch': {'type': 'object', 'properties': {'weights': {'type': 'array', 'items': {}}}}}}"));

            assertThat(analyzer.extractArrayFieldPatterns(model))
                    .containsExactly("nodes", "children", "values", "weights");
        }

        @Test
        @DisplayName("no schema yields the configured defaults")
        void defaultsWithoutSchema() {
            assertThat(analyzer.extractArrayFieldPatterns(null)).containsExactly("bike_sales", "laptop_sales");
        }

        @Test
        @DisplayName("schema without arrays yields the configured defaults")
        void defaultsWithoutArrays() {
            SchemaAnalyzer custom = new SchemaAnalyzer(TranscoderConfig.builder()
                    .defaultArrayFieldPatterns(List.of("orders"))
                    .build());
            SchemaModel model = SchemaModel.parse(json("{'properties': {'a': {'type': 'string'}}}"));

            assertThat(custom.extractArrayFieldPatterns(model)).containsExactly("orders");
        }
    }

    // ==================== Field Hierarchy ====================

    @Nested
    @DisplayName("field hierarchy")
    class Hierarchy {

        @Test
        @DisplayName("one entry per reachable array, parents first")
        void entries() {
            FieldHierarchy hierarchy = analyzer.extractFieldHierarchy(bikeStore);

            assertThat(hierarchy.getEntries().keySet())
                    .containsExactly("stores", "stores_bike_sales", "stores_laptop_sales");
            assertThat(hierarchy.get("stores_bike_sales").orElseThrow().parentPath()).isEqualTo("stores");
            assertThat(hierarchy.get("stores").orElseThrow().isNested()).isFalse();
        }

        @Test
        @DisplayName("container item properties are classified")
        void containerItem() {
            ArrayItemStructure stores = analyzer.extractFieldHierarchy(bikeStore).get("stores").orElseThrow();

            assertThat(stores.arrayField()).isEqualTo("stores");
            assertThat(stores.directFields()).containsExactly("name");
            assertThat(stores.arrayFields()).containsExactly("bike_sales", "laptop_sales");
            assertThat(stores.nestedObjects().get("address"))
                    .isEqualTo(new NestedStructure.ReferenceFields("RootModel_Address", List.of("city", "zip")));
            assertThat(stores.nestedObjects().get("manager"))
                    .isEqualTo(new NestedStructure.SimpleList(List.of("first", "last"), List.of()));
        }

        @Test
        @DisplayName("union-bearing nested array records union members and branches")
        void unionBearingNestedArray() {
            ArrayItemStructure stores = analyzer.extractFieldHierarchy(bikeStore).get("stores").orElseThrow();

            NestedStructure.NestedArrayFields bikeSales =
                    (NestedStructure.NestedArrayFields) stores.nestedObjects().get("bike_sales");
            assertThat(bikeSales.isUnionBearing()).isTrue();
            assertThat(bikeSales.directFields()).containsExactly("quantity");
            assertThat(bikeSales.unionFields())
                    .containsExactly(Map.entry("bike", List.of("price", "suspension", "weight")));
            assertThat(bikeSales.unionBranches().get("bike"))
                    .containsExactly("RootModel_MountainBike", "RootModel_RoadBike");

            NestedStructure.NestedArrayFields laptopSales =
                    (NestedStructure.NestedArrayFields) stores.nestedObjects().get("laptop_sales");
            assertThat(laptopSales.isUnionBearing()).isFalse();
            assertThat(laptopSales.directFields()).containsExactly("model", "units");
        }

        @Test
        @DisplayName("item-level union becomes a simple list with branches")
        void itemLevelUnion() {
            ArrayItemStructure bikeSales = analyzer.extractFieldHierarchy(bikeStore)
                    .get("stores_bike_sales").orElseThrow();

            assertThat(bikeSales.nestedObjects().get("bike")).isEqualTo(new NestedStructure.SimpleList(
                    List.of("price", "suspension", "weight"),
                    List.of("RootModel_MountainBike", "RootModel_RoadBike")));
        }

        @Test
        @DisplayName("union field names and branch definitions are collected")
        void unionNames() {
            FieldHierarchy hierarchy = analyzer.extractFieldHierarchy(bikeStore);

            assertThat(hierarchy.unionFieldNames()).containsExactly("bike");
            assertThat(hierarchy.branchDefinitions())
                    .containsExactly("RootModel_MountainBike", "RootModel_RoadBike");
        }

        @Test
        @DisplayName("recursive definitions terminate")
        void recursiveDefinitions() {
            SchemaModel model = SchemaModel.parse(json(
                    "{'properties': {'nodes': {'type': 'array', 'items': {'$ref': '#/$defs/Node'}}},"
                            + " '$defs': {'Node': {'type': 'object', 'properties': {"
                            + "   'label': {'type': 'string'},"
                            + "   'children': {'type': 'array', 'items': {'$ref': '#/$defs/Node'}}}}}}"));

            FieldHierarchy hierarchy = analyzer.extractFieldHierarchy(model);

            assertThat(hierarchy.getEntries().keySet()).containsExactly("nodes", "nodes_children");
            assertThat(hierarchy.get("nodes").orElseThrow().arrayFields()).containsExactly("children");
            assertThat(hierarchy.get("nodes_children").orElseThrow().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("unresolved reference degrades to an empty structure")
        void unresolvedReference() {
            SchemaModel model = SchemaModel.parse(json(
                    "{'properties': {'rows': {'type': 'array', 'items': {'$ref': '#/$defs/Row'}},"
                            + " 'ghosts': {'type': 'array', 'items': {'$ref': '#/$defs/Ghost'}}},"
                            + " '$defs': {'Row': {'type': 'object', 'properties': {"
                            + "   'id': {'type': 'string'},"
                            + "   'owner': {'$ref': '#/$defs/Missing'}}}}}"));
            Diagnostics diagnostics = new Diagnostics();

            FieldHierarchy hierarchy = analyzer.extractFieldHierarchy(model, diagnostics);

            assertThat(hierarchy.get("rows").orElseThrow().nestedObjects().get("owner"))
                    .isEqualTo(new NestedStructure.ReferenceFields("Missing", List.of()));
            assertThat(hierarchy.get("rows").orElseThrow().directFields()).containsExactly("id");
            assertThat(hierarchy.get("ghosts").orElseThrow().isEmpty()).isTrue();
            assertThat(diagnostics.getEntries(Diagnostics.Kind.UNRESOLVED_REFERENCE)).hasSize(2);
        }

        @Test
        @DisplayName("no schema yields an empty hierarchy")
        void noSchema() {
            assertThat(analyzer.extractFieldHierarchy(null).isEmpty()).isTrue();
        }
    }
}
