package io.github.formtranscoder;

import io.github.formtranscoder.schema.SchemaModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static io.github.formtranscoder.SchemaFixtures.json;
import static org.assertj.core.api.Assertions.*;

class SchemaInfoTest {

    private final TranscoderConfig config = TranscoderConfig.defaults();

    @Test
    @DisplayName("derives container, prefixes, patterns and discriminators")
    void derived() {
        SchemaInfo info = SchemaFixtures.bikeStoreInfo(config);

        assertThat(info.containerName()).isEqualTo("stores");
        assertThat(info.arrayFieldPatterns()).containsExactly("stores", "bike_sales", "laptop_sales");
        assertThat(info.patterns()).hasSize(18);
        assertThat(info.isLegacyMode()).isFalse();
        assertThat(info.discriminatorFields()).containsExactlyInAnyOrder("bike");
        assertThat(info.branchNames().resolve("roadbike")).isEqualTo("RoadBike");
        assertThat(info.branchNames().resolve("rootmodel_electricbike")).isEqualTo("ElectricBike");
    }

    @Test
    @DisplayName("union field names count as discriminators")
    void unionFieldsAreDiscriminators() {
        SchemaModel model = SchemaModel.parse(json(
                "{'properties': {'rides': {'type': 'array', 'items': {'$ref': '#/$defs/Ride'}}},"
                        + " '$defs': {'Ride': {'type': 'object', 'properties': {"
                        + "   'vehicle': {'anyOf': [{'$ref': '#/$defs/M_Car'}, {'$ref': '#/$defs/M_Van'}]}}},"
                        + " 'M_Car': {'type': 'object', 'properties': {'seats': {'type': 'integer'}}},"
                        + " 'M_Van': {'type': 'object', 'properties': {'load': {'type': 'integer'}}}}}"));

        SchemaInfo info = SchemaInfo.from(model, config);

        assertThat(info.discriminatorFields()).containsExactlyInAnyOrder("bike", "vehicle");
        assertThat(info.branchNames().resolve("van")).isEqualTo("Van");
    }

    @Test
    @DisplayName("pattern failure falls back to legacy mode with a diagnostic")
    void patternFailure() {
        SchemaModel model = SchemaModel.parse(json(
                "{'properties': {'rows': {'type': 'array', 'items': {'type': 'object', 'properties': {"
                        + "   'meta': {'type': 'object', 'properties': {'': {'type': 'string'}}}}}}}}"));
        Diagnostics diagnostics = new Diagnostics();

        SchemaInfo info = SchemaInfo.from(model, config, diagnostics);

        assertThat(info.isLegacyMode()).isTrue();
        assertThat(info.containerName()).isEqualTo("rows");
        assertThat(diagnostics.getEntries(Diagnostics.Kind.PATTERN_GENERATION_FAILURE))
                .singleElement()
                .satisfies(d -> assertThat(d.key()).isEqualTo("rows"));
    }

    @Test
    @DisplayName("schema without a root array is missing")
    void noRootArray() {
        SchemaModel model = SchemaModel.parse(json("{'properties': {'a': {'type': 'string'}}}"));

        assertThatThrownBy(() -> SchemaInfo.from(model, config)).isInstanceOf(SchemaMissingException.class);
    }
}
